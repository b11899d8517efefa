package es.gestorfiscal.ledger.service;

import es.gestorfiscal.common.exception.GestorFiscalException;
import es.gestorfiscal.common.exception.ValidationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.*;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.*;

/**
 * Reads the first sheet of an Excel file (.xlsx, .xls) or a CSV file into rows keyed by field name.
 *
 * The first row holds the headers. Each header is matched exactly (ignoring case, accents
 * and extra spaces) against a header index built with {@link #headerIndex(Map)}.
 * Unknown headers are ignored, blank rows are skipped.
 *
 * CSV files are read as UTF-8; the delimiter is ';' or ',', whichever the header line uses most.
 */
@Slf4j
@Component
public class SpreadsheetReader {

    @Value("${fiscal.import.max-file-size:10MB}")
    private DataSize maxFileSize = DataSize.ofMegabytes(10);

    /**
     * One data row. Only non-blank cells of known columns are present.
     */
    @Getter
    @RequiredArgsConstructor
    public static class SheetRow {
        private final int rowIndex; // 1-based, as shown by Excel
        private final Map<String, Object> values;

        public Object value(String field) {
            return values.get(field);
        }

        public String text(String field) {
            Object value = values.get(field);
            if (value == null) {
                return null;
            }
            if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
                // numeric invoice numbers and ids
                return String.valueOf(d.longValue());
            }
            String text = value.toString().trim();
            return text.isEmpty() ? null : text;
        }
    }

    public List<SheetRow> read(MultipartFile file, Map<String, String> headerToField) {
        String format = validateFile(file);
        try {
            List<SheetRow> rows = "csv".equals(format)
                    ? readCsv(file, headerToField)
                    : readExcel(file, headerToField);
            log.debug("Read {} data rows from {}", rows.size(), file.getOriginalFilename());
            return rows;
        } catch (IOException e) {
            log.error("Error reading file {}: {}", file.getOriginalFilename(), e.getMessage(), e);
            throw new ValidationException("file", "Failed to read file: " + e.getMessage());
        }
    }

    // ==================== EXCEL ====================

    private List<SheetRow> readExcel(MultipartFile file, Map<String, String> headerToField) throws IOException {
        try (InputStream in = file.getInputStream(); Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new ValidationException("file", "The sheet is empty");
            }

            List<String> headers = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                Object header = getCellValue(headerRow.getCell(c));
                headers.add(header != null ? header.toString() : null);
            }
            Map<Integer, String> columns = mapColumns(headers, headerToField);

            List<SheetRow> rows = new ArrayList<>();
            for (int i = headerRow.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) {
                    continue;
                }
                Map<String, Object> values = new HashMap<>();
                columns.forEach((index, field) -> putIfPresent(values, field, getCellValue(row.getCell(index))));
                if (!isBlank(row)) {
                    rows.add(new SheetRow(i + 1, values));
                }
            }
            return rows;
        }
    }

    private Object getCellValue(Cell cell) {
        if (cell == null) return null;

        return switch (cell.getCellType()) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(cell)) {
                    yield cell.getLocalDateTimeCellValue().toLocalDate();
                }
                yield cell.getNumericCellValue();
            }
            case BOOLEAN -> cell.getBooleanCellValue();
            case FORMULA -> switch (cell.getCachedFormulaResultType()) {
                case NUMERIC -> cell.getNumericCellValue();
                case BOOLEAN -> cell.getBooleanCellValue();
                case STRING -> cell.getStringCellValue();
                default -> null;
            };
            default -> null;
        };
    }

    private boolean isBlank(Row row) {
        for (Cell cell : row) {
            Object value = getCellValue(cell);
            if (value != null && !value.toString().isBlank()) {
                return false;
            }
        }
        return true;
    }

    // ==================== CSV ====================

    private List<SheetRow> readCsv(MultipartFile file, Map<String, String> headerToField) throws IOException {
        String content = new String(file.getBytes(), StandardCharsets.UTF_8);
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(detectDelimiter(content))
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();

        try (CSVParser parser = CSVParser.parse(content, format)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new ValidationException("file", "The file is empty");
            }
            CSVRecord headerRecord = records.next();
            List<String> headers = new ArrayList<>();
            headerRecord.forEach(headers::add);
            Map<Integer, String> columns = mapColumns(headers, headerToField);

            List<SheetRow> rows = new ArrayList<>();
            while (records.hasNext()) {
                CSVRecord record = records.next();
                Map<String, Object> values = new HashMap<>();
                columns.forEach((index, field) -> {
                    if (index < record.size()) {
                        putIfPresent(values, field, record.get(index));
                    }
                });
                if (record.stream().anyMatch(cell -> !cell.isBlank())) {
                    rows.add(new SheetRow((int) record.getRecordNumber(), values));
                }
            }
            return rows;
        }
    }

    static char detectDelimiter(String content) {
        int end = content.indexOf('\n');
        String firstLine = end >= 0 ? content.substring(0, end) : content;
        long semicolons = firstLine.chars().filter(ch -> ch == ';').count();
        long commas = firstLine.chars().filter(ch -> ch == ',').count();
        return semicolons >= commas && semicolons > 0 ? ';' : ',';
    }

    // ==================== HEADERS ====================

    /**
     * Index from normalized alias to field name.
     *
     * @throws GestorFiscalException when one alias is given to two fields
     */
    public static Map<String, String> headerIndex(Map<String, List<String>> aliases) {
        Map<String, String> index = new HashMap<>();
        aliases.forEach((field, names) -> names.forEach(alias -> {
            String previous = index.put(normalizeHeader(alias), field);
            if (previous != null && !previous.equals(field)) {
                throw new GestorFiscalException("Column alias '" + alias + "' mapped to " + previous + " and " + field);
            }
        }));
        return Map.copyOf(index);
    }

    public static String normalizeHeader(String header) {
        String stripped = Normalizer.normalize(header, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return stripped.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private Map<Integer, String> mapColumns(List<String> headers, Map<String, String> headerToField) {
        Map<Integer, String> columns = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header == null) {
                continue;
            }
            String field = headerToField.get(normalizeHeader(header));
            if (field != null && seen.add(field)) {
                columns.put(i, field);
            }
        }
        log.debug("Mapped columns: {}", columns);
        if (columns.isEmpty()) {
            throw new ValidationException("file", "No known column headers found in the first row");
        }
        return columns;
    }

    private static void putIfPresent(Map<String, Object> values, String field, Object value) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            return;
        }
        values.put(field, value instanceof String str ? str.trim() : value);
    }

    private String validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("file", "File is required");
        }

        if (file.getSize() > maxFileSize.toBytes()) {
            throw new ValidationException("file", "File size exceeds maximum (" + maxFileSize.toMegabytes() + "MB)");
        }

        String filename = file.getOriginalFilename();
        String lower = filename != null ? filename.toLowerCase(Locale.ROOT) : "";
        if (lower.endsWith(".csv")) {
            return "csv";
        }
        if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
            return "excel";
        }
        throw new ValidationException("file", "File must be an Excel (.xlsx, .xls) or CSV file");
    }
}
