package es.gestorfiscal.common.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AmountUtilsTest {

    private static void assertAmount(String expected, BigDecimal actual) {
        assertNotNull(actual);
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    void parseAmount_ShouldHandleNull() {
        assertNull(AmountUtils.parseAmount(null));
        assertNull(AmountUtils.parseAmount("sin importe"));
    }

    @Test
    void parseAmount_ShouldHandleNumbers() {
        assertAmount("10.5", AmountUtils.parseAmount(10.5));
        assertAmount("100", AmountUtils.parseAmount(100));
    }

    @Test
    void parseAmount_ShouldHandleSpanishAndEnglishSeparators() {
        assertAmount("1234.56", AmountUtils.parseAmount("1.234,56"));
        assertAmount("1234.56", AmountUtils.parseAmount("1,234.56"));
        assertAmount("10.50", AmountUtils.parseAmount("10,50"));
        assertAmount("-35.20", AmountUtils.parseAmount("-35,20"));
    }

    @Test
    void parseAmount_ShouldHandleCurrencySymbolsAndWhitespace() {
        assertAmount("50.00", AmountUtils.parseAmount(" 50,00 € "));
        assertAmount("1000", AmountUtils.parseAmount("1 000"));
        assertAmount("21", AmountUtils.parseAmount("21%"));
    }

    @Test
    void toDecimal_ShouldTreatNonFiniteValuesAsZero() {
        assertNull(AmountUtils.toDecimal(null));
        assertAmount("0", AmountUtils.toDecimal(Double.NaN));
        assertAmount("0", AmountUtils.toDecimal(Double.POSITIVE_INFINITY));
        assertAmount("0", AmountUtils.toDecimal("NaN"));
        assertAmount("12.345", AmountUtils.toDecimal("12.345"));
        assertAmount("7", AmountUtils.toDecimal(7L));
    }

    @Test
    void percentOf_ShouldNotRound() {
        assertAmount("210", AmountUtils.percentOf(new BigDecimal("1000"), new BigDecimal("21")));
        assertAmount("0.2121", AmountUtils.percentOf(new BigDecimal("1.01"), new BigDecimal("21")));
        assertAmount("0", AmountUtils.percentOf(null, new BigDecimal("21")));
    }

    @Test
    void add_ShouldTreatNullAsZero() {
        assertAmount("5", AmountUtils.add(null, new BigDecimal("5")));
        assertAmount("0", AmountUtils.add(null, null));
    }

    @Test
    void formatCurrency_ShouldUseSpanishFormat() {
        assertEquals("1.234,56 €", AmountUtils.formatCurrency(new BigDecimal("1234.555")));
        assertEquals("0,00 €", AmountUtils.formatCurrency(null));
    }
}
