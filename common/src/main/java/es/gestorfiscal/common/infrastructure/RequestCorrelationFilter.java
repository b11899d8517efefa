package es.gestorfiscal.common.infrastructure;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an X-Request-Id (taken from the caller or generated)
 * and exposes it to the log pattern through MDC.
 *
 * Health checks are logged at debug level only.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "requestId";

    private static final String ACTUATOR_PREFIX = "/actuator";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws IOException, ServletException {
        String requestId = resolveRequestId(request);
        long started = System.currentTimeMillis();

        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsed = System.currentTimeMillis() - started;
            String uri = request.getRequestURI();
            if (uri != null && uri.startsWith(ACTUATOR_PREFIX)) {
                log.debug("{} {} -> {} ({}ms)", request.getMethod(), uri, response.getStatus(), elapsed);
            } else {
                String qs = request.getQueryString();
                log.info("{} {} -> {} ({}ms)", request.getMethod(),
                        qs != null ? uri + "?" + qs : uri, response.getStatus(), elapsed);
            }
            MDC.remove(MDC_KEY);
        }
    }

    static String resolveRequestId(HttpServletRequest request) {
        String incoming = request.getHeader(HEADER);
        if (incoming == null || incoming.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return incoming.trim();
    }
}
