package com.example.studydesign.filter;

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
import java.util.regex.Pattern;

/**
 * Puts the request's correlation id into the MDC and echoes it in the response.
 *
 * Taken from {@code X-Request-ID} (or {@code X-Correlation-ID}) when it is a safe token, generated
 * otherwise. Pipeline runs started by the request inherit it through
 * {@link com.example.studydesign.config.MdcTaskDecorator}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
@Slf4j
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Request-ID";
    public static final String ALTERNATE_HEADER = "X-Correlation-ID";
    public static final String MDC_KEY = "correlationId";

    // Ends up verbatim in log lines
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String correlationId = resolve(request);

        MDC.put(MDC_KEY, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat threads are pooled
            MDC.remove(MDC_KEY);
        }
    }

    static String resolve(HttpServletRequest request) {
        String inbound = request.getHeader(CORRELATION_ID_HEADER);
        if (inbound == null || inbound.isBlank()) {
            inbound = request.getHeader(ALTERNATE_HEADER);
        }
        if (inbound != null && SAFE_ID.matcher(inbound.trim()).matches()) {
            return inbound.trim();
        }
        String generated = UUID.randomUUID().toString();
        if (inbound != null && !inbound.isBlank()) {
            log.debug("Replaced unsafe inbound correlation id with {}", generated);
        }
        return generated;
    }
}
