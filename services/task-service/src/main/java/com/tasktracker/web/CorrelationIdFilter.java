package com.tasktracker.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID is taken from {@code X-Correlation-ID} when the client sends one made of letters,
 * digits, {@code . _ : -} and at most 64 characters, otherwise a random UUID. It is put in the SLF4J MDC under {@value #MDC_KEY} (printed by the log
 * pattern), echoed on the response, and returned as {@code traceId} in error bodies.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE}, ahead of the security chain, so 401
 * responses carry it too.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String MDC_KEY = "correlationId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    /**
     * @return the correlation ID of the request on the current thread, or null outside a request
     */
    public static String currentCorrelationId() {
        return MDC.get(MDC_KEY);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        // the ID lands in every log line through the MDC
        if (correlationId == null || !ACCEPTED_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString();
        }

        MDC.put(MDC_KEY, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            MDC.remove(MDC_KEY);
        }
    }
}
