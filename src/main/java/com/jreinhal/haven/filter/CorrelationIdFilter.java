package com.jreinhal.haven.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Request tracing for logs and the audit trail.
 *
 * The correlation id and the caller's address are held in the MDC for the whole request.
 * {@link com.jreinhal.haven.service.AuditService} stamps both onto every entry it writes,
 * and error bodies echo the correlation id so a report from the field can be traced.
 */
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {
    public static final String HEADER_NAME = "X-Correlation-Id";
    public static final String MDC_KEY = "correlationId";
    public static final String CLIENT_IP_KEY = "clientIp";
    private static final Pattern ACCEPTED_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,64}$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String traceId = traceIdFor(request.getHeader(HEADER_NAME));
        response.setHeader(HEADER_NAME, traceId);
        MDC.put(MDC_KEY, traceId);
        if (request.getRemoteAddr() != null) {
            MDC.put(CLIENT_IP_KEY, request.getRemoteAddr());
        }
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(CLIENT_IP_KEY);
        }
    }

    /** Correlation id of the request on this thread, or null outside a request. */
    public static String currentCorrelationId() {
        return MDC.get(MDC_KEY);
    }

    public static String currentClientIp() {
        return MDC.get(CLIENT_IP_KEY);
    }

    // Header values reach log lines, so anything outside the accepted alphabet is replaced.
    static String traceIdFor(String supplied) {
        if (supplied != null && ACCEPTED_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }
}
