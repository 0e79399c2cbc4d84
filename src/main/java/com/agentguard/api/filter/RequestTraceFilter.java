package com.agentguard.api.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Enumeration;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with a trace id and writes one access log line per request.
 *
 * <p>The id is taken from the {@code X-Trace-ID} header when it looks sane, generated
 * otherwise, echoed back on the response and exposed to log patterns as MDC key
 * {@code traceId}. Header values are never logged; only header names, with sensitive ones
 * masked.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTraceFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestTraceFilter.class);

    public static final String TRACE_HEADER = "X-Trace-ID";
    public static final String MDC_KEY = "traceId";

    static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "x-api-key", "cookie", "set-cookie");

    private static final Pattern VALID_TRACE_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_HEADER));
        long start = System.nanoTime();
        MDC.put(MDC_KEY, traceId);
        response.setHeader(TRACE_HEADER, traceId);
        try {
            if (log.isDebugEnabled()) {
                log.debug("Request headers: {}", describeHeaders(request));
            }
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.info(
                    "{} {} -> {} ({} ms)",
                    request.getMethod(),
                    request.getRequestURI(),
                    response.getStatus(),
                    elapsedMs);
            MDC.remove(MDC_KEY);
        }
    }

    static String resolveTraceId(String supplied) {
        if (supplied != null && VALID_TRACE_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }

    static String describeHeaders(HttpServletRequest request) {
        StringBuilder sb = new StringBuilder();
        Enumeration<String> names = request.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(name);
            if (SENSITIVE_HEADERS.contains(name.toLowerCase())) {
                sb.append("=[REDACTED]");
            }
        }
        return sb.toString();
    }
}
