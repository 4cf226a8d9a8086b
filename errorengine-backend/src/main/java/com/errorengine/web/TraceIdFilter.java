package com.errorengine.web;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags the request's log lines. {@code trace_id} comes from {@code X-Request-Id} (or a fresh
 * UUID) and is echoed in the response; {@code query_id} is set when the request addresses a
 * monitored query, by path ({@code /v1/queries/{id}/...}) or by the {@code query_id} parameter.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    static final String TRACE_ID_HEADER = "X-Request-Id";
    static final String MDC_TRACE_ID = "trace_id";
    static final String MDC_QUERY_ID = "query_id";

    private static final Pattern QUERY_PATH = Pattern.compile("/v1/queries/(\\d{1,18})(?:/|$)");
    private static final Pattern NUMERIC = Pattern.compile("\\d{1,18}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (request instanceof HttpServletRequest httpServletRequest) {
            String traceId = httpServletRequest.getHeader(TRACE_ID_HEADER);
            if (traceId == null || traceId.isBlank()) {
                traceId = UUID.randomUUID().toString();
            }
            MDC.put(MDC_TRACE_ID, traceId);

            String queryId = queryIdOf(httpServletRequest);
            if (queryId != null) {
                MDC.put(MDC_QUERY_ID, queryId);
            }

            if (response instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(TRACE_ID_HEADER, traceId);
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_QUERY_ID);
        }
    }

    static String queryIdOf(HttpServletRequest request) {
        Matcher path = QUERY_PATH.matcher(request.getRequestURI() == null ? "" : request.getRequestURI());
        if (path.find()) {
            return path.group(1);
        }
        String param = request.getParameter(MDC_QUERY_ID);
        return param != null && NUMERIC.matcher(param).matches() ? param : null;
    }
}
