package com.errorengine.web;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void propagatesIncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "req-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(MDC.get(TraceIdFilter.MDC_TRACE_ID)));

        assertThat(seen.get()).isEqualTo("req-123");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo("req-123");
        assertThat(MDC.get(TraceIdFilter.MDC_TRACE_ID)).isNull();
    }

    @Test
    void generatesIdWhenMissing() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, res) -> { });

        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isNotBlank();
    }

    @Test
    void tagsQueryIdFromPathAndClearsIt() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/queries/42/run");
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, new MockHttpServletResponse(),
                (req, res) -> seen.set(MDC.get(TraceIdFilter.MDC_QUERY_ID)));

        assertThat(seen.get()).isEqualTo("42");
        assertThat(MDC.get(TraceIdFilter.MDC_QUERY_ID)).isNull();
    }

    @Test
    void queryIdParameterIsUsedWhenNumeric() {
        MockHttpServletRequest errors = new MockHttpServletRequest("GET", "/v1/errors");
        errors.setParameter("query_id", "7");
        MockHttpServletRequest bogus = new MockHttpServletRequest("GET", "/v1/errors");
        bogus.setParameter("query_id", "7;drop");

        assertThat(TraceIdFilter.queryIdOf(errors)).isEqualTo("7");
        assertThat(TraceIdFilter.queryIdOf(bogus)).isNull();
        assertThat(TraceIdFilter.queryIdOf(new MockHttpServletRequest("GET", "/v1/queries"))).isNull();
    }
}
