package com.errorengine.controller;

import com.errorengine.config.ConfigurationException;
import com.errorengine.config.MonitorConfigService;
import com.errorengine.model.ActiveError;
import com.errorengine.model.ExecutionStatus;
import com.errorengine.model.KeySignature;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.monitor.ErrorNotFoundException;
import com.errorengine.monitor.ExecutionResult;
import com.errorengine.monitor.MonitorOrchestrator;
import com.errorengine.monitor.NextScheduledRun;
import com.errorengine.monitor.QueryNotFoundException;
import com.errorengine.source.SourceErrorKind;
import com.errorengine.source.SourceException;
import com.errorengine.web.GlobalExceptionHandler;
import com.errorengine.web.TraceIdFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MonitorControllerTest {

    private final MonitorOrchestrator orchestrator = mock(MonitorOrchestrator.class);
    private final MonitorConfigService configService = mock(MonitorConfigService.class);
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new MonitorController(orchestrator, configService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(new TraceIdFilter())
                .build();
    }

    @Test
    void runNowReturnsResult() throws Exception {
        when(orchestrator.runNow(7L)).thenReturn(ExecutionResult.builder()
                .queryId(7L).status(ExecutionStatus.SKIPPED).message("already running").build());

        mvc.perform(post("/v1/queries/7/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query_id").value(7))
                .andExpect(jsonPath("$.status").value("SKIPPED"))
                .andExpect(jsonPath("$.message").value("already running"));
    }

    @Test
    void unknownQueryIs404() throws Exception {
        when(orchestrator.runNow(9L)).thenThrow(new QueryNotFoundException(9L));

        mvc.perform(post("/v1/queries/9/run"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.query_id").value(9))
                .andExpect(jsonPath("$.source_error_kind").doesNotExist());
    }

    @Test
    void resolveReturnsResolvedError() throws Exception {
        when(orchestrator.resolveManually(3L)).thenReturn(ActiveError.builder()
                .id(3L).queryId(1L).signature(KeySignature.of("42")).resolved(true).build());
        when(orchestrator.resolveManually(4L)).thenThrow(new ErrorNotFoundException(4L));

        mvc.perform(post("/v1/errors/3/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.resolved").value(true));
        mvc.perform(post("/v1/errors/4/resolve"))
                .andExpect(status().isNotFound());
    }

    @Test
    void activeErrorsFilterByQuery() throws Exception {
        when(orchestrator.listActiveErrors(5L)).thenReturn(List.of(
                ActiveError.builder().id(1L).queryId(5L).signature(KeySignature.of("A")).occurrenceCount(2).build()));

        mvc.perform(get("/v1/errors").param("query_id", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].occurrence_count").value(2));
        verify(orchestrator).listActiveErrors(5L);
    }

    @Test
    void nextRunIsNoContentWhenNothingScheduled() throws Exception {
        when(orchestrator.getNextScheduledRun()).thenReturn(Optional.empty());
        mvc.perform(get("/v1/schedule/next")).andExpect(status().isNoContent());

        when(orchestrator.getNextScheduledRun()).thenReturn(Optional.of(
                new NextScheduledRun(2L, "Late invoices", Instant.parse("2024-03-04T10:05:00Z"), 180)));
        mvc.perform(get("/v1/schedule/next"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query_id").value(2))
                .andExpect(jsonPath("$.seconds_remaining").value(180));
    }

    @Test
    void invalidDefinitionIs400WithField() throws Exception {
        when(configService.saveQuery(any())).thenThrow(new ConfigurationException("interval_minutes", "bad interval"));

        mvc.perform(put("/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Blocked orders\",\"source_type\":\"DATABASE\",\"key_fields\":[\"ORDER_ID\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_DEFINITION"))
                .andExpect(jsonPath("$.details").value("interval_minutes"));
    }

    @Test
    void beanValidationRejectsMissingName() throws Exception {
        mvc.perform(put("/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key_fields\":[\"ORDER_ID\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
        verify(configService, never()).saveQuery(any());
    }

    @Test
    void malformedBodyIs400() throws Exception {
        mvc.perform(put("/v1/queries").contentType(MediaType.APPLICATION_JSON).content("{oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void savedQueryIsEchoed() throws Exception {
        when(configService.saveQuery(any())).thenAnswer(inv -> ((MonitoredQuery) inv.getArgument(0)).toBuilder().id(11L).build());

        mvc.perform(put("/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Blocked orders\",\"key_fields\":[\"ORDER_ID\"],\"interval_minutes\":10}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(11))
                .andExpect(jsonPath("$.interval_minutes").value(10));
    }

    @Test
    void sourceFailureOnFieldsIs502() throws Exception {
        when(orchestrator.availableFields(eq(1L))).thenThrow(new SourceException(SourceErrorKind.TIMEOUT, "too slow"));

        mvc.perform(get("/v1/queries/1/fields").header("X-Request-Id", "req-42"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("SOURCE_TIMEOUT"))
                .andExpect(jsonPath("$.source_error_kind").value("TIMEOUT"))
                .andExpect(jsonPath("$.query_id").value(1))
                .andExpect(jsonPath("$.trace_id").value("req-42"));
    }

    @Test
    void logsLimitIsPassedThrough() throws Exception {
        when(orchestrator.executionLogs(1L, 10)).thenReturn(List.of());

        mvc.perform(get("/v1/queries/1/logs").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
        verify(orchestrator).executionLogs(1L, 10);
    }
}
