package com.errorengine.api;

import com.errorengine.model.ExecutionLog;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.monitor.ExecutionResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryStatusResponse {
    private MonitoredQuery query;
    private boolean running;
    private int activeErrors;
    private int pendingReminders;
    private Instant nextRunAt;
    private ExecutionLog lastExecution;
    /** Last outcome in this process, including schedule skips that are not logged. */
    private ExecutionResult lastOutcome;
}
