package com.errorengine.monitor;

import com.errorengine.model.ExecutionStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one {@code maybeRun}/{@code runNow} call.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionResult {
    long queryId;
    ExecutionStatus status;
    Instant startedAt;
    int rowsReturned;
    int newErrors;
    int resolvedErrors;
    int remindersSent;
    int notificationsSent;
    long durationMs;
    String message;

    static ExecutionResult skipped(long queryId, Instant at, String reason) {
        return ExecutionResult.builder()
                .queryId(queryId)
                .status(ExecutionStatus.SKIPPED)
                .startedAt(at)
                .message(reason)
                .build();
    }
}
