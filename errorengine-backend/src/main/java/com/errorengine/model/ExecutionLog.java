package com.errorengine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionLog {
    private Long id;
    private Long queryId;
    private Instant executedAt;
    private ExecutionStatus status;
    private int rowsReturned;
    private int newErrors;
    private int resolvedErrors;
    private int remindersSent;
    private int notificationsSent;
    private long durationMs;
    private String message;
}
