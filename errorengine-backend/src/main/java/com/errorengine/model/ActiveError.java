package com.errorengine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One logical error of a monitored query, tracked across executions by its key signature.
 *
 * <p>Within a query at most one unresolved error exists per signature. Resolved errors are kept
 * until retention removes them and are never revived: a signature that reappears after resolution
 * starts a new error.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ActiveError {
    private Long id;
    private Long queryId;
    private KeySignature signature;
    @Builder.Default
    private Map<String, Object> row = new LinkedHashMap<>();
    private Instant firstSeenAt;
    private Instant lastSeenAt;
    private int occurrenceCount;
    private boolean resolved;
    private Instant resolvedAt;
    private boolean notified;
    private Instant lastNotifiedAt;
    private int reminderCount;

    /**
     * @return a copy whose row map can be modified independently
     */
    public ActiveError copy() {
        return toBuilder().row(row != null ? new LinkedHashMap<>(row) : new LinkedHashMap<>()).build();
    }
}
