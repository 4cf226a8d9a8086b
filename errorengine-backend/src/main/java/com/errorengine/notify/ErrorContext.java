package com.errorengine.notify;

import com.errorengine.model.ActiveError;
import com.errorengine.model.KeySignature;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a notification says about one error.
 */
@Value
@Builder
public class ErrorContext {
    Long errorId;
    KeySignature signature;
    Map<String, Object> row;
    Instant firstSeenAt;
    Instant lastSeenAt;
    int occurrenceCount;
    int reminderCount;

    public static ErrorContext of(ActiveError error) {
        Map<String, Object> row = error.getRow() != null ? new LinkedHashMap<>(error.getRow()) : new LinkedHashMap<>();
        return ErrorContext.builder()
                .errorId(error.getId())
                .signature(error.getSignature())
                .row(Collections.unmodifiableMap(row))
                .firstSeenAt(error.getFirstSeenAt())
                .lastSeenAt(error.getLastSeenAt())
                .occurrenceCount(error.getOccurrenceCount())
                .reminderCount(error.getReminderCount())
                .build();
    }
}
