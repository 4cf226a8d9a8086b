package com.errorengine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A user-defined query executed on a schedule. Every row it returns is an active error, identified
 * by the values of {@link #keyFields}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MonitoredQuery {
    private Long id;
    @NotBlank
    private String name;
    private String description;
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @NotNull
    @Builder.Default
    private SourceType sourceType = SourceType.DATABASE;
    private Long dataSourceId;
    private String queryText;
    /** HTTP source settings: url, method, headers, body, response_path, auth_type, ... */
    @Builder.Default
    private Map<String, Object> sourceConfig = new LinkedHashMap<>();
    private Integer timeoutSeconds;

    @NotEmpty
    @Builder.Default
    private List<String> keyFields = new ArrayList<>();

    @Min(1)
    @Max(1440)
    @Builder.Default
    private int intervalMinutes = 15;
    @Builder.Default
    private Set<DayOfWeek> activeDays = EnumSet.allOf(DayOfWeek.class);
    private LocalTime windowStart;
    private LocalTime windowEnd;
    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private List<String> recipients = new ArrayList<>();
    @Builder.Default
    private boolean routingEnabled = true;
    @Builder.Default
    private List<String> defaultRecipients = new ArrayList<>();
    @Builder.Default
    private NoMatchAction noMatchAction = NoMatchAction.SEND_DEFAULT;
    @Builder.Default
    private AggregationMode aggregation = AggregationMode.PER_RECIPIENT;
    private int reminderIntervalMinutes;
    @Builder.Default
    private int reminderMaxCount = 5;
    @Builder.Default
    private List<Long> channelIds = new ArrayList<>();

    private Instant lastCheckAt;
    private Instant lockedAt;
    private Instant lastErrorAt;
    private long totalErrorsFound;
    private long totalNotificationsSent;

    /**
     * @return true when a daily time window restricts execution
     */
    public boolean hasTimeWindow() {
        return windowStart != null && windowEnd != null;
    }
}
