package com.errorengine.monitor;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.time.Instant;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NextScheduledRun {
    long queryId;
    String queryName;
    Instant runAt;
    long secondsRemaining;
}
