package com.errorengine.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

/**
 * A column available to routing conditions, with a sample value from the last fetch.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FieldInfo {
    String name;
    String type;
    Object sample;
}
