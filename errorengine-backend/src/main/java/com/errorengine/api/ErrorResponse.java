package com.errorengine.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Error body of every failed API call. {@code queryId} is present when the request addressed a
 * monitored query; {@code sourceErrorKind} when a fetch against the query's source failed.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String code;
    private String message;
    private String details;
    private Long queryId;
    private String sourceErrorKind;
    private String traceId;
}
