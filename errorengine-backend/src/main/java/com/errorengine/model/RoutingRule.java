package com.errorengine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A conditional routing rule. Rules are evaluated by ascending priority; a rule without
 * conditions matches every error.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RoutingRule {
    private Long id;
    private Long queryId;
    @NotBlank
    private String name;
    @Min(0)
    @Max(1000)
    private int priority;
    @Builder.Default
    private ConditionLogic logic = ConditionLogic.AND;
    @Valid
    @Builder.Default
    private List<RoutingCondition> conditions = new ArrayList<>();
    @Builder.Default
    private List<String> recipients = new ArrayList<>();
    @Builder.Default
    private boolean active = true;
    private boolean stopOnMatch;
}
