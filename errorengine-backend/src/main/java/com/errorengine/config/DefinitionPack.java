package com.errorengine.config;

import com.errorengine.model.DataSourceDefinition;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.RoutingRule;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of one definition YAML file. Queries reference their data source and channels by name.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DefinitionPack {
    private List<DataSourceDefinition> dataSources = new ArrayList<>();
    private List<NotificationChannel> channels = new ArrayList<>();
    private List<QueryEntry> queries = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class QueryEntry {
        /** Name of a data source declared in this or an earlier pack. */
        private String dataSource;
        private List<String> channels = new ArrayList<>();
        private MonitoredQuery query;
        /** Replaces the query's rules when present; absent keeps the stored rules. */
        private List<RoutingRule> rules;
    }
}
