package com.errorengine.config;

import com.errorengine.api.SourceTestResponse;
import com.errorengine.model.DataSourceDefinition;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.RoutingRule;
import com.errorengine.model.SourceType;
import com.errorengine.monitor.QueryNotFoundException;
import com.errorengine.source.JdbcSourceAdapter;
import com.errorengine.source.SourceException;
import com.errorengine.store.MonitorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Validated edits of queries, rules, data sources and channels. Saves without an id upsert by
 * name, so re-applying the same definition updates it instead of creating a duplicate.
 */
@Service
public class MonitorConfigService {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfigService.class);

    private final MonitorStore store;
    private final DefinitionValidator validator;
    private final JdbcSourceAdapter jdbcSourceAdapter;

    public MonitorConfigService(MonitorStore store, DefinitionValidator validator, JdbcSourceAdapter jdbcSourceAdapter) {
        this.store = store;
        this.validator = validator;
        this.jdbcSourceAdapter = jdbcSourceAdapter;
    }

    public List<MonitoredQuery> listQueries() {
        return store.findAllQueries();
    }

    public MonitoredQuery saveQuery(MonitoredQuery query) {
        validator.validateQuery(query);
        if (query.getSourceType() == SourceType.DATABASE && store.findDataSource(query.getDataSourceId()).isEmpty()) {
            throw new ConfigurationException("data_source_id", "data source not found: " + query.getDataSourceId());
        }
        if (query.getChannelIds() != null) {
            for (Long channelId : query.getChannelIds()) {
                if (channelId == null || store.findChannel(channelId).isEmpty()) {
                    throw new ConfigurationException("channel_ids", "channel not found: " + channelId);
                }
            }
        }

        MonitoredQuery toSave = query.toBuilder().name(query.getName().trim()).build();
        Optional<MonitoredQuery> sameName = store.findQueryByName(toSave.getName());
        if (toSave.getId() == null) {
            sameName.ifPresent(existing -> toSave.setId(existing.getId()));
        } else {
            store.findQuery(toSave.getId()).orElseThrow(() -> new QueryNotFoundException(toSave.getId()));
            if (sameName.isPresent() && !sameName.get().getId().equals(toSave.getId())) {
                throw new ConfigurationException("name", "another query is named " + toSave.getName());
            }
        }
        MonitoredQuery saved = store.saveQuery(toSave);
        log.info("Query saved: query_id={}, name={}, source_type={}", saved.getId(), saved.getName(), saved.getSourceType());
        return saved;
    }

    public List<RoutingRule> getRules(long queryId) {
        store.findQuery(queryId).orElseThrow(() -> new QueryNotFoundException(queryId));
        return store.findRules(queryId);
    }

    public List<RoutingRule> replaceRules(long queryId, List<RoutingRule> rules) {
        store.findQuery(queryId).orElseThrow(() -> new QueryNotFoundException(queryId));
        validator.validateRules(rules);
        List<RoutingRule> saved = store.replaceRules(queryId, rules == null ? List.of() : rules);
        log.info("Routing rules replaced: query_id={}, count={}", queryId, saved.size());
        return saved;
    }

    public List<DataSourceDefinition> listDataSources() {
        return store.findAllDataSources();
    }

    public DataSourceDefinition saveDataSource(DataSourceDefinition dataSource) {
        validator.validateDataSource(dataSource);
        DataSourceDefinition toSave = dataSource.toBuilder().name(dataSource.getName().trim()).build();
        if (toSave.getId() == null) {
            store.findDataSourceByName(toSave.getName()).ifPresent(existing -> toSave.setId(existing.getId()));
        }
        DataSourceDefinition saved = store.saveDataSource(toSave);
        jdbcSourceAdapter.invalidate(saved.getId());
        log.info("Data source saved: data_source_id={}, name={}, db_type={}", saved.getId(), saved.getName(), saved.getDbType());
        return saved;
    }

    /**
     * Open a throwaway connection to a stored data source.
     *
     * @param id data source id
     * @return outcome; failures are reported in the response, not thrown
     */
    public SourceTestResponse testDataSource(long id) {
        DataSourceDefinition dataSource = store.findDataSource(id)
                .orElseThrow(() -> new ConfigurationException("id", "data source not found: " + id));
        long start = System.nanoTime();
        SourceTestResponse.SourceTestResponseBuilder response = SourceTestResponse.builder()
                .columns(List.of())
                .sampleRows(List.of());
        try {
            jdbcSourceAdapter.testConnection(dataSource);
            response.success(true).message("connection OK");
        } catch (SourceException e) {
            log.warn("Data source test failed: data_source_id={}, kind={}, message={}", id, e.getKind(), e.getMessage());
            response.success(false).message(e.getMessage()).errorKind(e.getKind().name());
        }
        return response.durationMs(Duration.ofNanos(System.nanoTime() - start).toMillis()).build();
    }

    public List<NotificationChannel> listChannels() {
        return store.findAllChannels();
    }

    public NotificationChannel saveChannel(NotificationChannel channel) {
        validator.validateChannel(channel);
        NotificationChannel toSave = channel.toBuilder().name(channel.getName().trim()).build();
        if (toSave.getId() == null) {
            store.findChannelByName(toSave.getName()).ifPresent(existing -> toSave.setId(existing.getId()));
        }
        NotificationChannel saved = store.saveChannel(toSave);
        log.info("Channel saved: channel_id={}, name={}, type={}", saved.getId(), saved.getName(), saved.getType());
        return saved;
    }
}
