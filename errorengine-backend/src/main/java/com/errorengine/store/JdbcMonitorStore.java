package com.errorengine.store;

import com.errorengine.lifecycle.LifecycleDiff;
import com.errorengine.model.ActiveError;
import com.errorengine.model.AggregationMode;
import com.errorengine.model.ChannelType;
import com.errorengine.model.ConditionLogic;
import com.errorengine.model.ConditionOperator;
import com.errorengine.model.DataSourceDefinition;
import com.errorengine.model.ExecutionLog;
import com.errorengine.model.ExecutionStatus;
import com.errorengine.model.KeySignature;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NoMatchAction;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.NotificationKind;
import com.errorengine.model.RoutingCondition;
import com.errorengine.model.RoutingRule;
import com.errorengine.model.SourceType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link MonitorStore} over plain JDBC. The SQL sticks to what both H2 and PostgreSQL accept.
 */
public class JdbcMonitorStore implements MonitorStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcMonitorStore.class);

    private static final String SCHEMA_RESOURCE = "db/schema.sql";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<Long>> LONG_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private static final String QUERY_COLUMNS = """
            name, description, tags_json, source_type, data_source_id, query_text, source_config_json,
            timeout_seconds, key_fields_json, interval_minutes, active_days, window_start, window_end, active,
            recipients_json, routing_enabled, default_recipients_json, no_match_action, aggregation,
            reminder_interval_minutes, reminder_max_count, channel_ids_json""";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcMonitorStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    /**
     * Create missing tables and indexes.
     */
    public void initializeSchema() {
        String script;
        try (InputStream in = JdbcMonitorStore.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new StoreException("Schema resource not found: " + SCHEMA_RESOURCE, null);
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Failed to read schema resource", e);
        }

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) {
                    stmt.execute(sql.trim());
                }
            }
            log.info("State store schema ready");
        } catch (SQLException e) {
            log.error("Error initializing state store schema: {}", e.getMessage(), e);
            throw new StoreException("Failed to initialize schema", e);
        }
    }

    // ---------------------------------------------------------------- queries

    @Override
    public List<MonitoredQuery> findAllQueries() {
        return queryList("SELECT * FROM monitored_queries ORDER BY id", ps -> {
        }, this::mapQuery);
    }

    @Override
    public List<MonitoredQuery> findActiveQueries() {
        return queryList("SELECT * FROM monitored_queries WHERE active = TRUE ORDER BY id", ps -> {
        }, this::mapQuery);
    }

    @Override
    public Optional<MonitoredQuery> findQuery(long id) {
        return queryOne("SELECT * FROM monitored_queries WHERE id = ?", ps -> ps.setLong(1, id), this::mapQuery);
    }

    @Override
    public Optional<MonitoredQuery> findQueryByName(String name) {
        return queryOne("SELECT * FROM monitored_queries WHERE name = ?", ps -> ps.setString(1, name), this::mapQuery);
    }

    @Override
    public MonitoredQuery saveQuery(MonitoredQuery query) {
        if (query.getId() == null) {
            String sql = "INSERT INTO monitored_queries (" + QUERY_COLUMNS + ") VALUES ("
                    + "?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
            long id = insert(sql, ps -> bindQuery(ps, query));
            log.info("Query inserted: id={}, name={}", id, query.getName());
            return findQuery(id).orElseThrow();
        }

        String sql = """
                UPDATE monitored_queries SET
                    name = ?, description = ?, tags_json = ?, source_type = ?, data_source_id = ?, query_text = ?,
                    source_config_json = ?, timeout_seconds = ?, key_fields_json = ?, interval_minutes = ?,
                    active_days = ?, window_start = ?, window_end = ?, active = ?, recipients_json = ?,
                    routing_enabled = ?, default_recipients_json = ?, no_match_action = ?, aggregation = ?,
                    reminder_interval_minutes = ?, reminder_max_count = ?, channel_ids_json = ?
                WHERE id = ?
                """;
        int updated = update(sql, ps -> {
            int next = bindQuery(ps, query);
            ps.setLong(next, query.getId());
        });
        if (updated == 0) {
            throw new StoreException("Query not found: " + query.getId(), null);
        }
        return findQuery(query.getId()).orElseThrow();
    }

    @Override
    public void recordCheck(long queryId, Instant checkedAt, int newErrors, int notificationsSent) {
        if (newErrors > 0) {
            update("""
                    UPDATE monitored_queries SET last_check_at = ?, last_error_at = ?,
                        total_errors_found = total_errors_found + ?, total_notifications_sent = total_notifications_sent + ?
                    WHERE id = ?
                    """, ps -> {
                setInstant(ps, 1, checkedAt);
                setInstant(ps, 2, checkedAt);
                ps.setInt(3, newErrors);
                ps.setInt(4, notificationsSent);
                ps.setLong(5, queryId);
            });
        } else {
            update("""
                    UPDATE monitored_queries SET last_check_at = ?, total_notifications_sent = total_notifications_sent + ?
                    WHERE id = ?
                    """, ps -> {
                setInstant(ps, 1, checkedAt);
                ps.setInt(2, notificationsSent);
                ps.setLong(3, queryId);
            });
        }
    }

    @Override
    public boolean markLocked(long queryId, Instant lockedAt) {
        return update("UPDATE monitored_queries SET locked_at = ? WHERE id = ? AND locked_at IS NULL", ps -> {
            setInstant(ps, 1, lockedAt);
            ps.setLong(2, queryId);
        }) == 1;
    }

    @Override
    public void clearLock(long queryId) {
        update("UPDATE monitored_queries SET locked_at = NULL WHERE id = ?", ps -> ps.setLong(1, queryId));
    }

    @Override
    public int clearAllLocks() {
        return update("UPDATE monitored_queries SET locked_at = NULL WHERE locked_at IS NOT NULL", ps -> {
        });
    }

    // ---------------------------------------------------------------- rules

    @Override
    public List<RoutingRule> findRules(long queryId) {
        try (Connection conn = dataSource.getConnection()) {
            List<RoutingRule> rules = new ArrayList<>();
            Map<Long, RoutingRule> byId = new LinkedHashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT * FROM routing_rules WHERE query_id = ? ORDER BY sort_order, id")) {
                ps.setLong(1, queryId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        RoutingRule rule = mapRule(rs);
                        rules.add(rule);
                        byId.put(rule.getId(), rule);
                    }
                }
            }
            try (PreparedStatement ps = conn.prepareStatement("""
                    SELECT c.* FROM routing_conditions c
                    JOIN routing_rules r ON r.id = c.rule_id
                    WHERE r.query_id = ?
                    ORDER BY c.rule_id, c.sort_order
                    """)) {
                ps.setLong(1, queryId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        RoutingRule rule = byId.get(rs.getLong("rule_id"));
                        if (rule != null) {
                            rule.getConditions().add(mapCondition(rs));
                        }
                    }
                }
            }
            return rules;
        } catch (SQLException e) {
            log.error("Error finding routing rules: query_id={}, {}", queryId, e.getMessage(), e);
            throw new StoreException("Failed to read routing rules", e);
        }
    }

    @Override
    public List<RoutingRule> replaceRules(long queryId, List<RoutingRule> rules) {
        inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM routing_rules WHERE query_id = ?")) {
                ps.setLong(1, queryId);
                ps.executeUpdate();
            }
            int ruleOrder = 0;
            for (RoutingRule rule : rules) {
                long ruleId;
                try (PreparedStatement ps = conn.prepareStatement("""
                        INSERT INTO routing_rules (query_id, sort_order, name, priority, logic, recipients_json, active, stop_on_match)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                        """, Statement.RETURN_GENERATED_KEYS)) {
                    ps.setLong(1, queryId);
                    ps.setInt(2, ruleOrder++);
                    ps.setString(3, rule.getName());
                    ps.setInt(4, rule.getPriority());
                    ps.setString(5, (rule.getLogic() != null ? rule.getLogic() : ConditionLogic.AND).name());
                    ps.setString(6, json(nullToEmpty(rule.getRecipients())));
                    ps.setBoolean(7, rule.isActive());
                    ps.setBoolean(8, rule.isStopOnMatch());
                    ps.executeUpdate();
                    ruleId = generatedId(ps);
                }
                int conditionOrder = 0;
                for (RoutingCondition c : nullToEmpty(rule.getConditions())) {
                    try (PreparedStatement ps = conn.prepareStatement("""
                            INSERT INTO routing_conditions (rule_id, sort_order, field_name, operator_code, condition_value, case_sensitive)
                            VALUES (?, ?, ?, ?, ?, ?)
                            """)) {
                        ps.setLong(1, ruleId);
                        ps.setInt(2, conditionOrder++);
                        ps.setString(3, c.getFieldName());
                        ps.setString(4, c.getOperator().getCode());
                        ps.setString(5, c.getValue());
                        ps.setBoolean(6, c.isCaseSensitive());
                        ps.executeUpdate();
                    }
                }
            }
        }, "replace routing rules");
        log.info("Routing rules replaced: query_id={}, rules={}", queryId, rules.size());
        return findRules(queryId);
    }

    // ---------------------------------------------------------------- data sources and channels

    @Override
    public List<DataSourceDefinition> findAllDataSources() {
        return queryList("SELECT * FROM data_sources ORDER BY id", ps -> {
        }, this::mapDataSource);
    }

    @Override
    public Optional<DataSourceDefinition> findDataSource(long id) {
        return queryOne("SELECT * FROM data_sources WHERE id = ?", ps -> ps.setLong(1, id), this::mapDataSource);
    }

    @Override
    public Optional<DataSourceDefinition> findDataSourceByName(String name) {
        return queryOne("SELECT * FROM data_sources WHERE name = ?", ps -> ps.setString(1, name), this::mapDataSource);
    }

    @Override
    public DataSourceDefinition saveDataSource(DataSourceDefinition ds) {
        SqlBinder binder = ps -> {
            ps.setString(1, ds.getName());
            ps.setString(2, ds.getDbType());
            ps.setString(3, ds.getDsn());
            ps.setBoolean(4, ds.isActive());
            ps.setInt(5, ds.getMaxPoolSize());
        };
        if (ds.getId() == null) {
            long id = insert("INSERT INTO data_sources (name, db_type, dsn, active, max_pool_size) VALUES (?, ?, ?, ?, ?)", binder);
            return findDataSource(id).orElseThrow();
        }
        update("UPDATE data_sources SET name = ?, db_type = ?, dsn = ?, active = ?, max_pool_size = ? WHERE id = ?", ps -> {
            binder.bind(ps);
            ps.setLong(6, ds.getId());
        });
        return findDataSource(ds.getId()).orElseThrow(() -> new StoreException("Data source not found: " + ds.getId(), null));
    }

    @Override
    public List<NotificationChannel> findAllChannels() {
        return queryList("SELECT * FROM notification_channels ORDER BY id", ps -> {
        }, this::mapChannel);
    }

    @Override
    public Optional<NotificationChannel> findChannel(long id) {
        return queryOne("SELECT * FROM notification_channels WHERE id = ?", ps -> ps.setLong(1, id), this::mapChannel);
    }

    @Override
    public Optional<NotificationChannel> findChannelByName(String name) {
        return queryOne("SELECT * FROM notification_channels WHERE name = ?", ps -> ps.setString(1, name), this::mapChannel);
    }

    @Override
    public List<NotificationChannel> findChannels(Collection<Long> ids) {
        List<NotificationChannel> out = new ArrayList<>();
        for (Long id : new LinkedHashSet<>(ids)) {
            findChannel(id).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public NotificationChannel saveChannel(NotificationChannel channel) {
        SqlBinder binder = ps -> {
            ps.setString(1, channel.getName());
            ps.setString(2, channel.getType().name());
            ps.setString(3, json(channel.getConfig() != null ? channel.getConfig() : Map.of()));
            ps.setBoolean(4, channel.isActive());
        };
        if (channel.getId() == null) {
            long id = insert("INSERT INTO notification_channels (name, channel_type, config_json, active) VALUES (?, ?, ?, ?)", binder);
            return findChannel(id).orElseThrow();
        }
        update("UPDATE notification_channels SET name = ?, channel_type = ?, config_json = ?, active = ? WHERE id = ?", ps -> {
            binder.bind(ps);
            ps.setLong(5, channel.getId());
        });
        return findChannel(channel.getId()).orElseThrow(() -> new StoreException("Channel not found: " + channel.getId(), null));
    }

    // ---------------------------------------------------------------- errors

    @Override
    public List<ActiveError> findUnresolvedErrors(long queryId) {
        return queryList("SELECT * FROM active_errors WHERE query_id = ? AND resolved = FALSE ORDER BY id",
                ps -> ps.setLong(1, queryId), this::mapError);
    }

    @Override
    public List<ActiveError> findAllUnresolvedErrors() {
        return queryList("SELECT * FROM active_errors WHERE resolved = FALSE ORDER BY id", ps -> {
        }, this::mapError);
    }

    @Override
    public Optional<ActiveError> findError(long id) {
        return queryOne("SELECT * FROM active_errors WHERE id = ?", ps -> ps.setLong(1, id), this::mapError);
    }

    @Override
    public void applyDiff(long queryId, LifecycleDiff diff) {
        inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO active_errors (query_id, signature_json, row_json, first_seen_at, last_seen_at,
                        occurrence_count, resolved, resolved_at, notified, last_notified_at, reminder_count)
                    VALUES (?, ?, ?, ?, ?, ?, FALSE, NULL, FALSE, NULL, 0)
                    """, Statement.RETURN_GENERATED_KEYS)) {
                for (ActiveError e : diff.getCreated()) {
                    ps.setLong(1, queryId);
                    ps.setString(2, json(e.getSignature().getValues()));
                    ps.setString(3, json(e.getRow()));
                    setInstant(ps, 4, e.getFirstSeenAt());
                    setInstant(ps, 5, e.getLastSeenAt());
                    ps.setInt(6, e.getOccurrenceCount());
                    ps.executeUpdate();
                    e.setId(generatedId(ps));
                    e.setQueryId(queryId);
                }
            }
            if (!diff.getContinuing().isEmpty()) {
                try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE active_errors SET last_seen_at = ?, occurrence_count = ?, row_json = ?
                        WHERE id = ? AND resolved = FALSE
                        """)) {
                    for (ActiveError e : diff.getContinuing()) {
                        setInstant(ps, 1, e.getLastSeenAt());
                        ps.setInt(2, e.getOccurrenceCount());
                        ps.setString(3, json(e.getRow()));
                        ps.setLong(4, e.getId());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
            }
            if (!diff.getResolved().isEmpty()) {
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE active_errors SET resolved = TRUE, resolved_at = ? WHERE id = ? AND resolved = FALSE")) {
                    for (ActiveError e : diff.getResolved()) {
                        setInstant(ps, 1, e.getResolvedAt());
                        ps.setLong(2, e.getId());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
            }
        }, "apply lifecycle diff");
    }

    @Override
    public Optional<ActiveError> resolveError(long errorId, Instant resolvedAt) {
        update("UPDATE active_errors SET resolved = TRUE, resolved_at = ? WHERE id = ? AND resolved = FALSE", ps -> {
            setInstant(ps, 1, resolvedAt);
            ps.setLong(2, errorId);
        });
        return findError(errorId);
    }

    @Override
    public void markNotified(Collection<Long> errorIds, NotificationKind kind, Instant at) {
        if (errorIds.isEmpty()) {
            return;
        }
        String sql = kind == NotificationKind.NEW
                ? "UPDATE active_errors SET notified = TRUE, last_notified_at = ? WHERE id = ?"
                : "UPDATE active_errors SET reminder_count = reminder_count + 1, last_notified_at = ? WHERE id = ?";
        inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (Long id : new LinkedHashSet<>(errorIds)) {
                    setInstant(ps, 1, at);
                    ps.setLong(2, id);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }, "mark notified");
    }

    // ---------------------------------------------------------------- execution history

    @Override
    public ExecutionLog appendLog(ExecutionLog entry) {
        long id = insert("""
                INSERT INTO execution_logs (query_id, executed_at, status, rows_returned, new_errors, resolved_errors,
                    reminders_sent, notifications_sent, duration_ms, message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """, ps -> {
            ps.setLong(1, entry.getQueryId());
            setInstant(ps, 2, entry.getExecutedAt());
            ps.setString(3, entry.getStatus().name());
            ps.setInt(4, entry.getRowsReturned());
            ps.setInt(5, entry.getNewErrors());
            ps.setInt(6, entry.getResolvedErrors());
            ps.setInt(7, entry.getRemindersSent());
            ps.setInt(8, entry.getNotificationsSent());
            ps.setLong(9, entry.getDurationMs());
            ps.setString(10, truncate(entry.getMessage(), 2000));
        });
        return entry.toBuilder().id(id).build();
    }

    @Override
    public List<ExecutionLog> findLogs(long queryId, int limit) {
        String sql = "SELECT * FROM execution_logs WHERE query_id = ? ORDER BY executed_at DESC, id DESC";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, queryId);
            ps.setMaxRows(Math.max(1, limit));
            List<ExecutionLog> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapLog(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            log.error("Error finding execution logs: query_id={}, {}", queryId, e.getMessage(), e);
            throw new StoreException("Failed to read execution logs", e);
        }
    }

    // ---------------------------------------------------------------- retention

    @Override
    public int deleteLogsBefore(Instant cutoff) {
        return update("DELETE FROM execution_logs WHERE executed_at < ?", ps -> setInstant(ps, 1, cutoff));
    }

    @Override
    public int deleteResolvedErrorsBefore(Instant cutoff) {
        return update("DELETE FROM active_errors WHERE resolved = TRUE AND resolved_at < ?", ps -> setInstant(ps, 1, cutoff));
    }

    // ---------------------------------------------------------------- mapping

    private int bindQuery(PreparedStatement ps, MonitoredQuery q) throws SQLException {
        ps.setString(1, q.getName());
        ps.setString(2, q.getDescription());
        ps.setString(3, json(nullToEmpty(q.getTags())));
        ps.setString(4, q.getSourceType().name());
        if (q.getDataSourceId() != null) {
            ps.setLong(5, q.getDataSourceId());
        } else {
            ps.setNull(5, Types.BIGINT);
        }
        ps.setString(6, q.getQueryText());
        ps.setString(7, json(q.getSourceConfig() != null ? q.getSourceConfig() : Map.of()));
        if (q.getTimeoutSeconds() != null) {
            ps.setInt(8, q.getTimeoutSeconds());
        } else {
            ps.setNull(8, Types.INTEGER);
        }
        ps.setString(9, json(nullToEmpty(q.getKeyFields())));
        ps.setInt(10, q.getIntervalMinutes());
        ps.setString(11, formatDays(q.getActiveDays()));
        ps.setString(12, q.getWindowStart() != null ? q.getWindowStart().toString() : null);
        ps.setString(13, q.getWindowEnd() != null ? q.getWindowEnd().toString() : null);
        ps.setBoolean(14, q.isActive());
        ps.setString(15, json(nullToEmpty(q.getRecipients())));
        ps.setBoolean(16, q.isRoutingEnabled());
        ps.setString(17, json(nullToEmpty(q.getDefaultRecipients())));
        ps.setString(18, q.getNoMatchAction().name());
        ps.setString(19, q.getAggregation().name());
        ps.setInt(20, q.getReminderIntervalMinutes());
        ps.setInt(21, q.getReminderMaxCount());
        ps.setString(22, json(nullToEmpty(q.getChannelIds())));
        return 23;
    }

    private MonitoredQuery mapQuery(ResultSet rs) throws SQLException {
        long dataSourceId = rs.getLong("data_source_id");
        boolean dataSourceNull = rs.wasNull();
        int timeout = rs.getInt("timeout_seconds");
        boolean timeoutNull = rs.wasNull();
        String windowStart = rs.getString("window_start");
        String windowEnd = rs.getString("window_end");
        return MonitoredQuery.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .tags(new ArrayList<>(readJson(rs.getString("tags_json"), STRING_LIST)))
                .sourceType(SourceType.valueOf(rs.getString("source_type")))
                .dataSourceId(dataSourceNull ? null : dataSourceId)
                .queryText(rs.getString("query_text"))
                .sourceConfig(new LinkedHashMap<>(readJson(rs.getString("source_config_json"), OBJECT_MAP)))
                .timeoutSeconds(timeoutNull ? null : timeout)
                .keyFields(new ArrayList<>(readJson(rs.getString("key_fields_json"), STRING_LIST)))
                .intervalMinutes(rs.getInt("interval_minutes"))
                .activeDays(parseDays(rs.getString("active_days")))
                .windowStart(windowStart != null ? LocalTime.parse(windowStart) : null)
                .windowEnd(windowEnd != null ? LocalTime.parse(windowEnd) : null)
                .active(rs.getBoolean("active"))
                .recipients(new ArrayList<>(readJson(rs.getString("recipients_json"), STRING_LIST)))
                .routingEnabled(rs.getBoolean("routing_enabled"))
                .defaultRecipients(new ArrayList<>(readJson(rs.getString("default_recipients_json"), STRING_LIST)))
                .noMatchAction(NoMatchAction.valueOf(rs.getString("no_match_action")))
                .aggregation(AggregationMode.valueOf(rs.getString("aggregation")))
                .reminderIntervalMinutes(rs.getInt("reminder_interval_minutes"))
                .reminderMaxCount(rs.getInt("reminder_max_count"))
                .channelIds(new ArrayList<>(readJson(rs.getString("channel_ids_json"), LONG_LIST)))
                .lastCheckAt(getInstant(rs, "last_check_at"))
                .lockedAt(getInstant(rs, "locked_at"))
                .lastErrorAt(getInstant(rs, "last_error_at"))
                .totalErrorsFound(rs.getLong("total_errors_found"))
                .totalNotificationsSent(rs.getLong("total_notifications_sent"))
                .build();
    }

    private RoutingRule mapRule(ResultSet rs) throws SQLException {
        return RoutingRule.builder()
                .id(rs.getLong("id"))
                .queryId(rs.getLong("query_id"))
                .name(rs.getString("name"))
                .priority(rs.getInt("priority"))
                .logic(ConditionLogic.valueOf(rs.getString("logic")))
                .conditions(new ArrayList<>())
                .recipients(new ArrayList<>(readJson(rs.getString("recipients_json"), STRING_LIST)))
                .active(rs.getBoolean("active"))
                .stopOnMatch(rs.getBoolean("stop_on_match"))
                .build();
    }

    private RoutingCondition mapCondition(ResultSet rs) throws SQLException {
        return RoutingCondition.builder()
                .fieldName(rs.getString("field_name"))
                .operator(ConditionOperator.fromCode(rs.getString("operator_code")))
                .value(rs.getString("condition_value"))
                .caseSensitive(rs.getBoolean("case_sensitive"))
                .build();
    }

    private DataSourceDefinition mapDataSource(ResultSet rs) throws SQLException {
        return DataSourceDefinition.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .dbType(rs.getString("db_type"))
                .dsn(rs.getString("dsn"))
                .active(rs.getBoolean("active"))
                .maxPoolSize(rs.getInt("max_pool_size"))
                .build();
    }

    private NotificationChannel mapChannel(ResultSet rs) throws SQLException {
        return NotificationChannel.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .type(ChannelType.valueOf(rs.getString("channel_type")))
                .config(new LinkedHashMap<>(readJson(rs.getString("config_json"), STRING_MAP)))
                .active(rs.getBoolean("active"))
                .build();
    }

    private ActiveError mapError(ResultSet rs) throws SQLException {
        return ActiveError.builder()
                .id(rs.getLong("id"))
                .queryId(rs.getLong("query_id"))
                .signature(new KeySignature(readJson(rs.getString("signature_json"), STRING_LIST)))
                .row(new LinkedHashMap<>(readJson(rs.getString("row_json"), OBJECT_MAP)))
                .firstSeenAt(getInstant(rs, "first_seen_at"))
                .lastSeenAt(getInstant(rs, "last_seen_at"))
                .occurrenceCount(rs.getInt("occurrence_count"))
                .resolved(rs.getBoolean("resolved"))
                .resolvedAt(getInstant(rs, "resolved_at"))
                .notified(rs.getBoolean("notified"))
                .lastNotifiedAt(getInstant(rs, "last_notified_at"))
                .reminderCount(rs.getInt("reminder_count"))
                .build();
    }

    private ExecutionLog mapLog(ResultSet rs) throws SQLException {
        return ExecutionLog.builder()
                .id(rs.getLong("id"))
                .queryId(rs.getLong("query_id"))
                .executedAt(getInstant(rs, "executed_at"))
                .status(ExecutionStatus.valueOf(rs.getString("status")))
                .rowsReturned(rs.getInt("rows_returned"))
                .newErrors(rs.getInt("new_errors"))
                .resolvedErrors(rs.getInt("resolved_errors"))
                .remindersSent(rs.getInt("reminders_sent"))
                .notificationsSent(rs.getInt("notifications_sent"))
                .durationMs(rs.getLong("duration_ms"))
                .message(rs.getString("message"))
                .build();
    }

    // ---------------------------------------------------------------- plumbing

    @FunctionalInterface
    private interface SqlBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    private interface TransactionWork {
        void run(Connection conn) throws SQLException;
    }

    private <T> List<T> queryList(String sql, SqlBinder binder, RowMapper<T> mapper) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            List<T> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            log.error("Error running store query: {}", e.getMessage(), e);
            throw new StoreException("Store query failed", e);
        }
    }

    private <T> Optional<T> queryOne(String sql, SqlBinder binder, RowMapper<T> mapper) {
        List<T> rows = queryList(sql, binder, mapper);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private int update(String sql, SqlBinder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error running store update: {}", e.getMessage(), e);
            throw new StoreException("Store update failed", e);
        }
    }

    private long insert(String sql, SqlBinder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            binder.bind(ps);
            ps.executeUpdate();
            return generatedId(ps);
        } catch (SQLException e) {
            log.error("Error running store insert: {}", e.getMessage(), e);
            throw new StoreException("Store insert failed", e);
        }
    }

    private void inTransaction(TransactionWork work, String description) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                work.run(conn);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("Error in store transaction ({}): {}", description, e.getMessage(), e);
            throw new StoreException("Failed to " + description, e);
        }
    }

    private static long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }

    private static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize value", e);
        }
    }

    private <T> T readJson(String text, TypeReference<T> type) {
        try {
            return objectMapper.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize stored value", e);
        }
    }

    private static String formatDays(Set<DayOfWeek> days) {
        if (days == null || days.isEmpty()) {
            return "";
        }
        return EnumSet.copyOf(days).stream().map(Enum::name).collect(Collectors.joining(","));
    }

    private static Set<DayOfWeek> parseDays(String text) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (text != null && !text.isBlank()) {
            Arrays.stream(text.split(",")).map(String::trim).map(DayOfWeek::valueOf).forEach(days::add);
        }
        return days;
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values != null ? values : List.of();
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
