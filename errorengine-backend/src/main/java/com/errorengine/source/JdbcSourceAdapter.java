package com.errorengine.source;

import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.model.DataSourceDefinition;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.SourceType;
import com.errorengine.store.MonitorStore;
import com.errorengine.util.DsnParser;
import com.errorengine.util.JdbcConnectionInfo;
import com.errorengine.util.JdbcConnectionInfoResolver;
import com.errorengine.util.JdbcScalars;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs monitored SQL against the query's data source. One small Hikari pool is kept per data
 * source and rebuilt when the data source definition changes.
 */
@Slf4j
@Component
public class JdbcSourceAdapter implements SourceAdapter {

    private final MonitorStore store;
    private final JdbcConnectionInfoResolver connectionInfoResolver;
    private final ErrorEngineProperties properties;
    private final Map<Long, HikariDataSource> pools = new ConcurrentHashMap<>();

    public JdbcSourceAdapter(MonitorStore store, JdbcConnectionInfoResolver connectionInfoResolver,
                             ErrorEngineProperties properties) {
        this.store = store;
        this.connectionInfoResolver = connectionInfoResolver;
        this.properties = properties;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.DATABASE;
    }

    @Override
    public SourceResult fetch(MonitoredQuery query, Duration timeout) throws SourceException {
        if (query.getQueryText() == null || query.getQueryText().isBlank()) {
            throw new SourceException(SourceErrorKind.CONFIGURATION, "query text is empty");
        }
        DataSourceDefinition dataSource = resolveDataSource(query);
        HikariDataSource pool = pool(dataSource);

        try (Connection conn = pool.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
            int maxRows = properties.getSource().getMaxRows();
            if (maxRows > 0) {
                // one extra row tells a full result from a truncated one
                stmt.setMaxRows(maxRows + 1);
            }
            try (ResultSet rs = stmt.executeQuery(query.getQueryText())) {
                return readResult(rs, maxRows);
            }
        } catch (SQLException e) {
            throw translate(dataSource, e);
        }
    }

    /**
     * Open a throwaway connection to check a data source definition.
     *
     * @param dataSource data source
     * @throws SourceException when the connection cannot be established
     */
    public void testConnection(DataSourceDefinition dataSource) throws SourceException {
        HikariConfig config = buildHikariConfig(dataSource, "errorengine-test-" + dataSource.getName(), 1);
        config.setMinimumIdle(0);
        try (HikariDataSource ds = new HikariDataSource(config);
             Connection conn = ds.getConnection()) {
            if (!conn.isValid(5)) {
                throw new SourceException(SourceErrorKind.CONNECTION, "connection is not valid");
            }
        } catch (SQLException e) {
            throw translate(dataSource, e);
        } catch (RuntimeException e) {
            throw new SourceException(SourceErrorKind.CONNECTION,
                    "cannot connect to data source " + dataSource.getName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Drop the pool of a data source so the next fetch picks up an edited definition.
     *
     * @param dataSourceId data source id
     */
    public void invalidate(Long dataSourceId) {
        if (dataSourceId == null) {
            return;
        }
        HikariDataSource ds = pools.remove(dataSourceId);
        if (ds != null) {
            ds.close();
            log.info("Closed source pool: data_source_id={}", dataSourceId);
        }
    }

    @PreDestroy
    public void closeAll() {
        pools.keySet().forEach(this::invalidate);
    }

    /**
     * @param rs result set
     * @param maxRows row limit, 0 or less for none
     * @throws SourceException when the result has more than {@code maxRows} rows
     */
    static SourceResult readResult(ResultSet rs, int maxRows) throws SQLException, SourceException {
        ResultSetMetaData md = rs.getMetaData();
        int count = md.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(md.getColumnLabel(i));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            if (maxRows > 0 && rows.size() == maxRows) {
                throw new SourceException(SourceErrorKind.INVALID_RESPONSE,
                        "result exceeds max_rows (" + maxRows + "), narrow the query");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= count; i++) {
                row.put(columns.get(i - 1), JdbcScalars.readScalar(rs, i));
            }
            rows.add(row);
        }
        return new SourceResult(List.copyOf(columns), rows);
    }

    private DataSourceDefinition resolveDataSource(MonitoredQuery query) throws SourceException {
        if (query.getDataSourceId() == null) {
            throw new SourceException(SourceErrorKind.CONFIGURATION, "query has no data source");
        }
        DataSourceDefinition dataSource = store.findDataSource(query.getDataSourceId())
                .orElseThrow(() -> new SourceException(SourceErrorKind.CONFIGURATION,
                        "data source not found: " + query.getDataSourceId()));
        if (!dataSource.isActive()) {
            throw new SourceException(SourceErrorKind.CONFIGURATION, "data source is inactive: " + dataSource.getName());
        }
        return dataSource;
    }

    private HikariDataSource pool(DataSourceDefinition dataSource) throws SourceException {
        try {
            return pools.computeIfAbsent(dataSource.getId(), id -> {
                HikariConfig config = buildHikariConfig(dataSource, "errorengine-source-" + id,
                        Math.max(1, dataSource.getMaxPoolSize()));
                config.setMinimumIdle(0);
                config.setIdleTimeout(60_000);
                log.info("Opening source pool: data_source_id={}, name={}, url={}",
                        id, dataSource.getName(), DsnParser.maskUrl(config.getJdbcUrl()));
                return new HikariDataSource(config);
            });
        } catch (RuntimeException e) {
            throw new SourceException(SourceErrorKind.CONNECTION,
                    "cannot open data source " + dataSource.getName() + ": " + e.getMessage(), e);
        }
    }

    private HikariConfig buildHikariConfig(DataSourceDefinition dataSource, String poolName, int maximumPoolSize) {
        JdbcConnectionInfo info = connectionInfoResolver.resolve(dataSource.getDsn(), dataSource.getDbType());
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(info.getUrl());
        if (info.getUsername() != null && !info.getUsername().isEmpty()) {
            config.setUsername(info.getUsername());
            config.setPassword(info.getPassword());
        }
        if (info.getDriverClassName() != null) {
            config.setDriverClassName(info.getDriverClassName());
        }
        if ("postgres".equals(info.getDbType())) {
            config.addDataSourceProperty("ApplicationName", "errorengine");
        }
        if (info.getDataSourceProperties() != null) {
            info.getDataSourceProperties().forEach(config::addDataSourceProperty);
        }
        config.setReadOnly(true);
        config.setConnectionTimeout(Duration.ofSeconds(properties.getSource().getConnectTimeoutSeconds()).toMillis());
        config.setMaximumPoolSize(maximumPoolSize);
        config.setPoolName(poolName);
        return config;
    }

    private static SourceException translate(DataSourceDefinition dataSource, SQLException e) {
        String state = e.getSQLState();
        String message = "data source " + dataSource.getName() + ": " + e.getMessage();
        if (e instanceof SQLTimeoutException || "57014".equals(state)) {
            return new SourceException(SourceErrorKind.TIMEOUT, message, e);
        }
        if (e instanceof SQLSyntaxErrorException || (state != null && state.startsWith("42"))) {
            return new SourceException(SourceErrorKind.MALFORMED_QUERY, message, e);
        }
        if (state != null && state.startsWith("08")) {
            return new SourceException(SourceErrorKind.CONNECTION, message, e);
        }
        if (state != null && (state.startsWith("22") || state.startsWith("0A"))) {
            return new SourceException(SourceErrorKind.MALFORMED_QUERY, message, e);
        }
        return new SourceException(SourceErrorKind.CONNECTION, message, e);
    }
}
