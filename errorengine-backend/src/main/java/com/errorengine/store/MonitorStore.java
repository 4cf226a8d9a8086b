package com.errorengine.store;

import com.errorengine.lifecycle.LifecycleDiff;
import com.errorengine.model.ActiveError;
import com.errorengine.model.DataSourceDefinition;
import com.errorengine.model.ExecutionLog;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.NotificationKind;
import com.errorengine.model.RoutingRule;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistent state of the engine: definitions, active errors and execution history.
 *
 * <p>Returned objects are detached copies; changing them has no effect until they are saved.
 */
public interface MonitorStore {

    // queries

    List<MonitoredQuery> findAllQueries();

    List<MonitoredQuery> findActiveQueries();

    Optional<MonitoredQuery> findQuery(long id);

    Optional<MonitoredQuery> findQueryByName(String name);

    /**
     * Insert (id null) or update a query definition. Runtime fields (last check, lock marker,
     * statistics) are not changed by updates.
     *
     * @param query query
     * @return the stored query with its id
     */
    MonitoredQuery saveQuery(MonitoredQuery query);

    /**
     * Record a completed cycle: stamps the last-check time and adds to the statistics.
     *
     * @param queryId query id
     * @param checkedAt cycle time
     * @param newErrors errors created in the cycle
     * @param notificationsSent successful deliveries in the cycle
     */
    void recordCheck(long queryId, Instant checkedAt, int newErrors, int notificationsSent);

    /**
     * Set the crash-recovery lock marker.
     *
     * @param queryId query id
     * @param lockedAt lock time
     * @return false when a marker was already present
     */
    boolean markLocked(long queryId, Instant lockedAt);

    void clearLock(long queryId);

    /**
     * Clear every lock marker. Called once at startup, before scheduling begins.
     *
     * @return number of markers cleared
     */
    int clearAllLocks();

    // rules

    List<RoutingRule> findRules(long queryId);

    /**
     * Replace the whole rule set of a query.
     *
     * @param queryId query id
     * @param rules new rules; ids are reassigned
     * @return stored rules
     */
    List<RoutingRule> replaceRules(long queryId, List<RoutingRule> rules);

    // data sources and channels

    List<DataSourceDefinition> findAllDataSources();

    Optional<DataSourceDefinition> findDataSource(long id);

    Optional<DataSourceDefinition> findDataSourceByName(String name);

    DataSourceDefinition saveDataSource(DataSourceDefinition dataSource);

    List<NotificationChannel> findAllChannels();

    Optional<NotificationChannel> findChannel(long id);

    Optional<NotificationChannel> findChannelByName(String name);

    List<NotificationChannel> findChannels(Collection<Long> ids);

    NotificationChannel saveChannel(NotificationChannel channel);

    // errors

    List<ActiveError> findUnresolvedErrors(long queryId);

    List<ActiveError> findAllUnresolvedErrors();

    Optional<ActiveError> findError(long id);

    /**
     * Apply a lifecycle diff atomically: created errors are inserted and receive their ids (the
     * objects in the diff are updated in place), continuing and resolved errors are updated.
     * Updates never touch an error that was resolved in the meantime.
     *
     * @param queryId query id
     * @param diff diff
     */
    void applyDiff(long queryId, LifecycleDiff diff);

    /**
     * Resolve one error.
     *
     * @param errorId error id
     * @param resolvedAt resolution time
     * @return the resolved error, empty when it does not exist
     */
    Optional<ActiveError> resolveError(long errorId, Instant resolvedAt);

    /**
     * Record successful deliveries. NEW marks the errors notified; REMINDER increments their
     * reminder count. Both stamp the last-notified time.
     *
     * @param errorIds delivered error ids
     * @param kind notification kind
     * @param at delivery time
     */
    void markNotified(Collection<Long> errorIds, NotificationKind kind, Instant at);

    // execution history

    ExecutionLog appendLog(ExecutionLog log);

    List<ExecutionLog> findLogs(long queryId, int limit);

    // retention

    int deleteLogsBefore(Instant cutoff);

    int deleteResolvedErrorsBefore(Instant cutoff);
}
