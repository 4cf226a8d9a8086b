package com.errorengine.store;

import com.errorengine.lifecycle.LifecycleDiff;
import com.errorengine.model.ActiveError;
import com.errorengine.model.DataSourceDefinition;
import com.errorengine.model.ExecutionLog;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.NotificationKind;
import com.errorengine.model.RoutingCondition;
import com.errorengine.model.RoutingRule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store. State is lost on restart; used for tests and {@code errorengine.store.type=memory}.
 */
public class InMemoryMonitorStore implements MonitorStore {

    private final Map<Long, MonitoredQuery> queries = new LinkedHashMap<>();
    private final Map<Long, List<RoutingRule>> rules = new LinkedHashMap<>();
    private final Map<Long, DataSourceDefinition> dataSources = new LinkedHashMap<>();
    private final Map<Long, NotificationChannel> channels = new LinkedHashMap<>();
    private final Map<Long, ActiveError> errors = new LinkedHashMap<>();
    private final List<ExecutionLog> logs = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public synchronized List<MonitoredQuery> findAllQueries() {
        return queries.values().stream().map(InMemoryMonitorStore::copy).toList();
    }

    @Override
    public synchronized List<MonitoredQuery> findActiveQueries() {
        return queries.values().stream().filter(MonitoredQuery::isActive).map(InMemoryMonitorStore::copy).toList();
    }

    @Override
    public synchronized Optional<MonitoredQuery> findQuery(long id) {
        return Optional.ofNullable(queries.get(id)).map(InMemoryMonitorStore::copy);
    }

    @Override
    public synchronized Optional<MonitoredQuery> findQueryByName(String name) {
        return queries.values().stream().filter(q -> q.getName().equals(name)).findFirst().map(InMemoryMonitorStore::copy);
    }

    @Override
    public synchronized MonitoredQuery saveQuery(MonitoredQuery query) {
        MonitoredQuery stored = copy(query);
        if (stored.getId() == null) {
            stored.setId(ids.incrementAndGet());
        } else {
            MonitoredQuery existing = queries.get(stored.getId());
            if (existing != null) {
                stored.setLastCheckAt(existing.getLastCheckAt());
                stored.setLockedAt(existing.getLockedAt());
                stored.setLastErrorAt(existing.getLastErrorAt());
                stored.setTotalErrorsFound(existing.getTotalErrorsFound());
                stored.setTotalNotificationsSent(existing.getTotalNotificationsSent());
            }
        }
        queries.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public synchronized void recordCheck(long queryId, Instant checkedAt, int newErrors, int notificationsSent) {
        MonitoredQuery q = queries.get(queryId);
        if (q == null) {
            return;
        }
        q.setLastCheckAt(checkedAt);
        if (newErrors > 0) {
            q.setLastErrorAt(checkedAt);
        }
        q.setTotalErrorsFound(q.getTotalErrorsFound() + newErrors);
        q.setTotalNotificationsSent(q.getTotalNotificationsSent() + notificationsSent);
    }

    @Override
    public synchronized boolean markLocked(long queryId, Instant lockedAt) {
        MonitoredQuery q = queries.get(queryId);
        if (q == null || q.getLockedAt() != null) {
            return false;
        }
        q.setLockedAt(lockedAt);
        return true;
    }

    @Override
    public synchronized void clearLock(long queryId) {
        MonitoredQuery q = queries.get(queryId);
        if (q != null) {
            q.setLockedAt(null);
        }
    }

    @Override
    public synchronized int clearAllLocks() {
        int cleared = 0;
        for (MonitoredQuery q : queries.values()) {
            if (q.getLockedAt() != null) {
                q.setLockedAt(null);
                cleared++;
            }
        }
        return cleared;
    }

    @Override
    public synchronized List<RoutingRule> findRules(long queryId) {
        return rules.getOrDefault(queryId, List.of()).stream().map(InMemoryMonitorStore::copy).toList();
    }

    @Override
    public synchronized List<RoutingRule> replaceRules(long queryId, List<RoutingRule> newRules) {
        List<RoutingRule> stored = new ArrayList<>();
        for (RoutingRule rule : newRules) {
            RoutingRule r = copy(rule);
            r.setId(ids.incrementAndGet());
            r.setQueryId(queryId);
            stored.add(r);
        }
        rules.put(queryId, stored);
        return findRules(queryId);
    }

    @Override
    public synchronized List<DataSourceDefinition> findAllDataSources() {
        return dataSources.values().stream().map(d -> d.toBuilder().build()).toList();
    }

    @Override
    public synchronized Optional<DataSourceDefinition> findDataSource(long id) {
        return Optional.ofNullable(dataSources.get(id)).map(d -> d.toBuilder().build());
    }

    @Override
    public synchronized Optional<DataSourceDefinition> findDataSourceByName(String name) {
        return dataSources.values().stream().filter(d -> d.getName().equals(name)).findFirst().map(d -> d.toBuilder().build());
    }

    @Override
    public synchronized DataSourceDefinition saveDataSource(DataSourceDefinition dataSource) {
        DataSourceDefinition stored = dataSource.toBuilder().build();
        if (stored.getId() == null) {
            stored.setId(ids.incrementAndGet());
        }
        dataSources.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public synchronized List<NotificationChannel> findAllChannels() {
        return channels.values().stream().map(InMemoryMonitorStore::copy).toList();
    }

    @Override
    public synchronized Optional<NotificationChannel> findChannel(long id) {
        return Optional.ofNullable(channels.get(id)).map(InMemoryMonitorStore::copy);
    }

    @Override
    public synchronized Optional<NotificationChannel> findChannelByName(String name) {
        return channels.values().stream().filter(c -> c.getName().equals(name)).findFirst().map(InMemoryMonitorStore::copy);
    }

    @Override
    public synchronized List<NotificationChannel> findChannels(Collection<Long> channelIds) {
        return channelIds.stream()
                .map(channels::get)
                .filter(c -> c != null)
                .map(InMemoryMonitorStore::copy)
                .toList();
    }

    @Override
    public synchronized NotificationChannel saveChannel(NotificationChannel channel) {
        NotificationChannel stored = copy(channel);
        if (stored.getId() == null) {
            stored.setId(ids.incrementAndGet());
        }
        channels.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public synchronized List<ActiveError> findUnresolvedErrors(long queryId) {
        return errors.values().stream()
                .filter(e -> !e.isResolved() && e.getQueryId() == queryId)
                .map(ActiveError::copy)
                .toList();
    }

    @Override
    public synchronized List<ActiveError> findAllUnresolvedErrors() {
        return errors.values().stream().filter(e -> !e.isResolved()).map(ActiveError::copy).toList();
    }

    @Override
    public synchronized Optional<ActiveError> findError(long id) {
        return Optional.ofNullable(errors.get(id)).map(ActiveError::copy);
    }

    @Override
    public synchronized void applyDiff(long queryId, LifecycleDiff diff) {
        for (ActiveError created : diff.getCreated()) {
            created.setId(ids.incrementAndGet());
            created.setQueryId(queryId);
            errors.put(created.getId(), created.copy());
        }
        for (ActiveError updated : diff.getContinuing()) {
            ActiveError current = errors.get(updated.getId());
            if (current != null && !current.isResolved()) {
                current.setLastSeenAt(updated.getLastSeenAt());
                current.setOccurrenceCount(updated.getOccurrenceCount());
                current.setRow(new LinkedHashMap<>(updated.getRow()));
            }
        }
        for (ActiveError resolved : diff.getResolved()) {
            ActiveError current = errors.get(resolved.getId());
            if (current != null && !current.isResolved()) {
                current.setResolved(true);
                current.setResolvedAt(resolved.getResolvedAt());
            }
        }
    }

    @Override
    public synchronized Optional<ActiveError> resolveError(long errorId, Instant resolvedAt) {
        ActiveError current = errors.get(errorId);
        if (current == null) {
            return Optional.empty();
        }
        if (!current.isResolved()) {
            current.setResolved(true);
            current.setResolvedAt(resolvedAt);
        }
        return Optional.of(current.copy());
    }

    @Override
    public synchronized void markNotified(Collection<Long> errorIds, NotificationKind kind, Instant at) {
        for (Long id : new HashSet<>(errorIds)) {
            ActiveError e = errors.get(id);
            if (e == null) {
                continue;
            }
            e.setLastNotifiedAt(at);
            if (kind == NotificationKind.NEW) {
                e.setNotified(true);
            } else {
                e.setReminderCount(e.getReminderCount() + 1);
            }
        }
    }

    @Override
    public synchronized ExecutionLog appendLog(ExecutionLog log) {
        ExecutionLog stored = log.toBuilder().id(ids.incrementAndGet()).build();
        logs.add(stored);
        return stored;
    }

    @Override
    public synchronized List<ExecutionLog> findLogs(long queryId, int limit) {
        return logs.stream()
                .filter(l -> l.getQueryId() == queryId)
                .sorted(Comparator.comparing(ExecutionLog::getExecutedAt).thenComparing(ExecutionLog::getId).reversed())
                .limit(limit)
                .map(l -> l.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized int deleteLogsBefore(Instant cutoff) {
        int before = logs.size();
        logs.removeIf(l -> l.getExecutedAt().isBefore(cutoff));
        return before - logs.size();
    }

    @Override
    public synchronized int deleteResolvedErrorsBefore(Instant cutoff) {
        int before = errors.size();
        errors.values().removeIf(e -> e.isResolved() && e.getResolvedAt() != null && e.getResolvedAt().isBefore(cutoff));
        return before - errors.size();
    }

    private static MonitoredQuery copy(MonitoredQuery q) {
        return q.toBuilder()
                .tags(list(q.getTags()))
                .sourceConfig(q.getSourceConfig() != null ? new LinkedHashMap<>(q.getSourceConfig()) : new LinkedHashMap<>())
                .keyFields(list(q.getKeyFields()))
                .activeDays(q.getActiveDays() != null ? new LinkedHashSet<>(q.getActiveDays()) : new LinkedHashSet<>())
                .recipients(list(q.getRecipients()))
                .defaultRecipients(list(q.getDefaultRecipients()))
                .channelIds(list(q.getChannelIds()))
                .build();
    }

    private static RoutingRule copy(RoutingRule r) {
        List<RoutingCondition> conditions = new ArrayList<>();
        for (RoutingCondition c : list(r.getConditions())) {
            conditions.add(c.toBuilder().build());
        }
        return r.toBuilder()
                .conditions(conditions)
                .recipients(list(r.getRecipients()))
                .build();
    }

    private static NotificationChannel copy(NotificationChannel c) {
        return c.toBuilder().config(c.getConfig() != null ? new LinkedHashMap<>(c.getConfig()) : new LinkedHashMap<>()).build();
    }

    private static <T> List<T> list(List<T> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
