package com.errorengine.monitor;

import com.errorengine.api.FieldInfo;
import com.errorengine.api.QueryStatusResponse;
import com.errorengine.api.SourceTestResponse;
import com.errorengine.config.ConfigurationException;
import com.errorengine.lifecycle.ErrorLifecycleManager;
import com.errorengine.lifecycle.LifecycleDiff;
import com.errorengine.model.ActiveError;
import com.errorengine.model.ExecutionLog;
import com.errorengine.model.ExecutionStatus;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.NotificationKind;
import com.errorengine.model.RoutingRule;
import com.errorengine.notify.DeliveryPlan;
import com.errorengine.notify.DeliveryPlanEntry;
import com.errorengine.notify.DeliveryResult;
import com.errorengine.notify.ErrorContext;
import com.errorengine.notify.NotificationDispatcher;
import com.errorengine.notify.RecipientAggregator;
import com.errorengine.notify.ReminderSelector;
import com.errorengine.notify.RoutedError;
import com.errorengine.routing.RoutingDecision;
import com.errorengine.routing.RoutingEngine;
import com.errorengine.source.SourceException;
import com.errorengine.source.SourceFetcher;
import com.errorengine.source.SourceResult;
import com.errorengine.store.MonitorStore;
import com.errorengine.util.RowValues;
import com.errorengine.config.ErrorEngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs monitoring cycles: eligibility, per-query lock, fetch, lifecycle diff, routing, reminder
 * selection, aggregation and dispatch, in that order. Also serves the caller-facing operations.
 *
 * <p>Failures inside a cycle never escape: they become an {@link ExecutionStatus#ERROR} result so
 * the scheduler keeps running. Dispatch failures never roll back lifecycle changes.
 */
@Service
public class MonitorOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MonitorOrchestrator.class);

    static final String ALREADY_RUNNING = "already running";
    private static final String MDC_QUERY_ID = "query_id";

    private final MonitorStore store;
    private final ScheduleEvaluator scheduleEvaluator;
    private final ExecutionLockRegistry locks;
    private final SourceFetcher sourceFetcher;
    private final ErrorLifecycleManager lifecycleManager;
    private final RoutingEngine routingEngine;
    private final ReminderSelector reminderSelector;
    private final RecipientAggregator aggregator;
    private final NotificationDispatcher dispatcher;
    private final ErrorEngineProperties properties;
    private final Clock clock;
    private final Map<Long, ExecutionResult> lastOutcomes = new ConcurrentHashMap<>();

    public MonitorOrchestrator(MonitorStore store, ScheduleEvaluator scheduleEvaluator, ExecutionLockRegistry locks,
                               SourceFetcher sourceFetcher, ErrorLifecycleManager lifecycleManager,
                               RoutingEngine routingEngine, ReminderSelector reminderSelector,
                               RecipientAggregator aggregator, NotificationDispatcher dispatcher,
                               ErrorEngineProperties properties, Clock clock) {
        this.store = store;
        this.scheduleEvaluator = scheduleEvaluator;
        this.locks = locks;
        this.sourceFetcher = sourceFetcher;
        this.lifecycleManager = lifecycleManager;
        this.routingEngine = routingEngine;
        this.reminderSelector = reminderSelector;
        this.aggregator = aggregator;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Run a query if it is eligible at {@code now}.
     *
     * <p>{@code query} may be an older snapshot. It only serves as a pre-check; once the lock is
     * held the query is read again and eligibility is decided against the stored state and the
     * current clock, which is also the time the cycle runs at.
     *
     * @param query query
     * @param now tick time
     * @return cycle result; SKIPPED with the first failing check when not eligible
     */
    public ExecutionResult maybeRun(MonitoredQuery query, Instant now) {
        Optional<String> skipReason = scheduleEvaluator.skipReason(query, now);
        if (skipReason.isPresent()) {
            return skip(query.getId(), now, skipReason.get());
        }
        return execute(query.getId(), now, true);
    }

    /**
     * Run a query immediately, ignoring its schedule. The per-query lock still applies.
     *
     * @param queryId query id
     * @return cycle result
     * @throws QueryNotFoundException when the query does not exist
     */
    public ExecutionResult runNow(long queryId) {
        MonitoredQuery query = store.findQuery(queryId).orElseThrow(() -> new QueryNotFoundException(queryId));
        log.info("Manual run requested: query_id={}, name={}", queryId, query.getName());
        return execute(queryId, clock.instant(), false);
    }

    /**
     * Resolve an error by hand. Resolving an already resolved error is a no-op.
     *
     * @param errorId error id
     * @return the resolved error
     * @throws ErrorNotFoundException when the error does not exist
     */
    public ActiveError resolveManually(long errorId) {
        ActiveError resolved = store.resolveError(errorId, clock.instant())
                .orElseThrow(() -> new ErrorNotFoundException(errorId));
        log.info("Error resolved manually: error_id={}, query_id={}, signature={}",
                errorId, resolved.getQueryId(), resolved.getSignature());
        return resolved;
    }

    /**
     * @param queryId restrict to one query, or null for all
     * @return unresolved errors, most recently first seen first
     */
    public List<ActiveError> listActiveErrors(Long queryId) {
        List<ActiveError> errors;
        if (queryId != null) {
            store.findQuery(queryId).orElseThrow(() -> new QueryNotFoundException(queryId));
            errors = store.findUnresolvedErrors(queryId);
        } else {
            errors = store.findAllUnresolvedErrors();
        }
        return errors.stream()
                .sorted(Comparator.comparing(ActiveError::getFirstSeenAt).reversed()
                        .thenComparing(ActiveError::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * @return the active query that becomes eligible soonest, empty when none will
     */
    public Optional<NextScheduledRun> getNextScheduledRun() {
        Instant now = clock.instant();
        NextScheduledRun best = null;
        for (MonitoredQuery query : store.findActiveQueries()) {
            Optional<Instant> next = scheduleEvaluator.nextRunAt(query, now);
            if (next.isEmpty()) {
                continue;
            }
            if (best == null || next.get().isBefore(best.getRunAt())) {
                long seconds = Math.max(0, Duration.between(now, next.get()).getSeconds());
                best = new NextScheduledRun(query.getId(), query.getName(), next.get(), seconds);
            }
        }
        return Optional.ofNullable(best);
    }

    public QueryStatusResponse queryStatus(long queryId) {
        MonitoredQuery query = store.findQuery(queryId).orElseThrow(() -> new QueryNotFoundException(queryId));
        Instant now = clock.instant();
        List<ActiveError> unresolved = store.findUnresolvedErrors(queryId);
        List<ExecutionLog> last = store.findLogs(queryId, 1);
        return QueryStatusResponse.builder()
                .query(query)
                .running(locks.isHeld(queryId))
                .activeErrors(unresolved.size())
                .pendingReminders(reminderSelector.select(query, unresolved, now).size())
                .nextRunAt(scheduleEvaluator.nextRunAt(query, now).orElse(null))
                .lastExecution(last.isEmpty() ? null : last.get(0))
                .lastOutcome(lastOutcomes.get(queryId))
                .build();
    }

    public List<ExecutionLog> executionLogs(long queryId, int limit) {
        store.findQuery(queryId).orElseThrow(() -> new QueryNotFoundException(queryId));
        return store.findLogs(queryId, Math.max(1, Math.min(limit, 500)));
    }

    /**
     * Fetch a query's rows without touching the error lifecycle.
     *
     * @param queryId query id
     * @return test outcome with a few sample rows
     */
    public SourceTestResponse testSource(long queryId) {
        MonitoredQuery query = store.findQuery(queryId).orElseThrow(() -> new QueryNotFoundException(queryId));
        long start = System.nanoTime();
        try {
            SourceResult result = sourceFetcher.fetch(query);
            int sample = properties.getSource().getSampleRows();
            return SourceTestResponse.builder()
                    .success(true)
                    .message("OK")
                    .columns(result.getColumns())
                    .rowCount(result.size())
                    .sampleRows(result.getRows().subList(0, Math.min(sample, result.size())))
                    .durationMs(elapsedMs(start))
                    .build();
        } catch (SourceException e) {
            return SourceTestResponse.builder()
                    .success(false)
                    .message(e.getMessage())
                    .errorKind(e.getKind().name())
                    .columns(List.of())
                    .sampleRows(List.of())
                    .durationMs(elapsedMs(start))
                    .build();
        }
    }

    /**
     * Columns of a query's result with inferred type and a sample value, for rule editing.
     *
     * @param queryId query id
     * @return fields in column order
     * @throws SourceException when the fetch fails
     */
    public List<FieldInfo> availableFields(long queryId) throws SourceException {
        MonitoredQuery query = store.findQuery(queryId).orElseThrow(() -> new QueryNotFoundException(queryId));
        SourceResult result = sourceFetcher.fetch(query);
        Map<String, Object> first = result.getRows().isEmpty() ? Map.of() : result.getRows().get(0);
        List<FieldInfo> fields = new ArrayList<>();
        for (String column : result.getColumns()) {
            Object sample = first.get(column);
            fields.add(new FieldInfo(column, RowValues.typeOf(sample), sample));
        }
        return fields;
    }

    private ExecutionResult execute(long queryId, Instant requestedAt, boolean scheduled) {
        Optional<ExecutionLockRegistry.Lease> lease = locks.tryAcquire(queryId);
        if (lease.isEmpty()) {
            log.info("Query skipped, previous execution still running: query_id={}", queryId);
            ExecutionResult result = ExecutionResult.skipped(queryId, requestedAt, ALREADY_RUNNING);
            lastOutcomes.put(queryId, result);
            appendLogQuietly(result);
            return result;
        }

        // a request thread may already carry the id; put it back afterwards
        String outerQueryId = MDC.get(MDC_QUERY_ID);
        MDC.put(MDC_QUERY_ID, String.valueOf(queryId));
        try (ExecutionLockRegistry.Lease held = lease.get()) {
            Instant now = clock.instant();
            Optional<MonitoredQuery> current = store.findQuery(queryId);
            if (current.isEmpty()) {
                return skip(queryId, now, "query no longer exists");
            }
            MonitoredQuery query = current.get();
            if (scheduled) {
                // another run may have finished since the caller's snapshot was taken
                Optional<String> skipReason = scheduleEvaluator.skipReason(query, now);
                if (skipReason.isPresent()) {
                    return skip(queryId, now, skipReason.get());
                }
            }
            ExecutionResult result = runCycle(query, now);
            lastOutcomes.put(queryId, result);
            appendLogQuietly(result);
            return result;
        } finally {
            if (outerQueryId != null) {
                MDC.put(MDC_QUERY_ID, outerQueryId);
            } else {
                MDC.remove(MDC_QUERY_ID);
            }
        }
    }

    private ExecutionResult skip(long queryId, Instant at, String reason) {
        log.debug("Query skipped: query_id={}, reason={}", queryId, reason);
        ExecutionResult result = ExecutionResult.skipped(queryId, at, reason);
        lastOutcomes.put(queryId, result);
        return result;
    }

    private ExecutionResult runCycle(MonitoredQuery query, Instant now) {
        long start = System.nanoTime();
        ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                .queryId(query.getId())
                .startedAt(now);

        SourceResult fetched;
        try {
            fetched = sourceFetcher.fetch(query);
        } catch (SourceException e) {
            log.warn("Source fetch failed: query_id={}, kind={}, message={}", query.getId(), e.getKind(), e.getMessage());
            return result.status(ExecutionStatus.ERROR)
                    .message("source error (" + e.getKind() + "): " + e.getMessage())
                    .durationMs(elapsedMs(start))
                    .build();
        }

        try {
            List<ActiveError> unresolved = store.findUnresolvedErrors(query.getId());
            LifecycleDiff diff;
            try {
                diff = lifecycleManager.diff(query, fetched.getRows(), unresolved, now);
            } catch (ConfigurationException e) {
                log.warn("Fetched rows rejected: query_id={}, message={}", query.getId(), e.getMessage());
                return result.status(ExecutionStatus.ERROR)
                        .rowsReturned(fetched.size())
                        .message("validation error: " + e.getMessage())
                        .durationMs(elapsedMs(start))
                        .build();
            }
            store.applyDiff(query.getId(), diff);

            List<RoutingRule> rules = query.isRoutingEnabled() ? store.findRules(query.getId()) : List.of();
            List<NotificationChannel> channels = query.getChannelIds() == null || query.getChannelIds().isEmpty()
                    ? List.of()
                    : store.findChannels(query.getChannelIds());
            List<ActiveError> reminders = reminderSelector.select(query, diff.getContinuing(), now);

            DeliveryPlan plan = new DeliveryPlan();
            plan.addAll(aggregator.aggregate(route(query, rules, diff.getCreated()), channels, NotificationKind.NEW,
                    query.getAggregation()));
            plan.addAll(aggregator.aggregate(route(query, rules, reminders), channels, NotificationKind.REMINDER,
                    query.getAggregation()));

            int delivered = dispatch(query, plan, now);
            int remindersSent = (int) plan.entriesOf(NotificationKind.REMINDER).stream()
                    .flatMap(e -> e.getErrors().stream())
                    .map(ErrorContext::getErrorId)
                    .distinct()
                    .count();

            store.recordCheck(query.getId(), now, diff.getCreated().size(), delivered);

            ExecutionResult done = result.status(ExecutionStatus.SUCCESS)
                    .rowsReturned(diff.getRowsFetched())
                    .newErrors(diff.getCreated().size())
                    .resolvedErrors(diff.getResolved().size())
                    .remindersSent(remindersSent)
                    .notificationsSent(delivered)
                    .durationMs(elapsedMs(start))
                    .message(summary(diff, plan, delivered))
                    .build();
            log.info("Cycle completed: query_id={}, rows={}, new={}, resolved={}, reminders={}, notifications={}/{}, duration_ms={}",
                    query.getId(), done.getRowsReturned(), done.getNewErrors(), done.getResolvedErrors(),
                    reminders.size(), delivered, plan.size(), done.getDurationMs());
            return done;
        } catch (RuntimeException e) {
            log.error("Cycle failed: query_id={}", query.getId(), e);
            return result.status(ExecutionStatus.ERROR)
                    .rowsReturned(fetched.size())
                    .message("internal error: " + e.getMessage())
                    .durationMs(elapsedMs(start))
                    .build();
        }
    }

    private List<RoutedError> route(MonitoredQuery query, List<RoutingRule> rules, List<ActiveError> errors) {
        List<RoutedError> routed = new ArrayList<>(errors.size());
        for (ActiveError error : errors) {
            try {
                RoutingDecision decision = routingEngine.route(error, query, rules);
                if (decision.isSuppressed()) {
                    log.debug("No rule matched, error not notified: query_id={}, error_id={}", query.getId(), error.getId());
                }
                routed.add(new RoutedError(error, decision));
            } catch (RuntimeException e) {
                log.warn("Routing failed for error, skipping it: query_id={}, error_id={}", query.getId(), error.getId(), e);
            }
        }
        return routed;
    }

    private int dispatch(MonitoredQuery query, DeliveryPlan plan, Instant now) {
        int delivered = 0;
        for (NotificationKind kind : NotificationKind.values()) {
            Set<Long> deliveredErrorIds = new LinkedHashSet<>();
            for (DeliveryPlanEntry entry : plan.entriesOf(kind)) {
                DeliveryResult outcome;
                try {
                    outcome = dispatcher.send(entry.getDestination(), kind, entry.getErrors(), query);
                } catch (RuntimeException e) {
                    log.warn("Dispatcher failed: query_id={}, destination={}", query.getId(), entry.getDestination(), e);
                    outcome = DeliveryResult.failure(e.getMessage());
                }
                if (outcome.isSuccess()) {
                    delivered++;
                    entry.getErrors().forEach(c -> deliveredErrorIds.add(c.getErrorId()));
                }
            }
            if (!deliveredErrorIds.isEmpty()) {
                store.markNotified(deliveredErrorIds, kind, now);
            }
        }
        return delivered;
    }

    private void appendLogQuietly(ExecutionResult result) {
        if (result.getStatus() == ExecutionStatus.SKIPPED && !ALREADY_RUNNING.equals(result.getMessage())) {
            return;
        }
        try {
            store.appendLog(ExecutionLog.builder()
                    .queryId(result.getQueryId())
                    .executedAt(result.getStartedAt())
                    .status(result.getStatus())
                    .rowsReturned(result.getRowsReturned())
                    .newErrors(result.getNewErrors())
                    .resolvedErrors(result.getResolvedErrors())
                    .remindersSent(result.getRemindersSent())
                    .notificationsSent(result.getNotificationsSent())
                    .durationMs(result.getDurationMs())
                    .message(result.getMessage())
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to write execution log: query_id={}", result.getQueryId(), e);
        }
    }

    private static String summary(LifecycleDiff diff, DeliveryPlan plan, int delivered) {
        return diff.getRowsFetched() + " rows, " + diff.getCreated().size() + " new, "
                + diff.getResolved().size() + " resolved, " + delivered + "/" + plan.size() + " notifications delivered";
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
