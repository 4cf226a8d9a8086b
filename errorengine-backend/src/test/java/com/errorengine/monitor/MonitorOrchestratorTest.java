package com.errorengine.monitor;

import com.errorengine.MutableClock;
import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.lifecycle.ErrorLifecycleManager;
import com.errorengine.model.ActiveError;
import com.errorengine.model.ConditionOperator;
import com.errorengine.model.ExecutionLog;
import com.errorengine.model.ExecutionStatus;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationKind;
import com.errorengine.model.RoutingCondition;
import com.errorengine.model.RoutingRule;
import com.errorengine.model.SourceType;
import com.errorengine.notify.DeliveryResult;
import com.errorengine.notify.Destination;
import com.errorengine.notify.ErrorContext;
import com.errorengine.notify.NotificationDispatcher;
import com.errorengine.notify.RecipientAggregator;
import com.errorengine.notify.ReminderSelector;
import com.errorengine.routing.ConditionEvaluator;
import com.errorengine.routing.RoutingEngine;
import com.errorengine.source.SourceAdapter;
import com.errorengine.source.SourceErrorKind;
import com.errorengine.source.SourceException;
import com.errorengine.source.SourceFetcher;
import com.errorengine.source.SourceResult;
import com.errorengine.store.InMemoryMonitorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitorOrchestratorTest {

    private final MutableClock clock = MutableClock.at("2024-03-04T10:00:00Z");
    private final InMemoryMonitorStore store = new InMemoryMonitorStore();
    private final FakeAdapter adapter = new FakeAdapter();
    private final CapturingDispatcher dispatcher = new CapturingDispatcher();

    private SourceFetcher fetcher;
    private ExecutionLockRegistry locks;
    private MonitorOrchestrator orchestrator;
    private MonitoredQuery query;

    @BeforeEach
    void setUp() {
        ErrorEngineProperties properties = new ErrorEngineProperties();
        properties.setTimezone("UTC");
        fetcher = new SourceFetcher(List.of(adapter), properties);
        locks = new ExecutionLockRegistry(store, clock);
        orchestrator = new MonitorOrchestrator(store, new ScheduleEvaluator(properties), locks, fetcher,
                new ErrorLifecycleManager(), new RoutingEngine(new ConditionEvaluator()), new ReminderSelector(),
                new RecipientAggregator(), dispatcher, properties, clock);

        query = store.saveQuery(MonitoredQuery.builder()
                .name("Blocked orders")
                .sourceType(SourceType.HTTP)
                .keyFields(List.of("ORDER_ID"))
                .intervalMinutes(15)
                .defaultRecipients(List.of("support@x.com"))
                .build());
    }

    @AfterEach
    void tearDown() {
        adapter.release.countDown();
        fetcher.shutdown();
    }

    @Test
    void cyclesCreateUpdateAndResolveErrors() {
        adapter.rows = rows(1, 2, 3);
        ExecutionResult first = orchestrator.runNow(query.getId());

        assertThat(first.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(first.getNewErrors()).isEqualTo(3);
        assertThat(first.getNotificationsSent()).isEqualTo(1);
        assertThat(dispatcher.sent).singleElement().satisfies(s -> {
            assertThat(s.destination).isEqualTo(Destination.email("support@x.com"));
            assertThat(s.kind).isEqualTo(NotificationKind.NEW);
            assertThat(s.errors).hasSize(3);
        });
        assertThat(store.findUnresolvedErrors(query.getId())).allSatisfy(e -> assertThat(e.isNotified()).isTrue());

        clock.advance(Duration.ofMinutes(15));
        adapter.rows = rows(2, 3, 4);
        ExecutionResult second = orchestrator.runNow(query.getId());

        assertThat(second.getNewErrors()).isEqualTo(1);
        assertThat(second.getResolvedErrors()).isEqualTo(1);
        List<ActiveError> active = orchestrator.listActiveErrors(query.getId());
        assertThat(active).extracting(e -> e.getSignature().toString()).containsExactlyInAnyOrder("2", "3", "4");
        assertThat(active).filteredOn(e -> !e.getSignature().toString().equals("4"))
                .allSatisfy(e -> assertThat(e.getOccurrenceCount()).isEqualTo(2));
        assertThat(store.findQuery(query.getId()).orElseThrow().getLastCheckAt()).isEqualTo(clock.instant());
        assertThat(store.findLogs(query.getId(), 10)).hasSize(2);
    }

    @Test
    void concurrentRunsFetchOnce() throws Exception {
        adapter.rows = rows(1);
        adapter.block = true;

        CompletableFuture<ExecutionResult> running = CompletableFuture.supplyAsync(() -> orchestrator.runNow(query.getId()));
        assertThat(adapter.entered.await(5, TimeUnit.SECONDS)).isTrue();

        ExecutionResult loser = orchestrator.runNow(query.getId());
        adapter.release.countDown();
        ExecutionResult winner = running.get(5, TimeUnit.SECONDS);

        assertThat(loser.getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(loser.getMessage()).isEqualTo("already running");
        assertThat(winner.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(adapter.calls.get()).isEqualTo(1);
        assertThat(store.findLogs(query.getId(), 10)).extracting(ExecutionLog::getStatus)
                .containsExactlyInAnyOrder(ExecutionStatus.SKIPPED, ExecutionStatus.SUCCESS);
        assertThat(locks.isHeld(query.getId())).isFalse();
    }

    @Test
    void timedOutFetchReleasesLockAndLeavesStateAlone() {
        query = store.saveQuery(query.toBuilder().timeoutSeconds(1).build());
        adapter.rows = rows(1);
        adapter.block = true;

        ExecutionResult result = orchestrator.runNow(query.getId());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(result.getMessage()).contains("TIMEOUT");
        assertThat(locks.isHeld(query.getId())).isFalse();
        assertThat(store.findQuery(query.getId()).orElseThrow().getLastCheckAt()).isNull();
        assertThat(store.findUnresolvedErrors(query.getId())).isEmpty();
    }

    @Test
    void sourceFailureAbortsCycleWithoutResolvingErrors() {
        adapter.rows = rows(1, 2);
        orchestrator.runNow(query.getId());

        adapter.failure = new SourceException(SourceErrorKind.CONNECTION, "refused");
        clock.advance(Duration.ofMinutes(20));
        ExecutionResult result = orchestrator.runNow(query.getId());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(result.getMessage()).contains("CONNECTION").contains("refused");
        assertThat(store.findUnresolvedErrors(query.getId())).hasSize(2);
    }

    @Test
    void rowWithoutKeyFieldIsAnErrorResult() {
        Map<String, Object> bad = new LinkedHashMap<>();
        bad.put("SOMETHING", 1);
        adapter.rows = List.of(bad);

        ExecutionResult result = orchestrator.runNow(query.getId());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(result.getMessage()).contains("ORDER_ID");
        assertThat(store.findUnresolvedErrors(query.getId())).isEmpty();
    }

    @Test
    void failedDeliveryKeepsLifecycleButNotNotifiedFlag() {
        adapter.rows = rows(1);
        dispatcher.succeed = false;

        ExecutionResult result = orchestrator.runNow(query.getId());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.getNotificationsSent()).isZero();
        assertThat(store.findUnresolvedErrors(query.getId())).singleElement()
                .satisfies(e -> assertThat(e.isNotified()).isFalse());
    }

    @Test
    void remindersGoOutAfterTheInterval() {
        query = store.saveQuery(query.toBuilder().reminderIntervalMinutes(60).reminderMaxCount(1).build());
        adapter.rows = rows(1);
        orchestrator.runNow(query.getId());

        clock.advance(Duration.ofMinutes(30));
        assertThat(orchestrator.runNow(query.getId()).getRemindersSent()).isZero();

        clock.advance(Duration.ofMinutes(30));
        ExecutionResult due = orchestrator.runNow(query.getId());
        assertThat(due.getRemindersSent()).isEqualTo(1);
        assertThat(dispatcher.sent).extracting(s -> s.kind)
                .containsExactly(NotificationKind.NEW, NotificationKind.REMINDER);

        clock.advance(Duration.ofMinutes(120));
        assertThat(orchestrator.runNow(query.getId()).getRemindersSent()).isZero();
        assertThat(store.findUnresolvedErrors(query.getId()).get(0).getReminderCount()).isEqualTo(1);
    }

    @Test
    void routingRulesPickRecipients() {
        store.replaceRules(query.getId(), List.of(RoutingRule.builder()
                .name("EU")
                .priority(1)
                .stopOnMatch(true)
                .conditions(List.of(RoutingCondition.builder()
                        .fieldName("WAREHOUSE").operator(ConditionOperator.CONTAINS).value("EU").build()))
                .recipients(List.of("eu@x.com"))
                .build()));
        Map<String, Object> eu = row(1);
        eu.put("WAREHOUSE", "EU-NORTH");
        Map<String, Object> us = row(2);
        us.put("WAREHOUSE", "US-EAST");
        adapter.rows = List.of(eu, us);

        orchestrator.runNow(query.getId());

        assertThat(dispatcher.sent).extracting(s -> s.destination.getAddress())
                .containsExactlyInAnyOrder("eu@x.com", "support@x.com");
    }

    @Test
    void maybeRunOutsideWindowSkipsWithoutLockOrFetch() {
        query = store.saveQuery(query.toBuilder().windowStart(LocalTime.of(8, 0)).windowEnd(LocalTime.of(18, 0)).build());
        clock.set(Instant.parse("2024-03-04T19:00:00Z"));

        ExecutionResult result = orchestrator.maybeRun(query, clock.instant());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(result.getMessage()).contains("time window");
        assertThat(adapter.calls.get()).isZero();
        assertThat(store.findQuery(query.getId()).orElseThrow().getLockedAt()).isNull();
        assertThat(orchestrator.queryStatus(query.getId()).getLastOutcome()).isEqualTo(result);
    }

    @Test
    void outdatedSnapshotIsRecheckedAgainstStoredLastCheck() {
        adapter.rows = rows(1);
        MonitoredQuery snapshot = store.findQuery(query.getId()).orElseThrow();
        Instant tickTime = clock.instant();
        orchestrator.runNow(query.getId());
        clock.advance(Duration.ofMinutes(1));

        ExecutionResult result = orchestrator.maybeRun(snapshot, tickTime);

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(result.getMessage()).contains("interval not elapsed");
        assertThat(adapter.calls.get()).isEqualTo(1);
        assertThat(store.findQuery(query.getId()).orElseThrow().getLastCheckAt()).isEqualTo(tickTime);
        assertThat(store.findUnresolvedErrors(query.getId())).singleElement().satisfies(e -> {
            assertThat(e.getOccurrenceCount()).isEqualTo(1);
            assertThat(e.getLastSeenAt()).isEqualTo(tickTime);
        });
        assertThat(locks.isHeld(query.getId())).isFalse();
    }

    @Test
    void scheduledRunIsStampedWithCurrentTimeNotTickTime() {
        adapter.rows = rows(1);
        Instant tickTime = clock.instant();
        clock.advance(Duration.ofSeconds(30));

        ExecutionResult result = orchestrator.maybeRun(query, tickTime);

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.getStartedAt()).isEqualTo(clock.instant());
        assertThat(store.findQuery(query.getId()).orElseThrow().getLastCheckAt()).isEqualTo(clock.instant());
        assertThat(store.findUnresolvedErrors(query.getId())).singleElement()
                .satisfies(e -> assertThat(e.getFirstSeenAt()).isEqualTo(clock.instant()));
    }

    @Test
    void resolveManually() {
        adapter.rows = rows(1);
        orchestrator.runNow(query.getId());
        long errorId = store.findUnresolvedErrors(query.getId()).get(0).getId();

        ActiveError resolved = orchestrator.resolveManually(errorId);

        assertThat(resolved.isResolved()).isTrue();
        assertThat(resolved.getResolvedAt()).isEqualTo(clock.instant());
        assertThat(orchestrator.listActiveErrors(null)).isEmpty();
        assertThatThrownBy(() -> orchestrator.resolveManually(9999L)).isInstanceOf(ErrorNotFoundException.class);
    }

    @Test
    void unknownQueryIsRejected() {
        assertThatThrownBy(() -> orchestrator.runNow(404L)).isInstanceOf(QueryNotFoundException.class);
    }

    @Test
    void nextScheduledRunPicksSoonestQuery() {
        store.recordCheck(query.getId(), clock.instant(), 0, 0);
        MonitoredQuery other = store.saveQuery(MonitoredQuery.builder()
                .name("Late invoices").keyFields(List.of("ID")).intervalMinutes(5).build());
        store.recordCheck(other.getId(), clock.instant(), 0, 0);
        clock.advance(Duration.ofMinutes(2));

        NextScheduledRun next = orchestrator.getNextScheduledRun().orElseThrow();

        assertThat(next.getQueryId()).isEqualTo(other.getId());
        assertThat(next.getSecondsRemaining()).isEqualTo(180);
    }

    @Test
    void testSourceReturnsSampleRowsWithoutTouchingErrors() {
        adapter.rows = rows(1, 2, 3, 4, 5, 6, 7);

        var response = orchestrator.testSource(query.getId());

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getRowCount()).isEqualTo(7);
        assertThat(response.getSampleRows()).hasSize(5);
        assertThat(store.findUnresolvedErrors(query.getId())).isEmpty();
    }

    @Test
    void availableFieldsDescribeColumns() throws Exception {
        Map<String, Object> r = row(1);
        r.put("NOTE", "late");
        adapter.rows = List.of(r);

        assertThat(orchestrator.availableFields(query.getId()))
                .extracting(f -> f.getName() + ":" + f.getType())
                .containsExactly("ORDER_ID:number", "NOTE:string");
    }

    private static List<Map<String, Object>> rows(int... ids) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int id : ids) {
            rows.add(row(id));
        }
        return rows;
    }

    private static Map<String, Object> row(int id) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ORDER_ID", id);
        return row;
    }

    static class FakeAdapter implements SourceAdapter {
        volatile List<Map<String, Object>> rows = List.of();
        volatile SourceException failure;
        volatile boolean block;
        final AtomicInteger calls = new AtomicInteger();
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public SourceType sourceType() {
            return SourceType.HTTP;
        }

        @Override
        public SourceResult fetch(MonitoredQuery query, Duration timeout) throws SourceException {
            calls.incrementAndGet();
            entered.countDown();
            if (block) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SourceException(SourceErrorKind.TIMEOUT, "interrupted");
                }
            }
            if (failure != null) {
                throw failure;
            }
            List<String> columns = rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).keySet());
            List<Map<String, Object>> copy = new ArrayList<>();
            rows.forEach(r -> copy.add(new LinkedHashMap<>(r)));
            return new SourceResult(columns, copy);
        }
    }

    static class CapturingDispatcher implements NotificationDispatcher {
        final List<Sent> sent = Collections.synchronizedList(new ArrayList<>());
        volatile boolean succeed = true;

        @Override
        public DeliveryResult send(Destination destination, NotificationKind kind, List<ErrorContext> errors, MonitoredQuery query) {
            sent.add(new Sent(destination, kind, errors));
            return succeed ? DeliveryResult.success("ok") : DeliveryResult.failure("smtp down");
        }
    }

    record Sent(Destination destination, NotificationKind kind, List<ErrorContext> errors) {
    }
}
