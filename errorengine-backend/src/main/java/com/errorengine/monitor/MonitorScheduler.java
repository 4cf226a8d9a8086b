package com.errorengine.monitor;

import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.store.MonitorStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the periodic tick. Each tick hands every active query that is neither running nor
 * still waiting for a worker to the worker pool; eligibility and locking are decided by
 * {@link MonitorOrchestrator}.
 */
@Component
public class MonitorScheduler {

    private static final Logger log = LoggerFactory.getLogger(MonitorScheduler.class);

    private final MonitorStore store;
    private final MonitorOrchestrator orchestrator;
    private final ExecutionLockRegistry locks;
    private final ErrorEngineProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService ticker =
            Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("errorengine-tick-"));
    private final ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<Long> queued = ConcurrentHashMap.newKeySet();
    private ScheduledFuture<?> tickTask;

    public MonitorScheduler(MonitorStore store, MonitorOrchestrator orchestrator, ExecutionLockRegistry locks,
                            ErrorEngineProperties properties, Clock clock) {
        this.store = store;
        this.orchestrator = orchestrator;
        this.locks = locks;
        this.properties = properties;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(Math.max(1, properties.getScheduler().getWorkerThreads()),
                new CustomizableThreadFactory("errorengine-worker-"));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Scheduler disabled, queries run only on demand");
            return;
        }
        start();
    }

    /**
     * Clear stale locks and begin ticking.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Scheduler already running");
            return;
        }
        locks.recoverStaleLocks();
        ErrorEngineProperties.Scheduler settings = properties.getScheduler();
        tickTask = ticker.scheduleAtFixedRate(this::tick, settings.getInitialDelaySeconds(),
                settings.getTickSeconds(), TimeUnit.SECONDS);
        log.info("Scheduler started: tick_seconds={}, worker_threads={}", settings.getTickSeconds(),
                settings.getWorkerThreads());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Submit every active query for evaluation. Returns the number submitted.
     */
    int tick() {
        Instant now = clock.instant();
        List<MonitoredQuery> queries;
        try {
            queries = store.findActiveQueries();
        } catch (RuntimeException e) {
            // an exception here would cancel the fixed-rate task
            log.error("Tick failed to load queries", e);
            return 0;
        }
        int submitted = 0;
        for (MonitoredQuery query : queries) {
            if (locks.isHeld(query.getId())) {
                log.debug("Query still running, not submitted: query_id={}", query.getId());
                continue;
            }
            if (!queued.add(query.getId())) {
                log.debug("Query still waiting for a worker, not submitted: query_id={}", query.getId());
                continue;
            }
            try {
                workers.submit(() -> runSafely(query, now));
                submitted++;
            } catch (RejectedExecutionException e) {
                queued.remove(query.getId());
                log.warn("Worker pool rejected query: query_id={}", query.getId());
            }
        }
        log.debug("Tick: active_queries={}, submitted={}", queries.size(), submitted);
        return submitted;
    }

    private void runSafely(MonitoredQuery query, Instant now) {
        try {
            orchestrator.maybeRun(query, now);
        } catch (RuntimeException e) {
            log.error("Unexpected failure running query: query_id={}", query.getId(), e);
        } finally {
            queued.remove(query.getId());
        }
    }

    /**
     * @return number of submitted queries that have not finished yet
     */
    int pendingCount() {
        return queued.size();
    }

    /**
     * Stop ticking and wait for in-flight executions to finish.
     */
    @PreDestroy
    public void stop() {
        running.set(false);
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        ticker.shutdownNow();
        workers.shutdown();
        int wait = properties.getScheduler().getShutdownWaitSeconds();
        try {
            if (!workers.awaitTermination(wait, TimeUnit.SECONDS)) {
                log.warn("Executions still running after {}s, interrupting", wait);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Scheduler stopped");
    }
}
