package com.errorengine.monitor;

import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.store.MonitorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes old execution logs and resolved errors.
 */
@Service
public class RetentionCleanupService {

    private static final Logger log = LoggerFactory.getLogger(RetentionCleanupService.class);

    private final MonitorStore store;
    private final ErrorEngineProperties properties;
    private final Clock clock;

    public RetentionCleanupService(MonitorStore store, ErrorEngineProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${errorengine.retention.cron:0 0 3 * * *}")
    public void scheduledCleanup() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.error("Retention cleanup failed", e);
        }
    }

    /**
     * A retention of zero days or less disables that cleanup.
     */
    public void cleanup() {
        Instant now = clock.instant();
        ErrorEngineProperties.Retention retention = properties.getRetention();
        int logs = 0;
        int errors = 0;
        if (retention.getLogDays() > 0) {
            logs = store.deleteLogsBefore(now.minus(Duration.ofDays(retention.getLogDays())));
        }
        if (retention.getResolvedErrorDays() > 0) {
            errors = store.deleteResolvedErrorsBefore(now.minus(Duration.ofDays(retention.getResolvedErrorDays())));
        }
        log.info("Retention cleanup: deleted_logs={}, deleted_resolved_errors={}", logs, errors);
    }
}
