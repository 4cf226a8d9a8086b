package com.errorengine.monitor;

import com.errorengine.MutableClock;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.store.InMemoryMonitorStore;
import com.errorengine.store.MonitorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionLockRegistryTest {

    private final MonitorStore store = new InMemoryMonitorStore();
    private final MutableClock clock = MutableClock.at("2024-03-04T10:00:00Z");
    private final ExecutionLockRegistry locks = new ExecutionLockRegistry(store, clock);
    private long queryId;

    @BeforeEach
    void setUp() {
        queryId = store.saveQuery(MonitoredQuery.builder().name("q1").keyFields(List.of("ID")).build()).getId();
    }

    @Test
    void secondAcquireIsRejectedUntilRelease() {
        Optional<ExecutionLockRegistry.Lease> first = locks.tryAcquire(queryId);

        assertThat(first).isPresent();
        assertThat(locks.tryAcquire(queryId)).isEmpty();
        assertThat(locks.isHeld(queryId)).isTrue();
        assertThat(store.findQuery(queryId).orElseThrow().getLockedAt()).isEqualTo(Instant.parse("2024-03-04T10:00:00Z"));

        first.get().close();

        assertThat(locks.isHeld(queryId)).isFalse();
        assertThat(store.findQuery(queryId).orElseThrow().getLockedAt()).isNull();
        assertThat(locks.tryAcquire(queryId)).isPresent();
    }

    @Test
    void closingTwiceDoesNotReleaseANewerLease() {
        ExecutionLockRegistry.Lease old = locks.tryAcquire(queryId).orElseThrow();
        old.close();
        ExecutionLockRegistry.Lease current = locks.tryAcquire(queryId).orElseThrow();

        old.close();

        assertThat(locks.isHeld(queryId)).isTrue();
        assertThat(locks.heldQueryIds()).containsExactly(queryId);
        current.close();
    }

    @Test
    void staleMarkersAreClearedAtStartup() {
        store.markLocked(queryId, Instant.parse("2024-03-01T00:00:00Z"));

        assertThat(locks.recoverStaleLocks()).isEqualTo(1);
        assertThat(store.findQuery(queryId).orElseThrow().getLockedAt()).isNull();
    }
}
