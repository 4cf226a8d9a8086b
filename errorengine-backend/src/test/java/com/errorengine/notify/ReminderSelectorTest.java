package com.errorengine.notify;

import com.errorengine.model.ActiveError;
import com.errorengine.model.MonitoredQuery;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReminderSelectorTest {

    private static final Instant NOW = Instant.parse("2024-03-04T12:00:00Z");

    private final ReminderSelector selector = new ReminderSelector();

    private final MonitoredQuery query = MonitoredQuery.builder()
            .reminderIntervalMinutes(60)
            .reminderMaxCount(2)
            .build();

    @Test
    void selectsNotifiedErrorsPastTheInterval() {
        ActiveError due = notified(1L, NOW.minus(Duration.ofMinutes(60)), 0);
        ActiveError recent = notified(2L, NOW.minus(Duration.ofMinutes(59)), 0);

        assertThat(selector.select(query, List.of(due, recent), NOW)).containsExactly(due);
    }

    @Test
    void skipsErrorsNeverNotifiedOrAtTheCap() {
        ActiveError never = ActiveError.builder().id(1L).build();
        ActiveError capped = notified(2L, NOW.minus(Duration.ofHours(5)), 2);

        assertThat(selector.select(query, List.of(never, capped), NOW)).isEmpty();
    }

    @Test
    void zeroIntervalDisablesReminders() {
        MonitoredQuery disabled = query.toBuilder().reminderIntervalMinutes(0).build();

        assertThat(selector.select(disabled, List.of(notified(1L, NOW.minus(Duration.ofDays(1)), 0)), NOW)).isEmpty();
    }

    @Test
    void zeroCapMeansUnlimited() {
        MonitoredQuery unlimited = query.toBuilder().reminderMaxCount(0).build();
        ActiveError many = notified(1L, NOW.minus(Duration.ofHours(2)), 40);

        assertThat(selector.select(unlimited, List.of(many), NOW)).containsExactly(many);
    }

    private static ActiveError notified(Long id, Instant lastNotifiedAt, int reminders) {
        return ActiveError.builder().id(id).notified(true).lastNotifiedAt(lastNotifiedAt).reminderCount(reminders).build();
    }
}
