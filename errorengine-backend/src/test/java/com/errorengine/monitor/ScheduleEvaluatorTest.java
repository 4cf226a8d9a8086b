package com.errorengine.monitor;

import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.model.MonitoredQuery;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleEvaluatorTest {

    // 2024-03-04 is a Monday
    private static final Instant MONDAY_19 = Instant.parse("2024-03-04T19:00:00Z");

    private final ScheduleEvaluator evaluator = new ScheduleEvaluator(utc());

    private final MonitoredQuery query = MonitoredQuery.builder()
            .id(1L)
            .intervalMinutes(15)
            .windowStart(LocalTime.of(8, 0))
            .windowEnd(LocalTime.of(18, 0))
            .build();

    @Test
    void outsideTimeWindowIsSkipped() {
        assertThat(evaluator.skipReason(query, MONDAY_19)).hasValueSatisfying(r -> assertThat(r).contains("time window"));
    }

    @Test
    void windowStartIsInclusiveAndEndExclusive() {
        assertThat(evaluator.skipReason(query, Instant.parse("2024-03-04T08:00:00Z"))).isEmpty();
        assertThat(evaluator.skipReason(query, Instant.parse("2024-03-04T17:59:59Z"))).isEmpty();
        assertThat(evaluator.skipReason(query, Instant.parse("2024-03-04T18:00:00Z"))).isPresent();
    }

    @Test
    void checksRunInOrder() {
        MonitoredQuery inactiveAndWrongDay = query.toBuilder().active(false).activeDays(Set.of(DayOfWeek.SUNDAY)).build();
        MonitoredQuery wrongDay = query.toBuilder().activeDays(Set.of(DayOfWeek.SUNDAY)).build();

        assertThat(evaluator.skipReason(inactiveAndWrongDay, MONDAY_19)).contains("query is inactive");
        assertThat(evaluator.skipReason(wrongDay, MONDAY_19)).contains("not scheduled on MONDAY");
    }

    @Test
    void intervalCountsWholeMinutes() {
        MonitoredQuery noWindow = query.toBuilder().windowStart(null).windowEnd(null)
                .lastCheckAt(Instant.parse("2024-03-04T10:00:40Z")).build();

        assertThat(evaluator.skipReason(noWindow, Instant.parse("2024-03-04T10:14:59Z")))
                .hasValueSatisfying(r -> assertThat(r).contains("interval not elapsed (14 of 15 min)"));
        assertThat(evaluator.skipReason(noWindow, Instant.parse("2024-03-04T10:15:01Z"))).isEmpty();
        assertThat(ScheduleEvaluator.elapsedMinutes(Instant.parse("2024-03-04T10:00:59Z"),
                Instant.parse("2024-03-04T10:01:00Z"))).isEqualTo(1);
    }

    @Test
    void nextRunMovesToNextWindowOpening() {
        assertThat(evaluator.nextRunAt(query, MONDAY_19)).contains(Instant.parse("2024-03-05T08:00:00Z"));
    }

    @Test
    void nextRunSkipsDisallowedDays() {
        MonitoredQuery weekdays = query.toBuilder()
                .activeDays(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY))
                .build();

        // Friday 2024-03-08 evening -> Monday 08:00
        assertThat(evaluator.nextRunAt(weekdays, Instant.parse("2024-03-08T20:00:00Z")))
                .contains(Instant.parse("2024-03-11T08:00:00Z"));
    }

    @Test
    void nextRunWaitsForInterval() {
        MonitoredQuery checked = query.toBuilder().lastCheckAt(Instant.parse("2024-03-04T10:00:30Z")).build();

        assertThat(evaluator.nextRunAt(checked, Instant.parse("2024-03-04T10:05:00Z")))
                .contains(Instant.parse("2024-03-04T10:15:00Z"));
    }

    @Test
    void queriesThatCanNeverRunHaveNoNextRun() {
        assertThat(evaluator.nextRunAt(query.toBuilder().active(false).build(), MONDAY_19)).isEmpty();
        assertThat(evaluator.nextRunAt(query.toBuilder().activeDays(Set.of()).build(), MONDAY_19)).isEmpty();
    }

    private static ErrorEngineProperties utc() {
        ErrorEngineProperties properties = new ErrorEngineProperties();
        properties.setTimezone("UTC");
        return properties;
    }
}
