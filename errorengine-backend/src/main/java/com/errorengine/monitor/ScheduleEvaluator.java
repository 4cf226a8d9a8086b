package com.errorengine.monitor;

import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.model.MonitoredQuery;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a query may run now and when it will next be eligible.
 *
 * <p>Checks run in a fixed order: active flag, weekday, time window (start inclusive, end
 * exclusive, same day), then interval. The interval is measured in whole minutes between the
 * last check and now, both truncated to the minute, so a fixed tick does not drift by one tick
 * per run.
 */
@Component
public class ScheduleEvaluator {

    private final ZoneId zone;

    public ScheduleEvaluator(ErrorEngineProperties properties) {
        this.zone = properties.zoneId();
    }

    /**
     * @param query query
     * @param now current time
     * @return the first failing eligibility check, empty when the query may run
     */
    public Optional<String> skipReason(MonitoredQuery query, Instant now) {
        if (!query.isActive()) {
            return Optional.of("query is inactive");
        }
        ZonedDateTime local = now.atZone(zone);
        if (!dayAllowed(query, local.getDayOfWeek())) {
            return Optional.of("not scheduled on " + local.getDayOfWeek());
        }
        if (query.hasTimeWindow() && !insideWindow(query, local.toLocalTime())) {
            return Optional.of("outside time window " + query.getWindowStart() + "-" + query.getWindowEnd());
        }
        if (query.getLastCheckAt() != null) {
            long elapsed = elapsedMinutes(query.getLastCheckAt(), now);
            if (elapsed < query.getIntervalMinutes()) {
                return Optional.of("interval not elapsed (" + elapsed + " of " + query.getIntervalMinutes() + " min)");
            }
        }
        return Optional.empty();
    }

    /**
     * Earliest instant at or after {@code now} when the query passes every eligibility check.
     *
     * @param query query
     * @param now current time
     * @return next run time, empty for inactive queries or queries that can never run
     */
    public Optional<Instant> nextRunAt(MonitoredQuery query, Instant now) {
        if (!query.isActive()) {
            return Optional.empty();
        }
        Instant candidate = now;
        if (query.getLastCheckAt() != null) {
            Instant due = query.getLastCheckAt().truncatedTo(ChronoUnit.MINUTES)
                    .plus(Duration.ofMinutes(query.getIntervalMinutes()));
            if (due.isAfter(candidate)) {
                candidate = due;
            }
        }

        ZonedDateTime local = candidate.atZone(zone);
        // one pass per day is enough to find the next allowed weekday inside the window
        for (int i = 0; i <= 7; i++) {
            if (dayAllowed(query, local.getDayOfWeek())) {
                if (!query.hasTimeWindow()) {
                    return Optional.of(local.toInstant());
                }
                LocalTime t = local.toLocalTime();
                if (t.isBefore(query.getWindowStart())) {
                    return Optional.of(local.with(query.getWindowStart()).toInstant());
                }
                if (t.isBefore(query.getWindowEnd())) {
                    return Optional.of(local.toInstant());
                }
            }
            LocalTime dayStart = query.hasTimeWindow() ? query.getWindowStart() : LocalTime.MIDNIGHT;
            local = local.toLocalDate().plusDays(1).atTime(dayStart).atZone(zone);
        }
        return Optional.empty();
    }

    static long elapsedMinutes(Instant lastCheck, Instant now) {
        return Duration.between(lastCheck.truncatedTo(ChronoUnit.MINUTES), now.truncatedTo(ChronoUnit.MINUTES)).toMinutes();
    }

    private static boolean dayAllowed(MonitoredQuery query, DayOfWeek day) {
        Set<DayOfWeek> days = query.getActiveDays();
        return days != null && days.contains(day);
    }

    private static boolean insideWindow(MonitoredQuery query, LocalTime time) {
        return !time.isBefore(query.getWindowStart()) && time.isBefore(query.getWindowEnd());
    }
}
