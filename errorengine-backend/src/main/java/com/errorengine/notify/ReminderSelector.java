package com.errorengine.notify;

import com.errorengine.model.ActiveError;
import com.errorengine.model.MonitoredQuery;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Picks the errors that are due for a reminder: unresolved, already notified at least once, under
 * the query's reminder cap, and last notified at least the reminder interval ago. An interval of
 * zero disables reminders; a cap of zero or less means no cap.
 */
@Component
public class ReminderSelector {

    /**
     * @param query owning query
     * @param existing errors seen again in this cycle; errors created in the same cycle must not be passed
     * @param now cycle time
     * @return errors due for a reminder, in input order
     */
    public List<ActiveError> select(MonitoredQuery query, Collection<ActiveError> existing, Instant now) {
        int intervalMinutes = query.getReminderIntervalMinutes();
        if (intervalMinutes <= 0) {
            return List.of();
        }
        Duration interval = Duration.ofMinutes(intervalMinutes);
        int maxCount = query.getReminderMaxCount();

        return existing.stream()
                .filter(e -> !e.isResolved())
                .filter(ActiveError::isNotified)
                .filter(e -> e.getLastNotifiedAt() != null)
                .filter(e -> maxCount <= 0 || e.getReminderCount() < maxCount)
                .filter(e -> Duration.between(e.getLastNotifiedAt(), now).compareTo(interval) >= 0)
                .toList();
    }
}
