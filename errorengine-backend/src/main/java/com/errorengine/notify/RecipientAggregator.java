package com.errorengine.notify;

import com.errorengine.model.AggregationMode;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.NotificationKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the routing decisions of one cycle by destination.
 *
 * <p>E-mail destinations come from each error's routing decision. Channel destinations are
 * aggregated independently: every active channel attached to the query receives every error that
 * was not suppressed by routing. Entry and error order follow the order errors were routed.
 */
@Component
public class RecipientAggregator {

    public List<DeliveryPlanEntry> aggregate(List<RoutedError> routed, List<NotificationChannel> channels,
                                             NotificationKind kind, AggregationMode mode) {
        Map<Destination, List<ErrorContext>> byDestination = new LinkedHashMap<>();
        List<ErrorContext> forChannels = new ArrayList<>();

        for (RoutedError routedError : routed) {
            if (routedError.getDecision().isSuppressed()) {
                continue;
            }
            ErrorContext context = ErrorContext.of(routedError.getError());
            forChannels.add(context);
            for (String recipient : routedError.getDecision().getRecipients()) {
                byDestination.computeIfAbsent(Destination.email(recipient), d -> new ArrayList<>()).add(context);
            }
        }

        if (!forChannels.isEmpty() && channels != null) {
            for (NotificationChannel channel : channels) {
                if (channel.isActive()) {
                    byDestination.computeIfAbsent(Destination.channel(channel), d -> new ArrayList<>()).addAll(forChannels);
                }
            }
        }

        List<DeliveryPlanEntry> entries = new ArrayList<>();
        for (Map.Entry<Destination, List<ErrorContext>> e : byDestination.entrySet()) {
            if (mode == AggregationMode.PER_ERROR) {
                for (ErrorContext context : e.getValue()) {
                    entries.add(new DeliveryPlanEntry(e.getKey(), kind, List.of(context)));
                }
            } else {
                entries.add(new DeliveryPlanEntry(e.getKey(), kind, List.copyOf(e.getValue())));
            }
        }
        return entries;
    }
}
