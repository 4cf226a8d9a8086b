package com.errorengine.notify;

import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationKind;

import java.util.List;

/**
 * Sends one aggregated notification. Implementations report failures through
 * {@link DeliveryResult#failure(String)} and do not throw.
 */
public interface NotificationDispatcher {

    DeliveryResult send(Destination destination, NotificationKind kind, List<ErrorContext> errors, MonitoredQuery query);
}
