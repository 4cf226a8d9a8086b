package com.errorengine.notify;

import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationKind;

import java.util.List;

/**
 * One delivery mechanism (e-mail, HTTP channels). May throw; the dispatcher converts failures.
 */
public interface NotificationTransport {

    boolean supports(Destination destination);

    DeliveryResult deliver(Destination destination, NotificationKind kind, List<ErrorContext> errors, MonitoredQuery query)
            throws Exception;
}
