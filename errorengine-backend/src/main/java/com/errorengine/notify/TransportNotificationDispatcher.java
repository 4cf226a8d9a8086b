package com.errorengine.notify;

import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Dispatches each plan entry to the first transport that supports its destination and converts
 * transport failures into {@link DeliveryResult#failure(String)}.
 */
@Slf4j
@Service
public class TransportNotificationDispatcher implements NotificationDispatcher {

    private final List<NotificationTransport> transports;

    public TransportNotificationDispatcher(List<NotificationTransport> transports) {
        this.transports = List.copyOf(transports);
    }

    @Override
    public DeliveryResult send(Destination destination, NotificationKind kind, List<ErrorContext> errors, MonitoredQuery query) {
        NotificationTransport transport = transports.stream()
                .filter(t -> t.supports(destination))
                .findFirst()
                .orElse(null);
        if (transport == null) {
            log.warn("No transport for destination: query_id={}, destination={}", query.getId(), destination);
            return DeliveryResult.failure("no transport for " + destination.getKind());
        }
        try {
            DeliveryResult result = transport.deliver(destination, kind, errors, query);
            if (!result.isSuccess()) {
                log.warn("Notification not delivered: query_id={}, destination={}, kind={}, reason={}",
                        query.getId(), destination, kind, result.getMessage());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failure("interrupted");
        } catch (Exception e) {
            log.warn("Notification transport failed: query_id={}, destination={}, kind={}",
                    query.getId(), destination, kind, e);
            return DeliveryResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
