package com.errorengine.notify;

import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * E-mail transport that writes the rendered message to the log instead of talking to a mail server.
 */
@Slf4j
@Component
public class LoggingEmailTransport implements NotificationTransport {

    private final ErrorEngineProperties properties;

    public LoggingEmailTransport(ErrorEngineProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean supports(Destination destination) {
        return destination.getKind() == Destination.Kind.EMAIL;
    }

    @Override
    public DeliveryResult deliver(Destination destination, NotificationKind kind, List<ErrorContext> errors, MonitoredQuery query) {
        String subject = NotificationMessages.subject(properties.getNotify().getSubjectPrefix(), kind, query, errors.size());
        log.info("E-mail notification: to={}, subject={}\n{}", destination.getAddress(), subject,
                NotificationMessages.plainBody(kind, query, errors));
        return DeliveryResult.success("logged");
    }
}
