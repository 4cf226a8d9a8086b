package com.errorengine.notify;

import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TransportNotificationDispatcherTest {

    private final MonitoredQuery query = MonitoredQuery.builder().id(1L).name("q1").build();

    @Test
    void usesFirstSupportingTransport() throws Exception {
        NotificationTransport email = mock(NotificationTransport.class);
        NotificationTransport other = mock(NotificationTransport.class);
        when(email.supports(any())).thenReturn(true);
        when(email.deliver(any(), any(), any(), any())).thenReturn(DeliveryResult.success("ok"));

        TransportNotificationDispatcher dispatcher = new TransportNotificationDispatcher(List.of(email, other));
        DeliveryResult result = dispatcher.send(Destination.email("a@x.com"), NotificationKind.NEW, List.of(), query);

        assertThat(result.isSuccess()).isTrue();
        verify(other, never()).deliver(any(), any(), any(), any());
    }

    @Test
    void transportExceptionBecomesFailure() throws Exception {
        NotificationTransport broken = mock(NotificationTransport.class);
        when(broken.supports(any())).thenReturn(true);
        when(broken.deliver(any(), any(), any(), any())).thenThrow(new IOException("connection refused"));

        TransportNotificationDispatcher dispatcher = new TransportNotificationDispatcher(List.of(broken));
        DeliveryResult result = dispatcher.send(Destination.email("a@x.com"), NotificationKind.NEW, List.of(), query);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("connection refused");
    }

    @Test
    void missingTransportIsAFailure() {
        TransportNotificationDispatcher dispatcher = new TransportNotificationDispatcher(List.of());

        DeliveryResult result = dispatcher.send(Destination.email("a@x.com"), NotificationKind.REMINDER, List.of(), query);

        assertThat(result.isSuccess()).isFalse();
    }
}
