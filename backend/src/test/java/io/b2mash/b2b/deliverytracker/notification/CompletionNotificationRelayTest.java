package io.b2mash.b2b.deliverytracker.notification;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.deliverytracker.event.CertificateReadyToBillEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CompletionNotificationRelayTest {

  @Mock private NotificationGateway first;
  @Mock private NotificationGateway second;
  @Mock private NotificationGateway disabled;

  @Test
  void failingGatewayDoesNotStopTheOthers() {
    when(first.isEnabled()).thenReturn(true);
    when(second.isEnabled()).thenReturn(true);
    when(first.gatewayId()).thenReturn("webhook");
    var event = readyToBill();
    doThrow(new IllegalStateException("endpoint down")).when(first).deliver(event);

    var relay = new CompletionNotificationRelay(List.of(first, second));
    relay.onCertificateReadyToBill(event);

    verify(second).deliver(event);
  }

  @Test
  void disabledGatewaysAreSkipped() {
    when(first.isEnabled()).thenReturn(true);
    when(disabled.isEnabled()).thenReturn(false);
    var event = readyToBill();

    var relay = new CompletionNotificationRelay(List.of(first, disabled));
    relay.onCertificateReadyToBill(event);

    verify(first).deliver(event);
    verify(disabled, never()).deliver(event);
  }

  private static CertificateReadyToBillEvent readyToBill() {
    var certificateId = UUID.randomUUID();
    return new CertificateReadyToBillEvent(
        "certificate.ready_to_bill",
        "acceptance_certificate",
        certificateId,
        UUID.randomUUID(),
        UUID.randomUUID(),
        Instant.now(),
        Map.of(),
        UUID.randomUUID(),
        "PRJ-01-MS-001-CERT",
        new BigDecimal("25000.00"));
  }
}
