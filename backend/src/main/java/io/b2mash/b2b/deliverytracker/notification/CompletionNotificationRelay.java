package io.b2mash.b2b.deliverytracker.notification;

import io.b2mash.b2b.deliverytracker.event.CertificateReadyToBillEvent;
import io.b2mash.b2b.deliverytracker.event.DomainEvent;
import io.b2mash.b2b.deliverytracker.event.SignatureCompletedEvent;
import io.b2mash.b2b.deliverytracker.event.VariationAppliedEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards completion events to every enabled {@link NotificationGateway} once the originating
 * transaction has committed. A failing gateway is logged and does not stop the others.
 */
@Component
public class CompletionNotificationRelay {

  private static final Logger log = LoggerFactory.getLogger(CompletionNotificationRelay.class);

  private final List<NotificationGateway> gateways;

  public CompletionNotificationRelay(List<NotificationGateway> gatewayBeans) {
    this.gateways = gatewayBeans.stream().filter(NotificationGateway::isEnabled).toList();
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onSignatureCompleted(SignatureCompletedEvent event) {
    relay(event);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onCertificateReadyToBill(CertificateReadyToBillEvent event) {
    relay(event);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onVariationApplied(VariationAppliedEvent event) {
    relay(event);
  }

  void relay(DomainEvent event) {
    for (NotificationGateway gateway : gateways) {
      try {
        gateway.deliver(event);
      } catch (Exception e) {
        log.error(
            "Failed to deliver {} for {} {} via gateway={}",
            event.eventType(),
            event.entityType(),
            event.entityId(),
            gateway.gatewayId(),
            e);
      }
    }
  }
}
