package io.b2mash.b2b.deliverytracker.notification;

import io.b2mash.b2b.deliverytracker.event.DomainEvent;

/**
 * Outbound notification channel for committed completion events. Delivery and retries are the
 * gateway's own business.
 */
public interface NotificationGateway {

  /** Unique identifier for this gateway (e.g. "log", "email"). */
  String gatewayId();

  void deliver(DomainEvent event);

  boolean isEnabled();
}
