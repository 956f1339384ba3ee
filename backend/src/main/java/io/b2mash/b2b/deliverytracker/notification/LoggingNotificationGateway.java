package io.b2mash.b2b.deliverytracker.notification;

import io.b2mash.b2b.deliverytracker.event.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Writes completion events to the application log. */
@Component
public class LoggingNotificationGateway implements NotificationGateway {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationGateway.class);

  private final boolean enabled;

  public LoggingNotificationGateway(
      @Value("${tracker.notifications.log.enabled:true}") boolean enabled) {
    this.enabled = enabled;
  }

  @Override
  public String gatewayId() {
    return "log";
  }

  @Override
  public void deliver(DomainEvent event) {
    log.info(
        "Notification: {} on {} {} in project {} by {}",
        event.eventType(),
        event.entityType(),
        event.entityId(),
        event.projectId(),
        event.actorMemberId());
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }
}
