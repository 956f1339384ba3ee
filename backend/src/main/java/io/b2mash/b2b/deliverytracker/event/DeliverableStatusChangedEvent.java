package io.b2mash.b2b.deliverytracker.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record DeliverableStatusChangedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    String oldStatus,
    String newStatus)
    implements DomainEvent {}
