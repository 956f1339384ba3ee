package io.b2mash.b2b.deliverytracker.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** {@code entityId} is the new baseline version; consumed by the billing side. */
public record BaselineVersionCreatedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID milestoneId,
    int versionNumber,
    String source,
    UUID variationId)
    implements DomainEvent {}
