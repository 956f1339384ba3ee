package io.b2mash.b2b.deliverytracker.event;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** {@code entityId} is the parent whose children were reordered, or the project for roots. */
public record WorkItemReorderedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    List<UUID> orderedChildIds)
    implements DomainEvent {}
