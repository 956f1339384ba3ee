package io.b2mash.b2b.deliverytracker.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Published when an item changes parent or position, including indent/outdent. {@code oldKind} and
 * {@code newKind} differ when the move promoted or demoted the item.
 */
public record WorkItemMovedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID oldParentId,
    UUID newParentId,
    String oldKind,
    String newKind,
    String oldWbs,
    String newWbs)
    implements DomainEvent {}
