package io.b2mash.b2b.deliverytracker.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** One party slot of a signature record was filled. {@code entityId} is the signed entity. */
public record SignatureAddedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID signatureRecordId,
    String entityKind,
    String party)
    implements DomainEvent {}
