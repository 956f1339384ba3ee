package io.b2mash.b2b.deliverytracker.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Both party slots of a signature record are filled. Published exactly once per record, by the
 * transaction that won the completion mark; the kind-specific side effects have already run in
 * that same transaction.
 */
public record SignatureCompletedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID signatureRecordId,
    String entityKind,
    UUID providingSignerId,
    UUID receivingSignerId)
    implements DomainEvent {}
