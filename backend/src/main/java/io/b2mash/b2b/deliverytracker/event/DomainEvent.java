package io.b2mash.b2b.deliverytracker.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for all domain events published via Spring ApplicationEventPublisher. All
 * implementations are records with primitive/UUID/enum-name fields only, never JPA entities, so
 * they stay valid after the publishing transaction commits and the persistence context closes.
 *
 * <p>Events carry enough context for a consumer (audit trail, billing, notifications) to act
 * without further queries.
 */
public sealed interface DomainEvent
    permits WorkItemCreatedEvent,
        WorkItemMovedEvent,
        WorkItemReorderedEvent,
        WorkItemDeletedEvent,
        DeliverableStatusChangedEvent,
        SignatureAddedEvent,
        SignatureCompletedEvent,
        BaselineVersionCreatedEvent,
        CertificateReadyToBillEvent,
        VariationAppliedEvent {

  String eventType();

  String entityType();

  UUID entityId();

  UUID projectId();

  UUID actorMemberId();

  Instant occurredAt();

  Map<String, Object> details();
}
