package io.b2mash.b2b.deliverytracker.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record CertificateReadyToBillEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID milestoneId,
    String certificateNumber,
    BigDecimal milestoneValue)
    implements DomainEvent {}
