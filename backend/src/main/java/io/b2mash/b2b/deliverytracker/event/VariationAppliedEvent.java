package io.b2mash.b2b.deliverytracker.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record VariationAppliedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    String reference,
    String certificateNumber,
    BigDecimal totalCostImpact,
    int totalDaysImpact,
    List<UUID> baselineVersionIds)
    implements DomainEvent {}
