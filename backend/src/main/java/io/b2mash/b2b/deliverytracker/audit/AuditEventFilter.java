package io.b2mash.b2b.deliverytracker.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Query filter for {@link AuditService#findEvents}. All fields are nullable; null means "no filter
 * on this field".
 *
 * @param projectId filter by owning project
 * @param entityType filter by entity kind (e.g. "work_item", "signature")
 * @param entityId filter by specific entity
 * @param actorId filter by acting member
 * @param eventType prefix match, so "signature." matches signature.signed and signature.completed
 * @param from start of time range (inclusive)
 * @param to end of time range (exclusive)
 */
public record AuditEventFilter(
    UUID projectId,
    String entityType,
    UUID entityId,
    UUID actorId,
    String eventType,
    Instant from,
    Instant to) {}
