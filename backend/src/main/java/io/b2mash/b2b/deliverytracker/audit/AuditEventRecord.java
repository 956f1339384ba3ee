package io.b2mash.b2b.deliverytracker.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills in actor and request metadata.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g. "work_item", "signature")
 * @param entityId ID of the affected entity (not a FK, the entity may be soft-deleted later)
 * @param projectId owning project; null for events outside a project (security denials)
 * @param actorId member ID of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API or INTERNAL
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details key field changes as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
