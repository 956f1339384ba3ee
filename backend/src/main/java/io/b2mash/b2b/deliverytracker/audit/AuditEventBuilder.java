package io.b2mash.b2b.deliverytracker.audit;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor, source, IP address,
 * and user agent from the current request when available.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}. Services pass the
 * actor explicitly; the security context is only a fallback.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("work_item.created")
 *     .entityType("work_item")
 *     .entityId(item.getId())
 *     .projectId(item.getProjectId())
 *     .actorId(actorId)
 *     .details(Map.of("kind", item.getKind().name()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID projectId;
  private UUID actorId;
  private String source;
  private Map<String, Object> details;

  private boolean sourceExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder projectId(UUID projectId) {
    this.projectId = projectId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    this.sourceExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record, filling in what was not set explicitly:
   *
   * <ul>
   *   <li>{@code actorId} from the authenticated JWT subject, if any
   *   <li>{@code actorType} = "USER" when an actor is known, "SYSTEM" otherwise
   *   <li>{@code source} = "API" inside an HTTP request, "INTERNAL" otherwise
   *   <li>{@code ipAddress} and {@code userAgent} from the servlet request
   * </ul>
   */
  public AuditEventRecord build() {
    UUID resolvedActorId = actorId != null ? actorId : resolveAuthenticatedMember();
    String resolvedActorType = resolvedActorId != null ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();

    String resolvedSource = this.source;
    if (!sourceExplicitlySet) {
      resolvedSource = request != null ? "API" : "INTERNAL";
    }

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    if (request != null) {
      resolvedIpAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        projectId,
        resolvedActorId,
        resolvedActorType,
        resolvedSource,
        resolvedIpAddress,
        resolvedUserAgent,
        details);
  }

  private static UUID resolveAuthenticatedMember() {
    var authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null
        && authentication.getPrincipal() instanceof Jwt jwt
        && jwt.getSubject() != null) {
      try {
        return UUID.fromString(jwt.getSubject());
      } catch (IllegalArgumentException e) {
        // subject is not a member id (service token)
        return null;
      }
    }
    return null;
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
