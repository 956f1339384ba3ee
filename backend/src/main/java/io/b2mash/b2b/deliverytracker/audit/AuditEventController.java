package io.b2mash.b2b.deliverytracker.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping("/api/audit-events")
  @PreAuthorize("hasAnyRole('ORG_OWNER', 'ORG_ADMIN')")
  public ResponseEntity<Page<AuditEventResponse>> listAuditEvents(
      @RequestParam(required = false) UUID projectId,
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) UUID entityId,
      @RequestParam(required = false) UUID actorId,
      @RequestParam(required = false) String eventType,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {

    var filter = new AuditEventFilter(projectId, entityType, entityId, actorId, eventType, from, to);
    var pageable =
        PageRequest.of(page, Math.min(size, 200), Sort.by(Sort.Direction.DESC, "occurredAt"));
    var events = auditService.findEvents(filter, pageable);

    return ResponseEntity.ok(events.map(AuditEventResponse::from));
  }

  @GetMapping("/api/audit-events/stats")
  @PreAuthorize("hasAnyRole('ORG_OWNER', 'ORG_ADMIN')")
  public ResponseEntity<List<EventTypeCountResponse>> countByType() {
    return ResponseEntity.ok(
        auditService.countEventsByType().stream()
            .map(c -> new EventTypeCountResponse(c.getEventType(), c.getCount()))
            .toList());
  }

  // --- DTOs ---

  public record EventTypeCountResponse(String eventType, long count) {}

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      UUID projectId,
      UUID actorId,
      String actorType,
      String source,
      Map<String, Object> details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getProjectId(),
          event.getActorId(),
          event.getActorType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
