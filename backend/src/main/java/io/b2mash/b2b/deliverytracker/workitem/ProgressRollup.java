package io.b2mash.b2b.deliverytracker.workitem;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.event.DeliverableStatusChangedEvent;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Feeds task progress upward. Each task and finally the owning deliverable store the rounded mean
 * of their live direct children. Rollup stops at a deliverable whose progress is locked (under
 * review or signed off) and never reaches milestones, whose progress is computed on read.
 */
@Component
public class ProgressRollup {

  private static final Logger log = LoggerFactory.getLogger(ProgressRollup.class);

  private final WorkItemRepository workItemRepository;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public ProgressRollup(
      WorkItemRepository workItemRepository,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.workItemRepository = workItemRepository;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  /** Recomputes stored progress starting at {@code parentId} and walking up to the deliverable. */
  public void rollUpFrom(UUID parentId, UUID actorId) {
    UUID currentId = parentId;
    while (currentId != null) {
      var current = workItemRepository.findLiveById(currentId).orElse(null);
      if (current == null || current.getKind() == WorkItemKind.MILESTONE) {
        return;
      }
      var children = workItemRepository.findLiveChildren(currentId);
      if (children.isEmpty()) {
        return;
      }
      int mean =
          (int)
              Math.round(children.stream().mapToInt(WorkItem::getProgress).average().orElse(0));

      if (current.getKind() == WorkItemKind.TASK) {
        current.updateTaskProgress(mean);
        currentId = current.getParentId();
        continue;
      }

      if (current.getDeliverableStatus().isProgressLocked()) {
        log.debug(
            "Skipping progress rollup into deliverable {} in status {}",
            current.getItemRef(),
            current.getDeliverableStatus());
        return;
      }
      var before = current.getDeliverableStatus();
      current.updateDeliverableProgress(mean);
      if (before != current.getDeliverableStatus()) {
        publishStatusChange(current, before.name(), actorId, "progress_rollup");
      }
      return;
    }
  }

  /** Audits and publishes a deliverable status change. */
  public void publishStatusChange(WorkItem deliverable, String oldStatus, UUID actorId, String cause) {
    String newStatus = deliverable.getDeliverableStatus().name();
    log.info(
        "Deliverable {} moved from {} to {} ({})",
        deliverable.getItemRef(),
        oldStatus,
        newStatus,
        cause);

    Map<String, Object> details =
        Map.of(
            "item_ref", deliverable.getItemRef(),
            "old_status", oldStatus,
            "new_status", newStatus,
            "cause", cause);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("deliverable.status_changed")
            .entityType("work_item")
            .entityId(deliverable.getId())
            .projectId(deliverable.getProjectId())
            .actorId(actorId)
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new DeliverableStatusChangedEvent(
            "deliverable.status_changed",
            "work_item",
            deliverable.getId(),
            deliverable.getProjectId(),
            actorId,
            Instant.now(),
            details,
            oldStatus,
            newStatus));
  }
}
