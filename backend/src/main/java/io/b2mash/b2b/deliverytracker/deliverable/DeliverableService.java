package io.b2mash.b2b.deliverytracker.deliverable;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.member.ProjectCapability;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureService;
import io.b2mash.b2b.deliverytracker.workitem.ProgressRollup;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemKind;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Progress reporting and the review half of the deliverable lifecycle. */
@Service
public class DeliverableService {

  private static final Logger log = LoggerFactory.getLogger(DeliverableService.class);

  private final WorkItemRepository workItemRepository;
  private final ProgressRollup progressRollup;
  private final SignatureService signatureService;
  private final PermissionService permissionService;
  private final AuditService auditService;

  public DeliverableService(
      WorkItemRepository workItemRepository,
      ProgressRollup progressRollup,
      SignatureService signatureService,
      PermissionService permissionService,
      AuditService auditService) {
    this.workItemRepository = workItemRepository;
    this.progressRollup = progressRollup;
    this.signatureService = signatureService;
    this.permissionService = permissionService;
    this.auditService = auditService;
  }

  /**
   * Sets the progress of a task or of a deliverable without tasks, then rolls it up. A deliverable
   * with tasks takes its progress from them.
   */
  @Transactional
  public WorkItem updateProgress(UUID itemId, int progress, UUID actorId) {
    var item = requireLiveItem(itemId);
    permissionService.requireCapability(
        actorId, item.getProjectId(), ProjectCapability.SUBMIT_DELIVERABLE);
    int oldProgress = item.getProgress();

    switch (item.getKind()) {
      case TASK -> {
        item.updateTaskProgress(progress);
        progressRollup.rollUpFrom(item.getParentId(), actorId);
      }
      case DELIVERABLE -> {
        if (!workItemRepository.findLiveChildren(itemId).isEmpty()) {
          throw new InvalidStateException(
              "Progress derived from tasks",
              "Progress of deliverable "
                  + item.getItemRef()
                  + " is computed from its tasks; update the tasks instead");
        }
        var before = item.getDeliverableStatus();
        item.updateDeliverableProgress(progress);
        if (before != item.getDeliverableStatus()) {
          progressRollup.publishStatusChange(item, before.name(), actorId, "progress_update");
        }
      }
      case MILESTONE ->
          throw new InvalidStateException(
              "Progress derived from deliverables",
              "Milestone progress is computed from its deliverables and cannot be set");
    }

    log.info(
        "Progress of {} {} set from {} to {}",
        item.getKind(),
        item.getItemRef(),
        oldProgress,
        item.getProgress());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("work_item.progress_updated")
            .entityType("work_item")
            .entityId(item.getId())
            .projectId(item.getProjectId())
            .actorId(actorId)
            .details(
                Map.of(
                    "item_ref", item.getItemRef(),
                    "old_progress", oldProgress,
                    "new_progress", item.getProgress()))
            .build());

    return item;
  }

  @Transactional
  public WorkItem submitForReview(UUID deliverableId, UUID actorId) {
    var deliverable = requireLiveItem(deliverableId);
    permissionService.requireCapability(
        actorId, deliverable.getProjectId(), ProjectCapability.SUBMIT_DELIVERABLE);
    var before = deliverable.getDeliverableStatus();
    deliverable.submitForReview();
    progressRollup.publishStatusChange(deliverable, statusName(before), actorId, "submitted");
    return deliverable;
  }

  @Transactional
  public WorkItem returnForMoreWork(UUID deliverableId, String reason, UUID actorId) {
    var deliverable = requireLiveItem(deliverableId);
    permissionService.requireCapability(
        actorId, deliverable.getProjectId(), ProjectCapability.REVIEW_DELIVERABLE);
    var before = deliverable.getDeliverableStatus();
    deliverable.returnForMoreWork(reason, actorId);
    progressRollup.publishStatusChange(deliverable, statusName(before), actorId, "returned");
    return deliverable;
  }

  /** Accepts the review and opens the two-party sign-off. */
  @Transactional
  public WorkItem acceptReview(UUID deliverableId, UUID actorId) {
    var deliverable = requireLiveItem(deliverableId);
    permissionService.requireCapability(
        actorId, deliverable.getProjectId(), ProjectCapability.REVIEW_DELIVERABLE);
    var before = deliverable.getDeliverableStatus();
    deliverable.acceptReview(actorId);
    signatureService.open(
        SignatureEntityKind.DELIVERABLE, deliverable.getId(), deliverable.getProjectId(), actorId);
    progressRollup.publishStatusChange(deliverable, statusName(before), actorId, "review_accepted");
    return deliverable;
  }

  private WorkItem requireLiveItem(UUID itemId) {
    return workItemRepository
        .findLiveById(itemId)
        .orElseThrow(() -> new ResourceNotFoundException("Work item", itemId));
  }

  private static String statusName(DeliverableStatus status) {
    return status == null ? "NONE" : status.name();
  }
}
