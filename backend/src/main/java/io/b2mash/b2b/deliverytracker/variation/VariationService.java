package io.b2mash.b2b.deliverytracker.variation;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.member.ProjectCapability;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import io.b2mash.b2b.deliverytracker.project.ProjectReferenceSequence;
import io.b2mash.b2b.deliverytracker.project.ProjectRepository;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureService;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemKind;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Drafting, submission, rejection and deletion of variations. Application happens when both
 * parties have signed; see {@link VariationApplier}.
 */
@Service
public class VariationService {

  private static final Logger log = LoggerFactory.getLogger(VariationService.class);

  private final VariationRepository variationRepository;
  private final VariationMilestoneImpactRepository impactRepository;
  private final VariationDeliverableChangeRepository changeRepository;
  private final WorkItemRepository workItemRepository;
  private final ProjectRepository projectRepository;
  private final ProjectReferenceSequence referenceSequence;
  private final SignatureService signatureService;
  private final PermissionService permissionService;
  private final AuditService auditService;

  public VariationService(
      VariationRepository variationRepository,
      VariationMilestoneImpactRepository impactRepository,
      VariationDeliverableChangeRepository changeRepository,
      WorkItemRepository workItemRepository,
      ProjectRepository projectRepository,
      ProjectReferenceSequence referenceSequence,
      SignatureService signatureService,
      PermissionService permissionService,
      AuditService auditService) {
    this.variationRepository = variationRepository;
    this.impactRepository = impactRepository;
    this.changeRepository = changeRepository;
    this.workItemRepository = workItemRepository;
    this.projectRepository = projectRepository;
    this.referenceSequence = referenceSequence;
    this.signatureService = signatureService;
    this.permissionService = permissionService;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<Variation> list(UUID projectId, UUID memberId) {
    permissionService.roleFor(memberId, projectId);
    return variationRepository.findByProjectIdOrderByCreatedAtDesc(projectId);
  }

  @Transactional(readOnly = true)
  public VariationDetails getDetails(UUID variationId, UUID memberId) {
    var variation = requireVariation(variationId);
    permissionService.roleFor(memberId, variation.getProjectId());
    return new VariationDetails(
        variation,
        impactRepository.findByVariationIdOrderByCreatedAtAsc(variationId),
        changeRepository.findByVariationIdOrderByCreatedAtAsc(variationId));
  }

  @Transactional
  public Variation create(
      UUID projectId,
      String title,
      String description,
      String reason,
      VariationType variationType,
      UUID actorId) {
    projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    permissionService.requireCapability(actorId, projectId, ProjectCapability.MANAGE_VARIATIONS);

    String reference = referenceSequence.next(projectId, "VAR");
    var variation =
        variationRepository.save(
            new Variation(projectId, reference, title, description, reason, variationType, actorId));

    log.info("Created variation {} ({}) in project {}", reference, variation.getId(), projectId);
    audit("variation.created", variation, actorId, Map.of("title", title, "type", variationType.name()));
    return variation;
  }

  @Transactional
  public Variation update(
      UUID variationId,
      String title,
      String description,
      String reason,
      VariationType variationType,
      UUID actorId) {
    var variation = requireVariation(variationId);
    requireManage(variation, actorId);
    variation.update(title, description, reason, variationType);

    log.info("Updated variation {} ({})", variation.getReference(), variationId);
    audit("variation.updated", variation, actorId, Map.of("title", title));
    return variation;
  }

  /**
   * Adds the requested dates and value for a milestone. The milestone's current values are kept
   * alongside so the impact can be computed.
   *
   * @throws ResourceConflictException if the variation already has an impact on the milestone
   */
  @Transactional
  public VariationMilestoneImpact addMilestoneImpact(
      UUID variationId,
      UUID milestoneId,
      LocalDate newStartDate,
      LocalDate newEndDate,
      BigDecimal newValue,
      String rationale,
      UUID actorId) {
    var variation = requireVariation(variationId);
    requireManage(variation, actorId);
    variation.requireDraft("change");
    var milestone = requireLiveOfKind(milestoneId, WorkItemKind.MILESTONE, variation);
    if (impactRepository.existsByVariationIdAndMilestoneId(variationId, milestoneId)) {
      throw new ResourceConflictException(
          "Impact exists",
          "Variation "
              + variation.getReference()
              + " already has an impact on milestone "
              + milestone.getItemRef());
    }

    var impact =
        impactRepository.save(
            new VariationMilestoneImpact(
                variationId,
                milestoneId,
                milestone.getStartDate(),
                milestone.getEndDate(),
                milestone.getValue(),
                newStartDate,
                newEndDate,
                newValue,
                rationale));

    log.info(
        "Added impact on milestone {} to variation {}", milestone.getItemRef(), variation.getReference());
    audit(
        "variation.impact_added",
        variation,
        actorId,
        Map.of("milestone_id", milestoneId.toString(), "impact_id", impact.getId().toString()));
    return impact;
  }

  /**
   * Adds a deliverable change. ADD targets a milestone and needs a name; MODIFY and REMOVE target
   * an existing deliverable, whose milestone becomes the change's milestone.
   */
  @Transactional
  public VariationDeliverableChange addDeliverableChange(
      UUID variationId, DeliverableChangeRequest request, UUID actorId) {
    var variation = requireVariation(variationId);
    requireManage(variation, actorId);
    variation.requireDraft("change");

    UUID milestoneId;
    UUID deliverableId = null;
    if (request.changeType() == DeliverableChangeType.ADD) {
      if (request.milestoneId() == null || isBlank(request.name())) {
        throw new InvalidStateException(
            "Invalid deliverable change", "Adding a deliverable needs a milestone and a name");
      }
      milestoneId = requireLiveOfKind(request.milestoneId(), WorkItemKind.MILESTONE, variation).getId();
    } else {
      if (request.deliverableId() == null) {
        throw new InvalidStateException(
            "Invalid deliverable change",
            request.changeType() + " needs the deliverable it applies to");
      }
      if (request.changeType() == DeliverableChangeType.MODIFY && isBlank(request.name())) {
        throw new InvalidStateException(
            "Invalid deliverable change", "Modifying a deliverable needs a name");
      }
      var deliverable =
          requireLiveOfKind(request.deliverableId(), WorkItemKind.DELIVERABLE, variation);
      milestoneId = deliverable.getParentId();
      deliverableId = deliverable.getId();
    }

    var change =
        changeRepository.save(
            new VariationDeliverableChange(
                variationId,
                request.changeType(),
                milestoneId,
                deliverableId,
                request.name(),
                request.description(),
                request.startDate(),
                request.endDate(),
                request.removalReason()));

    log.info(
        "Added {} change to variation {} ({})",
        request.changeType(),
        variation.getReference(),
        change.getId());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("change_id", change.getId().toString());
    details.put("change_type", request.changeType().name());
    details.put("milestone_id", milestoneId.toString());
    if (deliverableId != null) {
      details.put("deliverable_id", deliverableId.toString());
    }
    audit("variation.change_added", variation, actorId, details);
    return change;
  }

  /** Removes a milestone impact or a deliverable change from a draft variation. */
  @Transactional
  public void removeChange(UUID variationId, UUID changeId, UUID actorId) {
    var variation = requireVariation(variationId);
    requireManage(variation, actorId);
    variation.requireDraft("change");

    var impact = impactRepository.findById(changeId).filter(i -> i.getVariationId().equals(variationId));
    if (impact.isPresent()) {
      impactRepository.delete(impact.get());
    } else {
      var change =
          changeRepository
              .findById(changeId)
              .filter(c -> c.getVariationId().equals(variationId))
              .orElseThrow(() -> new ResourceNotFoundException("Variation change", changeId));
      changeRepository.delete(change);
    }

    log.info("Removed change {} from variation {}", changeId, variation.getReference());
    audit("variation.change_removed", variation, actorId, Map.of("change_id", changeId.toString()));
  }

  /**
   * Computes the cost and day totals from the milestone impacts and opens the variation's
   * signature record.
   *
   * @throws InvalidStateException if the variation has neither impacts nor changes
   */
  @Transactional
  public Variation submit(UUID variationId, UUID actorId) {
    var variation = requireVariation(variationId);
    requireManage(variation, actorId);

    var impacts = impactRepository.findByVariationIdOrderByCreatedAtAsc(variationId);
    var changes = changeRepository.findByVariationIdOrderByCreatedAtAsc(variationId);
    if (impacts.isEmpty() && changes.isEmpty()) {
      throw new InvalidStateException(
          "Empty variation",
          "Variation " + variation.getReference() + " has no milestone impacts or deliverable changes");
    }

    BigDecimal totalCost = BigDecimal.ZERO;
    int totalDays = 0;
    for (VariationMilestoneImpact impact : impacts) {
      totalCost = totalCost.add(impact.costImpact());
      totalDays += impact.daysImpact();
    }
    variation.submit(totalCost, totalDays);
    signatureService.open(
        SignatureEntityKind.VARIATION, variationId, variation.getProjectId(), actorId);

    log.info(
        "Submitted variation {} ({}): cost impact {}, {} days",
        variation.getReference(),
        variationId,
        totalCost,
        totalDays);
    audit(
        "variation.submitted",
        variation,
        actorId,
        Map.of("total_cost_impact", totalCost.toPlainString(), "total_days_impact", totalDays));
    return variation;
  }

  /** Rejects a submitted variation and retires its signature record. */
  @Transactional
  public Variation reject(UUID variationId, String reason, UUID actorId) {
    var variation = requireVariation(variationId);
    permissionService.requireCapability(
        actorId, variation.getProjectId(), ProjectCapability.REVIEW_VARIATIONS);

    variation.reject(reason, actorId);
    signatureService.supersede(SignatureEntityKind.VARIATION, variationId, actorId);

    log.info("Rejected variation {} ({})", variation.getReference(), variationId);
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("reason", reason);
    audit("variation.rejected", variation, actorId, details);
    return variation;
  }

  @Transactional
  public Variation resetToDraft(UUID variationId, UUID actorId) {
    var variation = requireVariation(variationId);
    requireManage(variation, actorId);
    variation.resetToDraft();

    log.info("Reset variation {} ({}) to draft", variation.getReference(), variationId);
    audit("variation.reset", variation, actorId, Map.of());
    return variation;
  }

  /** Deletes an unapplied variation with its impacts and changes. */
  @Transactional
  public void delete(UUID variationId, UUID actorId) {
    var variation = requireVariation(variationId);
    requireManage(variation, actorId);
    if (!variation.getStatus().isDeletable()) {
      throw new InvalidStateException(
          "Variation applied", "Variation " + variation.getReference() + " has been applied");
    }
    signatureService.supersede(SignatureEntityKind.VARIATION, variationId, actorId);

    changeRepository.deleteByVariationId(variationId);
    impactRepository.deleteByVariationId(variationId);
    variationRepository.delete(variation);

    log.info("Deleted variation {} ({})", variation.getReference(), variationId);
    audit("variation.deleted", variation, actorId, Map.of("status", variation.getStatus().name()));
  }

  private void requireManage(Variation variation, UUID actorId) {
    permissionService.requireCapability(
        actorId, variation.getProjectId(), ProjectCapability.MANAGE_VARIATIONS);
  }

  private Variation requireVariation(UUID variationId) {
    return variationRepository
        .findById(variationId)
        .orElseThrow(() -> new ResourceNotFoundException("Variation", variationId));
  }

  private WorkItem requireLiveOfKind(UUID itemId, WorkItemKind kind, Variation variation) {
    String label = kind == WorkItemKind.MILESTONE ? "Milestone" : "Deliverable";
    var item =
        workItemRepository
            .findLiveById(itemId)
            .filter(i -> i.getKind() == kind)
            .orElseThrow(() -> new ResourceNotFoundException(label, itemId));
    if (!item.getProjectId().equals(variation.getProjectId())) {
      throw new ResourceNotFoundException(label, itemId);
    }
    return item;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private void audit(String eventType, Variation variation, UUID actorId, Map<String, Object> details) {
    Map<String, Object> withRef = new LinkedHashMap<>(details);
    withRef.put("reference", variation.getReference());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("variation")
            .entityId(variation.getId())
            .projectId(variation.getProjectId())
            .actorId(actorId)
            .details(withRef)
            .build());
  }

  /** Input for {@link #addDeliverableChange}. */
  public record DeliverableChangeRequest(
      DeliverableChangeType changeType,
      UUID milestoneId,
      UUID deliverableId,
      String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      String removalReason) {}

  public record VariationDetails(
      Variation variation,
      List<VariationMilestoneImpact> impacts,
      List<VariationDeliverableChange> changes) {}
}
