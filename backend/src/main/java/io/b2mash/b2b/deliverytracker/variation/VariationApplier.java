package io.b2mash.b2b.deliverytracker.variation;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.baseline.BaselineSource;
import io.b2mash.b2b.deliverytracker.baseline.BaselineVersionService;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.event.VariationAppliedEvent;
import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.project.ProjectRepository;
import io.b2mash.b2b.deliverytracker.signature.SignatureCompletionHandler;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureRecord;
import io.b2mash.b2b.deliverytracker.workitem.HierarchyService;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemAttributes;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemKind;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Applies a fully signed variation. Runs inside the completing signer's transaction, so a failure
 * at any step discards the new baseline versions, the hierarchy changes and the completing
 * signature together.
 */
@Component
public class VariationApplier implements SignatureCompletionHandler {

  private static final Logger log = LoggerFactory.getLogger(VariationApplier.class);

  private final VariationRepository variationRepository;
  private final VariationMilestoneImpactRepository impactRepository;
  private final VariationDeliverableChangeRepository changeRepository;
  private final WorkItemRepository workItemRepository;
  private final ProjectRepository projectRepository;
  private final HierarchyService hierarchyService;
  private final BaselineVersionService baselineVersionService;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public VariationApplier(
      VariationRepository variationRepository,
      VariationMilestoneImpactRepository impactRepository,
      VariationDeliverableChangeRepository changeRepository,
      WorkItemRepository workItemRepository,
      ProjectRepository projectRepository,
      HierarchyService hierarchyService,
      BaselineVersionService baselineVersionService,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.variationRepository = variationRepository;
    this.impactRepository = impactRepository;
    this.changeRepository = changeRepository;
    this.workItemRepository = workItemRepository;
    this.projectRepository = projectRepository;
    this.hierarchyService = hierarchyService;
    this.baselineVersionService = baselineVersionService;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  @Override
  public SignatureEntityKind kind() {
    return SignatureEntityKind.VARIATION;
  }

  @Override
  public void assertSignable(UUID entityId) {
    var variation = requireVariation(entityId);
    if (variation.getStatus() != VariationStatus.SUBMITTED) {
      throw new InvalidStateException(
          "Variation not submitted",
          "Variation "
              + variation.getReference()
              + " must be submitted before it can be signed, but is "
              + variation.getStatus());
    }
  }

  @Override
  public void onCompleted(SignatureRecord record, UUID completingSignerId) {
    var variation = requireVariation(record.getEntityId());
    var impacts = impactRepository.findByVariationIdOrderByCreatedAtAsc(variation.getId());
    var changes = changeRepository.findByVariationIdOrderByCreatedAtAsc(variation.getId());

    Map<UUID, VariationMilestoneImpact> impactByMilestone = new LinkedHashMap<>();
    impacts.forEach(impact -> impactByMilestone.put(impact.getMilestoneId(), impact));
    List<UUID> milestoneIds = new ArrayList<>(impactByMilestone.keySet());
    for (VariationDeliverableChange change : changes) {
      if (!milestoneIds.contains(change.getMilestoneId())) {
        milestoneIds.add(change.getMilestoneId());
      }
    }

    // 1. next baseline version per affected milestone
    List<UUID> versionIds = new ArrayList<>();
    for (UUID milestoneId : milestoneIds) {
      var milestone = requireMilestone(milestoneId);
      var impact = impactByMilestone.get(milestoneId);
      var version =
          baselineVersionService.recordVersion(
              milestone,
              BaselineSource.VARIATION,
              variation.getId(),
              newOrCurrent(impact == null ? null : impact.getNewStartDate(), milestone.getStartDate()),
              newOrCurrent(impact == null ? null : impact.getNewEndDate(), milestone.getEndDate()),
              impact == null || impact.getNewValue() == null
                  ? milestone.getValue()
                  : impact.getNewValue(),
              projectedDeliverables(milestone, changes),
              completingSignerId);
      versionIds.add(version.getId());
      if (impact != null) {
        impact.recordBaselineVersions(version.getVersionNumber() - 1, version.getVersionNumber());
      }
    }

    // 2. deliverable changes
    for (VariationDeliverableChange change : changes) {
      applyChange(variation, change, completingSignerId);
    }

    // 3. milestone dates and value
    for (VariationMilestoneImpact impact : impacts) {
      var milestone = requireMilestone(impact.getMilestoneId());
      hierarchyService.updateItem(
          milestone.getId(),
          new WorkItemAttributes(
              milestone.getName(),
              milestone.getDescription(),
              newOrCurrent(impact.getNewStartDate(), milestone.getStartDate()),
              newOrCurrent(impact.getNewEndDate(), milestone.getEndDate()),
              impact.getNewValue() == null ? milestone.getValue() : impact.getNewValue(),
              null,
              null),
          null,
          completingSignerId);
    }

    // 4. status and certificate number
    var project =
        projectRepository
            .findById(variation.getProjectId())
            .orElseThrow(() -> new ResourceNotFoundException("Project", variation.getProjectId()));
    String certificateNumber = project.getReference() + "-" + variation.getReference() + "-CERT";
    variation.markApplied(certificateNumber);

    log.info(
        "Applied variation {} ({}) with {} baseline versions and {} deliverable changes",
        variation.getReference(),
        variation.getId(),
        versionIds.size(),
        changes.size());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("reference", variation.getReference());
    details.put("certificate_number", certificateNumber);
    details.put("total_cost_impact", variation.getTotalCostImpact().toPlainString());
    details.put("total_days_impact", variation.getTotalDaysImpact());
    details.put("baseline_version_count", versionIds.size());
    details.put("deliverable_change_count", changes.size());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("variation.applied")
            .entityType("variation")
            .entityId(variation.getId())
            .projectId(variation.getProjectId())
            .actorId(completingSignerId)
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new VariationAppliedEvent(
            "variation.applied",
            "variation",
            variation.getId(),
            variation.getProjectId(),
            completingSignerId,
            Instant.now(),
            details,
            variation.getReference(),
            certificateNumber,
            variation.getTotalCostImpact(),
            variation.getTotalDaysImpact(),
            List.copyOf(versionIds)));
  }

  private void applyChange(Variation variation, VariationDeliverableChange change, UUID actorId) {
    switch (change.getChangeType()) {
      case ADD -> {
        var created =
            hierarchyService.createItem(
                variation.getProjectId(),
                WorkItemKind.DELIVERABLE,
                change.getMilestoneId(),
                new WorkItemAttributes(
                    change.getName(),
                    change.getDescription(),
                    change.getStartDate(),
                    change.getEndDate(),
                    null,
                    null,
                    null),
                actorId);
        change.recordCreatedDeliverable(created.getId());
      }
      case MODIFY -> {
        var deliverable = requireDeliverable(change.getDeliverableId());
        hierarchyService.updateItem(
            deliverable.getId(),
            new WorkItemAttributes(
                change.getName(),
                change.getDescription() == null
                    ? deliverable.getDescription()
                    : change.getDescription(),
                newOrCurrent(change.getStartDate(), deliverable.getStartDate()),
                newOrCurrent(change.getEndDate(), deliverable.getEndDate()),
                deliverable.getValue(),
                null,
                null),
            null,
            actorId);
      }
      case REMOVE -> {
        var deliverable = requireDeliverable(change.getDeliverableId());
        if (deliverable.getDeliverableStatus() == DeliverableStatus.DELIVERED) {
          throw new InvalidStateException(
              "Cannot remove delivered deliverable",
              "Variation "
                  + variation.getReference()
                  + " removes deliverable "
                  + deliverable.getItemRef()
                  + ", which has already been delivered");
        }
        hierarchyService.softDelete(deliverable.getId(), actorId);
      }
    }
  }

  /** The milestone's deliverables as they will stand once the changes are applied. */
  private List<Map<String, Object>> projectedDeliverables(
      WorkItem milestone, List<VariationDeliverableChange> changes) {
    Map<UUID, VariationDeliverableChange> modified = new LinkedHashMap<>();
    List<UUID> removed = new ArrayList<>();
    List<VariationDeliverableChange> added = new ArrayList<>();
    for (VariationDeliverableChange change : changes) {
      if (!change.getMilestoneId().equals(milestone.getId())) {
        continue;
      }
      switch (change.getChangeType()) {
        case ADD -> added.add(change);
        case MODIFY -> modified.put(change.getDeliverableId(), change);
        case REMOVE -> removed.add(change.getDeliverableId());
      }
    }

    List<Map<String, Object>> projected = new ArrayList<>();
    for (WorkItem deliverable :
        workItemRepository.findLiveChildrenOfKind(
            List.of(milestone.getId()), WorkItemKind.DELIVERABLE)) {
      if (removed.contains(deliverable.getId())) {
        continue;
      }
      var entry = BaselineVersionService.snapshotOf(deliverable);
      var change = modified.get(deliverable.getId());
      if (change != null) {
        entry.put("name", change.getName());
        entry.put(
            "start_date", dateOrNull(newOrCurrent(change.getStartDate(), deliverable.getStartDate())));
        entry.put("end_date", dateOrNull(newOrCurrent(change.getEndDate(), deliverable.getEndDate())));
      }
      projected.add(entry);
    }
    for (VariationDeliverableChange change : added) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", null);
      entry.put("item_ref", null);
      entry.put("name", change.getName());
      entry.put("start_date", dateOrNull(change.getStartDate()));
      entry.put("end_date", dateOrNull(change.getEndDate()));
      projected.add(entry);
    }
    return projected;
  }

  private static LocalDate newOrCurrent(LocalDate requested, LocalDate current) {
    return requested == null ? current : requested;
  }

  private static String dateOrNull(LocalDate date) {
    return date == null ? null : date.toString();
  }

  private Variation requireVariation(UUID variationId) {
    return variationRepository
        .findById(variationId)
        .orElseThrow(() -> new ResourceNotFoundException("Variation", variationId));
  }

  private WorkItem requireMilestone(UUID milestoneId) {
    return workItemRepository
        .findLiveById(milestoneId)
        .filter(item -> item.getKind() == WorkItemKind.MILESTONE)
        .orElseThrow(() -> new ResourceNotFoundException("Milestone", milestoneId));
  }

  private WorkItem requireDeliverable(UUID deliverableId) {
    return workItemRepository
        .findLiveById(deliverableId)
        .filter(item -> item.getKind() == WorkItemKind.DELIVERABLE)
        .orElseThrow(() -> new ResourceNotFoundException("Deliverable", deliverableId));
  }
}
