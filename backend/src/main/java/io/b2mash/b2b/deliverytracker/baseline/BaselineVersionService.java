package io.b2mash.b2b.deliverytracker.baseline;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.event.BaselineVersionCreatedEvent;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemKind;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Writes and reads the baseline history of milestones. */
@Service
public class BaselineVersionService {

  private static final Logger log = LoggerFactory.getLogger(BaselineVersionService.class);

  private final BaselineVersionRepository baselineVersionRepository;
  private final WorkItemRepository workItemRepository;
  private final PermissionService permissionService;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public BaselineVersionService(
      BaselineVersionRepository baselineVersionRepository,
      WorkItemRepository workItemRepository,
      PermissionService permissionService,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.baselineVersionRepository = baselineVersionRepository;
    this.workItemRepository = workItemRepository;
    this.permissionService = permissionService;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Writes the next version for the milestone. Only called from signature completion handlers, in
   * the completing transaction; the unique (milestone, version) constraint rejects a concurrent
   * duplicate number.
   */
  @Transactional
  public BaselineVersion recordVersion(
      WorkItem milestone,
      BaselineSource source,
      UUID variationId,
      LocalDate startDate,
      LocalDate endDate,
      BigDecimal value,
      List<Map<String, Object>> deliverables,
      UUID actorId) {
    int versionNumber = baselineVersionRepository.findMaxVersionNumber(milestone.getId()) + 1;
    var version =
        baselineVersionRepository.save(
            new BaselineVersion(
                milestone.getProjectId(),
                milestone.getId(),
                versionNumber,
                source,
                variationId,
                startDate,
                endDate,
                value,
                deliverables,
                actorId));

    log.info(
        "Recorded baseline v{} for milestone {} ({}) from {}",
        versionNumber,
        milestone.getItemRef(),
        milestone.getId(),
        source);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("milestone_ref", milestone.getItemRef());
    details.put("version_number", versionNumber);
    details.put("source", source.name());
    details.put("deliverable_count", deliverables.size());
    if (variationId != null) {
      details.put("variation_id", variationId.toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("baseline.version_created")
            .entityType("baseline_version")
            .entityId(version.getId())
            .projectId(milestone.getProjectId())
            .actorId(actorId)
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new BaselineVersionCreatedEvent(
            "baseline.version_created",
            "baseline_version",
            version.getId(),
            milestone.getProjectId(),
            actorId,
            Instant.now(),
            details,
            milestone.getId(),
            versionNumber,
            source.name(),
            variationId));

    return version;
  }

  @Transactional(readOnly = true)
  public List<BaselineVersion> history(UUID milestoneId, UUID memberId) {
    var milestone = requireMilestone(milestoneId);
    permissionService.roleFor(memberId, milestone.getProjectId());
    return baselineVersionRepository.findByMilestoneIdOrderByVersionNumberAsc(milestoneId);
  }

  @Transactional(readOnly = true)
  public BaselineVersion current(UUID milestoneId, UUID memberId) {
    var milestone = requireMilestone(milestoneId);
    permissionService.roleFor(memberId, milestone.getProjectId());
    return baselineVersionRepository
        .findTopByMilestoneIdOrderByVersionNumberDesc(milestoneId)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "No baseline",
                    "Milestone " + milestone.getItemRef() + " has no committed baseline yet"));
  }

  /** JSON snapshot entry for a live deliverable. */
  public static Map<String, Object> snapshotOf(WorkItem deliverable) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("id", deliverable.getId().toString());
    entry.put("item_ref", deliverable.getItemRef());
    entry.put("name", deliverable.getName());
    entry.put("start_date", dateOrNull(deliverable.getStartDate()));
    entry.put("end_date", dateOrNull(deliverable.getEndDate()));
    return entry;
  }

  static String dateOrNull(LocalDate date) {
    return date == null ? null : date.toString();
  }

  WorkItem requireMilestone(UUID milestoneId) {
    var milestone =
        workItemRepository
            .findLiveById(milestoneId)
            .orElseThrow(() -> new ResourceNotFoundException("Milestone", milestoneId));
    if (milestone.getKind() != WorkItemKind.MILESTONE) {
      throw new ResourceNotFoundException("Milestone", milestoneId);
    }
    return milestone;
  }
}
