package io.b2mash.b2b.deliverytracker.milestone;

import io.b2mash.b2b.deliverytracker.baseline.BaselineStatus;
import io.b2mash.b2b.deliverytracker.baseline.BaselineVersion;
import io.b2mash.b2b.deliverytracker.baseline.BaselineVersionRepository;
import io.b2mash.b2b.deliverytracker.certificate.AcceptanceCertificate;
import io.b2mash.b2b.deliverytracker.certificate.AcceptanceCertificateRepository;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureRecord;
import io.b2mash.b2b.deliverytracker.signature.SignatureService;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemKind;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Milestone reads. Status, progress and baseline health are recomputed from the live deliverable
 * rows on every call and never cached.
 */
@Service
public class MilestoneViewService {

  private final WorkItemRepository workItemRepository;
  private final BaselineVersionRepository baselineVersionRepository;
  private final AcceptanceCertificateRepository certificateRepository;
  private final SignatureService signatureService;
  private final PermissionService permissionService;

  public MilestoneViewService(
      WorkItemRepository workItemRepository,
      BaselineVersionRepository baselineVersionRepository,
      AcceptanceCertificateRepository certificateRepository,
      SignatureService signatureService,
      PermissionService permissionService) {
    this.workItemRepository = workItemRepository;
    this.baselineVersionRepository = baselineVersionRepository;
    this.certificateRepository = certificateRepository;
    this.signatureService = signatureService;
    this.permissionService = permissionService;
  }

  @Transactional(readOnly = true)
  public MilestoneStatus computeStatus(UUID milestoneId) {
    requireMilestone(milestoneId);
    return MilestoneAggregation.computeStatus(snapshots(liveDeliverables(milestoneId)));
  }

  @Transactional(readOnly = true)
  public int computeProgress(UUID milestoneId) {
    requireMilestone(milestoneId);
    return MilestoneAggregation.computeProgress(snapshots(liveDeliverables(milestoneId)));
  }

  @Transactional(readOnly = true)
  public MilestoneView getView(UUID milestoneId, UUID memberId) {
    var milestone = requireMilestone(milestoneId);
    permissionService.roleFor(memberId, milestone.getProjectId());
    var latestBaseline =
        baselineVersionRepository.findTopByMilestoneIdOrderByVersionNumberDesc(milestoneId);
    return assemble(
        milestone,
        liveDeliverables(milestoneId),
        latestBaseline.orElse(null),
        certificateRepository.findByMilestoneId(milestoneId).orElse(null));
  }

  /**
   * Whether moving a deliverable's end date to {@code proposedEndDate} would breach the milestone.
   * A baselined milestone is checked against its latest baseline version, otherwise against its
   * own end date.
   */
  @Transactional(readOnly = true)
  public DeliverableDateCheck checkDeliverableDate(
      UUID milestoneId, LocalDate proposedEndDate, UUID memberId) {
    var milestone = requireMilestone(milestoneId);
    permissionService.roleFor(memberId, milestone.getProjectId());
    var latestBaseline =
        baselineVersionRepository.findTopByMilestoneIdOrderByVersionNumberDesc(milestoneId);
    LocalDate limit =
        latestBaseline.map(BaselineVersion::getEndDate).orElse(milestone.getEndDate());
    boolean wouldBreach = limit != null && proposedEndDate.isAfter(limit);
    return new DeliverableDateCheck(
        milestoneId, proposedEndDate, latestBaseline.isPresent(), limit, wouldBreach);
  }

  /** Views of every live milestone in the project, in WBS order. */
  @Transactional(readOnly = true)
  public List<MilestoneView> listViews(UUID projectId, UUID memberId) {
    permissionService.roleFor(memberId, projectId);
    var milestones = workItemRepository.findLiveRoots(projectId);
    if (milestones.isEmpty()) {
      return List.of();
    }
    var milestoneIds = milestones.stream().map(WorkItem::getId).toList();
    var deliverablesByMilestone = deliverablesByMilestone(milestoneIds);

    Map<UUID, BaselineVersion> latestBaselines = new HashMap<>();
    for (BaselineVersion version : baselineVersionRepository.findByMilestoneIds(milestoneIds)) {
      latestBaselines.merge(
          version.getMilestoneId(),
          version,
          (a, b) -> a.getVersionNumber() >= b.getVersionNumber() ? a : b);
    }
    Map<UUID, AcceptanceCertificate> certificates =
        certificateRepository.findByMilestoneIdIn(milestoneIds).stream()
            .collect(Collectors.toMap(AcceptanceCertificate::getMilestoneId, Function.identity()));

    return milestones.stream()
        .map(
            milestone ->
                assemble(
                    milestone,
                    deliverablesByMilestone.getOrDefault(milestone.getId(), List.of()),
                    latestBaselines.get(milestone.getId()),
                    certificates.get(milestone.getId())))
        .toList();
  }

  /** Milestones with their live deliverables, as one flat list per milestone. */
  @Transactional(readOnly = true)
  public List<MilestoneWithDeliverables> listWithDeliverables(UUID projectId, UUID memberId) {
    permissionService.roleFor(memberId, projectId);
    var milestones = workItemRepository.findLiveRoots(projectId);
    if (milestones.isEmpty()) {
      return List.of();
    }
    var deliverablesByMilestone =
        deliverablesByMilestone(milestones.stream().map(WorkItem::getId).toList());
    return milestones.stream()
        .map(
            milestone ->
                new MilestoneWithDeliverables(
                    milestone, deliverablesByMilestone.getOrDefault(milestone.getId(), List.of())))
        .toList();
  }

  private MilestoneView assemble(
      WorkItem milestone,
      List<WorkItem> deliverables,
      BaselineVersion latestBaseline,
      AcceptanceCertificate certificate) {
    var snapshots = snapshots(deliverables);
    int delivered =
        (int)
            deliverables.stream()
                .filter(d -> d.getDeliverableStatus() == DeliverableStatus.DELIVERED)
                .count();

    SignatureRecord openCommitment =
        latestBaseline != null
            ? null
            : signatureService
                .findActive(SignatureEntityKind.BASELINE_COMMITMENT, milestone.getId())
                .orElse(null);
    SignatureRecord certificateRecord =
        certificate == null
            ? null
            : signatureService
                .findActive(SignatureEntityKind.ACCEPTANCE_CERTIFICATE, certificate.getId())
                .orElse(null);

    LocalDate baselineEnd = latestBaseline == null ? null : latestBaseline.getEndDate();
    var breaching =
        baselineEnd == null
            ? List.<String>of()
            : deliverables.stream()
                .filter(d -> d.getEndDate() != null && d.getEndDate().isAfter(baselineEnd))
                .map(WorkItem::getItemRef)
                .toList();

    return new MilestoneView(
        milestone.getId(),
        milestone.getProjectId(),
        milestone.getItemRef(),
        milestone.getWbs(),
        milestone.getName(),
        milestone.getDescription(),
        milestone.getStartDate(),
        milestone.getEndDate(),
        milestone.getValue(),
        MilestoneAggregation.computeStatus(snapshots),
        MilestoneAggregation.computeProgress(snapshots),
        deliverables.size(),
        delivered,
        BaselineStatus.of(latestBaseline != null, openCommitment),
        latestBaseline == null ? null : latestBaseline.getVersionNumber(),
        certificate == null ? null : certificate.getStatus(),
        certificate == null ? null : certificate.getCertificateNumber(),
        certificateRecord == null ? null : certificateRecord.stage(),
        MilestoneAggregation.computeHealth(
            baselineEnd, deliverables.stream().map(WorkItem::getEndDate).toList()),
        baselineEnd,
        breaching);
  }

  private Map<UUID, List<WorkItem>> deliverablesByMilestone(List<UUID> milestoneIds) {
    return workItemRepository
        .findLiveChildrenOfKind(milestoneIds, WorkItemKind.DELIVERABLE)
        .stream()
        .collect(Collectors.groupingBy(WorkItem::getParentId));
  }

  private List<WorkItem> liveDeliverables(UUID milestoneId) {
    return workItemRepository.findLiveChildrenOfKind(List.of(milestoneId), WorkItemKind.DELIVERABLE);
  }

  private static List<MilestoneAggregation.DeliverableSnapshot> snapshots(
      List<WorkItem> deliverables) {
    return deliverables.stream().map(MilestoneAggregation.DeliverableSnapshot::of).toList();
  }

  private WorkItem requireMilestone(UUID milestoneId) {
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
