package io.b2mash.b2b.deliverytracker.baseline;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.member.ProjectCapability;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureRecord;
import io.b2mash.b2b.deliverytracker.signature.SignatureService;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Entry point of the baseline commitment workflow for a milestone. */
@Service
public class BaselineCommitmentService {

  private static final Logger log = LoggerFactory.getLogger(BaselineCommitmentService.class);

  private final BaselineVersionService baselineVersionService;
  private final BaselineVersionRepository baselineVersionRepository;
  private final SignatureService signatureService;
  private final PermissionService permissionService;
  private final AuditService auditService;

  public BaselineCommitmentService(
      BaselineVersionService baselineVersionService,
      BaselineVersionRepository baselineVersionRepository,
      SignatureService signatureService,
      PermissionService permissionService,
      AuditService auditService) {
    this.baselineVersionService = baselineVersionService;
    this.baselineVersionRepository = baselineVersionRepository;
    this.signatureService = signatureService;
    this.permissionService = permissionService;
    this.auditService = auditService;
  }

  /**
   * Opens the commitment signature record. A milestone is committed once; later changes to a
   * locked baseline go through variations.
   */
  @Transactional
  public SignatureRecord requestCommitment(UUID milestoneId, UUID actorId) {
    var milestone = baselineVersionService.requireMilestone(milestoneId);
    permissionService.requireCapability(
        actorId, milestone.getProjectId(), ProjectCapability.MANAGE_PLAN);
    if (baselineVersionRepository.existsByMilestoneId(milestoneId)) {
      throw new ResourceConflictException(
          "Baseline locked",
          "The baseline of milestone "
              + milestone.getItemRef()
              + " is already committed; change it through a variation");
    }

    var record =
        signatureService.open(
            SignatureEntityKind.BASELINE_COMMITMENT, milestoneId, milestone.getProjectId(), actorId);

    log.info("Requested baseline commitment for milestone {} ({})", milestone.getItemRef(), milestoneId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("baseline.commitment_requested")
            .entityType("milestone")
            .entityId(milestoneId)
            .projectId(milestone.getProjectId())
            .actorId(actorId)
            .details(Map.of("milestone_ref", milestone.getItemRef()))
            .build());

    return record;
  }

  @Transactional(readOnly = true)
  public BaselineStatus status(UUID milestoneId, UUID memberId) {
    var milestone = baselineVersionService.requireMilestone(milestoneId);
    permissionService.roleFor(memberId, milestone.getProjectId());
    return BaselineStatus.of(
        baselineVersionRepository.existsByMilestoneId(milestoneId),
        signatureService
            .findActive(SignatureEntityKind.BASELINE_COMMITMENT, milestoneId)
            .orElse(null));
  }
}
