package io.b2mash.b2b.deliverytracker.certificate;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.exception.CertificateNotReadyException;
import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.member.ProjectCapability;
import io.b2mash.b2b.deliverytracker.milestone.MilestoneAggregation;
import io.b2mash.b2b.deliverytracker.milestone.MilestoneStatus;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import io.b2mash.b2b.deliverytracker.project.ProjectRepository;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureService;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemKind;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CertificateService {

  private static final Logger log = LoggerFactory.getLogger(CertificateService.class);

  private final AcceptanceCertificateRepository certificateRepository;
  private final WorkItemRepository workItemRepository;
  private final ProjectRepository projectRepository;
  private final SignatureService signatureService;
  private final PermissionService permissionService;
  private final AuditService auditService;

  public CertificateService(
      AcceptanceCertificateRepository certificateRepository,
      WorkItemRepository workItemRepository,
      ProjectRepository projectRepository,
      SignatureService signatureService,
      PermissionService permissionService,
      AuditService auditService) {
    this.certificateRepository = certificateRepository;
    this.workItemRepository = workItemRepository;
    this.projectRepository = projectRepository;
    this.signatureService = signatureService;
    this.permissionService = permissionService;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public CertificateReadiness canGenerateCertificate(UUID milestoneId, UUID memberId) {
    var milestone = requireMilestone(milestoneId);
    permissionService.roleFor(memberId, milestone.getProjectId());
    return evaluate(milestone, liveDeliverables(milestoneId));
  }

  /**
   * Generates the certificate in DRAFT with an open, unsigned signature record.
   *
   * @throws CertificateNotReadyException unless the milestone has deliverables and all are
   *     delivered
   * @throws ResourceConflictException if the milestone already has a certificate
   */
  @Transactional
  public AcceptanceCertificate generate(UUID milestoneId, UUID actorId) {
    var milestone = requireMilestone(milestoneId);
    permissionService.requireCapability(
        actorId, milestone.getProjectId(), ProjectCapability.MANAGE_PLAN);

    // serializes with structural changes in the milestone's subtree
    workItemRepository
        .lockById(milestoneId)
        .orElseThrow(() -> new ResourceNotFoundException("Milestone", milestoneId));

    if (certificateRepository.existsByMilestoneId(milestoneId)) {
      throw new ResourceConflictException(
          "Certificate exists",
          "Milestone " + milestone.getItemRef() + " already has an acceptance certificate");
    }
    var deliverables = liveDeliverables(milestoneId);
    var readiness = evaluate(milestone, deliverables);
    if (!readiness.ready()) {
      throw new CertificateNotReadyException("Certificate not ready", readiness.reason());
    }

    var project =
        projectRepository
            .findById(milestone.getProjectId())
            .orElseThrow(() -> new ResourceNotFoundException("Project", milestone.getProjectId()));
    String certificateNumber = project.getReference() + "-" + milestone.getItemRef() + "-CERT";
    var certificate =
        certificateRepository.save(
            new AcceptanceCertificate(
                milestone.getProjectId(),
                milestoneId,
                certificateNumber,
                milestone.getValue(),
                deliverables.size(),
                actorId));
    signatureService.open(
        SignatureEntityKind.ACCEPTANCE_CERTIFICATE,
        certificate.getId(),
        milestone.getProjectId(),
        actorId);

    log.info(
        "Generated certificate {} for milestone {} ({})",
        certificateNumber,
        milestone.getItemRef(),
        milestoneId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("certificate.generated")
            .entityType("acceptance_certificate")
            .entityId(certificate.getId())
            .projectId(milestone.getProjectId())
            .actorId(actorId)
            .details(
                Map.of(
                    "certificate_number", certificateNumber,
                    "milestone_id", milestoneId.toString(),
                    "deliverable_count", deliverables.size()))
            .build());

    return certificate;
  }

  /** Billing hook: records the invoice for a ready-to-bill certificate and flags the milestone. */
  @Transactional
  public AcceptanceCertificate markBilled(UUID certificateId, String invoiceRef, UUID actorId) {
    var certificate = requireCertificate(certificateId);
    permissionService.requireCapability(
        actorId, certificate.getProjectId(), ProjectCapability.RECORD_BILLING);
    certificate.markBilled(invoiceRef);
    workItemRepository.findLiveById(certificate.getMilestoneId()).ifPresent(WorkItem::markBilled);

    log.info("Certificate {} billed as {}", certificate.getCertificateNumber(), invoiceRef);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("certificate.billed")
            .entityType("acceptance_certificate")
            .entityId(certificate.getId())
            .projectId(certificate.getProjectId())
            .actorId(actorId)
            .details(
                Map.of(
                    "certificate_number", certificate.getCertificateNumber(),
                    "invoice_ref", invoiceRef))
            .build());

    return certificate;
  }

  @Transactional(readOnly = true)
  public AcceptanceCertificate getCertificate(UUID certificateId, UUID memberId) {
    var certificate = requireCertificate(certificateId);
    permissionService.roleFor(memberId, certificate.getProjectId());
    return certificate;
  }

  @Transactional(readOnly = true)
  public AcceptanceCertificate getForMilestone(UUID milestoneId, UUID memberId) {
    var milestone = requireMilestone(milestoneId);
    permissionService.roleFor(memberId, milestone.getProjectId());
    return certificateRepository
        .findByMilestoneId(milestoneId)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "No certificate",
                    "Milestone " + milestone.getItemRef() + " has no acceptance certificate"));
  }

  private CertificateReadiness evaluate(WorkItem milestone, List<WorkItem> deliverables) {
    if (certificateRepository.existsByMilestoneId(milestone.getId())) {
      return CertificateReadiness.notReady(
          "Milestone " + milestone.getItemRef() + " already has a certificate", List.of());
    }
    if (deliverables.isEmpty()) {
      return CertificateReadiness.notReady(
          "Milestone " + milestone.getItemRef() + " has no deliverables to certify", List.of());
    }
    var status =
        MilestoneAggregation.computeStatus(
            deliverables.stream().map(MilestoneAggregation.DeliverableSnapshot::of).toList());
    if (status == MilestoneStatus.COMPLETED) {
      return CertificateReadiness.allDelivered();
    }
    var blocking =
        deliverables.stream()
            .filter(d -> d.getDeliverableStatus() != DeliverableStatus.DELIVERED)
            .map(
                d ->
                    new CertificateReadiness.BlockingDeliverable(
                        d.getId(),
                        d.getItemRef(),
                        d.getName(),
                        d.getDeliverableStatus().label()))
            .toList();
    return CertificateReadiness.notReady(
        "Cannot generate a certificate until all deliverables are Delivered; still open: "
            + blocking.stream()
                .map(b -> b.itemRef() + " (" + b.status() + ")")
                .collect(Collectors.joining(", ")),
        blocking);
  }

  private List<WorkItem> liveDeliverables(UUID milestoneId) {
    return workItemRepository.findLiveChildrenOfKind(List.of(milestoneId), WorkItemKind.DELIVERABLE);
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

  private AcceptanceCertificate requireCertificate(UUID certificateId) {
    return certificateRepository
        .findById(certificateId)
        .orElseThrow(() -> new ResourceNotFoundException("Certificate", certificateId));
  }
}
