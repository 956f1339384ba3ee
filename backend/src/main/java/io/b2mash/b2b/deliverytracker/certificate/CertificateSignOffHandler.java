package io.b2mash.b2b.deliverytracker.certificate;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.event.CertificateReadyToBillEvent;
import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.signature.SignatureCompletionHandler;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/** A fully signed acceptance certificate becomes ready to bill. */
@Component
public class CertificateSignOffHandler implements SignatureCompletionHandler {

  private static final Logger log = LoggerFactory.getLogger(CertificateSignOffHandler.class);

  private final AcceptanceCertificateRepository certificateRepository;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public CertificateSignOffHandler(
      AcceptanceCertificateRepository certificateRepository,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.certificateRepository = certificateRepository;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  @Override
  public SignatureEntityKind kind() {
    return SignatureEntityKind.ACCEPTANCE_CERTIFICATE;
  }

  @Override
  public void assertSignable(UUID entityId) {
    var certificate = requireCertificate(entityId);
    if (certificate.getStatus() != CertificateStatus.DRAFT) {
      throw new InvalidStateException(
          "Certificate not signable",
          "Certificate " + certificate.getCertificateNumber() + " is " + certificate.getStatus().label());
    }
  }

  @Override
  public void onCompleted(SignatureRecord record, UUID completingSignerId) {
    var certificate = requireCertificate(record.getEntityId());
    certificate.markReadyToBill();

    log.info("Certificate {} is ready to bill", certificate.getCertificateNumber());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("certificate_number", certificate.getCertificateNumber());
    details.put("milestone_id", certificate.getMilestoneId().toString());
    if (certificate.getMilestoneValue() != null) {
      details.put("milestone_value", certificate.getMilestoneValue().toPlainString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("certificate.ready_to_bill")
            .entityType("acceptance_certificate")
            .entityId(certificate.getId())
            .projectId(certificate.getProjectId())
            .actorId(completingSignerId)
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new CertificateReadyToBillEvent(
            "certificate.ready_to_bill",
            "acceptance_certificate",
            certificate.getId(),
            certificate.getProjectId(),
            completingSignerId,
            Instant.now(),
            details,
            certificate.getMilestoneId(),
            certificate.getCertificateNumber(),
            certificate.getMilestoneValue()));
  }

  private AcceptanceCertificate requireCertificate(UUID certificateId) {
    return certificateRepository
        .findById(certificateId)
        .orElseThrow(() -> new ResourceNotFoundException("Certificate", certificateId));
  }
}
