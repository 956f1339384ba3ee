package io.b2mash.b2b.deliverytracker.certificate;

import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
public class CertificateController {

  private final CertificateService certificateService;

  public CertificateController(CertificateService certificateService) {
    this.certificateService = certificateService;
  }

  @GetMapping("/api/milestones/{milestoneId}/certificate/readiness")
  public ResponseEntity<CertificateReadiness> getReadiness(
      @PathVariable UUID milestoneId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        certificateService.canGenerateCertificate(milestoneId, CurrentMember.id(jwt)));
  }

  @PostMapping("/api/milestones/{milestoneId}/certificate")
  public ResponseEntity<CertificateResponse> generate(
      @PathVariable UUID milestoneId, @AuthenticationPrincipal Jwt jwt) {
    var certificate = certificateService.generate(milestoneId, CurrentMember.id(jwt));
    return ResponseEntity.created(URI.create("/api/certificates/" + certificate.getId()))
        .body(CertificateResponse.from(certificate));
  }

  @GetMapping("/api/milestones/{milestoneId}/certificate")
  public ResponseEntity<CertificateResponse> getForMilestone(
      @PathVariable UUID milestoneId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        CertificateResponse.from(
            certificateService.getForMilestone(milestoneId, CurrentMember.id(jwt))));
  }

  @GetMapping("/api/certificates/{id}")
  public ResponseEntity<CertificateResponse> getCertificate(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        CertificateResponse.from(certificateService.getCertificate(id, CurrentMember.id(jwt))));
  }

  @PostMapping("/api/certificates/{id}/billed")
  public ResponseEntity<CertificateResponse> markBilled(
      @PathVariable UUID id,
      @Valid @RequestBody MarkBilledRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        CertificateResponse.from(
            certificateService.markBilled(id, request.invoiceRef(), CurrentMember.id(jwt))));
  }

  // --- DTOs ---

  public record MarkBilledRequest(
      @NotBlank(message = "invoiceRef is required") @Size(max = 100) String invoiceRef) {}

  public record CertificateResponse(
      UUID id,
      UUID milestoneId,
      String certificateNumber,
      CertificateStatus status,
      String statusLabel,
      BigDecimal milestoneValue,
      int deliverableCount,
      Instant generatedAt,
      Instant readyAt,
      Instant billedAt,
      String invoiceRef) {

    public static CertificateResponse from(AcceptanceCertificate certificate) {
      return new CertificateResponse(
          certificate.getId(),
          certificate.getMilestoneId(),
          certificate.getCertificateNumber(),
          certificate.getStatus(),
          certificate.getStatus().label(),
          certificate.getMilestoneValue(),
          certificate.getDeliverableCount(),
          certificate.getGeneratedAt(),
          certificate.getReadyAt(),
          certificate.getBilledAt(),
          certificate.getInvoiceRef());
    }
  }
}
