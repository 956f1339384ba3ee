package io.b2mash.b2b.deliverytracker.certificate;

import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Milestone acceptance certificate. At most one per milestone. Signatures live on the
 * certificate's {@code ACCEPTANCE_CERTIFICATE} signature record; this entity only tracks the
 * billing status.
 */
@Entity
@Table(name = "acceptance_certificates")
public class AcceptanceCertificate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "milestone_id", nullable = false, updatable = false)
  private UUID milestoneId;

  @Column(name = "certificate_number", nullable = false, updatable = false, length = 80)
  private String certificateNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private CertificateStatus status;

  @Column(name = "milestone_value", precision = 14, scale = 2, updatable = false)
  private BigDecimal milestoneValue;

  @Column(name = "deliverable_count", nullable = false, updatable = false)
  private int deliverableCount;

  @Column(name = "generated_by", nullable = false, updatable = false)
  private UUID generatedBy;

  @Column(name = "generated_at", nullable = false, updatable = false)
  private Instant generatedAt;

  @Column(name = "ready_at")
  private Instant readyAt;

  @Column(name = "billed_at")
  private Instant billedAt;

  @Column(name = "invoice_ref", length = 100)
  private String invoiceRef;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  protected AcceptanceCertificate() {}

  public AcceptanceCertificate(
      UUID projectId,
      UUID milestoneId,
      String certificateNumber,
      BigDecimal milestoneValue,
      int deliverableCount,
      UUID generatedBy) {
    this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
    this.milestoneId = Objects.requireNonNull(milestoneId, "milestoneId must not be null");
    this.certificateNumber =
        Objects.requireNonNull(certificateNumber, "certificateNumber must not be null");
    this.milestoneValue = milestoneValue;
    this.deliverableCount = deliverableCount;
    this.generatedBy = Objects.requireNonNull(generatedBy, "generatedBy must not be null");
    this.status = CertificateStatus.DRAFT;
    this.generatedAt = Instant.now();
  }

  public void markReadyToBill() {
    requireTransition(CertificateStatus.READY_TO_BILL);
    this.status = CertificateStatus.READY_TO_BILL;
    this.readyAt = Instant.now();
  }

  public void markBilled(String invoiceRef) {
    requireTransition(CertificateStatus.BILLED);
    this.status = CertificateStatus.BILLED;
    this.invoiceRef = invoiceRef;
    this.billedAt = Instant.now();
  }

  private void requireTransition(CertificateStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid certificate state",
          "Cannot move certificate " + certificateNumber + " from " + status + " to " + target);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getMilestoneId() {
    return milestoneId;
  }

  public String getCertificateNumber() {
    return certificateNumber;
  }

  public CertificateStatus getStatus() {
    return status;
  }

  public BigDecimal getMilestoneValue() {
    return milestoneValue;
  }

  public int getDeliverableCount() {
    return deliverableCount;
  }

  public UUID getGeneratedBy() {
    return generatedBy;
  }

  public Instant getGeneratedAt() {
    return generatedAt;
  }

  public Instant getReadyAt() {
    return readyAt;
  }

  public Instant getBilledAt() {
    return billedAt;
  }

  public String getInvoiceRef() {
    return invoiceRef;
  }

  public int getVersion() {
    return version;
  }
}
