package io.b2mash.b2b.deliverytracker.variation;

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

/** A formal change request against one or more milestones of a project. */
@Entity
@Table(name = "variations")
public class Variation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "reference", nullable = false, updatable = false, length = 20)
  private String reference;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "reason", columnDefinition = "TEXT")
  private String reason;

  @Enumerated(EnumType.STRING)
  @Column(name = "variation_type", nullable = false, length = 30)
  private VariationType variationType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private VariationStatus status;

  @Column(name = "total_cost_impact", precision = 14, scale = 2, nullable = false)
  private BigDecimal totalCostImpact;

  @Column(name = "total_days_impact", nullable = false)
  private int totalDaysImpact;

  @Column(name = "submitted_at")
  private Instant submittedAt;

  @Column(name = "rejected_by")
  private UUID rejectedBy;

  @Column(name = "rejected_at")
  private Instant rejectedAt;

  @Column(name = "rejection_reason", columnDefinition = "TEXT")
  private String rejectionReason;

  @Column(name = "applied_at")
  private Instant appliedAt;

  @Column(name = "certificate_number", length = 80)
  private String certificateNumber;

  @Column(name = "created_by", nullable = false, updatable = false)
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  protected Variation() {}

  public Variation(
      UUID projectId,
      String reference,
      String title,
      String description,
      String reason,
      VariationType variationType,
      UUID createdBy) {
    this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
    this.reference = Objects.requireNonNull(reference, "reference must not be null");
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.description = description;
    this.reason = reason;
    this.variationType = Objects.requireNonNull(variationType, "variationType must not be null");
    this.createdBy = Objects.requireNonNull(createdBy, "createdBy must not be null");
    this.status = VariationStatus.DRAFT;
    this.totalCostImpact = BigDecimal.ZERO;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void update(String title, String description, String reason, VariationType variationType) {
    requireDraft("edit");
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.description = description;
    this.reason = reason;
    this.variationType = Objects.requireNonNull(variationType, "variationType must not be null");
    this.updatedAt = Instant.now();
  }

  public void submit(BigDecimal totalCostImpact, int totalDaysImpact) {
    requireTransition(VariationStatus.SUBMITTED, "submit");
    this.status = VariationStatus.SUBMITTED;
    this.totalCostImpact = totalCostImpact;
    this.totalDaysImpact = totalDaysImpact;
    this.submittedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void reject(String reason, UUID rejectedBy) {
    requireTransition(VariationStatus.REJECTED, "reject");
    this.status = VariationStatus.REJECTED;
    this.rejectionReason = reason;
    this.rejectedBy = rejectedBy;
    this.rejectedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void resetToDraft() {
    requireTransition(VariationStatus.DRAFT, "reset");
    this.status = VariationStatus.DRAFT;
    this.rejectionReason = null;
    this.rejectedBy = null;
    this.rejectedAt = null;
    this.submittedAt = null;
    this.updatedAt = Instant.now();
  }

  void markApplied(String certificateNumber) {
    requireTransition(VariationStatus.APPLIED, "apply");
    this.status = VariationStatus.APPLIED;
    this.certificateNumber = certificateNumber;
    this.appliedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  void requireDraft(String action) {
    if (status != VariationStatus.DRAFT) {
      throw new InvalidStateException(
          "Variation not editable",
          "Cannot " + action + " variation " + reference + " in status " + status);
    }
  }

  private void requireTransition(VariationStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid variation state",
          "Cannot " + action + " variation " + reference + " in status " + status);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getReference() {
    return reference;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getReason() {
    return reason;
  }

  public VariationType getVariationType() {
    return variationType;
  }

  public VariationStatus getStatus() {
    return status;
  }

  public BigDecimal getTotalCostImpact() {
    return totalCostImpact;
  }

  public int getTotalDaysImpact() {
    return totalDaysImpact;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public UUID getRejectedBy() {
    return rejectedBy;
  }

  public Instant getRejectedAt() {
    return rejectedAt;
  }

  public String getRejectionReason() {
    return rejectionReason;
  }

  public Instant getAppliedAt() {
    return appliedAt;
  }

  public String getCertificateNumber() {
    return certificateNumber;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public int getVersion() {
    return version;
  }
}
