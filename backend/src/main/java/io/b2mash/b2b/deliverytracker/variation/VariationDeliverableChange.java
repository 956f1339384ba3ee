package io.b2mash.b2b.deliverytracker.variation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * One deliverable-level change of a variation. {@code deliverableId} names the target of a MODIFY
 * or REMOVE; for an ADD it is filled in with the created deliverable once applied.
 */
@Entity
@Table(name = "variation_deliverable_changes")
public class VariationDeliverableChange {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "variation_id", nullable = false, updatable = false)
  private UUID variationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "change_type", nullable = false, updatable = false, length = 10)
  private DeliverableChangeType changeType;

  @Column(name = "milestone_id", nullable = false, updatable = false)
  private UUID milestoneId;

  @Column(name = "deliverable_id")
  private UUID deliverableId;

  @Column(name = "name", length = 500)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "start_date")
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "removal_reason", columnDefinition = "TEXT")
  private String removalReason;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected VariationDeliverableChange() {}

  public VariationDeliverableChange(
      UUID variationId,
      DeliverableChangeType changeType,
      UUID milestoneId,
      UUID deliverableId,
      String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      String removalReason) {
    this.variationId = Objects.requireNonNull(variationId, "variationId must not be null");
    this.changeType = Objects.requireNonNull(changeType, "changeType must not be null");
    this.milestoneId = Objects.requireNonNull(milestoneId, "milestoneId must not be null");
    this.deliverableId = deliverableId;
    this.name = name;
    this.description = description;
    this.startDate = startDate;
    this.endDate = endDate;
    this.removalReason = removalReason;
    this.createdAt = Instant.now();
  }

  void recordCreatedDeliverable(UUID deliverableId) {
    this.deliverableId = deliverableId;
  }

  public UUID getId() {
    return id;
  }

  public UUID getVariationId() {
    return variationId;
  }

  public DeliverableChangeType getChangeType() {
    return changeType;
  }

  public UUID getMilestoneId() {
    return milestoneId;
  }

  public UUID getDeliverableId() {
    return deliverableId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public String getRemovalReason() {
    return removalReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
