package io.b2mash.b2b.deliverytracker.variation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * Requested change to one milestone's dates and value. The original values are captured when the
 * impact is added; a null new value leaves that attribute unchanged.
 */
@Entity
@Table(name = "variation_milestone_impacts")
public class VariationMilestoneImpact {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "variation_id", nullable = false, updatable = false)
  private UUID variationId;

  @Column(name = "milestone_id", nullable = false, updatable = false)
  private UUID milestoneId;

  @Column(name = "original_start_date", updatable = false)
  private LocalDate originalStartDate;

  @Column(name = "original_end_date", updatable = false)
  private LocalDate originalEndDate;

  @Column(name = "original_value", precision = 14, scale = 2, updatable = false)
  private BigDecimal originalValue;

  @Column(name = "new_start_date")
  private LocalDate newStartDate;

  @Column(name = "new_end_date")
  private LocalDate newEndDate;

  @Column(name = "new_value", precision = 14, scale = 2)
  private BigDecimal newValue;

  @Column(name = "rationale", columnDefinition = "TEXT")
  private String rationale;

  @Column(name = "baseline_version_before")
  private Integer baselineVersionBefore;

  @Column(name = "baseline_version_after")
  private Integer baselineVersionAfter;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected VariationMilestoneImpact() {}

  public VariationMilestoneImpact(
      UUID variationId,
      UUID milestoneId,
      LocalDate originalStartDate,
      LocalDate originalEndDate,
      BigDecimal originalValue,
      LocalDate newStartDate,
      LocalDate newEndDate,
      BigDecimal newValue,
      String rationale) {
    this.variationId = Objects.requireNonNull(variationId, "variationId must not be null");
    this.milestoneId = Objects.requireNonNull(milestoneId, "milestoneId must not be null");
    this.originalStartDate = originalStartDate;
    this.originalEndDate = originalEndDate;
    this.originalValue = originalValue;
    this.newStartDate = newStartDate;
    this.newEndDate = newEndDate;
    this.newValue = newValue;
    this.rationale = rationale;
    this.createdAt = Instant.now();
  }

  /** Value change; zero when the value is unchanged. */
  public BigDecimal costImpact() {
    if (newValue == null) {
      return BigDecimal.ZERO;
    }
    return newValue.subtract(originalValue == null ? BigDecimal.ZERO : originalValue);
  }

  /** Days the end date moves; zero when either end date is unknown. */
  public int daysImpact() {
    if (newEndDate == null || originalEndDate == null) {
      return 0;
    }
    return (int) ChronoUnit.DAYS.between(originalEndDate, newEndDate);
  }

  void recordBaselineVersions(int before, int after) {
    this.baselineVersionBefore = before;
    this.baselineVersionAfter = after;
  }

  public UUID getId() {
    return id;
  }

  public UUID getVariationId() {
    return variationId;
  }

  public UUID getMilestoneId() {
    return milestoneId;
  }

  public LocalDate getOriginalStartDate() {
    return originalStartDate;
  }

  public LocalDate getOriginalEndDate() {
    return originalEndDate;
  }

  public BigDecimal getOriginalValue() {
    return originalValue;
  }

  public LocalDate getNewStartDate() {
    return newStartDate;
  }

  public LocalDate getNewEndDate() {
    return newEndDate;
  }

  public BigDecimal getNewValue() {
    return newValue;
  }

  public String getRationale() {
    return rationale;
  }

  public Integer getBaselineVersionBefore() {
    return baselineVersionBefore;
  }

  public Integer getBaselineVersionAfter() {
    return baselineVersionAfter;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
