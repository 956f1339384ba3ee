package io.b2mash.b2b.deliverytracker.baseline;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable snapshot of a milestone's committed scope. Version numbers are unique per milestone
 * (enforced by the table) and assigned by {@link BaselineVersionService}. No setters.
 */
@Entity
@Table(name = "baseline_versions")
public class BaselineVersion {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "milestone_id", nullable = false, updatable = false)
  private UUID milestoneId;

  @Column(name = "version_number", nullable = false, updatable = false)
  private int versionNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "source", nullable = false, updatable = false, length = 20)
  private BaselineSource source;

  @Column(name = "variation_id", updatable = false)
  private UUID variationId;

  @Column(name = "start_date", updatable = false)
  private LocalDate startDate;

  @Column(name = "end_date", updatable = false)
  private LocalDate endDate;

  @Column(name = "value", precision = 14, scale = 2, updatable = false)
  private BigDecimal value;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "deliverables", columnDefinition = "jsonb", nullable = false, updatable = false)
  private List<Map<String, Object>> deliverables;

  @Column(name = "created_by", nullable = false, updatable = false)
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected BaselineVersion() {}

  public BaselineVersion(
      UUID projectId,
      UUID milestoneId,
      int versionNumber,
      BaselineSource source,
      UUID variationId,
      LocalDate startDate,
      LocalDate endDate,
      BigDecimal value,
      List<Map<String, Object>> deliverables,
      UUID createdBy) {
    this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
    this.milestoneId = Objects.requireNonNull(milestoneId, "milestoneId must not be null");
    this.versionNumber = versionNumber;
    this.source = Objects.requireNonNull(source, "source must not be null");
    this.variationId = variationId;
    this.startDate = startDate;
    this.endDate = endDate;
    this.value = value;
    this.deliverables = List.copyOf(deliverables);
    this.createdBy = Objects.requireNonNull(createdBy, "createdBy must not be null");
    this.createdAt = Instant.now();
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

  public int getVersionNumber() {
    return versionNumber;
  }

  public BaselineSource getSource() {
    return source;
  }

  public UUID getVariationId() {
    return variationId;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public BigDecimal getValue() {
    return value;
  }

  public List<Map<String, Object>> getDeliverables() {
    return deliverables;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
