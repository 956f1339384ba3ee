package io.b2mash.b2b.deliverytracker.workitem;

import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
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
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * A node of the milestone / deliverable / task hierarchy. All three kinds share one table and one
 * parent reference; {@link WorkItemKind} is the discriminator and the nesting rules live in {@link
 * HierarchyService}.
 *
 * <p>Progress is authoritative only for deliverables and tasks. Milestones never store status or
 * progress; both are derived on read by {@code MilestoneAggregation}.
 */
@Entity
@Table(name = "work_items")
public class WorkItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 20)
  private WorkItemKind kind;

  @Column(name = "parent_id")
  private UUID parentId;

  @Column(name = "item_ref", nullable = false, length = 20)
  private String itemRef;

  @Column(name = "name", nullable = false, length = 500)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "start_date")
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "duration_days")
  private Integer durationDays;

  @Column(name = "progress", nullable = false)
  private int progress;

  @Enumerated(EnumType.STRING)
  @Column(name = "deliverable_status", length = 30)
  private DeliverableStatus deliverableStatus;

  @Column(name = "position", nullable = false)
  private int position;

  @Column(name = "wbs", nullable = false, length = 100)
  private String wbs;

  @Column(name = "value", precision = 14, scale = 2)
  private BigDecimal value;

  @Column(name = "estimate_component_id")
  private UUID estimateComponentId;

  @Column(name = "billed", nullable = false)
  private boolean billed;

  @Column(name = "submitted_at")
  private Instant submittedAt;

  @Column(name = "reviewed_at")
  private Instant reviewedAt;

  @Column(name = "reviewed_by")
  private UUID reviewedBy;

  @Column(name = "return_reason", length = 2000)
  private String returnReason;

  @Column(name = "delivered_at")
  private Instant deliveredAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "deleted_by")
  private UUID deletedBy;

  @Column(name = "created_by", nullable = false, updatable = false)
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  protected WorkItem() {}

  public WorkItem(
      UUID projectId,
      WorkItemKind kind,
      UUID parentId,
      String itemRef,
      String name,
      UUID createdBy) {
    this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
    this.parentId = parentId;
    this.itemRef = Objects.requireNonNull(itemRef, "itemRef must not be null");
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.createdBy = Objects.requireNonNull(createdBy, "createdBy must not be null");
    this.progress = 0;
    this.deliverableStatus = kind == WorkItemKind.DELIVERABLE ? DeliverableStatus.DRAFT : null;
    this.wbs = "";
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  // --- Attributes ---

  public void updateDetails(
      String name, String description, LocalDate startDate, LocalDate endDate, BigDecimal value) {
    if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
      throw new InvalidStateException(
          "Invalid dates", "End date " + endDate + " is before start date " + startDate);
    }
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.description = description;
    this.startDate = startDate;
    this.endDate = endDate;
    this.durationDays =
        startDate != null && endDate != null
            ? (int) ChronoUnit.DAYS.between(startDate, endDate) + 1
            : null;
    this.value = value;
    this.updatedAt = Instant.now();
  }

  public void linkEstimateComponent(UUID estimateComponentId) {
    this.estimateComponentId = estimateComponentId;
    this.updatedAt = Instant.now();
  }

  /** Set by the billing side once the item has been invoiced; billed items cannot be deleted. */
  public void markBilled() {
    this.billed = true;
    this.updatedAt = Instant.now();
  }

  // --- Structure (driven by HierarchyService) ---

  void placeUnder(UUID parentId, int position) {
    this.parentId = parentId;
    this.position = position;
    this.updatedAt = Instant.now();
  }

  void moveToPosition(int position) {
    if (this.position != position) {
      this.position = position;
      this.updatedAt = Instant.now();
    }
  }

  void assignWbs(String wbs) {
    if (!wbs.equals(this.wbs)) {
      this.wbs = wbs;
      this.updatedAt = Instant.now();
    }
  }

  /**
   * Promotes or demotes this item. A deliverable keeps its lifecycle fields only while it stays a
   * deliverable; an item becoming a deliverable starts in DRAFT or IN_PROGRESS according to its
   * progress. Milestones carry no stored progress.
   */
  void changeKind(WorkItemKind newKind, String newItemRef) {
    if (newKind == kind) {
      return;
    }
    if (kind == WorkItemKind.DELIVERABLE) {
      this.deliverableStatus = null;
      this.submittedAt = null;
      this.reviewedAt = null;
      this.reviewedBy = null;
      this.returnReason = null;
      this.deliveredAt = null;
    }
    if (newKind == WorkItemKind.DELIVERABLE) {
      this.deliverableStatus = progress > 0 ? DeliverableStatus.IN_PROGRESS : DeliverableStatus.DRAFT;
    }
    if (newKind == WorkItemKind.MILESTONE) {
      this.progress = 0;
    }
    this.kind = newKind;
    this.itemRef = newItemRef;
    this.updatedAt = Instant.now();
  }

  // --- Progress ---

  /** Stores a task's own progress. Ancestors are recomputed by {@link ProgressRollup}. */
  public void updateTaskProgress(int progress) {
    requireKind(WorkItemKind.TASK, "set task progress on");
    this.progress = requireValidProgress(progress);
    this.updatedAt = Instant.now();
  }

  /**
   * Stores a deliverable's progress and applies the automatic transitions: progress above zero
   * moves a DRAFT deliverable to IN_PROGRESS, progress back to zero moves IN_PROGRESS to DRAFT.
   */
  public void updateDeliverableProgress(int progress) {
    requireKind(WorkItemKind.DELIVERABLE, "set deliverable progress on");
    int validated = requireValidProgress(progress);
    if (deliverableStatus.isProgressLocked()) {
      throw new InvalidStateException(
          "Progress locked",
          "Cannot change progress of deliverable " + itemRef + " in status " + deliverableStatus);
    }
    this.progress = validated;
    if (deliverableStatus == DeliverableStatus.DRAFT && validated > 0) {
      this.deliverableStatus = DeliverableStatus.IN_PROGRESS;
    } else if (deliverableStatus == DeliverableStatus.IN_PROGRESS && validated == 0) {
      this.deliverableStatus = DeliverableStatus.DRAFT;
    }
    this.updatedAt = Instant.now();
  }

  // --- Deliverable lifecycle ---

  public void submitForReview() {
    requireKind(WorkItemKind.DELIVERABLE, "submit");
    requireTransition(DeliverableStatus.SUBMITTED_FOR_REVIEW, "submit");
    this.deliverableStatus = DeliverableStatus.SUBMITTED_FOR_REVIEW;
    this.submittedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void returnForMoreWork(String reason, UUID reviewerId) {
    requireKind(WorkItemKind.DELIVERABLE, "return");
    requireTransition(DeliverableStatus.RETURNED_FOR_MORE_WORK, "return");
    this.deliverableStatus = DeliverableStatus.RETURNED_FOR_MORE_WORK;
    this.returnReason = reason;
    this.reviewedAt = Instant.now();
    this.reviewedBy = reviewerId;
    this.updatedAt = Instant.now();
  }

  public void acceptReview(UUID reviewerId) {
    requireKind(WorkItemKind.DELIVERABLE, "accept");
    requireTransition(DeliverableStatus.REVIEW_COMPLETE, "accept");
    this.deliverableStatus = DeliverableStatus.REVIEW_COMPLETE;
    this.returnReason = null;
    this.reviewedAt = Instant.now();
    this.reviewedBy = reviewerId;
    this.updatedAt = Instant.now();
  }

  /**
   * Final sign-off. Only reachable once both signatures are in; forces progress to 100 regardless
   * of the stored value.
   */
  public void markDelivered() {
    requireKind(WorkItemKind.DELIVERABLE, "deliver");
    requireTransition(DeliverableStatus.DELIVERED, "deliver");
    this.deliverableStatus = DeliverableStatus.DELIVERED;
    this.progress = 100;
    this.deliveredAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  // --- Soft delete ---

  void markDeleted(UUID deletedBy, Instant at) {
    this.deletedAt = at;
    this.deletedBy = deletedBy;
    this.updatedAt = at;
  }

  void markRestored() {
    this.deletedAt = null;
    this.deletedBy = null;
    this.updatedAt = Instant.now();
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  private void requireKind(WorkItemKind required, String action) {
    if (kind != required) {
      throw new InvalidStateException(
          "Invalid work item kind", "Cannot " + action + " " + kind + " " + itemRef);
    }
  }

  private void requireTransition(DeliverableStatus target, String action) {
    if (!deliverableStatus.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid deliverable state",
          "Cannot " + action + " deliverable " + itemRef + " in status " + deliverableStatus);
    }
  }

  private static int requireValidProgress(int progress) {
    if (progress < 0 || progress > 100) {
      throw new InvalidStateException(
          "Invalid progress", "Progress must be between 0 and 100, got " + progress);
    }
    return progress;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public WorkItemKind getKind() {
    return kind;
  }

  public UUID getParentId() {
    return parentId;
  }

  public String getItemRef() {
    return itemRef;
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

  public Integer getDurationDays() {
    return durationDays;
  }

  public int getProgress() {
    return progress;
  }

  public DeliverableStatus getDeliverableStatus() {
    return deliverableStatus;
  }

  public int getPosition() {
    return position;
  }

  public String getWbs() {
    return wbs;
  }

  public BigDecimal getValue() {
    return value;
  }

  public UUID getEstimateComponentId() {
    return estimateComponentId;
  }

  public boolean isBilled() {
    return billed;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Instant getReviewedAt() {
    return reviewedAt;
  }

  public UUID getReviewedBy() {
    return reviewedBy;
  }

  public String getReturnReason() {
    return returnReason;
  }

  public Instant getDeliveredAt() {
    return deliveredAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public UUID getDeletedBy() {
    return deletedBy;
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
