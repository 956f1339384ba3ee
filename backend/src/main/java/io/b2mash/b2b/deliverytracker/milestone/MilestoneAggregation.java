package io.b2mash.b2b.deliverytracker.milestone;

import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import java.time.LocalDate;
import java.util.List;

/**
 * Folds a milestone's direct deliverables into its status and progress. Pure functions over the
 * snapshots passed in; nothing is cached or stored.
 */
public final class MilestoneAggregation {

  /**
   * The two deliverable fields aggregation reads.
   *
   * @param status null is treated as not started
   * @param progress null counts as 0
   */
  public record DeliverableSnapshot(DeliverableStatus status, Integer progress) {

    public static DeliverableSnapshot of(WorkItem deliverable) {
      return new DeliverableSnapshot(deliverable.getDeliverableStatus(), deliverable.getProgress());
    }
  }

  /**
   * No deliverables gives NOT_STARTED. All delivered gives COMPLETED. All not started gives
   * NOT_STARTED. Anything else is IN_PROGRESS.
   */
  public static MilestoneStatus computeStatus(List<DeliverableSnapshot> deliverables) {
    if (deliverables.isEmpty()) {
      return MilestoneStatus.NOT_STARTED;
    }
    boolean allDelivered =
        deliverables.stream().allMatch(d -> d.status() == DeliverableStatus.DELIVERED);
    if (allDelivered) {
      return MilestoneStatus.COMPLETED;
    }
    boolean allNotStarted =
        deliverables.stream()
            .allMatch(d -> d.status() == null || d.status() == DeliverableStatus.DRAFT);
    return allNotStarted ? MilestoneStatus.NOT_STARTED : MilestoneStatus.IN_PROGRESS;
  }

  /** Rounded arithmetic mean of deliverable progress; 0 without deliverables. */
  public static int computeProgress(List<DeliverableSnapshot> deliverables) {
    if (deliverables.isEmpty()) {
      return 0;
    }
    long total = 0;
    for (DeliverableSnapshot deliverable : deliverables) {
      total += deliverable.progress() == null ? 0 : deliverable.progress();
    }
    return (int) Math.round((double) total / deliverables.size());
  }

  /**
   * BREACHED when a baseline end date is committed and any deliverable ends after it. Without a
   * committed end date the milestone is NORMAL.
   *
   * @param deliverableEndDates null entries are deliverables without an end date
   */
  public static MilestoneHealth computeHealth(
      LocalDate baselineEndDate, List<LocalDate> deliverableEndDates) {
    if (baselineEndDate == null) {
      return MilestoneHealth.NORMAL;
    }
    boolean breached =
        deliverableEndDates.stream().anyMatch(end -> end != null && end.isAfter(baselineEndDate));
    return breached ? MilestoneHealth.BREACHED : MilestoneHealth.NORMAL;
  }

  private MilestoneAggregation() {}
}
