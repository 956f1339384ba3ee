package io.b2mash.b2b.deliverytracker.milestone;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.milestone.MilestoneAggregation.DeliverableSnapshot;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class MilestoneAggregationTest {

  @Test
  void deliveredAndHalfDoneDeliverablesGiveInProgressAtSeventyFive() {
    var deliverables =
        List.of(
            new DeliverableSnapshot(DeliverableStatus.DELIVERED, 100),
            new DeliverableSnapshot(DeliverableStatus.IN_PROGRESS, 50));

    assertThat(MilestoneAggregation.computeStatus(deliverables))
        .isEqualTo(MilestoneStatus.IN_PROGRESS);
    assertThat(MilestoneAggregation.computeProgress(deliverables)).isEqualTo(75);
  }

  @Test
  void milestoneWithoutDeliverablesIsNotStartedAtZero() {
    assertThat(MilestoneAggregation.computeStatus(List.of())).isEqualTo(MilestoneStatus.NOT_STARTED);
    assertThat(MilestoneAggregation.computeProgress(List.of())).isZero();
  }

  @Test
  void allDeliveredIsCompleted() {
    var deliverables =
        List.of(
            new DeliverableSnapshot(DeliverableStatus.DELIVERED, 100),
            new DeliverableSnapshot(DeliverableStatus.DELIVERED, 100));

    assertThat(MilestoneAggregation.computeStatus(deliverables))
        .isEqualTo(MilestoneStatus.COMPLETED);
    assertThat(MilestoneAggregation.computeProgress(deliverables)).isEqualTo(100);
  }

  @Test
  void allDraftIsNotStarted() {
    var deliverables =
        List.of(
            new DeliverableSnapshot(DeliverableStatus.DRAFT, 0),
            new DeliverableSnapshot(null, null));

    assertThat(MilestoneAggregation.computeStatus(deliverables))
        .isEqualTo(MilestoneStatus.NOT_STARTED);
  }

  @Test
  void anyActivityIsInProgress() {
    var deliverables =
        List.of(
            new DeliverableSnapshot(DeliverableStatus.DRAFT, 0),
            new DeliverableSnapshot(DeliverableStatus.SUBMITTED_FOR_REVIEW, 100));

    assertThat(MilestoneAggregation.computeStatus(deliverables))
        .isEqualTo(MilestoneStatus.IN_PROGRESS);
  }

  @Test
  void progressRoundsHalfUpAndCountsMissingAsZero() {
    var deliverables =
        List.of(
            new DeliverableSnapshot(DeliverableStatus.IN_PROGRESS, 33),
            new DeliverableSnapshot(DeliverableStatus.IN_PROGRESS, 34),
            new DeliverableSnapshot(DeliverableStatus.DRAFT, null));

    // (33 + 34 + 0) / 3 = 22.33
    assertThat(MilestoneAggregation.computeProgress(deliverables)).isEqualTo(22);
    assertThat(
            MilestoneAggregation.computeProgress(
                List.of(
                    new DeliverableSnapshot(DeliverableStatus.IN_PROGRESS, 50),
                    new DeliverableSnapshot(DeliverableStatus.IN_PROGRESS, 51))))
        .isEqualTo(51);
  }

  @Test
  void deliverableEndingAfterBaselineEndBreaches() {
    var baselineEnd = LocalDate.of(2026, 6, 30);

    assertThat(
            MilestoneAggregation.computeHealth(
                baselineEnd, Arrays.asList(LocalDate.of(2026, 6, 20), null, LocalDate.of(2026, 7, 1))))
        .isEqualTo(MilestoneHealth.BREACHED);
    assertThat(MilestoneAggregation.computeHealth(baselineEnd, List.of(baselineEnd)))
        .isEqualTo(MilestoneHealth.NORMAL);
  }

  @Test
  void milestoneWithoutCommittedEndIsNeverBreached() {
    assertThat(MilestoneAggregation.computeHealth(null, List.of(LocalDate.of(2030, 1, 1))))
        .isEqualTo(MilestoneHealth.NORMAL);
    assertThat(MilestoneAggregation.computeHealth(LocalDate.of(2026, 6, 30), List.of()))
        .isEqualTo(MilestoneHealth.NORMAL);
  }
}
