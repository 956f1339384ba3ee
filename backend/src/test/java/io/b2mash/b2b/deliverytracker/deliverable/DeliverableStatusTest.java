package io.b2mash.b2b.deliverytracker.deliverable;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DeliverableStatusTest {

  @Test
  void allowedTransitions_submittedForReview() {
    assertThat(DeliverableStatus.SUBMITTED_FOR_REVIEW.allowedTransitions())
        .containsExactlyInAnyOrder(
            DeliverableStatus.RETURNED_FOR_MORE_WORK, DeliverableStatus.REVIEW_COMPLETE);
  }

  @Test
  void allowedTransitions_returnedForMoreWork() {
    assertThat(DeliverableStatus.RETURNED_FOR_MORE_WORK.allowedTransitions())
        .containsExactly(DeliverableStatus.SUBMITTED_FOR_REVIEW);
  }

  @Test
  void reviewCompleteOnlyLeadsToDelivered() {
    assertThat(DeliverableStatus.REVIEW_COMPLETE.allowedTransitions())
        .containsExactly(DeliverableStatus.DELIVERED);
  }

  @Test
  void deliveredIsTerminal() {
    assertThat(DeliverableStatus.DELIVERED.allowedTransitions()).isEmpty();
    assertThat(DeliverableStatus.DELIVERED.isTerminal()).isTrue();
  }

  @Test
  void cannotSkipReview() {
    assertThat(DeliverableStatus.IN_PROGRESS.canTransitionTo(DeliverableStatus.DELIVERED)).isFalse();
    assertThat(DeliverableStatus.IN_PROGRESS.canTransitionTo(DeliverableStatus.REVIEW_COMPLETE))
        .isFalse();
  }

  @Test
  void progressLockedFromSubmissionOn() {
    assertThat(DeliverableStatus.SUBMITTED_FOR_REVIEW.isProgressLocked()).isTrue();
    assertThat(DeliverableStatus.REVIEW_COMPLETE.isProgressLocked()).isTrue();
    assertThat(DeliverableStatus.DELIVERED.isProgressLocked()).isTrue();
    assertThat(DeliverableStatus.RETURNED_FOR_MORE_WORK.isProgressLocked()).isFalse();
  }

  @Test
  void labels() {
    assertThat(DeliverableStatus.DRAFT.label()).isEqualTo("Not Started");
    assertThat(DeliverableStatus.SUBMITTED_FOR_REVIEW.label()).isEqualTo("Submitted for Review");
  }
}
