package io.b2mash.b2b.deliverytracker.deliverable;

import java.util.Map;
import java.util.Set;

/** Deliverable lifecycle status with validated transitions. */
public enum DeliverableStatus {
  DRAFT("Not Started"),
  IN_PROGRESS("In Progress"),
  SUBMITTED_FOR_REVIEW("Submitted for Review"),
  RETURNED_FOR_MORE_WORK("Returned for More Work"),
  REVIEW_COMPLETE("Review Complete"),
  DELIVERED("Delivered");

  private static final Map<DeliverableStatus, Set<DeliverableStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          DRAFT, Set.of(IN_PROGRESS),
          IN_PROGRESS, Set.of(DRAFT, SUBMITTED_FOR_REVIEW),
          SUBMITTED_FOR_REVIEW, Set.of(RETURNED_FOR_MORE_WORK, REVIEW_COMPLETE),
          RETURNED_FOR_MORE_WORK, Set.of(SUBMITTED_FOR_REVIEW),
          REVIEW_COMPLETE, Set.of(DELIVERED),
          DELIVERED, Set.of());

  private final String label;

  DeliverableStatus(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public Set<DeliverableStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(DeliverableStatus target) {
    return allowedTransitions().contains(target);
  }

  /** Progress cannot be edited while the deliverable is with the reviewer or signed off. */
  public boolean isProgressLocked() {
    return this == SUBMITTED_FOR_REVIEW || this == REVIEW_COMPLETE || this == DELIVERED;
  }

  /** Draft, in progress or returned: the deliverable may be restructured (indented, demoted). */
  public boolean isEditable() {
    return this == DRAFT || this == IN_PROGRESS || this == RETURNED_FOR_MORE_WORK;
  }

  public boolean isTerminal() {
    return this == DELIVERED;
  }
}
