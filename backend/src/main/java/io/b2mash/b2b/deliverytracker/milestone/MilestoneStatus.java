package io.b2mash.b2b.deliverytracker.milestone;

/** Milestone status, always computed from the milestone's deliverables. */
public enum MilestoneStatus {
  NOT_STARTED("Not Started"),
  IN_PROGRESS("In Progress"),
  COMPLETED("Completed");

  private final String label;

  MilestoneStatus(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
