package io.b2mash.b2b.deliverytracker.milestone;

/**
 * Schedule health of a milestone against its committed baseline. Computed on read from the latest
 * baseline version and the live deliverable dates.
 */
public enum MilestoneHealth {
  NORMAL("Normal"),
  BREACHED("Baseline Breached");

  private final String label;

  MilestoneHealth(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
