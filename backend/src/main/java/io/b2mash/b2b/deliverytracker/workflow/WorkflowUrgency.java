package io.b2mash.b2b.deliverytracker.workflow;

public enum WorkflowUrgency {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  public static WorkflowUrgency of(long daysPending, WorkflowProperties thresholds) {
    if (daysPending >= thresholds.criticalAfterDays()) {
      return CRITICAL;
    }
    if (daysPending >= thresholds.highAfterDays()) {
      return HIGH;
    }
    if (daysPending >= thresholds.mediumAfterDays()) {
      return MEDIUM;
    }
    return LOW;
  }
}
