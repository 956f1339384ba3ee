package io.b2mash.b2b.deliverytracker.workitem;

/** Kind discriminator of the single work-item hierarchy. */
public enum WorkItemKind {
  MILESTONE("MS"),
  DELIVERABLE("DEL"),
  TASK("TSK");

  private final String refPrefix;

  WorkItemKind(String refPrefix) {
    this.refPrefix = refPrefix;
  }

  public String refPrefix() {
    return refPrefix;
  }

  /**
   * Nesting rule: a milestone is always a root, a deliverable always sits under a milestone, a task
   * sits under a deliverable or another task.
   *
   * @param parentKind kind of the prospective parent, null for root
   */
  public boolean acceptsParent(WorkItemKind parentKind) {
    return switch (this) {
      case MILESTONE -> parentKind == null;
      case DELIVERABLE -> parentKind == MILESTONE;
      case TASK -> parentKind == DELIVERABLE || parentKind == TASK;
    };
  }

  /** Kind an item takes when indented under a preceding sibling of this kind. */
  public WorkItemKind demoted() {
    return switch (this) {
      case MILESTONE -> DELIVERABLE;
      case DELIVERABLE, TASK -> TASK;
    };
  }
}
