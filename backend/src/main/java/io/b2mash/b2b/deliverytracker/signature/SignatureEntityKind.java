package io.b2mash.b2b.deliverytracker.signature;

/** The kinds of entity that go through the dual-party signature workflow. */
public enum SignatureEntityKind {
  /** Deliverable review sign-off. Entity id is the deliverable work item. */
  DELIVERABLE("deliverable"),
  /** Milestone baseline commitment. Entity id is the milestone work item. */
  BASELINE_COMMITMENT("milestone"),
  /** Milestone acceptance certificate. Entity id is the certificate. */
  ACCEPTANCE_CERTIFICATE("acceptance_certificate"),
  /** Variation (change request). Entity id is the variation. */
  VARIATION("variation");

  private final String entityType;

  SignatureEntityKind(String entityType) {
    this.entityType = entityType;
  }

  /** Entity type used in audit rows and events for the signed entity. */
  public String entityType() {
    return entityType;
  }
}
