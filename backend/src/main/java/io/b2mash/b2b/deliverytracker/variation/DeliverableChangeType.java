package io.b2mash.b2b.deliverytracker.variation;

/** How a variation changes a deliverable when applied. */
public enum DeliverableChangeType {
  /** New deliverable under the target milestone. */
  ADD,
  /** Rename, re-describe or re-date an existing deliverable. */
  MODIFY,
  /** Soft-delete an existing deliverable. */
  REMOVE
}
