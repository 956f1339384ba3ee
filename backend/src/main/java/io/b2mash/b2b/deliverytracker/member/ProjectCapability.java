package io.b2mash.b2b.deliverytracker.member;

public enum ProjectCapability {
  /** Create, move, reorder and delete work items; generate certificates; request baselines. */
  MANAGE_PLAN,
  SUBMIT_DELIVERABLE,
  /** Accept or return a deliverable under review. */
  REVIEW_DELIVERABLE,
  /** Create, edit, submit and delete variations. */
  MANAGE_VARIATIONS,
  /** Reject a submitted variation. */
  REVIEW_VARIATIONS,
  MANAGE_MEMBERS,
  /** Record that a ready-to-bill certificate has been invoiced. */
  RECORD_BILLING
}
