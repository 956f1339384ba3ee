package io.b2mash.b2b.deliverytracker.member;

import java.util.EnumSet;
import java.util.Set;

/** Project-scoped role of a member. Stored in {@code project_members.project_role}. */
public enum ProjectRole {
  /** Full control on both sides; may act as either party. */
  ADMIN(EnumSet.allOf(ProjectCapability.class)),
  /** Providing-side project manager. */
  SUPPLIER_PM(
      EnumSet.of(
          ProjectCapability.MANAGE_PLAN,
          ProjectCapability.SUBMIT_DELIVERABLE,
          ProjectCapability.MANAGE_VARIATIONS)),
  SUPPLIER_FINANCE(EnumSet.of(ProjectCapability.RECORD_BILLING)),
  /** Receiving-side project manager. */
  CUSTOMER_PM(
      EnumSet.of(
          ProjectCapability.MANAGE_PLAN,
          ProjectCapability.REVIEW_DELIVERABLE,
          ProjectCapability.REVIEW_VARIATIONS)),
  CUSTOMER_FINANCE(EnumSet.noneOf(ProjectCapability.class)),
  CONTRIBUTOR(EnumSet.of(ProjectCapability.SUBMIT_DELIVERABLE)),
  VIEWER(EnumSet.noneOf(ProjectCapability.class));

  private final Set<ProjectCapability> capabilities;

  ProjectRole(Set<ProjectCapability> capabilities) {
    this.capabilities = capabilities;
  }

  public boolean has(ProjectCapability capability) {
    return capabilities.contains(capability);
  }
}
