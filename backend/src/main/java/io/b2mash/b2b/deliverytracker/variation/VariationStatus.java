package io.b2mash.b2b.deliverytracker.variation;

import java.util.Map;
import java.util.Set;

/**
 * Variation status. Signature progress while SUBMITTED is tracked on the variation's signature
 * record, not here.
 */
public enum VariationStatus {
  DRAFT,
  SUBMITTED,
  APPLIED,
  REJECTED;

  private static final Map<VariationStatus, Set<VariationStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          DRAFT, Set.of(SUBMITTED),
          SUBMITTED, Set.of(APPLIED, REJECTED),
          REJECTED, Set.of(DRAFT),
          APPLIED, Set.of());

  public boolean canTransitionTo(VariationStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }

  public boolean isDeletable() {
    return this != APPLIED;
  }
}
