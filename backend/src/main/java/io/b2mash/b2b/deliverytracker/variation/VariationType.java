package io.b2mash.b2b.deliverytracker.variation;

public enum VariationType {
  SCOPE_EXTENSION,
  SCOPE_REDUCTION,
  TIME_EXTENSION,
  COST_ADJUSTMENT,
  COMBINED
}
