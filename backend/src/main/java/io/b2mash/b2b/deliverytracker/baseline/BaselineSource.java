package io.b2mash.b2b.deliverytracker.baseline;

/** What produced a baseline version. */
public enum BaselineSource {
  COMMITMENT,
  VARIATION
}
