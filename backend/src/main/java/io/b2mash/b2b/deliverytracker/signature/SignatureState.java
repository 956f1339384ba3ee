package io.b2mash.b2b.deliverytracker.signature;

/** Derived state of a signature record. */
public enum SignatureState {
  UNSIGNED,
  PARTIALLY_SIGNED,
  COMPLETE
}
