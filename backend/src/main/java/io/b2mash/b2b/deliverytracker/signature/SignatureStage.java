package io.b2mash.b2b.deliverytracker.signature;

/** Display stage of a signature record, named after the party still to sign. */
public enum SignatureStage {
  NOT_SIGNED("Not Signed"),
  AWAITING_SUPPLIER("Awaiting Supplier"),
  AWAITING_CUSTOMER("Awaiting Customer"),
  SIGNED("Signed");

  private final String label;

  SignatureStage(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
