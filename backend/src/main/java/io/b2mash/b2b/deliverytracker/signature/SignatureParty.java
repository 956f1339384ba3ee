package io.b2mash.b2b.deliverytracker.signature;

public enum SignatureParty {
  PROVIDING("Supplier"),
  RECEIVING("Customer");

  private final String label;

  SignatureParty(String label) {
    this.label = label;
  }

  public SignatureParty other() {
    return this == PROVIDING ? RECEIVING : PROVIDING;
  }

  /** Display label, as used in "Awaiting Supplier" / "Awaiting Customer". */
  public String label() {
    return label;
  }
}
