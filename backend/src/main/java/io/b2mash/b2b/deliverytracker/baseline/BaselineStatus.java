package io.b2mash.b2b.deliverytracker.baseline;

import io.b2mash.b2b.deliverytracker.signature.SignatureParty;
import io.b2mash.b2b.deliverytracker.signature.SignatureRecord;

/** Commitment stage of a milestone's baseline, derived from its versions and signature record. */
public enum BaselineStatus {
  NOT_COMMITTED("Not Committed"),
  AWAITING_SUPPLIER("Awaiting Supplier"),
  AWAITING_CUSTOMER("Awaiting Customer"),
  LOCKED("Locked");

  private final String label;

  BaselineStatus(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * A milestone with any baseline version is locked. Otherwise the open commitment record decides;
   * with no signature yet the baseline still counts as not committed.
   *
   * @param openCommitment active commitment record, or null
   */
  public static BaselineStatus of(boolean hasVersion, SignatureRecord openCommitment) {
    if (hasVersion || (openCommitment != null && openCommitment.isComplete())) {
      return LOCKED;
    }
    if (openCommitment == null) {
      return NOT_COMMITTED;
    }
    boolean providing = openCommitment.isSigned(SignatureParty.PROVIDING);
    boolean receiving = openCommitment.isSigned(SignatureParty.RECEIVING);
    if (providing) {
      return AWAITING_CUSTOMER;
    }
    if (receiving) {
      return AWAITING_SUPPLIER;
    }
    return NOT_COMMITTED;
  }
}
