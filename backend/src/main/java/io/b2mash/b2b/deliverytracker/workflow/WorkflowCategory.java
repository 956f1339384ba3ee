package io.b2mash.b2b.deliverytracker.workflow;

import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureParty;

/**
 * Kinds of pending work. Signature categories are tied to the entity kind and the party whose
 * signature is missing; the rest are fed by deliverable review status or by collaborator records.
 */
public enum WorkflowCategory {
  DELIVERABLE_REVIEW("Deliverable Review", null, null),
  DELIVERABLE_SIGN_OFF_SUPPLIER(
      "Deliverable Sign-off (Supplier)", SignatureEntityKind.DELIVERABLE, SignatureParty.PROVIDING),
  DELIVERABLE_SIGN_OFF_CUSTOMER(
      "Deliverable Sign-off (Customer)", SignatureEntityKind.DELIVERABLE, SignatureParty.RECEIVING),
  BASELINE_AWAITING_SUPPLIER(
      "Baseline Signature (Supplier)",
      SignatureEntityKind.BASELINE_COMMITMENT,
      SignatureParty.PROVIDING),
  BASELINE_AWAITING_CUSTOMER(
      "Baseline Signature (Customer)",
      SignatureEntityKind.BASELINE_COMMITMENT,
      SignatureParty.RECEIVING),
  CERTIFICATE_PENDING_SUPPLIER(
      "Certificate Signature (Supplier)",
      SignatureEntityKind.ACCEPTANCE_CERTIFICATE,
      SignatureParty.PROVIDING),
  CERTIFICATE_PENDING_CUSTOMER(
      "Certificate Signature (Customer)",
      SignatureEntityKind.ACCEPTANCE_CERTIFICATE,
      SignatureParty.RECEIVING),
  VARIATION_AWAITING_SUPPLIER(
      "Variation Signature (Supplier)", SignatureEntityKind.VARIATION, SignatureParty.PROVIDING),
  VARIATION_AWAITING_CUSTOMER(
      "Variation Signature (Customer)", SignatureEntityKind.VARIATION, SignatureParty.RECEIVING),
  TIMESHEET_APPROVAL("Timesheet Approval", null, null),
  EXPENSE_CHARGEABLE("Expense Validation (Chargeable)", null, null),
  EXPENSE_NON_CHARGEABLE("Expense Validation (Non-Chargeable)", null, null);

  private final String label;
  private final SignatureEntityKind signatureKind;
  private final SignatureParty missingParty;

  WorkflowCategory(String label, SignatureEntityKind signatureKind, SignatureParty missingParty) {
    this.label = label;
    this.signatureKind = signatureKind;
    this.missingParty = missingParty;
  }

  public String label() {
    return label;
  }

  /** Signature kind behind this category, or null for status-driven categories. */
  public SignatureEntityKind signatureKind() {
    return signatureKind;
  }

  public SignatureParty missingParty() {
    return missingParty;
  }

  public boolean isSignatureCategory() {
    return signatureKind != null;
  }

  public static WorkflowCategory forSignature(SignatureEntityKind kind, SignatureParty missingParty) {
    for (WorkflowCategory category : values()) {
      if (category.signatureKind == kind && category.missingParty == missingParty) {
        return category;
      }
    }
    throw new IllegalArgumentException("No workflow category for " + kind + "/" + missingParty);
  }
}
