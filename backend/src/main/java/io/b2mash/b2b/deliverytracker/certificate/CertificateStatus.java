package io.b2mash.b2b.deliverytracker.certificate;

import java.util.Map;
import java.util.Set;

/** Acceptance certificate status with validated transitions. */
public enum CertificateStatus {
  DRAFT("Draft"),
  READY_TO_BILL("Ready to Bill"),
  BILLED("Billed");

  private static final Map<CertificateStatus, Set<CertificateStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          DRAFT, Set.of(READY_TO_BILL),
          READY_TO_BILL, Set.of(BILLED),
          BILLED, Set.of());

  private final String label;

  CertificateStatus(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public boolean canTransitionTo(CertificateStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }
}
