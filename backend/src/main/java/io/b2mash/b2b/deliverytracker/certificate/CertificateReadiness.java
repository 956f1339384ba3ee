package io.b2mash.b2b.deliverytracker.certificate;

import java.util.List;
import java.util.UUID;

/**
 * Whether a certificate can be generated for a milestone, and if not, why.
 *
 * @param blockingDeliverables live deliverables not yet delivered
 */
public record CertificateReadiness(
    boolean ready, String reason, List<BlockingDeliverable> blockingDeliverables) {

  public record BlockingDeliverable(UUID id, String itemRef, String name, String status) {}

  static CertificateReadiness allDelivered() {
    return new CertificateReadiness(true, null, List.of());
  }

  static CertificateReadiness notReady(String reason, List<BlockingDeliverable> blocking) {
    return new CertificateReadiness(false, reason, List.copyOf(blocking));
  }
}
