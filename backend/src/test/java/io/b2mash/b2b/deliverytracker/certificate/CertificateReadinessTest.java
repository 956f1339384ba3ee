package io.b2mash.b2b.deliverytracker.certificate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class CertificateReadinessTest {

  @Test
  void allDeliveredIsReadyWithNothingBlocking() {
    var readiness = CertificateReadiness.allDelivered();

    assertThat(readiness.ready()).isTrue();
    assertThat(readiness.reason()).isNull();
    assertThat(readiness.blockingDeliverables()).isEmpty();
  }

  @Test
  void notReadyKeepsReasonAndBlockingDeliverables() {
    var blocking =
        new CertificateReadiness.BlockingDeliverable(
            UUID.randomUUID(), "DEL-002", "Testing", "Submitted for Review");

    var readiness = CertificateReadiness.notReady("1 deliverable not delivered", List.of(blocking));

    assertThat(readiness.ready()).isFalse();
    assertThat(readiness.reason()).isEqualTo("1 deliverable not delivered");
    assertThat(readiness.blockingDeliverables()).containsExactly(blocking);
  }
}
