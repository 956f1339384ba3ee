package io.b2mash.b2b.deliverytracker.workitem;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.deliverytracker.workitem.WbsCalculator.Node;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class WbsCalculatorTest {

  @Test
  void numbersRootsBySiblingPosition() {
    var first = UUID.randomUUID();
    var second = UUID.randomUUID();

    var paths = WbsCalculator.compute(List.of(new Node(second, null, 1), new Node(first, null, 0)));

    assertThat(paths).containsEntry(first, "1").containsEntry(second, "2");
  }

  @Test
  void nestsPathsThroughArbitraryTaskDepth() {
    var milestone = UUID.randomUUID();
    var deliverable = UUID.randomUUID();
    var task = UUID.randomUUID();
    var subtask = UUID.randomUUID();
    var secondDeliverable = UUID.randomUUID();

    var paths =
        WbsCalculator.compute(
            List.of(
                new Node(milestone, null, 0),
                new Node(secondDeliverable, milestone, 1),
                new Node(deliverable, milestone, 0),
                new Node(task, deliverable, 0),
                new Node(subtask, task, 0)));

    assertThat(paths)
        .containsEntry(milestone, "1")
        .containsEntry(deliverable, "1.1")
        .containsEntry(secondDeliverable, "1.2")
        .containsEntry(task, "1.1.1")
        .containsEntry(subtask, "1.1.1.1");
  }

  @Test
  void gapsInPositionsDoNotLeakIntoPaths() {
    var milestone = UUID.randomUUID();
    var a = UUID.randomUUID();
    var b = UUID.randomUUID();

    var paths =
        WbsCalculator.compute(
            List.of(new Node(milestone, null, 3), new Node(a, milestone, 4), new Node(b, milestone, 9)));

    assertThat(paths).containsEntry(milestone, "1").containsEntry(a, "1.1").containsEntry(b, "1.2");
  }

  @Test
  void unreachableNodesGetNoPath() {
    var orphan = UUID.randomUUID();

    var paths = WbsCalculator.compute(List.of(new Node(orphan, UUID.randomUUID(), 0)));

    assertThat(paths).doesNotContainKey(orphan);
  }
}
