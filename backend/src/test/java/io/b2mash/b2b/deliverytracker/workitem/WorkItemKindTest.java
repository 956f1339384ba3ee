package io.b2mash.b2b.deliverytracker.workitem;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class WorkItemKindTest {

  @Test
  void milestoneIsAlwaysRoot() {
    assertThat(WorkItemKind.MILESTONE.acceptsParent(null)).isTrue();
    assertThat(WorkItemKind.MILESTONE.acceptsParent(WorkItemKind.MILESTONE)).isFalse();
    assertThat(WorkItemKind.MILESTONE.acceptsParent(WorkItemKind.DELIVERABLE)).isFalse();
  }

  @Test
  void deliverableOnlyUnderMilestone() {
    assertThat(WorkItemKind.DELIVERABLE.acceptsParent(WorkItemKind.MILESTONE)).isTrue();
    assertThat(WorkItemKind.DELIVERABLE.acceptsParent(null)).isFalse();
    assertThat(WorkItemKind.DELIVERABLE.acceptsParent(WorkItemKind.DELIVERABLE)).isFalse();
    assertThat(WorkItemKind.DELIVERABLE.acceptsParent(WorkItemKind.TASK)).isFalse();
  }

  @Test
  void taskUnderDeliverableOrTask() {
    assertThat(WorkItemKind.TASK.acceptsParent(WorkItemKind.DELIVERABLE)).isTrue();
    assertThat(WorkItemKind.TASK.acceptsParent(WorkItemKind.TASK)).isTrue();
    assertThat(WorkItemKind.TASK.acceptsParent(WorkItemKind.MILESTONE)).isFalse();
    assertThat(WorkItemKind.TASK.acceptsParent(null)).isFalse();
  }

  @Test
  void demotedKinds() {
    assertThat(WorkItemKind.MILESTONE.demoted()).isEqualTo(WorkItemKind.DELIVERABLE);
    assertThat(WorkItemKind.DELIVERABLE.demoted()).isEqualTo(WorkItemKind.TASK);
    assertThat(WorkItemKind.TASK.demoted()).isEqualTo(WorkItemKind.TASK);
  }
}
