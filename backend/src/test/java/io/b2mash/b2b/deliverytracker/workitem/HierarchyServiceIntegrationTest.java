package io.b2mash.b2b.deliverytracker.workitem;

import static io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture.named;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.deliverytracker.TestcontainersConfiguration;
import io.b2mash.b2b.deliverytracker.baseline.BaselineCommitmentService;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableService;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.exception.ForbiddenException;
import io.b2mash.b2b.deliverytracker.exception.NoValidParentException;
import io.b2mash.b2b.deliverytracker.exception.PromotionBlockedException;
import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.exception.TypeConstraintException;
import io.b2mash.b2b.deliverytracker.member.ProjectMemberService;
import io.b2mash.b2b.deliverytracker.member.ProjectRole;
import io.b2mash.b2b.deliverytracker.project.ProjectService;
import io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture;
import io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture.ProjectParties;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class HierarchyServiceIntegrationTest {

  @Autowired private ProjectService projectService;
  @Autowired private ProjectMemberService projectMemberService;
  @Autowired private HierarchyService hierarchyService;
  @Autowired private DeliverableService deliverableService;
  @Autowired private WorkItemRepository workItemRepository;
  @Autowired private BaselineCommitmentService baselineCommitmentService;

  private ProjectParties parties;

  @BeforeEach
  void createProject() {
    parties = TestProjectFixture.createProject(projectService, projectMemberService, "Plan Project");
  }

  @Test
  void wbsPathsFollowParentsAndSiblingOrder() {
    var phase1 = create(WorkItemKind.MILESTONE, null, "Phase 1");
    var phase2 = create(WorkItemKind.MILESTONE, null, "Phase 2");
    var design = create(WorkItemKind.DELIVERABLE, phase1, "Design");
    var build = create(WorkItemKind.DELIVERABLE, phase1, "Build");
    var task = create(WorkItemKind.TASK, design, "Draft");
    var subtask = create(WorkItemKind.TASK, task, "Outline");

    assertThat(wbs(phase1)).isEqualTo("1");
    assertThat(wbs(phase2)).isEqualTo("2");
    assertThat(wbs(design)).isEqualTo("1.1");
    assertThat(wbs(build)).isEqualTo("1.2");
    assertThat(wbs(task)).isEqualTo("1.1.1");
    assertThat(wbs(subtask)).isEqualTo("1.1.1.1");
    assertThat(workItemRepository.findById(design).orElseThrow().getItemRef()).startsWith("DEL");
  }

  @Test
  void kindsOnlyNestWhereAllowed() {
    var phase = create(WorkItemKind.MILESTONE, null, "Phase");

    assertThatThrownBy(() -> create(WorkItemKind.TASK, phase, "Stray task"))
        .isInstanceOf(TypeConstraintException.class);
    assertThatThrownBy(() -> create(WorkItemKind.DELIVERABLE, null, "Floating deliverable"))
        .isInstanceOf(TypeConstraintException.class);
  }

  @Test
  void reorderRenumbersSiblings() {
    var phase = create(WorkItemKind.MILESTONE, null, "Phase");
    var first = create(WorkItemKind.DELIVERABLE, phase, "First");
    var second = create(WorkItemKind.DELIVERABLE, phase, "Second");

    hierarchyService.reorder(parties.projectId(), phase, List.of(second, first), parties.adminId());

    assertThat(wbs(second)).isEqualTo("1.1");
    assertThat(wbs(first)).isEqualTo("1.2");
  }

  @Test
  void deliverableMovedToTopLevelBecomesMilestone() {
    var phase = create(WorkItemKind.MILESTONE, null, "Phase");
    var deliverable = create(WorkItemKind.DELIVERABLE, phase, "Spin-off");

    var promoted = hierarchyService.move(deliverable, null, null, null, parties.adminId());

    assertThat(promoted.getKind()).isEqualTo(WorkItemKind.MILESTONE);
    assertThat(promoted.getDeliverableStatus()).isNull();
    assertThat(wbs(deliverable)).isEqualTo("2");
  }

  @Test
  void deliverableWithTasksCannotBePromoted() {
    var phase = create(WorkItemKind.MILESTONE, null, "Phase");
    var deliverable = create(WorkItemKind.DELIVERABLE, phase, "Busy");
    create(WorkItemKind.TASK, deliverable, "Work");

    assertThatThrownBy(() -> hierarchyService.move(deliverable, null, null, null, parties.adminId()))
        .isInstanceOf(PromotionBlockedException.class);
  }

  @Test
  void moveRecomputesWbsOnBothSides() {
    var phase1 = create(WorkItemKind.MILESTONE, null, "Phase 1");
    var phase2 = create(WorkItemKind.MILESTONE, null, "Phase 2");
    var first = create(WorkItemKind.DELIVERABLE, phase1, "First");
    var second = create(WorkItemKind.DELIVERABLE, phase1, "Second");
    var task = create(WorkItemKind.TASK, second, "Work");

    hierarchyService.move(first, phase2, null, null, parties.adminId());

    assertThat(wbs(first)).isEqualTo("2.1");
    assertThat(wbs(second)).isEqualTo("1.1");
    assertThat(wbs(task)).isEqualTo("1.1.1");
  }

  @Test
  void indentingFirstSiblingHasNoParentToReceiveIt() {
    var phase = create(WorkItemKind.MILESTONE, null, "Phase");
    var deliverable = create(WorkItemKind.DELIVERABLE, phase, "Only");
    var task = create(WorkItemKind.TASK, deliverable, "Lead");

    assertThatThrownBy(() -> hierarchyService.indent(phase, parties.adminId()))
        .isInstanceOf(NoValidParentException.class);
    assertThatThrownBy(() -> hierarchyService.indent(deliverable, parties.adminId()))
        .isInstanceOf(NoValidParentException.class);
    assertThatThrownBy(() -> hierarchyService.indent(task, parties.adminId()))
        .isInstanceOf(NoValidParentException.class);
    assertThat(wbs(phase)).isEqualTo("1");
  }

  @Test
  void indentedMilestoneBecomesLastDeliverableOfPrecedingMilestone() {
    var phase1 = create(WorkItemKind.MILESTONE, null, "Phase 1");
    create(WorkItemKind.DELIVERABLE, phase1, "Existing");
    var phase2 = create(WorkItemKind.MILESTONE, null, "Phase 2");
    var phase3 = create(WorkItemKind.MILESTONE, null, "Phase 3");

    var demoted = hierarchyService.indent(phase2, parties.adminId());

    assertThat(demoted.getKind()).isEqualTo(WorkItemKind.DELIVERABLE);
    assertThat(demoted.getParentId()).isEqualTo(phase1);
    assertThat(wbs(phase2)).isEqualTo("1.2");
    assertThat(wbs(phase3)).isEqualTo("2");
  }

  @Test
  void indentedDeliverableBecomesTaskOfPrecedingDeliverable() {
    var phase = create(WorkItemKind.MILESTONE, null, "Phase");
    var design = create(WorkItemKind.DELIVERABLE, phase, "Design");
    var review = create(WorkItemKind.DELIVERABLE, phase, "Review");

    var demoted = hierarchyService.indent(review, parties.adminId());

    assertThat(demoted.getKind()).isEqualTo(WorkItemKind.TASK);
    assertThat(demoted.getParentId()).isEqualTo(design);
    assertThat(wbs(review)).isEqualTo("1.1.1");
  }

  @Test
  void milestoneWithDeliverablesCannotBeIndented() {
    create(WorkItemKind.MILESTONE, null, "Phase 1");
    var phase2 = create(WorkItemKind.MILESTONE, null, "Phase 2");
    create(WorkItemKind.DELIVERABLE, phase2, "Keeps it a milestone");

    assertThatThrownBy(() -> hierarchyService.indent(phase2, parties.adminId()))
        .isInstanceOf(TypeConstraintException.class);
    assertThat(wbs(phase2)).isEqualTo("2");
  }

  @Test
  void milestoneAwaitingBaselineCommitmentCannotBeIndented() {
    create(WorkItemKind.MILESTONE, null, "Phase 1");
    var phase2 = create(WorkItemKind.MILESTONE, null, "Phase 2");
    baselineCommitmentService.requestCommitment(phase2, parties.adminId());

    assertThatThrownBy(() -> hierarchyService.indent(phase2, parties.adminId()))
        .isInstanceOf(ResourceConflictException.class);

    var unchanged = workItemRepository.findById(phase2).orElseThrow();
    assertThat(unchanged.getKind()).isEqualTo(WorkItemKind.MILESTONE);
    assertThat(unchanged.getParentId()).isNull();
  }

  @Test
  void outdentPromotesOneLevelAndRenumbers() {
    var phase1 = create(WorkItemKind.MILESTONE, null, "Phase 1");
    var phase2 = create(WorkItemKind.MILESTONE, null, "Phase 2");
    var deliverable = create(WorkItemKind.DELIVERABLE, phase1, "Design");
    var task = create(WorkItemKind.TASK, deliverable, "Draft");

    var lifted = hierarchyService.outdent(task, parties.adminId());
    assertThat(lifted.getKind()).isEqualTo(WorkItemKind.DELIVERABLE);
    assertThat(lifted.getParentId()).isEqualTo(phase1);
    assertThat(wbs(task)).isEqualTo("1.2");

    var promoted = hierarchyService.outdent(task, parties.adminId());
    assertThat(promoted.getKind()).isEqualTo(WorkItemKind.MILESTONE);
    assertThat(promoted.getParentId()).isNull();
    assertThat(wbs(task)).isEqualTo("2");
    assertThat(wbs(phase2)).isEqualTo("3");
  }

  @Test
  void rootMilestoneCannotBeOutdented() {
    var phase = create(WorkItemKind.MILESTONE, null, "Phase");

    assertThatThrownBy(() -> hierarchyService.outdent(phase, parties.adminId()))
        .isInstanceOf(TypeConstraintException.class);
  }

  @Test
  void softDeleteHidesSubtreeAndRestoreBringsItBack() {
    var phase1 = create(WorkItemKind.MILESTONE, null, "Phase 1");
    var phase2 = create(WorkItemKind.MILESTONE, null, "Phase 2");
    var deliverable = create(WorkItemKind.DELIVERABLE, phase1, "Inside");

    hierarchyService.softDelete(phase1, parties.adminId());

    assertThat(workItemRepository.findLiveById(phase1)).isEmpty();
    assertThat(workItemRepository.findLiveById(deliverable)).isEmpty();
    assertThat(wbs(phase2)).isEqualTo("1");

    hierarchyService.restore(phase1, parties.adminId());

    assertThat(workItemRepository.findLiveById(deliverable)).isPresent();
    assertThat(wbs(phase2)).isEqualTo("1");
    assertThat(wbs(phase1)).isEqualTo("2");
    assertThat(wbs(deliverable)).isEqualTo("2.1");
  }

  @Test
  void taskProgressRollsUpIntoDeliverable() {
    var phase = create(WorkItemKind.MILESTONE, null, "Phase");
    var deliverable = create(WorkItemKind.DELIVERABLE, phase, "Rollup");
    var first = create(WorkItemKind.TASK, deliverable, "A");
    var second = create(WorkItemKind.TASK, deliverable, "B");

    deliverableService.updateProgress(first, 100, parties.supplierId());
    deliverableService.updateProgress(second, 50, parties.supplierId());

    var rolledUp = workItemRepository.findById(deliverable).orElseThrow();
    assertThat(rolledUp.getProgress()).isEqualTo(75);
    assertThat(rolledUp.getDeliverableStatus()).isEqualTo(DeliverableStatus.IN_PROGRESS);
  }

  @Test
  void viewerCannotChangeThePlan() {
    var viewerId = UUID.randomUUID();
    projectMemberService.addMember(
        parties.projectId(), viewerId, ProjectRole.VIEWER, parties.adminId());

    assertThatThrownBy(
            () ->
                hierarchyService.createItem(
                    parties.projectId(), WorkItemKind.MILESTONE, null, named("Nope"), viewerId))
        .isInstanceOf(ForbiddenException.class);
  }

  private UUID create(WorkItemKind kind, UUID parentId, String name) {
    return hierarchyService
        .createItem(parties.projectId(), kind, parentId, named(name), parties.adminId())
        .getId();
  }

  private String wbs(UUID itemId) {
    return workItemRepository.findById(itemId).orElseThrow().getWbs();
  }
}
