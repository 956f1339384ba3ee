package io.b2mash.b2b.deliverytracker.workflow;

import static io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture.named;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.deliverytracker.TestcontainersConfiguration;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableService;
import io.b2mash.b2b.deliverytracker.member.ProjectMemberService;
import io.b2mash.b2b.deliverytracker.project.ProjectService;
import io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture;
import io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture.ProjectParties;
import io.b2mash.b2b.deliverytracker.workflow.SubmittedRecordProvider.SubmittedRecord;
import io.b2mash.b2b.deliverytracker.workitem.HierarchyService;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemKind;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.annotation.Order;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@Import({
  TestcontainersConfiguration.class,
  WorkflowServiceIntegrationTest.CollaboratorSources.class
})
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class WorkflowServiceIntegrationTest {

  @Autowired private ProjectService projectService;
  @Autowired private ProjectMemberService projectMemberService;
  @Autowired private HierarchyService hierarchyService;
  @Autowired private DeliverableService deliverableService;
  @Autowired private WorkflowService workflowService;

  private ProjectParties parties;
  private UUID deliverableId;

  @BeforeAll
  void deliverableAwaitingSignOff() {
    parties =
        TestProjectFixture.createProject(projectService, projectMemberService, "Workflow Sources");
    var milestone =
        hierarchyService
            .createItem(
                parties.projectId(), WorkItemKind.MILESTONE, null, named("Phase"), parties.adminId())
            .getId();
    deliverableId =
        hierarchyService
            .createItem(
                parties.projectId(),
                WorkItemKind.DELIVERABLE,
                milestone,
                named("Handover pack"),
                parties.adminId())
            .getId();
    deliverableService.updateProgress(deliverableId, 100, parties.supplierId());
    deliverableService.submitForReview(deliverableId, parties.supplierId());
    deliverableService.acceptReview(deliverableId, parties.customerId());
  }

  @Test
  void failingCollaboratorSourceDoesNotAbortOtherCategories() {
    var summary = workflowService.pendingFor(parties.customerId(), parties.projectId());

    assertThat(summary.unavailableCategories())
        .containsExactly(WorkflowCategory.EXPENSE_CHARGEABLE);
    assertThat(summary.items())
        .extracting(PendingItem::category)
        .containsExactlyInAnyOrder(
            WorkflowCategory.DELIVERABLE_SIGN_OFF_CUSTOMER, WorkflowCategory.TIMESHEET_APPROVAL);
    assertThat(summary.items())
        .filteredOn(item -> item.category() == WorkflowCategory.DELIVERABLE_SIGN_OFF_CUSTOMER)
        .extracting(PendingItem::entityId)
        .containsExactly(deliverableId);
  }

  @Test
  void crossProjectViewSurvivesFailingSource() {
    var summary = workflowService.pendingForMember(parties.customerId());

    assertThat(summary.unavailableCategories())
        .containsExactly(WorkflowCategory.EXPENSE_CHARGEABLE);
    assertThat(summary.total()).isEqualTo(2);
  }

  @TestConfiguration(proxyBeanMethods = false)
  static class CollaboratorSources {

    @Bean
    @Order(1)
    SubmittedRecordProvider brokenExpenseSource() {
      return new BrokenExpenseSource();
    }

    @Bean
    @Order(2)
    SubmittedRecordProvider timesheetSource() {
      return new TimesheetSource();
    }
  }

  /** Queries a table that does not exist, aborting its database transaction. */
  static class BrokenExpenseSource implements SubmittedRecordProvider {

    @PersistenceContext private EntityManager entityManager;

    @Override
    public WorkflowCategory category() {
      return WorkflowCategory.EXPENSE_CHARGEABLE;
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubmittedRecord> findSubmitted(Collection<UUID> projectIds) {
      entityManager.createNativeQuery("SELECT id FROM expense_claims").getResultList();
      return List.of();
    }
  }

  /** One submitted timesheet per project, read from the live database. */
  static class TimesheetSource implements SubmittedRecordProvider {

    @PersistenceContext private EntityManager entityManager;

    @Override
    public WorkflowCategory category() {
      return WorkflowCategory.TIMESHEET_APPROVAL;
    }

    @Override
    @Transactional(readOnly = true)
    @SuppressWarnings("unchecked")
    public List<SubmittedRecord> findSubmitted(Collection<UUID> projectIds) {
      List<Object[]> rows =
          entityManager
              .createNativeQuery("SELECT id, name FROM projects WHERE id IN (:ids)")
              .setParameter("ids", projectIds)
              .getResultList();
      return rows.stream()
          .map(
              row ->
                  new SubmittedRecord(
                      "timesheet",
                      (UUID) row[0],
                      (UUID) row[0],
                      "Timesheet for " + row[1],
                      "Submitted",
                      Instant.now()))
          .toList();
    }
  }
}
