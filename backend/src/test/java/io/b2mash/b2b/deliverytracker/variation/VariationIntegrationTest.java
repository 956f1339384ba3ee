package io.b2mash.b2b.deliverytracker.variation;

import static io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture.named;
import static io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture.scheduled;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.deliverytracker.TestcontainersConfiguration;
import io.b2mash.b2b.deliverytracker.baseline.BaselineCommitmentService;
import io.b2mash.b2b.deliverytracker.baseline.BaselineSource;
import io.b2mash.b2b.deliverytracker.baseline.BaselineVersion;
import io.b2mash.b2b.deliverytracker.baseline.BaselineVersionRepository;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableService;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.member.ProjectMemberService;
import io.b2mash.b2b.deliverytracker.milestone.MilestoneHealth;
import io.b2mash.b2b.deliverytracker.milestone.MilestoneViewService;
import io.b2mash.b2b.deliverytracker.project.ProjectRepository;
import io.b2mash.b2b.deliverytracker.project.ProjectService;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureParty;
import io.b2mash.b2b.deliverytracker.signature.SignatureService;
import io.b2mash.b2b.deliverytracker.signature.SignatureState;
import io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture;
import io.b2mash.b2b.deliverytracker.testutil.TestProjectFixture.ProjectParties;
import io.b2mash.b2b.deliverytracker.variation.VariationService.DeliverableChangeRequest;
import io.b2mash.b2b.deliverytracker.workitem.HierarchyService;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemKind;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
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
class VariationIntegrationTest {

  private static final LocalDate START = LocalDate.of(2026, 6, 1);
  private static final LocalDate END = LocalDate.of(2026, 6, 30);

  @Autowired private ProjectService projectService;
  @Autowired private ProjectRepository projectRepository;
  @Autowired private ProjectMemberService projectMemberService;
  @Autowired private HierarchyService hierarchyService;
  @Autowired private DeliverableService deliverableService;
  @Autowired private SignatureService signatureService;
  @Autowired private BaselineCommitmentService baselineCommitmentService;
  @Autowired private BaselineVersionRepository baselineVersionRepository;
  @Autowired private VariationService variationService;
  @Autowired private VariationRepository variationRepository;
  @Autowired private VariationMilestoneImpactRepository impactRepository;
  @Autowired private WorkItemRepository workItemRepository;
  @Autowired private MilestoneViewService milestoneViewService;

  @Test
  void appliedVariationAddsVersionThreeAndTheNewDeliverable() {
    var parties = TestProjectFixture.createProject(projectService, projectMemberService, "Var Apply");
    var milestone = milestone(parties);
    deliverable(parties, milestone, "Design pack");
    commitBaseline(parties, milestone);

    var first = draft(parties, "Schedule slip");
    variationService.addMilestoneImpact(
        first.getId(), milestone, null, END.plusDays(15), null, "Late site access", parties.supplierId());
    submitAndSign(parties, first.getId());
    assertThat(versionNumbers(milestone)).containsExactly(1, 2);

    var second = draft(parties, "Training module");
    var impact =
        variationService.addMilestoneImpact(
            second.getId(),
            milestone,
            null,
            null,
            new BigDecimal("15000.00"),
            "Extra scope",
            parties.supplierId());
    variationService.addDeliverableChange(
        second.getId(),
        new DeliverableChangeRequest(
            DeliverableChangeType.ADD, milestone, null, "Operator training", null, null, null, null),
        parties.supplierId());
    var submitted = variationService.submit(second.getId(), parties.supplierId());
    assertThat(submitted.getTotalCostImpact()).isEqualByComparingTo("5000.00");
    sign(parties, second.getId());

    var versions = baselineVersionRepository.findByMilestoneIdOrderByVersionNumberAsc(milestone);
    assertThat(versions).extracting(BaselineVersion::getVersionNumber).containsExactly(1, 2, 3);
    var latest = versions.get(2);
    assertThat(latest.getSource()).isEqualTo(BaselineSource.VARIATION);
    assertThat(latest.getVariationId()).isEqualTo(second.getId());
    assertThat(latest.getEndDate()).isEqualTo(END.plusDays(15));
    assertThat(latest.getValue()).isEqualByComparingTo("15000.00");
    assertThat(latest.getDeliverables())
        .extracting(entry -> entry.get("name"))
        .containsExactly("Design pack", "Operator training");

    var applied = variationRepository.findById(second.getId()).orElseThrow();
    var project = projectRepository.findById(parties.projectId()).orElseThrow();
    assertThat(applied.getStatus()).isEqualTo(VariationStatus.APPLIED);
    assertThat(applied.getCertificateNumber())
        .isEqualTo(project.getReference() + "-" + applied.getReference() + "-CERT");

    var recordedImpact = impactRepository.findById(impact.getId()).orElseThrow();
    assertThat(recordedImpact.getBaselineVersionBefore()).isEqualTo(2);
    assertThat(recordedImpact.getBaselineVersionAfter()).isEqualTo(3);

    var updatedMilestone = workItemRepository.findById(milestone).orElseThrow();
    assertThat(updatedMilestone.getValue()).isEqualByComparingTo("15000.00");
    assertThat(updatedMilestone.getEndDate()).isEqualTo(END.plusDays(15));
    assertThat(workItemRepository.findLiveChildren(milestone))
        .extracting(WorkItem::getName)
        .contains("Operator training");
  }

  @Test
  void failedApplicationLeavesNoTrace() {
    var parties = TestProjectFixture.createProject(projectService, projectMemberService, "Var Fail");
    var milestone = milestone(parties);
    var delivered = deliverable(parties, milestone, "Survey");
    commitBaseline(parties, milestone);

    var earlier = draft(parties, "Schedule slip");
    variationService.addMilestoneImpact(
        earlier.getId(), milestone, null, END.plusDays(15), null, "Late site access", parties.supplierId());
    submitAndSign(parties, earlier.getId());
    assertThat(versionNumbers(milestone)).containsExactly(1, 2);
    TestProjectFixture.deliver(delivered, parties, deliverableService, signatureService);

    var variation = draft(parties, "Drop survey");
    variationService.addMilestoneImpact(
        variation.getId(), milestone, null, END.plusDays(30), null, null, parties.supplierId());
    variationService.addDeliverableChange(
        variation.getId(),
        new DeliverableChangeRequest(
            DeliverableChangeType.REMOVE, null, delivered, null, null, null, null, "Not needed"),
        parties.supplierId());
    variationService.submit(variation.getId(), parties.supplierId());
    signatureService.sign(
        SignatureEntityKind.VARIATION,
        variation.getId(),
        SignatureParty.PROVIDING,
        parties.supplierId(),
        null);

    assertThatThrownBy(
            () ->
                signatureService.sign(
                    SignatureEntityKind.VARIATION,
                    variation.getId(),
                    SignatureParty.RECEIVING,
                    parties.customerId(),
                    null))
        .isInstanceOf(InvalidStateException.class);

    assertThat(versionNumbers(milestone)).containsExactly(1, 2);
    var current =
        baselineVersionRepository.findTopByMilestoneIdOrderByVersionNumberDesc(milestone).orElseThrow();
    assertThat(current.getVariationId()).isEqualTo(earlier.getId());
    assertThat(current.getEndDate()).isEqualTo(END.plusDays(15));
    assertThat(variationRepository.findById(variation.getId()).orElseThrow().getStatus())
        .isEqualTo(VariationStatus.SUBMITTED);
    var record =
        signatureService.findActive(SignatureEntityKind.VARIATION, variation.getId()).orElseThrow();
    assertThat(record.state()).isEqualTo(SignatureState.PARTIALLY_SIGNED);
    assertThat(record.isSigned(SignatureParty.RECEIVING)).isFalse();
    var survey = workItemRepository.findById(delivered).orElseThrow();
    assertThat(survey.isDeleted()).isFalse();
    assertThat(survey.getDeliverableStatus()).isEqualTo(DeliverableStatus.DELIVERED);
    assertThat(workItemRepository.findById(milestone).orElseThrow().getEndDate())
        .isEqualTo(END.plusDays(15));
  }

  @Test
  void deliverableSlipBreachesBaselineUntilVariationRebaselines() {
    var parties = TestProjectFixture.createProject(projectService, projectMemberService, "Var Breach");
    var milestone = milestone(parties);
    var install =
        hierarchyService
            .createItem(
                parties.projectId(),
                WorkItemKind.DELIVERABLE,
                milestone,
                scheduled("Install", START, END.minusDays(5), null),
                parties.adminId())
            .getId();

    var beforeCommit =
        hierarchyService.updateItem(
            install, scheduled("Install", START, END.plusDays(10), null), null, parties.supplierId());
    assertThat(milestoneViewService.getView(milestone, parties.adminId()).health())
        .isEqualTo(MilestoneHealth.NORMAL);
    hierarchyService.updateItem(
        install, scheduled("Install", START, END.minusDays(5), null), null, parties.supplierId());

    commitBaseline(parties, milestone);
    assertThat(milestoneViewService.getView(milestone, parties.adminId()).health())
        .isEqualTo(MilestoneHealth.NORMAL);

    hierarchyService.updateItem(
        install, scheduled("Install", START, END.plusDays(10), null), null, parties.supplierId());
    var breached = milestoneViewService.getView(milestone, parties.adminId());
    assertThat(breached.health()).isEqualTo(MilestoneHealth.BREACHED);
    assertThat(breached.baselineEndDate()).isEqualTo(END);
    assertThat(breached.breachingDeliverables()).containsExactly(beforeCommit.getItemRef());

    var check =
        milestoneViewService.checkDeliverableDate(milestone, END.plusDays(1), parties.adminId());
    assertThat(check.baselined()).isTrue();
    assertThat(check.limitDate()).isEqualTo(END);
    assertThat(check.wouldBreach()).isTrue();

    var extension = draft(parties, "Extend install window");
    variationService.addMilestoneImpact(
        extension.getId(), milestone, null, END.plusDays(14), null, "Late delivery", parties.supplierId());
    submitAndSign(parties, extension.getId());

    var rebaselined = milestoneViewService.getView(milestone, parties.adminId());
    assertThat(rebaselined.health()).isEqualTo(MilestoneHealth.NORMAL);
    assertThat(rebaselined.baselineEndDate()).isEqualTo(END.plusDays(14));
    assertThat(rebaselined.breachingDeliverables()).isEmpty();
  }

  @Test
  void rejectedVariationCanBeReworkedAndResubmitted() {
    var parties = TestProjectFixture.createProject(projectService, projectMemberService, "Var Reject");
    var milestone = milestone(parties);

    var variation = draft(parties, "Extra reviews");
    variationService.addMilestoneImpact(
        variation.getId(), milestone, null, null, new BigDecimal("11000.00"), null, parties.supplierId());
    variationService.submit(variation.getId(), parties.supplierId());

    var rejected = variationService.reject(variation.getId(), "Budget frozen", parties.customerId());
    assertThat(rejected.getStatus()).isEqualTo(VariationStatus.REJECTED);
    assertThat(signatureService.findActive(SignatureEntityKind.VARIATION, variation.getId()))
        .isEmpty();

    variationService.resetToDraft(variation.getId(), parties.supplierId());
    variationService.submit(variation.getId(), parties.supplierId());

    assertThat(
            signatureService
                .findActive(SignatureEntityKind.VARIATION, variation.getId())
                .orElseThrow()
                .getRevision())
        .isEqualTo(2);
  }

  @Test
  void emptyVariationCannotBeSubmitted() {
    var parties = TestProjectFixture.createProject(projectService, projectMemberService, "Var Empty");
    var variation = draft(parties, "Nothing yet");

    assertThatThrownBy(() -> variationService.submit(variation.getId(), parties.supplierId()))
        .isInstanceOf(InvalidStateException.class);
  }

  private Variation draft(ProjectParties parties, String title) {
    return variationService.create(
        parties.projectId(), title, null, "Customer request", VariationType.COMBINED, parties.supplierId());
  }

  private void submitAndSign(ProjectParties parties, UUID variationId) {
    variationService.submit(variationId, parties.supplierId());
    sign(parties, variationId);
  }

  private void sign(ProjectParties parties, UUID variationId) {
    signatureService.sign(
        SignatureEntityKind.VARIATION, variationId, SignatureParty.PROVIDING, parties.supplierId(), null);
    signatureService.sign(
        SignatureEntityKind.VARIATION, variationId, SignatureParty.RECEIVING, parties.customerId(), null);
  }

  private void commitBaseline(ProjectParties parties, UUID milestoneId) {
    baselineCommitmentService.requestCommitment(milestoneId, parties.adminId());
    signatureService.sign(
        SignatureEntityKind.BASELINE_COMMITMENT,
        milestoneId,
        SignatureParty.PROVIDING,
        parties.supplierId(),
        null);
    signatureService.sign(
        SignatureEntityKind.BASELINE_COMMITMENT,
        milestoneId,
        SignatureParty.RECEIVING,
        parties.customerId(),
        null);
  }

  private List<Integer> versionNumbers(UUID milestoneId) {
    return baselineVersionRepository.findByMilestoneIdOrderByVersionNumberAsc(milestoneId).stream()
        .map(BaselineVersion::getVersionNumber)
        .toList();
  }

  private UUID milestone(ProjectParties parties) {
    return hierarchyService
        .createItem(
            parties.projectId(),
            WorkItemKind.MILESTONE,
            null,
            scheduled("Phase 1", START, END, new BigDecimal("10000.00")),
            parties.adminId())
        .getId();
  }

  private UUID deliverable(ProjectParties parties, UUID milestoneId, String name) {
    return hierarchyService
        .createItem(
            parties.projectId(), WorkItemKind.DELIVERABLE, milestoneId, named(name), parties.adminId())
        .getId();
  }
}
