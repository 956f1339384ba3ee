package io.b2mash.b2b.deliverytracker.workflow;

import io.b2mash.b2b.deliverytracker.certificate.AcceptanceCertificate;
import io.b2mash.b2b.deliverytracker.certificate.AcceptanceCertificateRepository;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.member.ProjectCapability;
import io.b2mash.b2b.deliverytracker.member.ProjectRole;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import io.b2mash.b2b.deliverytracker.project.Project;
import io.b2mash.b2b.deliverytracker.project.ProjectRepository;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureParty;
import io.b2mash.b2b.deliverytracker.signature.SignatureRecord;
import io.b2mash.b2b.deliverytracker.signature.SignatureService;
import io.b2mash.b2b.deliverytracker.variation.Variation;
import io.b2mash.b2b.deliverytracker.variation.VariationRepository;
import io.b2mash.b2b.deliverytracker.workitem.WorkItem;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Read-side view of what is waiting for a member: open signature slots their role can fill,
 * deliverables awaiting their review, and collaborator records awaiting their approval. Nothing
 * here writes. Each source reads in its own read-only transaction, so a failing source drops its
 * categories from the result instead of failing the whole view.
 */
@Service
@EnableConfigurationProperties(WorkflowProperties.class)
public class WorkflowService {

  private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

  private final SignatureService signatureService;
  private final PermissionService permissionService;
  private final ProjectRepository projectRepository;
  private final WorkItemRepository workItemRepository;
  private final AcceptanceCertificateRepository certificateRepository;
  private final VariationRepository variationRepository;
  private final List<SubmittedRecordProvider> submittedRecordProviders;
  private final WorkflowProperties properties;
  private final TransactionTemplate sourceTx;

  public WorkflowService(
      SignatureService signatureService,
      PermissionService permissionService,
      ProjectRepository projectRepository,
      WorkItemRepository workItemRepository,
      AcceptanceCertificateRepository certificateRepository,
      VariationRepository variationRepository,
      List<SubmittedRecordProvider> submittedRecordProviders,
      WorkflowProperties properties,
      PlatformTransactionManager transactionManager) {
    this.signatureService = signatureService;
    this.permissionService = permissionService;
    this.projectRepository = projectRepository;
    this.workItemRepository = workItemRepository;
    this.certificateRepository = certificateRepository;
    this.variationRepository = variationRepository;
    this.submittedRecordProviders = submittedRecordProviders;
    this.properties = properties;
    this.sourceTx = new TransactionTemplate(transactionManager);
    this.sourceTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.sourceTx.setReadOnly(true);
  }

  /** Pending items in one project, for the member's role there. */
  public WorkflowSummary pendingFor(UUID memberId, UUID projectId) {
    var role = permissionService.roleFor(memberId, projectId);
    return aggregate(Map.of(projectId, role));
  }

  /** Pending items across all of the member's projects, each with the member's role there. */
  public WorkflowSummary pendingForMember(UUID memberId) {
    Map<UUID, ProjectRole> roles = new LinkedHashMap<>();
    for (Project project : projectRepository.findForMember(memberId)) {
      roles.put(project.getId(), permissionService.roleFor(memberId, project.getId()));
    }
    return aggregate(roles);
  }

  WorkflowSummary aggregate(Map<UUID, ProjectRole> rolesByProject) {
    Instant now = Instant.now();
    List<PendingItem> items = new ArrayList<>();
    Set<WorkflowCategory> unavailable = EnumSet.noneOf(WorkflowCategory.class);

    if (rolesByProject.isEmpty()) {
      return summarize(items, unavailable);
    }

    var reviewProjects = projectsActingOn(rolesByProject, WorkflowCategory.DELIVERABLE_REVIEW);
    if (!reviewProjects.isEmpty()) {
      try {
        items.addAll(fromSource(() -> deliverableReviews(reviewProjects, now)));
      } catch (RuntimeException e) {
        log.error("Failed to load deliverables awaiting review", e);
        unavailable.add(WorkflowCategory.DELIVERABLE_REVIEW);
      }
    }

    for (SignatureEntityKind kind : SignatureEntityKind.values()) {
      var supplier = WorkflowCategory.forSignature(kind, SignatureParty.PROVIDING);
      var customer = WorkflowCategory.forSignature(kind, SignatureParty.RECEIVING);
      boolean visible =
          !projectsActingOn(rolesByProject, supplier).isEmpty()
              || !projectsActingOn(rolesByProject, customer).isEmpty();
      if (!visible) {
        continue;
      }
      try {
        items.addAll(fromSource(() -> openSignatures(kind, rolesByProject, now)));
      } catch (RuntimeException e) {
        log.error("Failed to load open {} signatures", kind, e);
        if (!projectsActingOn(rolesByProject, supplier).isEmpty()) {
          unavailable.add(supplier);
        }
        if (!projectsActingOn(rolesByProject, customer).isEmpty()) {
          unavailable.add(customer);
        }
      }
    }

    for (SubmittedRecordProvider provider : submittedRecordProviders) {
      var category = provider.category();
      var projectIds = projectsActingOn(rolesByProject, category);
      if (projectIds.isEmpty()) {
        continue;
      }
      try {
        items.addAll(fromSource(() -> submittedRecords(provider, projectIds, now)));
      } catch (RuntimeException e) {
        log.error("Failed to load {} records from collaborator", category, e);
        unavailable.add(category);
      }
    }

    return summarize(items, unavailable);
  }

  /** Whether a member with {@code role} acts on items of {@code category}. */
  boolean canAct(ProjectRole role, WorkflowCategory category) {
    if (role == ProjectRole.ADMIN) {
      return true;
    }
    return switch (category) {
      case DELIVERABLE_REVIEW -> role.has(ProjectCapability.REVIEW_DELIVERABLE);
      case TIMESHEET_APPROVAL, EXPENSE_CHARGEABLE -> role == ProjectRole.CUSTOMER_PM;
      case EXPENSE_NON_CHARGEABLE -> role == ProjectRole.SUPPLIER_PM;
      default ->
          permissionService.isEligibleSigner(
              role, category.signatureKind(), category.missingParty());
    };
  }

  private List<PendingItem> fromSource(Supplier<List<PendingItem>> source) {
    var items = sourceTx.execute(status -> source.get());
    return items == null ? List.of() : items;
  }

  private List<PendingItem> submittedRecords(
      SubmittedRecordProvider provider, List<UUID> projectIds, Instant now) {
    var category = provider.category();
    List<PendingItem> items = new ArrayList<>();
    for (var record : provider.findSubmitted(projectIds)) {
      items.add(
          pendingItem(
              category,
              record.entityKind(),
              record.entityId(),
              record.projectId(),
              record.title(),
              "Approve " + category.label().toLowerCase(),
              null,
              record.status(),
              record.submittedAt(),
              now));
    }
    return items;
  }

  private List<PendingItem> deliverableReviews(List<UUID> projectIds, Instant now) {
    List<PendingItem> items = new ArrayList<>();
    for (WorkItem deliverable :
        workItemRepository.findLiveDeliverablesByStatus(
            projectIds, DeliverableStatus.SUBMITTED_FOR_REVIEW)) {
      items.add(
          pendingItem(
              WorkflowCategory.DELIVERABLE_REVIEW,
              SignatureEntityKind.DELIVERABLE.entityType(),
              deliverable.getId(),
              deliverable.getProjectId(),
              deliverable.getItemRef() + " " + deliverable.getName(),
              "Review deliverable",
              null,
              deliverable.getDeliverableStatus().label(),
              deliverable.getSubmittedAt() != null
                  ? deliverable.getSubmittedAt()
                  : deliverable.getUpdatedAt(),
              now));
    }
    return items;
  }

  private List<PendingItem> openSignatures(
      SignatureEntityKind kind, Map<UUID, ProjectRole> rolesByProject, Instant now) {
    var records = signatureService.findOpen(rolesByProject.keySet(), kind);
    if (records.isEmpty()) {
      return List.of();
    }
    var titles = titlesFor(kind, records.stream().map(SignatureRecord::getEntityId).toList());

    List<PendingItem> items = new ArrayList<>();
    for (SignatureRecord record : records) {
      var role = rolesByProject.get(record.getProjectId());
      for (SignatureParty missing : record.missingParties()) {
        var category = WorkflowCategory.forSignature(kind, missing);
        if (role == null || !canAct(role, category)) {
          continue;
        }
        items.add(
            pendingItem(
                category,
                kind.entityType(),
                record.getEntityId(),
                record.getProjectId(),
                titles.getOrDefault(record.getEntityId(), record.getEntityId().toString()),
                "Sign as " + missing.label(),
                missing,
                record.stage().label(),
                record.pendingSince(missing),
                now));
      }
    }
    return items;
  }

  private Map<UUID, String> titlesFor(SignatureEntityKind kind, List<UUID> entityIds) {
    return switch (kind) {
      case DELIVERABLE, BASELINE_COMMITMENT ->
          workItemRepository.findAllById(entityIds).stream()
              .collect(
                  Collectors.toMap(
                      WorkItem::getId, item -> item.getItemRef() + " " + item.getName()));
      case ACCEPTANCE_CERTIFICATE ->
          certificateRepository.findAllById(entityIds).stream()
              .collect(
                  Collectors.toMap(
                      AcceptanceCertificate::getId, AcceptanceCertificate::getCertificateNumber));
      case VARIATION ->
          variationRepository.findAllById(entityIds).stream()
              .collect(
                  Collectors.toMap(
                      Variation::getId, variation -> variation.getReference() + " " + variation.getTitle()));
    };
  }

  private List<UUID> projectsActingOn(
      Map<UUID, ProjectRole> rolesByProject, WorkflowCategory category) {
    return rolesByProject.entrySet().stream()
        .filter(entry -> canAct(entry.getValue(), category))
        .map(Map.Entry::getKey)
        .toList();
  }

  private PendingItem pendingItem(
      WorkflowCategory category,
      String entityKind,
      UUID entityId,
      UUID projectId,
      String title,
      String requiredAction,
      SignatureParty requiredParty,
      String status,
      Instant pendingSince,
      Instant now) {
    long days = pendingSince == null ? 0 : Math.max(0, Duration.between(pendingSince, now).toDays());
    return new PendingItem(
        category,
        entityKind,
        entityId,
        projectId,
        title,
        requiredAction,
        requiredParty,
        status,
        pendingSince,
        days,
        WorkflowUrgency.of(days, properties));
  }

  private static WorkflowSummary summarize(
      List<PendingItem> items, Set<WorkflowCategory> unavailable) {
    var sorted =
        items.stream()
            .sorted(
                Comparator.comparing(
                    PendingItem::pendingSince, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    Map<WorkflowCategory, Integer> counts = new EnumMap<>(WorkflowCategory.class);
    for (PendingItem item : sorted) {
      counts.merge(item.category(), 1, Integer::sum);
    }
    return new WorkflowSummary(sorted, counts, sorted.size(), List.copyOf(unavailable));
  }
}
