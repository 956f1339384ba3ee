package io.b2mash.b2b.deliverytracker.workitem;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.baseline.BaselineVersionRepository;
import io.b2mash.b2b.deliverytracker.certificate.AcceptanceCertificateRepository;
import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import io.b2mash.b2b.deliverytracker.event.WorkItemCreatedEvent;
import io.b2mash.b2b.deliverytracker.event.WorkItemDeletedEvent;
import io.b2mash.b2b.deliverytracker.event.WorkItemMovedEvent;
import io.b2mash.b2b.deliverytracker.event.WorkItemReorderedEvent;
import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.exception.NoValidParentException;
import io.b2mash.b2b.deliverytracker.exception.PromotionBlockedException;
import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.exception.StaleVersionException;
import io.b2mash.b2b.deliverytracker.exception.TypeConstraintException;
import io.b2mash.b2b.deliverytracker.member.ProjectCapability;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import io.b2mash.b2b.deliverytracker.project.ProjectReferenceSequence;
import io.b2mash.b2b.deliverytracker.project.ProjectRepository;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureRecordRepository;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the structure of the work-item tree: creation, moves, reordering, indent/outdent and soft
 * delete. Every structural change locks the affected subtrees (see {@link SubtreeLocks}), keeps
 * sibling positions dense, recomputes WBS paths for the project and rolls task progress up into
 * the affected deliverables.
 */
@Service
public class HierarchyService {

  private static final Logger log = LoggerFactory.getLogger(HierarchyService.class);

  private final WorkItemRepository workItemRepository;
  private final ProjectRepository projectRepository;
  private final SubtreeLocks subtreeLocks;
  private final ProgressRollup progressRollup;
  private final ProjectReferenceSequence referenceSequence;
  private final PermissionService permissionService;
  private final BaselineVersionRepository baselineVersionRepository;
  private final AcceptanceCertificateRepository certificateRepository;
  private final SignatureRecordRepository signatureRecordRepository;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public HierarchyService(
      WorkItemRepository workItemRepository,
      ProjectRepository projectRepository,
      SubtreeLocks subtreeLocks,
      ProgressRollup progressRollup,
      ProjectReferenceSequence referenceSequence,
      PermissionService permissionService,
      BaselineVersionRepository baselineVersionRepository,
      AcceptanceCertificateRepository certificateRepository,
      SignatureRecordRepository signatureRecordRepository,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.workItemRepository = workItemRepository;
    this.projectRepository = projectRepository;
    this.subtreeLocks = subtreeLocks;
    this.progressRollup = progressRollup;
    this.referenceSequence = referenceSequence;
    this.permissionService = permissionService;
    this.baselineVersionRepository = baselineVersionRepository;
    this.certificateRepository = certificateRepository;
    this.signatureRecordRepository = signatureRecordRepository;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  // --- Reads ---

  @Transactional(readOnly = true)
  public WorkItem getItem(UUID itemId, UUID memberId) {
    var item = requireLiveItem(itemId);
    permissionService.roleFor(memberId, item.getProjectId());
    return item;
  }

  /** The live tree of a project, roots first, children in sibling order. */
  @Transactional(readOnly = true)
  public List<WorkItemNode> tree(UUID projectId, UUID memberId) {
    permissionService.roleFor(memberId, projectId);
    var items = workItemRepository.findLiveByProjectId(projectId);
    Map<UUID, List<WorkItem>> childrenByParent = new HashMap<>();
    List<WorkItem> roots = new ArrayList<>();
    for (WorkItem item : items) {
      if (item.getParentId() == null) {
        roots.add(item);
      } else {
        childrenByParent.computeIfAbsent(item.getParentId(), k -> new ArrayList<>()).add(item);
      }
    }
    return toNodes(roots, childrenByParent);
  }

  private List<WorkItemNode> toNodes(
      List<WorkItem> items, Map<UUID, List<WorkItem>> childrenByParent) {
    return items.stream()
        .map(
            item ->
                new WorkItemNode(
                    item,
                    toNodes(childrenByParent.getOrDefault(item.getId(), List.of()), childrenByParent)))
        .toList();
  }

  // --- Create / update ---

  /**
   * Creates an item under {@code parentId} (null for a root milestone) at the requested position.
   *
   * @throws TypeConstraintException if {@code kind} may not sit under the parent
   */
  @Transactional
  public WorkItem createItem(
      UUID projectId, WorkItemKind kind, UUID parentId, WorkItemAttributes attributes, UUID actorId) {
    projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    permissionService.requireCapability(actorId, projectId, ProjectCapability.MANAGE_PLAN);

    if (parentId == null) {
      if (!kind.acceptsParent(null)) {
        throw new TypeConstraintException(
            "Invalid parent", describeKind(kind) + " items cannot be created at the top level");
      }
      subtreeLocks.lockWholeProject(projectId);
    } else {
      var parent = requireLiveItem(parentId);
      requireSameProject(parent, projectId);
      requireParentKind(kind, parent);
      subtreeLocks.lockSubtreesOf(parent);
      requireParentKind(kind, parent);
    }

    var siblings = liveSiblings(projectId, parentId);
    String itemRef = referenceSequence.next(projectId, kind.refPrefix());
    var item = new WorkItem(projectId, kind, parentId, itemRef, attributes.name(), actorId);
    item.updateDetails(
        attributes.name(),
        attributes.description(),
        attributes.startDate(),
        attributes.endDate(),
        attributes.value());
    if (attributes.estimateComponentId() != null) {
      item.linkEstimateComponent(attributes.estimateComponentId());
    }
    int index = insertionIndex(attributes.position(), siblings.size());
    item.placeUnder(parentId, index);
    item = workItemRepository.save(item);
    siblings.add(index, item);
    renumber(siblings);
    recomputeWbs(projectId);
    if (kind == WorkItemKind.TASK) {
      progressRollup.rollUpFrom(parentId, actorId);
    }

    log.info(
        "Created {} {} ({}) in project {} at WBS {}",
        kind,
        item.getItemRef(),
        item.getId(),
        projectId,
        item.getWbs());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("item_ref", item.getItemRef());
    details.put("kind", kind.name());
    details.put("name", item.getName());
    details.put("wbs", item.getWbs());
    if (parentId != null) {
      details.put("parent_id", parentId.toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("work_item.created")
            .entityType("work_item")
            .entityId(item.getId())
            .projectId(projectId)
            .actorId(actorId)
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new WorkItemCreatedEvent(
            "work_item.created",
            "work_item",
            item.getId(),
            projectId,
            actorId,
            Instant.now(),
            details,
            kind.name(),
            parentId,
            item.getWbs()));

    return item;
  }

  /** Replaces name, description, dates and value. Structure is untouched. */
  @Transactional
  public WorkItem updateItem(
      UUID itemId, WorkItemAttributes attributes, Integer expectedVersion, UUID actorId) {
    var item = requireLiveItem(itemId);
    permissionService.requireCapability(
        actorId, item.getProjectId(), ProjectCapability.MANAGE_PLAN);
    requireExpectedVersion(item, expectedVersion);

    item.updateDetails(
        attributes.name(),
        attributes.description(),
        attributes.startDate(),
        attributes.endDate(),
        attributes.value());
    if (attributes.estimateComponentId() != null) {
      item.linkEstimateComponent(attributes.estimateComponentId());
    }

    log.info("Updated work item {} ({})", item.getItemRef(), item.getId());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("work_item.updated")
            .entityType("work_item")
            .entityId(item.getId())
            .projectId(item.getProjectId())
            .actorId(actorId)
            .details(Map.of("item_ref", item.getItemRef(), "name", item.getName()))
            .build());

    return item;
  }

  // --- Structural changes ---

  /**
   * Moves an item to a new parent and position, keeping its kind. A deliverable moved to the top
   * level is promoted to a milestone, which requires it to have no tasks.
   *
   * @param position zero-based index among the new siblings; null appends
   * @param expectedVersion the version the caller last read; null skips the check
   * @throws TypeConstraintException if the item's kind may not sit under the new parent, or the
   *     new parent lies inside the item's own subtree
   * @throws PromotionBlockedException if a deliverable with tasks is moved to the top level
   */
  @Transactional
  public WorkItem move(
      UUID itemId, UUID newParentId, Integer position, Integer expectedVersion, UUID actorId) {
    var item = requireLiveItem(itemId);
    UUID projectId = item.getProjectId();
    permissionService.requireCapability(actorId, projectId, ProjectCapability.MANAGE_PLAN);
    requireExpectedVersion(item, expectedVersion);

    if (newParentId == null) {
      switch (item.getKind()) {
        case MILESTONE -> {
          subtreeLocks.lockWholeProject(projectId, item);
          requireExpectedVersion(item, expectedVersion);
          return relocate(item, null, WorkItemKind.MILESTONE, position, actorId, "moved");
        }
        case DELIVERABLE -> {
          subtreeLocks.lockWholeProject(projectId, item);
          requireExpectedVersion(item, expectedVersion);
          requirePromotable(item);
          return relocate(item, null, WorkItemKind.MILESTONE, position, actorId, "promoted");
        }
        case TASK ->
            throw new TypeConstraintException(
                "Invalid parent", "Task " + item.getItemRef() + " cannot become a top-level item");
      }
    }

    var newParent = requireLiveItem(newParentId);
    requireSameProject(newParent, projectId);
    requireParentKind(item.getKind(), newParent);
    subtreeLocks.lockSubtreesOf(item, newParent);
    requireExpectedVersion(item, expectedVersion);
    requireParentKind(item.getKind(), newParent);
    if (isWithinSubtree(newParent, item.getId())) {
      throw new TypeConstraintException(
          "Invalid parent",
          "Cannot move "
              + item.getItemRef()
              + " under its own descendant "
              + newParent.getItemRef());
    }
    return relocate(item, newParentId, item.getKind(), position, actorId, "moved");
  }

  /**
   * Rewrites the sibling order under {@code parentId} (null for the project's milestones).
   *
   * @param orderedChildIds every live child exactly once, in the new order
   */
  @Transactional
  public List<WorkItem> reorder(
      UUID projectId, UUID parentId, List<UUID> orderedChildIds, UUID actorId) {
    projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    permissionService.requireCapability(actorId, projectId, ProjectCapability.MANAGE_PLAN);

    if (parentId == null) {
      subtreeLocks.lockWholeProject(projectId);
    } else {
      var parent = requireLiveItem(parentId);
      requireSameProject(parent, projectId);
      subtreeLocks.lockSubtreesOf(parent);
    }

    var children = liveSiblings(projectId, parentId);
    Map<UUID, WorkItem> byId =
        children.stream().collect(Collectors.toMap(WorkItem::getId, Function.identity()));
    if (orderedChildIds.size() != children.size()
        || new HashSet<>(orderedChildIds).size() != orderedChildIds.size()
        || !byId.keySet().containsAll(orderedChildIds)) {
      throw new InvalidStateException(
          "Invalid order", "The new order must list every live child of the parent exactly once");
    }

    List<WorkItem> reordered = orderedChildIds.stream().map(byId::get).toList();
    renumber(reordered);
    recomputeWbs(projectId);

    log.info(
        "Reordered {} children under {} in project {}",
        reordered.size(),
        parentId == null ? "root" : parentId,
        projectId);

    UUID entityId = parentId != null ? parentId : projectId;
    Map<String, Object> details = Map.of("child_count", reordered.size());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("work_item.reordered")
            .entityType(parentId != null ? "work_item" : "project")
            .entityId(entityId)
            .projectId(projectId)
            .actorId(actorId)
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new WorkItemReorderedEvent(
            "work_item.reordered",
            parentId != null ? "work_item" : "project",
            entityId,
            projectId,
            actorId,
            Instant.now(),
            details,
            List.copyOf(orderedChildIds)));

    return reordered;
  }

  /**
   * Demotes an item one level under its preceding sibling, appended as the last child. A milestone
   * becomes a deliverable, a deliverable becomes a task, a task nests under the preceding task.
   *
   * @throws NoValidParentException if there is no preceding sibling
   * @throws TypeConstraintException if a milestone still has deliverables
   * @throws ResourceConflictException if a milestone has a baseline commitment or certificate
   */
  @Transactional
  public WorkItem indent(UUID itemId, UUID actorId) {
    var item = requireLiveItem(itemId);
    UUID projectId = item.getProjectId();
    permissionService.requireCapability(actorId, projectId, ProjectCapability.MANAGE_PLAN);

    if (item.getKind() == WorkItemKind.MILESTONE) {
      subtreeLocks.lockWholeProject(projectId, item);
    } else {
      subtreeLocks.lockSubtreesOf(item);
    }

    var siblings = liveSiblings(projectId, item.getParentId());
    int index = indexOf(siblings, item.getId());
    if (index <= 0) {
      throw new NoValidParentException(
          "No valid parent",
          "Cannot indent "
              + item.getItemRef()
              + ": there is no preceding "
              + describeKind(item.getKind()).toLowerCase()
              + " to receive it");
    }
    var newParent = siblings.get(index - 1);

    switch (item.getKind()) {
      case MILESTONE -> {
        if (!workItemRepository.findLiveChildren(item.getId()).isEmpty()) {
          throw new TypeConstraintException(
              "Cannot demote milestone",
              "Milestone "
                  + item.getItemRef()
                  + " still has deliverables; move or delete them first");
        }
        requireUncommitted(item);
      }
      case DELIVERABLE -> requireEditable(item, "indent");
      case TASK -> {
        // a task keeps its kind under the preceding task
      }
    }

    return relocate(item, newParent.getId(), item.getKind().demoted(), null, actorId, "indented");
  }

  /**
   * Promotes an item one level, placed directly after its former parent. A deliverable becomes a
   * milestone, a task under a deliverable becomes a deliverable, a task under a task moves up to
   * the grandparent and stays a task.
   *
   * @throws TypeConstraintException for a milestone, which is already at the top level
   * @throws PromotionBlockedException if a deliverable still has tasks
   */
  @Transactional
  public WorkItem outdent(UUID itemId, UUID actorId) {
    var item = requireLiveItem(itemId);
    UUID projectId = item.getProjectId();
    permissionService.requireCapability(actorId, projectId, ProjectCapability.MANAGE_PLAN);

    switch (item.getKind()) {
      case MILESTONE ->
          throw new TypeConstraintException(
              "Cannot outdent milestone",
              "Milestone " + item.getItemRef() + " is already at the top level");
      case DELIVERABLE -> {
        subtreeLocks.lockWholeProject(projectId, item);
        requirePromotable(item);
        var parent = requireLiveItem(item.getParentId());
        return relocate(
            item, null, WorkItemKind.MILESTONE, parent.getPosition() + 1, actorId, "outdented");
      }
      case TASK -> {
        subtreeLocks.lockSubtreesOf(item);
        var parent = requireLiveItem(item.getParentId());
        var newKind =
            parent.getKind() == WorkItemKind.DELIVERABLE
                ? WorkItemKind.DELIVERABLE
                : WorkItemKind.TASK;
        return relocate(
            item, parent.getParentId(), newKind, parent.getPosition() + 1, actorId, "outdented");
      }
    }
    throw new IllegalStateException("Unhandled kind " + item.getKind());
  }

  // --- Delete / restore ---

  /**
   * Soft-deletes an item and its live subtree with a shared timestamp, so the same set can be
   * restored later.
   *
   * @throws ResourceConflictException if anything in the subtree is billed or awaiting sign-off
   */
  @Transactional
  public void softDelete(UUID itemId, UUID actorId) {
    var item = requireLiveItem(itemId);
    UUID projectId = item.getProjectId();
    permissionService.requireCapability(actorId, projectId, ProjectCapability.MANAGE_PLAN);

    if (item.getKind() == WorkItemKind.MILESTONE) {
      subtreeLocks.lockWholeProject(projectId, item);
    } else {
      subtreeLocks.lockSubtreesOf(item);
    }

    var subtree = subtreeOf(item, workItemRepository.findLiveByProjectId(projectId), null);
    for (WorkItem member : subtree) {
      if (member.isBilled()) {
        throw new ResourceConflictException(
            "Work item billed",
            "Cannot delete " + item.getItemRef() + ": " + member.getItemRef() + " has been billed");
      }
      if (member.getDeliverableStatus() == DeliverableStatus.REVIEW_COMPLETE) {
        throw new ResourceConflictException(
            "Sign-off in progress",
            "Cannot delete "
                + item.getItemRef()
                + ": deliverable "
                + member.getItemRef()
                + " is awaiting sign-off");
      }
    }

    Instant deletedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    subtree.forEach(member -> member.markDeleted(actorId, deletedAt));
    workItemRepository.flush();

    renumber(liveSiblings(projectId, item.getParentId()));
    recomputeWbs(projectId);
    if (item.getParentId() != null) {
      progressRollup.rollUpFrom(item.getParentId(), actorId);
    }

    log.info(
        "Soft-deleted {} {} and {} descendants in project {}",
        item.getKind(),
        item.getItemRef(),
        subtree.size() - 1,
        projectId);

    publishDeleted(item, subtree.size(), false, actorId);
  }

  /**
   * Restores an item together with the descendants deleted in the same operation. The item is
   * appended after its current live siblings.
   */
  @Transactional
  public WorkItem restore(UUID itemId, UUID actorId) {
    var item =
        workItemRepository
            .findById(itemId)
            .orElseThrow(() -> new ResourceNotFoundException("Work item", itemId));
    UUID projectId = item.getProjectId();
    permissionService.requireCapability(actorId, projectId, ProjectCapability.MANAGE_PLAN);
    if (!item.isDeleted()) {
      throw new InvalidStateException(
          "Not deleted", "Work item " + item.getItemRef() + " is not deleted");
    }

    if (item.getParentId() == null) {
      subtreeLocks.lockWholeProject(projectId);
    } else {
      var parent =
          workItemRepository
              .findLiveById(item.getParentId())
              .orElseThrow(
                  () ->
                      new InvalidStateException(
                          "Parent deleted",
                          "Restore the parent of " + item.getItemRef() + " first"));
      requireParentKind(item.getKind(), parent);
      subtreeLocks.lockSubtreesOf(parent);
    }

    Instant marker = item.getDeletedAt();
    var subtree = subtreeOf(item, workItemRepository.findByProjectId(projectId), marker);
    subtree.forEach(WorkItem::markRestored);
    workItemRepository.flush();

    var siblings = liveSiblings(projectId, item.getParentId());
    siblings.removeIf(sibling -> sibling.getId().equals(item.getId()));
    siblings.add(item);
    renumber(siblings);
    recomputeWbs(projectId);
    if (item.getParentId() != null) {
      progressRollup.rollUpFrom(item.getParentId(), actorId);
    }

    log.info(
        "Restored {} {} and {} descendants in project {}",
        item.getKind(),
        item.getItemRef(),
        subtree.size() - 1,
        projectId);

    publishDeleted(item, subtree.size(), true, actorId);
    return item;
  }

  // --- Internals ---

  private WorkItem relocate(
      WorkItem item,
      UUID newParentId,
      WorkItemKind newKind,
      Integer position,
      UUID actorId,
      String action) {
    UUID projectId = item.getProjectId();
    UUID oldParentId = item.getParentId();
    WorkItemKind oldKind = item.getKind();
    String oldWbs = item.getWbs();
    boolean sameParent = Objects.equals(oldParentId, newParentId);

    if (!sameParent) {
      var oldSiblings = liveSiblings(projectId, oldParentId);
      oldSiblings.removeIf(sibling -> sibling.getId().equals(item.getId()));
      renumber(oldSiblings);
    }
    var newSiblings = liveSiblings(projectId, newParentId);
    newSiblings.removeIf(sibling -> sibling.getId().equals(item.getId()));
    int index = insertionIndex(position, newSiblings.size());
    newSiblings.add(index, item);
    item.placeUnder(newParentId, index);
    if (newKind != oldKind) {
      item.changeKind(newKind, referenceSequence.next(projectId, newKind.refPrefix()));
    }
    renumber(newSiblings);
    recomputeWbs(projectId);

    if (oldParentId != null) {
      progressRollup.rollUpFrom(oldParentId, actorId);
    }
    if (newParentId != null && !sameParent) {
      progressRollup.rollUpFrom(newParentId, actorId);
    }

    log.info(
        "Work item {} {}: parent {} -> {}, kind {} -> {}, WBS {} -> {}",
        item.getItemRef(),
        action,
        oldParentId,
        newParentId,
        oldKind,
        newKind,
        oldWbs,
        item.getWbs());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("item_ref", item.getItemRef());
    details.put("action", action);
    details.put("old_kind", oldKind.name());
    details.put("new_kind", newKind.name());
    details.put("old_wbs", oldWbs);
    details.put("new_wbs", item.getWbs());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("work_item." + action)
            .entityType("work_item")
            .entityId(item.getId())
            .projectId(projectId)
            .actorId(actorId)
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new WorkItemMovedEvent(
            "work_item." + action,
            "work_item",
            item.getId(),
            projectId,
            actorId,
            Instant.now(),
            details,
            oldParentId,
            newParentId,
            oldKind.name(),
            newKind.name(),
            oldWbs,
            item.getWbs()));

    return item;
  }

  /** A milestone keyed by baseline versions, a commitment record or a certificate stays one. */
  private void requireUncommitted(WorkItem milestone) {
    UUID milestoneId = milestone.getId();
    if (baselineVersionRepository.existsByMilestoneId(milestoneId)
        || signatureRecordRepository
            .findActive(SignatureEntityKind.BASELINE_COMMITMENT, milestoneId)
            .isPresent()) {
      throw new ResourceConflictException(
          "Cannot demote milestone",
          "Milestone " + milestone.getItemRef() + " has a baseline commitment");
    }
    if (certificateRepository.existsByMilestoneId(milestoneId)) {
      throw new ResourceConflictException(
          "Cannot demote milestone",
          "Milestone " + milestone.getItemRef() + " has an acceptance certificate");
    }
  }

  private void publishDeleted(WorkItem item, int affectedItems, boolean restored, UUID actorId) {
    String eventType = restored ? "work_item.restored" : "work_item.deleted";
    Map<String, Object> details =
        Map.of(
            "item_ref", item.getItemRef(),
            "kind", item.getKind().name(),
            "affected_items", affectedItems);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("work_item")
            .entityId(item.getId())
            .projectId(item.getProjectId())
            .actorId(actorId)
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new WorkItemDeletedEvent(
            eventType,
            "work_item",
            item.getId(),
            item.getProjectId(),
            actorId,
            Instant.now(),
            details,
            affectedItems,
            restored));
  }

  /**
   * Collects {@code root} and its descendants from {@code candidates}. With a non-null {@code
   * deletedAt}, only descendants deleted at that instant are followed.
   */
  private List<WorkItem> subtreeOf(WorkItem root, List<WorkItem> candidates, Instant deletedAt) {
    Map<UUID, List<WorkItem>> childrenByParent = new HashMap<>();
    for (WorkItem candidate : candidates) {
      if (candidate.getParentId() != null
          && (deletedAt == null || deletedAt.equals(candidate.getDeletedAt()))) {
        childrenByParent
            .computeIfAbsent(candidate.getParentId(), k -> new ArrayList<>())
            .add(candidate);
      }
    }
    List<WorkItem> result = new ArrayList<>();
    var queue = new ArrayDeque<WorkItem>();
    queue.add(root);
    while (!queue.isEmpty()) {
      var current = queue.poll();
      result.add(current);
      queue.addAll(childrenByParent.getOrDefault(current.getId(), List.of()));
    }
    return result;
  }

  private boolean isWithinSubtree(WorkItem candidate, UUID ancestorId) {
    WorkItem current = candidate;
    while (current != null) {
      if (current.getId().equals(ancestorId)) {
        return true;
      }
      current =
          current.getParentId() == null
              ? null
              : workItemRepository.findById(current.getParentId()).orElse(null);
    }
    return false;
  }

  private void recomputeWbs(UUID projectId) {
    var items = workItemRepository.findLiveByProjectId(projectId);
    var paths =
        WbsCalculator.compute(
            items.stream()
                .map(i -> new WbsCalculator.Node(i.getId(), i.getParentId(), i.getPosition()))
                .toList());
    for (WorkItem item : items) {
      String path = paths.get(item.getId());
      if (path != null) {
        item.assignWbs(path);
      }
    }
  }

  private List<WorkItem> liveSiblings(UUID projectId, UUID parentId) {
    return new ArrayList<>(
        parentId == null
            ? workItemRepository.findLiveRoots(projectId)
            : workItemRepository.findLiveChildren(parentId));
  }

  private static void renumber(List<WorkItem> siblings) {
    for (int i = 0; i < siblings.size(); i++) {
      siblings.get(i).moveToPosition(i);
    }
  }

  private static int insertionIndex(Integer requested, int siblingCount) {
    if (requested == null || requested > siblingCount) {
      return siblingCount;
    }
    return Math.max(0, requested);
  }

  private static int indexOf(List<WorkItem> siblings, UUID itemId) {
    for (int i = 0; i < siblings.size(); i++) {
      if (siblings.get(i).getId().equals(itemId)) {
        return i;
      }
    }
    return -1;
  }

  private WorkItem requireLiveItem(UUID itemId) {
    return workItemRepository
        .findLiveById(itemId)
        .orElseThrow(() -> new ResourceNotFoundException("Work item", itemId));
  }

  private static void requireSameProject(WorkItem parent, UUID projectId) {
    if (!parent.getProjectId().equals(projectId)) {
      throw new TypeConstraintException(
          "Invalid parent", "Parent " + parent.getItemRef() + " belongs to another project");
    }
  }

  private static void requireParentKind(WorkItemKind kind, WorkItem parent) {
    if (!kind.acceptsParent(parent.getKind())) {
      throw new TypeConstraintException(
          "Invalid parent",
          describeKind(kind)
              + " items cannot be placed under "
              + describeKind(parent.getKind()).toLowerCase()
              + " "
              + parent.getItemRef());
    }
  }

  private static void requireExpectedVersion(WorkItem item, Integer expectedVersion) {
    if (expectedVersion != null && expectedVersion != item.getVersion()) {
      throw new StaleVersionException("Work item", item.getId());
    }
  }

  private void requirePromotable(WorkItem deliverable) {
    if (!workItemRepository.findLiveChildren(deliverable.getId()).isEmpty()) {
      throw new PromotionBlockedException(
          "Promotion blocked",
          "Deliverable "
              + deliverable.getItemRef()
              + " still has tasks; move or delete them before promoting it to a milestone");
    }
    requireEditable(deliverable, "promote");
  }

  private static void requireEditable(WorkItem deliverable, String action) {
    if (!deliverable.getDeliverableStatus().isEditable()) {
      throw new InvalidStateException(
          "Invalid deliverable state",
          "Cannot "
              + action
              + " deliverable "
              + deliverable.getItemRef()
              + " in status "
              + deliverable.getDeliverableStatus());
    }
  }

  private static String describeKind(WorkItemKind kind) {
    return switch (kind) {
      case MILESTONE -> "Milestone";
      case DELIVERABLE -> "Deliverable";
      case TASK -> "Task";
    };
  }
}
