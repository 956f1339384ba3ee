package io.b2mash.b2b.deliverytracker.workitem;

import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.exception.StaleVersionException;
import io.b2mash.b2b.deliverytracker.project.ProjectRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.Collection;
import java.util.TreeSet;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Per-subtree mutual exclusion for structural changes, held until the caller's transaction ends.
 *
 * <p>A subtree is identified by its root milestone, and the lock is a row lock on that milestone.
 * Changes at root level (new milestones, root reordering, promotion to or demotion from root) take
 * the project row lock first and then every root. Locks are always acquired project first, then
 * roots in ascending id order, so two operations can never wait on each other in a cycle.
 */
@Component
class SubtreeLocks {

  private final WorkItemRepository workItemRepository;
  private final ProjectRepository projectRepository;

  @PersistenceContext private EntityManager entityManager;

  SubtreeLocks(WorkItemRepository workItemRepository, ProjectRepository projectRepository) {
    this.workItemRepository = workItemRepository;
    this.projectRepository = projectRepository;
  }

  /** Locks the subtrees containing the given items and re-reads the items under the lock. */
  void lockSubtreesOf(WorkItem... items) {
    var roots = new TreeSet<UUID>();
    for (WorkItem item : items) {
      roots.add(rootIdOf(item));
    }
    lockRoots(roots);
    for (WorkItem item : items) {
      entityManager.refresh(item);
      if (item.isDeleted() || !roots.contains(rootIdOf(item))) {
        throw new StaleVersionException("Work item", item.getId());
      }
    }
  }

  /** Locks the project and every live root milestone in it. */
  void lockWholeProject(UUID projectId, WorkItem... items) {
    projectRepository
        .lockById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    var roots = new TreeSet<UUID>();
    workItemRepository.findLiveRoots(projectId).forEach(root -> roots.add(root.getId()));
    lockRoots(roots);
    for (WorkItem item : items) {
      entityManager.refresh(item);
      if (item.isDeleted()) {
        throw new StaleVersionException("Work item", item.getId());
      }
    }
  }

  UUID rootIdOf(WorkItem item) {
    WorkItem current = item;
    while (current.getParentId() != null) {
      UUID parentId = current.getParentId();
      current =
          workItemRepository
              .findById(parentId)
              .orElseThrow(() -> new ResourceNotFoundException("Work item", parentId));
    }
    return current.getId();
  }

  private void lockRoots(Collection<UUID> sortedRootIds) {
    for (UUID rootId : sortedRootIds) {
      workItemRepository
          .lockById(rootId)
          .orElseThrow(() -> new ResourceNotFoundException("Work item", rootId));
    }
  }
}
