package io.b2mash.b2b.deliverytracker.workitem;

import io.b2mash.b2b.deliverytracker.deliverable.DeliverableStatus;
import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkItemRepository extends JpaRepository<WorkItem, UUID> {

  @Query("SELECT w FROM WorkItem w WHERE w.id = :id AND w.deletedAt IS NULL")
  Optional<WorkItem> findLiveById(@Param("id") UUID id);

  /** Row lock on a root milestone; the per-subtree mutex for structural changes. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT w FROM WorkItem w WHERE w.id = :id")
  Optional<WorkItem> lockById(@Param("id") UUID id);

  @Query(
      """
      SELECT w FROM WorkItem w
      WHERE w.parentId = :parentId AND w.deletedAt IS NULL
      ORDER BY w.position ASC, w.createdAt ASC
      """)
  List<WorkItem> findLiveChildren(@Param("parentId") UUID parentId);

  @Query(
      """
      SELECT w FROM WorkItem w
      WHERE w.projectId = :projectId AND w.parentId IS NULL AND w.deletedAt IS NULL
      ORDER BY w.position ASC, w.createdAt ASC
      """)
  List<WorkItem> findLiveRoots(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT w FROM WorkItem w
      WHERE w.projectId = :projectId AND w.deletedAt IS NULL
      ORDER BY w.position ASC, w.createdAt ASC
      """)
  List<WorkItem> findLiveByProjectId(@Param("projectId") UUID projectId);

  /** Includes soft-deleted rows; used to walk subtrees for delete and restore. */
  List<WorkItem> findByProjectId(UUID projectId);

  @Query(
      """
      SELECT w FROM WorkItem w
      WHERE w.parentId IN :milestoneIds AND w.kind = :kind AND w.deletedAt IS NULL
      ORDER BY w.position ASC
      """)
  List<WorkItem> findLiveChildrenOfKind(
      @Param("milestoneIds") Collection<UUID> milestoneIds, @Param("kind") WorkItemKind kind);

  @Query(
      """
      SELECT w FROM WorkItem w
      WHERE w.projectId IN :projectIds
        AND w.deliverableStatus = :status
        AND w.deletedAt IS NULL
      ORDER BY w.updatedAt ASC
      """)
  List<WorkItem> findLiveDeliverablesByStatus(
      @Param("projectIds") Collection<UUID> projectIds, @Param("status") DeliverableStatus status);
}
