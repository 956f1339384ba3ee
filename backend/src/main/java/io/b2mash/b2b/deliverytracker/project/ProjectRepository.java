package io.b2mash.b2b.deliverytracker.project;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  boolean existsByReference(String reference);

  /**
   * Row lock on the project. Serializes root-level structural changes (new milestones, milestone
   * reordering, promotion to or demotion from root) for one project.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Project p WHERE p.id = :id")
  Optional<Project> lockById(@Param("id") UUID id);

  @Query(
      """
      SELECT p FROM Project p
      WHERE p.id IN (SELECT pm.projectId FROM ProjectMember pm WHERE pm.memberId = :memberId)
      ORDER BY p.createdAt DESC
      """)
  List<Project> findForMember(@Param("memberId") UUID memberId);
}
