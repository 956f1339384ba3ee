package io.b2mash.b2b.deliverytracker.baseline;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BaselineVersionRepository extends JpaRepository<BaselineVersion, UUID> {

  List<BaselineVersion> findByMilestoneIdOrderByVersionNumberAsc(UUID milestoneId);

  Optional<BaselineVersion> findTopByMilestoneIdOrderByVersionNumberDesc(UUID milestoneId);

  boolean existsByMilestoneId(UUID milestoneId);

  @Query(
      "SELECT COALESCE(MAX(b.versionNumber), 0) FROM BaselineVersion b"
          + " WHERE b.milestoneId = :milestoneId")
  int findMaxVersionNumber(@Param("milestoneId") UUID milestoneId);

  @Query(
      """
      SELECT b FROM BaselineVersion b
      WHERE b.milestoneId IN :milestoneIds
      ORDER BY b.milestoneId, b.versionNumber DESC
      """)
  List<BaselineVersion> findByMilestoneIds(@Param("milestoneIds") Collection<UUID> milestoneIds);
}
