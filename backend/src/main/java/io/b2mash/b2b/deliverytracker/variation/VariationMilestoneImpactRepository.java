package io.b2mash.b2b.deliverytracker.variation;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VariationMilestoneImpactRepository
    extends JpaRepository<VariationMilestoneImpact, UUID> {

  List<VariationMilestoneImpact> findByVariationIdOrderByCreatedAtAsc(UUID variationId);

  boolean existsByVariationIdAndMilestoneId(UUID variationId, UUID milestoneId);

  void deleteByVariationId(UUID variationId);
}
