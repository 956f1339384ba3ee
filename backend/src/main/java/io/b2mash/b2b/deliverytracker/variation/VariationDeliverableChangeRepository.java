package io.b2mash.b2b.deliverytracker.variation;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VariationDeliverableChangeRepository
    extends JpaRepository<VariationDeliverableChange, UUID> {

  List<VariationDeliverableChange> findByVariationIdOrderByCreatedAtAsc(UUID variationId);

  void deleteByVariationId(UUID variationId);
}
