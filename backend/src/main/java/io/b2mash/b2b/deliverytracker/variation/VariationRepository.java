package io.b2mash.b2b.deliverytracker.variation;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VariationRepository extends JpaRepository<Variation, UUID> {

  List<Variation> findByProjectIdOrderByCreatedAtDesc(UUID projectId);

  List<Variation> findByIdIn(Collection<UUID> ids);
}
