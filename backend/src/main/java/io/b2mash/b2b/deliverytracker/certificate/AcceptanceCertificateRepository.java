package io.b2mash.b2b.deliverytracker.certificate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AcceptanceCertificateRepository
    extends JpaRepository<AcceptanceCertificate, UUID> {

  Optional<AcceptanceCertificate> findByMilestoneId(UUID milestoneId);

  boolean existsByMilestoneId(UUID milestoneId);

  List<AcceptanceCertificate> findByMilestoneIdIn(Collection<UUID> milestoneIds);
}
