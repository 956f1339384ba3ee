package io.b2mash.b2b.deliverytracker.member;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectMemberRepository extends JpaRepository<ProjectMember, UUID> {

  List<ProjectMember> findByProjectIdOrderByCreatedAtAsc(UUID projectId);

  Optional<ProjectMember> findByProjectIdAndMemberId(UUID projectId, UUID memberId);

  boolean existsByProjectIdAndMemberId(UUID projectId, UUID memberId);

  long countByProjectIdAndProjectRole(UUID projectId, ProjectRole projectRole);

  List<ProjectMember> findByMemberId(UUID memberId);
}
