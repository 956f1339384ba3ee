package io.b2mash.b2b.deliverytracker.permission;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.deliverytracker.exception.ForbiddenException;
import io.b2mash.b2b.deliverytracker.member.ProjectCapability;
import io.b2mash.b2b.deliverytracker.member.ProjectMember;
import io.b2mash.b2b.deliverytracker.member.ProjectMemberRepository;
import io.b2mash.b2b.deliverytracker.member.ProjectRole;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureParty;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * {@link PermissionService} backed by {@code project_members}. Resolved roles are cached briefly in
 * Caffeine; membership changes evict the affected entry.
 */
@Service
@EnableConfigurationProperties(PermissionProperties.class)
public class ProjectRolePermissionService implements PermissionService {

  private static final Logger log = LoggerFactory.getLogger(ProjectRolePermissionService.class);

  private static final Set<ProjectRole> PROVIDING_SIGNERS =
      EnumSet.of(ProjectRole.SUPPLIER_PM, ProjectRole.ADMIN);
  private static final Set<ProjectRole> RECEIVING_SIGNERS =
      EnumSet.of(ProjectRole.CUSTOMER_PM, ProjectRole.ADMIN);

  private static final Map<SignatureEntityKind, Map<SignatureParty, Set<ProjectRole>>>
      ELIGIBLE_SIGNERS =
          Map.of(
              SignatureEntityKind.DELIVERABLE,
              Map.of(
                  SignatureParty.PROVIDING,
                  PROVIDING_SIGNERS,
                  SignatureParty.RECEIVING,
                  RECEIVING_SIGNERS),
              SignatureEntityKind.BASELINE_COMMITMENT,
              Map.of(
                  SignatureParty.PROVIDING,
                  PROVIDING_SIGNERS,
                  SignatureParty.RECEIVING,
                  RECEIVING_SIGNERS),
              SignatureEntityKind.ACCEPTANCE_CERTIFICATE,
              Map.of(
                  SignatureParty.PROVIDING,
                  PROVIDING_SIGNERS,
                  SignatureParty.RECEIVING,
                  RECEIVING_SIGNERS),
              SignatureEntityKind.VARIATION,
              Map.of(
                  SignatureParty.PROVIDING,
                  PROVIDING_SIGNERS,
                  SignatureParty.RECEIVING,
                  RECEIVING_SIGNERS));

  private final ProjectMemberRepository projectMemberRepository;
  private final Cache<RoleKey, ProjectRole> roleCache;

  public ProjectRolePermissionService(
      ProjectMemberRepository projectMemberRepository, PermissionProperties properties) {
    this.projectMemberRepository = projectMemberRepository;
    this.roleCache =
        Caffeine.newBuilder()
            .maximumSize(properties.cacheMaxSize())
            .expireAfterWrite(properties.cacheTtl())
            .build();
  }

  @Override
  public ProjectRole roleFor(UUID userId, UUID projectId) {
    ProjectRole role =
        roleCache.get(
            new RoleKey(projectId, userId),
            key ->
                projectMemberRepository
                    .findByProjectIdAndMemberId(key.projectId(), key.memberId())
                    .map(ProjectMember::getProjectRole)
                    .orElse(null));
    if (role == null) {
      throw new ForbiddenException(
          "Not a project member", "Member " + userId + " has no role in project " + projectId);
    }
    return role;
  }

  @Override
  public boolean isEligibleSigner(
      ProjectRole role, SignatureEntityKind kind, SignatureParty party) {
    if (role == null) {
      return false;
    }
    return ELIGIBLE_SIGNERS.get(kind).get(party).contains(role);
  }

  @Override
  public ProjectRole requireCapability(
      UUID userId, UUID projectId, ProjectCapability capability) {
    var role = roleFor(userId, projectId);
    if (!role.has(capability)) {
      log.debug(
          "Member {} with role {} lacks {} in project {}", userId, role, capability, projectId);
      throw new ForbiddenException(
          "Insufficient project role",
          "Role " + role + " does not allow " + capability.name().toLowerCase().replace('_', ' '));
    }
    return role;
  }

  @Override
  public void evict(UUID projectId, UUID memberId) {
    roleCache.invalidate(new RoleKey(projectId, memberId));
  }

  private record RoleKey(UUID projectId, UUID memberId) {}
}
