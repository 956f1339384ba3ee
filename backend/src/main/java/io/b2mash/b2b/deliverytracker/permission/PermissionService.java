package io.b2mash.b2b.deliverytracker.permission;

import io.b2mash.b2b.deliverytracker.member.ProjectCapability;
import io.b2mash.b2b.deliverytracker.member.ProjectRole;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureParty;
import java.util.UUID;

/**
 * Project-scoped authorization. Every caller passes the acting user explicitly; nothing here reads
 * ambient request state.
 */
public interface PermissionService {

  /**
   * Resolves the user's role in the project.
   *
   * @throws io.b2mash.b2b.deliverytracker.exception.ForbiddenException if the user is not a member
   */
  ProjectRole roleFor(UUID userId, UUID projectId);

  /** Whether a member holding {@code role} may fill the {@code party} slot for {@code kind}. */
  boolean isEligibleSigner(ProjectRole role, SignatureEntityKind kind, SignatureParty party);

  /**
   * Resolves the role and checks it grants the capability.
   *
   * @return the resolved role
   * @throws io.b2mash.b2b.deliverytracker.exception.ForbiddenException if not granted
   */
  ProjectRole requireCapability(UUID userId, UUID projectId, ProjectCapability capability);

  /** Drops any cached role for the member; called on membership changes. */
  void evict(UUID projectId, UUID memberId);
}
