package io.b2mash.b2b.deliverytracker.member;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectMemberService {

  private static final Logger log = LoggerFactory.getLogger(ProjectMemberService.class);

  private final ProjectMemberRepository projectMemberRepository;
  private final PermissionService permissionService;
  private final AuditService auditService;

  public ProjectMemberService(
      ProjectMemberRepository projectMemberRepository,
      PermissionService permissionService,
      AuditService auditService) {
    this.projectMemberRepository = projectMemberRepository;
    this.permissionService = permissionService;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<ProjectMember> listMembers(UUID projectId, UUID requestedBy) {
    permissionService.roleFor(requestedBy, projectId);
    return projectMemberRepository.findByProjectIdOrderByCreatedAtAsc(projectId);
  }

  @Transactional
  public ProjectMember addMember(UUID projectId, UUID memberId, ProjectRole role, UUID addedBy) {
    permissionService.requireCapability(addedBy, projectId, ProjectCapability.MANAGE_MEMBERS);
    if (projectMemberRepository.existsByProjectIdAndMemberId(projectId, memberId)) {
      throw new ResourceConflictException(
          "Already a member", "Member " + memberId + " already belongs to project " + projectId);
    }
    var member = projectMemberRepository.save(new ProjectMember(projectId, memberId, role, addedBy));
    permissionService.evict(projectId, memberId);

    log.info("Added member {} to project {} as {}", memberId, projectId, role);
    audit("project_member.added", member, addedBy, Map.of("role", role.name()));
    return member;
  }

  @Transactional
  public ProjectMember changeRole(
      UUID projectId, UUID memberId, ProjectRole newRole, UUID changedBy) {
    permissionService.requireCapability(changedBy, projectId, ProjectCapability.MANAGE_MEMBERS);
    var member = requireMember(projectId, memberId);
    var oldRole = member.getProjectRole();
    if (oldRole == ProjectRole.ADMIN && newRole != ProjectRole.ADMIN) {
      requireAnotherAdmin(projectId);
    }
    member.setProjectRole(newRole);
    permissionService.evict(projectId, memberId);

    log.info("Changed role of member {} in project {} from {} to {}", memberId, projectId, oldRole, newRole);
    audit(
        "project_member.role_changed",
        member,
        changedBy,
        Map.of("old_role", oldRole.name(), "new_role", newRole.name()));
    return member;
  }

  @Transactional
  public void removeMember(UUID projectId, UUID memberId, UUID removedBy) {
    permissionService.requireCapability(removedBy, projectId, ProjectCapability.MANAGE_MEMBERS);
    var member = requireMember(projectId, memberId);
    if (member.getProjectRole() == ProjectRole.ADMIN) {
      requireAnotherAdmin(projectId);
    }
    projectMemberRepository.delete(member);
    permissionService.evict(projectId, memberId);

    log.info("Removed member {} from project {}", memberId, projectId);
    audit(
        "project_member.removed", member, removedBy, Map.of("role", member.getProjectRole().name()));
  }

  private ProjectMember requireMember(UUID projectId, UUID memberId) {
    return projectMemberRepository
        .findByProjectIdAndMemberId(projectId, memberId)
        .orElseThrow(() -> new ResourceNotFoundException("ProjectMember", memberId));
  }

  private void requireAnotherAdmin(UUID projectId) {
    if (projectMemberRepository.countByProjectIdAndProjectRole(projectId, ProjectRole.ADMIN) <= 1) {
      throw new InvalidStateException(
          "Last project admin", "A project must keep at least one ADMIN member");
    }
  }

  private void audit(String eventType, ProjectMember member, UUID actorId, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("project_member")
            .entityId(member.getMemberId())
            .projectId(member.getProjectId())
            .actorId(actorId)
            .details(details)
            .build());
  }
}
