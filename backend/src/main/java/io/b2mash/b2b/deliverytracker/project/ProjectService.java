package io.b2mash.b2b.deliverytracker.project;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.member.ProjectMember;
import io.b2mash.b2b.deliverytracker.member.ProjectMemberRepository;
import io.b2mash.b2b.deliverytracker.member.ProjectRole;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository projectRepository;
  private final ProjectMemberRepository projectMemberRepository;
  private final PermissionService permissionService;
  private final AuditService auditService;

  public ProjectService(
      ProjectRepository projectRepository,
      ProjectMemberRepository projectMemberRepository,
      PermissionService permissionService,
      AuditService auditService) {
    this.projectRepository = projectRepository;
    this.projectMemberRepository = projectMemberRepository;
    this.permissionService = permissionService;
    this.auditService = auditService;
  }

  /** Creates a project and makes its creator the project ADMIN. */
  @Transactional
  public Project createProject(String name, String reference, String description, UUID createdBy) {
    String normalizedReference = reference.trim().toUpperCase();
    if (projectRepository.existsByReference(normalizedReference)) {
      throw new ResourceConflictException(
          "Duplicate project reference",
          "A project with reference " + normalizedReference + " already exists");
    }
    var project =
        projectRepository.save(new Project(name, normalizedReference, description, createdBy));
    projectMemberRepository.save(
        new ProjectMember(project.getId(), createdBy, ProjectRole.ADMIN, createdBy));

    log.info("Created project {} ({}) by {}", project.getId(), normalizedReference, createdBy);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("project.created")
            .entityType("project")
            .entityId(project.getId())
            .projectId(project.getId())
            .actorId(createdBy)
            .details(Map.of("name", name, "reference", normalizedReference))
            .build());

    return project;
  }

  @Transactional(readOnly = true)
  public Project getProject(UUID projectId, UUID memberId) {
    permissionService.roleFor(memberId, projectId);
    return requireProject(projectId);
  }

  @Transactional(readOnly = true)
  public Project requireProject(UUID projectId) {
    return projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  @Transactional(readOnly = true)
  public List<Project> listForMember(UUID memberId) {
    return projectRepository.findForMember(memberId);
  }
}
