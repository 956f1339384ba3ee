package io.b2mash.b2b.deliverytracker.project;

import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody CreateProjectRequest request, @AuthenticationPrincipal Jwt jwt) {
    var project =
        projectService.createProject(
            request.name(), request.reference(), request.description(), CurrentMember.id(jwt));
    return ResponseEntity.created(URI.create("/api/projects/" + project.getId()))
        .body(ProjectResponse.from(project));
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<List<ProjectResponse>> listProjects(@AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        projectService.listForMember(CurrentMember.id(jwt)).stream()
            .map(ProjectResponse::from)
            .toList());
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
  public ResponseEntity<ProjectResponse> getProject(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        ProjectResponse.from(projectService.getProject(id, CurrentMember.id(jwt))));
  }

  // --- DTOs ---

  public record CreateProjectRequest(
      @NotBlank(message = "name is required") @Size(max = 255) String name,
      @NotBlank(message = "reference is required")
          @Pattern(regexp = "[A-Za-z0-9-]{2,20}", message = "reference must be 2-20 letters, digits or dashes")
          String reference,
      String description) {}

  public record ProjectResponse(
      UUID id, String name, String reference, String description, Instant createdAt) {

    public static ProjectResponse from(Project project) {
      return new ProjectResponse(
          project.getId(),
          project.getName(),
          project.getReference(),
          project.getDescription(),
          project.getCreatedAt());
    }
  }
}
