package io.b2mash.b2b.deliverytracker.member;

import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
public class ProjectMemberController {

  private final ProjectMemberService projectMemberService;

  public ProjectMemberController(ProjectMemberService projectMemberService) {
    this.projectMemberService = projectMemberService;
  }

  @GetMapping("/api/projects/{projectId}/members")
  public ResponseEntity<List<ProjectMemberResponse>> listMembers(
      @PathVariable UUID projectId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        projectMemberService.listMembers(projectId, CurrentMember.id(jwt)).stream()
            .map(ProjectMemberResponse::from)
            .toList());
  }

  @PostMapping("/api/projects/{projectId}/members")
  public ResponseEntity<ProjectMemberResponse> addMember(
      @PathVariable UUID projectId,
      @Valid @RequestBody AddMemberRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    var member =
        projectMemberService.addMember(
            projectId, request.memberId(), request.role(), CurrentMember.id(jwt));
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/members/" + member.getMemberId()))
        .body(ProjectMemberResponse.from(member));
  }

  @PutMapping("/api/projects/{projectId}/members/{memberId}")
  public ResponseEntity<ProjectMemberResponse> changeRole(
      @PathVariable UUID projectId,
      @PathVariable UUID memberId,
      @Valid @RequestBody ChangeRoleRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        ProjectMemberResponse.from(
            projectMemberService.changeRole(
                projectId, memberId, request.role(), CurrentMember.id(jwt))));
  }

  @DeleteMapping("/api/projects/{projectId}/members/{memberId}")
  public ResponseEntity<Void> removeMember(
      @PathVariable UUID projectId, @PathVariable UUID memberId, @AuthenticationPrincipal Jwt jwt) {
    projectMemberService.removeMember(projectId, memberId, CurrentMember.id(jwt));
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record AddMemberRequest(
      @NotNull(message = "memberId is required") UUID memberId,
      @NotNull(message = "role is required") ProjectRole role) {}

  public record ChangeRoleRequest(@NotNull(message = "role is required") ProjectRole role) {}

  public record ProjectMemberResponse(
      UUID memberId, UUID projectId, ProjectRole role, UUID addedBy, Instant createdAt) {

    public static ProjectMemberResponse from(ProjectMember member) {
      return new ProjectMemberResponse(
          member.getMemberId(),
          member.getProjectId(),
          member.getProjectRole(),
          member.getAddedBy(),
          member.getCreatedAt());
    }
  }
}
