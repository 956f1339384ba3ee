package io.b2mash.b2b.deliverytracker.workflow;

import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
public class WorkflowController {

  private final WorkflowService workflowService;

  public WorkflowController(WorkflowService workflowService) {
    this.workflowService = workflowService;
  }

  @GetMapping("/api/projects/{projectId}/workflow/pending")
  public ResponseEntity<WorkflowSummary> pendingInProject(
      @PathVariable UUID projectId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(workflowService.pendingFor(CurrentMember.id(jwt), projectId));
  }

  @GetMapping("/api/workflow/pending")
  public ResponseEntity<WorkflowSummary> pendingEverywhere(@AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(workflowService.pendingForMember(CurrentMember.id(jwt)));
  }
}
