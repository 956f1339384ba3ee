package io.b2mash.b2b.deliverytracker.milestone;

import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemController.WorkItemResponse;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
public class MilestoneController {

  private final MilestoneViewService milestoneViewService;

  public MilestoneController(MilestoneViewService milestoneViewService) {
    this.milestoneViewService = milestoneViewService;
  }

  @GetMapping("/api/projects/{projectId}/milestones")
  public ResponseEntity<List<MilestoneView>> listMilestones(
      @PathVariable UUID projectId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(milestoneViewService.listViews(projectId, CurrentMember.id(jwt)));
  }

  @GetMapping("/api/projects/{projectId}/milestones/with-deliverables")
  public ResponseEntity<List<MilestoneWithDeliverablesResponse>> listWithDeliverables(
      @PathVariable UUID projectId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        milestoneViewService.listWithDeliverables(projectId, CurrentMember.id(jwt)).stream()
            .map(MilestoneWithDeliverablesResponse::from)
            .toList());
  }

  @GetMapping("/api/milestones/{id}")
  public ResponseEntity<MilestoneView> getMilestone(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(milestoneViewService.getView(id, CurrentMember.id(jwt)));
  }

  @GetMapping("/api/milestones/{id}/deliverable-date-check")
  public ResponseEntity<DeliverableDateCheck> checkDeliverableDate(
      @PathVariable UUID id,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate proposedEndDate,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        milestoneViewService.checkDeliverableDate(id, proposedEndDate, CurrentMember.id(jwt)));
  }

  // --- DTOs ---

  public record MilestoneWithDeliverablesResponse(
      WorkItemResponse milestone, List<WorkItemResponse> deliverables) {

    public static MilestoneWithDeliverablesResponse from(MilestoneWithDeliverables projection) {
      return new MilestoneWithDeliverablesResponse(
          WorkItemResponse.from(projection.milestone()),
          projection.deliverables().stream().map(WorkItemResponse::from).toList());
    }
  }
}
