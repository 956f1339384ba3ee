package io.b2mash.b2b.deliverytracker.deliverable;

import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import io.b2mash.b2b.deliverytracker.workitem.WorkItemController.WorkItemResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
public class DeliverableController {

  private final DeliverableService deliverableService;

  public DeliverableController(DeliverableService deliverableService) {
    this.deliverableService = deliverableService;
  }

  @PutMapping("/api/work-items/{id}/progress")
  public ResponseEntity<WorkItemResponse> updateProgress(
      @PathVariable UUID id,
      @Valid @RequestBody ProgressRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        WorkItemResponse.from(
            deliverableService.updateProgress(id, request.progress(), CurrentMember.id(jwt))));
  }

  @PostMapping("/api/deliverables/{id}/submit")
  public ResponseEntity<WorkItemResponse> submitForReview(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        WorkItemResponse.from(deliverableService.submitForReview(id, CurrentMember.id(jwt))));
  }

  @PostMapping("/api/deliverables/{id}/return")
  public ResponseEntity<WorkItemResponse> returnForMoreWork(
      @PathVariable UUID id,
      @Valid @RequestBody ReturnRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        WorkItemResponse.from(
            deliverableService.returnForMoreWork(id, request.reason(), CurrentMember.id(jwt))));
  }

  @PostMapping("/api/deliverables/{id}/accept")
  public ResponseEntity<WorkItemResponse> acceptReview(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        WorkItemResponse.from(deliverableService.acceptReview(id, CurrentMember.id(jwt))));
  }

  // --- DTOs ---

  public record ProgressRequest(
      @NotNull(message = "progress is required")
          @Min(value = 0, message = "progress must be between 0 and 100")
          @Max(value = 100, message = "progress must be between 0 and 100")
          Integer progress) {}

  public record ReturnRequest(@NotBlank(message = "reason is required") String reason) {}
}
