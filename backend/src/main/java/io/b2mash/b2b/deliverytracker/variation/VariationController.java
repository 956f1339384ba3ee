package io.b2mash.b2b.deliverytracker.variation;

import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import io.b2mash.b2b.deliverytracker.variation.VariationService.DeliverableChangeRequest;
import io.b2mash.b2b.deliverytracker.variation.VariationService.VariationDetails;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
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
public class VariationController {

  private final VariationService variationService;

  public VariationController(VariationService variationService) {
    this.variationService = variationService;
  }

  @GetMapping("/api/projects/{projectId}/variations")
  public ResponseEntity<List<VariationResponse>> listVariations(
      @PathVariable UUID projectId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        variationService.list(projectId, CurrentMember.id(jwt)).stream()
            .map(VariationResponse::from)
            .toList());
  }

  @PostMapping("/api/projects/{projectId}/variations")
  public ResponseEntity<VariationResponse> createVariation(
      @PathVariable UUID projectId,
      @Valid @RequestBody VariationRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    var variation =
        variationService.create(
            projectId,
            request.title(),
            request.description(),
            request.reason(),
            request.variationType(),
            CurrentMember.id(jwt));
    return ResponseEntity.created(URI.create("/api/variations/" + variation.getId()))
        .body(VariationResponse.from(variation));
  }

  @GetMapping("/api/variations/{id}")
  public ResponseEntity<VariationDetailResponse> getVariation(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        VariationDetailResponse.from(variationService.getDetails(id, CurrentMember.id(jwt))));
  }

  @PutMapping("/api/variations/{id}")
  public ResponseEntity<VariationResponse> updateVariation(
      @PathVariable UUID id,
      @Valid @RequestBody VariationRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        VariationResponse.from(
            variationService.update(
                id,
                request.title(),
                request.description(),
                request.reason(),
                request.variationType(),
                CurrentMember.id(jwt))));
  }

  @DeleteMapping("/api/variations/{id}")
  public ResponseEntity<Void> deleteVariation(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    variationService.delete(id, CurrentMember.id(jwt));
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/variations/{id}/impacts")
  public ResponseEntity<ImpactResponse> addMilestoneImpact(
      @PathVariable UUID id,
      @Valid @RequestBody ImpactRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    var impact =
        variationService.addMilestoneImpact(
            id,
            request.milestoneId(),
            request.newStartDate(),
            request.newEndDate(),
            request.newValue(),
            request.rationale(),
            CurrentMember.id(jwt));
    return ResponseEntity.ok(ImpactResponse.from(impact));
  }

  @PostMapping("/api/variations/{id}/changes")
  public ResponseEntity<ChangeResponse> addDeliverableChange(
      @PathVariable UUID id,
      @Valid @RequestBody ChangeRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    var change =
        variationService.addDeliverableChange(id, request.toServiceRequest(), CurrentMember.id(jwt));
    return ResponseEntity.ok(ChangeResponse.from(change));
  }

  @DeleteMapping("/api/variations/{id}/changes/{changeId}")
  public ResponseEntity<Void> removeChange(
      @PathVariable UUID id, @PathVariable UUID changeId, @AuthenticationPrincipal Jwt jwt) {
    variationService.removeChange(id, changeId, CurrentMember.id(jwt));
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api/variations/{id}/submit")
  public ResponseEntity<VariationResponse> submit(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        VariationResponse.from(variationService.submit(id, CurrentMember.id(jwt))));
  }

  @PostMapping("/api/variations/{id}/reject")
  public ResponseEntity<VariationResponse> reject(
      @PathVariable UUID id,
      @Valid @RequestBody RejectRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        VariationResponse.from(
            variationService.reject(id, request.reason(), CurrentMember.id(jwt))));
  }

  @PostMapping("/api/variations/{id}/reset")
  public ResponseEntity<VariationResponse> resetToDraft(
      @PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        VariationResponse.from(variationService.resetToDraft(id, CurrentMember.id(jwt))));
  }

  // --- DTOs ---

  public record VariationRequest(
      @NotBlank(message = "title is required") @Size(max = 300) String title,
      String description,
      String reason,
      @NotNull(message = "variationType is required") VariationType variationType) {}

  public record ImpactRequest(
      @NotNull(message = "milestoneId is required") UUID milestoneId,
      LocalDate newStartDate,
      LocalDate newEndDate,
      BigDecimal newValue,
      String rationale) {}

  public record ChangeRequest(
      @NotNull(message = "changeType is required") DeliverableChangeType changeType,
      UUID milestoneId,
      UUID deliverableId,
      @Size(max = 500) String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      String removalReason) {

    DeliverableChangeRequest toServiceRequest() {
      return new DeliverableChangeRequest(
          changeType,
          milestoneId,
          deliverableId,
          name,
          description,
          startDate,
          endDate,
          removalReason);
    }
  }

  public record RejectRequest(@NotBlank(message = "reason is required") String reason) {}

  public record VariationResponse(
      UUID id,
      UUID projectId,
      String reference,
      String title,
      String description,
      String reason,
      VariationType variationType,
      VariationStatus status,
      BigDecimal totalCostImpact,
      int totalDaysImpact,
      Instant submittedAt,
      String rejectionReason,
      Instant rejectedAt,
      Instant appliedAt,
      String certificateNumber,
      Instant createdAt,
      int version) {

    public static VariationResponse from(Variation variation) {
      return new VariationResponse(
          variation.getId(),
          variation.getProjectId(),
          variation.getReference(),
          variation.getTitle(),
          variation.getDescription(),
          variation.getReason(),
          variation.getVariationType(),
          variation.getStatus(),
          variation.getTotalCostImpact(),
          variation.getTotalDaysImpact(),
          variation.getSubmittedAt(),
          variation.getRejectionReason(),
          variation.getRejectedAt(),
          variation.getAppliedAt(),
          variation.getCertificateNumber(),
          variation.getCreatedAt(),
          variation.getVersion());
    }
  }

  public record ImpactResponse(
      UUID id,
      UUID milestoneId,
      LocalDate originalStartDate,
      LocalDate originalEndDate,
      BigDecimal originalValue,
      LocalDate newStartDate,
      LocalDate newEndDate,
      BigDecimal newValue,
      BigDecimal costImpact,
      int daysImpact,
      String rationale,
      Integer baselineVersionBefore,
      Integer baselineVersionAfter) {

    public static ImpactResponse from(VariationMilestoneImpact impact) {
      return new ImpactResponse(
          impact.getId(),
          impact.getMilestoneId(),
          impact.getOriginalStartDate(),
          impact.getOriginalEndDate(),
          impact.getOriginalValue(),
          impact.getNewStartDate(),
          impact.getNewEndDate(),
          impact.getNewValue(),
          impact.costImpact(),
          impact.daysImpact(),
          impact.getRationale(),
          impact.getBaselineVersionBefore(),
          impact.getBaselineVersionAfter());
    }
  }

  public record ChangeResponse(
      UUID id,
      DeliverableChangeType changeType,
      UUID milestoneId,
      UUID deliverableId,
      String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      String removalReason) {

    public static ChangeResponse from(VariationDeliverableChange change) {
      return new ChangeResponse(
          change.getId(),
          change.getChangeType(),
          change.getMilestoneId(),
          change.getDeliverableId(),
          change.getName(),
          change.getDescription(),
          change.getStartDate(),
          change.getEndDate(),
          change.getRemovalReason());
    }
  }

  public record VariationDetailResponse(
      VariationResponse variation, List<ImpactResponse> impacts, List<ChangeResponse> changes) {

    public static VariationDetailResponse from(VariationDetails details) {
      return new VariationDetailResponse(
          VariationResponse.from(details.variation()),
          details.impacts().stream().map(ImpactResponse::from).toList(),
          details.changes().stream().map(ChangeResponse::from).toList());
    }
  }
}
