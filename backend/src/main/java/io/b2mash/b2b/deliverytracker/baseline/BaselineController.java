package io.b2mash.b2b.deliverytracker.baseline;

import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import io.b2mash.b2b.deliverytracker.signature.SignatureController.SignatureRecordResponse;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/milestones/{milestoneId}/baseline")
@PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
public class BaselineController {

  private final BaselineCommitmentService baselineCommitmentService;
  private final BaselineVersionService baselineVersionService;

  public BaselineController(
      BaselineCommitmentService baselineCommitmentService,
      BaselineVersionService baselineVersionService) {
    this.baselineCommitmentService = baselineCommitmentService;
    this.baselineVersionService = baselineVersionService;
  }

  @PostMapping("/commitment")
  public ResponseEntity<SignatureRecordResponse> requestCommitment(
      @PathVariable UUID milestoneId, @AuthenticationPrincipal Jwt jwt) {
    var record = baselineCommitmentService.requestCommitment(milestoneId, CurrentMember.id(jwt));
    return ResponseEntity.created(
            URI.create("/api/signatures/BASELINE_COMMITMENT/" + milestoneId))
        .body(SignatureRecordResponse.from(record));
  }

  @GetMapping("/status")
  public ResponseEntity<BaselineStatusResponse> getStatus(
      @PathVariable UUID milestoneId, @AuthenticationPrincipal Jwt jwt) {
    var status = baselineCommitmentService.status(milestoneId, CurrentMember.id(jwt));
    return ResponseEntity.ok(new BaselineStatusResponse(status, status.label()));
  }

  @GetMapping("/current")
  public ResponseEntity<BaselineVersionResponse> getCurrent(
      @PathVariable UUID milestoneId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        BaselineVersionResponse.from(
            baselineVersionService.current(milestoneId, CurrentMember.id(jwt))));
  }

  @GetMapping("/history")
  public ResponseEntity<List<BaselineVersionResponse>> getHistory(
      @PathVariable UUID milestoneId, @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        baselineVersionService.history(milestoneId, CurrentMember.id(jwt)).stream()
            .map(BaselineVersionResponse::from)
            .toList());
  }

  // --- DTOs ---

  public record BaselineStatusResponse(BaselineStatus status, String label) {}

  public record BaselineVersionResponse(
      UUID id,
      UUID milestoneId,
      int versionNumber,
      BaselineSource source,
      UUID variationId,
      LocalDate startDate,
      LocalDate endDate,
      BigDecimal value,
      List<Map<String, Object>> deliverables,
      UUID createdBy,
      Instant createdAt) {

    public static BaselineVersionResponse from(BaselineVersion version) {
      return new BaselineVersionResponse(
          version.getId(),
          version.getMilestoneId(),
          version.getVersionNumber(),
          version.getSource(),
          version.getVariationId(),
          version.getStartDate(),
          version.getEndDate(),
          version.getValue(),
          version.getDeliverables(),
          version.getCreatedBy(),
          version.getCreatedAt());
    }
  }
}
