package io.b2mash.b2b.deliverytracker.signature;

import io.b2mash.b2b.deliverytracker.security.CurrentMember;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
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
@RequestMapping("/api/signatures/{kind}/{entityId}")
@PreAuthorize("hasAnyRole('ORG_MEMBER', 'ORG_ADMIN', 'ORG_OWNER')")
public class SignatureController {

  private final SignatureService signatureService;

  public SignatureController(SignatureService signatureService) {
    this.signatureService = signatureService;
  }

  @GetMapping
  public ResponseEntity<SignatureRecordResponse> getStatus(
      @PathVariable SignatureEntityKind kind,
      @PathVariable UUID entityId,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        SignatureRecordResponse.from(
            signatureService.status(kind, entityId, CurrentMember.id(jwt))));
  }

  @GetMapping("/history")
  public ResponseEntity<List<SignatureRecordResponse>> getHistory(
      @PathVariable SignatureEntityKind kind,
      @PathVariable UUID entityId,
      @AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(
        signatureService.history(kind, entityId, CurrentMember.id(jwt)).stream()
            .map(SignatureRecordResponse::from)
            .toList());
  }

  @PostMapping("/sign")
  public ResponseEntity<SignatureRecordResponse> sign(
      @PathVariable SignatureEntityKind kind,
      @PathVariable UUID entityId,
      @Valid @RequestBody SignRequest request,
      @AuthenticationPrincipal Jwt jwt) {
    var record =
        signatureService.sign(
            kind, entityId, request.party(), CurrentMember.id(jwt), request.expectedVersion());
    return ResponseEntity.ok(SignatureRecordResponse.from(record));
  }

  // --- DTOs ---

  public record SignRequest(
      @NotNull(message = "party is required") SignatureParty party, Integer expectedVersion) {}

  public record SlotResponse(SignatureParty party, boolean signed, UUID signerId, Instant signedAt) {

    static SlotResponse of(SignatureRecord record, SignatureParty party) {
      return new SlotResponse(
          party, record.isSigned(party), record.signerFor(party), record.signedAtFor(party));
    }
  }

  public record SignatureRecordResponse(
      UUID id,
      SignatureEntityKind entityKind,
      UUID entityId,
      int revision,
      SignatureState state,
      SignatureStage stage,
      String stageLabel,
      List<SignatureParty> missingParties,
      SlotResponse providing,
      SlotResponse receiving,
      Instant completedAt,
      Instant supersededAt,
      int version) {

    public static SignatureRecordResponse from(SignatureRecord record) {
      return new SignatureRecordResponse(
          record.getId(),
          record.getEntityKind(),
          record.getEntityId(),
          record.getRevision(),
          record.state(),
          record.stage(),
          record.stage().label(),
          record.missingParties(),
          SlotResponse.of(record, SignatureParty.PROVIDING),
          SlotResponse.of(record, SignatureParty.RECEIVING),
          record.getCompletedAt(),
          record.getSupersededAt(),
          record.getVersion());
    }
  }
}
