package io.b2mash.b2b.deliverytracker.signature;

import io.b2mash.b2b.deliverytracker.audit.AuditEventBuilder;
import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.event.SignatureAddedEvent;
import io.b2mash.b2b.deliverytracker.event.SignatureCompletedEvent;
import io.b2mash.b2b.deliverytracker.exception.AlreadySignedException;
import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.exception.NotEligibleException;
import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.exception.ResourceNotFoundException;
import io.b2mash.b2b.deliverytracker.exception.StaleVersionException;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The dual-party signature workflow shared by deliverables, baseline commitments, acceptance
 * certificates and variations. Kind-specific preconditions and completion side effects come from
 * the registered {@link SignatureCompletionHandler}s.
 */
@Service
public class SignatureService {

  private static final Logger log = LoggerFactory.getLogger(SignatureService.class);

  private final SignatureRecordRepository signatureRecordRepository;
  private final PermissionService permissionService;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Map<SignatureEntityKind, SignatureCompletionHandler> handlers;

  public SignatureService(
      SignatureRecordRepository signatureRecordRepository,
      PermissionService permissionService,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      List<SignatureCompletionHandler> completionHandlers) {
    this.signatureRecordRepository = signatureRecordRepository;
    this.permissionService = permissionService;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.handlers = new EnumMap<>(SignatureEntityKind.class);
    for (SignatureCompletionHandler handler : completionHandlers) {
      if (handlers.put(handler.kind(), handler) != null) {
        throw new IllegalStateException("Duplicate completion handler for " + handler.kind());
      }
    }
  }

  /**
   * Opens a new, unsigned record for the entity. Fails if the entity already has an active one.
   */
  @Transactional
  public SignatureRecord open(
      SignatureEntityKind kind, UUID entityId, UUID projectId, UUID actorId) {
    if (signatureRecordRepository.findActive(kind, entityId).isPresent()) {
      throw new ResourceConflictException(
          "Signature already open",
          "The " + kind.entityType() + " " + entityId + " already has an active signature record");
    }
    int revision = signatureRecordRepository.findMaxRevision(kind, entityId) + 1;
    var record =
        signatureRecordRepository.save(
            new SignatureRecord(projectId, kind, entityId, revision, actorId));

    log.info("Opened {} signature record {} for {} (revision {})", kind, record.getId(), entityId, revision);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("signature.opened")
            .entityType(kind.entityType())
            .entityId(entityId)
            .projectId(projectId)
            .actorId(actorId)
            .details(Map.of("signature_record_id", record.getId().toString(), "revision", revision))
            .build());

    return record;
  }

  /**
   * Fills one party slot. The slot write is a conditional update, so of two concurrent attempts on
   * the same slot exactly one succeeds and the other gets {@link AlreadySignedException}; of two
   * attempts on different slots exactly one sees the record complete and runs the completion
   * handler.
   *
   * @param expectedVersion record version the caller last read; null skips the check
   * @throws AlreadySignedException if the party slot is already signed
   * @throws NotEligibleException if the signer's role cannot sign for the party, or the signer
   *     already holds the other slot (also checked by the slot write itself)
   * @throws StaleVersionException if {@code expectedVersion} no longer matches
   */
  @Transactional
  public SignatureRecord sign(
      SignatureEntityKind kind,
      UUID entityId,
      SignatureParty party,
      UUID signerId,
      Integer expectedVersion) {
    var handler = handlerFor(kind);
    var record = requireActive(kind, entityId);

    if (record.isSigned(party)) {
      throw new AlreadySignedException(kind.entityType(), entityId, party.label());
    }
    var role = permissionService.roleFor(signerId, record.getProjectId());
    if (!permissionService.isEligibleSigner(role, kind, party)) {
      throw new NotEligibleException(
          "Not eligible to sign",
          "Project role "
              + role
              + " cannot sign for the "
              + party.label()
              + " party on this "
              + kind.entityType().replace('_', ' '));
    }
    if (signerId.equals(record.signerFor(party.other()))) {
      throw signerHoldsOtherSlot(party);
    }
    handler.assertSignable(entityId);

    Instant signedAt = Instant.now();
    int updated = writeSlot(record.getId(), party, signerId, signedAt, expectedVersion);
    if (updated == 0) {
      var current =
          signatureRecordRepository
              .findById(record.getId())
              .orElseThrow(() -> new ResourceNotFoundException("Signature record", record.getId()));
      if (current.isSigned(party)) {
        throw new AlreadySignedException(kind.entityType(), entityId, party.label());
      }
      if (signerId.equals(current.signerFor(party.other()))) {
        throw signerHoldsOtherSlot(party);
      }
      throw new StaleVersionException("Signature record", record.getId());
    }

    log.info(
        "{} signed {} {} as {} party",
        signerId,
        kind.entityType(),
        entityId,
        party.label());

    Map<String, Object> details =
        Map.of(
            "signature_record_id", record.getId().toString(),
            "party", party.name(),
            "role", role.name());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("signature.added")
            .entityType(kind.entityType())
            .entityId(entityId)
            .projectId(record.getProjectId())
            .actorId(signerId)
            .details(details)
            .build());
    eventPublisher.publishEvent(
        new SignatureAddedEvent(
            "signature.added",
            kind.entityType(),
            entityId,
            record.getProjectId(),
            signerId,
            signedAt,
            details,
            record.getId(),
            kind.name(),
            party.name()));

    if (signatureRecordRepository.markCompleted(record.getId(), Instant.now()) == 1) {
      var completed = reload(record.getId());
      handler.onCompleted(completed, signerId);
      publishCompleted(completed, signerId);
      return completed;
    }
    return reload(record.getId());
  }

  /**
   * Retires the open record of an entity, e.g. when a variation is rejected or deleted.
   *
   * @throws InvalidStateException if the record is already complete
   */
  @Transactional
  public void supersede(SignatureEntityKind kind, UUID entityId, UUID actorId) {
    var active = signatureRecordRepository.findActive(kind, entityId);
    if (active.isEmpty()) {
      return;
    }
    var record = active.get();
    if (signatureRecordRepository.supersede(record.getId(), Instant.now()) == 0) {
      throw new InvalidStateException(
          "Signature complete",
          "The signature record for " + kind.entityType() + " " + entityId + " is complete");
    }

    log.info("Superseded {} signature record {} for {}", kind, record.getId(), entityId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("signature.superseded")
            .entityType(kind.entityType())
            .entityId(entityId)
            .projectId(record.getProjectId())
            .actorId(actorId)
            .details(Map.of("signature_record_id", record.getId().toString()))
            .build());
  }

  @Transactional(readOnly = true)
  public Optional<SignatureRecord> findActive(SignatureEntityKind kind, UUID entityId) {
    return signatureRecordRepository.findActive(kind, entityId);
  }

  /** The active record, checked against the caller's project membership. */
  @Transactional(readOnly = true)
  public SignatureRecord status(SignatureEntityKind kind, UUID entityId, UUID memberId) {
    var record = requireActive(kind, entityId);
    permissionService.roleFor(memberId, record.getProjectId());
    return record;
  }

  @Transactional(readOnly = true)
  public List<SignatureRecord> history(SignatureEntityKind kind, UUID entityId, UUID memberId) {
    var records =
        signatureRecordRepository.findByEntityKindAndEntityIdOrderByRevisionAsc(kind, entityId);
    if (records.isEmpty()) {
      throw ResourceNotFoundException.withDetail(
          "No signature record", "No signature record exists for " + kind.entityType() + " " + entityId);
    }
    permissionService.roleFor(memberId, records.get(0).getProjectId());
    return records;
  }

  @Transactional(readOnly = true)
  public List<SignatureRecord> findOpen(Collection<UUID> projectIds, SignatureEntityKind kind) {
    if (projectIds.isEmpty()) {
      return List.of();
    }
    return signatureRecordRepository.findOpenByKind(projectIds, kind);
  }

  private int writeSlot(
      UUID recordId, SignatureParty party, UUID signerId, Instant signedAt, Integer expectedVersion) {
    if (party == SignatureParty.PROVIDING) {
      return expectedVersion == null
          ? signatureRecordRepository.signProviding(recordId, signerId, signedAt)
          : signatureRecordRepository.signProvidingAtVersion(
              recordId, signerId, signedAt, expectedVersion);
    }
    return expectedVersion == null
        ? signatureRecordRepository.signReceiving(recordId, signerId, signedAt)
        : signatureRecordRepository.signReceivingAtVersion(
            recordId, signerId, signedAt, expectedVersion);
  }

  private void publishCompleted(SignatureRecord record, UUID completingSignerId) {
    var kind = record.getEntityKind();
    log.info(
        "Signature record {} for {} {} completed",
        record.getId(),
        kind.entityType(),
        record.getEntityId());

    Map<String, Object> details =
        Map.of(
            "signature_record_id", record.getId().toString(),
            "revision", record.getRevision(),
            "providing_signer_id", record.getProvidingSignerId().toString(),
            "receiving_signer_id", record.getReceivingSignerId().toString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("signature.completed")
            .entityType(kind.entityType())
            .entityId(record.getEntityId())
            .projectId(record.getProjectId())
            .actorId(completingSignerId)
            .details(details)
            .build());
    eventPublisher.publishEvent(
        new SignatureCompletedEvent(
            "signature.completed",
            kind.entityType(),
            record.getEntityId(),
            record.getProjectId(),
            completingSignerId,
            record.getCompletedAt(),
            details,
            record.getId(),
            kind.name(),
            record.getProvidingSignerId(),
            record.getReceivingSignerId()));
  }

  private static NotEligibleException signerHoldsOtherSlot(SignatureParty party) {
    return new NotEligibleException(
        "Signer already signed",
        "The "
            + party.other().label()
            + " signature is already yours; the "
            + party.label()
            + " signature must come from someone else");
  }

  private SignatureRecord requireActive(SignatureEntityKind kind, UUID entityId) {
    return signatureRecordRepository
        .findActive(kind, entityId)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "No open signature",
                    "There is no active signature record for "
                        + kind.entityType().replace('_', ' ')
                        + " "
                        + entityId));
  }

  private SignatureRecord reload(UUID recordId) {
    return signatureRecordRepository
        .findById(recordId)
        .orElseThrow(() -> new ResourceNotFoundException("Signature record", recordId));
  }

  private SignatureCompletionHandler handlerFor(SignatureEntityKind kind) {
    var handler = handlers.get(kind);
    if (handler == null) {
      throw new IllegalStateException("No completion handler registered for " + kind);
    }
    return handler;
  }
}
