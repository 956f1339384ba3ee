package io.b2mash.b2b.deliverytracker.signature;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Two-party approval ledger for one entity. Slots are only ever filled through the conditional
 * updates in {@link SignatureRecordRepository}; the entity itself exposes no mutators for them, so
 * a signed slot can never be cleared.
 *
 * <p>{@code version} is bumped by every conditional update and is the value callers pass back as
 * their expected version. It is maintained by those bulk statements, not by JPA versioning.
 */
@Entity
@Table(name = "signature_records")
public class SignatureRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "entity_kind", nullable = false, updatable = false, length = 40)
  private SignatureEntityKind entityKind;

  @Column(name = "entity_id", nullable = false, updatable = false)
  private UUID entityId;

  @Column(name = "revision", nullable = false, updatable = false)
  private int revision;

  @Column(name = "providing_signer_id")
  private UUID providingSignerId;

  @Column(name = "providing_signed_at")
  private Instant providingSignedAt;

  @Column(name = "receiving_signer_id")
  private UUID receivingSignerId;

  @Column(name = "receiving_signed_at")
  private Instant receivingSignedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "superseded_at")
  private Instant supersededAt;

  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_by", nullable = false, updatable = false)
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SignatureRecord() {}

  public SignatureRecord(
      UUID projectId,
      SignatureEntityKind entityKind,
      UUID entityId,
      int revision,
      UUID createdBy) {
    this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
    this.entityKind = Objects.requireNonNull(entityKind, "entityKind must not be null");
    this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
    this.revision = revision;
    this.createdBy = Objects.requireNonNull(createdBy, "createdBy must not be null");
    this.createdAt = Instant.now();
  }

  public boolean isSigned(SignatureParty party) {
    return signedAtFor(party) != null;
  }

  public UUID signerFor(SignatureParty party) {
    return party == SignatureParty.PROVIDING ? providingSignerId : receivingSignerId;
  }

  public Instant signedAtFor(SignatureParty party) {
    return party == SignatureParty.PROVIDING ? providingSignedAt : receivingSignedAt;
  }

  /** Complete iff both slots are signed. */
  public boolean isComplete() {
    return providingSignedAt != null && receivingSignedAt != null;
  }

  public boolean isSuperseded() {
    return supersededAt != null;
  }

  public SignatureState state() {
    if (isComplete()) {
      return SignatureState.COMPLETE;
    }
    if (providingSignedAt != null || receivingSignedAt != null) {
      return SignatureState.PARTIALLY_SIGNED;
    }
    return SignatureState.UNSIGNED;
  }

  public SignatureStage stage() {
    if (isComplete()) {
      return SignatureStage.SIGNED;
    }
    if (providingSignedAt != null) {
      return SignatureStage.AWAITING_CUSTOMER;
    }
    if (receivingSignedAt != null) {
      return SignatureStage.AWAITING_SUPPLIER;
    }
    return SignatureStage.NOT_SIGNED;
  }

  /** Parties whose slot is still empty, providing first. */
  public List<SignatureParty> missingParties() {
    var missing = new ArrayList<SignatureParty>(2);
    for (SignatureParty party : SignatureParty.values()) {
      if (!isSigned(party)) {
        missing.add(party);
      }
    }
    return missing;
  }

  /**
   * When the missing party's turn started: the other party's signature if present, otherwise the
   * record's creation.
   */
  public Instant pendingSince(SignatureParty missingParty) {
    Instant otherSignedAt = signedAtFor(missingParty.other());
    return otherSignedAt != null ? otherSignedAt : createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public SignatureEntityKind getEntityKind() {
    return entityKind;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public int getRevision() {
    return revision;
  }

  public UUID getProvidingSignerId() {
    return providingSignerId;
  }

  public Instant getProvidingSignedAt() {
    return providingSignedAt;
  }

  public UUID getReceivingSignerId() {
    return receivingSignerId;
  }

  public Instant getReceivingSignedAt() {
    return receivingSignedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getSupersededAt() {
    return supersededAt;
  }

  public int getVersion() {
    return version;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
