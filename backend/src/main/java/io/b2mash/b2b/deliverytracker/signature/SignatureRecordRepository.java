package io.b2mash.b2b.deliverytracker.signature;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Slot updates are conditional bulk statements: each returns the number of rows it changed, and
 * zero means the precondition no longer held when the row was written. A slot write never
 * succeeds when the same signer already holds the other slot.
 */
public interface SignatureRecordRepository extends JpaRepository<SignatureRecord, UUID> {

  @Query(
      """
      SELECT s FROM SignatureRecord s
      WHERE s.entityKind = :kind AND s.entityId = :entityId AND s.supersededAt IS NULL
      """)
  Optional<SignatureRecord> findActive(
      @Param("kind") SignatureEntityKind kind, @Param("entityId") UUID entityId);

  List<SignatureRecord> findByEntityKindAndEntityIdOrderByRevisionAsc(
      SignatureEntityKind entityKind, UUID entityId);

  @Query(
      """
      SELECT COALESCE(MAX(s.revision), 0) FROM SignatureRecord s
      WHERE s.entityKind = :kind AND s.entityId = :entityId
      """)
  int findMaxRevision(@Param("kind") SignatureEntityKind kind, @Param("entityId") UUID entityId);

  /** Active records with at least one empty slot, for the workflow aggregator. */
  @Query(
      """
      SELECT s FROM SignatureRecord s
      WHERE s.projectId IN :projectIds
        AND s.entityKind = :kind
        AND s.supersededAt IS NULL
        AND s.completedAt IS NULL
      ORDER BY s.createdAt ASC
      """)
  List<SignatureRecord> findOpenByKind(
      @Param("projectIds") Collection<UUID> projectIds, @Param("kind") SignatureEntityKind kind);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SignatureRecord s
      SET s.providingSignerId = :signerId, s.providingSignedAt = :signedAt,
          s.version = s.version + 1
      WHERE s.id = :id AND s.providingSignedAt IS NULL AND s.supersededAt IS NULL
        AND (s.receivingSignerId IS NULL OR s.receivingSignerId <> :signerId)
      """)
  int signProviding(
      @Param("id") UUID id, @Param("signerId") UUID signerId, @Param("signedAt") Instant signedAt);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SignatureRecord s
      SET s.providingSignerId = :signerId, s.providingSignedAt = :signedAt,
          s.version = s.version + 1
      WHERE s.id = :id AND s.providingSignedAt IS NULL AND s.supersededAt IS NULL
        AND (s.receivingSignerId IS NULL OR s.receivingSignerId <> :signerId)
        AND s.version = :expectedVersion
      """)
  int signProvidingAtVersion(
      @Param("id") UUID id,
      @Param("signerId") UUID signerId,
      @Param("signedAt") Instant signedAt,
      @Param("expectedVersion") int expectedVersion);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SignatureRecord s
      SET s.receivingSignerId = :signerId, s.receivingSignedAt = :signedAt,
          s.version = s.version + 1
      WHERE s.id = :id AND s.receivingSignedAt IS NULL AND s.supersededAt IS NULL
        AND (s.providingSignerId IS NULL OR s.providingSignerId <> :signerId)
      """)
  int signReceiving(
      @Param("id") UUID id, @Param("signerId") UUID signerId, @Param("signedAt") Instant signedAt);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SignatureRecord s
      SET s.receivingSignerId = :signerId, s.receivingSignedAt = :signedAt,
          s.version = s.version + 1
      WHERE s.id = :id AND s.receivingSignedAt IS NULL AND s.supersededAt IS NULL
        AND (s.providingSignerId IS NULL OR s.providingSignerId <> :signerId)
        AND s.version = :expectedVersion
      """)
  int signReceivingAtVersion(
      @Param("id") UUID id,
      @Param("signerId") UUID signerId,
      @Param("signedAt") Instant signedAt,
      @Param("expectedVersion") int expectedVersion);

  /** Wins at most once per record: the transaction that sees both slots filled first. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SignatureRecord s
      SET s.completedAt = :completedAt, s.version = s.version + 1
      WHERE s.id = :id
        AND s.completedAt IS NULL
        AND s.providingSignedAt IS NOT NULL
        AND s.receivingSignedAt IS NOT NULL
      """)
  int markCompleted(@Param("id") UUID id, @Param("completedAt") Instant completedAt);

  /** Retires an open record. Completed records are never superseded. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      """
      UPDATE SignatureRecord s
      SET s.supersededAt = :supersededAt, s.version = s.version + 1
      WHERE s.id = :id AND s.completedAt IS NULL AND s.supersededAt IS NULL
        AND (s.providingSignedAt IS NULL OR s.receivingSignedAt IS NULL)
      """)
  int supersede(@Param("id") UUID id, @Param("supersededAt") Instant supersededAt);
}
