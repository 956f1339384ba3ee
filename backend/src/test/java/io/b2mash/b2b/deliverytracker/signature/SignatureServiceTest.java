package io.b2mash.b2b.deliverytracker.signature;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.deliverytracker.audit.AuditService;
import io.b2mash.b2b.deliverytracker.event.SignatureCompletedEvent;
import io.b2mash.b2b.deliverytracker.exception.AlreadySignedException;
import io.b2mash.b2b.deliverytracker.exception.InvalidStateException;
import io.b2mash.b2b.deliverytracker.exception.NotEligibleException;
import io.b2mash.b2b.deliverytracker.exception.ResourceConflictException;
import io.b2mash.b2b.deliverytracker.exception.StaleVersionException;
import io.b2mash.b2b.deliverytracker.member.ProjectRole;
import io.b2mash.b2b.deliverytracker.permission.PermissionService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class SignatureServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID ENTITY_ID = UUID.randomUUID();
  private static final UUID SUPPLIER_ID = UUID.randomUUID();
  private static final UUID CUSTOMER_ID = UUID.randomUUID();
  private static final SignatureEntityKind KIND = SignatureEntityKind.DELIVERABLE;

  @Mock private SignatureRecordRepository signatureRecordRepository;
  @Mock private PermissionService permissionService;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;
  @Mock private SignatureCompletionHandler handler;

  private SignatureService service;

  @BeforeEach
  void setUp() {
    when(handler.kind()).thenReturn(KIND);
    service =
        new SignatureService(
            signatureRecordRepository,
            permissionService,
            auditService,
            eventPublisher,
            List.of(handler));
  }

  @Test
  void duplicateHandlersForOneKindAreRejected() {
    var second = mock(SignatureCompletionHandler.class);
    when(second.kind()).thenReturn(KIND);

    assertThatThrownBy(
            () ->
                new SignatureService(
                    signatureRecordRepository,
                    permissionService,
                    auditService,
                    eventPublisher,
                    List.of(handler, second)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void open_rejectsWhenActiveRecordExists() {
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record()));

    assertThatThrownBy(() -> service.open(KIND, ENTITY_ID, PROJECT_ID, SUPPLIER_ID))
        .isInstanceOf(ResourceConflictException.class);
    verify(signatureRecordRepository, never()).save(any());
  }

  @Test
  void open_assignsNextRevision() {
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.empty());
    when(signatureRecordRepository.findMaxRevision(KIND, ENTITY_ID)).thenReturn(2);
    when(signatureRecordRepository.save(any(SignatureRecord.class)))
        .thenAnswer(
            invocation -> {
              SignatureRecord saved = invocation.getArgument(0);
              ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
              return saved;
            });

    var record = service.open(KIND, ENTITY_ID, PROJECT_ID, SUPPLIER_ID);

    assertThat(record.getRevision()).isEqualTo(3);
    verify(auditService).log(any());
  }

  @Test
  void sign_rejectsSlotAlreadyFilled() {
    var record = record();
    ReflectionTestUtils.setField(record, "providingSignerId", SUPPLIER_ID);
    ReflectionTestUtils.setField(record, "providingSignedAt", Instant.now());
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record));

    assertThatThrownBy(
            () -> service.sign(KIND, ENTITY_ID, SignatureParty.PROVIDING, UUID.randomUUID(), null))
        .isInstanceOf(AlreadySignedException.class);
    verify(signatureRecordRepository, never()).signProviding(any(), any(), any());
  }

  @Test
  void sign_rejectsIneligibleRole() {
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record()));
    when(permissionService.roleFor(CUSTOMER_ID, PROJECT_ID)).thenReturn(ProjectRole.CUSTOMER_PM);
    when(permissionService.isEligibleSigner(
            ProjectRole.CUSTOMER_PM, KIND, SignatureParty.PROVIDING))
        .thenReturn(false);

    assertThatThrownBy(
            () -> service.sign(KIND, ENTITY_ID, SignatureParty.PROVIDING, CUSTOMER_ID, null))
        .isInstanceOf(NotEligibleException.class);
    verify(handler, never()).assertSignable(any());
  }

  @Test
  void sign_rejectsSameMemberInBothSlots() {
    var record = record();
    ReflectionTestUtils.setField(record, "providingSignerId", SUPPLIER_ID);
    ReflectionTestUtils.setField(record, "providingSignedAt", Instant.now());
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record));
    when(permissionService.roleFor(SUPPLIER_ID, PROJECT_ID)).thenReturn(ProjectRole.ADMIN);
    when(permissionService.isEligibleSigner(ProjectRole.ADMIN, KIND, SignatureParty.RECEIVING))
        .thenReturn(true);

    assertThatThrownBy(
            () -> service.sign(KIND, ENTITY_ID, SignatureParty.RECEIVING, SUPPLIER_ID, null))
        .isInstanceOf(NotEligibleException.class);
    verify(signatureRecordRepository, never()).signReceiving(any(), any(), any());
  }

  @Test
  void sign_handlerPreconditionFailureWritesNothing() {
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record()));
    allowSupplier();
    doThrow(new InvalidStateException("Not reviewable", "not yet"))
        .when(handler)
        .assertSignable(ENTITY_ID);

    assertThatThrownBy(
            () -> service.sign(KIND, ENTITY_ID, SignatureParty.PROVIDING, SUPPLIER_ID, null))
        .isInstanceOf(InvalidStateException.class);
    verify(signatureRecordRepository, never()).signProviding(any(), any(), any());
  }

  @Test
  void sign_firstSignatureDoesNotComplete() {
    var record = record();
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record));
    allowSupplier();
    when(signatureRecordRepository.signProviding(eq(record.getId()), eq(SUPPLIER_ID), any()))
        .thenReturn(1);
    when(signatureRecordRepository.markCompleted(eq(record.getId()), any())).thenReturn(0);
    when(signatureRecordRepository.findById(record.getId())).thenReturn(Optional.of(record));

    service.sign(KIND, ENTITY_ID, SignatureParty.PROVIDING, SUPPLIER_ID, null);

    verify(handler, never()).onCompleted(any(), any());
    verify(eventPublisher, never()).publishEvent(any(SignatureCompletedEvent.class));
  }

  @Test
  void sign_completingSignatureRunsHandlerOnce() {
    var record = record();
    ReflectionTestUtils.setField(record, "providingSignerId", SUPPLIER_ID);
    ReflectionTestUtils.setField(record, "providingSignedAt", Instant.now());
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record));
    when(permissionService.roleFor(CUSTOMER_ID, PROJECT_ID)).thenReturn(ProjectRole.CUSTOMER_PM);
    when(permissionService.isEligibleSigner(
            ProjectRole.CUSTOMER_PM, KIND, SignatureParty.RECEIVING))
        .thenReturn(true);
    when(signatureRecordRepository.signReceiving(eq(record.getId()), eq(CUSTOMER_ID), any()))
        .thenReturn(1);
    when(signatureRecordRepository.markCompleted(eq(record.getId()), any())).thenReturn(1);

    var completed = record();
    ReflectionTestUtils.setField(completed, "id", record.getId());
    ReflectionTestUtils.setField(completed, "providingSignerId", SUPPLIER_ID);
    ReflectionTestUtils.setField(completed, "providingSignedAt", Instant.now());
    ReflectionTestUtils.setField(completed, "receivingSignerId", CUSTOMER_ID);
    ReflectionTestUtils.setField(completed, "receivingSignedAt", Instant.now());
    ReflectionTestUtils.setField(completed, "completedAt", Instant.now());
    when(signatureRecordRepository.findById(record.getId())).thenReturn(Optional.of(completed));

    var result = service.sign(KIND, ENTITY_ID, SignatureParty.RECEIVING, CUSTOMER_ID, null);

    assertThat(result.isComplete()).isTrue();
    verify(handler).onCompleted(completed, CUSTOMER_ID);
    verify(eventPublisher).publishEvent(any(SignatureCompletedEvent.class));
  }

  @Test
  void sign_lostRaceOnSameSlotReportsAlreadySigned() {
    var record = record();
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record));
    allowSupplier();
    when(signatureRecordRepository.signProviding(eq(record.getId()), eq(SUPPLIER_ID), any()))
        .thenReturn(0);
    var winner = record();
    ReflectionTestUtils.setField(winner, "providingSignerId", UUID.randomUUID());
    ReflectionTestUtils.setField(winner, "providingSignedAt", Instant.now());
    when(signatureRecordRepository.findById(record.getId())).thenReturn(Optional.of(winner));

    assertThatThrownBy(
            () -> service.sign(KIND, ENTITY_ID, SignatureParty.PROVIDING, SUPPLIER_ID, null))
        .isInstanceOf(AlreadySignedException.class);
    verify(handler, never()).onCompleted(any(), any());
  }

  @Test
  void sign_lostRaceToOwnOtherSlotIsNotEligible() {
    var record = record();
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record));
    when(permissionService.roleFor(SUPPLIER_ID, PROJECT_ID)).thenReturn(ProjectRole.ADMIN);
    when(permissionService.isEligibleSigner(ProjectRole.ADMIN, KIND, SignatureParty.RECEIVING))
        .thenReturn(true);
    when(signatureRecordRepository.signReceiving(eq(record.getId()), eq(SUPPLIER_ID), any()))
        .thenReturn(0);
    var concurrent = record();
    ReflectionTestUtils.setField(concurrent, "providingSignerId", SUPPLIER_ID);
    ReflectionTestUtils.setField(concurrent, "providingSignedAt", Instant.now());
    when(signatureRecordRepository.findById(record.getId())).thenReturn(Optional.of(concurrent));

    assertThatThrownBy(
            () -> service.sign(KIND, ENTITY_ID, SignatureParty.RECEIVING, SUPPLIER_ID, null))
        .isInstanceOf(NotEligibleException.class);
    verify(signatureRecordRepository, never()).markCompleted(any(), any());
  }

  @Test
  void sign_staleExpectedVersionIsRejected() {
    var record = record();
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record));
    allowSupplier();
    when(signatureRecordRepository.signProvidingAtVersion(
            eq(record.getId()), eq(SUPPLIER_ID), any(), anyInt()))
        .thenReturn(0);
    when(signatureRecordRepository.findById(record.getId())).thenReturn(Optional.of(record));

    assertThatThrownBy(
            () -> service.sign(KIND, ENTITY_ID, SignatureParty.PROVIDING, SUPPLIER_ID, 4))
        .isInstanceOf(StaleVersionException.class);
  }

  @Test
  void supersede_withoutActiveRecordIsNoOp() {
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.empty());

    service.supersede(KIND, ENTITY_ID, SUPPLIER_ID);

    verify(signatureRecordRepository, never()).supersede(any(), any());
    verify(auditService, never()).log(any());
  }

  @Test
  void supersede_completeRecordIsRejected() {
    var record = record();
    when(signatureRecordRepository.findActive(KIND, ENTITY_ID)).thenReturn(Optional.of(record));
    when(signatureRecordRepository.supersede(eq(record.getId()), any())).thenReturn(0);

    assertThatThrownBy(() -> service.supersede(KIND, ENTITY_ID, SUPPLIER_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  private void allowSupplier() {
    when(permissionService.roleFor(SUPPLIER_ID, PROJECT_ID)).thenReturn(ProjectRole.SUPPLIER_PM);
    when(permissionService.isEligibleSigner(
            ProjectRole.SUPPLIER_PM, KIND, SignatureParty.PROVIDING))
        .thenReturn(true);
  }

  private static SignatureRecord record() {
    var record = new SignatureRecord(PROJECT_ID, KIND, ENTITY_ID, 1, SUPPLIER_ID);
    ReflectionTestUtils.setField(record, "id", UUID.randomUUID());
    return record;
  }
}
