package io.b2mash.b2b.deliverytracker.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.deliverytracker.exception.ForbiddenException;
import io.b2mash.b2b.deliverytracker.member.ProjectCapability;
import io.b2mash.b2b.deliverytracker.member.ProjectMember;
import io.b2mash.b2b.deliverytracker.member.ProjectMemberRepository;
import io.b2mash.b2b.deliverytracker.member.ProjectRole;
import io.b2mash.b2b.deliverytracker.signature.SignatureEntityKind;
import io.b2mash.b2b.deliverytracker.signature.SignatureParty;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectRolePermissionServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID MEMBER_ID = UUID.randomUUID();

  @Mock private ProjectMemberRepository projectMemberRepository;
  @Mock private ProjectMember membership;

  private ProjectRolePermissionService service;

  @BeforeEach
  void setUp() {
    service =
        new ProjectRolePermissionService(
            projectMemberRepository, new PermissionProperties(100, Duration.ofMinutes(5)));
  }

  @ParameterizedTest
  @EnumSource(SignatureEntityKind.class)
  void supplierPmSignsProvidingOnly(SignatureEntityKind kind) {
    assertThat(service.isEligibleSigner(ProjectRole.SUPPLIER_PM, kind, SignatureParty.PROVIDING))
        .isTrue();
    assertThat(service.isEligibleSigner(ProjectRole.SUPPLIER_PM, kind, SignatureParty.RECEIVING))
        .isFalse();
  }

  @ParameterizedTest
  @EnumSource(SignatureEntityKind.class)
  void customerPmSignsReceivingOnly(SignatureEntityKind kind) {
    assertThat(service.isEligibleSigner(ProjectRole.CUSTOMER_PM, kind, SignatureParty.RECEIVING))
        .isTrue();
    assertThat(service.isEligibleSigner(ProjectRole.CUSTOMER_PM, kind, SignatureParty.PROVIDING))
        .isFalse();
  }

  @ParameterizedTest
  @EnumSource(SignatureParty.class)
  void adminSignsEitherParty(SignatureParty party) {
    assertThat(service.isEligibleSigner(ProjectRole.ADMIN, SignatureEntityKind.VARIATION, party))
        .isTrue();
  }

  @ParameterizedTest
  @EnumSource(
      value = ProjectRole.class,
      names = {"SUPPLIER_FINANCE", "CUSTOMER_FINANCE", "CONTRIBUTOR", "VIEWER"})
  void otherRolesNeverSign(ProjectRole role) {
    for (SignatureParty party : SignatureParty.values()) {
      assertThat(service.isEligibleSigner(role, SignatureEntityKind.DELIVERABLE, party)).isFalse();
    }
  }

  @Test
  void missingRoleIsNotEligible() {
    assertThat(service.isEligibleSigner(null, SignatureEntityKind.DELIVERABLE, SignatureParty.PROVIDING))
        .isFalse();
  }

  @Test
  void roleFor_nonMemberIsForbidden() {
    when(projectMemberRepository.findByProjectIdAndMemberId(PROJECT_ID, MEMBER_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.roleFor(MEMBER_ID, PROJECT_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void roleFor_cachesUntilEvicted() {
    when(membership.getProjectRole()).thenReturn(ProjectRole.SUPPLIER_PM);
    when(projectMemberRepository.findByProjectIdAndMemberId(PROJECT_ID, MEMBER_ID))
        .thenReturn(Optional.of(membership));

    assertThat(service.roleFor(MEMBER_ID, PROJECT_ID)).isEqualTo(ProjectRole.SUPPLIER_PM);
    assertThat(service.roleFor(MEMBER_ID, PROJECT_ID)).isEqualTo(ProjectRole.SUPPLIER_PM);
    verify(projectMemberRepository, times(1)).findByProjectIdAndMemberId(PROJECT_ID, MEMBER_ID);

    service.evict(PROJECT_ID, MEMBER_ID);
    service.roleFor(MEMBER_ID, PROJECT_ID);
    verify(projectMemberRepository, times(2)).findByProjectIdAndMemberId(PROJECT_ID, MEMBER_ID);
  }

  @Test
  void requireCapability_rejectsRoleWithoutIt() {
    when(membership.getProjectRole()).thenReturn(ProjectRole.VIEWER);
    when(projectMemberRepository.findByProjectIdAndMemberId(PROJECT_ID, MEMBER_ID))
        .thenReturn(Optional.of(membership));

    assertThatThrownBy(
            () -> service.requireCapability(MEMBER_ID, PROJECT_ID, ProjectCapability.MANAGE_PLAN))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireCapability_returnsRoleWhenGranted() {
    when(membership.getProjectRole()).thenReturn(ProjectRole.CUSTOMER_PM);
    when(projectMemberRepository.findByProjectIdAndMemberId(PROJECT_ID, MEMBER_ID))
        .thenReturn(Optional.of(membership));

    assertThat(
            service.requireCapability(
                MEMBER_ID, PROJECT_ID, ProjectCapability.REVIEW_DELIVERABLE))
        .isEqualTo(ProjectRole.CUSTOMER_PM);
  }
}
