package com.example.tool_gateway.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.tool_gateway.model.UserProfile;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class AuthorizationGateTest {

  private static final Set<String> READ_ROLES = Set.of("reader", "admin");

  private final EntitlementResolver resolver = Mockito.mock(EntitlementResolver.class);
  private final AuthorizationGate gate = new AuthorizationGate(resolver);

  @Test
  void readerPassesReadGate() {
    final UserProfile reader = new UserProfile("user-1", Set.of("reader"), Set.of("ops"));
    when(resolver.resolve("token-1")).thenReturn(AccessResult.success(reader));

    final AccessResult<UserProfile> result = gate.authorize("Bearer token-1", READ_ROLES);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEqualTo(reader);
  }

  @Test
  void callerWithoutRolesIsDeniedWithRequiredAndActualRoles() {
    final UserProfile nobody = new UserProfile("user-2", Set.of(), Set.of("ops"));
    when(resolver.resolve("token-2")).thenReturn(AccessResult.success(nobody));

    final AccessResult<UserProfile> result = gate.authorize("Bearer token-2", READ_ROLES);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.failure().kind()).isEqualTo(AccessFailure.Kind.AUTHORIZATION);
    assertThat(result.failure().message())
        .isEqualTo("Insufficient permissions. Required one of: [admin, reader], user has: []");
  }

  @Test
  void readerIsDeniedAdminGate() {
    final UserProfile reader = new UserProfile("user-1", Set.of("reader"), Set.of("ops"));
    when(resolver.resolve("token-1")).thenReturn(AccessResult.success(reader));

    final AccessResult<UserProfile> result = gate.authorize("Bearer token-1", Set.of("admin"));

    assertThat(result.failure().kind()).isEqualTo(AccessFailure.Kind.AUTHORIZATION);
    assertThat(result.failure().message()).contains("[admin]").contains("[reader]");
  }

  @Test
  void missingCredentialFailsBeforeResolution() {
    final AccessResult<UserProfile> result = gate.authorize(null, READ_ROLES);

    assertThat(result.failure().kind()).isEqualTo(AccessFailure.Kind.AUTHENTICATION);
    verifyNoInteractions(resolver);
  }

  @Test
  void resolverFailureIsPropagatedUnchanged() {
    final AccessFailure failure = AccessFailure.authentication("token verification failed");
    when(resolver.resolve("token-3")).thenReturn(AccessResult.failure(failure));

    final AccessResult<UserProfile> result = gate.authorize("Bearer token-3", READ_ROLES);

    assertThat(result.failure()).isEqualTo(failure);
  }

  @Test
  void authenticateResolvesWithoutRoleCheck() {
    final UserProfile nobody = new UserProfile("user-2", Set.of(), Set.of());
    when(resolver.resolve("token-2")).thenReturn(AccessResult.success(nobody));

    assertThat(gate.authenticate("bearer token-2").value()).isEqualTo(nobody);
  }

  @Test
  void authorizeRolesRejectsEmptyRequirement() {
    final UserProfile reader = new UserProfile("user-1", Set.of("reader"), Set.of("ops"));

    assertThatThrownBy(() -> gate.authorizeRoles(reader, Set.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> gate.authorize("Bearer token-1", Set.of()))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(resolver);
  }
}
