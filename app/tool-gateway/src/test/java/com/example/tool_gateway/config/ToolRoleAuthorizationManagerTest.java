package com.example.tool_gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.tool_gateway.auth.AuthorizationGate;
import com.example.tool_gateway.auth.EntitlementResolver;
import com.example.tool_gateway.auth.ToolPermission;
import com.example.tool_gateway.model.UserProfile;
import com.example.tool_gateway.service.ToolGatewayMetrics;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

class ToolRoleAuthorizationManagerTest {

  private final ToolGatewayMetrics metrics = Mockito.mock(ToolGatewayMetrics.class);
  private final AuthorizationGate gate =
      new AuthorizationGate(Mockito.mock(EntitlementResolver.class));
  private final MockHttpServletRequest request =
      new MockHttpServletRequest("POST", "/v1/tools/refresh-cache");

  @Test
  void adminMayRefreshCache() {
    final AuthorizationDecision decision =
        manager(ToolPermission.REFRESH_CACHE)
            .check(() -> authenticated(Set.of("admin")), new RequestAuthorizationContext(request));

    assertThat(decision.isGranted()).isTrue();
    verify(metrics).recordAuthorization("refresh_cache", "allowed");
    assertThat(request.getAttribute(ToolRoleAuthorizationManager.DENIAL_MESSAGE_ATTRIBUTE))
        .isNull();
  }

  @Test
  void readerIsDeniedRefreshWithRoleMessage() {
    final AuthorizationDecision decision =
        manager(ToolPermission.REFRESH_CACHE)
            .check(() -> authenticated(Set.of("reader")), new RequestAuthorizationContext(request));

    assertThat(decision.isGranted()).isFalse();
    verify(metrics).recordAuthorization("refresh_cache", "forbidden");
    assertThat(request.getAttribute(ToolRoleAuthorizationManager.DENIAL_MESSAGE_ATTRIBUTE))
        .isEqualTo("Insufficient permissions. Required one of: [admin], user has: [reader]");
  }

  @Test
  void readerMayListEntities() {
    final AuthorizationDecision decision =
        manager(ToolPermission.LIST_ENTITIES)
            .check(() -> authenticated(Set.of("reader")), new RequestAuthorizationContext(request));

    assertThat(decision.isGranted()).isTrue();
  }

  @Test
  void principalOtherThanResolvedProfileIsDenied() {
    final Authentication foreign =
        new UsernamePasswordAuthenticationToken(
            "someone", "N/A", List.of(new SimpleGrantedAuthority("admin")));

    final AuthorizationDecision decision =
        manager(ToolPermission.REFRESH_CACHE)
            .check(() -> foreign, new RequestAuthorizationContext(request));

    assertThat(decision.isGranted()).isFalse();
    verifyNoInteractions(metrics);
  }

  @Test
  void anonymousCallerIsDenied() {
    final Authentication anonymous =
        new AnonymousAuthenticationToken(
            "key", "anonymousUser", List.of(new SimpleGrantedAuthority("ROLE_ANONYMOUS")));

    final AuthorizationDecision decision =
        manager(ToolPermission.GET_ENTITY)
            .check(() -> anonymous, new RequestAuthorizationContext(request));

    assertThat(decision.isGranted()).isFalse();
  }

  private ToolRoleAuthorizationManager manager(ToolPermission permission) {
    return new ToolRoleAuthorizationManager(permission, gate, metrics);
  }

  private static Authentication authenticated(Set<String> roles) {
    final UserProfile profile = new UserProfile("user-1", roles, Set.of("ops"));
    return new UsernamePasswordAuthenticationToken(
        profile,
        "N/A",
        roles.stream().map(SimpleGrantedAuthority::new).toList());
  }
}
