package com.example.tool_gateway.config;

import com.example.tool_gateway.auth.AccessResult;
import com.example.tool_gateway.auth.AuthorizationGate;
import com.example.tool_gateway.auth.ToolPermission;
import com.example.tool_gateway.model.UserProfile;
import com.example.tool_gateway.service.ToolGatewayMetrics;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

public class ToolRoleAuthorizationManager
    implements AuthorizationManager<RequestAuthorizationContext> {

  public static final String DENIAL_MESSAGE_ATTRIBUTE =
      "com.example.tool_gateway.config.ToolRoleAuthorizationManager.DENIAL_MESSAGE";

  private static final Logger logger = LoggerFactory.getLogger(ToolRoleAuthorizationManager.class);

  private final ToolPermission permission;
  private final AuthorizationGate authorizationGate;
  private final ToolGatewayMetrics metrics;

  public ToolRoleAuthorizationManager(
      ToolPermission permission, AuthorizationGate authorizationGate, ToolGatewayMetrics metrics) {
    this.permission = permission;
    this.authorizationGate = authorizationGate;
    this.metrics = metrics;
  }

  @Override
  public AuthorizationDecision check(
      Supplier<Authentication> authentication, RequestAuthorizationContext context) {
    final Authentication auth = authentication.get();
    if (auth == null
        || !auth.isAuthenticated()
        || !(auth.getPrincipal() instanceof UserProfile profile)) {
      return new AuthorizationDecision(false);
    }
    final AccessResult<UserProfile> result =
        authorizationGate.authorizeRoles(profile, permission.requiredRoles());
    if (result.isSuccess()) {
      metrics.recordAuthorization(permission.toolName(), "allowed");
      return new AuthorizationDecision(true);
    }
    metrics.recordAuthorization(permission.toolName(), "forbidden");
    logger.info(
        "tool call forbidden tool={} subjectId={}", permission.toolName(), profile.subjectId());
    context.getRequest().setAttribute(DENIAL_MESSAGE_ATTRIBUTE, result.failure().message());
    return new AuthorizationDecision(false);
  }
}
