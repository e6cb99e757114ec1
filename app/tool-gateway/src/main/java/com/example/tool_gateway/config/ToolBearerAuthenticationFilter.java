/*
 * どこで: Tool Gateway セキュリティ層
 * 何を: ツール呼び出しの bearer 資格情報を解決し SecurityContext へ設定する
 * なぜ: ロール判定を Spring Security の認可フィルタへ委ね、未認証は JSON 401 で返すため
 */
package com.example.tool_gateway.config;

import com.example.tool_gateway.auth.AccessResult;
import com.example.tool_gateway.auth.AuthorizationGate;
import com.example.tool_gateway.auth.ToolPermission;
import com.example.tool_gateway.model.UserProfile;
import com.example.tool_gateway.service.ToolGatewayMetrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.web.filter.OncePerRequestFilter;

public class ToolBearerAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(ToolBearerAuthenticationFilter.class);
  static final String MDC_TOOL_NAME = "tool_name";
  static final String MDC_SUBJECT_ID = "subject_id";
  static final String UNKNOWN_TOOL = "unknown";

  private final AuthorizationGate authorizationGate;
  private final ToolGatewayMetrics metrics;
  private final AuthenticationEntryPoint authenticationEntryPoint;

  public ToolBearerAuthenticationFilter(
      AuthorizationGate authorizationGate,
      ToolGatewayMetrics metrics,
      AuthenticationEntryPoint authenticationEntryPoint) {
    this.authorizationGate = authorizationGate;
    this.metrics = metrics;
    this.authenticationEntryPoint = authenticationEntryPoint;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith(ToolPermission.TOOL_PATH_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String toolName =
        ToolPermission.match(request.getMethod(), request.getRequestURI())
            .map(ToolPermission::toolName)
            .orElse(UNKNOWN_TOOL);
    MDC.put(MDC_TOOL_NAME, toolName);
    try {
      final AccessResult<UserProfile> result =
          authorizationGate.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
      if (!result.isSuccess()) {
        metrics.recordAuthorization(toolName, "unauthenticated");
        logger.info("tool call unauthenticated message={}", result.failure().message());
        SecurityContextHolder.clearContext();
        authenticationEntryPoint.commence(
            request, response, new BadCredentialsException(result.failure().message()));
        return;
      }
      final UserProfile profile = result.value();
      MDC.put(MDC_SUBJECT_ID, profile.subjectId());
      SecurityContextHolder.getContext().setAuthentication(toAuthentication(profile));
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_SUBJECT_ID);
      MDC.remove(MDC_TOOL_NAME);
    }
  }

  private UsernamePasswordAuthenticationToken toAuthentication(UserProfile profile) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    for (String role : profile.roles()) {
      authorities.add(new SimpleGrantedAuthority(role));
    }
    return new UsernamePasswordAuthenticationToken(profile, "N/A", authorities);
  }
}
