/*
 * どこで: Tool Gateway セキュリティ層
 * 何を: 認証失敗を 401、認可拒否を 403 の ApiErrorResponse として書き出す
 * なぜ: フィルタ段で止まった呼び出しもコントローラ例外と同じ JSON 形式で返すため
 */
package com.example.tool_gateway.config;

import com.example.tool_gateway.api.ApiErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;

public class ToolSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

  static final String NO_POLICY_MESSAGE = "no role policy is declared for this tool";

  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public ToolSecurityErrorHandler(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    write(
        response,
        HttpServletResponse.SC_UNAUTHORIZED,
        new ApiErrorResponse("TOOL_UNAUTHENTICATED", authException.getMessage()));
  }

  @Override
  public void handle(
      HttpServletRequest request,
      HttpServletResponse response,
      AccessDeniedException accessDeniedException)
      throws IOException {
    final Object denial =
        request.getAttribute(ToolRoleAuthorizationManager.DENIAL_MESSAGE_ATTRIBUTE);
    final String message = denial instanceof String text ? text : NO_POLICY_MESSAGE;
    write(
        response,
        HttpServletResponse.SC_FORBIDDEN,
        new ApiErrorResponse("TOOL_FORBIDDEN", message));
  }

  private void write(HttpServletResponse response, int status, ApiErrorResponse body)
      throws IOException {
    response.setStatus(status);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
