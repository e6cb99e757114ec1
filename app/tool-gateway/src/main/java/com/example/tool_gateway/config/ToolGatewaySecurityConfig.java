package com.example.tool_gateway.config;

import com.example.tool_gateway.auth.AuthorizationGate;
import com.example.tool_gateway.auth.ToolPermission;
import com.example.tool_gateway.service.ToolGatewayMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
public class ToolGatewaySecurityConfig {

  @Bean
  ToolSecurityErrorHandler toolSecurityErrorHandler(ObjectMapper objectMapper) {
    return new ToolSecurityErrorHandler(objectMapper);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      AuthorizationGate authorizationGate,
      ToolGatewayMetrics metrics,
      ToolSecurityErrorHandler toolSecurityErrorHandler)
      throws Exception {
    // Bean にするとサーブレットフィルタとしても登録されるため、チェーン専用に生成する
    final ToolBearerAuthenticationFilter bearerFilter =
        new ToolBearerAuthenticationFilter(authorizationGate, metrics, toolSecurityErrorHandler);
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(bearerFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth -> {
              auth.requestMatchers(
                      "/error",
                      "/actuator/health",
                      "/actuator/health/**",
                      "/actuator/info",
                      "/actuator/prometheus",
                      "/v1/resources/cache/**")
                  .permitAll();
              for (ToolPermission permission : ToolPermission.values()) {
                auth.requestMatchers(permission.method(), permission.path())
                    .access(
                        new ToolRoleAuthorizationManager(permission, authorizationGate, metrics));
              }
              // ロール宣言の無いツールは許可しない
              auth.requestMatchers(ToolPermission.TOOL_PATH_PREFIX + "**")
                  .denyAll()
                  .anyRequest()
                  .authenticated();
            })
        .exceptionHandling(
            ex ->
                ex.authenticationEntryPoint(toolSecurityErrorHandler)
                    .accessDeniedHandler(toolSecurityErrorHandler));
    return http.build();
  }
}
