package com.example.tool_gateway.auth;

import java.util.Locale;

public final class BearerTokenExtractor {

  private static final String PREFIX = "bearer ";

  private BearerTokenExtractor() {}

  public static AccessResult<String> extract(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      return AccessResult.failure(AccessFailure.authentication("no bearer token found in request"));
    }
    if (authorizationHeader.length() < PREFIX.length()
        || !authorizationHeader
            .substring(0, PREFIX.length())
            .toLowerCase(Locale.ROOT)
            .equals(PREFIX)) {
      return AccessResult.failure(
          AccessFailure.authentication("authorization header is not a bearer credential"));
    }
    final String token = authorizationHeader.substring(PREFIX.length()).trim();
    if (token.isEmpty()) {
      return AccessResult.failure(AccessFailure.authentication("bearer token is empty"));
    }
    return AccessResult.success(token);
  }
}
