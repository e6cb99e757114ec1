/*
 * どこで: Tool Gateway 認可層
 * 何を: bearer 資格情報を IdP の userinfo で検証し UserProfile を得るクライアント
 * なぜ: ロールとカテゴリ権限の唯一の出所を IdP に置くため
 */
package com.example.tool_gateway.auth;

import com.example.tool_gateway.model.UserProfile;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.LinkedHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class UserInfoIdentityVerifier implements IdentityVerifier {

  private static final Logger logger = LoggerFactory.getLogger(UserInfoIdentityVerifier.class);

  private final RestClient identityRestClient;
  private final String userinfoUrl;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public UserInfoIdentityVerifier(RestClient identityRestClient, String userinfoUrl) {
    this.identityRestClient = identityRestClient;
    this.userinfoUrl = userinfoUrl;
  }

  @Override
  public UserProfile verify(String token) {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("token is required");
    }
    try {
      return toProfile(
          identityRestClient
              .get()
              .uri(userinfoUrl)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
              .retrieve()
              .body(UserInfoResponse.class));
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (IdentityVerificationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("userinfo response parse failed", ex);
      throw new IdentityVerificationException(
          IdentityVerificationException.Reason.INVALID_RESPONSE,
          "userinfo response parse failed",
          ex);
    }
  }

  private UserProfile toProfile(UserInfoResponse response) {
    if (response == null || response.sub() == null || response.sub().isBlank()) {
      throw new IdentityVerificationException(
          IdentityVerificationException.Reason.INVALID_RESPONSE, "userinfo response is invalid");
    }
    return new UserProfile(
        response.sub(),
        new LinkedHashSet<>(response.roles()),
        new LinkedHashSet<>(response.categories()));
  }

  private IdentityVerificationException mapResponseException(RestClientResponseException ex) {
    // 応答本文には資格情報が含まれうるためステータスのみ記録する
    logger.warn(
        "userinfo verify failed with http status={} statusText={}",
        ex.getStatusCode().value(),
        ex.getStatusText());
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new IdentityVerificationException(
          IdentityVerificationException.Reason.UNAUTHORIZED, "credential rejected", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new IdentityVerificationException(
          IdentityVerificationException.Reason.BAD_GATEWAY, "identity provider server error", ex);
    }
    return new IdentityVerificationException(
        IdentityVerificationException.Reason.UNAUTHORIZED,
        "identity provider returned status " + status,
        ex);
  }

  private IdentityVerificationException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("userinfo verify timed out");
      return new IdentityVerificationException(
          IdentityVerificationException.Reason.TIMEOUT, "identity provider timeout", ex);
    }
    logger.warn("userinfo verify connection failed", ex);
    return new IdentityVerificationException(
        IdentityVerificationException.Reason.BAD_GATEWAY, "identity provider connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
