/*
 * どこで: Tool Gateway キャッシュ層
 * 何を: 下流データソースから全エンティティを取得するクライアント
 * なぜ: スナップショット構築に必要な一覧を1回の呼び出しで得るため
 */
package com.example.tool_gateway.cache;

import com.example.tool_gateway.model.EntityRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class DownstreamEntityClient implements DownstreamFetcher {

  private static final Logger logger = LoggerFactory.getLogger(DownstreamEntityClient.class);
  private static final ParameterizedTypeReference<List<EntityRecord>> ENTITY_LIST =
      new ParameterizedTypeReference<>() {};

  private final RestClient downstreamRestClient;
  private final String entitiesPath;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public DownstreamEntityClient(RestClient downstreamRestClient, String entitiesPath) {
    this.downstreamRestClient = downstreamRestClient;
    this.entitiesPath = entitiesPath;
  }

  @Override
  public Map<String, EntityRecord> fetchAll() {
    try {
      return toEntityMap(
          downstreamRestClient.get().uri(entitiesPath).retrieve().body(ENTITY_LIST));
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (UpstreamFetchException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("downstream entities response parse failed", ex);
      throw new UpstreamFetchException(
          UpstreamFetchException.Reason.INVALID_RESPONSE,
          "downstream entities response parse failed",
          ex);
    }
  }

  private Map<String, EntityRecord> toEntityMap(List<EntityRecord> entities) {
    if (entities == null) {
      throw new UpstreamFetchException(
          UpstreamFetchException.Reason.INVALID_RESPONSE, "downstream entities response is empty");
    }
    final Map<String, EntityRecord> byId = new LinkedHashMap<>();
    for (EntityRecord entity : entities) {
      if (entity == null || !entity.isComplete()) {
        throw new UpstreamFetchException(
            UpstreamFetchException.Reason.INVALID_RESPONSE,
            "downstream entity is missing id, name or category");
      }
      // 同一 id は後勝ち
      byId.put(entity.id(), entity);
    }
    return byId;
  }

  private UpstreamFetchException mapResponseException(RestClientResponseException ex) {
    logger.warn(
        "downstream fetchAll failed with http status={} statusText={}",
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().is5xxServerError()) {
      return new UpstreamFetchException(
          UpstreamFetchException.Reason.BAD_GATEWAY, "downstream server error", ex);
    }
    return new UpstreamFetchException(
        UpstreamFetchException.Reason.BAD_GATEWAY,
        "downstream request failed with status " + ex.getStatusCode().value(),
        ex);
  }

  private UpstreamFetchException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("downstream fetchAll timed out");
      return new UpstreamFetchException(
          UpstreamFetchException.Reason.TIMEOUT, "downstream request timeout", ex);
    }
    logger.warn("downstream fetchAll connection failed", ex);
    return new UpstreamFetchException(
        UpstreamFetchException.Reason.BAD_GATEWAY, "downstream connection failed", ex);
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
