/*
 * どこで: Tool Gateway API
 * 何を: LLM クライアント向けのツール呼び出し口を提供する
 * なぜ: ロール判定はセキュリティ設定に任せ、認証済みプロファイルを業務ロジックへ渡すだけの入口にするため
 */
package com.example.tool_gateway.api;

import com.example.tool_gateway.model.UserProfile;
import com.example.tool_gateway.service.EntityToolService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/v1/tools", produces = MediaType.TEXT_PLAIN_VALUE)
@RequiredArgsConstructor
public class ToolController {

  private final EntityToolService entityToolService;

  @GetMapping("/list-entities")
  public String listEntities(
      @RequestParam(name = "category", required = false) String category,
      @AuthenticationPrincipal UserProfile profile) {
    return entityToolService.listEntities(profile, category);
  }

  @GetMapping("/get-entity")
  public String getEntity(
      @RequestParam("entity_id") String entityId,
      @AuthenticationPrincipal UserProfile profile) {
    return entityToolService.getEntity(profile, entityId);
  }

  @PostMapping("/refresh-cache")
  public String refreshCache() {
    return entityToolService.refreshCache();
  }
}
