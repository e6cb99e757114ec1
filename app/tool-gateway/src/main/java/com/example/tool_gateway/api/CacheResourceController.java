package com.example.tool_gateway.api;

import com.example.tool_gateway.service.CacheStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/v1/resources/cache", produces = MediaType.TEXT_PLAIN_VALUE)
@RequiredArgsConstructor
public class CacheResourceController {

  private final CacheStatusService cacheStatusService;

  @GetMapping("/summary")
  public String summary() {
    return cacheStatusService.summary();
  }

  @GetMapping("/health")
  public String health() {
    return cacheStatusService.health();
  }
}
