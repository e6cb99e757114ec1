package com.example.tool_gateway.worker;

import static org.mockito.Mockito.verify;

import com.example.tool_gateway.cache.CacheRefresher;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class EntityCacheRefreshWorkerTest {

  @Test
  void runTriggersOneScheduledCycle() {
    final CacheRefresher refresher = Mockito.mock(CacheRefresher.class);

    new EntityCacheRefreshWorker(refresher).run();

    verify(refresher).scheduledCycle();
  }
}
