package com.example.tool_gateway.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.tool_gateway.model.UserProfile;
import com.example.tool_gateway.service.ToolGatewayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class EntitlementResolverTest {

  private static final UserProfile READER =
      new UserProfile("user-1", Set.of("reader"), Set.of("ops"));

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final IdentityVerifier identityVerifier = Mockito.mock(IdentityVerifier.class);
  private final EntitlementResolver resolver =
      new EntitlementResolver(identityVerifier, new ToolGatewayMetrics(registry));

  @Test
  void resolveTwiceVerifiesOnce() {
    when(identityVerifier.verify("token-1")).thenReturn(READER);

    final AccessResult<UserProfile> first = resolver.resolve("token-1");
    final AccessResult<UserProfile> second = resolver.resolve("token-1");

    assertThat(first.value()).isEqualTo(second.value()).isEqualTo(READER);
    verify(identityVerifier, times(1)).verify("token-1");
    assertThat(resolver.cachedEntries()).isEqualTo(1);
    assertThat(
            registry.get("tool_gateway.entitlement.lookup.total").tag("result", "hit").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void distinctTokensAreCachedSeparately() {
    final UserProfile admin = new UserProfile("admin-1", Set.of("admin"), Set.of("finance"));
    when(identityVerifier.verify("token-1")).thenReturn(READER);
    when(identityVerifier.verify("token-2")).thenReturn(admin);

    assertThat(resolver.resolve("token-1").value()).isEqualTo(READER);
    assertThat(resolver.resolve("token-2").value()).isEqualTo(admin);
    assertThat(resolver.cachedEntries()).isEqualTo(2);
  }

  @Test
  void verificationFailureIsNotCached() {
    when(identityVerifier.verify("token-1"))
        .thenThrow(
            new IdentityVerificationException(
                IdentityVerificationException.Reason.UNAUTHORIZED, "credential rejected"))
        .thenReturn(READER);

    final AccessResult<UserProfile> failed = resolver.resolve("token-1");
    final AccessResult<UserProfile> retried = resolver.resolve("token-1");

    assertThat(failed.isSuccess()).isFalse();
    assertThat(failed.failure().kind()).isEqualTo(AccessFailure.Kind.AUTHENTICATION);
    assertThat(retried.value()).isEqualTo(READER);
    verify(identityVerifier, times(2)).verify("token-1");
  }

  @Test
  void blankTokenFailsWithoutCallingVerifier() {
    final AccessResult<UserProfile> result = resolver.resolve(" ");

    assertThat(result.failure().kind()).isEqualTo(AccessFailure.Kind.AUTHENTICATION);
    verifyNoInteractions(identityVerifier);
  }

  @Test
  void concurrentMissesEndWithOneValidEntry() throws Exception {
    when(identityVerifier.verify(anyString())).thenReturn(READER);
    final ExecutorService executor = Executors.newFixedThreadPool(8);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<AccessResult<UserProfile>>> futures = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        final Callable<AccessResult<UserProfile>> call =
            () -> {
              start.await();
              return resolver.resolve("shared-token");
            };
        futures.add(executor.submit(call));
      }
      start.countDown();
      for (Future<AccessResult<UserProfile>> future : futures) {
        assertThat(future.get(10, TimeUnit.SECONDS).value()).isEqualTo(READER);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(resolver.cachedEntries()).isEqualTo(1);
  }
}
