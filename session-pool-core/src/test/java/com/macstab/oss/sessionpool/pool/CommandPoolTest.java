/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.pool;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;
import com.macstab.oss.sessionpool.testsupport.ScriptedSessionChannel;
import com.macstab.oss.sessionpool.testsupport.ScriptedSessionChannelFactory;

@DisplayName("CommandPool")
class CommandPoolTest {

  private CommandPool pool;

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.dispose();
    }
  }

  private CommandPool start(final ScriptedSessionChannelFactory factory, final int maxReuses) {
    pool =
        new CommandPool(
            factory, "haiku", null, maxReuses, SessionPoolMetrics.NOOP, Clock.systemUTC());
    pool.activate().join();
    return pool;
  }

  @Test
  @DisplayName("runs a single slot")
  void singleSlot() {
    // Arrange
    final var factory = ScriptedSessionChannelFactory.answering();

    // Act
    start(factory, 24);

    // Assert
    assertThat(pool.getPoolSize()).isEqualTo(CommandPool.POOL_SIZE);
    assertThat(factory.openCount()).isEqualTo(1);
    assertThat(factory.channels().get(0).pushed()).containsExactly(CommandPool.WARMUP_MESSAGE);
  }

  @Test
  @DisplayName("sendPrompt returns the raw reply and its metadata")
  void sendPrompt_ReturnsReply() {
    // Arrange
    final var factory =
        ScriptedSessionChannelFactory.answering().respondWith(message -> "echo: " + message);
    start(factory, 24);

    // Act
    final var result = pool.sendPrompt("rewrite this").join();

    // Assert
    assertThat(result.text()).contains("echo: rewrite this");
    assertThat(result.getMeta().getModel()).isEqualTo("haiku");
    assertThat(result.getMeta().getInputTokens())
        .isEqualTo(ScriptedSessionChannel.META.getInputTokens());
  }

  @Test
  @DisplayName("sendPrompt times out to an empty result and the slot comes back")
  void sendPrompt_Timeout_Empty() {
    // Arrange
    final var factory = ScriptedSessionChannelFactory.holding();
    start(factory, 24);

    // Act
    final var result =
        pool.sendPrompt("slow", CommandOptions.withTimeout(Duration.ofMillis(100))).join();

    // Assert
    assertThat(result.isEmpty()).isTrue();
    await().atMost(5, SECONDS).until(() -> factory.openCount() == 2);
    factory.respondWith(message -> "fast");
    await()
        .atMost(5, SECONDS)
        .untilAsserted(() -> assertThat(pool.sendPrompt("again").join().text()).contains("fast"));
  }

  @Test
  @DisplayName("a failed result from the backend yields an empty result")
  void sendPrompt_FailedResult_Empty() {
    // Arrange
    final var factory = ScriptedSessionChannelFactory.holding();
    start(factory, 24);
    final var reply = pool.sendPrompt("doomed");
    await().atMost(5, SECONDS).until(() -> factory.heldCount() == 1);

    // Act
    factory.firstHolding().releaseNext(null);

    // Assert
    assertThat(reply.join().isEmpty()).isTrue();
  }

  @Test
  @DisplayName("a broken warm-up degrades the pool and notifies the listener")
  void warmupBroken_Degrades() {
    // Arrange
    final var factory = ScriptedSessionChannelFactory.answering().breakWarmup();
    final var degraded = new AtomicInteger();
    pool = new CommandPool(factory, "haiku", null);
    pool.setDegradedListener(degraded::incrementAndGet);

    // Act
    pool.activate().join();

    // Assert
    await().atMost(5, SECONDS).until(() -> degraded.get() == 1);
    assertThat(pool.isAvailable()).isFalse();
    assertThat(pool.sendPrompt("anything").join()).isEqualTo(CommandResult.EMPTY);
  }

  @Test
  @DisplayName("updateModel recycles the slot")
  void updateModel_Recycles() {
    // Arrange
    final var factory = ScriptedSessionChannelFactory.answering();
    start(factory, 24);

    // Act
    pool.updateModel("opus").join();

    // Assert
    assertThat(factory.openCount()).isEqualTo(2);
    assertThat(factory.openChannels())
        .singleElement()
        .satisfies(channel -> assertThat(channel.spec().getModel()).isEqualTo("opus"));
  }
}
