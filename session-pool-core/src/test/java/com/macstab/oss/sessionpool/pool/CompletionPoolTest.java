/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.pool;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;
import com.macstab.oss.sessionpool.slot.SlotState;
import com.macstab.oss.sessionpool.testsupport.ScriptedSessionChannelFactory;

@DisplayName("CompletionPool")
class CompletionPoolTest {

  private static final String PREFIX = "Hello wonderful world";

  private CompletionPool pool;

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.dispose();
    }
  }

  private CompletionPool start(final ScriptedSessionChannelFactory factory, final int size) {
    pool =
        new CompletionPool(
            factory, "haiku", Path.of("/work"), size, 8, SessionPoolMetrics.NOOP, Clock.systemUTC());
    pool.activate().join();
    return pool;
  }

  @Nested
  @DisplayName("getCompletion")
  class GetCompletion {

    @Test
    @DisplayName("returns the reply with the echoed completion start removed")
    void getCompletion_StripsCompletionStart() {
      // Arrange
      final var factory =
          ScriptedSessionChannelFactory.answering()
              .respondWith(message -> ScriptedSessionChannelFactory.fillReply(message, " again"));
      start(factory, 2);

      // Act
      final var completion = pool.getCompletion(CompletionContext.of(PREFIX, "")).join();

      // Assert
      assertThat(completion).contains(" again");
      assertThat(factory.requests()).hasSize(1);
      assertThat(factory.requests().get(0))
          .contains("<completion_start> world</completion_start>");
    }

    @Test
    @DisplayName("a reply that does not echo the completion start yields empty")
    void getCompletion_NoEcho_Empty() {
      // Arrange
      final var factory =
          ScriptedSessionChannelFactory.answering()
              .respondWith(message -> "<output>something else</output>");
      start(factory, 1);

      // Act
      final var completion = pool.getCompletion(CompletionContext.of(PREFIX, "")).join();

      // Assert
      assertThat(completion).isEmpty();
    }

    @Test
    @DisplayName("an unavailable pool answers empty without touching the backend")
    void getCompletion_Unavailable_Empty() {
      // Arrange
      final var factory = ScriptedSessionChannelFactory.answering().unavailable();
      start(factory, 2);

      // Act
      final var completion = pool.getCompletion(CompletionContext.of(PREFIX, "")).join();

      // Assert
      assertThat(completion).isEmpty();
      assertThat(factory.openCount()).isZero();
    }

    @Test
    @DisplayName("cancelling a waiting request withdraws it")
    void getCompletion_CancelWhileWaiting() {
      // Arrange
      final var factory = ScriptedSessionChannelFactory.holding();
      start(factory, 1);
      final var first = pool.getCompletion(CompletionContext.of(PREFIX, ""));
      await().atMost(5, SECONDS).until(() -> factory.heldCount() == 1);
      final var second = pool.getCompletion(CompletionContext.of("Something else entirely", ""));

      // Act
      second.cancel(true);
      factory.firstHolding().releaseNextFill(" done");

      // Assert
      assertThat(first.join()).contains(" done");
      await()
          .atMost(5, SECONDS)
          .untilAsserted(
              () ->
                  assertThat(pool.getStats().getSlots())
                      .allMatch(slot -> slot.getState() == SlotState.AVAILABLE));
      assertThat(factory.requests()).hasSize(1);
    }
  }

  @Nested
  @DisplayName("lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("a failed first warm-up is retried and the pool then serves completions")
    void warmupRetry_ThenServesCompletions() {
      // Arrange
      final var metrics = mock(SessionPoolMetrics.class);
      final var factory =
          ScriptedSessionChannelFactory.answering()
              .breakNextWarmups(1)
              .respondWith(message -> ScriptedSessionChannelFactory.fillReply(message, " again"));
      pool = new CompletionPool(factory, "haiku", null, 2, 8, metrics, Clock.systemUTC());
      pool.activate().join();
      await()
          .atMost(5, SECONDS)
          .untilAsserted(
              () ->
                  assertThat(pool.getStats().getSlots())
                      .allMatch(slot -> slot.getState() == SlotState.AVAILABLE));

      // Act
      final var completion = pool.getCompletion(CompletionContext.of(PREFIX, "")).join();

      // Assert
      assertThat(completion).contains(" again");
      assertThat(pool.isAvailable()).isTrue();
      assertThat(factory.openCount()).isEqualTo(4);
      verify(metrics, times(1)).recordWarmupFailure(CompletionPool.LABEL);
      verify(metrics, never()).recordPoolDegraded(anyString());
    }

    @Test
    @DisplayName("a request racing dispose completes empty instead of failing")
    void getCompletion_RacingDispose_NeverFails() {
      for (int round = 0; round < 200; round++) {
        // Arrange
        final var racing =
            new CompletionPool(
                ScriptedSessionChannelFactory.answering(),
                "haiku",
                null,
                1,
                8,
                SessionPoolMetrics.NOOP,
                Clock.systemUTC());
        racing.activate().join();

        // Act
        final var request =
            CompletableFuture.supplyAsync(
                    () -> racing.getCompletion(CompletionContext.of(PREFIX, "")))
                .thenCompose(completion -> completion);
        racing.dispose();

        // Assert
        assertThat(request).succeedsWithin(Duration.ofSeconds(5));
      }
    }
  }

  @Nested
  @DisplayName("configuration")
  class Configuration {

    @Test
    @DisplayName("sessions start with the configured model, prompt and directory")
    void sessionSpec_CarriesConfiguration() {
      // Arrange
      final var factory = ScriptedSessionChannelFactory.answering();

      // Act
      start(factory, 2);

      // Assert
      assertThat(factory.channels())
          .allSatisfy(
              channel -> {
                assertThat(channel.spec().getModel()).isEqualTo("haiku");
                assertThat(channel.spec().getLabel()).isEqualTo(CompletionPool.LABEL);
                assertThat(channel.spec().getWorkingDirectory()).isEqualTo(Path.of("/work"));
                assertThat(channel.spec().getSystemPrompt()).isNotBlank();
              });
    }

    @Test
    @DisplayName("updateModel recycles every slot onto the new model")
    void updateModel_RecyclesSlots() {
      // Arrange
      final var factory = ScriptedSessionChannelFactory.answering();
      start(factory, 2);

      // Act
      pool.updateModel("sonnet").join();

      // Assert
      assertThat(pool.getModel()).isEqualTo("sonnet");
      assertThat(factory.openCount()).isEqualTo(4);
      assertThat(factory.openChannels())
          .hasSize(2)
          .allSatisfy(channel -> assertThat(channel.spec().getModel()).isEqualTo("sonnet"));
    }

    @Test
    @DisplayName("updateModel with the current model does nothing")
    void updateModel_SameModel_NoRecycle() {
      // Arrange
      final var factory = ScriptedSessionChannelFactory.answering();
      start(factory, 2);

      // Act
      pool.updateModel("haiku").join();

      // Assert
      assertThat(factory.openCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("constructor rejects maxReuses below one")
    void constructor_RejectsZeroReuses() {
      assertThatThrownBy(
              () ->
                  new CompletionPool(
                      ScriptedSessionChannelFactory.answering(),
                      "haiku",
                      null,
                      2,
                      0,
                      SessionPoolMetrics.NOOP,
                      Clock.systemUTC()))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("warm-up validation")
  class WarmupValidation {

    private final CompletionPool idle =
        new CompletionPool(ScriptedSessionChannelFactory.answering(), "haiku", null);

    @AfterEach
    void disposeIdle() {
      idle.dispose();
    }

    @Test
    @DisplayName("accepts the expected word regardless of case and whitespace")
    void accepts_ExpectedWord() {
      assertThat(idle.validateWarmupResponse("<output> equals  Four \n</output>")).isTrue();
    }

    @Test
    @DisplayName("rejects a wrong answer")
    void rejects_WrongAnswer() {
      assertThat(idle.validateWarmupResponse("<output> equals five</output>")).isFalse();
    }

    @Test
    @DisplayName("rejects a reply that does not echo the completion start")
    void rejects_MissingEcho() {
      assertThat(idle.validateWarmupResponse("<output>four</output>")).isFalse();
    }
  }
}
