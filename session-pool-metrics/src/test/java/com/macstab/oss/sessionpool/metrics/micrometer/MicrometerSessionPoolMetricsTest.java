/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.metrics.micrometer;

import static com.macstab.oss.sessionpool.metrics.micrometer.MetricsConfiguration.*;
import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link MicrometerSessionPoolMetrics}.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>{@link SimpleMeterRegistry} for isolation
 *   <li>Verify dimensional tags (instance.name, pool.name, slot.index)
 *   <li>Verify counter, timer and gauge values directly
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("MicrometerSessionPoolMetrics")
class MicrometerSessionPoolMetricsTest {

  private SimpleMeterRegistry registry;
  private MicrometerSessionPoolMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new MicrometerSessionPoolMetrics(registry, "editor", 1000);
  }

  @Nested
  @DisplayName("Constructor")
  class ConstructorTests {

    @Test
    @DisplayName("should reject null MeterRegistry")
    void shouldRejectNullMeterRegistry() {
      assertThatNullPointerException()
          .isThrownBy(() -> new MicrometerSessionPoolMetrics(null, "editor", 1000))
          .withMessageContaining("MeterRegistry must not be null");
    }

    @Test
    @DisplayName("should reject null instance name")
    void shouldRejectNullInstanceName() {
      assertThatNullPointerException()
          .isThrownBy(() -> new MicrometerSessionPoolMetrics(new SimpleMeterRegistry(), null, 1000))
          .withMessageContaining("instanceName must not be null");
    }

    @Test
    @DisplayName("should reject invalid max cache size")
    void shouldRejectInvalidMaxCacheSize() {
      assertThatIllegalArgumentException()
          .isThrownBy(() -> new MicrometerSessionPoolMetrics(new SimpleMeterRegistry(), "editor", 0))
          .withMessageContaining("maxCacheSize must be > 0");
    }

    @Test
    @DisplayName("should use default max cache size")
    void shouldUseDefaultMaxCacheSize() {
      // Act
      final var withDefault = new MicrometerSessionPoolMetrics(registry, "editor");

      // Assert
      assertThat(withDefault.getCacheSize()).isZero();
      assertThat(withDefault.getInstanceName()).isEqualTo("editor");
    }
  }

  @Nested
  @DisplayName("Slot metrics")
  class SlotMetrics {

    @Test
    @DisplayName("should count acquisitions per slot and waited flag")
    void shouldCountAcquisitions() {
      // Act
      metrics.recordSlotAcquired("completion", 0, false);
      metrics.recordSlotAcquired("completion", 0, false);
      metrics.recordSlotAcquired("completion", 0, true);

      // Assert
      assertThat(
              registry
                  .counter(
                      SLOT_ACQUISITIONS,
                      TAG_INSTANCE_NAME,
                      "editor",
                      TAG_POOL_NAME,
                      "completion",
                      TAG_SLOT_INDEX,
                      "0",
                      TAG_WAITED,
                      "false")
                  .count())
          .isEqualTo(2.0);
      assertThat(
              registry
                  .counter(
                      SLOT_ACQUISITIONS,
                      TAG_INSTANCE_NAME,
                      "editor",
                      TAG_POOL_NAME,
                      "completion",
                      TAG_SLOT_INDEX,
                      "0",
                      TAG_WAITED,
                      "true")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should skip negative slot index")
    void shouldSkipNegativeSlotIndex() {
      // Act
      metrics.recordSlotAcquired("completion", -1, false);

      // Assert
      assertThat(registry.find(SLOT_ACQUISITIONS).counters()).isEmpty();
    }

    @Test
    @DisplayName("should count recycles by reason")
    void shouldCountRecyclesByReason() {
      // Act
      metrics.recordSlotRecycled("command", 0, "reuse-limit");
      metrics.recordSlotRecycled("command", 0, "timeout");
      metrics.recordSlotRecycled("command", 0, "timeout");

      // Assert
      assertThat(
              registry
                  .counter(
                      SLOT_RECYCLES,
                      TAG_INSTANCE_NAME,
                      "editor",
                      TAG_POOL_NAME,
                      "command",
                      TAG_SLOT_INDEX,
                      "0",
                      TAG_REASON,
                      "timeout")
                  .count())
          .isEqualTo(2.0);
    }

    @Test
    @DisplayName("should count displaced waiters, retirements, warm-up failures and degradations")
    void shouldCountPoolEvents() {
      // Act
      metrics.recordWaiterDisplaced("completion");
      metrics.recordSlotRetired("completion", 1);
      metrics.recordWarmupFailure("completion");
      metrics.recordWarmupFailure("completion");
      metrics.recordPoolDegraded("completion");

      // Assert
      assertThat(registry.get(WAITERS_DISPLACED).counter().count()).isEqualTo(1.0);
      assertThat(registry.get(SLOT_RETIREMENTS).tag(TAG_SLOT_INDEX, "1").counter().count())
          .isEqualTo(1.0);
      assertThat(registry.get(WARMUP_FAILURES).counter().count()).isEqualTo(2.0);
      assertThat(registry.get(POOL_DEGRADATIONS).tag(TAG_POOL_NAME, "completion").counter().count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Request and usage metrics")
  class RequestMetrics {

    @Test
    @DisplayName("should time requests by outcome")
    void shouldTimeRequests() {
      // Act
      metrics.recordRequest("completion", Duration.ofMillis(120), true);
      metrics.recordRequest("completion", Duration.ofMillis(80), true);
      metrics.recordRequest("completion", Duration.ofMillis(10), false);

      // Assert
      final var delivered = registry.get(REQUESTS).tag(TAG_OUTCOME, "delivered").timer();
      assertThat(delivered.count()).isEqualTo(2);
      assertThat(delivered.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
      assertThat(registry.get(REQUESTS).tag(TAG_OUTCOME, "empty").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should accumulate tokens and cost")
    void shouldAccumulateUsage() {
      // Act
      metrics.recordUsage("command", 10, 2, 0.001);
      metrics.recordUsage("command", 5, 0, 0.0);

      // Assert
      assertThat(registry.get(TOKENS).tag(TAG_DIRECTION, "input").counter().count())
          .isEqualTo(15.0);
      assertThat(registry.get(TOKENS).tag(TAG_DIRECTION, "output").counter().count())
          .isEqualTo(2.0);
      assertThat(registry.get(COST).counter().count()).isCloseTo(0.001, within(1e-9));
    }
  }

  @Nested
  @DisplayName("Coordination metrics")
  class CoordinationMetrics {

    @Test
    @DisplayName("should count role changes and takeovers")
    void shouldCountRoleChangesAndTakeovers() {
      // Act
      metrics.recordRoleChange("server");
      metrics.recordTakeover("promoted");
      metrics.recordTakeover("reconnected");
      metrics.recordTakeover("reconnected");

      // Assert
      assertThat(registry.get(ROLE_CHANGES).tag(TAG_ROLE, "server").counter().count())
          .isEqualTo(1.0);
      assertThat(registry.get(TAKEOVERS).tag(TAG_OUTCOME, "reconnected").counter().count())
          .isEqualTo(2.0);
    }

    @Test
    @DisplayName("should track connected clients as gauge")
    void shouldTrackConnectedClients() {
      // Act
      metrics.setConnectedClients(3);
      metrics.setConnectedClients(2);

      // Assert
      assertThat(registry.get(CONNECTED_CLIENTS).tag(TAG_INSTANCE_NAME, "editor").gauge().value())
          .isEqualTo(2.0);
    }
  }

  @Nested
  @DisplayName("Close")
  class CloseTests {

    @Test
    @DisplayName("should remove gauges and ignore later recordings")
    void shouldRemoveGaugesOnClose() {
      // Arrange
      metrics.setConnectedClients(4);
      metrics.recordTakeover("failed");

      // Act
      metrics.close();
      metrics.recordTakeover("failed");
      metrics.setConnectedClients(7);

      // Assert
      assertThat(registry.find(CONNECTED_CLIENTS).gauges()).isEmpty();
      assertThat(registry.get(TAKEOVERS).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should be idempotent")
    void shouldBeIdempotent() {
      // Act & Assert
      assertThatCode(
              () -> {
                metrics.close();
                metrics.close();
              })
          .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should leave other instances untouched")
    void shouldLeaveOtherInstances() {
      // Arrange
      final var other = new MicrometerSessionPoolMetrics(registry, "terminal", 1000);
      metrics.setConnectedClients(1);
      other.setConnectedClients(5);

      // Act
      metrics.close();

      // Assert
      assertThat(registry.find(CONNECTED_CLIENTS).gauges()).hasSize(1);
      assertThat(registry.get(CONNECTED_CLIENTS).tag(TAG_INSTANCE_NAME, "terminal").gauge().value())
          .isEqualTo(5.0);
    }
  }
}
