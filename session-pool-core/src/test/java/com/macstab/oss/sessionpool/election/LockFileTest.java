/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.election;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.macstab.oss.sessionpool.testsupport.SimulatedProcesses;

@DisplayName("LockFile")
class LockFileTest {

  @TempDir Path tempDir;

  private final SimulatedProcesses processes = new SimulatedProcesses();

  private LockFile lockFile() {
    return new LockFile(tempDir.resolve("state").resolve("pool.lock"), processes);
  }

  @Nested
  @DisplayName("tryAcquire")
  class TryAcquire {

    @Test
    @DisplayName("creates the lock with pid and timestamp when none exists")
    void noLock_Acquired() throws Exception {
      // Arrange
      final var lock = lockFile();
      final long pid = processes.spawn(100);

      // Act
      final boolean acquired = lock.tryAcquire(pid);

      // Assert
      assertThat(acquired).isTrue();
      assertThat(lock.read())
          .hasValueSatisfying(
              record -> {
                assertThat(record.getPid()).isEqualTo(100);
                assertThat(record.getTimestamp()).isPositive();
              });
      assertThat(lock.isHeldByLiveProcess()).isTrue();
    }

    @Test
    @DisplayName("is idempotent for the current owner")
    void ownLock_StillAcquired() throws Exception {
      // Arrange
      final var lock = lockFile();
      final long pid = processes.spawn(100);
      lock.tryAcquire(pid);

      // Act & Assert
      assertThat(lock.tryAcquire(pid)).isTrue();
    }

    @Test
    @DisplayName("a live foreign owner blocks acquisition")
    void liveOwner_Blocks() throws Exception {
      // Arrange
      final var lock = lockFile();
      lock.tryAcquire(processes.spawn(100));

      // Act
      final boolean acquired = lock.tryAcquire(processes.spawn(200));

      // Assert
      assertThat(acquired).isFalse();
      assertThat(lock.read()).hasValueSatisfying(record -> assertThat(record.getPid()).isEqualTo(100));
    }

    @Test
    @DisplayName("a dead owner's lock is replaced")
    void deadOwner_Replaced() throws Exception {
      // Arrange
      final var lock = lockFile();
      lock.tryAcquire(processes.spawn(100));
      processes.kill(100);

      // Act
      final boolean acquired = lock.tryAcquire(processes.spawn(200));

      // Assert
      assertThat(acquired).isTrue();
      assertThat(lock.read()).hasValueSatisfying(record -> assertThat(record.getPid()).isEqualTo(200));
    }

    @Test
    @DisplayName("an unreadable lock blocks the exclusive create")
    void corruptLock_Blocks() throws Exception {
      // Arrange
      final var lock = lockFile();
      Files.createDirectories(lock.getPath().getParent());
      Files.writeString(lock.getPath(), "{not json", UTF_8);

      // Act
      final boolean acquired = lock.tryAcquire(processes.spawn(300));

      // Assert
      assertThat(lock.read()).isEmpty();
      assertThat(acquired).isFalse();
    }

    @Test
    @DisplayName("concurrent contenders produce exactly one winner")
    void concurrentContenders_SingleWinner() throws Exception {
      // Arrange
      final int contenders = 8;
      final var start = new CountDownLatch(1);
      final var executor = Executors.newFixedThreadPool(contenders);
      final List<Future<Boolean>> results = new ArrayList<>();

      try {
        for (int i = 0; i < contenders; i++) {
          final long pid = processes.spawn(1_000 + i);
          final var lock = lockFile();
          results.add(
              executor.submit(
                  () -> {
                    start.await();
                    return lock.tryAcquire(pid);
                  }));
        }

        // Act
        start.countDown();
        int winners = 0;
        for (final var result : results) {
          if (result.get(10, SECONDS)) {
            winners++;
          }
        }

        // Assert
        assertThat(winners).isEqualTo(1);
        assertThat(lockFile().read())
            .hasValueSatisfying(record -> assertThat(record.getPid()).isBetween(1_000L, 1_007L));
      } finally {
        executor.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("forceAcquire and release")
  class ForceAndRelease {

    @Test
    @DisplayName("forceAcquire overwrites a live owner")
    void forceAcquire_Overwrites() throws Exception {
      // Arrange
      final var lock = lockFile();
      lock.tryAcquire(processes.spawn(100));

      // Act
      lock.forceAcquire(processes.spawn(200));

      // Assert
      assertThat(lock.read()).hasValueSatisfying(record -> assertThat(record.getPid()).isEqualTo(200));
    }

    @Test
    @DisplayName("release deletes the owner's lock")
    void release_Owner_Deleted() throws Exception {
      // Arrange
      final var lock = lockFile();
      lock.tryAcquire(processes.spawn(100));

      // Act
      lock.release(100);

      // Assert
      assertThat(Files.exists(lock.getPath())).isFalse();
      assertThat(lock.isHeldByLiveProcess()).isFalse();
    }

    @Test
    @DisplayName("release leaves another process's lock in place")
    void release_Foreign_Kept() throws Exception {
      // Arrange
      final var lock = lockFile();
      lock.tryAcquire(processes.spawn(100));

      // Act
      lock.release(200);

      // Assert
      assertThat(lock.read()).hasValueSatisfying(record -> assertThat(record.getPid()).isEqualTo(100));
    }

    @Test
    @DisplayName("release without a lock is a no-op")
    void release_NoLock() {
      // Arrange
      final var lock = lockFile();

      // Act
      lock.release(100);

      // Assert
      assertThat(lock.read()).isEmpty();
    }
  }
}
