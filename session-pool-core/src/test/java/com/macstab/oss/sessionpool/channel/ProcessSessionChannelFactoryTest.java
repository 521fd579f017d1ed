/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ProcessSessionChannelFactory")
class ProcessSessionChannelFactoryTest {

  private static final SessionSpec SPEC =
      SessionSpec.builder()
          .label("completion")
          .slotIndex(0)
          .model("haiku")
          .systemPrompt("Be brief.")
          .build();

  @Nested
  @DisplayName("configuration")
  class Configuration {

    @Test
    @DisplayName("builds the stream-json command line with extra arguments last")
    void command_StreamJson() {
      // Arrange
      final var factory = new ProcessSessionChannelFactory("claude", List.of("--debug"), 4);

      // Act
      final var command = factory.command(SPEC);

      // Assert
      assertThat(command)
          .containsExactly(
              "claude",
              "--print",
              "--input-format",
              "stream-json",
              "--output-format",
              "stream-json",
              "--verbose",
              "--model",
              "haiku",
              "--system-prompt",
              "Be brief.",
              "--debug");
    }

    @Test
    @DisplayName("missing executable reports the backend unavailable")
    void isAvailable_MissingExecutable() {
      // Arrange
      final var factory =
          new ProcessSessionChannelFactory("definitely-not-installed-backend-x9", List.of(), 4);

      // Act & Assert
      assertThat(factory.isAvailable()).isFalse();
    }

    @Test
    @DisplayName("constructor rejects invalid arguments")
    void constructor_Validates() {
      assertThatThrownBy(() -> new ProcessSessionChannelFactory(" ", List.of(), 4))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> new ProcessSessionChannelFactory("claude", List.of(), 0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("with a scripted backend process")
  @EnabledOnOs({OS.LINUX, OS.MAC})
  class ScriptedProcess {

    @TempDir Path tempDir;

    private Path backend(final String body) throws Exception {
      final var script = tempDir.resolve("backend.sh");
      Files.writeString(script, "#!/bin/sh\n" + body + "\n", UTF_8);
      Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
      return script;
    }

    @Test
    @DisplayName("answers every pushed turn with a result event")
    void pushAndReceive() throws Exception {
      // Arrange
      final var script =
          backend(
              "while read line; do\n"
                  + "  echo '{\"type\":\"assistant\"}'\n"
                  + "  echo '{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"pong\"}'\n"
                  + "done");
      final var factory = new ProcessSessionChannelFactory(script.toString(), List.of(), 4);
      final var listener = new RecordingListener();

      // Act
      final var channel = factory.open(SPEC, listener);
      channel.push("ping");
      channel.push("ping again");

      // Assert
      assertThat(factory.isAvailable()).isTrue();
      await()
          .atMost(10, SECONDS)
          .until(() -> listener.events.stream().filter(SessionEvent::isResult).count() == 2);
      assertThat(listener.events)
          .filteredOn(SessionEvent::isResult)
          .extracting(SessionEvent::getText)
          .containsExactly("pong", "pong");

      channel.close();
      await().atMost(10, SECONDS).until(() -> listener.closed.get() == 1);
      assertThat(channel.isOpen()).isFalse();
      assertThatThrownBy(() -> channel.push("too late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("a backend that exits fires onClosed exactly once")
    void processExit_ClosedOnce() throws Exception {
      // Arrange
      final var script = backend("exit 0");
      final var factory = new ProcessSessionChannelFactory(script.toString(), List.of(), 4);
      final var listener = new RecordingListener();

      // Act
      final var channel = factory.open(SPEC, listener);

      // Assert
      await().atMost(10, SECONDS).until(() -> listener.closed.get() == 1);
      channel.close();
      assertThat(listener.closed).hasValue(1);
      assertThat(listener.events).isEmpty();
    }
  }

  private static final class RecordingListener implements SessionListener {
    private final List<SessionEvent> events = new CopyOnWriteArrayList<>();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private final AtomicInteger closed = new AtomicInteger();

    @Override
    public void onEvent(final SessionEvent event) {
      events.add(event);
    }

    @Override
    public void onError(final Throwable error) {
      errors.add(error);
    }

    @Override
    public void onClosed() {
      closed.incrementAndGet();
    }
  }
}
