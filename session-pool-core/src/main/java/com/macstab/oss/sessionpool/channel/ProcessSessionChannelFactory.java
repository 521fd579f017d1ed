/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Spawns one backend process per session.
 *
 * <p>The command line is {@code <executable> --print --input-format stream-json --output-format
 * stream-json --verbose --model <model> --system-prompt <prompt>} followed by any configured extra
 * arguments. Tool use, filesystem writes and session persistence are the backend's business and are
 * controlled through those extra arguments.
 *
 * <p>{@link #isAvailable()} resolves the executable against {@code PATH} without launching it.
 */
@Slf4j
@Getter
public class ProcessSessionChannelFactory implements SessionChannelFactory {

  public static final String DEFAULT_EXECUTABLE = "claude";
  public static final int DEFAULT_INPUT_CAPACITY = 16;

  private static final AtomicLong SESSION_COUNTER = new AtomicLong();

  private final String executable;
  private final List<String> extraArguments;
  private final int inputCapacity;
  private final StreamJsonCodec codec;

  public ProcessSessionChannelFactory() {
    this(DEFAULT_EXECUTABLE, List.of(), DEFAULT_INPUT_CAPACITY);
  }

  public ProcessSessionChannelFactory(
      @NonNull final String executable,
      @NonNull final List<String> extraArguments,
      final int inputCapacity) {
    if (executable.isBlank()) {
      throw new IllegalArgumentException("executable must not be blank");
    }
    if (inputCapacity < 1) {
      throw new IllegalArgumentException("inputCapacity must be >= 1, got: " + inputCapacity);
    }
    this.executable = executable;
    this.extraArguments = List.copyOf(extraArguments);
    this.inputCapacity = inputCapacity;
    this.codec = new StreamJsonCodec();
  }

  @Override
  public SessionChannel open(@NonNull final SessionSpec spec, @NonNull final SessionListener listener)
      throws IOException {
    final var builder = new ProcessBuilder(command(spec));
    if (spec.getWorkingDirectory() != null && Files.isDirectory(spec.getWorkingDirectory())) {
      builder.directory(spec.getWorkingDirectory().toFile());
    }
    builder.redirectError(ProcessBuilder.Redirect.DISCARD);

    final var process = builder.start();
    final var name =
        spec.getLabel().toLowerCase(Locale.ROOT).replace(' ', '-')
            + "-"
            + spec.getSlotIndex()
            + "-"
            + SESSION_COUNTER.incrementAndGet();
    final var channel = new ProcessSessionChannel(process, listener, codec, inputCapacity, name);
    channel.start();
    return channel;
  }

  @Override
  public boolean isAvailable() {
    final var resolved = resolveExecutable();
    if (resolved == null) {
      log.warn("Backend executable '{}' not found on PATH", executable);
      return false;
    }
    log.debug("Backend executable resolved to {}", resolved);
    return true;
  }

  List<String> command(final SessionSpec spec) {
    final List<String> command = new ArrayList<>();
    command.add(executable);
    command.add("--print");
    command.add("--input-format");
    command.add("stream-json");
    command.add("--output-format");
    command.add("stream-json");
    command.add("--verbose");
    command.add("--model");
    command.add(spec.getModel());
    command.add("--system-prompt");
    command.add(spec.getSystemPrompt());
    command.addAll(extraArguments);
    return command;
  }

  private Path resolveExecutable() {
    if (executable.contains("/") || executable.contains(File.separator)) {
      final var path = Path.of(executable);
      return Files.isExecutable(path) ? path : null;
    }
    final var pathVariable = System.getenv("PATH");
    if (pathVariable == null) {
      return null;
    }
    for (final var directory : pathVariable.split(File.pathSeparator)) {
      if (directory.isBlank()) {
        continue;
      }
      for (final var candidateName : candidateNames()) {
        final var candidate = Path.of(directory, candidateName);
        if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
          return candidate;
        }
      }
    }
    return null;
  }

  private List<String> candidateNames() {
    if (File.separatorChar == '\\') {
      return List.of(executable, executable + ".exe", executable + ".cmd");
    }
    return List.of(executable);
  }
}
