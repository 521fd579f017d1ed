/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SessionChannel} backed by a long-lived backend process speaking stream-json over stdio.
 *
 * <p><strong>Threads:</strong> one writer drains the bounded input queue into stdin, one reader
 * parses stdout line by line and forwards events to the listener. Both are daemon threads named
 * after the owning session. stderr is discarded by the factory.
 *
 * <p><strong>Close:</strong> {@link #close()} clears pending input, destroys the process and lets
 * the reader observe end of stream, which fires {@link SessionListener#onClosed()} exactly once.
 * I/O errors raised after close are not reported.
 */
@Slf4j
final class ProcessSessionChannel implements SessionChannel {

  private static final long WRITER_POLL_MS = 200;

  private final Process process;
  private final SessionListener listener;
  private final StreamJsonCodec codec;
  private final BlockingQueue<String> input;
  private final String name;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicBoolean closeNotified = new AtomicBoolean();

  ProcessSessionChannel(
      @NonNull final Process process,
      @NonNull final SessionListener listener,
      @NonNull final StreamJsonCodec codec,
      final int inputCapacity,
      @NonNull final String name) {
    this.process = process;
    this.listener = listener;
    this.codec = codec;
    this.input = new ArrayBlockingQueue<>(inputCapacity);
    this.name = name;
  }

  void start() {
    startDaemon(this::readLoop, name + "-reader");
    startDaemon(this::writeLoop, name + "-writer");
    log.debug("Session {} started (pid {})", name, process.pid());
  }

  @Override
  public void push(@NonNull final String message) {
    if (closed.get()) {
      throw new IllegalStateException("Session " + name + " is closed");
    }
    if (!input.offer(codec.encodeUserMessage(message))) {
      throw new IllegalStateException("Session " + name + " input queue is full");
    }
  }

  @Override
  public boolean isOpen() {
    return !closed.get() && process.isAlive();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    input.clear();
    process.destroy();
    log.debug("Session {} closed", name);
  }

  private void writeLoop() {
    try (Writer writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), UTF_8))) {
      while (!closed.get()) {
        final var line = input.poll(WRITER_POLL_MS, TimeUnit.MILLISECONDS);
        if (line == null) {
          continue;
        }
        writer.write(line);
        writer.write('\n');
        writer.flush();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (final IOException e) {
      if (!closed.get()) {
        listener.onError(e);
      }
    }
  }

  private void readLoop() {
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(process.getInputStream(), UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        final var event = codec.decode(line);
        if (event.isPresent()) {
          listener.onEvent(event.get());
        } else if (log.isTraceEnabled()) {
          log.trace("Session {} ignored non-event line: {}", name, abbreviate(line));
        }
      }
    } catch (final IOException e) {
      if (!closed.get()) {
        listener.onError(e);
      }
    } finally {
      notifyClosed();
    }
  }

  private void notifyClosed() {
    if (closeNotified.compareAndSet(false, true)) {
      listener.onClosed();
    }
  }

  private static void startDaemon(final Runnable task, final String threadName) {
    final var thread = new Thread(task, threadName);
    thread.setDaemon(true);
    thread.start();
  }

  private static String abbreviate(final String line) {
    return line.length() <= 200 ? line : line.substring(0, 200) + "...";
  }
}
