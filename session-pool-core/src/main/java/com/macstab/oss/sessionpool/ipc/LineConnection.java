/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.NonNull;

/**
 * Newline-framed text over a blocking Unix domain socket.
 *
 * <p>One thread reads ({@link #readLine()}), any number of threads write; writes are serialized so
 * frames never interleave. Closing from another thread unblocks the reader, which then sees an
 * exception or end of stream.
 */
final class LineConnection implements Closeable {

  private final SocketChannel channel;
  private final BufferedReader reader;
  private final Object writeLock = new Object();
  private final AtomicBoolean closed = new AtomicBoolean();

  LineConnection(@NonNull final SocketChannel channel) {
    this.channel = channel;
    this.reader = new BufferedReader(Channels.newReader(channel, UTF_8));
  }

  static LineConnection connect(@NonNull final Path socketPath) throws IOException {
    final var channel = SocketChannel.open(StandardProtocolFamily.UNIX);
    try {
      channel.connect(UnixDomainSocketAddress.of(socketPath));
    } catch (final IOException | RuntimeException e) {
      channel.close();
      throw e;
    }
    return new LineConnection(channel);
  }

  /** Next line without its terminator, or {@code null} at end of stream. */
  String readLine() throws IOException {
    return reader.readLine();
  }

  void writeLine(@NonNull final String line) throws IOException {
    final var buffer = UTF_8.encode(line + "\n");
    synchronized (writeLock) {
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
    }
  }

  boolean isOpen() {
    return !closed.get() && channel.isOpen();
  }

  @Override
  public void close() throws IOException {
    if (closed.compareAndSet(false, true)) {
      channel.close();
    }
  }
}
