/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.testsupport;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

import com.macstab.oss.sessionpool.channel.ResultMetadata;
import com.macstab.oss.sessionpool.channel.SessionChannel;
import com.macstab.oss.sessionpool.channel.SessionEvent;
import com.macstab.oss.sessionpool.channel.SessionListener;
import com.macstab.oss.sessionpool.channel.SessionSpec;

/** One fake session. Replies synchronously from {@link #push(String)} unless the message is held. */
public final class ScriptedSessionChannel implements SessionChannel {

  public static final ResultMetadata META =
      ResultMetadata.builder().inputTokens(10).outputTokens(2).costUsd(0.001).build();

  private final SessionSpec spec;
  private final SessionListener listener;
  private final UnaryOperator<String> replies;
  private final List<String> pushed = new CopyOnWriteArrayList<>();
  private final Deque<String> held = new ArrayDeque<>();
  private final AtomicBoolean open = new AtomicBoolean(true);

  ScriptedSessionChannel(
      final SessionSpec spec, final SessionListener listener, final UnaryOperator<String> replies) {
    this.spec = spec;
    this.listener = listener;
    this.replies = replies;
  }

  @Override
  public void push(final String message) {
    if (!open.get()) {
      throw new IllegalStateException("channel closed");
    }
    pushed.add(message);
    final var reply = replies.apply(message);
    if (reply == null) {
      synchronized (held) {
        held.add(message);
      }
      return;
    }
    listener.onEvent(SessionEvent.result(reply, META));
  }

  /** Answers the oldest held message with {@code text}. */
  public void releaseNext(final String text) {
    synchronized (held) {
      if (held.poll() == null) {
        throw new AssertionError("nothing held on slot " + spec.getSlotIndex());
      }
    }
    listener.onEvent(SessionEvent.result(text, META));
  }

  /** Answers the oldest held message with an echo of its completion start plus {@code body}. */
  public void releaseNextFill(final String body) {
    final String message;
    synchronized (held) {
      message = held.poll();
    }
    if (message == null) {
      throw new AssertionError("nothing held on slot " + spec.getSlotIndex());
    }
    listener.onEvent(
        SessionEvent.result(ScriptedSessionChannelFactory.fillReply(message, body), META));
  }

  /** Simulates the backend exiting on its own. */
  public void crash() {
    if (open.compareAndSet(true, false)) {
      listener.onClosed();
    }
  }

  public void fail(final Throwable error) {
    listener.onError(error);
  }

  public int heldCount() {
    synchronized (held) {
      return held.size();
    }
  }

  public List<String> pushed() {
    return pushed;
  }

  public SessionSpec spec() {
    return spec;
  }

  @Override
  public boolean isOpen() {
    return open.get();
  }

  @Override
  public void close() {
    if (open.compareAndSet(true, false)) {
      listener.onClosed();
    }
  }
}
