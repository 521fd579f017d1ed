/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.pool;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

import com.macstab.oss.sessionpool.channel.SessionChannelFactory;
import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;
import com.macstab.oss.sessionpool.slot.SlotPool;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-slot pool for one-shot prompts (commit messages, reviews, rewrites).
 *
 * <p>Sessions are warmed up with {@code "Reply with exactly the word: READY"} and serve up to
 * {@value #DEFAULT_MAX_REUSES} prompts. A prompt with a timeout that goes unanswered completes with
 * {@link CommandResult#EMPTY} and the slot is recycled, since the session may still be producing
 * the abandoned reply.
 */
@Slf4j
public class CommandPool extends SlotPool {

  public static final String LABEL = "command";
  public static final int POOL_SIZE = 1;
  public static final int DEFAULT_MAX_REUSES = 24;

  static final String WARMUP_MESSAGE = "Reply with exactly the word: READY";

  private static final String SYSTEM_PROMPT = Prompts.load("command-system-prompt.txt");

  private final int maxReuses;

  public CommandPool(
      @NonNull final SessionChannelFactory channelFactory,
      @NonNull final String model,
      final Path workingDirectory) {
    this(
        channelFactory,
        model,
        workingDirectory,
        DEFAULT_MAX_REUSES,
        SessionPoolMetrics.NOOP,
        Clock.systemUTC());
  }

  public CommandPool(
      @NonNull final SessionChannelFactory channelFactory,
      @NonNull final String model,
      final Path workingDirectory,
      final int maxReuses,
      final SessionPoolMetrics metrics,
      @NonNull final Clock clock) {
    super(LABEL, POOL_SIZE, channelFactory, model, workingDirectory, metrics, clock);
    if (maxReuses < 1) {
      throw new IllegalArgumentException("maxReuses must be >= 1, got: " + maxReuses);
    }
    this.maxReuses = maxReuses;
  }

  /**
   * Sends {@code message} and completes with the reply.
   *
   * <p>Never completes exceptionally for pool conditions: unavailable pool, displaced waiter,
   * timeout and session failure all yield {@link CommandResult#EMPTY}. Once the slot is claimed the
   * request is committed; cancelling the returned future only withdraws a request still waiting
   * for the slot.
   */
  public CompletableFuture<CommandResult> sendPrompt(
      @NonNull final String message, @NonNull final CommandOptions options) {
    if (!isAvailable()) {
      return CompletableFuture.completedFuture(CommandResult.EMPTY);
    }
    final var claim = acquireSlot();
    final CompletableFuture<CommandResult> reply =
        claim
            .thenCompose(slot -> dispatch(slot, message, options.getTimeout()))
            .thenApply(
                result ->
                    result.isEmpty()
                        ? CommandResult.EMPTY
                        : new CommandResult(result.getText(), result.getMeta()));
    reply.whenComplete(
        (ignored, error) -> {
          if (reply.isCancelled()) {
            claim.cancel(false);
          }
        });
    return reply;
  }

  public CompletableFuture<CommandResult> sendPrompt(@NonNull final String message) {
    return sendPrompt(message, CommandOptions.NONE);
  }

  @Override
  protected String getSystemPrompt() {
    return SYSTEM_PROMPT;
  }

  @Override
  protected int getMaxReuses() {
    return maxReuses;
  }

  @Override
  protected String buildWarmupMessage() {
    return WARMUP_MESSAGE;
  }

  @Override
  protected boolean validateWarmupResponse(final String response) {
    return response.trim().toLowerCase(Locale.ROOT).contains("ready");
  }
}
