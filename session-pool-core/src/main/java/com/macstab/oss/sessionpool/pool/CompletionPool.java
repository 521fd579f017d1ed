/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.pool;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.macstab.oss.sessionpool.channel.SessionChannelFactory;
import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;
import com.macstab.oss.sessionpool.slot.SessionResult;
import com.macstab.oss.sessionpool.slot.SlotPool;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Inline-completion pool: fill-in-the-middle requests against warm sessions.
 *
 * <p><strong>Defaults:</strong> {@value #DEFAULT_POOL_SIZE} slots, {@value #DEFAULT_MAX_REUSES}
 * requests per session. Every session is warmed up with the fill message for {@code "Two plus two
 * equals "} / {@code "."} and must answer with {@code "four"}.
 *
 * <p><strong>Request flow:</strong>
 *
 * <ol>
 *   <li>Build the fill message ({@link FillPrompt#build(String, String)})
 *   <li>Claim a slot (latest-wins when all are busy)
 *   <li>Push, await the result, extract the {@code <output>} body
 *   <li>Strip the echoed completion start; a reply that does not echo it yields empty
 * </ol>
 *
 * <p>Whitespace-only completions and trimming of overlapping suffix text are the caller's
 * post-processing concern.
 */
@Slf4j
public class CompletionPool extends SlotPool {

  public static final String LABEL = "completion";
  public static final int DEFAULT_POOL_SIZE = 2;
  public static final int DEFAULT_MAX_REUSES = 8;

  static final String WARMUP_PREFIX = "Two plus two equals ";
  static final String WARMUP_SUFFIX = ".";
  static final String WARMUP_EXPECTED = "four";

  private static final String SYSTEM_PROMPT = Prompts.load("completion-system-prompt.txt");

  private final int maxReuses;

  public CompletionPool(
      @NonNull final SessionChannelFactory channelFactory,
      @NonNull final String model,
      final Path workingDirectory) {
    this(
        channelFactory,
        model,
        workingDirectory,
        DEFAULT_POOL_SIZE,
        DEFAULT_MAX_REUSES,
        SessionPoolMetrics.NOOP,
        Clock.systemUTC());
  }

  public CompletionPool(
      @NonNull final SessionChannelFactory channelFactory,
      @NonNull final String model,
      final Path workingDirectory,
      final int poolSize,
      final int maxReuses,
      final SessionPoolMetrics metrics,
      @NonNull final Clock clock) {
    super(LABEL, poolSize, channelFactory, model, workingDirectory, metrics, clock);
    if (maxReuses < 1) {
      throw new IllegalArgumentException("maxReuses must be >= 1, got: " + maxReuses);
    }
    this.maxReuses = maxReuses;
  }

  /**
   * Requests a completion for the cursor position in {@code context}.
   *
   * <p>Completes with empty when the pool is unavailable, the request was displaced by a newer one,
   * the session failed, or the model did not echo the completion start. Cancelling the returned
   * future while it still waits for a slot withdraws the request.
   */
  public CompletableFuture<Optional<String>> getCompletion(@NonNull final CompletionContext context) {
    if (!isAvailable()) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    final var message = FillPrompt.build(context.getPrefix(), context.getSuffix());
    if (log.isTraceEnabled()) {
      log.trace("{}: sending fill message:\n{}", getLabel(), message.getText());
    }
    final var claim = acquireSlot();
    final CompletableFuture<Optional<String>> completion =
        claim
            .thenCompose(slot -> dispatch(slot, message.getText(), null))
            .thenApply(result -> toCompletion(result, message));
    completion.whenComplete(
        (ignored, error) -> {
          if (completion.isCancelled()) {
            claim.cancel(false);
          }
        });
    return completion;
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
    return FillPrompt.build(WARMUP_PREFIX, WARMUP_SUFFIX).getText();
  }

  @Override
  protected boolean validateWarmupResponse(final String response) {
    final var completionStart = FillPrompt.splitPrefix(WARMUP_PREFIX).getCompletionStart();
    return FillPrompt.stripCompletionStart(FillPrompt.extractOutput(response), completionStart)
        .map(text -> text.trim().toLowerCase(Locale.ROOT).equals(WARMUP_EXPECTED))
        .orElse(false);
  }

  private Optional<String> toCompletion(final SessionResult result, final FillPrompt.Message message) {
    if (result.isEmpty()) {
      return Optional.empty();
    }
    final var extracted = FillPrompt.extractOutput(result.getText());
    final var completion = FillPrompt.stripCompletionStart(extracted, message.getCompletionStart());
    if (completion.isEmpty() && log.isDebugEnabled()) {
      log.debug(
          "{}: reply did not echo completion start '{}', dropped",
          getLabel(),
          message.getCompletionStart());
    }
    return completion;
  }
}
