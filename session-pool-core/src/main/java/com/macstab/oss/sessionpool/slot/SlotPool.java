/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.slot;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.IntStream;

import com.macstab.oss.sessionpool.channel.ResultMetadata;
import com.macstab.oss.sessionpool.channel.SessionChannelFactory;
import com.macstab.oss.sessionpool.channel.SessionEvent;
import com.macstab.oss.sessionpool.channel.SessionListener;
import com.macstab.oss.sessionpool.channel.SessionSpec;
import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-size pool of warm, reusable backend sessions.
 *
 * <p><strong>Architecture:</strong> each slot owns one {@link
 * com.macstab.oss.sessionpool.channel.SessionChannel}. A slot is warmed up once (a validated
 * round-trip), then serves up to {@link #getMaxReuses()} requests before it is torn down and
 * re-initialized with a fresh session. Acquisition scans round-robin for an available slot; when
 * none is free the caller parks as the single pending waiter.
 *
 * <p><strong>Latest-wins:</strong> at most one caller waits. A newer caller displaces the parked
 * one, which resolves with {@link OptionalInt#empty()} and ultimately an empty result. This fits
 * keystroke-driven workloads where only the latest request matters.
 *
 * <p><strong>Concurrency model:</strong> all slot state lives on a single-threaded event loop owned
 * by the pool. Channel callbacks, timers and public operations are posted onto it; the only
 * suspension points are the {@link CompletableFuture}s handed back to callers. Nothing in this
 * class takes a lock.
 *
 * <p><strong>Failure handling:</strong>
 *
 * <ul>
 *   <li>Stream failure or unexpected stream end: the in-flight caller gets an empty result and the
 *       slot is recycled.
 *   <li>Warm-up failure: every slot is killed and re-initialized once; a second failed round
 *       disables the pool until {@link #restart()} or {@link #recycleAll()} resets the count.
 *   <li>Rapid recycling: {@value #RAPID_RECYCLE_LIMIT} recycles of one slot within {@value
 *       #RAPID_RECYCLE_WINDOW_MS} ms retire it. When every slot is retired the pool degrades.
 * </ul>
 *
 * <p>Degradation fires the listener registered via {@link #setDegradedListener(Runnable)} at most
 * once per episode.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public abstract class SlotPool {

  static final int RAPID_RECYCLE_LIMIT = 5;
  static final long RAPID_RECYCLE_WINDOW_MS = 5_000;
  static final int MAX_WARMUP_ATTEMPTS = 2;

  private static final long DISPOSE_TIMEOUT_MS = 5_000;

  private enum Availability {
    UNKNOWN,
    AVAILABLE,
    UNAVAILABLE
  }

  @Getter private final String label;
  private final SessionChannelFactory channelFactory;
  private final SessionPoolMetrics metrics;
  private final Clock clock;
  private final Slot[] slots;
  private final ScheduledExecutorService loop;
  private volatile Thread loopThread;

  private volatile Availability availability = Availability.UNKNOWN;
  private volatile boolean disposed;
  private volatile Runnable degradedListener;
  private volatile String model;
  private volatile Path workingDirectory;

  // Confined to the event loop from here on
  private int nextSlot;
  private CompletableFuture<OptionalInt> pendingWaiter;
  private CompletableFuture<Void> recycleInFlight;
  private int warmupFailureCount;
  private boolean warmupFailureHandled;
  private boolean degradedNotified;

  private long activatedAt;
  private long lastRequestAt;
  private long totalRequests;
  private long totalRecycles;
  private long totalInputTokens;
  private long totalOutputTokens;
  private long totalCacheReadTokens;
  private long totalCacheCreationTokens;
  private double totalCostUsd;

  protected SlotPool(
      @NonNull final String label,
      final int poolSize,
      @NonNull final SessionChannelFactory channelFactory,
      @NonNull final String model,
      final Path workingDirectory,
      final SessionPoolMetrics metrics,
      @NonNull final Clock clock) {
    if (poolSize < 1) {
      throw new IllegalArgumentException("poolSize must be >= 1, got: " + poolSize);
    }
    this.label = label;
    this.channelFactory = channelFactory;
    this.model = model;
    this.workingDirectory = workingDirectory;
    this.metrics = metrics != null ? metrics : SessionPoolMetrics.NOOP;
    this.clock = clock;
    this.slots = IntStream.range(0, poolSize).mapToObj(Slot::new).toArray(Slot[]::new);
    this.loop =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              final var thread =
                  new Thread(runnable, "session-pool-" + label.toLowerCase(Locale.ROOT));
              thread.setDaemon(true);
              loopThread = thread;
              return thread;
            });
  }

  // ---------------------------------------------------------------------------------------------
  // Subclass contract
  // ---------------------------------------------------------------------------------------------

  protected abstract String getSystemPrompt();

  /** Requests a slot serves before it is recycled. */
  protected abstract int getMaxReuses();

  /** First message pushed to every fresh session. */
  protected abstract String buildWarmupMessage();

  /** Judges the raw text of the warm-up reply. */
  protected abstract boolean validateWarmupResponse(String response);

  // ---------------------------------------------------------------------------------------------
  // Lifecycle
  // ---------------------------------------------------------------------------------------------

  /**
   * Probes the backend and initializes every slot.
   *
   * <p>Completes once every slot has either warmed up or failed. An unavailable backend completes
   * immediately and leaves the pool unavailable.
   */
  public CompletableFuture<Void> activate() {
    return onLoop(
        () -> {
          if (disposed || availability == Availability.AVAILABLE) {
            return CompletableFuture.completedFuture(null);
          }
          if (!probeBackend()) {
            return CompletableFuture.completedFuture(null);
          }
          activatedAt = clock.millis();
          log.info("{}: initializing pool ({} slots)", label, slots.length);
          return initAllSlots().thenRun(() -> log.info("{}: pool initialized", label));
        });
  }

  /**
   * Kills and re-initializes every slot, e.g. after a model change.
   *
   * <p>No-op while the pool is unavailable. Concurrent calls share the in-flight recycle. Resets
   * the warm-up failure count.
   */
  public CompletableFuture<Void> recycleAll() {
    return onLoop(
        () -> {
          if (disposed || availability != Availability.AVAILABLE) {
            return CompletableFuture.completedFuture(null);
          }
          if (recycleInFlight != null) {
            return recycleInFlight;
          }
          final var inFlight = new CompletableFuture<Void>();
          recycleInFlight = inFlight;
          warmupFailureCount = 0;
          warmupFailureHandled = false;
          degradedNotified = false;
          log.info("{}: recycling all slots", label);
          killAllSlots();
          initAllSlots()
              .whenComplete(
                  (ignored, error) -> {
                    recycleInFlight = null;
                    if (error != null) {
                      inFlight.completeExceptionally(error);
                    } else {
                      log.info("{}: all slots recycled", label);
                      inFlight.complete(null);
                    }
                  });
          return inFlight;
        });
  }

  /**
   * Full reset: kills every slot, clears the availability verdict and warm-up count, re-probes the
   * backend and re-initializes. The recovery path from a degraded pool.
   */
  public CompletableFuture<Void> restart() {
    return onLoop(
        () -> {
          if (disposed) {
            return CompletableFuture.completedFuture(null);
          }
          log.info("{}: restarting pool", label);
          killAllSlots();
          warmupFailureCount = 0;
          warmupFailureHandled = false;
          degradedNotified = false;
          availability = Availability.UNKNOWN;
          if (!probeBackend()) {
            return CompletableFuture.completedFuture(null);
          }
          activatedAt = clock.millis();
          return initAllSlots().thenRun(() -> log.info("{}: pool restarted", label));
        });
  }

  /**
   * Kills every slot, releases any waiter with an empty result and stops the event loop.
   *
   * <p>Idempotent. Waits briefly for the teardown when called from outside the loop.
   */
  public void dispose() {
    if (disposed) {
      return;
    }
    disposed = true;
    final var teardown =
        onLoop(
            () -> {
              killAllSlots();
              availability = Availability.UNAVAILABLE;
              return CompletableFuture.<Void>completedFuture(null);
            });
    if (!inLoop()) {
      try {
        teardown.get(DISPOSE_TIMEOUT_MS, MILLISECONDS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (final ExecutionException | TimeoutException e) {
        log.warn("{}: teardown did not finish cleanly: {}", label, e.toString());
      }
    }
    loop.shutdown();
    log.info("{}: pool disposed", label);
  }

  public boolean isAvailable() {
    return !disposed && availability == Availability.AVAILABLE;
  }

  public String getModel() {
    return model;
  }

  /** Working directory of new sessions; {@code null} inherits the host's. */
  public Path getWorkingDirectory() {
    return workingDirectory;
  }

  /** Switches the model. Every slot is recycled so new sessions pick it up. */
  public CompletableFuture<Void> updateModel(@NonNull final String newModel) {
    if (Objects.equals(model, newModel)) {
      return CompletableFuture.completedFuture(null);
    }
    log.info("{}: model changed {} -> {}", label, model, newModel);
    model = newModel;
    return recycleAll();
  }

  /** Switches the backend working directory. Every slot is recycled. */
  public CompletableFuture<Void> updateWorkingDirectory(final Path newWorkingDirectory) {
    if (Objects.equals(workingDirectory, newWorkingDirectory)) {
      return CompletableFuture.completedFuture(null);
    }
    log.info("{}: working directory changed {} -> {}", label, workingDirectory, newWorkingDirectory);
    workingDirectory = newWorkingDirectory;
    return recycleAll();
  }

  public int getPoolSize() {
    return slots.length;
  }

  /** Registers the listener fired when the pool degrades. Replaces any earlier listener. */
  public void setDegradedListener(final Runnable listener) {
    this.degradedListener = listener;
  }

  public PoolStats getStats() {
    if (disposed || inLoop()) {
      return snapshot();
    }
    return onLoop(() -> CompletableFuture.completedFuture(snapshot()))
        .exceptionally(error -> snapshot())
        .join();
  }

  // ---------------------------------------------------------------------------------------------
  // Request path (subclasses)
  // ---------------------------------------------------------------------------------------------

  /**
   * Claims a warm slot.
   *
   * <p>Completes immediately when a slot is available, otherwise parks the caller as the pending
   * waiter. Completes with empty when the caller is displaced by a newer one, when the pool
   * degrades or is disposed. Cancelling the returned future before it completes withdraws the
   * waiter.
   */
  protected final CompletableFuture<OptionalInt> acquireSlot() {
    final var claim = new CompletableFuture<OptionalInt>();
    claim.whenComplete(
        (ignored, error) -> {
          if (claim.isCancelled()) {
            runOnLoop(() -> dropWaiter(claim));
          }
        });
    if (!runOnLoop(() -> claimOrWait(claim))) {
      claim.complete(OptionalInt.empty());
    }
    return claim;
  }

  /**
   * Pushes {@code message} to the claimed slot and completes with its result.
   *
   * <p>An empty claim completes with {@link SessionResult#EMPTY}, as does a claim that loses the
   * race with {@link #dispose()}. With a positive {@code timeout} an unanswered request completes
   * empty when the timer fires and the slot is recycled. Never completes exceptionally.
   */
  protected final CompletableFuture<SessionResult> dispatch(
      final OptionalInt claim, @NonNull final String message, final Duration timeout) {
    if (claim.isEmpty()) {
      return CompletableFuture.completedFuture(SessionResult.EMPTY);
    }
    final int index = claim.getAsInt();
    return onLoop(() -> send(index, message, timeout))
        .exceptionally(
            error -> {
              log.debug("{}: request on slot {} dropped: {}", label, index, error.toString());
              return SessionResult.EMPTY;
            });
  }

  // ---------------------------------------------------------------------------------------------
  // Event-loop internals
  // ---------------------------------------------------------------------------------------------

  private void claimOrWait(final CompletableFuture<OptionalInt> claim) {
    if (claim.isDone()) {
      return;
    }
    if (disposed || availability != Availability.AVAILABLE) {
      claim.complete(OptionalInt.empty());
      return;
    }
    for (int i = 0; i < slots.length; i++) {
      final int index = (nextSlot + i) % slots.length;
      final var slot = slots[index];
      if (slot.state == SlotState.AVAILABLE) {
        slot.state = SlotState.BUSY;
        nextSlot = (index + 1) % slots.length;
        if (!claim.complete(OptionalInt.of(index))) {
          slot.state = SlotState.AVAILABLE;
          return;
        }
        metrics.recordSlotAcquired(label, index, false);
        return;
      }
    }

    final var displaced = pendingWaiter;
    pendingWaiter = claim;
    if (displaced != null && displaced.complete(OptionalInt.empty())) {
      log.trace("{}: pending waiter displaced by newer request", label);
      metrics.recordWaiterDisplaced(label);
    }
    if (log.isTraceEnabled()) {
      log.trace("{}: no slot available, waiting ({})", label, Arrays.toString(slots));
    }
  }

  private void dropWaiter(final CompletableFuture<OptionalInt> claim) {
    if (pendingWaiter == claim) {
      pendingWaiter = null;
    }
  }

  /** Hands the freshly available slot to the pending waiter, marking it busy first. */
  private void notifyWaiter(final int index) {
    final var waiter = pendingWaiter;
    if (waiter == null) {
      return;
    }
    pendingWaiter = null;
    final var slot = slots[index];
    slot.state = SlotState.BUSY;
    if (!waiter.complete(OptionalInt.of(index))) {
      slot.state = SlotState.AVAILABLE;
      return;
    }
    metrics.recordSlotAcquired(label, index, true);
  }

  private CompletableFuture<SessionResult> send(
      final int index, final String message, final Duration timeout) {
    final var slot = slots[index];
    final var pending = slot.pendingResult;
    if (slot.state != SlotState.BUSY || slot.channel == null || pending == null) {
      return CompletableFuture.completedFuture(SessionResult.EMPTY);
    }
    try {
      slot.channel.push(message);
    } catch (final IllegalStateException e) {
      log.warn("{}: push to slot {} failed: {}", label, index, e.getMessage());
      recycleSlot(index, "dispatch-failure");
      return CompletableFuture.completedFuture(SessionResult.EMPTY);
    }

    final long now = clock.millis();
    slot.dispatchedAt = now;
    lastRequestAt = now;
    totalRequests++;

    if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
      final int generation = slot.generation;
      try {
        final var timer =
            loop.schedule(
                guarded(() -> onDispatchTimeout(index, generation, pending, timeout)),
                timeout.toMillis(),
                MILLISECONDS);
        pending.whenComplete((ignored, error) -> timer.cancel(false));
      } catch (final RejectedExecutionException e) {
        log.debug("{}: timer not scheduled, pool is shutting down", label);
      }
    }
    return pending;
  }

  private void onDispatchTimeout(
      final int index,
      final int generation,
      final CompletableFuture<SessionResult> pending,
      final Duration timeout) {
    if (pending.isDone()) {
      return;
    }
    log.warn("{}: request on slot {} timed out after {} ms, recycling", label, index, timeout.toMillis());
    metrics.recordRequest(label, timeout, false);
    pending.complete(SessionResult.EMPTY);
    final var slot = slots[index];
    if (slot.generation == generation && slot.pendingResult == pending) {
      recycleSlot(index, "timeout");
    }
  }

  private boolean probeBackend() {
    boolean ok;
    try {
      ok = channelFactory.isAvailable();
    } catch (final RuntimeException e) {
      log.error("{}: backend probe failed", label, e);
      ok = false;
    }
    availability = ok ? Availability.AVAILABLE : Availability.UNAVAILABLE;
    if (!ok) {
      log.error("{}: backend not available, pool disabled", label);
    }
    return ok;
  }

  private CompletableFuture<Void> initAllSlots() {
    return CompletableFuture.allOf(
        IntStream.range(0, slots.length).mapToObj(this::initSlot).toArray(CompletableFuture[]::new));
  }

  /**
   * Opens a fresh session, pushes the warm-up and completes once the verdict has been applied.
   * Never completes exceptionally.
   */
  private CompletableFuture<Void> initSlot(final int index) {
    final var slot = slots[index];
    final int generation = slot.generation;
    slot.state = SlotState.INITIALIZING;
    slot.reuseCount = 0;
    try {
      slot.channel = channelFactory.open(sessionSpec(index), new SlotConsumer(index, generation));
      slot.channel.push(buildWarmupMessage());
    } catch (final IOException | RuntimeException e) {
      log.error("{}: failed to initialize slot {}", label, index, e);
      slot.closeChannel();
      slot.state = SlotState.DEAD;
      return CompletableFuture.completedFuture(null);
    }
    log.trace("{}: warmup sent to slot {}", label, index);
    slot.resetPendingResult();
    final var verdict = new CompletableFuture<Boolean>();
    slot.warmupVerdict = verdict;
    return verdict
        .thenAcceptAsync(ok -> onWarmupVerdict(index, generation, ok), loop)
        .exceptionally(
            error -> {
              log.debug("{}: warmup verdict for slot {} dropped: {}", label, index, error.toString());
              return null;
            });
  }

  private void onWarmupVerdict(final int index, final int generation, final boolean ok) {
    final var slot = slots[index];
    if (slot.generation != generation) {
      log.trace("{}: stale warmup verdict for slot {} ignored", label, index);
      return;
    }
    if (!ok) {
      handleWarmupFailure(index);
      return;
    }
    if (slot.state != SlotState.INITIALIZING) {
      return;
    }
    slot.state = SlotState.AVAILABLE;
    log.debug("{}: slot {} ready", label, index);
    notifyWaiter(index);
  }

  private void handleWarmupFailure(final int index) {
    if (warmupFailureHandled) {
      return;
    }
    warmupFailureHandled = true;
    warmupFailureCount++;
    metrics.recordWarmupFailure(label);
    log.error(
        "{}: warmup failed on slot {} (attempt {}/{})",
        label,
        index,
        warmupFailureCount,
        MAX_WARMUP_ATTEMPTS);
    killAllSlots();
    if (warmupFailureCount >= MAX_WARMUP_ATTEMPTS) {
      log.error("{}: warmup failed after retry, pool disabled", label);
      degrade();
      return;
    }
    log.info("{}: retrying warmup for all slots", label);
    post(
        () -> {
          warmupFailureHandled = false;
          if (!disposed && availability == Availability.AVAILABLE) {
            initAllSlots();
          }
        });
  }

  /**
   * Tears the slot down and schedules a fresh session on the next loop turn. Trips the circuit
   * breaker instead when the slot recycles too fast.
   */
  private void recycleSlot(final int index, final String reason) {
    final var slot = slots[index];
    if (disposed || slot.state == SlotState.DEAD) {
      return;
    }
    final long now = clock.millis();
    slot.rapidRecycleCount =
        now - slot.lastRecycleTime < RAPID_RECYCLE_WINDOW_MS ? slot.rapidRecycleCount + 1 : 1;
    slot.lastRecycleTime = now;
    slot.generation++;
    totalRecycles++;

    if (slot.rapidRecycleCount >= RAPID_RECYCLE_LIMIT) {
      log.error(
          "{}: slot {} recycled {} times within {} ms, circuit breaker tripped",
          label,
          index,
          slot.rapidRecycleCount,
          RAPID_RECYCLE_WINDOW_MS);
      slot.state = SlotState.DEAD;
      slot.teardown();
      metrics.recordSlotRetired(label, index);
      if (allSlotsDead()) {
        log.error("{}: all slots retired, pool degraded", label);
        degrade();
      }
      return;
    }

    log.debug("{}: recycling slot {} ({})", label, index, reason);
    metrics.recordSlotRecycled(label, index, reason);
    slot.state = SlotState.INITIALIZING;
    slot.teardown();
    final int generation = slot.generation;
    post(
        () -> {
          if (!disposed && slot.generation == generation && slot.state == SlotState.INITIALIZING) {
            initSlot(index);
          }
        });
  }

  private void killAllSlots() {
    final var waiter = pendingWaiter;
    pendingWaiter = null;
    if (waiter != null) {
      waiter.complete(OptionalInt.empty());
    }
    for (final var slot : slots) {
      slot.generation++;
      slot.state = SlotState.DEAD;
      slot.teardown();
      slot.resetCircuitBreaker();
      slot.resolveWarmup(false);
    }
  }

  private void degrade() {
    availability = Availability.UNAVAILABLE;
    final var waiter = pendingWaiter;
    pendingWaiter = null;
    if (waiter != null) {
      waiter.complete(OptionalInt.empty());
    }
    if (degradedNotified) {
      return;
    }
    degradedNotified = true;
    metrics.recordPoolDegraded(label);
    final var listener = degradedListener;
    if (listener != null) {
      try {
        listener.run();
      } catch (final RuntimeException e) {
        log.error("{}: degraded listener failed", label, e);
      }
    }
  }

  private boolean allSlotsDead() {
    return Arrays.stream(slots).allMatch(slot -> slot.state == SlotState.DEAD);
  }

  private SessionSpec sessionSpec(final int index) {
    return SessionSpec.builder()
        .label(label)
        .slotIndex(index)
        .model(getModel())
        .systemPrompt(getSystemPrompt())
        .workingDirectory(getWorkingDirectory())
        .build();
  }

  private void recordUsage(final ResultMetadata meta) {
    totalInputTokens += meta.getInputTokens();
    totalOutputTokens += meta.getOutputTokens();
    totalCacheReadTokens += meta.getCacheReadTokens();
    totalCacheCreationTokens += meta.getCacheCreationTokens();
    totalCostUsd += meta.getCostUsd();
    metrics.recordUsage(label, meta.getInputTokens(), meta.getOutputTokens(), meta.getCostUsd());
  }

  private PoolStats snapshot() {
    final var builder =
        PoolStats.builder()
            .label(label)
            .available(isAvailable())
            .activatedAt(activatedAt > 0 ? activatedAt : null)
            .uptimeMs(activatedAt > 0 ? clock.millis() - activatedAt : 0)
            .totalRequests(totalRequests)
            .totalRecycles(totalRecycles)
            .lastRequestAt(lastRequestAt > 0 ? lastRequestAt : null)
            .totalInputTokens(totalInputTokens)
            .totalOutputTokens(totalOutputTokens)
            .totalCacheReadTokens(totalCacheReadTokens)
            .totalCacheCreationTokens(totalCacheCreationTokens)
            .totalCostUsd(totalCostUsd);
    final int maxReuses = getMaxReuses();
    for (final var slot : slots) {
      builder.slot(
          SlotStats.builder()
              .state(slot.state)
              .requestCount(slot.reuseCount)
              .maxRequests(maxReuses)
              .build());
    }
    return builder.build();
  }

  // ---------------------------------------------------------------------------------------------
  // Loop plumbing
  // ---------------------------------------------------------------------------------------------

  private boolean inLoop() {
    return Thread.currentThread() == loopThread;
  }

  /** Runs {@code action} on the loop, inline when already there. */
  private <T> CompletableFuture<T> onLoop(final Supplier<CompletableFuture<T>> action) {
    if (inLoop()) {
      return invoke(action);
    }
    final var result = new CompletableFuture<T>();
    final boolean accepted =
        post(
            () ->
                invoke(action)
                    .whenComplete(
                        (value, error) -> {
                          if (error != null) {
                            result.completeExceptionally(error);
                          } else {
                            result.complete(value);
                          }
                        }));
    if (!accepted) {
      result.completeExceptionally(new IllegalStateException(label + " pool is disposed"));
    }
    return result;
  }

  private boolean runOnLoop(final Runnable task) {
    if (inLoop()) {
      task.run();
      return true;
    }
    return post(task);
  }

  /** Queues {@code task} for a later loop turn, even when called from the loop. */
  private boolean post(final Runnable task) {
    try {
      loop.execute(guarded(task));
      return true;
    } catch (final RejectedExecutionException e) {
      log.debug("{}: loop rejected task, pool is disposed", label);
      return false;
    }
  }

  private Runnable guarded(final Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (final RuntimeException e) {
        log.error("{}: unexpected error on pool loop", label, e);
      }
    };
  }

  private static <T> CompletableFuture<T> invoke(final Supplier<CompletableFuture<T>> action) {
    try {
      return action.get();
    } catch (final RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Background consumer of one session's output.
   *
   * <p>The first result is the warm-up reply. Every later result goes to the caller waiting on the
   * slot. Bound to the generation it was created under; once the slot moves on, everything this
   * consumer sees is dropped.
   */
  private final class SlotConsumer implements SessionListener {

    private final int index;
    private final int generation;

    // Loop-confined
    private int resultCount;
    private boolean finished;

    private SlotConsumer(final int index, final int generation) {
      this.index = index;
      this.generation = generation;
    }

    @Override
    public void onEvent(final SessionEvent event) {
      post(() -> handleEvent(event));
    }

    @Override
    public void onError(final Throwable error) {
      post(() -> handleEnd(error));
    }

    @Override
    public void onClosed() {
      post(() -> handleEnd(null));
    }

    private boolean isStale() {
      return slots[index].generation != generation;
    }

    private void handleEvent(final SessionEvent event) {
      if (finished || !event.isResult()) {
        return;
      }
      if (isStale()) {
        finished = true;
        log.trace("{}: dropped result from replaced session on slot {}", label, index);
        return;
      }
      final var slot = slots[index];
      recordUsage(event.getMeta());
      resultCount++;
      if (resultCount == 1) {
        handleWarmupResult(slot, event);
        return;
      }

      if (slot.state != SlotState.BUSY) {
        log.debug("{}: unsolicited result on slot {} dropped", label, index);
        return;
      }
      final var result =
          event.isSuccess()
              ? new SessionResult(event.getText(), event.getMeta().withModel(getModel()))
              : SessionResult.EMPTY;
      slot.reuseCount++;
      metrics.recordRequest(
          label, Duration.ofMillis(clock.millis() - slot.dispatchedAt), !result.isEmpty());
      slot.deliver(result);

      if (disposed || isStale() || slot.state != SlotState.BUSY) {
        finished = true;
        return;
      }
      if (slot.reuseCount >= getMaxReuses()) {
        log.debug("{}: slot {} served {} requests, recycling", label, index, slot.reuseCount);
        finished = true;
        recycleSlot(index, "reuse-limit");
        return;
      }
      slot.resetPendingResult();
      slot.state = SlotState.AVAILABLE;
      notifyWaiter(index);
    }

    private void handleWarmupResult(final Slot slot, final SessionEvent event) {
      boolean ok = false;
      if (!event.isSuccess()) {
        log.error("{}: warmup on slot {} returned no result", label, index);
      } else {
        try {
          ok = validateWarmupResponse(event.getText());
        } catch (final RuntimeException e) {
          log.error("{}: warmup validation threw on slot {}", label, index, e);
        }
        if (!ok) {
          log.error(
              "{}: warmup validation failed on slot {}, got: {}",
              label,
              index,
              abbreviate(event.getText()));
        }
      }
      if (!ok) {
        finished = true;
        slot.closeChannel();
      }
      slot.resolveWarmup(ok);
    }

    private void handleEnd(final Throwable error) {
      if (finished) {
        return;
      }
      finished = true;
      if (isStale()) {
        return;
      }
      final var slot = slots[index];
      if (slot.warmupVerdict != null) {
        if (error != null) {
          log.error("{}: session on slot {} failed during warmup", label, index, error);
        } else {
          log.error("{}: session on slot {} ended during warmup", label, index);
        }
        slot.closeChannel();
        slot.resolveWarmup(false);
        return;
      }
      if (error != null) {
        log.error("{}: stream error on slot {}", label, index, error);
      } else {
        log.warn("{}: session on slot {} ended unexpectedly", label, index);
      }
      recycleSlot(index, "stream-failure");
    }
  }

  private static String abbreviate(final String text) {
    if (text == null) {
      return "null";
    }
    return text.length() <= 100 ? text : text.substring(0, 100) + "...";
  }
}
