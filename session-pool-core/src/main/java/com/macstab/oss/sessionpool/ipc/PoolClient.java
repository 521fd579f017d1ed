/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import com.macstab.oss.sessionpool.channel.SessionChannelFactory;
import com.macstab.oss.sessionpool.election.LockFile;
import com.macstab.oss.sessionpool.election.ProcessLiveness;
import com.macstab.oss.sessionpool.ipc.protocol.InboundFrame;
import com.macstab.oss.sessionpool.ipc.protocol.MalformedFrameException;
import com.macstab.oss.sessionpool.ipc.protocol.MessageCodec;
import com.macstab.oss.sessionpool.ipc.protocol.PoolKind;
import com.macstab.oss.sessionpool.ipc.protocol.PoolRequest;
import com.macstab.oss.sessionpool.ipc.protocol.PoolResponse;
import com.macstab.oss.sessionpool.ipc.protocol.RecycleTarget;
import com.macstab.oss.sessionpool.ipc.protocol.ServerEvent;
import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;
import com.macstab.oss.sessionpool.pool.CommandOptions;
import com.macstab.oss.sessionpool.pool.CommandResult;
import com.macstab.oss.sessionpool.pool.CompletionContext;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for every process that wants pooled sessions.
 *
 * <p><strong>Leader election:</strong> on {@link #activate()} the client first tries the shared
 * socket. If nobody answers it competes for the lockfile; the winner embeds a {@link PoolServer}
 * and becomes the {@link PoolRole#SERVER}, everyone else connects as a {@link PoolRole#CLIENT}.
 * Connect attempts are retried {@code maxReconnectAttempts} times; if still nobody answers, the
 * lock is force-acquired (accepted risk: an unresponsive but live leader ends up with a rival).
 *
 * <p><strong>Failover:</strong> when the server connection drops, every pending request fails and
 * a single takeover task runs on the coordinator thread: back off {@code reconnectDelay ×
 * attempt}, try to reconnect, otherwise try the lock and promote. Bounded by {@code
 * maxReconnectAttempts}.
 *
 * <p><strong>Fast path:</strong> in the server role every public operation calls straight into the
 * embedded server, no serialization.
 *
 * <p><strong>Errors:</strong> transport failures, timeouts and error responses are logged and
 * surface as empty results. Only {@link #activate()} completes exceptionally.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class PoolClient {

  @Getter private final String clientId;
  private final long pid;
  private final IpcPaths paths;
  private final LockFile lockFile;
  private final SessionChannelFactory channelFactory;
  private final SessionPoolMetrics metrics;
  private final Clock clock;
  private final MessageCodec codec = new MessageCodec();
  private final Consumer<PoolKind> degradedListener;
  private final Consumer<PoolRole> roleListener;
  private final ExecutorService coordinator;

  private final ConcurrentHashMap<String, CompletableFuture<PoolResponse>> pending =
      new ConcurrentHashMap<>();
  private final AtomicReference<LineConnection> connection = new AtomicReference<>();
  private final AtomicBoolean activating = new AtomicBoolean();
  private final AtomicBoolean takingOver = new AtomicBoolean();
  private final AtomicLong requestCounter = new AtomicLong();

  private volatile PoolSettings settings;
  private volatile PoolRole role = PoolRole.CLIENT;
  private volatile PoolServer server;
  private volatile String serverModel;
  private volatile boolean disposed;

  @Builder
  public PoolClient(
      final PoolSettings settings,
      final SessionChannelFactory channelFactory,
      final IpcPaths paths,
      final LockFile lockFile,
      final Long pid,
      final String clientId,
      final SessionPoolMetrics metrics,
      final Consumer<PoolKind> degradedListener,
      final Consumer<PoolRole> roleListener,
      final Clock clock) {
    this.settings = settings != null ? settings : PoolSettings.DEFAULTS;
    this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
    this.paths = paths != null ? paths : IpcPaths.defaults();
    this.lockFile = lockFile != null ? lockFile : new LockFile(this.paths.getLockPath());
    this.pid = pid != null ? pid : ProcessLiveness.currentPid();
    this.clientId =
        clientId != null ? clientId : this.pid + "-" + UUID.randomUUID().toString().substring(0, 8);
    this.metrics = metrics != null ? metrics : SessionPoolMetrics.NOOP;
    this.degradedListener = degradedListener;
    this.roleListener = roleListener;
    this.clock = clock != null ? clock : Clock.systemUTC();
    this.coordinator =
        Executors.newSingleThreadExecutor(
            runnable -> {
              final var thread = new Thread(runnable, "pool-client-coordinator");
              thread.setDaemon(true);
              return thread;
            });
  }

  // ---------------------------------------------------------------------------------------------
  // Lifecycle
  // ---------------------------------------------------------------------------------------------

  /**
   * Joins the group: connects to the running server or becomes it.
   *
   * <p>Completes exceptionally only when becoming the server fails (socket bind, lock I/O).
   */
  public CompletableFuture<Void> activate() {
    if (disposed) {
      return CompletableFuture.failedFuture(new IllegalStateException("PoolClient is disposed"));
    }
    try {
      return CompletableFuture.runAsync(this::runActivation, coordinator);
    } catch (final RejectedExecutionException e) {
      return CompletableFuture.failedFuture(new IllegalStateException("PoolClient is disposed", e));
    }
  }

  /** Leaves the group. Disposes the embedded server when this process leads. Idempotent. */
  public void dispose() {
    if (disposed) {
      return;
    }
    disposed = true;
    rejectAllPending(new IOException("Client disposed"));
    final var current = connection.getAndSet(null);
    if (current != null) {
      closeQuietly(current);
    }
    final var embedded = server;
    server = null;
    if (embedded != null) {
      embedded.dispose();
    }
    coordinator.shutdownNow();
    log.info("Pool client {}: disposed", clientId);
  }

  public PoolRole getRole() {
    return role;
  }

  public boolean isLeader() {
    return role == PoolRole.SERVER && server != null;
  }

  public PoolSettings getSettings() {
    return settings;
  }

  /** Embedded server while this process leads, otherwise {@code null}. */
  PoolServer embeddedServer() {
    return server;
  }

  /** Model the server reported at connect time, or the configured model in the server role. */
  public String getCurrentModel() {
    final var embedded = server;
    if (role == PoolRole.SERVER && embedded != null) {
      return embedded.getModel();
    }
    return serverModel != null ? serverModel : settings.getModel();
  }

  // ---------------------------------------------------------------------------------------------
  // Operations
  // ---------------------------------------------------------------------------------------------

  public CompletableFuture<Optional<String>> getCompletion(final CompletionContext context) {
    if (disposed) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    final var embedded = leaderServer();
    if (embedded != null) {
      return embedded.getCompletion(context);
    }
    return sendRequest(PoolRequest.Completion.of(nextRequestId(), context))
        .handle(
            (response, error) -> {
              if (error != null) {
                log.error("Pool client: completion error: {}", describe(error));
                return Optional.empty();
              }
              if (response instanceof PoolResponse.Completion completion && completion.isSuccess()) {
                return Optional.ofNullable(completion.getText());
              }
              log.error("Pool client: completion failed: {}", response.getError());
              return Optional.empty();
            });
  }

  public CompletableFuture<CommandResult> sendCommand(
      final String message, final CommandOptions options) {
    if (disposed) {
      return CompletableFuture.completedFuture(CommandResult.EMPTY);
    }
    final var effective = options != null ? options : CommandOptions.NONE;
    final var embedded = leaderServer();
    if (embedded != null) {
      return embedded.sendCommand(message, effective);
    }
    final var timeoutMs = effective.getTimeout() != null ? effective.getTimeout().toMillis() : null;
    return sendRequest(new PoolRequest.Command(nextRequestId(), message, timeoutMs))
        .handle(
            (response, error) -> {
              if (error != null) {
                log.error("Pool client: command error: {}", describe(error));
                return CommandResult.EMPTY;
              }
              if (response instanceof PoolResponse.Command command && command.isSuccess()) {
                return command.getText() == null
                    ? CommandResult.EMPTY
                    : new CommandResult(command.getText(), command.getMeta());
              }
              log.error("Pool client: command failed: {}", response.getError());
              return CommandResult.EMPTY;
            });
  }

  public boolean isAvailable() {
    if (disposed) {
      return false;
    }
    final var embedded = leaderServer();
    if (embedded != null) {
      return embedded.isCompletionPoolAvailable();
    }
    return isConnected();
  }

  /** In the client role this only reflects the connection; the server's pool may still be down. */
  public boolean isCommandPoolAvailable() {
    if (disposed) {
      return false;
    }
    final var embedded = leaderServer();
    if (embedded != null) {
      return embedded.isCommandPoolAvailable();
    }
    return isConnected();
  }

  /**
   * Applies new settings. A changed model is propagated to the server (or the embedded server),
   * which recycles its pools. Other settings take effect on the next promotion or reconnect.
   */
  public void updateConfig(final PoolSettings newSettings) {
    Objects.requireNonNull(newSettings, "newSettings");
    final boolean modelChanged = !newSettings.getModel().equals(settings.getModel());
    settings = newSettings;
    if (!modelChanged || disposed) {
      return;
    }
    final var embedded = leaderServer();
    if (embedded != null) {
      embedded
          .updateModel(newSettings.getModel())
          .exceptionally(
              error -> {
                log.error("Pool client: config update failed: {}", describe(error));
                return null;
              });
      return;
    }
    sendRequest(new PoolRequest.ConfigUpdate(nextRequestId(), newSettings.getModel()))
        .whenComplete(
            (response, error) -> {
              if (error != null) {
                log.error("Pool client: config update failed: {}", describe(error));
              } else if (!response.isSuccess()) {
                log.error("Pool client: config update rejected: {}", response.getError());
              } else {
                serverModel = newSettings.getModel();
              }
            });
  }

  public CompletableFuture<Void> recycleAll() {
    if (disposed) {
      return CompletableFuture.completedFuture(null);
    }
    final var embedded = leaderServer();
    final CompletableFuture<?> recycle =
        embedded != null
            ? embedded.recycle(RecycleTarget.ALL)
            : sendRequest(new PoolRequest.Recycle(nextRequestId(), RecycleTarget.ALL));
    return recycle.handle(
        (ignored, error) -> {
          if (error != null) {
            log.error("Pool client: recycle failed: {}", describe(error));
          }
          return null;
        });
  }

  /** Full pool restart in the server role; a recycle request otherwise. */
  public CompletableFuture<Void> restart() {
    if (disposed) {
      return CompletableFuture.completedFuture(null);
    }
    final var embedded = leaderServer();
    if (embedded == null) {
      return recycleAll();
    }
    return embedded
        .restartPools()
        .handle(
            (ignored, error) -> {
              if (error != null) {
                log.error("Pool client: restart failed: {}", describe(error));
              }
              return null;
            });
  }

  public CompletableFuture<Optional<PoolStatus>> getPoolStatus() {
    if (disposed) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    final var embedded = leaderServer();
    if (embedded != null) {
      return CompletableFuture.completedFuture(Optional.of(toStatus(embedded.status(null))));
    }
    return sendRequest(new PoolRequest.Status(nextRequestId()))
        .handle(
            (response, error) -> {
              if (error == null
                  && response instanceof PoolResponse.Status status
                  && status.isSuccess()) {
                return Optional.of(toStatus(status));
              }
              log.debug("Pool client: status unavailable: {}", error != null ? describe(error) : response);
              return Optional.empty();
            });
  }

  // ---------------------------------------------------------------------------------------------
  // Election and failover (coordinator thread)
  // ---------------------------------------------------------------------------------------------

  private void runActivation() {
    if (disposed || leaderServer() != null || isConnected()) {
      return;
    }
    activating.set(true);
    try {
      log.info("Pool client {}: activating", clientId);
      if (tryConnect()) {
        changeRole(PoolRole.CLIENT);
        return;
      }
      if (lockFile.tryAcquire(pid)) {
        becomeServer();
        return;
      }

      final int maxAttempts = settings.getMaxReconnectAttempts();
      for (int attempt = 1; attempt <= maxAttempts && !disposed; attempt++) {
        if (!pause(settings.getReconnectDelay())) {
          throw new IllegalStateException("Activation interrupted");
        }
        if (tryConnect()) {
          changeRole(PoolRole.CLIENT);
          return;
        }
        if (lockFile.tryAcquire(pid)) {
          becomeServer();
          return;
        }
        log.debug("Pool client {}: activation attempt {}/{} failed", clientId, attempt, maxAttempts);
      }
      if (disposed) {
        return;
      }
      log.warn(
          "Pool client {}: no server answered after {} attempts, forcing lock acquisition",
          clientId,
          maxAttempts);
      lockFile.forceAcquire(pid);
      becomeServer();
    } catch (final IOException e) {
      throw new UncheckedIOException("Pool client activation failed", e);
    } finally {
      activating.set(false);
    }
  }

  private void attemptTakeOver() {
    if (disposed || leaderServer() != null || isConnected()) {
      return;
    }
    if (!takingOver.compareAndSet(false, true)) {
      return;
    }
    try {
      final int maxAttempts = settings.getMaxReconnectAttempts();
      for (int attempt = 1; attempt <= maxAttempts && !disposed; attempt++) {
        if (!pause(settings.getReconnectDelay().multipliedBy(attempt))) {
          return;
        }
        if (tryConnect()) {
          log.info("Pool client {}: reconnected (attempt {})", clientId, attempt);
          metrics.recordTakeover("reconnected");
          return;
        }
        if (lockFile.tryAcquire(pid)) {
          becomeServer();
          metrics.recordTakeover("promoted");
          return;
        }
        log.debug("Pool client {}: takeover attempt {}/{} failed", clientId, attempt, maxAttempts);
      }
      if (!disposed) {
        log.error(
            "Pool client {}: could not reconnect or take over after {} attempts",
            clientId,
            maxAttempts);
        metrics.recordTakeover("failed");
      }
    } catch (final IOException | RuntimeException e) {
      log.error("Pool client {}: takeover failed", clientId, e);
      metrics.recordTakeover("failed");
    } finally {
      takingOver.set(false);
    }
  }

  private void becomeServer() throws IOException {
    log.info("Pool client {}: becoming server", clientId);
    final var embedded =
        PoolServer.builder()
            .serverId(clientId)
            .pid(pid)
            .settings(settings)
            .channelFactory(channelFactory)
            .paths(paths)
            .lockFile(lockFile)
            .metrics(metrics)
            .degradedListener(this::notifyDegraded)
            .clock(clock)
            .build();
    embedded.start();
    if (disposed) {
      embedded.dispose();
      return;
    }
    server = embedded;
    changeRole(PoolRole.SERVER);
    log.info("Pool client {}: now serving on {}", clientId, paths.getSocketPath());
  }

  private boolean tryConnect() {
    if (!paths.endpointExists()) {
      return false;
    }
    final LineConnection candidate;
    try {
      candidate = LineConnection.connect(paths.getSocketPath());
    } catch (final IOException e) {
      log.debug("Pool client {}: connect failed: {}", clientId, e.getMessage());
      return false;
    }
    connection.set(candidate);
    startDaemon(() -> readLoop(candidate), "pool-client-reader");

    try {
      final var response =
          send(candidate, new PoolRequest.ClientHello(nextRequestId(), clientId))
              .get(settings.getConnectTimeout().toMillis(), MILLISECONDS);
      if (response instanceof PoolResponse.ClientHello hello && hello.isSuccess()) {
        serverModel = hello.getModel();
        log.info(
            "Pool client {}: connected to server {} (model {})",
            clientId,
            hello.getServerId(),
            hello.getModel());
        return true;
      }
      log.warn("Pool client {}: unexpected hello reply: {}", clientId, response);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (final ExecutionException | TimeoutException e) {
      log.debug("Pool client {}: hello failed: {}", clientId, describe(e));
    }
    if (connection.compareAndSet(candidate, null)) {
      closeQuietly(candidate);
    }
    return false;
  }

  // ---------------------------------------------------------------------------------------------
  // Transport
  // ---------------------------------------------------------------------------------------------

  private CompletableFuture<PoolResponse> sendRequest(final PoolRequest request) {
    final var current = connection.get();
    if (current == null) {
      return CompletableFuture.failedFuture(new IOException("Not connected to server"));
    }
    return send(current, request);
  }

  private CompletableFuture<PoolResponse> send(
      final LineConnection target, final PoolRequest request) {
    final var id = request.getId();
    final var future = new CompletableFuture<PoolResponse>();
    pending.put(id, future);
    future
        .orTimeout(settings.getRequestTimeout().toMillis(), MILLISECONDS)
        .whenComplete((ignored, error) -> pending.remove(id, future));
    try {
      target.writeLine(codec.encode(request));
    } catch (final IOException e) {
      future.completeExceptionally(e);
    }
    return future;
  }

  private void readLoop(final LineConnection source) {
    try {
      String line;
      while ((line = source.readLine()) != null) {
        if (!line.isBlank()) {
          handleFrame(source, line);
        }
      }
    } catch (final IOException e) {
      log.debug("Pool client {}: read failed: {}", clientId, e.getMessage());
    } finally {
      handleDisconnect(source);
    }
  }

  private void handleFrame(final LineConnection source, final String line) {
    final InboundFrame frame;
    try {
      frame = codec.decodeInbound(line);
    } catch (final MalformedFrameException e) {
      log.error("Pool client {}: dropped malformed frame: {}", clientId, e.getMessage());
      return;
    }
    if (frame.isEvent()) {
      handleEvent(source, frame.getEvent());
      return;
    }
    final var response = frame.getResponse();
    final var future = pending.remove(response.getId());
    if (future == null) {
      log.debug("Pool client {}: no pending request for response {}", clientId, response.getId());
      return;
    }
    future.complete(response);
  }

  private void handleEvent(final LineConnection source, final ServerEvent event) {
    if (event instanceof ServerEvent.ShuttingDown) {
      log.info("Pool client {}: server is shutting down", clientId);
      closeQuietly(source);
    } else if (event instanceof ServerEvent.PoolDegraded degraded) {
      notifyDegraded(degraded.getPool());
    }
  }

  private void handleDisconnect(final LineConnection source) {
    if (!connection.compareAndSet(source, null)) {
      return;
    }
    closeQuietly(source);
    rejectAllPending(new IOException("Server disconnected"));
    if (disposed || activating.get()) {
      return;
    }
    log.info("Pool client {}: disconnected from server, attempting takeover", clientId);
    try {
      coordinator.execute(this::attemptTakeOver);
    } catch (final RejectedExecutionException e) {
      log.debug("Pool client {}: takeover not scheduled, client is shutting down", clientId);
    }
  }

  private void rejectAllPending(final Throwable reason) {
    for (final var id : pending.keySet()) {
      final var future = pending.remove(id);
      if (future != null) {
        future.completeExceptionally(reason);
      }
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------------------------

  private PoolServer leaderServer() {
    final var embedded = server;
    return role == PoolRole.SERVER ? embedded : null;
  }

  private boolean isConnected() {
    final var current = connection.get();
    return current != null && current.isOpen();
  }

  private void changeRole(final PoolRole newRole) {
    role = newRole;
    metrics.recordRoleChange(newRole.wireName());
    if (roleListener != null) {
      try {
        roleListener.accept(newRole);
      } catch (final RuntimeException e) {
        log.error("Pool client {}: role listener failed", clientId, e);
      }
    }
  }

  private void notifyDegraded(final PoolKind kind) {
    log.error("Pool client {}: {} pool degraded", clientId, kind.wireName());
    if (degradedListener != null) {
      try {
        degradedListener.accept(kind);
      } catch (final RuntimeException e) {
        log.error("Pool client {}: degraded listener failed", clientId, e);
      }
    }
  }

  private PoolStatus toStatus(final PoolResponse.Status status) {
    return PoolStatus.builder()
        .role(role)
        .model(status.getModel())
        .completionPoolAvailable(status.isCompletionPoolAvailable())
        .commandPoolAvailable(status.isCommandPoolAvailable())
        .connectedClients(status.getConnectedClients())
        .completionPool(status.getCompletionPool())
        .commandPool(status.getCommandPool())
        .build();
  }

  private String nextRequestId() {
    return clientId + "-" + requestCounter.incrementAndGet();
  }

  private boolean pause(final Duration delay) {
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void closeQuietly(final LineConnection target) {
    try {
      target.close();
    } catch (final IOException e) {
      log.debug("Pool client {}: close failed: {}", clientId, e.getMessage());
    }
  }

  private static String describe(final Throwable error) {
    var cause = error;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause instanceof TimeoutException
        ? "request timed out"
        : cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }

  private static void startDaemon(final Runnable task, final String name) {
    final var thread = new Thread(task, name);
    thread.setDaemon(true);
    thread.start();
  }
}
