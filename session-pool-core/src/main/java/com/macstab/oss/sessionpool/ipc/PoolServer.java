/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.macstab.oss.sessionpool.channel.ResultMetadata;
import com.macstab.oss.sessionpool.channel.SessionChannelFactory;
import com.macstab.oss.sessionpool.election.LockFile;
import com.macstab.oss.sessionpool.ipc.protocol.MalformedFrameException;
import com.macstab.oss.sessionpool.ipc.protocol.MessageCodec;
import com.macstab.oss.sessionpool.ipc.protocol.PoolKind;
import com.macstab.oss.sessionpool.ipc.protocol.PoolRequest;
import com.macstab.oss.sessionpool.ipc.protocol.PoolResponse;
import com.macstab.oss.sessionpool.ipc.protocol.RecycleTarget;
import com.macstab.oss.sessionpool.ipc.protocol.ServerEvent;
import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;
import com.macstab.oss.sessionpool.pool.CommandOptions;
import com.macstab.oss.sessionpool.pool.CommandPool;
import com.macstab.oss.sessionpool.pool.CommandResult;
import com.macstab.oss.sessionpool.pool.CompletionContext;
import com.macstab.oss.sessionpool.pool.CompletionPool;
import com.macstab.oss.sessionpool.slot.PoolStats;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Hosts the completion and command pools for every cooperating process.
 *
 * <p><strong>Transport:</strong> a Unix domain socket at {@link IpcPaths#getSocketPath()}, one
 * newline-delimited JSON message per line. One accept thread plus one reader thread per connected
 * client. Every decoded request produces exactly one response carrying the request's id. A frame
 * that fails to decode is logged and dropped; if its id can still be read an error response is
 * sent.
 *
 * <p><strong>Local fast path:</strong> the owning process calls the public methods ({@link
 * #getCompletion(CompletionContext)}, {@link #sendCommand(String, CommandOptions)}, ...) directly,
 * without serialization.
 *
 * <p><strong>Events:</strong> {@code server-shutting-down} is broadcast on {@link #dispose()};
 * {@code pool-degraded} whenever a hosted pool gives up.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class PoolServer {

  @Getter private final String serverId;
  private final long pid;
  private final IpcPaths paths;
  private final LockFile lockFile;
  private final MessageCodec codec;
  private final SessionPoolMetrics metrics;
  private final CompletionPool completionPool;
  private final CommandPool commandPool;
  private final Consumer<PoolKind> degradedListener;

  private final Set<ClientConnection> clients = ConcurrentHashMap.newKeySet();
  private final AtomicInteger connectionCounter = new AtomicInteger();

  private volatile String model;
  private volatile ServerSocketChannel listener;
  private volatile boolean disposed;

  @Builder
  public PoolServer(
      @NonNull final String serverId,
      final long pid,
      @NonNull final PoolSettings settings,
      @NonNull final SessionChannelFactory channelFactory,
      @NonNull final IpcPaths paths,
      @NonNull final LockFile lockFile,
      final SessionPoolMetrics metrics,
      final Consumer<PoolKind> degradedListener,
      final Clock clock) {
    this.serverId = serverId;
    this.pid = pid;
    this.paths = paths;
    this.lockFile = lockFile;
    this.codec = new MessageCodec();
    this.metrics = metrics != null ? metrics : SessionPoolMetrics.NOOP;
    this.degradedListener = degradedListener;
    this.model = settings.getModel();

    final var effectiveClock = clock != null ? clock : Clock.systemUTC();
    this.completionPool =
        new CompletionPool(
            channelFactory,
            settings.getModel(),
            settings.getWorkingDirectory(),
            settings.getCompletionPoolSize(),
            settings.getCompletionMaxReuses(),
            this.metrics,
            effectiveClock);
    this.commandPool =
        new CommandPool(
            channelFactory,
            settings.getModel(),
            settings.getWorkingDirectory(),
            settings.getCommandMaxReuses(),
            this.metrics,
            effectiveClock);
    completionPool.setDegradedListener(() -> onPoolDegraded(PoolKind.COMPLETION));
    commandPool.setDegradedListener(() -> onPoolDegraded(PoolKind.COMMAND));
  }

  /**
   * Binds the socket, starts accepting clients and activates both pools.
   *
   * <p>Returns once both pools have finished their initial warm-up. Clients may connect while the
   * pools are still warming up. On failure the socket and the lockfile are cleaned up and the
   * exception is rethrown.
   *
   * @throws IOException if the state directory cannot be created or the socket cannot be bound
   */
  public void start() throws IOException {
    try {
      paths.ensureStateDirectory();
      paths.removeEndpoint();
      final var channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
      listener = channel;
      channel.bind(UnixDomainSocketAddress.of(paths.getSocketPath()));
      log.info("Pool server {} listening on {}", serverId, paths.getSocketPath());
      startDaemon(() -> acceptLoop(channel), "pool-server-accept");

      CompletableFuture.allOf(completionPool.activate(), commandPool.activate()).join();
      log.info(
          "Pool server {} ready (completion available: {}, command available: {})",
          serverId,
          completionPool.isAvailable(),
          commandPool.isAvailable());
    } catch (final IOException | RuntimeException e) {
      log.error("Pool server {} failed to start", serverId, e);
      closeListener();
      paths.removeEndpoint();
      lockFile.release(pid);
      throw e;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Direct API (local fast path)
  // ---------------------------------------------------------------------------------------------

  public CompletableFuture<Optional<String>> getCompletion(@NonNull final CompletionContext context) {
    return completionPool.getCompletion(context);
  }

  public CompletableFuture<CommandResult> sendCommand(
      @NonNull final String message, @NonNull final CommandOptions options) {
    return commandPool.sendPrompt(message, options);
  }

  public boolean isCompletionPoolAvailable() {
    return completionPool.isAvailable();
  }

  public boolean isCommandPoolAvailable() {
    return commandPool.isAvailable();
  }

  public String getModel() {
    return model;
  }

  public int getConnectedClientCount() {
    return clients.size();
  }

  public PoolStats getCompletionPoolStats() {
    return completionPool.getStats();
  }

  public PoolStats getCommandPoolStats() {
    return commandPool.getStats();
  }

  /** Switches both pools to {@code newModel}; completes when both have recycled. */
  public CompletableFuture<Void> updateModel(@NonNull final String newModel) {
    model = newModel;
    return CompletableFuture.allOf(
        completionPool.updateModel(newModel), commandPool.updateModel(newModel));
  }

  public CompletableFuture<Void> recycle(@NonNull final RecycleTarget target) {
    final var completion =
        target.includes(PoolKind.COMPLETION)
            ? completionPool.recycleAll()
            : CompletableFuture.<Void>completedFuture(null);
    final var command =
        target.includes(PoolKind.COMMAND)
            ? commandPool.recycleAll()
            : CompletableFuture.<Void>completedFuture(null);
    return CompletableFuture.allOf(completion, command);
  }

  /** Full restart of both pools, including re-probing the backend. */
  public CompletableFuture<Void> restartPools() {
    return CompletableFuture.allOf(completionPool.restart(), commandPool.restart());
  }

  public PoolResponse.Status status(final String requestId) {
    final var status = new PoolResponse.Status(requestId);
    status.setCompletionPoolAvailable(completionPool.isAvailable());
    status.setCommandPoolAvailable(commandPool.isAvailable());
    status.setConnectedClients(clients.size());
    status.setModel(model);
    status.setCompletionPool(completionPool.getStats());
    status.setCommandPool(commandPool.getStats());
    return status;
  }

  /**
   * Broadcasts {@code server-shutting-down}, drops every client, disposes both pools and removes
   * the socket file and the lockfile. Idempotent.
   */
  public void dispose() {
    if (disposed) {
      return;
    }
    disposed = true;
    log.info("Pool server {} shutting down", serverId);
    broadcast(new ServerEvent.ShuttingDown());
    for (final var client : clients) {
      closeQuietly(client);
    }
    clients.clear();
    metrics.setConnectedClients(0);
    closeListener();
    completionPool.dispose();
    commandPool.dispose();
    paths.removeEndpoint();
    lockFile.release(pid);
    log.info("Pool server {} disposed", serverId);
  }

  public boolean isDisposed() {
    return disposed;
  }

  // ---------------------------------------------------------------------------------------------
  // Socket handling
  // ---------------------------------------------------------------------------------------------

  private void acceptLoop(final ServerSocketChannel channel) {
    while (!disposed) {
      final LineConnection connection;
      try {
        connection = new LineConnection(channel.accept());
      } catch (final ClosedChannelException e) {
        break;
      } catch (final IOException e) {
        if (!disposed) {
          log.error("Pool server {} stopped accepting connections", serverId, e);
        }
        break;
      }
      final var client = new ClientConnection(connectionCounter.incrementAndGet(), connection);
      clients.add(client);
      metrics.setConnectedClients(clients.size());
      log.info("Pool server: {} connected ({} total)", client, clients.size());
      startDaemon(() -> readLoop(client), "pool-server-" + client);
    }
  }

  private void readLoop(final ClientConnection client) {
    try {
      String line;
      while ((line = client.connection.readLine()) != null) {
        if (!line.isBlank()) {
          handleLine(client, line);
        }
      }
    } catch (final IOException e) {
      if (!disposed) {
        log.debug("Pool server: read from {} failed: {}", client, e.getMessage());
      }
    } finally {
      if (clients.remove(client)) {
        closeQuietly(client);
        metrics.setConnectedClients(clients.size());
        if (!disposed) {
          log.info("Pool server: {} disconnected ({} remaining)", client, clients.size());
        }
      }
    }
  }

  private void handleLine(final ClientConnection client, final String line) {
    final PoolRequest request;
    try {
      request = codec.decodeRequest(line);
    } catch (final MalformedFrameException e) {
      log.error("Pool server: rejected frame from {}: {}", client, e.getMessage());
      codec.peekId(line).ifPresent(id -> send(client, new PoolResponse.Error(id, e.getMessage())));
      return;
    }
    if (log.isTraceEnabled()) {
      log.trace("Pool server: {} <- {}", client, request);
    }

    CompletableFuture<PoolResponse> reply;
    try {
      reply = handleRequest(client, request);
    } catch (final RuntimeException e) {
      reply = CompletableFuture.failedFuture(e);
    }
    reply.whenComplete(
        (response, error) -> {
          if (error != null) {
            log.error("Pool server: {} request {} failed", client, request.getId(), unwrap(error));
            send(client, new PoolResponse.Error(request.getId(), describe(error)));
          } else {
            send(client, response);
          }
          if (request instanceof PoolRequest.Dispose) {
            startDaemon(this::dispose, "pool-server-dispose");
          }
        });
  }

  private CompletableFuture<PoolResponse> handleRequest(
      final ClientConnection client, final PoolRequest request) {
    final var id = request.getId();
    if (request instanceof PoolRequest.ClientHello hello) {
      client.clientId = hello.getClientId();
      log.info("Pool server: {} identified as {}", client, hello.getClientId());
      return done(new PoolResponse.ClientHello(id, serverId, model));
    }
    if (request instanceof PoolRequest.Completion completion) {
      return handleCompletion(completion);
    }
    if (request instanceof PoolRequest.Command command) {
      return handleCommand(command);
    }
    if (request instanceof PoolRequest.Warmup) {
      return done(new PoolResponse.Warmup(id, true, null));
    }
    if (request instanceof PoolRequest.Recycle recycle) {
      final var target = recycle.getPool() != null ? recycle.getPool() : RecycleTarget.ALL;
      return recycle(target)
          .handle(
              (ignored, error) ->
                  new PoolResponse.Recycle(id, error == null, error == null ? null : describe(error)));
    }
    if (request instanceof PoolRequest.Status) {
      return done(status(id));
    }
    if (request instanceof PoolRequest.ConfigUpdate update) {
      final var change =
          update.getModel() != null
              ? updateModel(update.getModel())
              : CompletableFuture.<Void>completedFuture(null);
      return change.handle(
          (ignored, error) ->
              new PoolResponse.ConfigUpdate(id, error == null, error == null ? null : describe(error)));
    }
    if (request instanceof PoolRequest.Dispose) {
      return done(new PoolResponse.Dispose(id));
    }
    return done(new PoolResponse.Error(id, "Unknown request type"));
  }

  private CompletableFuture<PoolResponse> handleCompletion(final PoolRequest.Completion request) {
    if (!completionPool.isAvailable()) {
      return done(PoolResponse.Completion.failed(request.getId(), "Completion pool not available"));
    }
    final var meta = ResultMetadata.builder().model(completionPool.getModel()).build();
    return getCompletion(request.toContext())
        .thenApply(text -> new PoolResponse.Completion(request.getId(), text.orElse(null), meta));
  }

  private CompletableFuture<PoolResponse> handleCommand(final PoolRequest.Command request) {
    if (!commandPool.isAvailable()) {
      return done(PoolResponse.Command.failed(request.getId(), "Command pool not available"));
    }
    final var timeoutMs = request.getTimeoutMs();
    final var options =
        timeoutMs != null && timeoutMs > 0
            ? CommandOptions.withTimeout(Duration.ofMillis(timeoutMs))
            : CommandOptions.NONE;
    return sendCommand(request.getMessage(), options)
        .thenApply(
            result -> new PoolResponse.Command(request.getId(), result.getText(), result.getMeta()));
  }

  private void onPoolDegraded(final PoolKind kind) {
    log.error("Pool server: {} pool degraded", kind.wireName());
    broadcast(new ServerEvent.PoolDegraded(kind));
    if (degradedListener != null) {
      degradedListener.accept(kind);
    }
  }

  private void broadcast(final ServerEvent event) {
    final String line;
    try {
      line = codec.encode(event);
    } catch (final JsonProcessingException e) {
      log.error("Pool server: failed to encode {}", event, e);
      return;
    }
    for (final var client : clients) {
      try {
        client.connection.writeLine(line);
      } catch (final IOException e) {
        log.debug("Pool server: broadcast to {} failed: {}", client, e.getMessage());
      }
    }
  }

  private void send(final ClientConnection client, final PoolResponse response) {
    try {
      client.connection.writeLine(codec.encode(response));
    } catch (final IOException e) {
      log.debug("Pool server: reply to {} failed: {}", client, e.getMessage());
      closeQuietly(client);
    }
  }

  /** Drops every client socket without the shutdown broadcast, as a crashed server would. */
  void dropAllConnections() {
    for (final var client : clients) {
      closeQuietly(client);
    }
  }

  private void closeListener() {
    final var channel = listener;
    listener = null;
    if (channel != null) {
      try {
        channel.close();
      } catch (final IOException e) {
        log.debug("Pool server: closing listener failed: {}", e.getMessage());
      }
    }
  }

  private static void closeQuietly(final ClientConnection client) {
    try {
      client.connection.close();
    } catch (final IOException e) {
      log.debug("Pool server: closing {} failed: {}", client, e.getMessage());
    }
  }

  private static CompletableFuture<PoolResponse> done(final PoolResponse response) {
    return CompletableFuture.completedFuture(response);
  }

  private static Throwable unwrap(final Throwable error) {
    return error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
  }

  private static String describe(final Throwable error) {
    final var cause = unwrap(error);
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }

  private static void startDaemon(final Runnable task, final String name) {
    final var thread = new Thread(task, name);
    thread.setDaemon(true);
    thread.start();
  }

  /** One accepted socket. */
  private static final class ClientConnection {
    private final int number;
    private final LineConnection connection;
    private volatile String clientId;

    private ClientConnection(final int number, final LineConnection connection) {
      this.number = number;
      this.connection = connection;
    }

    @Override
    public String toString() {
      return clientId != null ? "client-" + number + "/" + clientId : "client-" + number;
    }
  }
}
