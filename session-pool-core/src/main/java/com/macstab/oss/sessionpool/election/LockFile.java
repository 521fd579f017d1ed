/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.election;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Leader lockfile holding {@code {"pid":..,"timestamp":..}}.
 *
 * <p><strong>Acquisition:</strong>
 *
 * <ol>
 *   <li>Read the existing record. A live foreign owner wins, acquisition fails.
 *   <li>A dead owner's record is deleted as stale.
 *   <li>Create the file exclusively ({@link StandardOpenOption#CREATE_NEW}). Losing that race means
 *       someone else won.
 *   <li>Re-read and confirm the file names this process.
 * </ol>
 *
 * <p><strong>Known race:</strong> two processes that both judge the same record stale may both
 * delete and recreate it. The verify step catches most interleavings; the remaining window is
 * accepted and surfaces as a failed socket bind on the loser.
 *
 * <p>An unreadable or half-written file reads as "no lock". Its owner is still racing to write it,
 * so the exclusive create in step 3 fails and acquisition reports {@code false}.
 */
@Slf4j
public final class LockFile {

  @Getter private final Path path;
  private final ProcessLiveness liveness;
  private final ObjectMapper mapper;
  private final Clock clock;

  public LockFile(@NonNull final Path path) {
    this(path, ProcessLiveness.SYSTEM, new ObjectMapper(), Clock.systemUTC());
  }

  public LockFile(@NonNull final Path path, @NonNull final ProcessLiveness liveness) {
    this(path, liveness, new ObjectMapper(), Clock.systemUTC());
  }

  public LockFile(
      @NonNull final Path path,
      @NonNull final ProcessLiveness liveness,
      @NonNull final ObjectMapper mapper,
      @NonNull final Clock clock) {
    this.path = path;
    this.liveness = liveness;
    this.mapper = mapper;
    this.clock = clock;
  }

  /**
   * Tries to become the lock owner.
   *
   * @return {@code true} when the file now names {@code pid}
   * @throws IOException if the lock directory cannot be created or the file cannot be written
   */
  public boolean tryAcquire(final long pid) throws IOException {
    final var existing = read();
    if (existing.isPresent()) {
      final long owner = existing.get().getPid();
      if (owner == pid) {
        return true;
      }
      if (liveness.isAlive(owner)) {
        log.debug("Lock {} held by live process {}", path, owner);
        return false;
      }
      log.info("Removing stale lock {} held by dead process {}", path, owner);
      Files.deleteIfExists(path);
    }

    Files.createDirectories(path.toAbsolutePath().getParent());
    try {
      Files.write(path, encode(pid), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    } catch (final FileAlreadyExistsException e) {
      log.debug("Lock {} created concurrently by another process", path);
      return false;
    }

    final boolean owned = read().map(record -> record.getPid() == pid).orElse(false);
    if (owned) {
      log.info("Acquired lock {} (pid {})", path, pid);
    } else {
      log.warn("Lock {} was replaced right after creation, not owned", path);
    }
    return owned;
  }

  /** Overwrites the lock unconditionally. Last resort when nothing answers on the socket. */
  public void forceAcquire(final long pid) throws IOException {
    Files.createDirectories(path.toAbsolutePath().getParent());
    Files.write(
        path,
        encode(pid),
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE);
    log.warn("Force-acquired lock {} (pid {})", path, pid);
  }

  /** Current record; empty when the file is missing or unreadable. */
  public Optional<LockRecord> read() {
    try {
      final var bytes = Files.readAllBytes(path);
      if (bytes.length == 0) {
        return Optional.empty();
      }
      return Optional.of(mapper.readValue(bytes, LockRecord.class));
    } catch (final NoSuchFileException e) {
      return Optional.empty();
    } catch (final IOException e) {
      log.debug("Lock {} unreadable: {}", path, e.getMessage());
      return Optional.empty();
    }
  }

  /** Whether the lock names a process that is still running. */
  public boolean isHeldByLiveProcess() {
    return read().map(record -> liveness.isAlive(record.getPid())).orElse(false);
  }

  /**
   * Deletes the lockfile unless it names another process. Failures are logged, never thrown.
   */
  public void release(final long pid) {
    final var current = read();
    if (current.isPresent() && current.get().getPid() != pid) {
      log.debug("Lock {} now owned by {}, left in place", path, current.get().getPid());
      return;
    }
    try {
      if (Files.deleteIfExists(path)) {
        log.debug("Released lock {}", path);
      }
    } catch (final IOException e) {
      log.warn("Failed to delete lock {}: {}", path, e.getMessage());
    }
  }

  private byte[] encode(final long pid) throws IOException {
    return mapper.writeValueAsBytes(
        LockRecord.builder().pid(pid).timestamp(clock.millis()).build());
  }
}
