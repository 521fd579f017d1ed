/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.election;

/**
 * Answers whether a process id belongs to a running process.
 *
 * <p>{@link #SYSTEM} asks the operating system. Tests substitute a table of simulated processes so
 * several "processes" can compete for leadership inside one JVM.
 */
@FunctionalInterface
public interface ProcessLiveness {

  ProcessLiveness SYSTEM = pid -> ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);

  boolean isAlive(long pid);

  static long currentPid() {
    return ProcessHandle.current().pid();
  }
}
