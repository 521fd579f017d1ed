/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc;

import java.util.Locale;

/** Role of a process in the cooperating group: exactly one server, everyone else a client. */
public enum PoolRole {
  SERVER,
  CLIENT;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
