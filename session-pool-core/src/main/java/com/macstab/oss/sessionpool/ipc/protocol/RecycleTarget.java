/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc.protocol;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Which pool(s) a recycle request addresses. */
public enum RecycleTarget {
  COMPLETION,
  COMMAND,
  ALL;

  public boolean includes(final PoolKind kind) {
    return this == ALL || name().equals(kind.name());
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static RecycleTarget fromWireName(final String value) {
    return RecycleTarget.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
