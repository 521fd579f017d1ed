/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc.protocol;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The two pools hosted by a pool server. */
public enum PoolKind {
  COMPLETION,
  COMMAND;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static PoolKind fromWireName(final String value) {
    return PoolKind.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
