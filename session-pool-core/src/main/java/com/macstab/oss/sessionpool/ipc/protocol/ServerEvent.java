/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/** Unsolicited server-to-client notification. Events never carry an {@code id}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ServerEvent.ShuttingDown.class, name = "server-shutting-down"),
  @JsonSubTypes.Type(value = ServerEvent.PoolDegraded.class, name = "pool-degraded")
})
@ToString
public abstract class ServerEvent {

  /** The server is going away; clients should start a takeover. */
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class ShuttingDown extends ServerEvent {}

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class PoolDegraded extends ServerEvent {
    private PoolKind pool;

    public PoolDegraded(final PoolKind pool) {
      this.pool = pool;
    }
  }
}
