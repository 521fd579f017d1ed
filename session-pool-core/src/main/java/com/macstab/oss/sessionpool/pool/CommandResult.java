/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.pool;

import java.util.Optional;

import com.macstab.oss.sessionpool.channel.ResultMetadata;

import lombok.Value;

/** Reply to a one-shot command. {@code text} is {@code null} when nothing came back. */
@Value
public class CommandResult {

  public static final CommandResult EMPTY = new CommandResult(null, null);

  String text;
  ResultMetadata meta;

  public Optional<String> text() {
    return Optional.ofNullable(text);
  }

  public boolean isEmpty() {
    return text == null;
  }
}
