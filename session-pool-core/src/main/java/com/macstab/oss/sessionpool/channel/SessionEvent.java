/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * One structured event read from a backend session.
 *
 * <p>Only {@code result} events matter to the pool. A successful result carries the response text;
 * a failed result ({@code success == false}) carries no text but still terminates the turn.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SessionEvent {

  public static final String RESULT_TYPE = "result";

  @NonNull String type;
  boolean success;
  String text;
  @NonNull ResultMetadata meta;

  public static SessionEvent result(final String text, final ResultMetadata meta) {
    return new SessionEvent(RESULT_TYPE, text != null, text, meta != null ? meta : ResultMetadata.NONE);
  }

  public static SessionEvent failedResult(final ResultMetadata meta) {
    return new SessionEvent(RESULT_TYPE, false, null, meta != null ? meta : ResultMetadata.NONE);
  }

  public static SessionEvent other(@NonNull final String type) {
    return new SessionEvent(type, false, null, ResultMetadata.NONE);
  }

  public boolean isResult() {
    return RESULT_TYPE.equals(type);
  }
}
