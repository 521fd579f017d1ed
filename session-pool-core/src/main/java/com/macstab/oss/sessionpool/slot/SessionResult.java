/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.slot;

import com.macstab.oss.sessionpool.channel.ResultMetadata;

import lombok.Value;

/**
 * Outcome of one dispatched request.
 *
 * <p>{@link #EMPTY} is the uniform "no result" value: displaced waiter, timeout, stream failure,
 * disposal. Callers never see an exception for those cases.
 */
@Value
public class SessionResult {

  public static final SessionResult EMPTY = new SessionResult(null, null);

  String text;
  ResultMetadata meta;

  public boolean isEmpty() {
    return text == null;
  }
}
