/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc.protocol;

import java.io.IOException;

/** A line that is not valid JSON or does not match any known message type. */
public class MalformedFrameException extends IOException {

  private static final long serialVersionUID = 1L;

  public MalformedFrameException(final String message, final Throwable cause) {
    super(message, cause);
  }

  public MalformedFrameException(final String message) {
    super(message);
  }
}
