/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.pool;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.io.UncheckedIOException;

import lombok.experimental.UtilityClass;

/** Loads system prompts shipped next to this class. */
@UtilityClass
class Prompts {

  static String load(final String resource) {
    try (var in = Prompts.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing prompt resource: " + resource);
      }
      return new String(in.readAllBytes(), UTF_8).strip();
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read prompt resource: " + resource, e);
    }
  }
}
