/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.pool;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Editor state around the cursor for one completion request.
 *
 * <p>Only {@code prefix} and {@code suffix} shape the prompt. The remaining fields travel with the
 * request for logging and for callers that post-process per language.
 */
@Value
@Builder
public class CompletionContext {

  @NonNull String prefix;

  @Builder.Default @NonNull String suffix = "";

  @Builder.Default @NonNull Mode mode = Mode.PROSE;

  String languageId;
  String fileName;
  String filePath;

  public static CompletionContext of(final String prefix, final String suffix) {
    return CompletionContext.builder().prefix(prefix).suffix(suffix).build();
  }

  /** Whether the text around the cursor is prose or source code. */
  public enum Mode {
    PROSE,
    CODE;

    @JsonValue
    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Mode fromWireName(final String value) {
      return value == null ? PROSE : Mode.valueOf(value.toUpperCase(Locale.ROOT));
    }
  }
}
