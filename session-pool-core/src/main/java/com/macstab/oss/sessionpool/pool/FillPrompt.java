/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.pool;

import java.util.Optional;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.UtilityClass;

/**
 * Fill-in-the-middle message format used by the completion pool.
 *
 * <p>The last few characters of the prefix are moved out of the visible text into a {@code
 * <completion_start>} block the model must echo back verbatim. Echo-back anchors the model at the
 * cursor; the echoed start is stripped again before the completion is returned.
 *
 * <pre>{@code
 * <current_text>{truncated prefix}>>>CURSOR<<<{suffix}</current_text>
 * <completion_start>{completion start}</completion_start>
 * }</pre>
 *
 * <p>A suffix that is blank after trimming is omitted entirely.
 */
@UtilityClass
public class FillPrompt {

  /** Characters moved from the prefix into the completion start (before word-boundary search). */
  public static final int COMPLETION_START_LENGTH = 10;

  public static final String CURSOR_MARKER = ">>>CURSOR<<<";

  private static final String OUTPUT_OPEN = "<output>";
  private static final String OUTPUT_CLOSE = "</output>";

  /** A built message together with the completion start the reply must begin with. */
  @Value
  public static class Message {
    String text;
    String completionStart;
  }

  /** Split of a prefix into visible text and echo-back anchor. */
  @Value
  public static class PrefixSplit {
    String truncatedPrefix;
    String completionStart;
  }

  public static Message build(@NonNull final String prefix, @NonNull final String suffix) {
    final var split = splitPrefix(prefix);
    final var currentText =
        suffix.trim().isEmpty()
            ? "<current_text>" + split.getTruncatedPrefix() + CURSOR_MARKER + "</current_text>"
            : "<current_text>" + split.getTruncatedPrefix() + CURSOR_MARKER + suffix + "</current_text>";
    final var text =
        currentText + "\n<completion_start>" + split.getCompletionStart() + "</completion_start>";
    return new Message(text, split.getCompletionStart());
  }

  /**
   * Cuts the prefix {@value #COMPLETION_START_LENGTH} characters from its end, moving the cut
   * forward to the first space or newline within the following {@value #COMPLETION_START_LENGTH}
   * characters so the visible text ends on a whole word.
   */
  public static PrefixSplit splitPrefix(@NonNull final String prefix) {
    if (prefix.length() <= COMPLETION_START_LENGTH) {
      return new PrefixSplit("", prefix);
    }
    final int idealCut = prefix.length() - COMPLETION_START_LENGTH;
    int cut = idealCut;
    final int limit = Math.min(prefix.length(), idealCut + COMPLETION_START_LENGTH);
    for (int i = idealCut; i < limit; i++) {
      final char c = prefix.charAt(i);
      if (c == ' ' || c == '\n') {
        cut = i;
        break;
      }
    }
    return new PrefixSplit(prefix.substring(0, cut), prefix.substring(cut));
  }

  /**
   * Returns the text between the first {@code <output>} and the last {@code </output>}, or the raw
   * text when the tags are missing or out of order.
   */
  public static String extractOutput(@NonNull final String raw) {
    final int open = raw.indexOf(OUTPUT_OPEN);
    final int close = raw.lastIndexOf(OUTPUT_CLOSE);
    if (open == -1 || close == -1 || close <= open) {
      return raw;
    }
    return raw.substring(open + OUTPUT_OPEN.length(), close);
  }

  /** Removes the echoed completion start; empty when the model did not echo it. */
  public static Optional<String> stripCompletionStart(
      @NonNull final String output, final String completionStart) {
    if (completionStart == null || completionStart.isEmpty()) {
      return Optional.of(output);
    }
    if (output.startsWith(completionStart)) {
      return Optional.of(output.substring(completionStart.length()));
    }
    return Optional.empty();
  }
}
