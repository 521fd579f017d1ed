/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

import java.io.UncheckedIOException;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.NonNull;

/**
 * Line codec for the backend's stream-json dialect.
 *
 * <p>Input lines wrap one user turn:
 *
 * <pre>{@code
 * {"type":"user","message":{"role":"user","content":"..."},"parent_tool_use_id":null,"session_id":""}
 * }</pre>
 *
 * <p>Output lines are arbitrary typed objects. Only {@code "type":"result"} carries anything the
 * pool needs: {@code subtype == "success"} plus a string {@code result} is a successful turn, every
 * other subtype is a failed turn. Usage counters are optional and default to zero.
 */
public final class StreamJsonCodec {

  private final ObjectMapper mapper;

  public StreamJsonCodec(@NonNull final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public StreamJsonCodec() {
    this(new ObjectMapper());
  }

  /** Encodes one user turn as a single line (no trailing newline). */
  public String encodeUserMessage(@NonNull final String content) {
    final ObjectNode root = mapper.createObjectNode();
    root.put("type", "user");
    final ObjectNode message = root.putObject("message");
    message.put("role", "user");
    message.put("content", content);
    root.putNull("parent_tool_use_id");
    root.put("session_id", "");
    try {
      return mapper.writeValueAsString(root);
    } catch (final JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Decodes one output line.
   *
   * @return the event, or empty when the line is not a JSON object with a {@code type}
   */
  public Optional<SessionEvent> decode(final String line) {
    if (line == null || line.isBlank()) {
      return Optional.empty();
    }
    final JsonNode node;
    try {
      node = mapper.readTree(line);
    } catch (final JsonProcessingException e) {
      return Optional.empty();
    }
    if (node == null || !node.isObject() || !node.path("type").isTextual()) {
      return Optional.empty();
    }
    final var type = node.get("type").asText();
    if (!SessionEvent.RESULT_TYPE.equals(type)) {
      return Optional.of(SessionEvent.other(type));
    }

    final var meta = readMetadata(node);
    final var result = node.path("result");
    if ("success".equals(node.path("subtype").asText()) && result.isTextual()) {
      return Optional.of(SessionEvent.result(result.asText(), meta));
    }
    return Optional.of(SessionEvent.failedResult(meta));
  }

  private static ResultMetadata readMetadata(final JsonNode node) {
    final var usage = node.path("usage");
    return ResultMetadata.builder()
        .durationMs(node.path("duration_ms").asLong(0))
        .durationApiMs(node.path("duration_api_ms").asLong(0))
        .costUsd(node.path("total_cost_usd").asDouble(0))
        .inputTokens(usage.path("input_tokens").asLong(0))
        .outputTokens(usage.path("output_tokens").asLong(0))
        .cacheReadTokens(usage.path("cache_read_input_tokens").asLong(0))
        .cacheCreationTokens(usage.path("cache_creation_input_tokens").asLong(0))
        .sessionId(node.path("session_id").isTextual() ? node.get("session_id").asText() : null)
        .build();
  }
}
