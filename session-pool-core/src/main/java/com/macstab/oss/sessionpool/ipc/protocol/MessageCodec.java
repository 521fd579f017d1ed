/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc.protocol;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import lombok.NonNull;

/**
 * Newline-delimited JSON codec for the pool IPC protocol.
 *
 * <p><strong>Framing:</strong> one JSON object per line, UTF-8. {@link #encode(Object)} returns the
 * object without the terminating newline; the connection appends it.
 *
 * <p><strong>Classification:</strong> inbound server frames are told apart structurally. A frame
 * with an {@code id} is a {@link PoolResponse}, a frame without one is a {@link ServerEvent}.
 *
 * <p>Unknown properties are ignored so older peers can read newer messages. Unknown {@code type}
 * values are rejected.
 */
public final class MessageCodec {

  private final ObjectMapper mapper;

  public MessageCodec() {
    this(
        JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build());
  }

  public MessageCodec(@NonNull final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public String encode(@NonNull final Object message) throws JsonProcessingException {
    return mapper.writeValueAsString(message);
  }

  public PoolRequest decodeRequest(final String line) throws MalformedFrameException {
    final var node = readObject(line);
    try {
      return mapper.treeToValue(node, PoolRequest.class);
    } catch (final JsonProcessingException e) {
      throw new MalformedFrameException("Not a valid request: " + e.getOriginalMessage(), e);
    }
  }

  public InboundFrame decodeInbound(final String line) throws MalformedFrameException {
    final var node = readObject(line);
    try {
      if (node.hasNonNull("id")) {
        return InboundFrame.of(mapper.treeToValue(node, PoolResponse.class));
      }
      return InboundFrame.of(mapper.treeToValue(node, ServerEvent.class));
    } catch (final JsonProcessingException e) {
      throw new MalformedFrameException("Not a valid server frame: " + e.getOriginalMessage(), e);
    }
  }

  /** Best-effort id of a frame that failed to decode, so the sender can still be answered. */
  public Optional<String> peekId(final String line) {
    try {
      final var node = readObject(line);
      final var id = node.get("id");
      return id != null && id.isTextual() ? Optional.of(id.asText()) : Optional.empty();
    } catch (final MalformedFrameException e) {
      return Optional.empty();
    }
  }

  private JsonNode readObject(final String line) throws MalformedFrameException {
    if (line == null || line.isBlank()) {
      throw new MalformedFrameException("Empty frame");
    }
    final JsonNode node;
    try {
      node = mapper.readTree(line);
    } catch (final JsonProcessingException e) {
      throw new MalformedFrameException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new MalformedFrameException("Frame is not a JSON object");
    }
    return node;
  }
}
