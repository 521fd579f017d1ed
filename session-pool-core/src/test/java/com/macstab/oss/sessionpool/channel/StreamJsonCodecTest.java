/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("StreamJsonCodec")
class StreamJsonCodecTest {

  private final StreamJsonCodec codec = new StreamJsonCodec();
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  @DisplayName("encodes a user turn on a single line")
  void encodeUserMessage_SingleLine() throws Exception {
    // Act
    final var line = codec.encodeUserMessage("line one\nline \"two\"");

    // Assert
    assertThat(line).doesNotContain("\n");
    final var node = mapper.readTree(line);
    assertThat(node.path("type").asText()).isEqualTo("user");
    assertThat(node.path("message").path("role").asText()).isEqualTo("user");
    assertThat(node.path("message").path("content").asText()).isEqualTo("line one\nline \"two\"");
    assertThat(node.path("parent_tool_use_id").isNull()).isTrue();
    assertThat(node.path("session_id").asText()).isEmpty();
  }

  @Test
  @DisplayName("decodes a successful result with usage")
  void decode_SuccessfulResult() {
    // Arrange
    final var line =
        "{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"pong\",\"duration_ms\":120,"
            + "\"duration_api_ms\":100,\"total_cost_usd\":0.002,\"session_id\":\"s-1\","
            + "\"usage\":{\"input_tokens\":12,\"output_tokens\":3,"
            + "\"cache_read_input_tokens\":40,\"cache_creation_input_tokens\":5}}";

    // Act
    final var event = codec.decode(line);

    // Assert
    assertThat(event).hasValueSatisfying(
        e -> {
          assertThat(e.isResult()).isTrue();
          assertThat(e.isSuccess()).isTrue();
          assertThat(e.getText()).isEqualTo("pong");
          assertThat(e.getMeta().getDurationMs()).isEqualTo(120);
          assertThat(e.getMeta().getDurationApiMs()).isEqualTo(100);
          assertThat(e.getMeta().getCostUsd()).isEqualTo(0.002);
          assertThat(e.getMeta().getInputTokens()).isEqualTo(12);
          assertThat(e.getMeta().getOutputTokens()).isEqualTo(3);
          assertThat(e.getMeta().getCacheReadTokens()).isEqualTo(40);
          assertThat(e.getMeta().getCacheCreationTokens()).isEqualTo(5);
          assertThat(e.getMeta().getSessionId()).isEqualTo("s-1");
        });
  }

  @Test
  @DisplayName("an error subtype is a failed result")
  void decode_ErrorSubtype_Failed() {
    // Act
    final var event = codec.decode("{\"type\":\"result\",\"subtype\":\"error_during_execution\"}");

    // Assert
    assertThat(event).hasValueSatisfying(
        e -> {
          assertThat(e.isResult()).isTrue();
          assertThat(e.isSuccess()).isFalse();
          assertThat(e.getText()).isNull();
          assertThat(e.getMeta().getInputTokens()).isZero();
        });
  }

  @Test
  @DisplayName("other typed lines decode to non-result events")
  void decode_OtherType() {
    assertThat(codec.decode("{\"type\":\"assistant\",\"message\":{}}"))
        .hasValueSatisfying(e -> assertThat(e.isResult()).isFalse());
  }

  @Test
  @DisplayName("garbage, blank and untyped lines are skipped")
  void decode_Garbage_Empty() {
    assertThat(codec.decode("not json")).isEmpty();
    assertThat(codec.decode("   ")).isEmpty();
    assertThat(codec.decode("[1,2]")).isEmpty();
    assertThat(codec.decode("{\"subtype\":\"success\"}")).isEmpty();
  }
}
