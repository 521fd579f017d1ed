/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.macstab.oss.sessionpool.pool.CompletionContext;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Client-to-server request. Every request carries a correlation {@code id} echoed by exactly one
 * {@link PoolResponse}.
 *
 * <p>The {@code type} property selects the subtype. Unknown types fail decoding.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = PoolRequest.Completion.class, name = "completion"),
  @JsonSubTypes.Type(value = PoolRequest.Command.class, name = "command"),
  @JsonSubTypes.Type(value = PoolRequest.Warmup.class, name = "warmup"),
  @JsonSubTypes.Type(value = PoolRequest.Recycle.class, name = "recycle"),
  @JsonSubTypes.Type(value = PoolRequest.Status.class, name = "status"),
  @JsonSubTypes.Type(value = PoolRequest.ConfigUpdate.class, name = "config-update"),
  @JsonSubTypes.Type(value = PoolRequest.Dispose.class, name = "dispose"),
  @JsonSubTypes.Type(value = PoolRequest.ClientHello.class, name = "client-hello")
})
@Getter
@Setter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class PoolRequest {

  private String id;

  protected PoolRequest(final String id) {
    this.id = id;
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Completion extends PoolRequest {
    private String prefix;
    private String suffix;
    private CompletionContext.Mode mode;
    private String languageId;
    private String fileName;
    private String filePath;

    public static Completion of(final String id, final CompletionContext context) {
      final var request = new Completion();
      request.setId(id);
      request.prefix = context.getPrefix();
      request.suffix = context.getSuffix();
      request.mode = context.getMode();
      request.languageId = context.getLanguageId();
      request.fileName = context.getFileName();
      request.filePath = context.getFilePath();
      return request;
    }

    public CompletionContext toContext() {
      return CompletionContext.builder()
          .prefix(prefix != null ? prefix : "")
          .suffix(suffix != null ? suffix : "")
          .mode(mode != null ? mode : CompletionContext.Mode.PROSE)
          .languageId(languageId)
          .fileName(fileName)
          .filePath(filePath)
          .build();
    }
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Command extends PoolRequest {
    private String message;
    private Long timeoutMs;

    public Command(final String id, final String message, final Long timeoutMs) {
      super(id);
      this.message = message;
      this.timeoutMs = timeoutMs;
    }
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Warmup extends PoolRequest {
    private PoolKind pool;

    public Warmup(final String id, final PoolKind pool) {
      super(id);
      this.pool = pool;
    }
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Recycle extends PoolRequest {
    private RecycleTarget pool;

    public Recycle(final String id, final RecycleTarget pool) {
      super(id);
      this.pool = pool;
    }
  }

  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Status extends PoolRequest {
    public Status(final String id) {
      super(id);
    }
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class ConfigUpdate extends PoolRequest {
    private String model;

    public ConfigUpdate(final String id, final String model) {
      super(id);
      this.model = model;
    }
  }

  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Dispose extends PoolRequest {
    public Dispose(final String id) {
      super(id);
    }
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class ClientHello extends PoolRequest {
    private String clientId;

    public ClientHello(final String id, final String clientId) {
      super(id);
      this.clientId = clientId;
    }
  }
}
