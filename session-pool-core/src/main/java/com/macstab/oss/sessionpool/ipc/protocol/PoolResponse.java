/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.macstab.oss.sessionpool.channel.ResultMetadata;
import com.macstab.oss.sessionpool.slot.PoolStats;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Server-to-client reply, correlated to its request by {@code id}.
 *
 * <p>{@code success == false} carries a human-readable {@code error}. {@link Error} answers
 * requests the server could decode far enough to read an id but not to handle.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = PoolResponse.Completion.class, name = "completion"),
  @JsonSubTypes.Type(value = PoolResponse.Command.class, name = "command"),
  @JsonSubTypes.Type(value = PoolResponse.Warmup.class, name = "warmup"),
  @JsonSubTypes.Type(value = PoolResponse.Recycle.class, name = "recycle"),
  @JsonSubTypes.Type(value = PoolResponse.Status.class, name = "status"),
  @JsonSubTypes.Type(value = PoolResponse.ConfigUpdate.class, name = "config-update"),
  @JsonSubTypes.Type(value = PoolResponse.Dispose.class, name = "dispose"),
  @JsonSubTypes.Type(value = PoolResponse.ClientHello.class, name = "client-hello"),
  @JsonSubTypes.Type(value = PoolResponse.Error.class, name = "error")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@Getter
@Setter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class PoolResponse {

  private String id;
  private boolean success;
  private String error;

  protected PoolResponse(final String id, final boolean success, final String error) {
    this.id = id;
    this.success = success;
    this.error = error;
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Completion extends PoolResponse {
    private String text;
    private ResultMetadata meta;

    public Completion(final String id, final String text, final ResultMetadata meta) {
      super(id, true, null);
      this.text = text;
      this.meta = meta;
    }

    public static Completion failed(final String id, final String error) {
      final var response = new Completion();
      response.setId(id);
      response.setError(error);
      return response;
    }
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Command extends PoolResponse {
    private String text;
    private ResultMetadata meta;

    public Command(final String id, final String text, final ResultMetadata meta) {
      super(id, true, null);
      this.text = text;
      this.meta = meta;
    }

    public static Command failed(final String id, final String error) {
      final var response = new Command();
      response.setId(id);
      response.setError(error);
      return response;
    }
  }

  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Warmup extends PoolResponse {
    public Warmup(final String id, final boolean success, final String error) {
      super(id, success, error);
    }
  }

  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Recycle extends PoolResponse {
    public Recycle(final String id, final boolean success, final String error) {
      super(id, success, error);
    }
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Status extends PoolResponse {
    private boolean completionPoolAvailable;
    private boolean commandPoolAvailable;
    private int connectedClients;
    private String model;
    private PoolStats completionPool;
    private PoolStats commandPool;

    public Status(final String id) {
      super(id, true, null);
    }
  }

  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class ConfigUpdate extends PoolResponse {
    public ConfigUpdate(final String id, final boolean success, final String error) {
      super(id, success, error);
    }
  }

  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Dispose extends PoolResponse {
    public Dispose(final String id) {
      super(id, true, null);
    }
  }

  @Getter
  @Setter
  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class ClientHello extends PoolResponse {
    private String serverId;
    private String model;

    public ClientHello(final String id, final String serverId, final String model) {
      super(id, true, null);
      this.serverId = serverId;
      this.model = model;
    }
  }

  @ToString(callSuper = true)
  @NoArgsConstructor
  public static class Error extends PoolResponse {
    public Error(final String id, final String error) {
      super(id, false, error);
    }
  }
}
