package io.intellixity.sift.memory;

import io.intellixity.sift.exec.handle.EngineHandle;

import java.util.Objects;

public record InMemoryHandle(String id, RowSource client, String namespace) implements EngineHandle<RowSource> {
  public InMemoryHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(client, "client");
  }

  public InMemoryHandle(String id, RowSource client) {
    this(id, client, null);
  }
}
