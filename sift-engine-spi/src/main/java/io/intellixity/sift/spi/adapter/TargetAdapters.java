package io.intellixity.sift.spi.adapter;

import io.intellixity.sift.util.SiftFactoriesLoader;

import java.util.ArrayList;
import java.util.List;

/** Looks up adapters registered in {@code META-INF/sift.factories}. */
public final class TargetAdapters {
  private TargetAdapters() {}

  @SuppressWarnings("rawtypes")
  public static List<TargetAdapter<?>> discover() {
    List<TargetAdapter> raw = SiftFactoriesLoader.load(TargetAdapter.class);
    List<TargetAdapter<?>> out = new ArrayList<>(raw.size());
    for (TargetAdapter a : raw) out.add(a);
    return out;
  }

  /** Finds a discovered adapter by id. */
  public static TargetAdapter<?> byId(String id) {
    for (TargetAdapter<?> a : discover()) {
      if (a.id().equals(id)) return a;
    }
    throw new IllegalArgumentException("No target adapter registered with id '" + id + "'");
  }
}
