package io.intellixity.sift.spi.adapter;

/** Backend query produced by a {@link TargetAdapter}. */
public interface NativeStatement {
  /** Rendered query text (SQL, pipeline JSON, plan listing); stable for a given plan. */
  String text();
}
