package io.intellixity.sift.jdbc;

import io.intellixity.sift.spi.adapter.NativeStatement;

import java.util.List;

/**
 * Compiled SQL with {@code ?} placeholders and its binds in placeholder order.
 *
 * @param guards result columns holding MIN, MAX or AVERAGE aggregates; a NULL there means the
 *               aggregate saw no values and the row must fail instead of being returned
 */
public record SqlStatement(String sql, List<Bind> binds, List<Guard> guards) implements NativeStatement {
  public record Guard(int column, String function, String field) {}

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    guards = guards == null ? List.of() : List.copyOf(guards);
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, List.of());
  }

  @Override
  public String text() { return sql; }
}
