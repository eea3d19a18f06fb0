package io.intellixity.sift.jdbc.dialect;

import io.intellixity.sift.jdbc.SqlStatement;
import io.intellixity.sift.spi.adapter.TargetAdapter;

/** SQL target adapter for JDBC engines. */
public interface SqlDialect extends TargetAdapter<SqlStatement> {
  /** Quotes an identifier (table, column or alias). */
  String quoteIdent(String ident);
}
