package io.intellixity.sift.jdbc.postgres;

import io.intellixity.sift.jdbc.dialect.AbstractSqlDialect;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public static final String ID = "postgres";

  @Override public String id() { return ID; }

  @Override
  public String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyPage(String sql, int offset, int limit) {
    return sql + " LIMIT " + limit + " OFFSET " + offset;
  }

  @Override
  protected String doubleType() {
    return "float8";
  }
}
