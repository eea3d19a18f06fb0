package io.intellixity.sift.jdbc.dialect;

/** SQL:2008 dialect: double-quoted identifiers, {@code OFFSET ... ROWS FETCH NEXT ... ROWS ONLY}. Works on H2. */
public class AnsiSqlDialect extends AbstractSqlDialect {
  public static final String ID = "ansi";

  @Override public String id() { return ID; }

  @Override
  public String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyPage(String sql, int offset, int limit) {
    return sql + " OFFSET " + offset + " ROWS FETCH NEXT " + limit + " ROWS ONLY";
  }
}
