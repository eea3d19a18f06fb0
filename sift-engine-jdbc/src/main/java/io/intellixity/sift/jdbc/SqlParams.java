package io.intellixity.sift.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rewrites SQL with named parameters ({@code :b1}) into JDBC SQL with {@code ?} placeholders.
 *
 * Rules:\n
 * - Params are ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is a cast, not a param\n
 * - Params inside single-quoted literals or double-quoted identifiers are ignored\n
 */
public final class SqlParams {
  private SqlParams() {}

  /** Rewrites {@code sql} and orders the named binds by their appearance; a name used twice is bound twice. */
  public static SqlStatement compile(String sql, Map<String, Bind> named, List<SqlStatement.Guard> guards) {
    StringBuilder out = new StringBuilder(sql.length());
    List<Bind> binds = new ArrayList<>();
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          // doubled quote is an escape
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }
      if (ch == '\'' || ch == '"') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          String name = sql.substring(start, end);
          Bind b = named.get(name);
          if (b == null) throw new IllegalArgumentException("Missing query param: " + name);
          binds.add(b);
          out.append('?');
          i = end - 1;
          continue;
        }
      }
      out.append(ch);
    }
    return new SqlStatement(out.toString(), binds, guards);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
