package io.intellixity.unisql.jdbc;

import io.intellixity.unisql.sql.SqlStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites numbered placeholders ({@code $1}, {@code :1}) into JDBC {@code ?} binds, reordering and
 * repeating parameter values to match.
 *
 * Rules:
 * - {@code $n} and {@code :n} with n >= 1 are placeholders.\n
 * - {@code ::} is a cast, never a placeholder.\n
 * - Anything inside single quotes or double-quoted identifiers is left alone.\n
 * - SQL without numbered placeholders is returned unchanged with its params.\n
 */
public final class JdbcPlaceholders {
  private JdbcPlaceholders() {}

  public static SqlStatement toJdbc(String sql, List<Object> params) {
    List<Object> values = (params == null) ? List.of() : params;
    if (sql == null || (sql.indexOf('$') < 0 && sql.indexOf(':') < 0)) {
      return new SqlStatement(sql == null ? "" : sql, values);
    }

    StringBuilder out = new StringBuilder(sql.length());
    List<Object> ordered = new ArrayList<>();
    boolean numbered = false;
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' && !inDoubleQuote) {
        // '' escape stays inside the literal
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }
      if (ch == '"' && !inSingleQuote) {
        inDoubleQuote = !inDoubleQuote;
        out.append(ch);
        continue;
      }
      if (inSingleQuote || inDoubleQuote) {
        out.append(ch);
        continue;
      }

      if (ch == ':' && i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
        out.append("::");
        i++;
        continue;
      }

      if ((ch == '$' || ch == ':') && i + 1 < sql.length() && isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && isDigit(sql.charAt(end))) end++;
        int n = Integer.parseInt(sql.substring(i + 1, end));
        if (n < 1 || n > values.size()) {
          throw new IllegalArgumentException("Placeholder " + sql.substring(i, end)
              + " has no matching parameter; " + values.size() + " given");
        }
        ordered.add(values.get(n - 1));
        out.append('?');
        numbered = true;
        i = end - 1;
        continue;
      }

      out.append(ch);
    }

    return numbered ? new SqlStatement(out.toString(), ordered) : new SqlStatement(sql, values);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
