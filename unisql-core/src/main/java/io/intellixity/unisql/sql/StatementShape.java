package io.intellixity.unisql.sql;

import java.util.Locale;
import java.util.regex.Pattern;

/** Decides whether a statement returns rows or only an affected-row count. */
public enum StatementShape {
  /** Leading SELECT/WITH, or a RETURNING clause. {@code rowCount} is the number of rows returned. */
  HAS_ROWS,
  /** Everything else. {@code rowCount} is the number of rows affected. */
  AFFECTS_ROWS;

  private static final Pattern RETURNING = Pattern.compile("\\bRETURNING\\b");

  public static StatementShape of(String sql) {
    if (sql == null) return AFFECTS_ROWS;
    String normalized = sql.trim().toUpperCase(Locale.ROOT);
    if (normalized.startsWith("SELECT") || normalized.startsWith("WITH")) return HAS_ROWS;
    if (RETURNING.matcher(normalized).find()) return HAS_ROWS;
    return AFFECTS_ROWS;
  }

  public boolean hasRows() { return this == HAS_ROWS; }
}
