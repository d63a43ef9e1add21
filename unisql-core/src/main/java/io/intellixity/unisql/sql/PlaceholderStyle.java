package io.intellixity.unisql.sql;

/** Positional placeholder syntax rendered by {@link Sql#toStatement(PlaceholderStyle)}. */
public enum PlaceholderStyle {
  /** {@code $1, $2, ...} (Postgres family). */
  DOLLAR_NUMBERED,
  /** {@code :1, :2, ...}. */
  COLON_NUMBERED,
  /** {@code ?} repeated (MySQL, SQLite, JDBC). */
  QUESTION;

  String placeholder(int position1Based) {
    return switch (this) {
      case DOLLAR_NUMBERED -> "$" + position1Based;
      case COLON_NUMBERED -> ":" + position1Based;
      case QUESTION -> "?";
    };
  }
}
