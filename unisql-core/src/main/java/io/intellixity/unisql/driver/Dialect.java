package io.intellixity.unisql.driver;

import io.intellixity.unisql.sql.PlaceholderStyle;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/** SQL backend family: placeholder syntax plus the isolation keywords it understands. */
public enum Dialect {
  POSTGRESQL("postgresql", PlaceholderStyle.DOLLAR_NUMBERED, true),
  MYSQL("mysql", PlaceholderStyle.QUESTION, true),
  SQLITE("sqlite", PlaceholderStyle.QUESTION, false);

  private final String id;
  private final PlaceholderStyle placeholderStyle;
  private final boolean isolationSyntax;

  Dialect(String id, PlaceholderStyle placeholderStyle, boolean isolationSyntax) {
    this.id = id;
    this.placeholderStyle = placeholderStyle;
    this.isolationSyntax = isolationSyntax;
  }

  public String id() { return id; }

  public PlaceholderStyle placeholderStyle() { return placeholderStyle; }

  /** False for engines without per-transaction isolation syntax (SQLite is always serializable). */
  public boolean supportsIsolationSyntax() { return isolationSyntax; }

  private static final Map<IsolationLevel, String> ISOLATION_KEYWORDS = new EnumMap<>(Map.of(
      IsolationLevel.READ_UNCOMMITTED, "READ UNCOMMITTED",
      IsolationLevel.READ_COMMITTED, "READ COMMITTED",
      IsolationLevel.REPEATABLE_READ, "REPEATABLE READ",
      IsolationLevel.SERIALIZABLE, "SERIALIZABLE"
  ));

  /**
   * Statement that sets the isolation level of the current transaction, or null when this dialect
   * has no syntax for it.
   */
  public String setIsolationStatement(IsolationLevel level) {
    Objects.requireNonNull(level, "level");
    if (!isolationSyntax) return null;
    return "SET TRANSACTION ISOLATION LEVEL " + ISOLATION_KEYWORDS.get(level);
  }

  public static Dialect fromId(String id) {
    Objects.requireNonNull(id, "id");
    for (Dialect d : values()) {
      if (d.id.equalsIgnoreCase(id)) return d;
    }
    throw new IllegalArgumentException("Unknown dialect: " + id);
  }
}
