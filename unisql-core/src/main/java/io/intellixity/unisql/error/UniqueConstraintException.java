package io.intellixity.unisql.error;

import java.util.List;
import java.util.Map;

/** A write violated a unique index or primary key. */
public class UniqueConstraintException extends QueryException {
  private final String constraint;
  private final String table;
  private final List<String> columns;

  public UniqueConstraintException(String message, String constraint, String table, List<String> columns,
                                   String nativeCode, String sql, List<?> params, Throwable cause) {
    super(message, ErrorCode.UNIQUE_CONSTRAINT, nativeCode, sql, params, cause);
    this.constraint = constraint;
    this.table = table;
    this.columns = (columns == null) ? List.of() : List.copyOf(columns);
  }

  /** Constraint or index name, when the backend reports it. */
  public String constraint() { return constraint; }

  public String table() { return table; }

  public List<String> columns() { return columns; }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> out = super.toMap();
    if (constraint != null) out.put("constraint", constraint);
    if (table != null) out.put("table", table);
    if (!columns.isEmpty()) out.put("columns", columns);
    return out;
  }
}
