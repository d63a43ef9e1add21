package io.intellixity.unisql.error;

import java.util.List;
import java.util.Map;

/** A write referenced a missing parent row, or removed a parent row that is still referenced. */
public class ForeignKeyException extends QueryException {
  private final String constraint;
  private final String table;

  public ForeignKeyException(String message, String constraint, String table,
                             String nativeCode, String sql, List<?> params, Throwable cause) {
    super(message, ErrorCode.FOREIGN_KEY_CONSTRAINT, nativeCode, sql, params, cause);
    this.constraint = constraint;
    this.table = table;
  }

  public String constraint() { return constraint; }

  public String table() { return table; }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> out = super.toMap();
    if (constraint != null) out.put("constraint", constraint);
    if (table != null) out.put("table", table);
    return out;
  }
}
