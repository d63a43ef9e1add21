package io.intellixity.unisql.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** A statement was rejected or failed while executing. Carries the SQL and params for diagnostics. */
public class QueryException extends DriverException {
  private final String sql;
  private final List<Object> params;

  public QueryException(String message, String sql, List<?> params) {
    this(message, ErrorCode.QUERY_FAILED, null, sql, params, null);
  }

  public QueryException(String message, ErrorCode code, String nativeCode, String sql, List<?> params, Throwable cause) {
    super(message, code, nativeCode, cause);
    this.sql = sql;
    this.params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public String sql() { return sql; }

  public List<Object> params() { return params; }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> out = super.toMap();
    if (sql != null) out.put("sql", sql);
    return out;
  }
}
