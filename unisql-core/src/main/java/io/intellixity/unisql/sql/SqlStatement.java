package io.intellixity.unisql.sql;

import java.util.List;
import java.util.Objects;

/** Rendered statement text plus its ordered parameter values. */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    params = (params == null) ? List.of() : params;
  }
}
