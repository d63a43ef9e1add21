package io.intellixity.unisql.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.sql.StatementShape;

import java.util.List;
import java.util.Map;

/** Envelope returned by the D1 query endpoint, for single statements and batches alike. */
@JsonIgnoreProperties(ignoreUnknown = true)
record D1Response(boolean success, List<Result> result, List<ApiError> errors) {

  D1Response {
    result = (result == null) ? List.of() : result;
    errors = (errors == null) ? List.of() : errors;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Result(List<Map<String, Object>> results, boolean success, Meta meta) {

    /** rowCount is the number of returned rows for row-returning statements, {@code meta.changes} otherwise. */
    QueryResult toQueryResult(String sql) {
      List<Map<String, Object>> rows = (results == null) ? List.of() : results;
      if (StatementShape.of(sql).hasRows()) return new QueryResult(rows, rows.size());
      return new QueryResult(rows, (meta == null) ? 0 : meta.changes());
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Meta(long changes, double duration) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ApiError(int code, String message) {}
}
