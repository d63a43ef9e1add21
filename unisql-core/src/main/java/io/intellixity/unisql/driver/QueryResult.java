package io.intellixity.unisql.driver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical result of one statement.
 * <p>
 * {@code rowCount} is the number of rows returned for reads and the number of rows affected for
 * writes.
 */
public record QueryResult(List<Map<String, Object>> rows, long rowCount) {
  public QueryResult {
    if (rows == null || rows.isEmpty()) {
      rows = List.of();
    } else {
      List<Map<String, Object>> copy = new ArrayList<>(rows.size());
      // Row maps may hold SQL NULLs, so Map.copyOf is not an option.
      for (Map<String, Object> r : rows) copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
      rows = Collections.unmodifiableList(copy);
    }
  }

  public static QueryResult ofRows(List<Map<String, Object>> rows) {
    return new QueryResult(rows, rows == null ? 0 : rows.size());
  }

  public static QueryResult affected(long rowCount) {
    return new QueryResult(List.of(), rowCount);
  }

  public static QueryResult empty() {
    return new QueryResult(List.of(), 0);
  }

  public Map<String, Object> firstRowOrNull() {
    return rows.isEmpty() ? null : rows.get(0);
  }
}
