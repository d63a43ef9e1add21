package io.intellixity.unisql.driver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** One element of a batch request: raw SQL using the driver's placeholder style, plus ordered values. */
public record BatchQuery(String sql, List<Object> params) {
  public BatchQuery {
    Objects.requireNonNull(sql, "sql");
    params = (params == null || params.isEmpty())
        ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public BatchQuery(String sql) {
    this(sql, List.of());
  }

  public static BatchQuery of(String sql, Object... params) {
    return new BatchQuery(sql, params == null ? List.of() : Arrays.asList(params));
  }
}
