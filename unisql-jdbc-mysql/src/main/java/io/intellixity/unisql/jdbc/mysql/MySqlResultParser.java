package io.intellixity.unisql.jdbc.mysql;

import io.intellixity.unisql.driver.Operation;
import io.intellixity.unisql.result.ParseStep;
import io.intellixity.unisql.result.RelationType;
import io.intellixity.unisql.result.ResultParser;
import io.intellixity.unisql.result.ResultParsing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MySQL returns JSON columns as text and aggregates as {@code BigDecimal}; booleans live in
 * {@code TINYINT(1)} and arrive as integers unless the connection maps them.
 */
public final class MySqlResultParser implements ResultParser {
  public static final MySqlResultParser INSTANCE = new MySqlResultParser();

  @Override
  public Object parseResult(Object raw, Operation operation, ParseStep<Operation> next) {
    if (operation == Operation.COUNT || operation == Operation.EXIST) {
      Optional<List<Map<String, Object>>> normalized = ResultParsing.normalizeCountResult(raw);
      if (normalized.isPresent()) {
        Map<String, Object> row = new LinkedHashMap<>(normalized.get().get(0));
        Object count = row.get(ResultParsing.COUNT_RESULT_KEY);
        ResultParsing.toLongCount(count).ifPresent(n -> row.put(ResultParsing.COUNT_RESULT_KEY, n));
        return next.apply(List.of(row), operation);
      }
    }
    return next.apply(raw, operation);
  }

  @Override
  public Object parseRelation(Object value, RelationType type, ParseStep<RelationType> next) {
    return next.apply(ResultParsing.tryParseJsonString(value).orElse(value), type);
  }

  @Override
  public Object parseField(Object value, String fieldType, ParseStep<String> next) {
    if ("boolean".equals(fieldType)) {
      Optional<Boolean> parsed = ResultParsing.parseIntegerBoolean(value);
      if (parsed.isPresent()) return parsed.get();
    }
    if ("json".equals(fieldType)) {
      Optional<Object> parsed = ResultParsing.tryParseJsonString(value);
      if (parsed.isPresent()) return parsed.get();
    }
    return next.apply(value, fieldType);
  }
}
