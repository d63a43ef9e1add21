package io.intellixity.unisql.result;

import io.intellixity.unisql.driver.Operation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalises results from SQLite-family engines, embedded or behind HTTP: count columns renamed for
 * count/exist, relation payloads built with json_group_array parsed from text, and 0/1 integers
 * turned into booleans for boolean fields.
 */
public final class SqliteResultParser implements ResultParser {
  public static final SqliteResultParser INSTANCE = new SqliteResultParser();

  @Override
  public Object parseResult(Object raw, Operation operation, ParseStep<Operation> next) {
    if (operation == Operation.COUNT || operation == Operation.EXIST) {
      Optional<List<Map<String, Object>>> normalized = ResultParsing.normalizeCountResult(raw);
      if (normalized.isPresent()) return next.apply(normalized.get(), operation);
    }
    return next.apply(raw, operation);
  }

  @Override
  public Object parseRelation(Object value, RelationType type, ParseStep<RelationType> next) {
    Optional<Object> parsed = ResultParsing.tryParseJsonString(value);
    return next.apply(parsed.orElse(value), type);
  }

  @Override
  public Object parseField(Object value, String fieldType, ParseStep<String> next) {
    if ("boolean".equals(fieldType)) {
      Optional<Boolean> parsed = ResultParsing.parseIntegerBoolean(value);
      if (parsed.isPresent()) return parsed.get();
    }
    return next.apply(value, fieldType);
  }
}
