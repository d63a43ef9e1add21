package io.intellixity.unisql.result;

import io.intellixity.unisql.driver.Operation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Driver-level result normalisation middleware.
 * <p>
 * Each hook receives the raw value plus a {@code next} continuation. A hook that does not apply
 * must defer to {@code next} unchanged; hooks never throw on unexpected shapes.
 */
public interface ResultParser {
  /** Pass-through parser for backends whose results are already canonical. */
  ResultParser NONE = new ResultParser() {};

  /** Whole-result hook, e.g. collapsing backend-specific count columns. */
  default Object parseResult(Object raw, Operation operation, ParseStep<Operation> next) {
    return next.apply(raw, operation);
  }

  /** Relation payload hook, e.g. JSON text produced by an embedded engine's json aggregation. */
  default Object parseRelation(Object value, RelationType type, ParseStep<RelationType> next) {
    return next.apply(value, type);
  }

  /** Scalar field hook, keyed by the declared field type ({@code boolean}, {@code json}, ...). */
  default Object parseField(Object value, String fieldType, ParseStep<String> next) {
    return next.apply(value, fieldType);
  }

  default Object parseResult(Object raw, Operation operation) {
    return parseResult(raw, operation, ParseStep.identity());
  }

  default Object parseRelation(Object value, RelationType type) {
    return parseRelation(value, type, ParseStep.identity());
  }

  default Object parseField(Object value, String fieldType) {
    return parseField(value, fieldType, ParseStep.identity());
  }

  /** Applies {@link #parseField} to every column with a declared type; other columns are copied as-is. */
  default Map<String, Object> parseRow(Map<String, Object> row, Map<String, String> fieldTypes) {
    if (row == null) return null;
    Map<String, Object> out = new LinkedHashMap<>(row.size());
    for (Map.Entry<String, Object> e : row.entrySet()) {
      String type = (fieldTypes == null) ? null : fieldTypes.get(e.getKey());
      out.put(e.getKey(), type == null ? e.getValue() : parseField(e.getValue(), type));
    }
    return out;
  }
}
