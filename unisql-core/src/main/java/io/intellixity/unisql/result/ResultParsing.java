package io.intellixity.unisql.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.unisql.driver.QueryResult;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shared helpers for adapter result parsers. An empty {@link Optional} means "not handled": the
 * caller falls through to {@code next}.
 */
public final class ResultParsing {
  /** Canonical column name for count results. */
  public static final String COUNT_RESULT_KEY = "_result";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ResultParsing() {}

  /** Parses JSON object/array text (MySQL and SQLite return JSON as strings). */
  public static Optional<Object> tryParseJsonString(Object value) {
    if (!(value instanceof String s)) return Optional.empty();
    String trimmed = s.trim();
    boolean looksJson = (trimmed.startsWith("[") && trimmed.endsWith("]"))
        || (trimmed.startsWith("{") && trimmed.endsWith("}"));
    if (!looksJson) return Optional.empty();
    try {
      return Optional.ofNullable(MAPPER.readValue(trimmed, Object.class));
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  /**
   * 0/1 integer to boolean. Only numbers are handled; {@code null} is left to the caller, which
   * keeps it as SQL NULL.
   */
  public static Optional<Boolean> parseIntegerBoolean(Object value) {
    if (value instanceof Number n) return Optional.of(n.doubleValue() == 1d);
    return Optional.empty();
  }

  /** Wide integer types (BigInteger, BigDecimal with no fraction) collapsed to long. */
  public static Optional<Long> toLongCount(Object value) {
    try {
      if (value instanceof BigInteger bi) return Optional.of(bi.longValueExact());
      if (value instanceof BigDecimal bd) return Optional.of(bd.longValueExact());
    } catch (ArithmeticException e) {
      // out of range or fractional: keep the original value
      return Optional.empty();
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return Optional.of(((Number) value).longValue());
    }
    return Optional.empty();
  }

  /**
   * Renames a {@code count}/{@code COUNT(*)} style column to {@link #COUNT_RESULT_KEY}.
   * Accepts a {@link QueryResult}, a list of rows or a single row.
   */
  public static Optional<List<Map<String, Object>>> normalizeCountResult(Object raw) {
    Map<String, Object> first = firstRow(raw);
    if (first == null) return Optional.empty();
    for (Map.Entry<String, Object> e : first.entrySet()) {
      String key = e.getKey() == null ? "" : e.getKey().toLowerCase(Locale.ROOT);
      if (key.equals("count") || key.startsWith("count(")) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(COUNT_RESULT_KEY, e.getValue());
        return Optional.of(List.of(row));
      }
    }
    return Optional.empty();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> firstRow(Object raw) {
    if (raw instanceof QueryResult qr) return qr.firstRowOrNull();
    if (raw instanceof List<?> l) {
      if (l.isEmpty()) return null;
      Object f = l.get(0);
      return (f instanceof Map<?, ?> m) ? (Map<String, Object>) m : null;
    }
    if (raw instanceof Map<?, ?> m) return (Map<String, Object>) m;
    return null;
  }
}
