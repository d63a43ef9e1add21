package io.intellixity.unisql.jdbc.bind;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * JDBC-family parameter binder.
 *
 * Dialect modules extend this and handle their own types in {@link #bindDialect}; anything they
 * decline falls through to the base JDBC rules:
 * - null binds as SQL NULL\n
 * - {@link Instant} binds as {@link Timestamp}\n
 * - maps and collections bind as JSON text\n
 * - everything else goes through {@code setObject}\n
 */
public class JdbcParameterBinder {
  public static final JdbcParameterBinder DEFAULT = new JdbcParameterBinder();

  protected static final ObjectMapper JSON = new ObjectMapper();

  public final void bindAll(PreparedStatement ps, List<Object> params) throws SQLException {
    if (params == null) return;
    for (int i = 0; i < params.size(); i++) {
      bind(ps, i + 1, params.get(i));
    }
  }

  public final void bind(PreparedStatement ps, int position, Object value) throws SQLException {
    if (position <= 0) throw new IllegalArgumentException("position must be >= 1");
    if (bindDialect(ps, position, value)) return;
    bindJdbc(ps, position, value);
  }

  /** Dialect-specific binding. Returns false to fall through to the base JDBC rules. */
  protected boolean bindDialect(PreparedStatement ps, int position, Object value) throws SQLException {
    return false;
  }

  protected void bindJdbc(PreparedStatement ps, int position, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(position, Types.NULL);
    } else if (value instanceof Instant i) {
      ps.setTimestamp(position, Timestamp.from(i));
    } else if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
      ps.setString(position, toJson(value));
    } else {
      ps.setObject(position, value);
    }
  }

  protected static String toJson(Object value) throws SQLException {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SQLException("Cannot encode parameter as JSON: " + value.getClass().getName(), e);
    }
  }
}
