package io.intellixity.unisql.jdbc;

import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.jdbc.bind.JdbcParameterBinder;
import io.intellixity.unisql.sql.SqlStatement;
import io.intellixity.unisql.sql.StatementShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one statement on a JDBC connection and shapes the {@link QueryResult}.
 * <p>
 * Statements that have rows by shape go through {@code executeQuery}; everything else through
 * {@code execute}, so a write reports its update count while a PRAGMA or SHOW still returns rows.
 */
public final class JdbcExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcExecutor.class);

  private final String driverName;
  private final JdbcParameterBinder binder;
  private final JdbcRowReader rowReader;

  public JdbcExecutor(String driverName, JdbcParameterBinder binder, JdbcRowReader rowReader) {
    this.driverName = Objects.requireNonNull(driverName, "driverName");
    this.binder = (binder == null) ? JdbcParameterBinder.DEFAULT : binder;
    this.rowReader = (rowReader == null) ? JdbcRowReader.DEFAULT : rowReader;
  }

  /**
   * @param timeoutSeconds JDBC query timeout; 0 leaves the driver default
   */
  public QueryResult execute(Connection c, String sql, List<Object> params, int timeoutSeconds) throws SQLException {
    SqlStatement stmt = JdbcPlaceholders.toJdbc(sql, params);
    StatementShape shape = StatementShape.of(stmt.sql());
    long start = System.nanoTime();
    debugSql(shape, stmt, timeoutSeconds);

    try (PreparedStatement ps = c.prepareStatement(stmt.sql())) {
      if (timeoutSeconds > 0) ps.setQueryTimeout(timeoutSeconds);
      binder.bindAll(ps, stmt.params());

      QueryResult result;
      if (shape.hasRows()) {
        try (ResultSet rs = ps.executeQuery()) {
          result = QueryResult.ofRows(rowReader.readAll(rs));
        }
      } else if (ps.execute()) {
        try (ResultSet rs = ps.getResultSet()) {
          result = QueryResult.ofRows(rowReader.readAll(rs));
        }
      } else {
        result = QueryResult.affected(Math.max(0, ps.getUpdateCount()));
      }
      debugDone(shape, result, System.nanoTime() - start);
      return result;
    }
  }

  /** Runs a statement that produces no result, e.g. SET TRANSACTION or a savepoint command. */
  public void executeCommand(Connection c, String sql) throws SQLException {
    if (log.isDebugEnabled()) log.debug("unisql.jdbc op=COMMAND driver={} sql={}", driverName, sql);
    try (var st = c.createStatement()) {
      st.execute(sql);
    }
  }

  private void debugSql(StatementShape shape, SqlStatement stmt, int timeoutSeconds) {
    if (!log.isDebugEnabled()) return;
    log.debug("unisql.jdbc op=EXECUTE driver={} shape={} bindCount={} timeoutSec={} sql={}",
        driverName, shape, stmt.params().size(), timeoutSeconds, stmt.sql());

    // TRACE: bind summary only, never raw values
    if (log.isTraceEnabled() && !stmt.params().isEmpty()) {
      int idx = 1;
      for (Object v : stmt.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("unisql.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(StatementShape shape, QueryResult result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("unisql.jdbc_done driver={} shape={} durationMs={} rowCount={} columns={}",
        driverName, shape, durationNanos / 1_000_000.0, result.rowCount(), columns(result));
  }

  private static int columns(QueryResult result) {
    Map<String, Object> first = result.firstRowOrNull();
    return first == null ? 0 : first.size();
  }
}
