package io.intellixity.unisql.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.driver.DriverCapabilities;
import io.intellixity.unisql.driver.IsolationLevel;
import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.driver.TransactionOptions;
import io.intellixity.unisql.error.ConnectionException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.ExceptionTranslator;
import io.intellixity.unisql.jdbc.bind.JdbcParameterBinder;
import io.intellixity.unisql.result.ResultParser;
import io.intellixity.unisql.spi.AbstractDriver;
import io.intellixity.unisql.sql.PlaceholderStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * JDBC driver over a HikariCP pool.
 * <p>
 * Plain statements borrow a pooled connection per call. Each top-level transaction holds its own
 * pooled connection from {@code begin} until {@code release}; nested transactions are savepoints
 * on that connection. Statements render with {@code ?} placeholders; raw SQL may also use
 * numbered {@code $n} placeholders, which are rewritten before binding.
 */
public class PooledJdbcDriver extends AbstractDriver<HikariDataSource, JdbcTransaction> {
  private static final Logger log = LoggerFactory.getLogger(PooledJdbcDriver.class);

  private final HikariConfig config;
  private final JdbcExecutor executor;
  private final ExceptionTranslator translator;

  public PooledJdbcDriver(Dialect dialect, String driverName, HikariConfig config) {
    this(dialect, driverName, ResultParser.NONE, config, null,
        JdbcParameterBinder.DEFAULT, JdbcRowReader.DEFAULT, SqlStateExceptionTranslator.INSTANCE);
  }

  /** Wraps an existing pool; the driver owns it from now on and closes it on disconnect. */
  public PooledJdbcDriver(Dialect dialect, String driverName, HikariDataSource dataSource) {
    this(dialect, driverName, ResultParser.NONE, null, dataSource,
        JdbcParameterBinder.DEFAULT, JdbcRowReader.DEFAULT, SqlStateExceptionTranslator.INSTANCE);
  }

  protected PooledJdbcDriver(Dialect dialect,
                             String driverName,
                             ResultParser resultParser,
                             HikariConfig config,
                             HikariDataSource existing,
                             JdbcParameterBinder binder,
                             JdbcRowReader rowReader,
                             ExceptionTranslator translator) {
    super(dialect, driverName, DriverCapabilities.of(true, false), resultParser, existing);
    if (config == null && existing == null) throw new IllegalArgumentException("config or dataSource is required");
    this.config = config;
    this.executor = new JdbcExecutor(driverName, binder, rowReader);
    this.translator = (translator == null) ? SqlStateExceptionTranslator.INSTANCE : translator;
  }

  /** JDBC binds are always {@code ?}. */
  @Override
  public PlaceholderStyle placeholderStyle() {
    return PlaceholderStyle.QUESTION;
  }

  /** The live pool, initialising it if needed. */
  public final DataSource dataSource() {
    return getClient();
  }

  protected final JdbcExecutor executor() {
    return executor;
  }

  @Override
  protected ExceptionTranslator exceptionTranslator() {
    return translator;
  }

  @Override
  protected HikariDataSource initClient() {
    if (config == null) {
      throw new ConnectionException(driverName() + " was built around a data source that has since been closed",
          ErrorCode.CONNECTION_CLOSED);
    }
    HikariDataSource ds = new HikariDataSource(config);
    log.info("unisql.jdbc pool_started driver={} pool={} maxSize={}",
        driverName(), ds.getPoolName(), ds.getMaximumPoolSize());
    return ds;
  }

  @Override
  protected void closeClient(HikariDataSource ds) {
    log.info("unisql.jdbc pool_closing driver={} pool={}", driverName(), ds.getPoolName());
    ds.close();
  }

  @Override
  protected QueryResult execute(HikariDataSource ds, String sql, List<Object> params) throws SQLException {
    try (Connection c = ds.getConnection()) {
      return executor.execute(c, sql, params, 0);
    }
  }

  @Override
  protected JdbcTransaction begin(HikariDataSource ds, TransactionOptions options) throws SQLException {
    Connection c = ds.getConnection();
    try {
      c.setAutoCommit(false);
      applyIsolation(c, options.isolationLevel());
      return new JdbcTransaction(c, options.timeout());
    } catch (SQLException | RuntimeException e) {
      try {
        c.close();
      } catch (SQLException ce) {
        e.addSuppressed(ce);
      }
      throw e;
    }
  }

  /** Isolation is set as the first statement of the transaction. */
  protected void applyIsolation(Connection c, IsolationLevel level) throws SQLException {
    if (level == null) return;
    String stmt = dialect().setIsolationStatement(level);
    if (stmt != null) {
      executor.executeCommand(c, stmt);
      return;
    }
    // no isolation syntax: the engine is always serializable
    if (level == IsolationLevel.SERIALIZABLE) return;
    instrumentation().warn("Isolation level " + level + " is not supported by " + dialect().id()
            + "; the transaction runs SERIALIZABLE.",
        Map.of("feature", "isolationLevel", "requested", level.name()), context());
  }

  @Override
  protected void commit(JdbcTransaction tx) throws SQLException {
    tx.connection().commit();
  }

  @Override
  protected void rollback(JdbcTransaction tx) throws SQLException {
    tx.connection().rollback();
  }

  /** Returns the connection to the pool; Hikari restores auto-commit on return. */
  @Override
  protected void release(JdbcTransaction tx) throws SQLException {
    tx.connection().close();
  }

  @Override
  protected QueryResult executeInTransaction(JdbcTransaction tx, String sql, List<Object> params) throws SQLException {
    return executor.execute(tx.connection(), sql, params, tx.remainingTimeoutSeconds());
  }
}
