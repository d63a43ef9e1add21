package io.intellixity.unisql.jdbc.sqlite;

import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.driver.DriverCapabilities;
import io.intellixity.unisql.driver.IsolationLevel;
import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.driver.TransactionOptions;
import io.intellixity.unisql.error.ConnectionException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.ExceptionTranslator;
import io.intellixity.unisql.jdbc.JdbcExecutor;
import io.intellixity.unisql.jdbc.JdbcRowReader;
import io.intellixity.unisql.jdbc.JdbcTransaction;
import io.intellixity.unisql.result.SqliteResultParser;
import io.intellixity.unisql.spi.AbstractDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Embedded SQLite over one sqlite-jdbc connection.
 * <p>
 * The connection is the transaction: {@code BEGIN}/{@code COMMIT}/{@code ROLLBACK} run on it
 * directly and nested transactions are savepoints. A top-level transaction holds the connection
 * lock from begin to release, so plain statements from other threads wait instead of joining it.
 * SQLite is always serializable; any other requested isolation level is reported and ignored.
 */
public final class SqliteDriver extends AbstractDriver<Connection, JdbcTransaction> {
  private static final Logger log = LoggerFactory.getLogger(SqliteDriver.class);

  public static final String MEMORY = ":memory:";

  private final String filename;
  private final SQLiteConfig config;
  private final boolean wrapped;
  private final JdbcExecutor executor;
  private final ReentrantLock connectionLock = new ReentrantLock();

  public SqliteDriver() {
    this(MEMORY);
  }

  public SqliteDriver(String filename) {
    this(filename, new SQLiteConfig());
  }

  public SqliteDriver(String filename, SQLiteConfig config) {
    this(filename, config, null);
  }

  /** Wraps an open sqlite-jdbc connection; it is closed on disconnect and never reopened. */
  public SqliteDriver(Connection connection) {
    this(null, null, Objects.requireNonNull(connection, "connection"));
  }

  private SqliteDriver(String filename, SQLiteConfig config, Connection existing) {
    super(Dialect.SQLITE, "sqlite", DriverCapabilities.of(true, false), SqliteResultParser.INSTANCE, existing);
    this.filename = (filename == null || filename.isBlank()) ? MEMORY : filename;
    this.config = (config == null) ? new SQLiteConfig() : config;
    this.wrapped = existing != null;
    this.executor = new JdbcExecutor("sqlite", SqliteParameterBinder.INSTANCE, JdbcRowReader.DEFAULT);
  }

  public String filename() { return filename; }

  @Override
  protected ExceptionTranslator exceptionTranslator() {
    return SqliteExceptionTranslator.INSTANCE;
  }

  @Override
  protected Connection initClient() throws SQLException {
    if (wrapped) {
      throw new ConnectionException(driverName() + " was built around a connection that has since been closed",
          ErrorCode.CONNECTION_CLOSED);
    }
    Connection c = config.createConnection("jdbc:sqlite:" + filename);
    log.debug("unisql.sqlite opened filename={}", filename);
    return c;
  }

  @Override
  protected void closeClient(Connection c) throws SQLException {
    log.debug("unisql.sqlite closing filename={}", filename);
    c.close();
  }

  @Override
  protected QueryResult execute(Connection c, String sql, List<Object> params) throws SQLException {
    connectionLock.lock();
    try {
      return executor.execute(c, sql, params, 0);
    } finally {
      connectionLock.unlock();
    }
  }

  @Override
  protected JdbcTransaction begin(Connection c, TransactionOptions options) throws SQLException {
    IsolationLevel level = options.isolationLevel();
    if (level != null && level != IsolationLevel.SERIALIZABLE) {
      instrumentation().warn("SQLite transactions are always SERIALIZABLE; requested " + level + " is ignored.",
          Map.of("feature", "isolationLevel", "requested", level.name()), context());
    }
    connectionLock.lock();
    try {
      executor.executeCommand(c, "BEGIN");
      return new JdbcTransaction(c, options.timeout());
    } catch (SQLException | RuntimeException e) {
      connectionLock.unlock();
      throw e;
    }
  }

  @Override
  protected void commit(JdbcTransaction tx) throws SQLException {
    executor.executeCommand(tx.connection(), "COMMIT");
  }

  @Override
  protected void rollback(JdbcTransaction tx) throws SQLException {
    executor.executeCommand(tx.connection(), "ROLLBACK");
  }

  @Override
  protected void release(JdbcTransaction tx) {
    if (connectionLock.isHeldByCurrentThread()) connectionLock.unlock();
  }

  @Override
  protected QueryResult executeInTransaction(JdbcTransaction tx, String sql, List<Object> params) throws SQLException {
    return executor.execute(tx.connection(), sql, params, tx.remainingTimeoutSeconds());
  }
}
