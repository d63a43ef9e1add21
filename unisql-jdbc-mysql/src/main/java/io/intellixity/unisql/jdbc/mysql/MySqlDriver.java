package io.intellixity.unisql.jdbc.mysql;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.jdbc.JdbcRowReader;
import io.intellixity.unisql.jdbc.PooledJdbcDriver;
import io.intellixity.unisql.jdbc.bind.JdbcParameterBinder;

import java.util.Objects;

/**
 * MySQL over any MySQL JDBC driver on the classpath and a HikariCP pool. Maps and collections bind
 * as JSON text.
 */
public final class MySqlDriver extends PooledJdbcDriver {

  public MySqlDriver(HikariConfig config) {
    this(Objects.requireNonNull(config, "config"), null);
  }

  public MySqlDriver(String jdbcUrl, String username, String password) {
    this(config(jdbcUrl, username, password));
  }

  /** Wraps an existing pool; the driver closes it on disconnect. */
  public MySqlDriver(HikariDataSource dataSource) {
    this(null, Objects.requireNonNull(dataSource, "dataSource"));
  }

  private MySqlDriver(HikariConfig config, HikariDataSource existing) {
    super(Dialect.MYSQL, "mysql", MySqlResultParser.INSTANCE, config, existing,
        JdbcParameterBinder.DEFAULT, JdbcRowReader.DEFAULT, MySqlExceptionTranslator.INSTANCE);
  }

  private static HikariConfig config(String jdbcUrl, String username, String password) {
    HikariConfig cfg = new HikariConfig();
    cfg.setJdbcUrl(Objects.requireNonNull(jdbcUrl, "jdbcUrl"));
    if (username != null) cfg.setUsername(username);
    if (password != null) cfg.setPassword(password);
    return cfg;
  }
}
