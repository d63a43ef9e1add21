package io.intellixity.unisql.jdbc.postgres;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.jdbc.PooledJdbcDriver;
import io.intellixity.unisql.result.ResultParser;

import java.util.Objects;

/**
 * Postgres over pgjdbc and a HikariCP pool. Each top-level transaction runs on its own pooled
 * connection; isolation is set with {@code SET TRANSACTION ISOLATION LEVEL} as its first statement.
 */
public final class PostgresDriver extends PooledJdbcDriver {

  /**
   * @param pool     pool settings; at least the JDBC URL
   * @param pgvector vector operators are allowed
   * @param postgis  geospatial operators are allowed
   */
  public record Options(HikariConfig pool, boolean pgvector, boolean postgis) {
    public Options {
      Objects.requireNonNull(pool, "pool");
    }

    public static Options of(String jdbcUrl, String username, String password) {
      HikariConfig cfg = new HikariConfig();
      cfg.setJdbcUrl(Objects.requireNonNull(jdbcUrl, "jdbcUrl"));
      if (username != null) cfg.setUsername(username);
      if (password != null) cfg.setPassword(password);
      return new Options(cfg, false, false);
    }

    public Options withPgvector(boolean enabled) {
      return new Options(pool, enabled, postgis);
    }

    public Options withPostgis(boolean enabled) {
      return new Options(pool, pgvector, enabled);
    }
  }

  private final PostgresExtensions extensions;

  public PostgresDriver(Options options) {
    this(options, null);
  }

  /** Wraps an existing pool; the driver closes it on disconnect. */
  public PostgresDriver(HikariDataSource dataSource, boolean pgvector, boolean postgis) {
    this(null, Objects.requireNonNull(dataSource, "dataSource"), new PostgresExtensions(pgvector, postgis));
  }

  private PostgresDriver(Options options, HikariDataSource existing) {
    this(Objects.requireNonNull(options, "options").pool(), existing,
        new PostgresExtensions(options.pgvector(), options.postgis()));
  }

  private PostgresDriver(HikariConfig config, HikariDataSource existing, PostgresExtensions extensions) {
    super(Dialect.POSTGRESQL, "postgres", ResultParser.NONE, config, existing,
        PostgresParameterBinder.INSTANCE, PostgresRowReader.INSTANCE, PostgresExceptionTranslator.INSTANCE);
    this.extensions = extensions;
  }

  public PostgresExtensions extensions() { return extensions; }
}
