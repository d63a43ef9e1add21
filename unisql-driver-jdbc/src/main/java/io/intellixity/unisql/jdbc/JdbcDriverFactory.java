package io.intellixity.unisql.jdbc;

import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.spi.DriverFactory;
import io.intellixity.unisql.spi.DriverProperties;

import java.util.Map;

/**
 * {@code jdbc}: a pooled driver for any JDBC URL. Requires {@code dialect}
 * ({@code postgresql|mysql|sqlite}) next to the {@link HikariConfigs} keys.
 */
public final class JdbcDriverFactory implements DriverFactory {
  @Override
  public String name() {
    return "jdbc";
  }

  @Override
  public Driver create(Map<String, String> properties) {
    DriverProperties props = new DriverProperties(properties);
    Dialect dialect = Dialect.fromId(props.require("dialect"));
    return new PooledJdbcDriver(dialect, props.get("driverName", "jdbc-" + dialect.id()), HikariConfigs.from(props));
  }
}
