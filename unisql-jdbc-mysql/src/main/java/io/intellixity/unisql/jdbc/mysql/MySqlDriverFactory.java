package io.intellixity.unisql.jdbc.mysql;

import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.jdbc.HikariConfigs;
import io.intellixity.unisql.spi.DriverFactory;
import io.intellixity.unisql.spi.DriverProperties;

import java.util.Map;

/** {@code mysql}: the {@link HikariConfigs} keys. */
public final class MySqlDriverFactory implements DriverFactory {
  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public Driver create(Map<String, String> properties) {
    return new MySqlDriver(HikariConfigs.from(new DriverProperties(properties)));
  }
}
