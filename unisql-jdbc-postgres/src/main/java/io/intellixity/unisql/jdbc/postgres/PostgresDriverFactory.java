package io.intellixity.unisql.jdbc.postgres;

import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.jdbc.HikariConfigs;
import io.intellixity.unisql.spi.DriverFactory;
import io.intellixity.unisql.spi.DriverProperties;

import java.util.Map;

/** {@code postgres}: the {@link HikariConfigs} keys plus {@code pgvector} and {@code postgis} flags. */
public final class PostgresDriverFactory implements DriverFactory {
  @Override
  public String name() {
    return "postgres";
  }

  @Override
  public Driver create(Map<String, String> properties) {
    DriverProperties props = new DriverProperties(properties);
    return new PostgresDriver(new PostgresDriver.Options(HikariConfigs.from(props),
        props.getBoolean("pgvector", false), props.getBoolean("postgis", false)));
  }
}
