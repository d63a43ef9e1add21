package io.intellixity.unisql.jdbc;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.unisql.spi.DriverProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Builds a {@link HikariConfig} from flat driver properties.
 *
 * <pre>
 * url                   JDBC URL (required)
 * username, password
 * pool.name
 * pool.maximumSize
 * pool.minimumIdle
 * pool.connectionTimeout  milliseconds
 * datasource.*          passed to the JDBC driver as connection properties
 * </pre>
 */
public final class HikariConfigs {
  private HikariConfigs() {}

  public static HikariConfig from(DriverProperties props) {
    HikariConfig cfg = new HikariConfig();
    cfg.setJdbcUrl(props.require("url"));
    String user = props.get("username");
    if (user != null) cfg.setUsername(user);
    String password = props.get("password");
    if (password != null) cfg.setPassword(password);

    String poolName = props.get("pool.name");
    if (poolName != null) cfg.setPoolName(poolName);
    cfg.setMaximumPoolSize(props.getInt("pool.maximumSize", 10));
    int minIdle = props.getInt("pool.minimumIdle", -1);
    if (minIdle >= 0) cfg.setMinimumIdle(minIdle);
    Duration connTimeout = props.getDuration("pool.connectionTimeout", null);
    if (connTimeout != null) cfg.setConnectionTimeout(connTimeout.toMillis());

    for (Map.Entry<String, String> e : props.withPrefix("datasource.").entrySet()) {
      cfg.addDataSourceProperty(e.getKey(), e.getValue());
    }
    return cfg;
  }
}
