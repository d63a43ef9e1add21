package io.intellixity.unisql.jdbc.sqlite;

import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.spi.DriverFactory;
import io.intellixity.unisql.spi.DriverProperties;
import org.sqlite.SQLiteConfig;

import java.util.Locale;
import java.util.Map;

/**
 * {@code sqlite}. Properties: {@code filename} (default {@code :memory:}), {@code journalMode}
 * ({@code WAL}, {@code DELETE}, ...), {@code busyTimeout} in milliseconds, {@code foreignKeys}.
 */
public final class SqliteDriverFactory implements DriverFactory {
  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public Driver create(Map<String, String> properties) {
    DriverProperties props = new DriverProperties(properties);
    SQLiteConfig config = new SQLiteConfig();
    String journal = props.get("journalMode");
    if (journal != null) config.setJournalMode(SQLiteConfig.JournalMode.valueOf(journal.toUpperCase(Locale.ROOT)));
    int busyTimeout = props.getInt("busyTimeout", -1);
    if (busyTimeout >= 0) config.setBusyTimeout(busyTimeout);
    config.enforceForeignKeys(props.getBoolean("foreignKeys", true));
    return new SqliteDriver(props.get("filename", SqliteDriver.MEMORY), config);
  }
}
