package io.intellixity.unisql.spi;

import io.intellixity.unisql.driver.Driver;

import java.util.Map;

/**
 * Builds a driver from flat string properties. Implementations are listed in
 * {@code META-INF/unisql.factories} under this interface's name.
 */
public interface DriverFactory {
  /** Lookup key, e.g. {@code postgres}, {@code sqlite}. */
  String name();

  Driver create(Map<String, String> properties);
}
