package io.intellixity.unisql.spi;

import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.util.UnisqlFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Name-based driver construction over the discovered {@link DriverFactory} implementations. */
public final class DriverFactories {
  private static final Logger log = LoggerFactory.getLogger(DriverFactories.class);

  private DriverFactories() {}

  public static Map<String, DriverFactory> discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static Map<String, DriverFactory> discover(ClassLoader cl) {
    Map<String, DriverFactory> byName = new LinkedHashMap<>();
    for (DriverFactory f : UnisqlFactoriesLoader.load(DriverFactory.class, cl)) {
      DriverFactory previous = byName.putIfAbsent(f.name(), f);
      if (previous != null) {
        log.warn("unisql.factories duplicate_driver name={} kept={} ignored={}",
            f.name(), previous.getClass().getName(), f.getClass().getName());
      }
    }
    return Collections.unmodifiableMap(byName);
  }

  public static Set<String> names() {
    return discover().keySet();
  }

  public static Driver create(String name, Map<String, String> properties) {
    Objects.requireNonNull(name, "name");
    Map<String, DriverFactory> factories = discover();
    DriverFactory f = factories.get(name);
    if (f == null) {
      throw new DriverException("No driver named '" + name + "' on the classpath; available: " + factories.keySet(),
          ErrorCode.DRIVER_NOT_SUPPORTED);
    }
    log.debug("unisql.factories create name={} factory={}", name, f.getClass().getName());
    return f.create(properties == null ? Map.of() : properties);
  }
}
