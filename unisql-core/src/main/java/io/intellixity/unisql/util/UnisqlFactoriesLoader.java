package io.intellixity.unisql.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Discovers SPI implementations listed in {@code META-INF/unisql.factories} resources.
 * <p>
 * Each resource is a properties file keyed by the SPI's fully qualified name; values are
 * comma-separated implementation class names with a public no-arg constructor:
 * <pre>
 * io.intellixity.unisql.spi.DriverFactory=io.intellixity.unisql.jdbc.sqlite.SqliteDriverFactory
 * </pre>
 * Duplicates across resources are instantiated once, in classpath order.
 */
public final class UnisqlFactoriesLoader {
  public static final String RESOURCE = "META-INF/unisql.factories";

  private UnisqlFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = (cl == null) ? UnisqlFactoriesLoader.class.getClassLoader() : cl;

    List<T> out = new ArrayList<>();
    for (String implName : implementationNames(spiType.getName(), loader)) {
      out.add(instantiate(implName, spiType, loader));
    }
    return out;
  }

  static Set<String> implementationNames(String key, ClassLoader loader) {
    Enumeration<URL> resources;
    try {
      resources = loader.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot enumerate " + RESOURCE, e);
    }

    Set<String> names = new LinkedHashSet<>();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties props = new Properties();
      try (InputStream in = url.openStream()) {
        props.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Cannot read " + url, e);
      }
      String value = props.getProperty(key);
      if (value == null) continue;
      for (String part : value.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.add(name);
      }
    }
    return names;
  }

  private static <T> T instantiate(String implName, Class<T> spiType, ClassLoader loader) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, loader);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Listed in " + RESOURCE + " but not on classpath: " + implName, e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException(implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}
