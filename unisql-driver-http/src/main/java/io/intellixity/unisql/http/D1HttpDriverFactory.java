package io.intellixity.unisql.http;

import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.spi.DriverFactory;
import io.intellixity.unisql.spi.DriverProperties;

import java.util.Map;

/**
 * {@code d1-http}.
 * <pre>
 * accountId        Cloudflare account id (required)
 * databaseId       D1 database id (required)
 * apiToken         API token with D1 edit rights (required)
 * baseUrl          API base URL (default {@value D1HttpDriver#DEFAULT_BASE_URL})
 * requestTimeout   per-request timeout in ms
 * </pre>
 */
public final class D1HttpDriverFactory implements DriverFactory {
  @Override
  public String name() {
    return "d1-http";
  }

  @Override
  public Driver create(Map<String, String> properties) {
    DriverProperties p = new DriverProperties(properties);
    D1HttpDriver.Options options = new D1HttpDriver.Options(
        p.require("accountId"),
        p.require("databaseId"),
        p.require("apiToken"),
        p.get("baseUrl"),
        p.getDuration("requestTimeout", null));
    return new D1HttpDriver(options);
  }
}
