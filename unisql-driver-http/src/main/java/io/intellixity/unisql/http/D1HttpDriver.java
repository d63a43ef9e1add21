package io.intellixity.unisql.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.unisql.driver.BatchQuery;
import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.driver.DriverCapabilities;
import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.error.ExceptionTranslator;
import io.intellixity.unisql.result.SqliteResultParser;
import io.intellixity.unisql.spi.AbstractDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Cloudflare D1 over its REST query endpoint.
 * <p>
 * The API is stateless: there are no interactive transactions, so {@code withTransaction} runs the
 * callback directly with a warning. Batches are sent as one array body, which the endpoint runs
 * atomically.
 */
public final class D1HttpDriver extends AbstractDriver<D1Client, Void> {
  private static final Logger log = LoggerFactory.getLogger(D1HttpDriver.class);

  public static final String DEFAULT_BASE_URL = "https://api.cloudflare.com/client/v4";

  /**
   * @param requestTimeout per-request timeout; null leaves it to the HTTP client
   */
  public record Options(String accountId, String databaseId, String apiToken, String baseUrl, Duration requestTimeout) {
    public Options {
      Objects.requireNonNull(accountId, "accountId");
      Objects.requireNonNull(databaseId, "databaseId");
      Objects.requireNonNull(apiToken, "apiToken");
      baseUrl = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl);
    }

    public static Options of(String accountId, String databaseId, String apiToken) {
      return new Options(accountId, databaseId, apiToken, null, null);
    }

    public Options withBaseUrl(String url) {
      return new Options(accountId, databaseId, apiToken, url, requestTimeout);
    }

    public Options withRequestTimeout(Duration timeout) {
      return new Options(accountId, databaseId, apiToken, baseUrl, timeout);
    }

    private static String stripTrailingSlash(String url) {
      return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
  }

  private final Options options;
  private final HttpClient http;
  private final ObjectMapper mapper = new ObjectMapper();

  public D1HttpDriver(Options options) {
    this(options, null);
  }

  /** Uses the given HTTP client instead of building one on connect. */
  public D1HttpDriver(Options options, HttpClient http) {
    super(Dialect.SQLITE, "d1-http", DriverCapabilities.of(false, true), SqliteResultParser.INSTANCE);
    this.options = Objects.requireNonNull(options, "options");
    this.http = http;
  }

  public Options options() { return options; }

  @Override
  protected ExceptionTranslator exceptionTranslator() {
    return D1ExceptionTranslator.INSTANCE;
  }

  @Override
  protected D1Client initClient() {
    HttpClient client = (http != null) ? http : HttpClient.newBuilder()
        .connectTimeout(options.requestTimeout() != null ? options.requestTimeout() : Duration.ofSeconds(30))
        .build();
    D1Client d1 = new D1Client(client, mapper, options);
    log.debug("unisql.d1 client endpoint={}", d1.endpoint());
    return d1;
  }

  @Override
  protected void closeClient(D1Client client) {
    // nothing is held open between requests
    log.debug("unisql.d1 client released endpoint={}", client.endpoint());
  }

  @Override
  protected QueryResult execute(D1Client client, String sql, List<Object> params)
      throws IOException, InterruptedException, D1ApiException {
    return client.query(sql, params);
  }

  @Override
  protected List<QueryResult> executeNativeBatch(D1Client client, List<BatchQuery> queries)
      throws IOException, InterruptedException, D1ApiException {
    return client.batch(queries);
  }
}
