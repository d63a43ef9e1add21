package io.intellixity.unisql.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.unisql.driver.BatchQuery;
import io.intellixity.unisql.driver.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless client for one D1 database. Every call is one POST to the query endpoint; nothing is
 * held open between calls.
 */
final class D1Client {
  private static final Logger log = LoggerFactory.getLogger(D1Client.class);

  private final HttpClient http;
  private final ObjectMapper mapper;
  private final URI endpoint;
  private final String apiToken;
  private final Duration requestTimeout;

  D1Client(HttpClient http, ObjectMapper mapper, D1HttpDriver.Options options) {
    this.http = http;
    this.mapper = mapper;
    this.endpoint = URI.create(options.baseUrl() + "/accounts/" + options.accountId()
        + "/d1/database/" + options.databaseId() + "/query");
    this.apiToken = options.apiToken();
    this.requestTimeout = options.requestTimeout();
  }

  URI endpoint() { return endpoint; }

  QueryResult query(String sql, List<Object> params) throws IOException, InterruptedException, D1ApiException {
    D1Response response = post(statement(sql, params));
    // a statement the endpoint accepted without a result block has nothing to report
    if (response.result().isEmpty()) return QueryResult.empty();
    return response.result().get(0).toQueryResult(sql);
  }

  /** The endpoint runs an array body as one atomic batch: one result per statement, in order. */
  List<QueryResult> batch(List<BatchQuery> queries) throws IOException, InterruptedException, D1ApiException {
    List<Map<String, Object>> body = new ArrayList<>(queries.size());
    for (BatchQuery q : queries) body.add(statement(q.sql(), q.params()));
    D1Response response = post(body);
    List<QueryResult> out = new ArrayList<>(response.result().size());
    for (int i = 0; i < response.result().size(); i++) {
      String sql = (i < queries.size()) ? queries.get(i).sql() : null;
      out.add(response.result().get(i).toQueryResult(sql));
    }
    return out;
  }

  private Map<String, Object> statement(String sql, List<Object> params) throws JsonProcessingException {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("sql", sql);
    m.put("params", D1Parameters.convert(params, mapper));
    return m;
  }

  private D1Response post(Object body) throws IOException, InterruptedException, D1ApiException {
    byte[] json = mapper.writeValueAsBytes(body);
    HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
        .header("Authorization", "Bearer " + apiToken)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofByteArray(json));
    if (requestTimeout != null) request.timeout(requestTimeout);

    long t0 = System.nanoTime();
    HttpResponse<String> response;
    try {
      response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw e;
    }
    int status = response.statusCode();
    if (log.isDebugEnabled()) {
      log.debug("unisql.d1 op=post status={} bytes={} ms={}", status, json.length, (System.nanoTime() - t0) / 1_000_000);
    }

    if (status < 200 || status >= 300) {
      D1Response parsed = tryParse(response.body());
      if (parsed != null && !parsed.errors().isEmpty()) throw D1ApiException.fromErrors(status, parsed.errors());
      throw new D1ApiException("D1 HTTP API error: " + status + " - " + response.body(), status, List.of());
    }
    D1Response parsed = mapper.readValue(response.body(), D1Response.class);
    if (!parsed.success()) throw D1ApiException.fromErrors(status, parsed.errors());
    return parsed;
  }

  private D1Response tryParse(String body) {
    if (body == null || body.isBlank()) return null;
    try {
      return mapper.readValue(body, D1Response.class);
    } catch (JsonProcessingException e) {
      // error pages from proxies are not JSON
      return null;
    }
  }
}
