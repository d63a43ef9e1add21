package io.intellixity.unisql.spi;

import io.intellixity.unisql.driver.BatchQuery;
import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.driver.DriverCapabilities;
import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.driver.TransactionOptions;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/** In-memory adapter that records every hook call. */
final class RecordingDriver extends AbstractDriver<RecordingDriver.Client, RecordingDriver.Tx> {
  static final class Client {
    final int id;
    volatile boolean closed;

    Client(int id) { this.id = id; }
  }

  record Tx(Client client, TransactionOptions options) {}

  final List<String> events = Collections.synchronizedList(new ArrayList<>());
  final AtomicInteger inits = new AtomicInteger();
  volatile Predicate<String> failWhen = sql -> false;
  volatile boolean failRollback;

  RecordingDriver(DriverCapabilities capabilities) {
    super(Dialect.POSTGRESQL, "recording", capabilities, null);
  }

  static RecordingDriver transactional() {
    return new RecordingDriver(DriverCapabilities.of(true, false));
  }

  /** Events with the timestamp suffix stripped from savepoint names. */
  List<String> normalizedEvents() {
    synchronized (events) {
      return events.stream().map(e -> e.replaceAll("(sp_\\d+)_\\d+", "$1")).collect(Collectors.toList());
    }
  }

  @Override
  protected Client initClient() {
    events.add("init");
    return new Client(inits.incrementAndGet());
  }

  @Override
  protected void closeClient(Client client) {
    events.add("close");
    client.closed = true;
  }

  @Override
  protected QueryResult execute(Client client, String sql, List<Object> params) throws SQLException {
    return run("exec", sql);
  }

  @Override
  protected QueryResult executeInTransaction(Tx tx, String sql, List<Object> params) throws SQLException {
    return run("tx", sql);
  }

  private QueryResult run(String prefix, String sql) throws SQLException {
    events.add(prefix + ":" + sql);
    if (failWhen.test(sql)) throw new SQLException("boom: " + sql, "XX000");
    if (sql.startsWith("SELECT")) return QueryResult.ofRows(List.of(Map.of("v", 1)));
    return QueryResult.affected(1);
  }

  @Override
  protected Tx begin(Client client, TransactionOptions options) {
    events.add(options.isolationLevel() == null ? "begin" : "begin:" + options.isolationLevel());
    return new Tx(client, options);
  }

  @Override
  protected void commit(Tx tx) {
    events.add("commit");
  }

  @Override
  protected void rollback(Tx tx) throws SQLException {
    events.add("rollback");
    if (failRollback) throw new SQLException("rollback failed", "08006");
  }

  @Override
  protected void release(Tx tx) {
    events.add("release");
  }

  @Override
  protected List<QueryResult> executeNativeBatch(Client client, List<BatchQuery> queries) throws SQLException {
    events.add("batch:" + queries.size());
    for (BatchQuery q : queries) {
      if (failWhen.test(q.sql())) throw new SQLException("batch rejected: " + q.sql(), "XX000");
    }
    List<QueryResult> out = new ArrayList<>();
    for (int i = 0; i < queries.size(); i++) out.add(QueryResult.affected(1));
    return out;
  }
}
