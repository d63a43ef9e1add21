package io.intellixity.unisql.jdbc.sqlite;

import io.intellixity.unisql.driver.BatchQuery;
import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.driver.IsolationLevel;
import io.intellixity.unisql.driver.Operation;
import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.driver.TransactionOptions;
import io.intellixity.unisql.error.ConnectionException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.QueryException;
import io.intellixity.unisql.error.TransactionException;
import io.intellixity.unisql.error.UniqueConstraintException;
import io.intellixity.unisql.instrument.InstrumentationContext;
import io.intellixity.unisql.instrument.QueryLogEvent;
import io.intellixity.unisql.result.RelationType;
import io.intellixity.unisql.spi.DriverFactories;
import io.intellixity.unisql.sql.Sql;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteDriverTest {
  private SqliteDriver driver;
  private final List<QueryLogEvent> logged = Collections.synchronizedList(new ArrayList<>());

  @BeforeEach
  void setUp() {
    driver = new SqliteDriver();
    driver.setInstrumentation(InstrumentationContext.logging(logged::add));
    driver.executeRaw("CREATE TABLE users (id INTEGER PRIMARY KEY, email TEXT NOT NULL UNIQUE, active INTEGER, ref TEXT)");
    driver.executeRaw("CREATE TABLE posts (id INTEGER PRIMARY KEY, user_id INTEGER REFERENCES users(id), title TEXT)");
  }

  @AfterEach
  void tearDown() {
    driver.disconnect();
  }

  private long count(Driver d, String table) {
    return ((Number) d.executeRaw("SELECT COUNT(*) AS n FROM " + table).firstRowOrNull().get("n")).longValue();
  }

  @Test
  void booleansRoundTripThroughTheResultParser() {
    driver.executeRaw("INSERT INTO users (email, active) VALUES (?, ?)", List.of("a@x", true));
    driver.executeRaw("INSERT INTO users (email, active) VALUES (?, ?)", List.of("b@x", false));
    driver.executeRaw("INSERT INTO users (email, active) VALUES (?, ?)", Arrays.asList("c@x", null));

    QueryResult r = driver.executeRaw("SELECT email, active FROM users ORDER BY email");
    assertEquals(1, ((Number) r.rows().get(0).get("active")).intValue());

    Map<String, String> types = Map.of("active", "boolean");
    assertEquals(Boolean.TRUE, driver.resultParser().parseRow(r.rows().get(0), types).get("active"));
    assertEquals(Boolean.FALSE, driver.resultParser().parseRow(r.rows().get(1), types).get("active"));
    assertNull(driver.resultParser().parseRow(r.rows().get(2), types).get("active"));
    assertEquals("a@x", driver.resultParser().parseRow(r.rows().get(0), types).get("email"));
  }

  @Test
  void uniqueViolationCarriesTableAndColumns() {
    driver.execute(Sql.builder().append("INSERT INTO users (email) VALUES (").param("dup@x").append(")").build());

    UniqueConstraintException e = assertThrows(UniqueConstraintException.class,
        () -> driver.executeRaw("INSERT INTO users (email) VALUES (?)", List.of("dup@x")));

    assertEquals(ErrorCode.UNIQUE_CONSTRAINT, e.code());
    assertEquals("users", e.table());
    assertEquals(List.of("email"), e.columns());
    assertEquals("INSERT INTO users (email) VALUES (?)", e.sql());
  }

  @Test
  void notNullViolationIsTyped() {
    QueryException e = assertThrows(QueryException.class,
        () -> driver.executeRaw("INSERT INTO users (email) VALUES (?)", Arrays.asList((Object) null)));
    assertEquals(ErrorCode.NOT_NULL_CONSTRAINT, e.code());
  }

  @Test
  void failedBatchCommitsNothing() {
    List<BatchQuery> batch = List.of(
        BatchQuery.of("INSERT INTO users (email) VALUES (?)", "one@x"),
        BatchQuery.of("INSERT INTO users (email) VALUES (?)", "one@x"),
        BatchQuery.of("INSERT INTO users (email) VALUES (?)", "three@x"));

    assertThrows(UniqueConstraintException.class, () -> driver.executeBatch(batch));
    assertEquals(0, count(driver, "users"));
    assertFalse(driver.inTransaction());
  }

  @Test
  void successfulBatchReturnsOneResultPerStatement() {
    List<QueryResult> out = driver.executeBatch(List.of(
        BatchQuery.of("INSERT INTO users (email) VALUES (?)", "one@x"),
        BatchQuery.of("SELECT email FROM users")));

    assertEquals(2, out.size());
    assertEquals(1, out.get(0).rowCount());
    assertEquals("one@x", out.get(1).firstRowOrNull().get("email"));
  }

  @Test
  void nestedFailureRollsBackOnlyTheSavepoint() {
    driver.withTransaction(tx -> {
      tx.executeRaw("INSERT INTO users (email) VALUES (?)", List.of("keep@x"));
      assertThrows(UniqueConstraintException.class, () -> tx.withTransaction(inner -> {
        inner.executeRaw("INSERT INTO users (email) VALUES (?)", List.of("drop@x"));
        return inner.executeRaw("INSERT INTO users (email) VALUES (?)", List.of("keep@x"));
      }));
      assertEquals(1, tx.transactionDepth());
      return null;
    });

    QueryResult r = driver.executeRaw("SELECT email FROM users");
    assertEquals(List.of(Map.of("email", "keep@x")), r.rows());
  }

  @Test
  void failedBatchInsideATransactionIsUndoneWithoutAbortingIt() {
    List<BatchQuery> batch = List.of(
        BatchQuery.of("INSERT INTO users (email) VALUES (?)", "batch@x"),
        BatchQuery.of("INSERT INTO users (email) VALUES (?)", (Object) null));

    driver.withTransaction(tx -> {
      tx.executeRaw("INSERT INTO users (email) VALUES (?)", List.of("before@x"));
      QueryException e = assertThrows(QueryException.class, () -> tx.executeBatch(batch));
      assertEquals(ErrorCode.NOT_NULL_CONSTRAINT, e.code());
      assertEquals(1, count(tx, "users"));
      return null;
    });

    assertEquals(List.of(Map.of("email", "before@x")), driver.executeRaw("SELECT email FROM users").rows());
  }

  @Test
  void viewLeakedFromACommittedTransactionCannotWrite() {
    List<Driver> leaked = new ArrayList<>();
    driver.withTransaction(tx -> {
      leaked.add(tx);
      return tx.executeRaw("INSERT INTO users (email) VALUES (?)", List.of("in@x"));
    });

    TransactionException e = assertThrows(TransactionException.class,
        () -> leaked.get(0).executeRaw("INSERT INTO users (email) VALUES (?)", List.of("late@x")));
    assertEquals(ErrorCode.TRANSACTION_FAILED, e.code());
    assertEquals(1, count(driver, "users"));
  }

  @Test
  void wrappedConnectionIsNotReopenedAfterDisconnect() throws SQLException {
    Connection connection = new SQLiteConfig().createConnection("jdbc:sqlite::memory:");
    SqliteDriver wrapped = new SqliteDriver(connection);
    wrapped.executeRaw("CREATE TABLE t (v INTEGER)");
    wrapped.executeRaw("INSERT INTO t (v) VALUES (1)");
    assertEquals(1, wrapped.executeRaw("SELECT v FROM t").rowCount());

    wrapped.disconnect();

    assertTrue(connection.isClosed());
    ConnectionException e = assertThrows(ConnectionException.class, () -> wrapped.executeRaw("SELECT v FROM t"));
    assertEquals(ErrorCode.CONNECTION_CLOSED, e.code());
    assertFalse(wrapped.isConnected());
  }

  @Test
  void plainStatementsFromOtherThreadsWaitForTheTransaction() throws Exception {
    CompletableFuture<Long> outside = driver.withTransaction(tx -> {
      tx.executeRaw("INSERT INTO users (email) VALUES (?)", List.of("tx@x"));
      assertEquals(1, count(tx, "users"));
      CompletableFuture<Long> f = CompletableFuture.supplyAsync(() -> count(driver, "users"));
      sleep(150);
      assertFalse(f.isDone());
      return f;
    });

    assertEquals(1L, outside.get(5, TimeUnit.SECONDS));
  }

  @Test
  void rolledBackWritesAreGone() {
    assertThrows(IllegalStateException.class, () -> driver.withTransaction(tx -> {
      tx.executeRaw("INSERT INTO users (email) VALUES (?)", List.of("gone@x"));
      throw new IllegalStateException("abort");
    }));
    assertEquals(0, count(driver, "users"));
  }

  @Test
  void onlySerializableIsAcceptedSilently() {
    driver.withTransaction(tx -> tx.executeRaw("SELECT 1"), TransactionOptions.isolation(IsolationLevel.SERIALIZABLE));
    assertTrue(logged.stream().noneMatch(e -> e.level() == QueryLogEvent.Level.WARNING));

    driver.withTransaction(tx -> tx.executeRaw("SELECT 1"), TransactionOptions.isolation(IsolationLevel.READ_UNCOMMITTED));
    QueryLogEvent warning = logged.stream().filter(e -> e.level() == QueryLogEvent.Level.WARNING).findFirst().orElseThrow();
    assertEquals("isolationLevel", warning.meta().get("feature"));
  }

  @Test
  void countAndRelationPayloadsAreNormalised() {
    driver.executeRaw("INSERT INTO users (id, email) VALUES (1, 'a@x')");
    driver.executeRaw("INSERT INTO posts (user_id, title) VALUES (1, 'first'), (1, 'second')");

    QueryResult countResult = driver.executeRaw("SELECT COUNT(*) FROM posts");
    Object normalised = driver.resultParser().parseResult(countResult, Operation.COUNT);
    assertEquals(List.of(Map.of("_result", 2)), normalised);
    assertSame(countResult, driver.resultParser().parseResult(countResult, Operation.FIND_MANY));

    Object payload = driver.executeRaw(
        "SELECT json_group_array(json_object('title', title)) AS posts FROM posts WHERE user_id = ?", List.of(1))
        .firstRowOrNull().get("posts");
    assertInstanceOf(String.class, payload);
    Object parsed = driver.resultParser().parseRelation(payload, RelationType.ONE_TO_MANY);
    assertEquals(List.of(Map.of("title", "first"), Map.of("title", "second")), parsed);
    assertEquals("not json", driver.resultParser().parseRelation("not json", RelationType.ONE_TO_ONE));
  }

  @Test
  void uuidParametersAreStoredAsText() {
    UUID ref = UUID.randomUUID();
    driver.executeRaw("INSERT INTO users (email, ref) VALUES (?, ?)", List.of("u@x", ref));
    assertEquals(ref.toString(), driver.executeRaw("SELECT ref FROM users").firstRowOrNull().get("ref"));
  }

  @Test
  void factoryCreatesAnInMemoryDriver() {
    Driver d = DriverFactories.create("sqlite", Map.of("busyTimeout", "1000"));
    try {
      assertEquals("sqlite", d.driverName());
      assertEquals(1, d.executeRaw("SELECT 1 AS one").rowCount());
    } finally {
      d.disconnect();
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
