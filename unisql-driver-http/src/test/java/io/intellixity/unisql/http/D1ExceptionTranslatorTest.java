package io.intellixity.unisql.http;

import io.intellixity.unisql.error.ConnectionException;
import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.ForeignKeyException;
import io.intellixity.unisql.error.QueryException;
import io.intellixity.unisql.error.UniqueConstraintException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class D1ExceptionTranslatorTest {
  private final D1ExceptionTranslator t = D1ExceptionTranslator.INSTANCE;

  private static D1ApiException api(int status, int code, String message) {
    return D1ApiException.fromErrors(status, List.of(new D1Response.ApiError(code, message)));
  }

  @Test
  void compositeUniqueKeyListsEveryColumn() {
    DriverException e = t.translate(api(400, 7500,
        "UNIQUE constraint failed: memberships.org_id, memberships.user_id: SQLITE_CONSTRAINT"), "INSERT", List.of());

    UniqueConstraintException u = assertInstanceOf(UniqueConstraintException.class, e);
    assertEquals("memberships", u.table());
    assertEquals(List.of("org_id", "user_id"), u.columns());
  }

  @Test
  void otherConstraintFailures() {
    assertInstanceOf(ForeignKeyException.class,
        t.translate(api(400, 7500, "FOREIGN KEY constraint failed: SQLITE_CONSTRAINT"), "INSERT", List.of()));
    assertEquals(ErrorCode.NOT_NULL_CONSTRAINT,
        t.translate(api(400, 7500, "NOT NULL constraint failed: users.email"), "INSERT", List.of()).code());
    assertEquals(ErrorCode.CHECK_CONSTRAINT,
        t.translate(api(400, 7500, "CHECK constraint failed: age > 0"), "INSERT", List.of()).code());
    assertEquals(ErrorCode.QUERY_SYNTAX,
        t.translate(api(400, 7500, "no such table: nope"), "SELECT", List.of()).code());
  }

  @Test
  void unclassifiedApiErrorKeepsTheD1Code() {
    QueryException e = assertInstanceOf(QueryException.class,
        t.translate(api(400, 7400, "D1_ERROR: something else"), "SELECT 1", List.of()));
    assertEquals(ErrorCode.QUERY_FAILED, e.code());
    assertEquals("7400", e.nativeCode());
    assertEquals("SELECT 1", e.sql());
  }

  @Test
  void throttlingAndServerErrorsAreRetryable() {
    DriverException throttled = t.translate(new D1ApiException("too many requests", 429, List.of()), "SELECT 1", List.of());
    assertInstanceOf(ConnectionException.class, throttled);
    assertEquals("HTTP_429", throttled.nativeCode());
    assertTrue(throttled.isRetryable());

    assertTrue(t.translate(new D1ApiException("bad gateway", 502, List.of()), "SELECT 1", List.of()).isRetryable());
  }

  @Test
  void transportFailures() {
    DriverException timeout = t.translate(new HttpTimeoutException("request timed out"), "SELECT 1", List.of());
    assertEquals(ErrorCode.CONNECTION_TIMEOUT, timeout.code());

    DriverException io = t.translate(new IOException("connection reset"), "SELECT 1", List.of());
    assertInstanceOf(ConnectionException.class, io);
    assertEquals(ErrorCode.CONNECTION_FAILED, io.code());
    assertFalse(io.isRetryable());
  }

  @Test
  void driverExceptionsPassThrough() {
    DriverException original = new QueryException("already translated", "SELECT 1", List.of());
    assertSame(original, t.translate(original, "SELECT 1", List.of()));
  }
}
