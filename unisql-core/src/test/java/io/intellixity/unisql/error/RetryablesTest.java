package io.intellixity.unisql.error;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RetryablesTest {

  @Test
  void decidedByCodeNotByClass() {
    QueryException serialization = new QueryException("could not serialize", ErrorCode.QUERY_FAILED, "40001", "UPDATE t", List.of(), null);
    QueryException syntax = new QueryException("syntax error", ErrorCode.QUERY_SYNTAX, "42601", "SELEC", List.of(), null);

    assertTrue(serialization.isRetryable());
    assertFalse(syntax.isRetryable());
  }

  @Test
  void retryableErrorCodes() {
    assertTrue(new TransactionException("deadlock", ErrorCode.DEADLOCK, null, null).isRetryable());
    assertTrue(new ConnectionException("timed out", ErrorCode.CONNECTION_TIMEOUT).isRetryable());
    assertFalse(new ConnectionException("refused").isRetryable());
  }

  @Test
  void retryableNativeCodes() {
    assertTrue(Retryables.isRetryableNativeCode("40P01"));
    assertTrue(Retryables.isRetryableNativeCode("SQLITE_BUSY"));
    assertTrue(Retryables.isRetryableNativeCode("1213"));
    assertFalse(Retryables.isRetryableNativeCode("23505"));
    assertFalse(Retryables.isRetryableNativeCode(null));
  }

  @Test
  void rawSqlExceptionsAreInspectedBySqlState() {
    assertTrue(Retryables.isRetryable(new SQLException("deadlock", "40P01")));
    assertTrue(Retryables.isRetryable(new SQLException("lock wait", "HY000", 1205)));
    assertFalse(Retryables.isRetryable(new IllegalStateException("x")));
    assertFalse(Retryables.isRetryable(null));
  }

  @Test
  void genericTranslatorIsIdempotent() {
    DriverException original = new TransactionException("boom");
    assertSame(original, ExceptionTranslator.GENERIC.translate(original, "SELECT 1", List.of()));

    DriverException wrapped = ExceptionTranslator.GENERIC.translate(new IllegalStateException("bad"), "SELECT 1", List.of(1));
    assertInstanceOf(QueryException.class, wrapped);
    assertEquals("SELECT 1", ((QueryException) wrapped).sql());
    assertEquals(List.of(1), ((QueryException) wrapped).params());
  }

  @Test
  void featureNotSupportedCarriesSuggestion() {
    FeatureNotSupportedException e = new FeatureNotSupportedException("vector", "nearest", "Enable the pgvector extension.");
    assertEquals(ErrorCode.FEATURE_NOT_SUPPORTED, e.code());
    assertEquals("U8001", e.code().code());
    assertTrue(e.getMessage().contains("pgvector"));
    assertEquals("nearest", e.toMap().get("method"));
  }
}
