package io.intellixity.unisql.jdbc.sqlite;

import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.ForeignKeyException;
import io.intellixity.unisql.error.UniqueConstraintException;
import org.junit.jupiter.api.Test;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteExceptionTranslatorTest {
  private final SqliteExceptionTranslator t = SqliteExceptionTranslator.INSTANCE;

  @Test
  void busyIsRetryable() {
    DriverException e = t.translate(new SQLiteException("database is locked", SQLiteErrorCode.SQLITE_BUSY), "UPDATE t", List.of());
    assertEquals("SQLITE_BUSY", e.nativeCode());
    assertTrue(e.isRetryable());
  }

  @Test
  void compositeUniqueKeyListsEveryColumn() {
    SQLiteException raw = new SQLiteException(
        "[SQLITE_CONSTRAINT_UNIQUE] A UNIQUE constraint failed (UNIQUE constraint failed: memberships.org_id, memberships.user_id)",
        SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE);

    UniqueConstraintException e = assertInstanceOf(UniqueConstraintException.class, t.translate(raw, "INSERT", List.of()));
    assertEquals("memberships", e.table());
    assertEquals(List.of("org_id", "user_id"), e.columns());
    assertNull(e.constraint());
  }

  @Test
  void foreignKeyAndSyntaxFailures() {
    DriverException fk = t.translate(new SQLiteException("FOREIGN KEY constraint failed",
        SQLiteErrorCode.SQLITE_CONSTRAINT_FOREIGNKEY), "INSERT", List.of());
    assertInstanceOf(ForeignKeyException.class, fk);

    DriverException syntax = t.translate(new SQLiteException("near \"SELEC\": syntax error",
        SQLiteErrorCode.SQLITE_ERROR), "SELEC 1", List.of());
    assertEquals(ErrorCode.QUERY_SYNTAX, syntax.code());
    assertFalse(syntax.isRetryable());
  }
}
