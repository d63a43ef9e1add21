package io.intellixity.unisql.jdbc.mysql;

import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.ForeignKeyException;
import io.intellixity.unisql.error.QueryException;
import io.intellixity.unisql.error.TransactionException;
import io.intellixity.unisql.error.UniqueConstraintException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MySqlExceptionTranslatorTest {
  private final MySqlExceptionTranslator t = MySqlExceptionTranslator.INSTANCE;

  @Test
  void duplicateEntryCarriesKeyAndTable() {
    SQLException raw = new SQLException("Duplicate entry 'a@x' for key 'users.users_email_key'", "23000", 1062);

    UniqueConstraintException e = assertInstanceOf(UniqueConstraintException.class,
        t.translate(raw, "INSERT INTO users (email) VALUES (?)", List.of("a@x")));
    assertEquals(ErrorCode.UNIQUE_CONSTRAINT, e.code());
    assertEquals("users_email_key", e.constraint());
    assertEquals("users", e.table());
    assertEquals("1062", e.nativeCode());
    assertEquals(List.of("a@x"), e.params());
    assertFalse(e.isRetryable());
  }

  @Test
  void olderServersReportAnUnqualifiedKey() {
    SQLException raw = new SQLException("Duplicate entry '1' for key 'PRIMARY'", "23000", 1062);

    UniqueConstraintException e = assertInstanceOf(UniqueConstraintException.class, t.translate(raw, "INSERT", List.of()));
    assertEquals("PRIMARY", e.constraint());
    assertNull(e.table());
  }

  @Test
  void foreignKeyViolationsInBothDirections() {
    SQLException child = new SQLException("Cannot add or update a child row: a foreign key constraint fails "
        + "(`app`.`posts`, CONSTRAINT `posts_ibfk_1` FOREIGN KEY (`user_id`) REFERENCES `users` (`id`))", "23000", 1452);
    ForeignKeyException e = assertInstanceOf(ForeignKeyException.class, t.translate(child, "INSERT", List.of()));
    assertEquals("posts_ibfk_1", e.constraint());
    assertEquals("posts", e.table());
    assertEquals("1452", e.nativeCode());

    SQLException parent = new SQLException("Cannot delete or update a parent row: a foreign key constraint fails "
        + "(`app`.`posts`, CONSTRAINT `posts_ibfk_1` FOREIGN KEY (`user_id`) REFERENCES `users` (`id`))", "23000", 1451);
    assertEquals(ErrorCode.FOREIGN_KEY_CONSTRAINT, t.translate(parent, "DELETE", List.of()).code());
  }

  @Test
  void nullAndCheckViolations() {
    DriverException notNull = t.translate(new SQLException("Column 'email' cannot be null", "23000", 1048), "INSERT", List.of());
    assertEquals(ErrorCode.NOT_NULL_CONSTRAINT, notNull.code());

    DriverException check = t.translate(new SQLException("Check constraint 'age_positive' is violated.", "HY000", 3819), "INSERT", List.of());
    assertEquals(ErrorCode.CHECK_CONSTRAINT, check.code());
  }

  @Test
  void deadlockAndLockWaitAreRetryable() {
    DriverException deadlock = t.translate(new SQLException(
        "Deadlock found when trying to get lock; try restarting transaction", "40001", 1213), "UPDATE", List.of());
    assertInstanceOf(TransactionException.class, deadlock);
    assertEquals(ErrorCode.DEADLOCK, deadlock.code());
    assertEquals("1213", deadlock.nativeCode());
    assertTrue(deadlock.isRetryable());

    DriverException lockWait = t.translate(new SQLException(
        "Lock wait timeout exceeded; try restarting transaction", "HY000", 1205), "UPDATE", List.of());
    assertInstanceOf(QueryException.class, lockWait);
    assertEquals(ErrorCode.QUERY_TIMEOUT, lockWait.code());
    assertTrue(lockWait.isRetryable());
  }

  @Test
  void unknownVendorCodesFallBackToSqlState() {
    DriverException noTable = t.translate(new SQLException("Table 'app.nope' doesn't exist", "42S02", 1146), "SELECT", List.of());
    assertEquals(ErrorCode.QUERY_SYNTAX, noTable.code());
    assertEquals("1146", noTable.nativeCode());

    DriverException link = t.translate(new SQLException("Communications link failure", "08S01", 0), "SELECT", List.of());
    assertEquals(ErrorCode.CONNECTION_FAILED, link.code());
    assertEquals("08S01", link.nativeCode());
  }

  @Test
  void findsTheSqlExceptionUnderAWrapper() {
    RuntimeException wrapped = new RuntimeException("pool", new SQLException("You have an error in your SQL syntax", "42000", 1064));
    assertEquals(ErrorCode.QUERY_SYNTAX, t.translate(wrapped, "SELEC 1", List.of()).code());
  }
}
