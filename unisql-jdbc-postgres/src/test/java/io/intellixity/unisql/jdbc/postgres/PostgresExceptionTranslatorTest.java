package io.intellixity.unisql.jdbc.postgres;

import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.ForeignKeyException;
import io.intellixity.unisql.error.TransactionException;
import io.intellixity.unisql.error.UniqueConstraintException;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresExceptionTranslatorTest {
  private final PostgresExceptionTranslator t = PostgresExceptionTranslator.INSTANCE;

  /** Backend error fields as the server sends them: one type byte, the value, a NUL terminator. */
  private static PSQLException serverError(String... fields) {
    StringBuilder raw = new StringBuilder();
    for (String f : fields) raw.append(f).append('\0');
    return new PSQLException(new ServerErrorMessage(raw.toString()));
  }

  @Test
  void uniqueViolationCarriesServerMetadata() {
    PSQLException e = serverError(
        "SERROR", "C23505",
        "Mduplicate key value violates unique constraint \"members_org_email_key\"",
        "DKey (org_id, email)=(1, a@x) already exists.",
        "tmembers", "nmembers_org_email_key");

    DriverException out = t.translate(e, "INSERT INTO members VALUES ($1, $2)", List.of(1, "a@x"));

    UniqueConstraintException u = assertInstanceOf(UniqueConstraintException.class, out);
    assertEquals("members_org_email_key", u.constraint());
    assertEquals("members", u.table());
    assertEquals(List.of("org_id", "email"), u.columns());
    assertEquals("23505", u.nativeCode());
    assertEquals(List.of(1, "a@x"), u.params());
  }

  @Test
  void foreignKeyViolation() {
    PSQLException e = serverError(
        "SERROR", "C23503",
        "Minsert or update on table \"posts\" violates foreign key constraint \"posts_user_id_fkey\"",
        "tposts", "nposts_user_id_fkey");

    ForeignKeyException fk = assertInstanceOf(ForeignKeyException.class, t.translate(e, "INSERT", List.of()));
    assertEquals("posts_user_id_fkey", fk.constraint());
    assertEquals("posts", fk.table());
  }

  @Test
  void notNullReportsTheColumn() {
    PSQLException e = serverError("SERROR", "C23502",
        "Mnull value in column \"email\" violates not-null constraint", "tusers", "cemail");
    DriverException out = t.translate(e, "INSERT", List.of());
    assertEquals(ErrorCode.NOT_NULL_CONSTRAINT, out.code());
  }

  @Test
  void deadlockIsARetryableTransactionFailure() {
    DriverException out = t.translate(serverError("SERROR", "C40P01", "Mdeadlock detected"), "UPDATE", List.of());
    assertInstanceOf(TransactionException.class, out);
    assertEquals(ErrorCode.DEADLOCK, out.code());
    assertTrue(out.isRetryable());
  }
}
