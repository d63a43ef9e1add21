package io.intellixity.unisql.jdbc;

import io.intellixity.unisql.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcPlaceholdersTest {

  @Test
  void rewritesDollarPlaceholdersInOrderOfAppearance() {
    SqlStatement s = JdbcPlaceholders.toJdbc("SELECT * FROM t WHERE b = $2 AND a = $1 OR a = $1", List.of("x", 7));
    assertEquals("SELECT * FROM t WHERE b = ? AND a = ? OR a = ?", s.sql());
    assertEquals(List.of(7, "x", "x"), s.params());
  }

  @Test
  void leavesCastsLiteralsAndQuotedIdentifiersAlone() {
    SqlStatement s = JdbcPlaceholders.toJdbc(
        "SELECT $1::int, '$2 and :3', \"col$1\" FROM t WHERE x = :2", List.of(1, 2));
    assertEquals("SELECT ?::int, '$2 and :3', \"col$1\" FROM t WHERE x = ?", s.sql());
    assertEquals(List.of(1, 2), s.params());
  }

  @Test
  void questionMarkSqlPassesThroughWithItsParams() {
    List<Object> params = Arrays.asList("a", null);
    SqlStatement s = JdbcPlaceholders.toJdbc("UPDATE t SET a = ? WHERE b = ?", params);
    assertEquals("UPDATE t SET a = ? WHERE b = ?", s.sql());
    assertSame(params, s.params());
  }

  @Test
  void keepsNullValues() {
    SqlStatement s = JdbcPlaceholders.toJdbc("INSERT INTO t VALUES ($1, $2)", Arrays.asList(null, 2));
    assertEquals(Arrays.asList(null, 2), s.params());
  }

  @Test
  void placeholderWithoutValueIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> JdbcPlaceholders.toJdbc("SELECT $3", List.of(1)));
    assertTrue(e.getMessage().contains("$3"));
  }
}
