package io.intellixity.unisql.sql;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class StatementShapeTest {

  @Test
  void readsAndReturningClausesHaveRows() {
    assertTrue(StatementShape.of("select * from t").hasRows());
    assertTrue(StatementShape.of("  WITH x AS (SELECT 1) SELECT * FROM x").hasRows());
    assertTrue(StatementShape.of("INSERT INTO t(a) VALUES (?) RETURNING id").hasRows());
    assertTrue(StatementShape.of("delete from t where id = 1 returning *").hasRows());
  }

  @Test
  void writesAffectRows() {
    assertEquals(StatementShape.AFFECTS_ROWS, StatementShape.of("INSERT INTO t(a) VALUES (1)"));
    assertEquals(StatementShape.AFFECTS_ROWS, StatementShape.of("UPDATE t SET returning_customer = 1"));
    assertEquals(StatementShape.AFFECTS_ROWS, StatementShape.of("CREATE TABLE t (id INTEGER)"));
    assertEquals(StatementShape.AFFECTS_ROWS, StatementShape.of(null));
  }
}
