package io.intellixity.unisql.jdbc.postgres;

import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import java.lang.reflect.Proxy;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresParameterBinderTest {

  /** PreparedStatement double that records setter calls as "method:position:value". */
  private static final class RecordingStatement {
    final List<String> calls = new ArrayList<>();
    final List<Object> values = new ArrayList<>();
    final PreparedStatement proxy = (PreparedStatement) Proxy.newProxyInstance(
        PreparedStatement.class.getClassLoader(), new Class<?>[]{PreparedStatement.class},
        (p, method, args) -> {
          if (!method.getName().startsWith("set")) throw new UnsupportedOperationException(method.getName());
          calls.add(method.getName() + ":" + args[0]);
          values.add(args[1]);
          return null;
        });
  }

  @Test
  void mapsAndListsBindAsJsonb() throws Exception {
    RecordingStatement ps = new RecordingStatement();
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("tags", List.of("a", "b"));
    doc.put("n", 1);

    PostgresParameterBinder.INSTANCE.bindAll(ps.proxy, Arrays.asList(doc, List.of(1, 2), "plain", null));

    assertEquals(List.of("setObject:1", "setObject:2", "setObject:3", "setNull:4"), ps.calls);
    PGobject json = assertInstanceOf(PGobject.class, ps.values.get(0));
    assertEquals("jsonb", json.getType());
    assertEquals("{\"tags\":[\"a\",\"b\"],\"n\":1}", json.getValue());
    assertEquals("[1,2]", ((PGobject) ps.values.get(1)).getValue());
    assertEquals("plain", ps.values.get(2));
  }

  @Test
  void instantsBindAsTimestamps() throws Exception {
    RecordingStatement ps = new RecordingStatement();
    Instant now = Instant.parse("2024-05-01T10:15:30Z");

    PostgresParameterBinder.INSTANCE.bind(ps.proxy, 1, now);

    assertEquals(List.of("setTimestamp:1"), ps.calls);
    assertEquals(Timestamp.from(now), ps.values.get(0));
  }
}
