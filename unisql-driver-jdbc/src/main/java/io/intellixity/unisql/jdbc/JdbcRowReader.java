package io.intellixity.unisql.jdbc;

import java.sql.Array;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link ResultSet} into insertion-ordered rows keyed by column label.
 * <p>
 * Vendor modules override {@link #readValue(ResultSet, int)} to unwrap driver-specific types.
 */
public class JdbcRowReader {
  public static final JdbcRowReader DEFAULT = new JdbcRowReader();

  public List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    String[] labels = labels(rs.getMetaData());
    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(labels.length * 2);
      for (int i = 0; i < labels.length; i++) {
        row.put(labels[i], readValue(rs, i + 1));
      }
      rows.add(row);
    }
    return rows;
  }

  protected Object readValue(ResultSet rs, int index) throws SQLException {
    Object v = rs.getObject(index);
    if (v instanceof Array a) {
      try {
        Object arr = a.getArray();
        return (arr instanceof Object[] oa) ? Arrays.asList(oa) : arr;
      } finally {
        a.free();
      }
    }
    if (v instanceof Clob c) return c.getSubString(1, (int) c.length());
    return v;
  }

  private static String[] labels(ResultSetMetaData md) throws SQLException {
    String[] out = new String[md.getColumnCount()];
    for (int i = 1; i <= out.length; i++) out[i - 1] = md.getColumnLabel(i);
    return out;
  }
}
