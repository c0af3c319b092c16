package io.intellixity.paging.jdbc;

import io.intellixity.paging.mapping.RowAdapter;
import io.intellixity.paging.source.SourceDef;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the current row of a JDBC result set by declared column name. Label lookup ignores case
 * because databases differ in how they fold unquoted identifiers.
 */
public final class JdbcRowAdapter implements RowAdapter {
  private final java.sql.ResultSet rs;
  private final SourceDef source;
  private Map<String, Integer> colIndex;

  public JdbcRowAdapter(java.sql.ResultSet rs, SourceDef source) {
    this.rs = rs;
    this.source = source;
  }

  @Override public SourceDef source() { return source; }

  @Override
  public Object raw(String column) {
    try {
      return rs.getObject(indexOf(column));
    } catch (SQLException e) {
      throw new IllegalStateException("Cannot read column '" + column + "' of source '" + source.name() + "'", e);
    }
  }

  private int indexOf(String column) throws SQLException {
    if (colIndex == null) {
      Map<String, Integer> idx = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
      ResultSetMetaData md = rs.getMetaData();
      for (int i = 1; i <= md.getColumnCount(); i++) idx.putIfAbsent(md.getColumnLabel(i), i);
      colIndex = idx;
    }
    Integer i = colIndex.get(column);
    if (i == null) throw new IllegalArgumentException("Column not in result: " + column);
    return i;
  }
}
