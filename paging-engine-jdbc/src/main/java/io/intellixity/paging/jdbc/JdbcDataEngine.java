package io.intellixity.paging.jdbc;

import io.intellixity.paging.exec.DataEngine;
import io.intellixity.paging.jdbc.dialect.JdbcDialect;
import io.intellixity.paging.mapping.RowReader;
import io.intellixity.paging.query.Query;
import io.intellixity.paging.source.SourceDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link DataEngine} over a JDBC {@link DataSource}. Each call borrows one connection and runs in
 * the connection's own transaction mode (auto-commit for pooled data sources).
 */
public final class JdbcDataEngine implements DataEngine {
  private static final Logger log = LoggerFactory.getLogger(JdbcDataEngine.class);

  private final DataSource ds;
  private final JdbcDialect dialect;

  public JdbcDataEngine(DataSource ds, JdbcDialect dialect) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override public String id() { return "jdbc:" + dialect.id(); }

  public JdbcDialect dialect() { return dialect; }

  @Override
  public <T> List<T> select(SourceDef source, Query query, RowReader<T> reader) {
    SqlStatement ss = dialect.mergeSelect(source, query);
    try (Connection c = ds.getConnection()) {
      long start = System.nanoTime();
      debugSql("SELECT", source, ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
        bindAll(ps, ss);
        try (java.sql.ResultSet rs = ps.executeQuery()) {
          List<T> out = new ArrayList<>();
          JdbcRowAdapter row = new JdbcRowAdapter(rs, source);
          while (rs.next()) out.add(reader.read(row));
          debugDone("SELECT", source, out.size(), System.nanoTime() - start);
          return out;
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("SELECT failed for source '" + source.name() + "'", e);
    }
  }

  @Override
  public long count(SourceDef source, Query query) {
    SqlStatement ss = dialect.mergeCount(source, query);
    try (Connection c = ds.getConnection()) {
      long start = System.nanoTime();
      debugSql("COUNT", source, ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
        bindAll(ps, ss);
        try (java.sql.ResultSet rs = ps.executeQuery()) {
          if (!rs.next()) return 0;
          long v = rs.getLong(1);
          debugDone("COUNT", source, v, System.nanoTime() - start);
          return v;
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("COUNT failed for source '" + source.name() + "'", e);
    }
  }

  @Override
  public long deleteByCriteria(SourceDef source, Query query) {
    SqlStatement ss = dialect.renderDelete(source, query);
    try (Connection c = ds.getConnection()) {
      long start = System.nanoTime();
      debugSql("DELETE", source, ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
        bindAll(ps, ss);
        long n = ps.executeUpdate();
        debugDone("DELETE", source, n, System.nanoTime() - start);
        return n;
      }
    } catch (SQLException e) {
      throw new IllegalStateException("DELETE failed for source '" + source.name() + "'", e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    for (int i = 0; i < stmt.binds().size(); i++) {
      Object v = stmt.binds().get(i).value();
      if (v == null) ps.setNull(i + 1, Types.NULL);
      else ps.setObject(i + 1, v);
    }
  }

  private void debugSql(String op, SourceDef source, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("paging.jdbc op={} dialect={} source={} bindCount={} sql={}",
        op, dialect.id(), source.name(), ss.binds().size(), ss.sql());

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        log.trace("paging.jdbc bind index={} columnType={} valueType={}",
            idx++, b.type(), v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private void debugDone(String op, SourceDef source, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("paging.jdbc_done op={} source={} durationMs={} result={}",
        op, source.name(), durationNanos / 1_000_000.0, result);
  }
}
