package io.intellixity.paging.jdbc.dialect;

import io.intellixity.paging.query.OffsetPage;

/**
 * SQL:2008 dialect ({@code OFFSET .. ROWS FETCH NEXT .. ROWS ONLY}), understood by H2, Postgres,
 * Oracle 12c+ and SQL Server 2012+. Identifiers are emitted unquoted so they fold the way the
 * tables were created.
 */
public final class StandardSqlDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "standard"; }

  @Override
  protected String quoteIdent(String ident) {
    return ident;
  }

  @Override
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " OFFSET " + page.offset() + " ROWS FETCH NEXT " + page.limit() + " ROWS ONLY";
  }
}
