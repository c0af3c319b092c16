package io.intellixity.paging.jdbc.dialect;

import io.intellixity.paging.jdbc.Bind;
import io.intellixity.paging.query.OffsetPage;
import io.intellixity.paging.source.ColumnType;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides: quoted identifiers, LIMIT/OFFSET and native ILIKE.
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " LIMIT " + page.limit() + " OFFSET " + page.offset();
  }

  @Override
  protected String renderIlike(String expr, ColumnType type, String pattern, RenderCtx ctx) {
    String target = type.textual() ? expr : "CAST(" + expr + " AS TEXT)";
    return target + " ILIKE " + ctx.add(new Bind(pattern, ColumnType.STRING));
  }
}
