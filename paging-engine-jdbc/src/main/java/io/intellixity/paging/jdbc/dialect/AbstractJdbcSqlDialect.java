package io.intellixity.paging.jdbc.dialect;

import io.intellixity.paging.jdbc.Bind;
import io.intellixity.paging.jdbc.SqlStatement;
import io.intellixity.paging.query.*;
import io.intellixity.paging.source.ColumnType;
import io.intellixity.paging.source.SourceDef;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.
 * <p>
 * Renders select/count/delete for a single aliased table ({@code FROM people me}): the filter tree
 * becomes a WHERE clause with {@code ?} binds, sort fields an ORDER BY, and the page is left to
 * {@link #applyOffsetPage}. Property names may carry the source alias ({@code me.name}); any name
 * that is not a declared column is rejected, which also keeps request keys out of the SQL text.
 * <p>
 * DB-specific dialects override hooks for quoting, paging and case-insensitive matching.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private final List<Bind> binds = new ArrayList<>();
    public String add(Bind b) {
      binds.add(b);
      return "?";
    }
  }

  @Override
  public final SqlStatement mergeSelect(SourceDef source, Query query) {
    RenderCtx ctx = new RenderCtx();
    List<String> selectItems = new ArrayList<>();
    for (String column : source.columns().keySet()) {
      selectItems.add(columnRef(source, column) + " AS " + quoteIdent(column));
    }
    String sql = "SELECT " + String.join(", ", selectItems) + " FROM " + fromClause(source);
    sql = appendFilter(sql, source, query.filter(), ctx);
    sql = appendSort(sql, source, query.sort());
    if (query.page() instanceof OffsetPage op) sql = applyOffsetPage(sql, op);
    return new SqlStatement(sql, ctx.binds);
  }

  @Override
  public final SqlStatement mergeCount(SourceDef source, Query query) {
    RenderCtx ctx = new RenderCtx();
    String sql = appendFilter("SELECT COUNT(1) FROM " + fromClause(source), source, query.filter(), ctx);
    return new SqlStatement(sql, ctx.binds);
  }

  @Override
  public final SqlStatement renderDelete(SourceDef source, Query query) {
    RenderCtx ctx = new RenderCtx();
    String sql = appendFilter("DELETE FROM " + fromClause(source), source, query.filter(), ctx);
    return new SqlStatement(sql, ctx.binds);
  }

  protected String fromClause(SourceDef source) {
    return quoteIdent(source.table()) + " " + source.alias();
  }

  protected String columnRef(SourceDef source, String column) {
    return source.alias() + "." + quoteIdent(column);
  }

  protected String appendFilter(String base, SourceDef source, QueryElement filter, RenderCtx ctx) {
    if (filter == null) return base;
    String where = renderPredicateSql(source, filter, ctx, false);
    if (where == null || where.isBlank()) return base;
    return base + " WHERE " + stripParensIfAny(where);
  }

  protected String appendSort(String base, SourceDef source, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return base;
    List<String> parts = new ArrayList<>();
    for (SortField sf : sort) {
      String column = resolveColumn(source, sf.field());
      parts.add(columnRef(source, column) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
    }
    return base + " ORDER BY " + String.join(", ", parts);
  }

  /** Dialects append their LIMIT/OFFSET (or OFFSET/FETCH) syntax. */
  protected abstract String applyOffsetPage(String sql, OffsetPage page);

  private String renderPredicateSql(SourceDef source, QueryElement el, RenderCtx ctx, boolean negate) {
    if (el == null) return "";

    if (el instanceof NotElement n) {
      return renderPredicateSql(source, n.element(), ctx, !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        String s = renderPredicateSql(source, c, ctx, negate);
        if (s == null || s.isBlank()) continue;
        childSql.add(s);
      }
      if (childSql.isEmpty()) return "";
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String column = resolveColumn(source, c.property());
    String expr = columnRef(source, column);
    ColumnType type = source.columnType(column);
    boolean not = c.not() ^ negate;
    Object value = c.value();

    return switch (c.operator()) {
      case EQ -> (value == null)
          ? nullCheckSql(expr, true, not)
          : unarySql(expr, "=", coerce(source, column, type, value), type, not, ctx);
      case NE -> (value == null)
          ? nullCheckSql(expr, false, not)
          : unarySql(expr, "<>", coerce(source, column, type, value), type, not, ctx);
      case GT -> unarySql(expr, ">", requireValue(c, value, source, column, type), type, not, ctx);
      case GE -> unarySql(expr, ">=", requireValue(c, value, source, column, type), type, not, ctx);
      case LT -> unarySql(expr, "<", requireValue(c, value, source, column, type), type, not, ctx);
      case LE -> unarySql(expr, "<=", requireValue(c, value, source, column, type), type, not, ctx);
      case LIKE -> unarySql(expr, "LIKE", pattern(c, value), ColumnType.STRING, not, ctx);
      case ILIKE -> {
        String sql = renderIlike(expr, type, pattern(c, value), ctx);
        yield not ? "NOT (" + sql + ")" : sql;
      }
      case IN -> listSql(expr, "IN", toList(value), source, column, type, not, ctx);
      case NIN -> listSql(expr, "NOT IN", toList(value), source, column, type, not, ctx);
    };
  }

  /**
   * Case-insensitive pattern match. Default lower-cases both sides; non-text columns are cast to
   * VARCHAR first.
   */
  protected String renderIlike(String expr, ColumnType type, String pattern, RenderCtx ctx) {
    String target = type.textual() ? expr : "CAST(" + expr + " AS VARCHAR(255))";
    String p = ctx.add(new Bind(pattern.toLowerCase(Locale.ROOT), ColumnType.STRING));
    return "LOWER(" + target + ") LIKE " + p;
  }

  /**
   * Maps a property path to a declared column: {@code name} and {@code me.name} both resolve to
   * {@code name} for a source aliased {@code me}.
   */
  protected String resolveColumn(SourceDef source, String property) {
    String column = property;
    String prefix = source.alias() + ".";
    if (column != null && column.startsWith(prefix)) column = column.substring(prefix.length());
    if (!source.hasColumn(column)) {
      throw new QueryValidationException("Unknown column '" + property + "' for source '" + source.name() + "'");
    }
    return column;
  }

  private static String nullCheckSql(String expr, boolean isNull, boolean not) {
    String sql = expr + (isNull ? " IS NULL" : " IS NOT NULL");
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unarySql(String expr, String op, Object value, ColumnType type, boolean not, RenderCtx ctx) {
    String p = ctx.add(new Bind(value, type));
    String sql = expr + " " + op + " " + p;
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String listSql(String expr, String op, List<Object> vals, SourceDef source, String column,
                                ColumnType type, boolean not, RenderCtx ctx) {
    if (vals.isEmpty()) {
      // IN () matches nothing, NOT IN () everything
      boolean matches = "NOT IN".equals(op) ^ not;
      return matches ? "TRUE" : "FALSE";
    }
    List<String> ph = new ArrayList<>();
    for (Object x : vals) ph.add(ctx.add(new Bind(coerce(source, column, type, x), type)));
    String sql = expr + " " + op + " (" + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static Object requireValue(Condition c, Object value, SourceDef source, String column, ColumnType type) {
    if (value == null) throw new QueryValidationException(c.operator() + " requires a non-null value for '" + c.property() + "'");
    return coerce(source, column, type, value);
  }

  private static String pattern(Condition c, Object value) {
    if (value == null) throw new QueryValidationException(c.operator() + " requires a non-null pattern for '" + c.property() + "'");
    return String.valueOf(value);
  }

  private static Object coerce(SourceDef source, String column, ColumnType type, Object value) {
    try {
      return type.coerce(value);
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException(
          "Invalid value for column '" + column + "' of source '" + source.name() + "': " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof List<?> l) return (List<Object>) l;
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }

  protected String stripParensIfAny(String s) {
    if (s == null) return null;
    String t = s.trim();
    if (t.startsWith("(") && t.endsWith(")") && balanced(t.substring(1, t.length() - 1))) {
      return t.substring(1, t.length() - 1);
    }
    return t;
  }

  private static boolean balanced(String s) {
    int depth = 0;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '(') depth++;
      else if (ch == ')' && --depth < 0) return false;
    }
    return depth == 0;
  }

  protected abstract String quoteIdent(String ident);
}
