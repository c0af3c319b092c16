package io.intellixity.paging.exec;

import io.intellixity.paging.mapping.RowReader;
import io.intellixity.paging.query.OffsetPage;
import io.intellixity.paging.query.Query;
import io.intellixity.paging.query.QueryElement;
import io.intellixity.paging.query.QueryFilters;
import io.intellixity.paging.source.SourceDef;

import java.util.List;
import java.util.Objects;

/**
 * {@link ResultSet} backed by a {@link DataEngine}.
 * <p>
 * Subclasses that add behaviour (for example the {@code ControllerSearch} hook) override
 * {@link #derive(Query)} so refinements keep their type.
 */
public class EngineResultSet<T> implements ResultSet<T> {
  private final DataEngine engine;
  private final SourceDef source;
  private final RowReader<T> reader;
  private final Query query;
  private final Integer rows;
  private final Integer page;

  public EngineResultSet(DataEngine engine, SourceDef source, RowReader<T> reader) {
    this(engine, source, reader, new Query());
  }

  protected EngineResultSet(DataEngine engine, SourceDef source, RowReader<T> reader, Query query) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.source = Objects.requireNonNull(source, "source");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.query = Objects.requireNonNull(query, "query").copy();
    if (this.query.page() instanceof OffsetPage op) {
      this.rows = op.limit();
      this.page = op.offset() / op.limit() + 1;
    } else {
      this.rows = null;
      this.page = null;
    }
  }

  /** Creates a result set of the same kind over {@code query}. */
  protected EngineResultSet<T> derive(Query query) {
    return new EngineResultSet<>(engine, source, reader, query);
  }

  protected DataEngine engine() { return engine; }
  protected RowReader<T> reader() { return reader; }

  @Override public SourceDef source() { return source; }
  /** A copy of the query this result set would execute. */
  @Override public Query query() { return query.copy(); }

  /** Current page size, or null when unpaged. */
  public Integer rows() { return rows; }

  /** Current 1-based page number, or null when unpaged. */
  public Integer page() { return page; }

  @Override
  public EngineResultSet<T> search(QueryElement filter) {
    return search(filter, SearchAttributes.NONE);
  }

  @Override
  public EngineResultSet<T> search(QueryElement filter, SearchAttributes attrs) {
    SearchAttributes a = (attrs == null) ? SearchAttributes.NONE : attrs;
    Query next = query.copy().withFilter(QueryFilters.merge(query.filter(), filter));
    if (a.orderBy() != null) next.withSort(a.orderBy());
    if (a.rows() != null) {
      int p = (a.page() != null) ? a.page() : 1;
      next.withPage(OffsetPage.ofPage(a.rows(), p));
    } else if (a.page() != null && rows != null) {
      next.withPage(OffsetPage.ofPage(rows, a.page()));
    }
    return derive(next);
  }

  @Override
  public List<T> all() {
    return engine.select(source, query, reader);
  }

  @Override
  public long count() {
    return engine.count(source, query);
  }

  @Override
  public long delete() {
    return engine.deleteByCriteria(source, Query.of(query.filter()));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{source=" + source.name() + ", " + query + "}";
  }
}
