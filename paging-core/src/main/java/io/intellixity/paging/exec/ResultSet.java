package io.intellixity.paging.exec;

import io.intellixity.paging.query.Query;
import io.intellixity.paging.query.QueryElement;
import io.intellixity.paging.source.SourceDef;

import java.util.List;

/**
 * Deferred, composable query over a {@link SourceDef}. Refinements return new instances; nothing
 * runs until {@link #all()}, {@link #count()} or {@link #delete()}.
 *
 * @param <T> row type produced by {@link #all()}
 */
public interface ResultSet<T> {
  SourceDef source();

  /** The query this result set would execute. */
  Query query();

  /** AND-merge {@code filter} (may be null) into the current filter and apply {@code attrs}. */
  ResultSet<T> search(QueryElement filter, SearchAttributes attrs);

  default ResultSet<T> search(QueryElement filter) {
    return search(filter, SearchAttributes.NONE);
  }

  List<T> all();

  /** Rows matching the filter, ignoring paging. */
  long count();

  /** Deletes the rows matching the filter, ignoring paging and ordering. */
  long delete();

  default String alias() {
    return source().alias();
  }

  default List<String> primaryColumns() {
    return source().primaryColumns();
  }

  /** Column name qualified with the current source alias, e.g. {@code me.name}. */
  default String qualify(String column) {
    return alias() + "." + column;
  }
}
