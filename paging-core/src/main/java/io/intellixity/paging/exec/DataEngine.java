package io.intellixity.paging.exec;

import io.intellixity.paging.mapping.RowReader;
import io.intellixity.paging.query.Query;
import io.intellixity.paging.source.SourceDef;

import java.util.List;

public interface DataEngine {
  /** Short identifier used in logs (e.g. the dialect id). */
  String id();

  <T> List<T> select(SourceDef source, Query query, RowReader<T> reader);

  /** Counts rows matching the query filter; sort and page are ignored. */
  long count(SourceDef source, Query query);

  /** Deletes rows matching the query filter; sort and page are ignored. */
  long deleteByCriteria(SourceDef source, Query query);

  /** Deferred result set over the whole source. */
  default <T> ResultSet<T> resultSet(SourceDef source, RowReader<T> reader) {
    return new EngineResultSet<>(this, source, reader);
  }
}
