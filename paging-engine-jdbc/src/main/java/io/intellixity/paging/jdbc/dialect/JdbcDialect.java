package io.intellixity.paging.jdbc.dialect;

import io.intellixity.paging.jdbc.SqlStatement;
import io.intellixity.paging.query.Query;
import io.intellixity.paging.source.SourceDef;

/** Renders queries over a {@link SourceDef} to JDBC statements. */
public interface JdbcDialect {
  String id();

  /** Filter, sort and page applied to a select of every declared column. */
  SqlStatement mergeSelect(SourceDef source, Query query);

  /** Row count of the filter; sort and page are ignored. */
  SqlStatement mergeCount(SourceDef source, Query query);

  /** Delete of the rows matching the filter; sort and page are ignored. */
  SqlStatement renderDelete(SourceDef source, Query query);
}
