package io.intellixity.paging.jdbc;

import java.util.List;

/** Rendered SQL with {@code ?} placeholders and their binds, in order. */
public record SqlStatement(String sql, List<Bind> binds) {
  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
  }
}
