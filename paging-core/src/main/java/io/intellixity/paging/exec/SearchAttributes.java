package io.intellixity.paging.exec;

import io.intellixity.paging.query.SortField;

import java.util.List;

/**
 * Options applied by {@link ResultSet#search(io.intellixity.paging.query.QueryElement, SearchAttributes)}.
 * Null components leave the corresponding option of the result set untouched.
 *
 * @param orderBy sort fields, replacing any previous ordering
 * @param rows page size
 * @param page 1-based page number; defaults to 1 when only rows is given
 */
public record SearchAttributes(List<SortField> orderBy, Integer rows, Integer page) {
  public static final SearchAttributes NONE = new SearchAttributes(null, null, null);

  public SearchAttributes {
    orderBy = (orderBy == null) ? null : List.copyOf(orderBy);
    if (rows != null && rows <= 0) throw new IllegalArgumentException("rows must be > 0");
    if (page != null && page <= 0) throw new IllegalArgumentException("page must be > 0");
  }

  public static SearchAttributes orderBy(List<SortField> orderBy) {
    return new SearchAttributes(orderBy, null, null);
  }

  public static SearchAttributes paged(int rows, int page) {
    return new SearchAttributes(null, rows, page);
  }
}
