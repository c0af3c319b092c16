package io.intellixity.paging.paging;

/**
 * Names of the request parameters read by {@link PagingSupport}.
 *
 * @param limit rows per page
 * @param start zero-based offset of the first row
 * @param sort column to sort by
 * @param dir sort direction, {@code asc} or {@code desc}
 * @param toDelete primary-key values (or comma-separated key tuples) to delete
 */
public record ParamNames(String limit, String start, String sort, String dir, String toDelete) {
  private static final ParamNames DEFAULTS = new ParamNames("limit", "start", "sort", "dir", "to_delete");

  public ParamNames {
    limit = orDefault(limit, "limit");
    start = orDefault(start, "start");
    sort = orDefault(sort, "sort");
    dir = orDefault(dir, "dir");
    toDelete = orDefault(toDelete, "to_delete");
  }

  public static ParamNames defaults() {
    return DEFAULTS;
  }

  private static String orDefault(String v, String dflt) {
    return (v == null || v.isBlank()) ? dflt : v;
  }
}
