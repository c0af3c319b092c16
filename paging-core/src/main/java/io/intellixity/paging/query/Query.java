package io.intellixity.paging.query;

import java.util.*;

public final class Query {
  private QueryElement filter;
  private Page page;
  private List<SortField> sort = new ArrayList<>();

  public Query() {}

  public QueryElement filter() { return filter; }
  public Page page() { return page; }
  public List<SortField> sort() { return sort; }

  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  public Query withPage(Page page) { this.page = page; return this; }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }

  /** Shallow copy; elements are immutable so only the sort list is duplicated. */
  public Query copy() {
    return new Query().withFilter(filter).withPage(page).withSort(sort);
  }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  @Override
  public String toString() {
    return "Query{filter=" + filter + ", sort=" + sort + ", page=" + page + "}";
  }
}
