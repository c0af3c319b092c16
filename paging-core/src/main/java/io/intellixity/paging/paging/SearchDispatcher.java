package io.intellixity.paging.paging;

import io.intellixity.paging.exec.ResultSet;
import io.intellixity.paging.query.QueryElement;
import io.intellixity.paging.query.QueryFilters;

import java.util.*;
import java.util.function.Function;

/**
 * Dispatch table from request key to filter, for {@link ControllerSearch} implementations.
 * <pre>{@code
 * SearchDispatcher.builder()
 *     .on("status", v -> QueryFilters.eq("me.repair_order_status", v))
 *     .on("part", v -> QueryFilters.contains("me.part_id", v))
 *     .build();
 * }</pre>
 * Keys without a handler and keys whose value is blank are skipped.
 */
public final class SearchDispatcher {
  private final Map<String, Function<String, QueryElement>> handlers;

  private SearchDispatcher(Map<String, Function<String, QueryElement>> handlers) {
    this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<String> keys() {
    return handlers.keySet();
  }

  /** AND of the filters produced for {@code params}, or null when no handler applies. */
  public QueryElement filter(RequestParams params) {
    List<QueryElement> parts = new ArrayList<>();
    for (String key : params.keys()) {
      Function<String, QueryElement> fn = handlers.get(key);
      String value = params.value(key);
      if (fn == null || value == null) continue;
      QueryElement el = fn.apply(value);
      if (el != null) parts.add(el);
    }
    if (parts.isEmpty()) return null;
    return (parts.size() == 1) ? parts.get(0) : QueryFilters.and(parts);
  }

  public <T> ResultSet<T> apply(ResultSet<T> rs, RequestParams params) {
    QueryElement filter = filter(params);
    return (filter == null) ? rs : rs.search(filter);
  }

  public static final class Builder {
    private final Map<String, Function<String, QueryElement>> handlers = new LinkedHashMap<>();

    private Builder() {}

    public Builder on(String key, Function<String, QueryElement> handler) {
      handlers.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(handler, "handler"));
      return this;
    }

    public SearchDispatcher build() {
      return new SearchDispatcher(handlers);
    }
  }
}
