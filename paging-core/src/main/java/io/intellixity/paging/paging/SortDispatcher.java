package io.intellixity.paging.paging;

import io.intellixity.paging.exec.ResultSet;
import io.intellixity.paging.exec.SearchAttributes;
import io.intellixity.paging.query.SortField;

import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Dispatch table from sort key to ordering, for {@link ControllerSort} implementations.
 * <p>
 * A registered key maps the requested direction to sort fields (so {@code sort=name} can order by
 * last then first name). Unregistered keys go to the fallback when both sort and direction are
 * present. Without a sort key the result set is returned unchanged.
 */
public final class SortDispatcher {
  private final Map<String, Function<SortField.Direction, List<SortField>>> handlers;
  private final BiFunction<String, SortField.Direction, List<SortField>> fallback;
  private final ParamNames names;

  private SortDispatcher(Map<String, Function<SortField.Direction, List<SortField>>> handlers,
                         BiFunction<String, SortField.Direction, List<SortField>> fallback,
                         ParamNames names) {
    this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    this.fallback = fallback;
    this.names = names;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Ordering for {@code params}, or null when the request does not ask for one. */
  public List<SortField> orderBy(RequestParams params) {
    String sort = params.value(names.sort());
    if (sort == null) return null;
    String dir = params.value(names.dir());

    Function<SortField.Direction, List<SortField>> fn = handlers.get(sort);
    if (fn != null) {
      SortField.Direction d = (dir == null) ? SortField.Direction.ASC : PagingSupport.direction(names.dir(), dir);
      return fn.apply(d);
    }
    if (dir != null) {
      return fallback.apply(sort, PagingSupport.direction(names.dir(), dir));
    }
    return null;
  }

  public <T> ResultSet<T> apply(ResultSet<T> rs, RequestParams params) {
    List<SortField> orderBy = orderBy(params);
    return (orderBy == null || orderBy.isEmpty()) ? rs : rs.search(null, SearchAttributes.orderBy(orderBy));
  }

  public static final class Builder {
    private final Map<String, Function<SortField.Direction, List<SortField>>> handlers = new LinkedHashMap<>();
    private BiFunction<String, SortField.Direction, List<SortField>> fallback =
        (sort, dir) -> List.of(new SortField(sort, dir));
    private ParamNames names = ParamNames.defaults();

    private Builder() {}

    public Builder on(String sortKey, Function<SortField.Direction, List<SortField>> handler) {
      handlers.put(Objects.requireNonNull(sortKey, "sortKey"), Objects.requireNonNull(handler, "handler"));
      return this;
    }

    /** Replaces the default mapping of {@code sort=col&dir=d} to a single sort field on {@code col}. */
    public Builder fallback(BiFunction<String, SortField.Direction, List<SortField>> fallback) {
      this.fallback = Objects.requireNonNull(fallback, "fallback");
      return this;
    }

    public Builder paramNames(ParamNames names) {
      this.names = Objects.requireNonNull(names, "names");
      return this;
    }

    public SortDispatcher build() {
      return new SortDispatcher(handlers, fallback, names);
    }
  }
}
