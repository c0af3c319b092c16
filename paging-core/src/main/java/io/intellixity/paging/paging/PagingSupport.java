package io.intellixity.paging.paging;

import io.intellixity.paging.exec.ResultSet;
import io.intellixity.paging.exec.SearchAttributes;
import io.intellixity.paging.query.Condition;
import io.intellixity.paging.query.QueryElement;
import io.intellixity.paging.query.QueryFilters;
import io.intellixity.paging.query.SortField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Maps request parameters onto result-set refinements: paging ({@code limit}/{@code start}), sorting
 * ({@code sort}/{@code dir}), substring search on arbitrary columns, and deletion by primary key
 * ({@code to_delete}).
 * <p>
 * Every operation except {@link #simpleDeletion} returns a new deferred {@link ResultSet}; nothing
 * is executed until the caller reads it.
 */
public final class PagingSupport {
  private static final Logger log = LoggerFactory.getLogger(PagingSupport.class);

  private final PagingSettings settings;

  public PagingSupport(PagingSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public PagingSettings settings() {
    return settings;
  }

  /** {@link #sort} then {@link #paginate}. */
  public <T> ResultSet<T> pageAndSort(RequestParams params, ResultSet<T> rs) {
    return paginate(params, sort(params, rs));
  }

  public <T> ResultSet<T> paginate(RequestParams params, ResultSet<T> rs) {
    return rs.search(null, pageAttributes(params));
  }

  /**
   * Rows and page for the request: {@code rows = limit} (or the configured page size) and
   * {@code page = start / rows + 1}.
   */
  public SearchAttributes pageAttributes(RequestParams params) {
    ParamNames names = settings.paramNames();
    int rows = settings.pageSize();
    String limit = params.value(names.limit());
    if (limit != null) {
      rows = parseInt(names.limit(), limit);
      if (rows <= 0) throw new PagingParameterException(names.limit(), names.limit() + " must be > 0 but was " + rows);
    }
    int start = 0;
    String rawStart = params.value(names.start());
    if (rawStart != null) {
      start = parseInt(names.start(), rawStart);
      if (start < 0) throw new PagingParameterException(names.start(), names.start() + " must be >= 0 but was " + start);
    }
    long page = (long) start / rows + 1;
    if (page > Integer.MAX_VALUE) {
      throw new PagingParameterException(names.start(), names.start() + " is too large for " + names.limit() + " " + rows + ": " + start);
    }
    log.debug("paging.paginate rows={} start={} page={}", rows, start, page);
    return SearchAttributes.paged(rows, (int) page);
  }

  /** Delegates to {@link ControllerSearch} when {@code rs} implements it, else {@link #simpleSearch}. */
  public <T> ResultSet<T> search(RequestParams params, ResultSet<T> rs) {
    if (rs instanceof ControllerSearch<?> hook) {
      log.debug("paging.search delegating to controllerSearch of {}", rs.source().name());
      @SuppressWarnings("unchecked")
      ControllerSearch<T> typed = (ControllerSearch<T>) hook;
      return typed.controllerSearch(params);
    }
    return simpleSearch(params, rs);
  }

  /** Delegates to {@link ControllerSort} when {@code rs} implements it, else {@link #simpleSort}. */
  public <T> ResultSet<T> sort(RequestParams params, ResultSet<T> rs) {
    if (rs instanceof ControllerSort<?> hook) {
      log.debug("paging.sort delegating to controllerSort of {}", rs.source().name());
      @SuppressWarnings("unchecked")
      ControllerSort<T> typed = (ControllerSort<T>) hook;
      return typed.controllerSort(params);
    }
    return simpleSort(params, rs);
  }

  /**
   * Case-insensitive substring filter for every non-ignored key with a non-blank value. Values of
   * one key are OR-ed, distinct keys AND-ed.
   */
  public <T> ResultSet<T> simpleSearch(RequestParams params, ResultSet<T> rs) {
    List<QueryElement> searches = new ArrayList<>();
    for (String key : params.keys()) {
      if (settings.ignores(key)) continue;
      List<String> values = params.nonBlank(key);
      if (values.isEmpty()) continue;
      String column = rs.qualify(key);
      if (values.size() == 1) {
        searches.add(QueryFilters.contains(column, values.get(0)));
      } else {
        List<Condition> alternatives = new ArrayList<>();
        for (String v : values) alternatives.add(QueryFilters.contains(column, v));
        searches.add(QueryFilters.or(alternatives));
      }
    }
    if (searches.isEmpty()) return rs;
    log.debug("paging.simple_search source={} filters={}", rs.source().name(), searches.size());
    QueryElement filter = (searches.size() == 1) ? searches.get(0) : QueryFilters.and(searches);
    return rs.search(filter);
  }

  /**
   * Orders by {@code sort} in direction {@code dir} when both are given, otherwise by the primary
   * key.
   */
  public <T> ResultSet<T> simpleSort(RequestParams params, ResultSet<T> rs) {
    ParamNames names = settings.paramNames();
    String sort = params.value(names.sort());
    String dir = params.value(names.dir());
    List<SortField> orderBy = new ArrayList<>();
    if (sort != null && dir != null) {
      orderBy.add(new SortField(rs.qualify(sort), direction(names.dir(), dir)));
    } else {
      for (String pk : rs.primaryColumns()) orderBy.add(SortField.asc(rs.qualify(pk)));
    }
    log.debug("paging.simple_sort source={} orderBy={}", rs.source().name(), orderBy);
    return rs.search(null, SearchAttributes.orderBy(orderBy));
  }

  /**
   * Deletes the rows whose primary key is listed in {@code to_delete} and returns the identifiers.
   * With a single primary column each value may hold several comma-separated ids; with a composite
   * key each value is one comma-separated tuple in primary-column order.
   */
  public <T> List<String> simpleDeletion(RequestParams params, ResultSet<T> rs) {
    String param = settings.paramNames().toDelete();
    List<String> toDelete = params.nonBlank(param);
    if (toDelete.isEmpty()) {
      throw new PagingParameterException(param, "Required request parameter (" + param + ") undefined!");
    }

    List<String> pks = rs.primaryColumns();
    List<String> deleted = new ArrayList<>();
    QueryElement expression;
    if (pks.size() == 1) {
      for (String v : toDelete) {
        for (String id : v.split(",")) {
          String trimmed = id.trim();
          if (!trimmed.isEmpty()) deleted.add(trimmed);
        }
      }
      if (deleted.isEmpty()) {
        throw new PagingParameterException(param, "Required request parameter (" + param + ") undefined!");
      }
      expression = QueryFilters.in(rs.qualify(pks.get(0)), deleted);
    } else {
      List<QueryElement> tuples = new ArrayList<>();
      for (String tuple : toDelete) {
        String[] parts = tuple.split(",", -1);
        if (parts.length != pks.size()) {
          throw new PagingParameterException(param,
              "Expected " + pks.size() + " comma-separated key values (" + String.join(",", pks) + ") but got '" + tuple + "'");
        }
        List<QueryElement> eqs = new ArrayList<>();
        for (int i = 0; i < pks.size(); i++) eqs.add(QueryFilters.eq(rs.qualify(pks.get(i)), parts[i].trim()));
        tuples.add(QueryFilters.and(eqs));
        deleted.add(tuple);
      }
      expression = QueryFilters.or(tuples);
    }

    long n = rs.search(expression).delete();
    log.debug("paging.simple_deletion source={} requested={} deleted={}", rs.source().name(), deleted.size(), n);
    return List.copyOf(deleted);
  }

  /** Parses {@code asc}/{@code desc} (any case). */
  static SortField.Direction direction(String param, String dir) {
    return switch (dir.trim().toLowerCase(Locale.ROOT)) {
      case "asc" -> SortField.Direction.ASC;
      case "desc" -> SortField.Direction.DESC;
      default -> throw new PagingParameterException(param, param + " must be 'asc' or 'desc' but was '" + dir + "'");
    };
  }

  private static int parseInt(String param, String raw) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new PagingParameterException(param, param + " must be an integer but was '" + raw + "'", e);
    }
  }
}
