package io.intellixity.paging.paging;

import io.intellixity.paging.exec.ResultSet;
import io.intellixity.paging.exec.SearchAttributes;

import java.util.List;

/**
 * Mixin for controllers that page, search, sort and delete through request parameters.
 * <p>
 * Implementors override {@link #pagingSettings()} to change the page size, the ignored search keys
 * or the parameter names. A typical listing action reads:
 * <pre>{@code
 * ResultSet<Person> people = pageAndSort(params, search(params, peopleResultSet()));
 * }</pre>
 */
public interface DoesPaging {
  default PagingSettings pagingSettings() {
    return PagingSettings.defaults();
  }

  default PagingSupport paging() {
    return new PagingSupport(pagingSettings());
  }

  default <T> ResultSet<T> pageAndSort(RequestParams params, ResultSet<T> rs) {
    return paging().pageAndSort(params, rs);
  }

  default <T> ResultSet<T> paginate(RequestParams params, ResultSet<T> rs) {
    return paging().paginate(params, rs);
  }

  default SearchAttributes pageAttributes(RequestParams params) {
    return paging().pageAttributes(params);
  }

  default <T> ResultSet<T> search(RequestParams params, ResultSet<T> rs) {
    return paging().search(params, rs);
  }

  default <T> ResultSet<T> sort(RequestParams params, ResultSet<T> rs) {
    return paging().sort(params, rs);
  }

  default <T> ResultSet<T> simpleSearch(RequestParams params, ResultSet<T> rs) {
    return paging().simpleSearch(params, rs);
  }

  default <T> ResultSet<T> simpleSort(RequestParams params, ResultSet<T> rs) {
    return paging().simpleSort(params, rs);
  }

  default <T> List<String> simpleDeletion(RequestParams params, ResultSet<T> rs) {
    return paging().simpleDeletion(params, rs);
  }
}
