package io.intellixity.paging.paging;

import io.intellixity.paging.exec.ResultSet;

/**
 * Implemented by result sets that translate request parameters into filters themselves.
 * {@link PagingSupport#search} prefers this hook over simple search.
 */
public interface ControllerSearch<T> {
  ResultSet<T> controllerSearch(RequestParams params);
}
