package io.intellixity.paging.paging;

import io.intellixity.paging.exec.ResultSet;

/**
 * Implemented by result sets that translate request parameters into an ordering themselves.
 * {@link PagingSupport#sort} prefers this hook over simple sort.
 */
public interface ControllerSort<T> {
  ResultSet<T> controllerSort(RequestParams params);
}
