package io.intellixity.paging.paging;

import java.util.*;

/**
 * Configuration of the paging role.
 *
 * @param pageSize rows per page when the request carries no limit
 * @param ignoredParams request keys that simple search never turns into filters
 * @param paramNames names of the recognized request parameters
 */
public record PagingSettings(int pageSize, Set<String> ignoredParams, ParamNames paramNames) {
  public static final int DEFAULT_PAGE_SIZE = 25;
  public static final Set<String> DEFAULT_IGNORED_PARAMS =
      Collections.unmodifiableSet(new LinkedHashSet<>(List.of("limit", "start", "sort", "dir", "_dc", "rm", "xaction")));

  public PagingSettings {
    if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
    ignoredParams = Collections.unmodifiableSet(new LinkedHashSet<>(ignoredParams == null ? DEFAULT_IGNORED_PARAMS : ignoredParams));
    paramNames = (paramNames == null) ? ParamNames.defaults() : paramNames;
  }

  public static PagingSettings defaults() {
    return new PagingSettings(DEFAULT_PAGE_SIZE, DEFAULT_IGNORED_PARAMS, ParamNames.defaults());
  }

  public PagingSettings withPageSize(int pageSize) {
    return new PagingSettings(pageSize, ignoredParams, paramNames);
  }

  public PagingSettings withIgnoredParams(Collection<String> ignoredParams) {
    return new PagingSettings(pageSize, new LinkedHashSet<>(ignoredParams), paramNames);
  }

  public PagingSettings withParamNames(ParamNames paramNames) {
    return new PagingSettings(pageSize, ignoredParams, paramNames);
  }

  public boolean ignores(String key) {
    return ignoredParams.contains(key);
  }
}
