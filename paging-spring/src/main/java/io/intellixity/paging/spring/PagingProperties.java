package io.intellixity.paging.spring;

import io.intellixity.paging.paging.ParamNames;
import io.intellixity.paging.paging.PagingSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@ConfigurationProperties(prefix = "paging")
public class PagingProperties {
  private int pageSize = PagingSettings.DEFAULT_PAGE_SIZE;
  private List<String> ignoredParams = new ArrayList<>(PagingSettings.DEFAULT_IGNORED_PARAMS);
  private final Names paramNames = new Names();

  public int getPageSize() { return pageSize; }
  public void setPageSize(int pageSize) { this.pageSize = pageSize; }
  public List<String> getIgnoredParams() { return ignoredParams; }
  public void setIgnoredParams(List<String> ignoredParams) { this.ignoredParams = ignoredParams; }
  public Names getParamNames() { return paramNames; }

  public PagingSettings toSettings() {
    ParamNames names = new ParamNames(
        paramNames.getLimit(), paramNames.getStart(), paramNames.getSort(), paramNames.getDir(), paramNames.getToDelete());
    return new PagingSettings(pageSize, ignoredParams == null ? null : new LinkedHashSet<>(ignoredParams), names);
  }

  /** Request parameter names; blank values fall back to the defaults. */
  public static class Names {
    private String limit = "limit";
    private String start = "start";
    private String sort = "sort";
    private String dir = "dir";
    private String toDelete = "to_delete";

    public String getLimit() { return limit; }
    public void setLimit(String limit) { this.limit = limit; }
    public String getStart() { return start; }
    public void setStart(String start) { this.start = start; }
    public String getSort() { return sort; }
    public void setSort(String sort) { this.sort = sort; }
    public String getDir() { return dir; }
    public void setDir(String dir) { this.dir = dir; }
    public String getToDelete() { return toDelete; }
    public void setToDelete(String toDelete) { this.toDelete = toDelete; }
  }
}
