package io.intellixity.paging.mapping;

import java.util.Map;

public final class RowReaders {
  private RowReaders() {}

  /** Reads each row as an ordered column-to-value map. */
  public static RowReader<Map<String, Object>> asMap() {
    return RowAdapter::map;
  }
}
