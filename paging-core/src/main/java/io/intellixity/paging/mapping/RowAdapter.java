package io.intellixity.paging.mapping;

import io.intellixity.paging.source.SourceDef;

import java.util.LinkedHashMap;
import java.util.Map;

/** Read access to the current row, addressed by declared column name. */
public interface RowAdapter {
  SourceDef source();

  Object raw(String column);

  default String string(String column) {
    Object v = raw(column);
    return v == null ? null : String.valueOf(v);
  }

  default Long longValue(String column) {
    Object v = raw(column);
    if (v == null) return null;
    if (v instanceof Number n) return n.longValue();
    return Long.valueOf(String.valueOf(v).trim());
  }

  /** All declared columns of the source, in declaration order. */
  default Map<String, Object> map() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (String column : source().columns().keySet()) out.put(column, raw(column));
    return out;
  }
}
