package io.intellixity.paging.mapping;

import io.intellixity.paging.source.SourceDef;

import java.util.Map;
import java.util.Objects;

/** Row adapter over an in-memory map, for engines that materialize rows themselves. */
public final class MapRowAdapter implements RowAdapter {
  private final SourceDef source;
  private final Map<String, ?> values;

  public MapRowAdapter(SourceDef source, Map<String, ?> values) {
    this.source = Objects.requireNonNull(source, "source");
    this.values = Objects.requireNonNull(values, "values");
  }

  @Override public SourceDef source() { return source; }

  @Override
  public Object raw(String column) {
    return values.get(column);
  }
}
