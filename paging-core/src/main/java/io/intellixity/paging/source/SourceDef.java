package io.intellixity.paging.source;

import java.util.*;

/**
 * A relational source: one table, the alias it is queried under, its declared columns and its
 * primary key.
 *
 * @param name logical name (used in messages and logs)
 * @param table physical table name
 * @param alias table alias used to qualify columns ("me" unless given)
 * @param primaryColumns primary-key columns in key order
 * @param columns declared columns in select order
 */
public record SourceDef(
    String name,
    String table,
    String alias,
    List<String> primaryColumns,
    Map<String, ColumnType> columns
) {
  public static final String DEFAULT_ALIAS = "me";

  public SourceDef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    if (table == null || table.isBlank()) throw new IllegalArgumentException("table is required");
    alias = (alias == null || alias.isBlank()) ? DEFAULT_ALIAS : alias;
    columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns == null ? Map.of() : columns));
    primaryColumns = List.copyOf(primaryColumns == null ? List.of() : primaryColumns);
    if (primaryColumns.isEmpty()) throw new IllegalArgumentException("Source '" + name + "' has no primary columns");
    for (String pk : primaryColumns) {
      if (!columns.containsKey(pk)) {
        throw new IllegalArgumentException("Primary column '" + pk + "' is not a declared column of '" + name + "'");
      }
    }
  }

  public boolean hasColumn(String column) {
    return column != null && columns.containsKey(column);
  }

  /** Type of a declared column, or null if the column is unknown. */
  public ColumnType columnType(String column) {
    return column == null ? null : columns.get(column);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private String table;
    private String alias;
    private final List<String> primaryColumns = new ArrayList<>();
    private final Map<String, ColumnType> columns = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
      this.table = name;
    }

    public Builder table(String table) { this.table = table; return this; }
    public Builder alias(String alias) { this.alias = alias; return this; }

    public Builder column(String column, ColumnType type) {
      columns.put(column, Objects.requireNonNull(type, "type"));
      return this;
    }

    /** Declares a column and appends it to the primary key. */
    public Builder primaryColumn(String column, ColumnType type) {
      column(column, type);
      primaryColumns.add(column);
      return this;
    }

    public SourceDef build() {
      return new SourceDef(name, table, alias, primaryColumns, columns);
    }
  }
}
