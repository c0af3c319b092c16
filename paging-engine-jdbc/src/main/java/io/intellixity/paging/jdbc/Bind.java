package io.intellixity.paging.jdbc;

import io.intellixity.paging.source.ColumnType;

/** A positional bind value, already coerced to the column's type. */
public record Bind(Object value, ColumnType type) {}
