package io.intellixity.paging.mapping;

@FunctionalInterface
public interface RowReader<T> {
  T read(RowAdapter row);
}
