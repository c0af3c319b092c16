package io.intellixity.paging.query;

/** Node of a filter tree: a {@link Condition}, {@link LogicalGroup} or {@link NotElement}. */
public interface QueryElement {
}
