package io.intellixity.paging.query;

/** Marker for paging strategies understood by engines. */
public interface Page {
}
