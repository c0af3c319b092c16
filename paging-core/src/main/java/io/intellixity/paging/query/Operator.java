package io.intellixity.paging.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  LIKE,
  /** Case-insensitive LIKE; the pattern is matched against the lower-cased column value. */
  ILIKE
}
