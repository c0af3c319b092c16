package io.intellixity.paging.query;

public record OffsetPage(int offset, int limit) implements Page {
  public OffsetPage {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }

  /** Page numbers are 1-based: page 1 starts at offset 0. */
  public static OffsetPage ofPage(int rows, int page) {
    if (page <= 0) throw new IllegalArgumentException("page must be > 0");
    return new OffsetPage(Math.multiplyExact(page - 1, rows), rows);
  }
}
