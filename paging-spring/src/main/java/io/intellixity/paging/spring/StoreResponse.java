package io.intellixity.paging.spring;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.intellixity.paging.exec.ResultSet;

import java.util.List;

/**
 * Store-shaped listing: one page of rows plus the number of rows matching the filter.
 */
@JsonPropertyOrder({"success", "total", "data"})
public record StoreResponse<T>(boolean success, long total, List<T> data) {
  public StoreResponse {
    data = (data == null) ? List.of() : List.copyOf(data);
  }

  /** Reads the current page of {@code rs}; the total ignores paging. */
  public static <T> StoreResponse<T> of(ResultSet<T> rs) {
    return new StoreResponse<>(true, rs.count(), rs.all());
  }
}
