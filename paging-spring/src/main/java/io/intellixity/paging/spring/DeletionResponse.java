package io.intellixity.paging.spring;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"success", "deleted"})
public record DeletionResponse(boolean success, List<String> deleted) {
  public DeletionResponse {
    deleted = (deleted == null) ? List.of() : List.copyOf(deleted);
  }

  public static DeletionResponse of(List<String> deleted) {
    return new DeletionResponse(true, deleted);
  }
}
