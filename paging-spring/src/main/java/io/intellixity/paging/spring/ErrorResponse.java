package io.intellixity.paging.spring;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"success", "message"})
public record ErrorResponse(boolean success, String message) {
  public static ErrorResponse of(String message) {
    return new ErrorResponse(false, message);
  }
}
