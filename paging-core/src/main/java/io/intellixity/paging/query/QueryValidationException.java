package io.intellixity.paging.query;

/**
 * Raised when a Query references unknown columns or otherwise fails validation.
 * <p>
 * Thrown by engines while rendering, so a deferred result set reports it on first execution.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
