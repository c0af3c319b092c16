package io.intellixity.paging.paging;

/** A recognized request parameter is missing where required, or malformed. */
public final class PagingParameterException extends RuntimeException {
  private final String parameter;

  public PagingParameterException(String parameter, String message) {
    super(message);
    this.parameter = parameter;
  }

  public PagingParameterException(String parameter, String message, Throwable cause) {
    super(message, cause);
    this.parameter = parameter;
  }

  public String parameter() {
    return parameter;
  }
}
