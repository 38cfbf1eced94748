package io.intellixity.livequery.query;

/**
 * Raised when a query definition received from a client cannot be turned into a {@link Query}:
 * unknown operators or join keywords, missing names, invalid pagination.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
