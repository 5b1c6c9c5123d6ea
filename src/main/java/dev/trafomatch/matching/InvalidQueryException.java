package dev.trafomatch.matching;

/**
 * A search request that cannot be processed. Carries the offending field so callers can point the
 * user at it; the request is rejected as a whole and never partially processed.
 */
public class InvalidQueryException extends IllegalArgumentException {

  private final String field;

  public InvalidQueryException(String field, String reason) {
    super("Invalid query field '" + field + "': " + reason);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
