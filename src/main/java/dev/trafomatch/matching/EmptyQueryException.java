package dev.trafomatch.matching;

/** The query has no scorable targets. */
public class EmptyQueryException extends InvalidQueryException {

  public EmptyQueryException(String reason) {
    super("targets", reason);
  }

  public EmptyQueryException() {
    this("query has no scorable targets");
  }
}
