package dev.trafomatch.matching;

/** Treatment of a query that carries bounds but no scorable targets. */
public enum BoundOnlyPolicy {
  /** Return every admitted design with score 1.0 and no details, ordered by id. */
  ACCEPT,
  /** Reject the query with an {@link EmptyQueryException}. */
  REJECT
}
