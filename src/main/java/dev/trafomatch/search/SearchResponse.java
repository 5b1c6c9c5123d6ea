package dev.trafomatch.search;

import dev.trafomatch.matching.Query;
import dev.trafomatch.matching.ScoredResult;
import java.util.List;

/**
 * Outcome of one catalog search, handed to the presentation layer as is.
 *
 * @param query the normalized query that was ranked
 * @param matches ranked results, best first
 * @param candidatesConsidered size of the catalog snapshot the query ran against
 */
public record SearchResponse(Query query, List<ScoredResult> matches, int candidatesConsidered) {

  public SearchResponse {
    matches = List.copyOf(matches);
  }
}
