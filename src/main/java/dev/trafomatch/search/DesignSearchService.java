package dev.trafomatch.search;

import dev.trafomatch.catalog.CatalogSnapshot;
import dev.trafomatch.catalog.DesignCatalog;
import dev.trafomatch.matching.Query;
import dev.trafomatch.matching.QueryNormalizer;
import dev.trafomatch.matching.Ranker;
import dev.trafomatch.matching.RawQuery;
import dev.trafomatch.matching.ScoredResult;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search entry point: normalizes raw input, then ranks it against the catalog snapshot that is
 * current when the call starts. A concurrent refresh does not affect a call already in flight.
 */
@Service
public class DesignSearchService {

  private static final Logger log = LoggerFactory.getLogger(DesignSearchService.class);

  private final QueryNormalizer normalizer;
  private final Ranker ranker;
  private final DesignCatalog catalog;

  public DesignSearchService(QueryNormalizer normalizer, Ranker ranker, DesignCatalog catalog) {
    this.normalizer = normalizer;
    this.ranker = ranker;
    this.catalog = catalog;
  }

  /**
   * Searches with separate target and bound maps, as an extraction collaborator supplies them.
   *
   * @throws dev.trafomatch.matching.InvalidQueryException if the input does not validate
   */
  public SearchResponse search(RawQuery raw) {
    return search(normalizer.normalize(raw));
  }

  /**
   * Searches with a flat form map ({@code max_<attribute>} keys are bounds).
   *
   * @throws dev.trafomatch.matching.InvalidQueryException if the input does not validate
   */
  public SearchResponse searchForm(Map<String, ?> form) {
    return search(normalizer.normalizeForm(form));
  }

  /** Ranks an already validated query. */
  public SearchResponse search(Query query) {
    CatalogSnapshot snapshot = catalog.snapshot();
    List<ScoredResult> matches = ranker.rank(query, snapshot.records());
    log.debug(
        "Query {} matched {} of {} designs", describe(query), matches.size(), snapshot.size());
    return new SearchResponse(query, matches, snapshot.size());
  }

  private static String describe(Query query) {
    StringBuilder sb = new StringBuilder();
    query
        .targets()
        .forEach((name, value) -> sb.append(name).append('=').append(value.display()).append(' '));
    query.bounds().forEach((name, limit) -> sb.append(name).append("<=").append(limit).append(' '));
    return sb.toString().strip();
  }
}
