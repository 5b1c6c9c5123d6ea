package dev.trafomatch.matching;

import dev.trafomatch.design.DesignRecord;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks a corpus of design records against a query.
 *
 * <p>Pipeline: validate the query against the attribute table -> drop records failing a bound ->
 * score the rest -> drop results under the optional minimum score -> sort by overall score
 * descending, then record id ascending -> truncate to the query limit.
 *
 * <p>The corpus is borrowed read-only for the duration of the call. Corpora of at least {@code
 * parallelThreshold} records are scored on a parallel stream; the final sort makes the output
 * independent of scoring order. An empty corpus, or one where nothing passes the bounds, yields an
 * empty list.
 */
public class Ranker {

  private static final Logger log = LoggerFactory.getLogger(Ranker.class);

  /** Overall score descending, then record id ascending. */
  public static final Comparator<ScoredResult> RANKING_ORDER =
      Comparator.comparingDouble(ScoredResult::overallScore)
          .reversed()
          .thenComparing(ScoredResult::recordId);

  /** Corpus size from which scoring runs on a parallel stream, unless configured. */
  public static final int DEFAULT_PARALLEL_THRESHOLD = 2048;

  private final AttributePolicy policy;
  private final RecordScorer scorer;
  private final ConstraintFilter filter;
  private final BoundOnlyPolicy boundOnlyPolicy;
  private final int parallelThreshold;

  public Ranker(
      AttributePolicy policy,
      RecordScorer scorer,
      ConstraintFilter filter,
      BoundOnlyPolicy boundOnlyPolicy,
      int parallelThreshold) {
    this.policy = policy;
    this.scorer = scorer;
    this.filter = filter;
    this.boundOnlyPolicy = boundOnlyPolicy;
    this.parallelThreshold = parallelThreshold;
  }

  public Ranker(AttributePolicy policy, AttributeComparator comparator) {
    this(
        policy,
        new RecordScorer(policy, comparator),
        new ConstraintFilter(),
        BoundOnlyPolicy.ACCEPT,
        DEFAULT_PARALLEL_THRESHOLD);
  }

  /**
   * Returns at most {@code query.limit()} results in ranking order.
   *
   * @param query the query; names are re-checked against the attribute table
   * @param corpus the candidate records, not modified
   * @throws InvalidQueryException if the query does not fit the attribute table, or has neither
   *     targets nor bounds, or is bound-only while bound-only queries are rejected
   */
  public List<ScoredResult> rank(Query query, List<DesignRecord> corpus) {
    policy.validate(query);

    if (query.targets().isEmpty()) {
      return rankBoundOnly(query, corpus);
    }

    List<ScoredResult> scored =
        candidates(corpus)
            .filter(record -> filter.passes(query, record))
            .map(record -> scorer.score(query, record))
            .filter(result -> query.minScore() == null || result.overallScore() >= query.minScore())
            .toList();

    List<ScoredResult> ranked = scored.stream().sorted(RANKING_ORDER).limit(query.limit()).toList();
    log.debug(
        "Scored {} of {} designs, returning {}", scored.size(), corpus.size(), ranked.size());
    return ranked;
  }

  private List<ScoredResult> rankBoundOnly(Query query, List<DesignRecord> corpus) {
    if (query.bounds().isEmpty()) {
      throw new EmptyQueryException("query has neither targets nor bounds");
    }
    if (boundOnlyPolicy == BoundOnlyPolicy.REJECT) {
      throw new EmptyQueryException("bound-only queries are not accepted");
    }
    // Every admitted design meets all criteria; order falls back to the id tie-break.
    return candidates(corpus)
        .filter(record -> filter.passes(query, record))
        .map(record -> new ScoredResult(record, 1.0, List.of()))
        .sorted(RANKING_ORDER)
        .limit(query.limit())
        .toList();
  }

  private Stream<DesignRecord> candidates(List<DesignRecord> corpus) {
    return corpus.size() >= parallelThreshold ? corpus.parallelStream() : corpus.stream();
  }
}
