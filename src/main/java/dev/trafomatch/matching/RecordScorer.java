package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeValue;
import dev.trafomatch.design.DesignRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scores one design record against a query's targets.
 *
 * <p>The overall score is the weighted mean {@code sum(w_a * s_a) / sum(w_a)} over the
 * participating attributes, so it stays within [0, 1] no matter how many attributes are queried.
 * It is exactly 1.0 only when every participating attribute scores 1.0. Bounds play no part here,
 * see {@link ConstraintFilter}.
 */
public class RecordScorer {

  private final AttributePolicy policy;
  private final AttributeComparator comparator;

  public RecordScorer(AttributePolicy policy, AttributeComparator comparator) {
    this.policy = policy;
    this.comparator = comparator;
  }

  /**
   * Scores {@code record} against {@code query}.
   *
   * @return the overall score plus one {@link MatchDetail} per participating attribute, in
   *     declaration order
   * @throws EmptyQueryException if no target of the query is a known attribute
   */
  public ScoredResult score(Query query, DesignRecord record) {
    Set<String> participating = policy.participatingAttributes(query);
    if (participating.isEmpty()) {
      throw new EmptyQueryException();
    }

    List<MatchDetail> details = new ArrayList<>(participating.size());
    double weightedSum = 0.0;
    double totalWeight = 0.0;

    for (String name : participating) {
      AttributeSpec spec = policy.resolve(name);
      AttributeValue queryValue = query.targets().get(name);
      AttributeValue designValue = record.attribute(name);
      double score = comparator.compare(spec, queryValue, designValue);

      details.add(new MatchDetail(name, queryValue, designValue, score));
      weightedSum += spec.weight() * score;
      totalWeight += spec.weight();
    }

    return new ScoredResult(
        record, AttributeComparator.clamp(weightedSum / totalWeight), details);
  }
}
