package dev.trafomatch.matching;

import dev.trafomatch.design.DesignRecord;
import java.util.List;

/**
 * A design record with its overall similarity and the per-attribute breakdown, ordered by the
 * attribute table's declaration order.
 *
 * @param record the scored design
 * @param overallScore weighted mean of the detail scores, in [0, 1]
 * @param details one entry per participating attribute
 */
public record ScoredResult(DesignRecord record, double overallScore, List<MatchDetail> details) {

  public ScoredResult {
    details = List.copyOf(details);
  }

  public String recordId() {
    return record.id();
  }
}
