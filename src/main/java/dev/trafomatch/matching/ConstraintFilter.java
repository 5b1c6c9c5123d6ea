package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeKind;
import dev.trafomatch.design.AttributeValue;
import dev.trafomatch.design.DesignRecord;
import dev.trafomatch.design.InvalidAttributeKindException;
import java.util.Map;

/**
 * Admission gate for query bounds: a design whose recorded value exceeds a bound is excluded
 * regardless of its weighted score. Limits are inclusive.
 *
 * <p>A bound on an attribute the design does not record is satisfied unless configured otherwise.
 */
public class ConstraintFilter {

  private final boolean absentSatisfies;

  public ConstraintFilter(boolean absentSatisfies) {
    this.absentSatisfies = absentSatisfies;
  }

  public ConstraintFilter() {
    this(true);
  }

  /**
   * Checks every bound of the query against the record.
   *
   * @return false if any recorded value exceeds its bound
   * @throws InvalidAttributeKindException if a bounded attribute holds a non-numeric value
   */
  public boolean passes(Query query, DesignRecord record) {
    for (Map.Entry<String, Double> bound : query.bounds().entrySet()) {
      AttributeValue value = record.attribute(bound.getKey());
      if (value == null) {
        if (!absentSatisfies) {
          return false;
        }
        continue;
      }
      if (value.kind() != AttributeKind.NUMERIC) {
        throw new InvalidAttributeKindException(
            bound.getKey(), AttributeKind.NUMERIC, value.kind());
      }
      if (value.asNumber() > bound.getValue()) {
        return false;
      }
    }
    return true;
  }
}
