package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A validated search request.
 *
 * <p>A target says "close to this value" and contributes to the weighted score; a bound says "no
 * more than this value" and only admits or excludes a design. The same attribute may appear in
 * both. Attribute names are checked against the attribute table by {@link QueryNormalizer} and
 * again by {@link Ranker}.
 *
 * @param targets attribute name to desired value
 * @param bounds attribute name to inclusive upper limit (numeric attributes only)
 * @param limit maximum number of results, at least 1
 * @param minScore optional score threshold in [0, 1]; results scoring below it are dropped
 */
public record Query(
    Map<String, AttributeValue> targets,
    Map<String, Double> bounds,
    int limit,
    @Nullable Double minScore) {

  public Query {
    targets = targets == null ? Map.of() : Map.copyOf(targets);
    bounds = bounds == null ? Map.of() : Map.copyOf(bounds);
    if (limit < 1) {
      throw new InvalidQueryException("limit", "must be at least 1, got " + limit);
    }
    if (minScore != null && (minScore.isNaN() || minScore < 0.0 || minScore > 1.0)) {
      throw new InvalidQueryException("min_score", "must be within [0, 1], got " + minScore);
    }
    bounds.forEach(
        (name, value) -> {
          if (!Double.isFinite(value)) {
            throw new InvalidQueryException(name, "bound must be a finite number");
          }
        });
  }

  public Query(Map<String, AttributeValue> targets, Map<String, Double> bounds, int limit) {
    this(targets, bounds, limit, null);
  }

  /** True when the query only carries bounds and nothing to score against. */
  public boolean isBoundOnly() {
    return targets.isEmpty() && !bounds.isEmpty();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Fluent builder, mainly for programmatic callers that already hold typed values. */
  public static final class Builder {

    private final Map<String, AttributeValue> targets = new LinkedHashMap<>();
    private final Map<String, Double> bounds = new LinkedHashMap<>();
    private int limit = QueryNormalizer.DEFAULT_LIMIT;
    private @Nullable Double minScore;

    private Builder() {}

    public Builder target(String attribute, double value) {
      targets.put(attribute, AttributeValue.of(value));
      return this;
    }

    public Builder target(String attribute, String value) {
      targets.put(attribute, AttributeValue.of(value));
      return this;
    }

    public Builder bound(String attribute, double upperLimit) {
      bounds.put(attribute, upperLimit);
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder minScore(@Nullable Double minScore) {
      this.minScore = minScore;
      return this;
    }

    public Query build() {
      return new Query(targets, bounds, limit, minScore);
    }
  }
}
