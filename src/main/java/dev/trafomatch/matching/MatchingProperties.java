package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeKind;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the matching engine.
 *
 * <p>Properties are bound from {@code trafomatch.matching.*} in application.yml.
 *
 * <ul>
 *   <li>{@code absent-score} - score for a queried attribute the design does not record (default
 *       0.5, bounded [0, 1])
 *   <li>{@code absent-bound-satisfied} - whether a bound on an unrecorded attribute admits the
 *       design (default true)
 *   <li>{@code bound-only-policy} - ACCEPT or REJECT queries with bounds but no targets
 *   <li>{@code default-limit} / {@code max-limit} - result count when none is given, and the cap
 *   <li>{@code parallel-threshold} - corpus size from which scoring runs in parallel
 *   <li>{@code attributes} - the attribute table, in declaration order
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range or the attribute table is inconsistent.
 */
@Configuration
@ConfigurationProperties(prefix = "trafomatch.matching")
public class MatchingProperties {

  private double absentScore = AttributeComparator.DEFAULT_ABSENT_SCORE;
  private boolean absentBoundSatisfied = true;
  private BoundOnlyPolicy boundOnlyPolicy = BoundOnlyPolicy.ACCEPT;
  private int defaultLimit = QueryNormalizer.DEFAULT_LIMIT;
  private int maxLimit = 100;
  private int parallelThreshold = Ranker.DEFAULT_PARALLEL_THRESHOLD;
  private List<Attribute> attributes = new ArrayList<>();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (absentScore < 0.0 || absentScore > 1.0) {
      throw new IllegalStateException(
          "trafomatch.matching.absent-score must be in [0.0, 1.0], got: " + absentScore);
    }
    if (defaultLimit < 1 || maxLimit < defaultLimit) {
      throw new IllegalStateException(
          "trafomatch.matching limits must satisfy 1 <= default-limit <= max-limit, got: "
              + defaultLimit
              + ", "
              + maxLimit);
    }
    if (parallelThreshold < 1) {
      throw new IllegalStateException(
          "trafomatch.matching.parallel-threshold must be positive, got: " + parallelThreshold);
    }
    if (attributes.isEmpty()) {
      throw new IllegalStateException("trafomatch.matching.attributes must not be empty");
    }
    Set<String> names = new HashSet<>();
    for (Attribute attribute : attributes) {
      if (!names.add(attribute.getName())) {
        throw new IllegalStateException(
            "trafomatch.matching.attributes declares '" + attribute.getName() + "' twice");
      }
      try {
        attribute.toSpec();
      } catch (IllegalArgumentException e) {
        throw new IllegalStateException(
            "trafomatch.matching.attributes is invalid: " + e.getMessage(), e);
      }
    }
  }

  /** Builds the attribute table in declaration order. */
  public List<AttributeSpec> toSpecs() {
    return attributes.stream().map(Attribute::toSpec).toList();
  }

  public double getAbsentScore() {
    return absentScore;
  }

  public void setAbsentScore(double absentScore) {
    this.absentScore = absentScore;
  }

  public boolean isAbsentBoundSatisfied() {
    return absentBoundSatisfied;
  }

  public void setAbsentBoundSatisfied(boolean absentBoundSatisfied) {
    this.absentBoundSatisfied = absentBoundSatisfied;
  }

  public BoundOnlyPolicy getBoundOnlyPolicy() {
    return boundOnlyPolicy;
  }

  public void setBoundOnlyPolicy(BoundOnlyPolicy boundOnlyPolicy) {
    this.boundOnlyPolicy = boundOnlyPolicy;
  }

  public int getDefaultLimit() {
    return defaultLimit;
  }

  public void setDefaultLimit(int defaultLimit) {
    this.defaultLimit = defaultLimit;
  }

  public int getMaxLimit() {
    return maxLimit;
  }

  public void setMaxLimit(int maxLimit) {
    this.maxLimit = maxLimit;
  }

  public int getParallelThreshold() {
    return parallelThreshold;
  }

  public void setParallelThreshold(int parallelThreshold) {
    this.parallelThreshold = parallelThreshold;
  }

  public List<Attribute> getAttributes() {
    return attributes;
  }

  public void setAttributes(List<Attribute> attributes) {
    this.attributes = attributes;
  }

  /** One row of the attribute table. */
  public static class Attribute {

    private String name = "";
    private AttributeKind kind = AttributeKind.NUMERIC;
    private double weight = 1.0;
    private ToleranceRule.@Nullable Mode toleranceMode;
    private double tolerance;
    private @Nullable String unit;
    private List<List<String>> equivalenceClasses = new ArrayList<>();

    /** Numeric attributes default to RELATIVE tolerance, categorical ones to EQUALITY. */
    AttributeSpec toSpec() {
      ToleranceRule.Mode mode = toleranceMode;
      if (mode == null) {
        mode =
            kind == AttributeKind.NUMERIC
                ? ToleranceRule.Mode.RELATIVE
                : ToleranceRule.Mode.EQUALITY;
      }
      ToleranceRule rule =
          switch (mode) {
            case RELATIVE -> ToleranceRule.relative(tolerance);
            case ABSOLUTE -> ToleranceRule.absolute(tolerance);
            case EQUALITY -> ToleranceRule.equality(equivalenceClasses);
          };
      return new AttributeSpec(name, kind, weight, rule, unit);
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public AttributeKind getKind() {
      return kind;
    }

    public void setKind(AttributeKind kind) {
      this.kind = kind;
    }

    public double getWeight() {
      return weight;
    }

    public void setWeight(double weight) {
      this.weight = weight;
    }

    public ToleranceRule.@Nullable Mode getToleranceMode() {
      return toleranceMode;
    }

    public void setToleranceMode(ToleranceRule.@Nullable Mode toleranceMode) {
      this.toleranceMode = toleranceMode;
    }

    public double getTolerance() {
      return tolerance;
    }

    public void setTolerance(double tolerance) {
      this.tolerance = tolerance;
    }

    public @Nullable String getUnit() {
      return unit;
    }

    public void setUnit(@Nullable String unit) {
      this.unit = unit;
    }

    public List<List<String>> getEquivalenceClasses() {
      return equivalenceClasses;
    }

    public void setEquivalenceClasses(List<List<String>> equivalenceClasses) {
      this.equivalenceClasses = equivalenceClasses;
    }
  }
}
