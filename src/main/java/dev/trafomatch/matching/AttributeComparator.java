package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeValue;
import dev.trafomatch.design.InvalidAttributeKindException;
import java.math.BigDecimal;
import java.math.MathContext;
import org.jspecify.annotations.Nullable;

/**
 * Scores a single (query value, design value) pair on a 0..1 scale.
 *
 * <p>Dispatch is on the declared {@link AttributeSpec#kind()}:
 *
 * <ul>
 *   <li>numeric, relative tolerance {@code t}: {@code 1 - |q - d| / (t * |q|)}, falling back to
 *       {@code t} as an absolute tolerance when {@code q == 0}
 *   <li>numeric, absolute tolerance {@code t}: {@code 1 - |q - d| / t}
 *   <li>a tolerance of zero degenerates to exact match (1 if equal, else 0)
 *   <li>categorical: 1 if equal (case-insensitively) or equivalent, else 0
 * </ul>
 *
 * <p>Numeric scores are clamped to [0, 1]. A missing design value scores the configured
 * neutral-absence score. Pure and thread-safe.
 */
public final class AttributeComparator {

  /** Neutral-absence score used when none is configured. */
  public static final double DEFAULT_ABSENT_SCORE = 0.5;

  private final double absentScore;

  public AttributeComparator(double absentScore) {
    if (!(absentScore >= 0.0 && absentScore <= 1.0)) {
      throw new IllegalArgumentException("absentScore must be in [0.0, 1.0], got: " + absentScore);
    }
    this.absentScore = absentScore;
  }

  public AttributeComparator() {
    this(DEFAULT_ABSENT_SCORE);
  }

  /**
   * Compares a query value with a design value.
   *
   * @param spec the attribute declaration
   * @param queryValue the value asked for
   * @param designValue the catalog value, or null when the design does not record it
   * @return similarity in [0, 1]
   * @throws InvalidAttributeKindException if either value's kind differs from {@code spec.kind()}
   */
  public double compare(
      AttributeSpec spec, AttributeValue queryValue, @Nullable AttributeValue designValue) {
    requireKind(spec, queryValue);
    if (designValue == null) {
      return absentScore;
    }
    requireKind(spec, designValue);

    return switch (spec.kind()) {
      case NUMERIC ->
          compareNumeric(spec.tolerance(), queryValue.asNumber(), designValue.asNumber());
      case CATEGORICAL ->
          spec.tolerance().equivalent(queryValue.asText(), designValue.asText()) ? 1.0 : 0.0;
    };
  }

  public double absentScore() {
    return absentScore;
  }

  // Decimal arithmetic so that a deviation of exactly the allowance (3 vs 3.3 at 10%) scores 0
  private static double compareNumeric(ToleranceRule rule, double query, double design) {
    BigDecimal target = BigDecimal.valueOf(query);
    BigDecimal deviation = target.subtract(BigDecimal.valueOf(design)).abs();
    BigDecimal amount = BigDecimal.valueOf(rule.amount());
    BigDecimal allowance =
        switch (rule.mode()) {
          case RELATIVE -> target.signum() == 0 ? amount : amount.multiply(target.abs());
          case ABSOLUTE -> amount;
          case EQUALITY -> throw new IllegalStateException("EQUALITY tolerance on numeric value");
        };
    if (allowance.signum() == 0) {
      return deviation.signum() == 0 ? 1.0 : 0.0;
    }
    if (deviation.compareTo(allowance) >= 0) {
      return 0.0;
    }
    return clamp(1.0 - deviation.divide(allowance, MathContext.DECIMAL64).doubleValue());
  }

  static double clamp(double score) {
    // Math.max(0.0, -0.0) yields 0.0, keeping sort keys free of negative zero
    return Math.min(1.0, Math.max(0.0, score));
  }

  private static void requireKind(AttributeSpec spec, AttributeValue value) {
    if (value.kind() != spec.kind()) {
      throw new InvalidAttributeKindException(spec.name(), spec.kind(), value.kind());
    }
  }
}
