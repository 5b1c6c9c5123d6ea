package dev.trafomatch.design;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * A typed attribute value, either a finite number or a non-blank text token.
 *
 * <p>The accessors {@link #asNumber()} and {@link #asText()} only succeed for the matching kind;
 * callers check {@link #kind()} against the attribute declaration first and otherwise get an
 * {@link InvalidAttributeKindException}.
 */
public sealed interface AttributeValue permits AttributeValue.Numeric, AttributeValue.Categorical {

  AttributeKind kind();

  /** Numeric payload. Throws {@link InvalidAttributeKindException} for categorical values. */
  double asNumber();

  /** Text payload. Throws {@link InvalidAttributeKindException} for numeric values. */
  String asText();

  /** Plain representation for display and logging, e.g. {@code 100} or {@code Dyn11}. */
  String display();

  static AttributeValue of(double value) {
    return new Numeric(value);
  }

  static AttributeValue of(String value) {
    return new Categorical(value);
  }

  /**
   * Numeric attribute value.
   *
   * @param value the number, must be finite
   */
  record Numeric(double value) implements AttributeValue {

    public Numeric {
      if (!Double.isFinite(value)) {
        throw new IllegalArgumentException("Numeric value must be finite, got: " + value);
      }
    }

    @Override
    public AttributeKind kind() {
      return AttributeKind.NUMERIC;
    }

    @Override
    public double asNumber() {
      return value;
    }

    @Override
    public String asText() {
      throw new InvalidAttributeKindException(this, AttributeKind.CATEGORICAL);
    }

    @Override
    public String display() {
      return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
  }

  /**
   * Categorical attribute value. Surrounding whitespace is trimmed on construction; comparison
   * keys are case-insensitive via {@link #normalized()}.
   *
   * @param value the text token, must not be blank
   */
  record Categorical(String value) implements AttributeValue {

    public Categorical {
      if (value == null || value.isBlank()) {
        throw new IllegalArgumentException("Categorical value must not be blank");
      }
      value = value.strip();
    }

    /** Lower-cased form used for equality and equivalence lookups. */
    public String normalized() {
      return value.toLowerCase(Locale.ROOT);
    }

    @Override
    public AttributeKind kind() {
      return AttributeKind.CATEGORICAL;
    }

    @Override
    public double asNumber() {
      throw new InvalidAttributeKindException(this, AttributeKind.NUMERIC);
    }

    @Override
    public String asText() {
      return value;
    }

    @Override
    public String display() {
      return value;
    }
  }
}
