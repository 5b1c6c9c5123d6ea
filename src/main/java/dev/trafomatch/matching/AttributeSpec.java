package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeKind;
import org.jspecify.annotations.Nullable;

/**
 * Static description of one matchable attribute: its kind, its weight in the weighted mean, and
 * its tolerance rule.
 *
 * @param name unique attribute name, e.g. {@code rating_kva}
 * @param kind numeric or categorical
 * @param weight positive importance in the weighted mean
 * @param tolerance tolerance rule; numeric modes for numeric attributes, EQUALITY otherwise
 * @param unit declared unit used when coercing strings such as {@code "100kVA"}; may be null
 */
public record AttributeSpec(
    String name,
    AttributeKind kind,
    double weight,
    ToleranceRule tolerance,
    @Nullable String unit) {

  public AttributeSpec {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Attribute name must not be blank");
    }
    if (kind == null || tolerance == null) {
      throw new IllegalArgumentException("Attribute '" + name + "' needs a kind and a tolerance");
    }
    if (!Double.isFinite(weight) || weight <= 0.0) {
      throw new IllegalArgumentException(
          "Attribute '" + name + "' weight must be positive, got: " + weight);
    }
    if (tolerance.isNumeric() != (kind == AttributeKind.NUMERIC)) {
      throw new IllegalArgumentException(
          "Attribute '" + name + "' is " + kind + " but has " + tolerance.mode() + " tolerance");
    }
  }

  public static AttributeSpec numeric(
      String name, double weight, ToleranceRule tolerance, @Nullable String unit) {
    return new AttributeSpec(name, AttributeKind.NUMERIC, weight, tolerance, unit);
  }

  public static AttributeSpec categorical(String name, double weight, ToleranceRule tolerance) {
    return new AttributeSpec(name, AttributeKind.CATEGORICAL, weight, tolerance, null);
  }

  public static AttributeSpec categorical(String name, double weight) {
    return categorical(name, weight, ToleranceRule.equality());
  }
}
