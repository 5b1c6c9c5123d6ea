package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeValue;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Coerces loosely typed input into an {@link AttributeValue} of the attribute's declared kind.
 *
 * <p>Numeric input may be a {@link Number} or a string such as {@code "100"}, {@code "4,5"},
 * {@code "11000V"} or {@code "11 kV"}. A comma followed by exactly three digits is rejected, as
 * {@code "1,000"} cannot be told apart from a decimal comma. A unit suffix must equal the
 * attribute's declared unit, or be that unit with a {@code k} prefix (scaled by 1000). Categorical
 * input is any non-blank text; numbers are accepted in their plain decimal form.
 */
public final class ValueParser {

  private static final Pattern NUMBER_WITH_UNIT =
      Pattern.compile("^([-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+))\\s*([A-Za-z%]+)?$");

  // "1,000" or "12,500" reads as either a decimal comma or digit grouping
  private static final Pattern DIGIT_GROUPING = Pattern.compile("\\d,\\d{3}(?!\\d)");

  private ValueParser() {}

  /**
   * Parses {@code raw} for {@code spec}.
   *
   * @throws IllegalArgumentException if the input cannot be read as the declared kind
   */
  public static AttributeValue parse(AttributeSpec spec, Object raw) {
    return switch (spec.kind()) {
      case NUMERIC -> AttributeValue.of(parseNumber(raw, spec.unit()));
      case CATEGORICAL -> AttributeValue.of(parseText(raw));
    };
  }

  /**
   * Parses a numeric value with an optional unit suffix.
   *
   * @throws IllegalArgumentException for non-numeric input or a foreign unit
   */
  public static double parseNumber(Object raw, @Nullable String unit) {
    if (raw instanceof Number number) {
      double value = number.doubleValue();
      if (!Double.isFinite(value)) {
        throw new IllegalArgumentException("not a finite number: " + raw);
      }
      return value;
    }
    if (!(raw instanceof CharSequence text)) {
      throw new IllegalArgumentException("expected a number, got " + describe(raw));
    }
    if (DIGIT_GROUPING.matcher(text).find()) {
      throw new IllegalArgumentException("ambiguous digit grouping in '" + text + "'");
    }
    String candidate = text.toString().strip().replace(',', '.');
    Matcher matcher = NUMBER_WITH_UNIT.matcher(candidate);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("not a number: '" + text + "'");
    }
    double value = Double.parseDouble(matcher.group(1));
    String suffix = matcher.group(2);
    if (suffix == null) {
      return value;
    }
    return value * unitMultiplier(suffix, unit, text.toString());
  }

  private static double unitMultiplier(String suffix, @Nullable String unit, String original) {
    if (unit != null) {
      String declared = unit.toLowerCase(Locale.ROOT);
      String given = suffix.toLowerCase(Locale.ROOT);
      if (given.equals(declared)) {
        return 1.0;
      }
      if (given.equals("k" + declared)) {
        return 1000.0;
      }
    }
    throw new IllegalArgumentException(
        "unexpected unit '" + suffix + "' in '" + original + "'"
            + (unit == null ? "" : ", expected " + unit));
  }

  private static String parseText(Object raw) {
    if (raw instanceof CharSequence text && !text.toString().isBlank()) {
      return text.toString().strip();
    }
    if (raw instanceof Number number && Double.isFinite(number.doubleValue())) {
      return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
    }
    throw new IllegalArgumentException("expected text, got " + describe(raw));
  }

  private static String describe(@Nullable Object raw) {
    return raw == null ? "null" : raw.getClass().getSimpleName() + " '" + raw + "'";
  }
}
