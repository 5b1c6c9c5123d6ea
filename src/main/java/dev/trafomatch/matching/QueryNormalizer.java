package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeKind;
import dev.trafomatch.design.AttributeValue;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates and canonicalizes raw search input into a {@link Query}.
 *
 * <p>Responsibilities:
 *
 * <ul>
 *   <li>reject attribute names outside the {@link AttributePolicy}, whatever their value
 *   <li>drop entries whose value is null, blank or the text {@code "null"} (extractors emit them)
 *   <li>coerce values to the declared kind via {@link ValueParser}; garbage is rejected
 *   <li>accept bounds on numeric attributes only
 *   <li>default a missing limit, reject non-positive or non-integral limits, clamp oversized ones
 *   <li>reject a request with neither targets nor bounds
 * </ul>
 *
 * <p>Every failure is an {@link InvalidQueryException} naming the offending field.
 */
public class QueryNormalizer {

  private static final Logger log = LoggerFactory.getLogger(QueryNormalizer.class);

  /** Result count used when the request does not specify one. */
  public static final int DEFAULT_LIMIT = 10;

  static final String BOUND_PREFIX = "max_";

  private final AttributePolicy policy;
  private final int defaultLimit;
  private final int maxLimit;

  public QueryNormalizer(AttributePolicy policy, int defaultLimit, int maxLimit) {
    if (defaultLimit < 1 || maxLimit < defaultLimit) {
      throw new IllegalArgumentException(
          "Limits must satisfy 1 <= defaultLimit <= maxLimit, got "
              + defaultLimit
              + " and "
              + maxLimit);
    }
    this.policy = policy;
    this.defaultLimit = defaultLimit;
    this.maxLimit = maxLimit;
  }

  public QueryNormalizer(AttributePolicy policy) {
    this(policy, DEFAULT_LIMIT, 100);
  }

  /**
   * Normalizes separate target and bound maps.
   *
   * @param raw the unvalidated input
   * @return a query whose names all exist in the policy and whose values have the declared kinds
   * @throws InvalidQueryException on any validation failure
   */
  public Query normalize(RawQuery raw) {
    Map<String, AttributeValue> targets = new LinkedHashMap<>();
    raw.targets()
        .forEach(
            (name, value) -> {
              AttributeSpec spec = policy.resolve(name);
              if (!isMissing(value)) {
                targets.put(name, coerce(spec, value));
              }
            });

    Map<String, Double> bounds = new LinkedHashMap<>();
    raw.bounds()
        .forEach(
            (name, value) -> {
              AttributeSpec spec = policy.resolve(name);
              if (spec.kind() != AttributeKind.NUMERIC) {
                throw new InvalidQueryException(name, "bounds apply to numeric attributes only");
              }
              if (!isMissing(value)) {
                bounds.put(name, coerce(spec, value).asNumber());
              }
            });

    if (targets.isEmpty() && bounds.isEmpty()) {
      throw new InvalidQueryException("targets", "at least one target or bound is required");
    }

    return new Query(targets, bounds, resolveLimit(raw.limit()), resolveMinScore(raw.minScore()));
  }

  /**
   * Normalizes a single flat map as a structured search form submits it. Keys {@code limit} and
   * {@code max_results} set the limit, {@code min_score} the minimum score, {@code max_<attribute>}
   * a bound on that attribute; every other key is a target.
   *
   * @throws InvalidQueryException on any validation failure
   */
  public Query normalizeForm(Map<String, ?> form) {
    Map<String, Object> targets = new LinkedHashMap<>();
    Map<String, Object> bounds = new LinkedHashMap<>();
    Object limit = null;
    Object minScore = null;

    for (Map.Entry<String, ?> entry : form.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        throw new InvalidQueryException("form", "null key");
      }
      Object value = entry.getValue();
      if (key.equals("limit") || key.equals("max_results")) {
        limit = isMissing(value) ? limit : value;
      } else if (key.equals("min_score")) {
        minScore = value;
      } else if (!policy.contains(key)
          && key.startsWith(BOUND_PREFIX)
          && policy.contains(key.substring(BOUND_PREFIX.length()))) {
        bounds.put(key.substring(BOUND_PREFIX.length()), value);
      } else {
        targets.put(key, value);
      }
    }
    return normalize(new RawQuery(targets, bounds, limit, minScore));
  }

  private static AttributeValue coerce(AttributeSpec spec, Object value) {
    try {
      return ValueParser.parse(spec, value);
    } catch (IllegalArgumentException e) {
      throw new InvalidQueryException(spec.name(), e.getMessage());
    }
  }

  private int resolveLimit(@Nullable Object raw) {
    if (isMissing(raw)) {
      return defaultLimit;
    }
    int limit = parseInteger(raw);
    if (limit < 1) {
      throw new InvalidQueryException("limit", "must be a positive integer, got " + raw);
    }
    if (limit > maxLimit) {
      log.debug("Requested limit {} exceeds maximum, clamping to {}", limit, maxLimit);
      return maxLimit;
    }
    return limit;
  }

  private static int parseInteger(Object raw) {
    try {
      BigDecimal decimal =
          raw instanceof Number number
              ? new BigDecimal(number.toString())
              : new BigDecimal(raw.toString().strip());
      return decimal.intValueExact();
    } catch (NumberFormatException | ArithmeticException e) {
      throw new InvalidQueryException("limit", "must be a positive integer, got " + raw);
    }
  }

  private static @Nullable Double resolveMinScore(@Nullable Object raw) {
    if (isMissing(raw)) {
      return null;
    }
    try {
      return ValueParser.parseNumber(raw, null);
    } catch (IllegalArgumentException e) {
      throw new InvalidQueryException("min_score", e.getMessage());
    }
  }

  private static boolean isMissing(@Nullable Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof CharSequence text) {
      String trimmed = text.toString().strip();
      return trimmed.isEmpty() || trimmed.equalsIgnoreCase("null");
    }
    return false;
  }
}
