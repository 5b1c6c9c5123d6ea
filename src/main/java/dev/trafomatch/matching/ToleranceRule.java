package dev.trafomatch.matching;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * How far a design value may deviate from the query value before its score reaches zero.
 *
 * <ul>
 *   <li>{@code RELATIVE} - {@code amount} is a fraction of the query value; 0 means exact match
 *   <li>{@code ABSOLUTE} - {@code amount} is a fixed deviation in the attribute's unit
 *   <li>{@code EQUALITY} - categorical equality, optionally widened by equivalence classes
 * </ul>
 *
 * @param mode the tolerance mode
 * @param amount non-negative tolerance amount (always 0 for {@code EQUALITY})
 * @param equivalences lower-cased member to lower-cased class representative
 */
public record ToleranceRule(Mode mode, double amount, Map<String, String> equivalences) {

  public enum Mode {
    RELATIVE,
    ABSOLUTE,
    EQUALITY
  }

  public ToleranceRule {
    if (mode == null) {
      throw new IllegalArgumentException("Tolerance mode must not be null");
    }
    if (!Double.isFinite(amount) || amount < 0.0) {
      throw new IllegalArgumentException("Tolerance must be a non-negative number, got: " + amount);
    }
    if (mode == Mode.EQUALITY && amount != 0.0) {
      throw new IllegalArgumentException("EQUALITY tolerance takes no amount, got: " + amount);
    }
    if (mode != Mode.EQUALITY && equivalences != null && !equivalences.isEmpty()) {
      throw new IllegalArgumentException("Equivalence classes only apply to EQUALITY tolerance");
    }
    equivalences = equivalences == null ? Map.of() : Map.copyOf(equivalences);
  }

  public static ToleranceRule relative(double fraction) {
    return new ToleranceRule(Mode.RELATIVE, fraction, Map.of());
  }

  public static ToleranceRule absolute(double amount) {
    return new ToleranceRule(Mode.ABSOLUTE, amount, Map.of());
  }

  public static ToleranceRule equality() {
    return new ToleranceRule(Mode.EQUALITY, 0.0, Map.of());
  }

  /**
   * Categorical equality where every member of a class counts as equal to every other member, e.g.
   * {@code [cu, copper]}. Classes must be disjoint.
   */
  public static ToleranceRule equality(List<? extends Collection<String>> classes) {
    Map<String, String> index = new HashMap<>();
    for (Collection<String> members : classes) {
      if (members.isEmpty()) {
        continue;
      }
      String representative = canonical(members.iterator().next());
      for (String member : members) {
        String previous = index.put(canonical(member), representative);
        if (previous != null && !previous.equals(representative)) {
          throw new IllegalArgumentException(
              "Value '" + member + "' belongs to more than one equivalence class");
        }
      }
    }
    return new ToleranceRule(Mode.EQUALITY, 0.0, index);
  }

  /** Whether this rule applies to numeric attributes. */
  public boolean isNumeric() {
    return mode != Mode.EQUALITY;
  }

  /** Case-insensitive equality, honouring the declared equivalence classes. */
  public boolean equivalent(String left, String right) {
    return representative(left).equals(representative(right));
  }

  private String representative(String value) {
    String key = canonical(value);
    return equivalences.getOrDefault(key, key);
  }

  private static String canonical(String value) {
    return value.strip().toLowerCase(Locale.ROOT);
  }
}
