package dev.trafomatch.matching;

import dev.trafomatch.design.AttributeKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The closed universe of matchable attributes with their weights and tolerance rules.
 *
 * <p>Built once from configuration and read-only afterwards. Declaration order is significant: it
 * fixes the order of {@link MatchDetail}s in every {@link ScoredResult}.
 */
public final class AttributePolicy {

  private final Map<String, AttributeSpec> specs;

  public AttributePolicy(List<AttributeSpec> declarations) {
    if (declarations == null || declarations.isEmpty()) {
      throw new IllegalArgumentException("Attribute table must declare at least one attribute");
    }
    Map<String, AttributeSpec> byName = new LinkedHashMap<>();
    for (AttributeSpec spec : declarations) {
      if (byName.putIfAbsent(spec.name(), spec) != null) {
        throw new IllegalArgumentException("Duplicate attribute name: " + spec.name());
      }
    }
    this.specs = Collections.unmodifiableMap(byName);
  }

  /**
   * Looks up an attribute declaration.
   *
   * @throws UnknownAttributeException if the name is not declared
   */
  public AttributeSpec resolve(String name) {
    AttributeSpec spec = specs.get(name);
    if (spec == null) {
      throw new UnknownAttributeException(name);
    }
    return spec;
  }

  public boolean contains(String name) {
    return specs.containsKey(name);
  }

  /** All declarations in declaration order. */
  public List<AttributeSpec> attributes() {
    return List.copyOf(specs.values());
  }

  /**
   * Names of the query's targets that exist in the table, in declaration order. This set is the
   * denominator of the weighted mean computed by {@link RecordScorer}.
   */
  public Set<String> participatingAttributes(Query query) {
    Set<String> participating = new LinkedHashSet<>();
    for (String name : specs.keySet()) {
      if (query.targets().containsKey(name)) {
        participating.add(name);
      }
    }
    return participating;
  }

  /**
   * Checks every target and bound of the query against the table.
   *
   * @throws UnknownAttributeException for a name outside the table
   * @throws InvalidQueryException for a bound on a categorical attribute or a target whose value
   *     kind does not fit its attribute
   */
  public void validate(Query query) {
    query
        .targets()
        .forEach(
            (name, value) -> {
              AttributeSpec spec = resolve(name);
              if (value.kind() != spec.kind()) {
                throw new InvalidQueryException(
                    name, "expected a " + spec.kind() + " value, got " + value.kind());
              }
            });
    for (String name : query.bounds().keySet()) {
      if (resolve(name).kind() != AttributeKind.NUMERIC) {
        throw new InvalidQueryException(name, "bounds apply to numeric attributes only");
      }
    }
  }
}
