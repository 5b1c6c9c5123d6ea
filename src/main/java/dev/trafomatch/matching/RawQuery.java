package dev.trafomatch.matching;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Unvalidated search input as an extraction collaborator hands it over: a structured form or a
 * language-model extractor. Values are loosely typed (numbers, numeric strings, text, or null).
 *
 * @param targets attribute name to desired value
 * @param bounds attribute name to upper limit
 * @param limit requested result count; null selects the default
 * @param minScore optional minimum score
 */
public record RawQuery(
    Map<String, ?> targets,
    Map<String, ?> bounds,
    @Nullable Object limit,
    @Nullable Object minScore) {

  public RawQuery {
    targets = targets == null ? Map.of() : targets;
    bounds = bounds == null ? Map.of() : bounds;
  }

  public RawQuery(Map<String, ?> targets, Map<String, ?> bounds, @Nullable Object limit) {
    this(targets, bounds, limit, null);
  }

  public RawQuery(Map<String, ?> targets) {
    this(targets, Map.of(), null, null);
  }
}
