package dev.trafomatch.design;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One catalog entry: a transformer design extracted from an engineering spreadsheet.
 *
 * <p>Attributes not recorded for the design are simply missing from the map. Records are immutable
 * and are replaced wholesale when the catalog is refreshed.
 *
 * @param id unique design identifier (e.g. the design number), used as ranking tie-break
 * @param sourceLocator where the design was read from (e.g. a spreadsheet path)
 * @param attributes attribute name to value; absent attributes are not present as keys
 */
public record DesignRecord(
    String id, String sourceLocator, Map<String, AttributeValue> attributes) {

  public DesignRecord {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Design id must not be blank");
    }
    sourceLocator = sourceLocator == null ? "" : sourceLocator;
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public DesignRecord(String id, Map<String, AttributeValue> attributes) {
    this(id, "", attributes);
  }

  /** Returns the recorded value of {@code name}, or null when the design does not record it. */
  public @Nullable AttributeValue attribute(String name) {
    return attributes.get(name);
  }
}
