package dev.trafomatch.catalog;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of the current catalog, e.g. for populating search form choices.
 *
 * @param totalDesigns number of designs in the snapshot
 * @param numericRanges min/max per numeric attribute; attributes no design records are omitted
 * @param distinctValues sorted distinct values per categorical attribute
 * @param loadedAt when the summarised snapshot was published
 */
public record CatalogStats(
    int totalDesigns,
    Map<String, Range> numericRanges,
    Map<String, List<String>> distinctValues,
    Instant loadedAt) {

  public CatalogStats {
    numericRanges = Map.copyOf(numericRanges);
    distinctValues = Map.copyOf(distinctValues);
  }

  /** Closed interval of recorded values. */
  public record Range(double min, double max) {}
}
