package dev.trafomatch.catalog;

import dev.trafomatch.design.DesignRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the design catalog at one point in time. Readers hold on to a snapshot for the
 * duration of a call; a refresh publishes a new one instead of touching this.
 *
 * @param records the designs, in load order
 * @param loadedAt when this snapshot was published
 */
public record CatalogSnapshot(List<DesignRecord> records, Instant loadedAt) {

  public CatalogSnapshot {
    records = List.copyOf(records);
  }

  static CatalogSnapshot empty(Instant loadedAt) {
    return new CatalogSnapshot(List.of(), loadedAt);
  }

  public int size() {
    return records.size();
  }

  public Optional<DesignRecord> findById(String id) {
    return records.stream().filter(record -> record.id().equals(id)).findFirst();
  }

  /**
   * Rejects duplicate design ids, which would make the ranking tie-break ambiguous.
   *
   * @throws IllegalArgumentException naming the first duplicated id
   */
  static void requireUniqueIds(List<DesignRecord> records) {
    Map<String, DesignRecord> seen = new LinkedHashMap<>();
    for (DesignRecord record : records) {
      if (seen.putIfAbsent(record.id(), record) != null) {
        throw new IllegalArgumentException("Duplicate design id: " + record.id());
      }
    }
  }
}
