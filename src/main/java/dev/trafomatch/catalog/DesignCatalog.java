package dev.trafomatch.catalog;

import dev.trafomatch.design.DesignRecord;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the in-memory design corpus as an atomically swapped {@link CatalogSnapshot}.
 *
 * <p>A refresh builds a complete new snapshot and publishes it with a single reference swap, so a
 * reader sees either the entire old collection or the entire new one, never a mix. Starts empty.
 */
@Component
public class DesignCatalog {

  private static final Logger log = LoggerFactory.getLogger(DesignCatalog.class);

  private final Clock clock;
  private final AtomicReference<CatalogSnapshot> current;

  public DesignCatalog(Clock clock) {
    this.clock = clock;
    this.current = new AtomicReference<>(CatalogSnapshot.empty(clock.instant()));
  }

  /** The currently published snapshot. */
  public CatalogSnapshot snapshot() {
    return current.get();
  }

  /**
   * Replaces the whole corpus.
   *
   * @param records the new designs; ids must be unique
   * @return the published snapshot
   * @throws IllegalArgumentException on duplicate ids, in which case the old snapshot stays live
   */
  public CatalogSnapshot replace(List<DesignRecord> records) {
    CatalogSnapshot.requireUniqueIds(records);
    CatalogSnapshot next = new CatalogSnapshot(records, clock.instant());
    CatalogSnapshot previous = current.getAndSet(next);
    log.info("Design catalog refreshed: {} designs (previously {})", next.size(), previous.size());
    return next;
  }

  public Optional<DesignRecord> findById(String id) {
    return snapshot().findById(id);
  }

  public int size() {
    return snapshot().size();
  }
}
