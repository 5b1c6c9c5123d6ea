package dev.trafomatch.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trafomatch.design.AttributeValue;
import dev.trafomatch.design.DesignRecord;
import dev.trafomatch.matching.AttributePolicy;
import dev.trafomatch.matching.ValueParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Loads the JSON catalog snapshot and publishes it to the {@link DesignCatalog}.
 *
 * <p>Values of declared attributes are coerced to their declared kind; a value that cannot be
 * coerced is dropped with a warning and the design is kept, scored as not recording it. Attributes
 * outside the policy are kept as plain numbers or text.
 *
 * <p>Reloads on a fixed delay. A failed reload is logged and the previous snapshot stays live.
 */
@Component
public class CatalogLoader {

  private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

  private final DesignCatalog catalog;
  private final AttributePolicy policy;
  private final ObjectMapper objectMapper;
  private final CatalogProperties properties;

  public CatalogLoader(
      DesignCatalog catalog,
      AttributePolicy policy,
      ObjectMapper objectMapper,
      CatalogProperties properties) {
    this.catalog = catalog;
    this.policy = policy;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /** Scheduled reload of the configured snapshot file; a no-op when no file is configured. */
  @Scheduled(fixedDelayString = "${trafomatch.catalog.refresh-interval:PT5M}")
  public void refresh() {
    Path file = properties.file();
    if (file == null) {
      log.debug("No catalog file configured, skipping refresh");
      return;
    }
    try {
      catalog.replace(load(file));
    } catch (IOException | IllegalArgumentException e) {
      log.error(
          "Catalog refresh from {} failed, keeping previous snapshot: {}", file, e.getMessage());
    }
  }

  /**
   * Reads and converts a snapshot file without publishing it.
   *
   * @throws IOException if the file cannot be read, is not valid JSON or holds {@code null}
   * @throws IllegalArgumentException if an entry is {@code null} or has no id
   */
  public List<DesignRecord> load(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      List<CatalogEntry> entries =
          objectMapper.readValue(in, new TypeReference<List<CatalogEntry>>() {});
      if (entries == null) {
        throw new IOException("catalog snapshot is empty or null: " + file);
      }
      List<DesignRecord> records = new ArrayList<>(entries.size());
      for (int i = 0; i < entries.size(); i++) {
        CatalogEntry entry = entries.get(i);
        if (entry == null) {
          throw new IllegalArgumentException("catalog entry " + i + " is null");
        }
        records.add(toRecord(entry));
      }
      log.info("Loaded {} designs from {}", records.size(), file);
      return records;
    }
  }

  DesignRecord toRecord(CatalogEntry entry) {
    Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    if (entry.attributes() != null) {
      entry
          .attributes()
          .forEach(
              (name, raw) -> {
                if (raw != null) {
                  try {
                    attributes.put(name, convert(name, raw));
                  } catch (IllegalArgumentException e) {
                    log.warn("Dropping {} of design {}: {}", name, entry.id(), e.getMessage());
                  }
                }
              });
    }
    return new DesignRecord(entry.id(), entry.source(), attributes);
  }

  private AttributeValue convert(String name, Object raw) {
    if (policy.contains(name)) {
      return ValueParser.parse(policy.resolve(name), raw);
    }
    return raw instanceof Number number
        ? AttributeValue.of(number.doubleValue())
        : AttributeValue.of(raw.toString());
  }
}
