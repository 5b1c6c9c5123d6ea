package dev.trafomatch.catalog;

import dev.trafomatch.design.AttributeKind;
import dev.trafomatch.design.AttributeValue;
import dev.trafomatch.design.DesignRecord;
import dev.trafomatch.matching.AttributePolicy;
import dev.trafomatch.matching.AttributeSpec;
import dev.trafomatch.matching.InvalidQueryException;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import org.springframework.stereotype.Service;

/** Computes {@link CatalogStats} over the attributes of the {@link AttributePolicy}. */
@Service
public class CatalogStatsService {

  private final DesignCatalog catalog;
  private final AttributePolicy policy;

  public CatalogStatsService(DesignCatalog catalog, AttributePolicy policy) {
    this.catalog = catalog;
    this.policy = policy;
  }

  public CatalogStats stats() {
    CatalogSnapshot snapshot = catalog.snapshot();
    Map<String, CatalogStats.Range> ranges = new LinkedHashMap<>();
    Map<String, List<String>> distinct = new LinkedHashMap<>();

    for (AttributeSpec spec : policy.attributes()) {
      if (spec.kind() == AttributeKind.NUMERIC) {
        DoubleSummaryStatistics summary =
            snapshot.records().stream()
                .map(record -> record.attribute(spec.name()))
                .filter(Objects::nonNull)
                .filter(value -> value.kind() == AttributeKind.NUMERIC)
                .mapToDouble(AttributeValue::asNumber)
                .summaryStatistics();
        if (summary.getCount() > 0) {
          ranges.put(spec.name(), new CatalogStats.Range(summary.getMin(), summary.getMax()));
        }
      } else {
        distinct.put(spec.name(), distinctValues(snapshot.records(), spec.name()));
      }
    }
    return new CatalogStats(snapshot.size(), ranges, distinct, snapshot.loadedAt());
  }

  /**
   * Sorted distinct values of one categorical attribute across the catalog.
   *
   * @throws dev.trafomatch.matching.UnknownAttributeException for an undeclared attribute
   * @throws InvalidQueryException for a numeric attribute
   */
  public List<String> distinctValues(String attribute) {
    AttributeSpec spec = policy.resolve(attribute);
    if (spec.kind() != AttributeKind.CATEGORICAL) {
      throw new InvalidQueryException(
          attribute, "distinct values are listed for categorical attributes only");
    }
    return distinctValues(catalog.snapshot().records(), attribute);
  }

  private static List<String> distinctValues(List<DesignRecord> records, String attribute) {
    TreeSet<String> values = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    for (DesignRecord record : records) {
      AttributeValue value = record.attribute(attribute);
      if (value != null && value.kind() == AttributeKind.CATEGORICAL) {
        values.add(value.asText());
      }
    }
    return List.copyOf(values);
  }
}
