package dev.trafomatch.catalog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One design as it appears in the JSON catalog snapshot written by the spreadsheet ingestion job.
 *
 * <pre>{@code
 * {"id": "TR-1001", "source": "designs/TR-1001.xlsx",
 *  "attributes": {"rating_kva": 100, "high_voltage_v": "11000V", "vector_group": "Dyn11"}}
 * }</pre>
 *
 * @param id design number
 * @param source spreadsheet the design was read from
 * @param attributes raw attribute values; nulls mean "not recorded"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record CatalogEntry(
    @JsonAlias("design_number") String id,
    @JsonAlias({"file_path", "source_locator"}) @Nullable String source,
    @Nullable Map<String, Object> attributes) {}
