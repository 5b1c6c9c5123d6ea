package dev.trafomatch.catalog;

import java.nio.file.Path;
import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Location and refresh cadence of the JSON catalog snapshot.
 *
 * @param file the snapshot file; when null the catalog is only populated programmatically
 * @param refreshInterval delay between reloads
 */
@ConfigurationProperties(prefix = "trafomatch.catalog")
public record CatalogProperties(
    @Nullable Path file, @DefaultValue("PT5M") Duration refreshInterval) {}
