package dev.trafomatch.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.trafomatch.design.DesignRecord;
import dev.trafomatch.fixture.DesignRecordBuilder;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DesignCatalogTest {

  private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

  private final DesignCatalog catalog = new DesignCatalog(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void startsEmpty() {
    assertThat(catalog.size()).isZero();
    assertThat(catalog.snapshot().records()).isEmpty();
    assertThat(catalog.snapshot().loadedAt()).isEqualTo(NOW);
  }

  @Test
  void replacePublishesNewSnapshot() {
    DesignRecord first = new DesignRecordBuilder("TR-1").with("rating_kva", 100).build();

    CatalogSnapshot snapshot = catalog.replace(List.of(first));

    assertThat(catalog.snapshot()).isSameAs(snapshot);
    assertThat(catalog.findById("TR-1")).contains(first);
    assertThat(catalog.findById("TR-2")).isEmpty();
  }

  @Test
  void snapshotHeldByReaderIsUnaffectedByRefresh() {
    catalog.replace(List.of(new DesignRecordBuilder("TR-1").build()));
    CatalogSnapshot inFlight = catalog.snapshot();

    catalog.replace(
        List.of(new DesignRecordBuilder("TR-2").build(), new DesignRecordBuilder("TR-3").build()));

    assertThat(inFlight.records()).extracting(DesignRecord::id).containsExactly("TR-1");
    assertThat(catalog.snapshot().records())
        .extracting(DesignRecord::id)
        .containsExactly("TR-2", "TR-3");
  }

  @Test
  void snapshotIsIsolatedFromCallerList() {
    List<DesignRecord> records = new ArrayList<>();
    records.add(new DesignRecordBuilder("TR-1").build());
    catalog.replace(records);

    records.add(new DesignRecordBuilder("TR-2").build());

    assertThat(catalog.size()).isEqualTo(1);
  }

  @Test
  void duplicateIdsAreRejectedAndOldSnapshotStays() {
    catalog.replace(List.of(new DesignRecordBuilder("TR-1").build()));

    assertThatThrownBy(
            () ->
                catalog.replace(
                    List.of(
                        new DesignRecordBuilder("TR-9").build(),
                        new DesignRecordBuilder("TR-9").build())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Duplicate design id: TR-9");
    assertThat(catalog.findById("TR-1")).isPresent();
  }
}
