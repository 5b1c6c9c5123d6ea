package dev.trafomatch;

import static org.assertj.core.api.Assertions.assertThat;

import dev.trafomatch.catalog.CatalogLoader;
import dev.trafomatch.catalog.CatalogStatsService;
import dev.trafomatch.catalog.DesignCatalog;
import dev.trafomatch.matching.AttributePolicy;
import dev.trafomatch.matching.AttributeSpec;
import dev.trafomatch.matching.RawQuery;
import dev.trafomatch.matching.ScoredResult;
import dev.trafomatch.search.DesignSearchService;
import dev.trafomatch.search.SearchResponse;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "trafomatch.catalog.file=src/test/resources/catalog/designs.json",
      "trafomatch.catalog.refresh-interval=PT1H"
    })
class TrafoMatchApplicationTest {

  @Autowired AttributePolicy policy;

  @Autowired CatalogLoader catalogLoader;

  @Autowired DesignCatalog catalog;

  @Autowired DesignSearchService searchService;

  @Autowired CatalogStatsService statsService;

  @BeforeEach
  void loadCatalog() {
    catalogLoader.refresh();
  }

  @Test
  void attributeTableIsBoundFromConfiguration() {
    assertThat(policy.attributes())
        .extracting(AttributeSpec::name)
        .startsWith("rating_kva", "high_voltage_v", "low_voltage_v", "vector_group")
        .contains("core_material");
    assertThat(policy.resolve("frequency_hz").tolerance().amount()).isZero();
    assertThat(policy.resolve("lv_material").tolerance().equivalent("Cu", "copper")).isTrue();
  }

  @Test
  void sampleCatalogIsLoaded() {
    assertThat(catalog.size()).isEqualTo(5);
    assertThat(statsService.stats().distinctValues().get("vector_group"))
        .containsExactly("Dyn11", "Dyn5", "Yyn0");
  }

  @Test
  void formSearchRanksClosestDesignFirst() {
    SearchResponse response =
        searchService.searchForm(
            Map.of(
                "rating_kva", "100 kVA",
                "high_voltage_v", "11 kV",
                "vector_group", "dyn11",
                "lv_material", "aluminium",
                "max_load_loss_w", 2000,
                "max_results", 3));

    assertThat(response.candidatesConsidered()).isEqualTo(5);
    assertThat(response.matches()).hasSizeLessThanOrEqualTo(3);
    assertThat(response.matches()).extracting(ScoredResult::recordId).first().isEqualTo("TR-1001");
    assertThat(response.matches().get(0).overallScore()).isEqualTo(1.0);
    assertThat(response.matches())
        .extracting(ScoredResult::recordId)
        .doesNotContain("TR-1004");
  }

  @Test
  void boundOnlySearchIsAcceptedByDefault() {
    SearchResponse response =
        searchService.search(new RawQuery(Map.of(), Map.of("load_loss_w", 5000), null));

    assertThat(response.query().isBoundOnly()).isTrue();
    assertThat(response.matches())
        .allSatisfy(match -> assertThat(match.details()).isEmpty())
        .extracting(ScoredResult::recordId)
        .isSorted();
  }
}
