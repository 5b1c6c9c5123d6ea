package dev.trafomatch.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.trafomatch.design.AttributeKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class MatchingPropertiesTest {

  @Test
  void defaultsAreApplied() {
    MatchingProperties properties = withAttributes(numeric("rating_kva", 1.0, 0.05));

    properties.validate();

    assertThat(properties.getAbsentScore()).isEqualTo(0.5);
    assertThat(properties.isAbsentBoundSatisfied()).isTrue();
    assertThat(properties.getBoundOnlyPolicy()).isEqualTo(BoundOnlyPolicy.ACCEPT);
    assertThat(properties.getDefaultLimit()).isEqualTo(10);
  }

  @Test
  void attributeRowsBecomeSpecsInDeclarationOrder() {
    MatchingProperties.Attribute material = new MatchingProperties.Attribute();
    material.setName("lv_material");
    material.setKind(AttributeKind.CATEGORICAL);
    material.setWeight(0.4);
    material.setEquivalenceClasses(List.of(List.of("cu", "copper")));
    MatchingProperties.Attribute impedance = numeric("impedance_percent", 0.6, 0.5);
    impedance.setToleranceMode(ToleranceRule.Mode.ABSOLUTE);
    impedance.setUnit("%");

    List<AttributeSpec> specs =
        withAttributes(numeric("rating_kva", 1.0, 0.05), material, impedance).toSpecs();

    assertThat(specs).extracting(AttributeSpec::name)
        .containsExactly("rating_kva", "lv_material", "impedance_percent");
    assertThat(specs.get(0).tolerance()).isEqualTo(ToleranceRule.relative(0.05));
    assertThat(specs.get(1).tolerance().equivalent("CU", "Copper")).isTrue();
    assertThat(specs.get(2).tolerance()).isEqualTo(ToleranceRule.absolute(0.5));
    assertThat(specs.get(2).unit()).isEqualTo("%");
  }

  @Test
  void absentScoreOutOfRangeFailsValidation() {
    MatchingProperties properties = withAttributes(numeric("rating_kva", 1.0, 0.05));
    properties.setAbsentScore(-0.1);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("absent-score");
  }

  @Test
  void emptyAttributeTableFailsValidation() {
    assertThatThrownBy(new MatchingProperties()::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("attributes must not be empty");
  }

  @Test
  void duplicateAttributeFailsValidation() {
    MatchingProperties properties =
        withAttributes(numeric("rating_kva", 1.0, 0.05), numeric("rating_kva", 2.0, 0.1));

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("'rating_kva' twice");
  }

  @Test
  void nonPositiveWeightFailsValidation() {
    MatchingProperties properties = withAttributes(numeric("rating_kva", 0.0, 0.05));

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("weight must be positive");
  }

  @Test
  void toleranceModeMustFitKind() {
    MatchingProperties.Attribute group = new MatchingProperties.Attribute();
    group.setName("vector_group");
    group.setKind(AttributeKind.CATEGORICAL);
    group.setToleranceMode(ToleranceRule.Mode.RELATIVE);

    assertThatThrownBy(withAttributes(group)::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("vector_group");
  }

  @Test
  void limitsMustBeConsistent() {
    MatchingProperties properties = withAttributes(numeric("rating_kva", 1.0, 0.05));
    properties.setDefaultLimit(20);
    properties.setMaxLimit(5);

    assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
  }

  private static MatchingProperties.Attribute numeric(String name, double weight, double tol) {
    MatchingProperties.Attribute attribute = new MatchingProperties.Attribute();
    attribute.setName(name);
    attribute.setKind(AttributeKind.NUMERIC);
    attribute.setWeight(weight);
    attribute.setTolerance(tol);
    return attribute;
  }

  private static MatchingProperties withAttributes(MatchingProperties.Attribute... attributes) {
    MatchingProperties properties = new MatchingProperties();
    properties.setAttributes(List.of(attributes));
    return properties;
  }
}
