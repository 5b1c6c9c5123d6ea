package dev.trafomatch.design;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AttributeValueTest {

  @Test
  void numericValueReportsNumericKind() {
    AttributeValue value = AttributeValue.of(100.0);

    assertThat(value.kind()).isEqualTo(AttributeKind.NUMERIC);
    assertThat(value.asNumber()).isEqualTo(100.0);
    assertThat(value.display()).isEqualTo("100");
  }

  @Test
  void numericValueRejectsNonFiniteNumbers() {
    assertThatThrownBy(() -> AttributeValue.of(Double.NaN))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("finite");
    assertThatThrownBy(() -> AttributeValue.of(Double.POSITIVE_INFINITY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void categoricalValueIsTrimmedAndKeepsCase() {
    AttributeValue value = AttributeValue.of("  Dyn11 ");

    assertThat(value.kind()).isEqualTo(AttributeKind.CATEGORICAL);
    assertThat(value.asText()).isEqualTo("Dyn11");
    assertThat(((AttributeValue.Categorical) value).normalized()).isEqualTo("dyn11");
  }

  @Test
  void blankCategoricalValueIsRejected() {
    assertThatThrownBy(() -> AttributeValue.of("   "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Categorical value must not be blank");
  }

  @Test
  void readingTheWrongKindThrowsInvalidAttributeKind() {
    assertThatThrownBy(() -> AttributeValue.of("ONAN").asNumber())
        .isInstanceOf(InvalidAttributeKindException.class)
        .hasMessageContaining("ONAN");
    assertThatThrownBy(() -> AttributeValue.of(50.0).asText())
        .isInstanceOf(InvalidAttributeKindException.class);
  }

  @Test
  void numericDisplayDropsTrailingZerosOnly() {
    assertThat(AttributeValue.of(0.25).display()).isEqualTo("0.25");
    assertThat(AttributeValue.of(11000.0).display()).isEqualTo("11000");
  }
}
