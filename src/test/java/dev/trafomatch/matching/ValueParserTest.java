package dev.trafomatch.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.trafomatch.design.AttributeValue;
import org.junit.jupiter.api.Test;

class ValueParserTest {

  private static final AttributeSpec VOLTAGE =
      AttributeSpec.numeric("high_voltage_v", 1.0, ToleranceRule.relative(0.05), "V");
  private static final AttributeSpec RATING =
      AttributeSpec.numeric("rating_kva", 1.0, ToleranceRule.relative(0.05), "kVA");
  private static final AttributeSpec IMPEDANCE =
      AttributeSpec.numeric("impedance_percent", 1.0, ToleranceRule.relative(0.1), "%");
  private static final AttributeSpec COOLING = AttributeSpec.categorical("cooling_type", 1.0);

  @Test
  void numbersPassThrough() {
    assertThat(ValueParser.parse(VOLTAGE, 11000)).isEqualTo(AttributeValue.of(11000.0));
    assertThat(ValueParser.parse(VOLTAGE, 415.5)).isEqualTo(AttributeValue.of(415.5));
  }

  @Test
  void numericStringsAreCoerced() {
    assertThat(ValueParser.parse(VOLTAGE, " 11000 ")).isEqualTo(AttributeValue.of(11000.0));
    assertThat(ValueParser.parse(IMPEDANCE, "4,5")).isEqualTo(AttributeValue.of(4.5));
    assertThat(ValueParser.parse(IMPEDANCE, ".5")).isEqualTo(AttributeValue.of(0.5));
  }

  @Test
  void declaredUnitSuffixIsAccepted() {
    assertThat(ValueParser.parse(VOLTAGE, "11000V")).isEqualTo(AttributeValue.of(11000.0));
    assertThat(ValueParser.parse(RATING, "100 kVA")).isEqualTo(AttributeValue.of(100.0));
    assertThat(ValueParser.parse(IMPEDANCE, "4,5%")).isEqualTo(AttributeValue.of(4.5));
  }

  @Test
  void kiloPrefixedUnitIsScaled() {
    assertThat(ValueParser.parse(VOLTAGE, "11 kV")).isEqualTo(AttributeValue.of(11000.0));
    assertThat(ValueParser.parse(VOLTAGE, "0.4kv")).isEqualTo(AttributeValue.of(400.0));
  }

  @Test
  void foreignUnitIsRejected() {
    assertThatThrownBy(() -> ValueParser.parse(VOLTAGE, "100 kVA"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unexpected unit 'kVA'");
  }

  @Test
  void digitGroupingIsRejectedAsAmbiguous() {
    assertThatThrownBy(() -> ValueParser.parse(RATING, "1,000 kVA"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ambiguous digit grouping");
    assertThatThrownBy(() -> ValueParser.parse(VOLTAGE, "11,000"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(ValueParser.parse(RATING, "1,25 kVA")).isEqualTo(AttributeValue.of(1.25));
    assertThat(ValueParser.parse(RATING, "1,2500")).isEqualTo(AttributeValue.of(1.25));
  }

  @Test
  void garbageIsRejected() {
    assertThatThrownBy(() -> ValueParser.parse(RATING, "about a hundred"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("not a number");
    assertThatThrownBy(() -> ValueParser.parse(RATING, "1.2.3"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ValueParser.parse(RATING, true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("expected a number");
    assertThatThrownBy(() -> ValueParser.parse(RATING, Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void categoricalInputIsTrimmedText() {
    assertThat(ValueParser.parse(COOLING, " ONAN ")).isEqualTo(AttributeValue.of("ONAN"));
  }

  @Test
  void categoricalAcceptsNumbersInPlainForm() {
    assertThat(ValueParser.parse(COOLING, 11)).isEqualTo(AttributeValue.of("11"));
    assertThat(ValueParser.parse(COOLING, 11.0)).isEqualTo(AttributeValue.of("11"));
  }

  @Test
  void blankCategoricalIsRejected() {
    assertThatThrownBy(() -> ValueParser.parse(COOLING, " "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("expected text");
  }
}
