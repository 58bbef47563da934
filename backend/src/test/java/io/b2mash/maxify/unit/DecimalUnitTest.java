package io.b2mash.maxify.unit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.maxify.exception.ValueParsingException;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class DecimalUnitTest {

  private final DecimalUnit unit = new DecimalUnit();

  @Test
  void parsesExactDecimals() {
    assertThat(unit.parse("500.5")).isEqualTo(new BigDecimal("500.5"));
  }

  @Test
  void rejectsMalformedText() {
    assertThatThrownBy(() -> unit.parse("5a"))
        .isInstanceOf(ValueParsingException.class)
        .hasMessageContaining("5a");
  }

  @Test
  void additionIsExact() {
    var sum = unit.add(unit.parse("0.1"), unit.parse("0.2"));

    assertThat(sum).isEqualTo(new BigDecimal("0.3"));
  }

  @Test
  void refusesBinaryFloatingPoint() {
    assertThat(unit.coerce(0.1d)).isEmpty();
    assertThat(unit.coerce(3)).contains(BigDecimal.valueOf(3));
  }

  @Test
  void formatsWithoutExponent() {
    assertThat(unit.format(new BigDecimal("1E+3"))).isEqualTo("1000");
  }
}
