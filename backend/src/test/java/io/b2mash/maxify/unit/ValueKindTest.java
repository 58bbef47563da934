package io.b2mash.maxify.unit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.maxify.exception.ModelException;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ValueKindTest {

  @ParameterizedTest
  @CsvSource({
    "Integer, INTEGER",
    "int, INTEGER",
    "Number, DECIMAL",
    "decimal, DECIMAL",
    "FLOAT, DECIMAL",
    "Duration, DURATION",
    "time, DURATION",
    "String, STRING",
    "str, STRING",
    "' text ', STRING"
  })
  void resolvesTypeIdentifiers(String identifier, ValueKind expected) {
    assertThat(ValueKind.fromIdentifier(identifier)).contains(expected);
  }

  @Test
  void unknownIdentifierResolvesToNothing() {
    assertThat(ValueKind.fromIdentifier("boolean")).isEmpty();
    assertThat(ValueKind.fromIdentifier(null)).isEmpty();
  }

  @Test
  void parsesWithTheKindsOwnUnit() {
    assertThat(ValueKind.INTEGER.parse("42")).isEqualTo(42L);
    assertThat(ValueKind.DECIMAL.parse("42")).isEqualTo(new BigDecimal("42"));
    assertThat(ValueKind.STRING.parse("42")).isEqualTo("42");
  }

  @Test
  void coerceRejectsOtherTypes() {
    assertThatThrownBy(() -> ValueKind.INTEGER.coerce("5"))
        .isInstanceOf(ModelException.class)
        .hasMessageContaining("Integer");
    assertThatThrownBy(() -> ValueKind.STRING.coerce(null)).isInstanceOf(ModelException.class);
  }

  @Test
  void stringsCannotBeSummed() {
    assertThat(ValueKind.STRING.isNumeric()).isFalse();
    assertThatThrownBy(() -> ValueKind.STRING.add("a", "b")).isInstanceOf(ModelException.class);
  }

  @Test
  void sameValueIgnoresDecimalScale() {
    assertThat(ValueKind.DECIMAL.sameValue(new BigDecimal("5.0"), new BigDecimal("5"))).isTrue();
    assertThat(ValueKind.INTEGER.sameValue(5, 5L)).isTrue();
  }

  @Test
  void encodeAndDecodeKeepExactValues() {
    var encoded = ValueKind.DURATION.encode(new BigDecimal("16200.0"));

    assertThat(ValueKind.DURATION.decode(encoded)).isEqualTo(new BigDecimal("16200.0"));
  }
}
