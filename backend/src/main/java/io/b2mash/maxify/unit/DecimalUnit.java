package io.b2mash.maxify.unit;

import io.b2mash.maxify.exception.ValueParsingException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Exact decimal numbers. Binary floating point values are refused by {@link #coerce(Object)} since
 * they cannot be represented exactly.
 */
public final class DecimalUnit implements NumericUnit<BigDecimal> {

  @Override
  public BigDecimal parse(String text) {
    if (text == null) {
      throw new ValueParsingException("Invalid decimal expression: null", null);
    }
    try {
      return new BigDecimal(text.trim());
    } catch (NumberFormatException e) {
      throw new ValueParsingException("Invalid decimal expression: " + text, text);
    }
  }

  @Override
  public String format(BigDecimal value) {
    return value.toPlainString();
  }

  @Override
  public Optional<BigDecimal> coerce(Object value) {
    return toExactDecimal(value);
  }

  @Override
  public String encode(BigDecimal value) {
    return value.toPlainString();
  }

  @Override
  public BigDecimal decode(String encoded) {
    return new BigDecimal(encoded);
  }

  @Override
  public BigDecimal add(BigDecimal left, BigDecimal right) {
    return left.add(right);
  }

  @Override
  public BigDecimal zero() {
    return BigDecimal.ZERO;
  }

  static Optional<BigDecimal> toExactDecimal(Object value) {
    if (value instanceof BigDecimal decimal) {
      return Optional.of(decimal);
    }
    if (value instanceof BigInteger big) {
      return Optional.of(new BigDecimal(big));
    }
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
    }
    return Optional.empty();
  }
}
