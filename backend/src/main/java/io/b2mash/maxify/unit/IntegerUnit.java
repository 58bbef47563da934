package io.b2mash.maxify.unit;

import io.b2mash.maxify.exception.ModelException;
import io.b2mash.maxify.exception.ValueParsingException;
import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Base-10 integers, held as {@link Long}. Well-formed integers outside the {@code long} range are
 * rejected as out of range.
 */
public final class IntegerUnit implements NumericUnit<Long> {

  private static final Pattern DIGITS = Pattern.compile("[+-]?\\d+");

  @Override
  public Long parse(String text) {
    if (text == null) {
      throw new ValueParsingException("Invalid integer expression: null", null);
    }
    String trimmed = text.trim();
    try {
      return Long.parseLong(trimmed);
    } catch (NumberFormatException e) {
      if (DIGITS.matcher(trimmed).matches()) {
        throw new ValueParsingException("Integer out of range: " + text, text);
      }
      throw new ValueParsingException("Invalid integer expression: " + text, text);
    }
  }

  @Override
  public String format(Long value) {
    return value.toString();
  }

  @Override
  public Optional<Long> coerce(Object value) {
    if (value instanceof Long l) {
      return Optional.of(l);
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return Optional.of(((Number) value).longValue());
    }
    if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
      return Optional.of(big.longValue());
    }
    return Optional.empty();
  }

  @Override
  public Long decode(String encoded) {
    return Long.valueOf(encoded);
  }

  @Override
  public Long add(Long left, Long right) {
    try {
      return Math.addExact(left, right);
    } catch (ArithmeticException e) {
      throw new ModelException(
          "Integer overflow", "Accumulating " + right + " onto " + left + " overflows");
    }
  }

  @Override
  public Long zero() {
    return 0L;
  }
}
