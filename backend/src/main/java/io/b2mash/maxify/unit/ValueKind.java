package io.b2mash.maxify.unit;

import io.b2mash.maxify.exception.ModelException;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The declared type of a metric's values. Each kind selects exactly one {@link ValueUnit}, so text
 * is always parsed deterministically and never by trying every unit in turn.
 */
public enum ValueKind {
  INTEGER(new IntegerUnit()),
  DECIMAL(new DecimalUnit()),
  DURATION(new DurationUnit()),
  STRING(new StringUnit());

  private static final Map<String, ValueKind> IDENTIFIERS =
      Map.of(
          "integer", INTEGER,
          "int", INTEGER,
          "decimal", DECIMAL,
          "number", DECIMAL,
          "float", DECIMAL,
          "duration", DURATION,
          "time", DURATION,
          "string", STRING,
          "str", STRING,
          "text", STRING);

  private final ValueUnit<?> unit;

  ValueKind(ValueUnit<?> unit) {
    this.unit = unit;
  }

  /** Resolves a metric type identifier as written in a project definition, ignoring case. */
  public static Optional<ValueKind> fromIdentifier(String identifier) {
    if (identifier == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(IDENTIFIERS.get(identifier.trim().toLowerCase(Locale.ROOT)));
  }

  public boolean isNumeric() {
    return unit instanceof NumericUnit;
  }

  /**
   * Parses text with this kind's unit.
   *
   * @throws io.b2mash.maxify.exception.ValueParsingException if the text is invalid
   */
  public Object parse(String text) {
    return unit.parse(text);
  }

  /**
   * Normalizes an already parsed value to this kind's value type.
   *
   * @throws ModelException if the value is absent or of an incompatible type
   */
  public Object coerce(Object value) {
    if (value == null) {
      throw new ModelException("Type mismatch", "A " + label() + " value is required");
    }
    return unit.coerce(value)
        .map(Object.class::cast)
        .orElseThrow(
            () ->
                new ModelException(
                    "Type mismatch",
                    "Expected a "
                        + label()
                        + " value but got "
                        + value.getClass().getSimpleName()
                        + " '"
                        + value
                        + "'"));
  }

  public String format(Object value) {
    return formatWith(unit, coerce(value));
  }

  public String encode(Object value) {
    return encodeWith(unit, coerce(value));
  }

  public Object decode(String encoded) {
    return unit.decode(encoded);
  }

  /**
   * Sums two values of this kind.
   *
   * @throws ModelException if this kind is not numeric or the sum overflows
   */
  public Object add(Object left, Object right) {
    return addWith(numericUnit(), coerce(left), coerce(right));
  }

  /** Additive identity of a numeric kind. */
  public Object zero() {
    return numericUnit().zero();
  }

  /** Value equality that ignores decimal scale, so {@code 5.0} and {@code 5} are the same. */
  public boolean sameValue(Object left, Object right) {
    Object a = coerce(left);
    Object b = coerce(right);
    if (a instanceof BigDecimal x && b instanceof BigDecimal y) {
      return x.compareTo(y) == 0;
    }
    return a.equals(b);
  }

  /** Human readable name, e.g. {@code "Duration"}. */
  public String label() {
    String lower = name().toLowerCase(Locale.ROOT);
    return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
  }

  private NumericUnit<?> numericUnit() {
    if (unit instanceof NumericUnit<?> numeric) {
      return numeric;
    }
    throw new ModelException("Unsupported operation", label() + " values cannot be summed");
  }

  @SuppressWarnings("unchecked")
  private static <T> String formatWith(ValueUnit<T> unit, Object value) {
    return unit.format((T) value);
  }

  @SuppressWarnings("unchecked")
  private static <T> String encodeWith(ValueUnit<T> unit, Object value) {
    return unit.encode((T) value);
  }

  @SuppressWarnings("unchecked")
  private static <T> Object addWith(NumericUnit<T> unit, Object left, Object right) {
    return unit.add((T) left, (T) right);
  }
}
