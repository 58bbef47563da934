package io.b2mash.maxify.unit;

import java.util.Optional;

/**
 * Converts between user facing text and an exact typed value for one {@link ValueKind}.
 *
 * <p>Implementations are stateless and thread safe. {@link #parse(String)} accepts the grammar a
 * user types; {@link #encode(Object)} and {@link #decode(String)} are the canonical storage form
 * and always round-trip, which {@link #format(Object)} is not required to do.
 *
 * @param <T> the Java type of parsed values
 */
public interface ValueUnit<T> {

  /**
   * Parses user or configuration supplied text.
   *
   * @throws io.b2mash.maxify.exception.ValueParsingException if the text is not valid for this unit
   */
  T parse(String text);

  /** Renders a value for display. */
  String format(T value);

  /**
   * Converts an already parsed value into this unit's value type. Returns empty when the value is
   * not of a compatible type; lossy conversions are never performed.
   */
  Optional<T> coerce(Object value);

  default String encode(T value) {
    return value.toString();
  }

  T decode(String encoded);
}
