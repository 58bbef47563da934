package io.b2mash.maxify.unit;

import java.util.Optional;

/** Free text. Parsing is the identity function. */
public final class StringUnit implements ValueUnit<String> {

  @Override
  public String parse(String text) {
    return text;
  }

  @Override
  public String format(String value) {
    return value;
  }

  @Override
  public Optional<String> coerce(Object value) {
    return value instanceof String s ? Optional.of(s) : Optional.empty();
  }

  @Override
  public String decode(String encoded) {
    return encoded;
  }
}
