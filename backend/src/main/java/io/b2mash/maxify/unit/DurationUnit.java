package io.b2mash.maxify.unit;

import io.b2mash.maxify.exception.ValueParsingException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Time spans measured in seconds, held as an exact {@link BigDecimal}.
 *
 * <p>Two input grammars are accepted and never mixed within one string:
 *
 * <ol>
 *   <li>clock format {@code H:MM:SS} or {@code H:MM};
 *   <li>one or more {@code <number><unit>} / {@code <unit><number>} tokens separated by whitespace
 *       or commas, e.g. {@code "2 hrs, 5 mins"} or {@code "hrs 2, 5 mins"}. Units are matched
 *       case-insensitively against the day, hour, minute and second synonym sets.
 * </ol>
 *
 * An input that matches neither grammar, including the empty string, is rejected.
 */
public final class DurationUnit implements NumericUnit<BigDecimal> {

  private static final long SECONDS_PER_DAY = 86_400;
  private static final long SECONDS_PER_HOUR = 3_600;
  private static final long SECONDS_PER_MINUTE = 60;

  private static final List<UnitSynonyms> UNITS =
      List.of(
          new UnitSynonyms(Set.of("days", "day", "d"), SECONDS_PER_DAY),
          new UnitSynonyms(Set.of("hours", "hour", "hrs", "hr", "h"), SECONDS_PER_HOUR),
          new UnitSynonyms(Set.of("minutes", "minute", "mins", "min", "m"), SECONDS_PER_MINUTE),
          new UnitSynonyms(Set.of("seconds", "second", "secs", "sec", "s"), 1));

  private static final Pattern CLOCK_FORMAT =
      Pattern.compile("^\\s*(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2}))?\\s*$");

  private static final Pattern TOKEN =
      Pattern.compile(
          "(?:(?<unit>[A-Za-z]+)\\s*(?<num>\\d+\\.?\\d*))"
              + "|(?:(?<numAlt>\\d+\\.?\\d*)\\s*(?<unitAlt>[A-Za-z]+))");

  private static final Pattern SEPARATORS = Pattern.compile("[\\s,]*");

  @Override
  public BigDecimal parse(String text) {
    if (text == null) {
      throw new ValueParsingException("Invalid duration expression: null", null);
    }

    var clockValue = parseClockFormat(text);
    if (clockValue.isPresent()) {
      return clockValue.get();
    }

    BigDecimal total = BigDecimal.ZERO;
    int matched = 0;
    int lastEnd = 0;
    Matcher matcher = TOKEN.matcher(text);
    while (matcher.find()) {
      requireSeparatorsOnly(text, text.substring(lastEnd, matcher.start()));
      lastEnd = matcher.end();

      String number = matcher.group("num") != null ? matcher.group("num") : matcher.group("numAlt");
      String unit = matcher.group("unit") != null ? matcher.group("unit") : matcher.group("unitAlt");

      long multiplier =
          multiplierFor(unit)
              .orElseThrow(
                  () ->
                      new ValueParsingException(
                          "Invalid duration expression: " + matcher.group(), text));
      total = total.add(new BigDecimal(number).multiply(BigDecimal.valueOf(multiplier)));
      matched++;
    }
    requireSeparatorsOnly(text, text.substring(lastEnd));

    if (matched == 0) {
      throw new ValueParsingException("Invalid duration expression: " + text, text);
    }
    return total;
  }

  /**
   * Renders the duration the way a time span is usually printed, e.g. {@code "1 day, 0:01:40"} or
   * {@code "0:00:04.500000"}. Not intended to round-trip through {@link #parse(String)}.
   */
  @Override
  public String format(BigDecimal seconds) {
    if (seconds.signum() < 0) {
      return "-" + format(seconds.negate());
    }

    BigDecimal whole = seconds.setScale(0, RoundingMode.DOWN);
    BigDecimal fraction = seconds.subtract(whole);

    // Day counts are unbounded; only the remainder within one day narrows to int.
    BigDecimal[] daysAndRemainder = whole.divideAndRemainder(BigDecimal.valueOf(SECONDS_PER_DAY));
    BigInteger days = daysAndRemainder[0].toBigInteger();
    int remainder = daysAndRemainder[1].intValueExact();
    int hours = remainder / (int) SECONDS_PER_HOUR;
    int minutes = remainder % (int) SECONDS_PER_HOUR / (int) SECONDS_PER_MINUTE;
    int secs = remainder % (int) SECONDS_PER_MINUTE;

    var sb = new StringBuilder();
    if (days.signum() > 0) {
      sb.append(days).append(BigInteger.ONE.equals(days) ? " day, " : " days, ");
    }
    sb.append(String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, secs));

    if (fraction.signum() != 0) {
      long micros = fraction.movePointRight(6).setScale(0, RoundingMode.DOWN).longValueExact();
      sb.append(String.format(Locale.ROOT, ".%06d", micros));
    }
    return sb.toString();
  }

  @Override
  public Optional<BigDecimal> coerce(Object value) {
    if (value instanceof Duration duration) {
      return Optional.of(
          BigDecimal.valueOf(duration.getSeconds())
              .add(BigDecimal.valueOf(duration.getNano(), 9))
              .stripTrailingZeros());
    }
    return DecimalUnit.toExactDecimal(value);
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

  private static Optional<BigDecimal> parseClockFormat(String text) {
    Matcher matcher = CLOCK_FORMAT.matcher(text);
    if (!matcher.matches()) {
      return Optional.empty();
    }

    int hours = Integer.parseInt(matcher.group(1));
    int minutes = Integer.parseInt(matcher.group(2));
    int seconds = matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : 0;
    if (hours > 23 || minutes > 59 || seconds > 59) {
      return Optional.empty();
    }
    return Optional.of(
        BigDecimal.valueOf(hours * SECONDS_PER_HOUR + minutes * SECONDS_PER_MINUTE + seconds));
  }

  private static Optional<Long> multiplierFor(String unit) {
    String normalized = unit.toLowerCase(Locale.ROOT);
    return UNITS.stream()
        .filter(u -> u.names().contains(normalized))
        .map(UnitSynonyms::seconds)
        .findFirst();
  }

  private static void requireSeparatorsOnly(String text, String gap) {
    if (!SEPARATORS.matcher(gap).matches()) {
      throw new ValueParsingException("Invalid duration expression: " + gap.trim(), text);
    }
  }

  private record UnitSynonyms(Set<String> names, long seconds) {}
}
