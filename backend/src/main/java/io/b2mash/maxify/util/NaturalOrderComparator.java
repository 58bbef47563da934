package io.b2mash.maxify.util;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orders strings the way people read them: runs of digits compare by numeric value and everything
 * else compares case-insensitively, so {@code "Task 2"} sorts before {@code "Task 10"}.
 */
public final class NaturalOrderComparator implements Comparator<String> {

  public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

  private static final Pattern DIGITS = Pattern.compile("[0-9]+");

  private NaturalOrderComparator() {}

  @Override
  public int compare(String left, String right) {
    var a = chunks(left);
    var b = chunks(right);
    int shared = Math.min(a.size(), b.size());
    for (int i = 0; i < shared; i++) {
      int result = compareChunk(a.get(i), b.get(i));
      if (result != 0) {
        return result;
      }
    }
    int bySize = Integer.compare(a.size(), b.size());
    return bySize != 0 ? bySize : left.compareTo(right);
  }

  private static int compareChunk(Object a, Object b) {
    if (a instanceof BigInteger x && b instanceof BigInteger y) {
      return x.compareTo(y);
    }
    if (a instanceof BigInteger) {
      return -1;
    }
    if (b instanceof BigInteger) {
      return 1;
    }
    return ((String) a).compareTo((String) b);
  }

  private static List<Object> chunks(String value) {
    var chunks = new ArrayList<>();
    Matcher matcher = DIGITS.matcher(value);
    int last = 0;
    while (matcher.find()) {
      if (matcher.start() > last) {
        chunks.add(value.substring(last, matcher.start()).toLowerCase(Locale.ROOT));
      }
      chunks.add(new BigInteger(matcher.group()));
      last = matcher.end();
    }
    if (last < value.length()) {
      chunks.add(value.substring(last).toLowerCase(Locale.ROOT));
    }
    return chunks;
  }
}
