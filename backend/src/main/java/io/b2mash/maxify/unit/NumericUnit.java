package io.b2mash.maxify.unit;

/** A unit whose values can be summed, which makes it usable for accumulating metrics. */
public interface NumericUnit<T> extends ValueUnit<T> {

  T add(T left, T right);

  T zero();
}
