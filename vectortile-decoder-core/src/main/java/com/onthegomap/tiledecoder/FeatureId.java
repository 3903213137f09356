package com.onthegomap.tiledecoder;

import java.math.BigInteger;

/**
 * The unsigned 64-bit identifier of a feature.
 *
 * @param bits the identifier, interpreted as unsigned
 */
public record FeatureId(long bits) implements Comparable<FeatureId> {

  public static FeatureId of(long bits) {
    return new FeatureId(bits);
  }

  /** Returns the identifier as a non-negative {@link BigInteger}. */
  public BigInteger toBigInteger() {
    return new BigInteger(Long.toUnsignedString(bits));
  }

  @Override
  public int compareTo(FeatureId o) {
    return Long.compareUnsigned(bits, o.bits);
  }

  @Override
  public String toString() {
    return Long.toUnsignedString(bits);
  }
}
