package com.onthegomap.tiledecoder.geo;

import com.google.common.base.Preconditions;
import java.util.Locale;

/**
 * The inclusive range of the integer type that decoded coordinates are stored in.
 * <p>
 * A scaled coordinate outside this range fails decoding instead of being clamped.
 */
public record CoordinateRange(long min, long max) {

  /** 16-bit signed coordinates, the default target type. */
  public static final CoordinateRange INT16 = new CoordinateRange(Short.MIN_VALUE, Short.MAX_VALUE);
  public static final CoordinateRange INT32 = new CoordinateRange(Integer.MIN_VALUE, Integer.MAX_VALUE);

  public CoordinateRange {
    Preconditions.checkArgument(min <= max, "min %s must not exceed max %s", min, max);
    Preconditions.checkArgument(min >= Integer.MIN_VALUE && max <= Integer.MAX_VALUE,
      "coordinate range [%s, %s] does not fit in 32 bits", min, max);
  }

  public static CoordinateRange of(long min, long max) {
    return new CoordinateRange(min, max);
  }

  /** Returns the range named {@code int16} or {@code int32}. */
  public static CoordinateRange named(String name) {
    return switch (name.strip().toLowerCase(Locale.ROOT)) {
      case "int16", "short" -> INT16;
      case "int32", "int" -> INT32;
      default -> throw new IllegalArgumentException("Unrecognized coordinate type: " + name);
    };
  }

  /** Returns {@code true} if {@code value} is a number within this range. NaN is never contained. */
  public boolean contains(double value) {
    return value >= min && value <= max;
  }
}
