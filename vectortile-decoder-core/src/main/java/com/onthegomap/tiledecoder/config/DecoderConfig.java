package com.onthegomap.tiledecoder.config;

import com.onthegomap.tiledecoder.geo.CoordinateRange;
import com.onthegomap.tiledecoder.geo.GeometryDecoder;

/**
 * Holder for settings shared by every layer and feature decoded from one tile.
 *
 * @param maxReservedPoints   cap on how many points a geometry command's declared count may pre-allocate, between 0
 *                            and {@link GeometryDecoder#MAX_RESERVED_POINTS}
 * @param coordinateRange     range that scaled geometry coordinates must fit in
 * @param strictPointCommands when true, LineTo or ClosePath commands in point features fail decoding
 * @param maxInflatedBytes    largest tile that a gzip-compressed input may expand to
 */
public record DecoderConfig(
  int maxReservedPoints,
  CoordinateRange coordinateRange,
  boolean strictPointCommands,
  int maxInflatedBytes
) {

  /** Default limit on the size of an inflated gzip tile, 64 MiB. */
  public static final int DEFAULT_MAX_INFLATED_BYTES = 64 << 20;

  private static final DecoderConfig DEFAULTS = new DecoderConfig(GeometryDecoder.MAX_RESERVED_POINTS,
    CoordinateRange.INT16, false, DEFAULT_MAX_INFLATED_BYTES);

  public DecoderConfig {
    if (maxReservedPoints < 0 || maxReservedPoints > GeometryDecoder.MAX_RESERVED_POINTS) {
      throw new IllegalArgumentException("max_reserved_points must be between 0 and %d, got %d"
        .formatted(GeometryDecoder.MAX_RESERVED_POINTS, maxReservedPoints));
    }
    if (coordinateRange == null) {
      throw new IllegalArgumentException("coordinateRange is required");
    }
    if (maxInflatedBytes < 0) {
      throw new IllegalArgumentException("max_inflated_bytes must not be negative, got " + maxInflatedBytes);
    }
  }

  public DecoderConfig(int maxReservedPoints, CoordinateRange coordinateRange, boolean strictPointCommands) {
    this(maxReservedPoints, coordinateRange, strictPointCommands, DEFAULT_MAX_INFLATED_BYTES);
  }

  public static DecoderConfig defaults() {
    return DEFAULTS;
  }

  /** Reads settings from {@code arguments}, falling back to {@link #defaults()} for anything missing. */
  public static DecoderConfig from(Arguments arguments) {
    int maxReserved = arguments.getInteger("max_reserved_points",
      "maximum points to pre-allocate from a geometry command count", GeometryDecoder.MAX_RESERVED_POINTS);
    return new DecoderConfig(
      Math.max(0, Math.min(maxReserved, GeometryDecoder.MAX_RESERVED_POINTS)),
      CoordinateRange.named(arguments.getString("coordinate_type",
        "integer type decoded coordinates must fit in (int16 or int32)", "int16")),
      arguments.getBoolean("strict_point_commands", "reject LineTo and ClosePath commands in point features", false),
      arguments.getInteger("max_inflated_bytes", "largest size a gzipped tile may inflate to",
        DEFAULT_MAX_INFLATED_BYTES)
    );
  }

  /** Returns a copy of this config that decodes coordinates into {@code range}. */
  public DecoderConfig withCoordinateRange(CoordinateRange range) {
    return new DecoderConfig(maxReservedPoints, range, strictPointCommands, maxInflatedBytes);
  }

  /** Returns a copy of this config that refuses gzipped tiles inflating past {@code maxBytes}. */
  public DecoderConfig withMaxInflatedBytes(int maxBytes) {
    return new DecoderConfig(maxReservedPoints, coordinateRange, strictPointCommands, maxBytes);
  }
}
