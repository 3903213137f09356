package com.onthegomap.tiledecoder.config;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tiledecoder.geo.CoordinateRange;
import com.onthegomap.tiledecoder.geo.GeometryDecoder;
import org.junit.jupiter.api.Test;

class DecoderConfigTest {

  @Test
  void testDefaults() {
    DecoderConfig config = DecoderConfig.defaults();
    assertEquals(GeometryDecoder.MAX_RESERVED_POINTS, config.maxReservedPoints());
    assertEquals(CoordinateRange.INT16, config.coordinateRange());
    assertFalse(config.strictPointCommands());
    assertEquals(config, DecoderConfig.from(Arguments.of()));
  }

  @Test
  void testFromArguments() {
    DecoderConfig config = DecoderConfig.from(Arguments.of(
      "max-reserved-points", "100",
      "coordinate-type", "int32",
      "strict-point-commands", "true"
    ));
    assertEquals(new DecoderConfig(100, CoordinateRange.INT32, true), config);
    assertEquals(DecoderConfig.DEFAULT_MAX_INFLATED_BYTES, config.maxInflatedBytes());
    assertEquals(4096, DecoderConfig.from(Arguments.of("max_inflated_bytes", "4096")).maxInflatedBytes());
  }

  @Test
  void testReservationClamped() {
    assertEquals(GeometryDecoder.MAX_RESERVED_POINTS,
      DecoderConfig.from(Arguments.of("max_reserved_points", "100000000")).maxReservedPoints());
    assertEquals(0, DecoderConfig.from(Arguments.of("max_reserved_points", "-5")).maxReservedPoints());
  }

  @Test
  void testInvalid() {
    assertThrows(IllegalArgumentException.class,
      () -> new DecoderConfig(-1, CoordinateRange.INT16, false));
    assertThrows(IllegalArgumentException.class,
      () -> new DecoderConfig(GeometryDecoder.MAX_RESERVED_POINTS + 1, CoordinateRange.INT16, false));
    assertThrows(IllegalArgumentException.class, () -> new DecoderConfig(0, null, false));
    assertThrows(IllegalArgumentException.class,
      () -> DecoderConfig.defaults().withMaxInflatedBytes(-1));
    assertThrows(IllegalArgumentException.class,
      () -> DecoderConfig.from(Arguments.of("coordinate_type", "int64")));
  }

  @Test
  void testWithCoordinateRange() {
    DecoderConfig config = DecoderConfig.defaults().withCoordinateRange(CoordinateRange.INT32);
    assertEquals(CoordinateRange.INT32, config.coordinateRange());
    assertEquals(DecoderConfig.defaults().maxReservedPoints(), config.maxReservedPoints());
  }
}
