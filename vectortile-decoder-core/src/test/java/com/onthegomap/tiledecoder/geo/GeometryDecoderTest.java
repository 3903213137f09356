package com.onthegomap.tiledecoder.geo;

import static com.onthegomap.tiledecoder.TestTiles.command;
import static com.onthegomap.tiledecoder.TestTiles.commands;
import static com.onthegomap.tiledecoder.TestTiles.packed;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.protobuf.ByteString;
import com.onthegomap.tiledecoder.DecodeException;
import com.onthegomap.tiledecoder.proto.PackedUint32;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class GeometryDecoderTest {

  private static Paths decode(GeometryType type, PackedUint32 commands) throws DecodeException {
    return decode(type, 1f, commands);
  }

  private static Paths decode(GeometryType type, float scale, PackedUint32 commands) throws DecodeException {
    return new GeometryDecoder(type, scale, CoordinateRange.INT16).decode(commands);
  }

  private static DecodeException.Kind failure(GeometryType type, PackedUint32 commands) {
    return assertThrows(DecodeException.class, () -> decode(type, commands)).kind();
  }

  @Test
  void testPoint() throws DecodeException {
    Paths paths = decode(GeometryType.POINT, packed(9, 20, 20));
    assertEquals(Paths.of(GeometryType.POINT, PointPath.of(10, 10)), paths);
    assertEquals(List.of(new TilePoint(10, 10)), paths.points().toList());
  }

  @Test
  void testMultiPoint() throws DecodeException {
    assertEquals(
      Paths.of(GeometryType.POINT, PointPath.of(5, 7), PointPath.of(3, 2)),
      decode(GeometryType.POINT, packed(17, 10, 14, 3, 9))
    );
  }

  @Test
  void testLineString() throws DecodeException {
    assertEquals(
      Paths.of(GeometryType.LINESTRING, PointPath.of(2, 2, 2, 7)),
      decode(GeometryType.LINESTRING, packed(9, 4, 4, 10, 0, 10))
    );
  }

  @Test
  void testMultiLineStringDeltasCarryAcrossPaths() throws DecodeException {
    var commands = commands()
      .moveTo(2, 2).lineTo(2, 10, 10, 10)
      .moveTo(1, 1).lineTo(3, 5);
    assertEquals(
      Paths.of(GeometryType.LINESTRING, PointPath.of(2, 2, 2, 10, 10, 10), PointPath.of(1, 1, 3, 5)),
      decode(GeometryType.LINESTRING, commands.toPacked())
    );
  }

  @Test
  void testPolygonClosePathRepeatsFirstPoint() throws DecodeException {
    Paths paths = decode(GeometryType.POLYGON, packed(9, 6, 12, 18, 10, 12, 24, 44, 15));
    assertEquals(Paths.of(GeometryType.POLYGON, PointPath.of(3, 6, 8, 12, 20, 34, 3, 6)), paths);
    assertTrue(paths.get(0).isClosed());
  }

  @Test
  void testPolygonWithHole() throws DecodeException {
    var commands = commands()
      .moveTo(0, 0).lineTo(10, 0, 10, 10, 0, 10).closePath()
      .moveTo(2, 2).lineTo(2, 8, 8, 8, 8, 2).closePath();
    assertEquals(
      Paths.of(GeometryType.POLYGON,
        PointPath.of(0, 0, 10, 0, 10, 10, 0, 10, 0, 0),
        PointPath.of(2, 2, 2, 8, 8, 8, 8, 2, 2, 2)),
      decode(GeometryType.POLYGON, commands.toPacked())
    );
  }

  @Test
  void testEmptyStreamYieldsSingleEmptyPath() throws DecodeException {
    Paths paths = decode(GeometryType.POLYGON, PackedUint32.EMPTY);
    assertEquals(1, paths.size());
    assertTrue(paths.isEmpty());
  }

  @Test
  void testClosePathOnEmptyPathIsNoOp() throws DecodeException {
    Paths paths = decode(GeometryType.POLYGON, packed(command(1, 0), command(7, 1)));
    assertEquals(Paths.of(GeometryType.POLYGON, PointPath.of()), paths);
    assertEquals(0, paths.pointCount());
  }

  @Test
  void testZeroCountCommandIsSkipped() throws DecodeException {
    assertEquals(
      Paths.of(GeometryType.LINESTRING, PointPath.of(1, 1, 3, 3)),
      decode(GeometryType.LINESTRING, packed(9, 2, 2, command(2, 0), command(2, 1), 4, 4))
    );
  }

  @ParameterizedTest
  @CsvSource({
    "0",
    "3",
    "4",
    "5",
    "6",
  })
  void testUnknownCommand(int id) {
    assertEquals(DecodeException.Kind.UNKNOWN_COMMAND,
      failure(GeometryType.LINESTRING, packed(9, 2, 2, command(id, 1), 2, 2)));
  }

  @Test
  void testUnknownCommandWithZeroCount() {
    assertEquals(DecodeException.Kind.UNKNOWN_COMMAND, failure(GeometryType.POINT, packed(command(3, 0))));
  }

  @Test
  void testMissingParameters() {
    assertEquals(DecodeException.Kind.TRUNCATED_COMMAND, failure(GeometryType.POINT, packed(9, 2)));
    assertEquals(DecodeException.Kind.TRUNCATED_COMMAND, failure(GeometryType.POINT, packed(9)));
    assertEquals(DecodeException.Kind.TRUNCATED_COMMAND,
      failure(GeometryType.LINESTRING, packed(9, 2, 2, command(2, 2), 2, 2, 4)));
  }

  @Test
  void testStreamShorterThanDeclaredCount() throws DecodeException {
    assertEquals(
      Paths.of(GeometryType.LINESTRING, PointPath.of(1, 1, 2, 2)),
      decode(GeometryType.LINESTRING, packed(9, 2, 2, command(2, 5), 2, 2))
    );
  }

  @Test
  void testHugeDeclaredCountDoesNotDriveReservation() throws DecodeException {
    assertEquals(GeometryDecoder.MAX_RESERVED_POINTS, GeometryDecoder.reservation(10_000_000, 65_536));
    assertEquals(65_536, GeometryDecoder.MAX_RESERVED_POINTS);
    assertEquals(3, GeometryDecoder.reservation(3, 65_536));
    assertEquals(0, GeometryDecoder.reservation(10, 0));

    assertEquals(
      Paths.of(GeometryType.LINESTRING, PointPath.of(1, 1, 2, 2, 3, 3)),
      decode(GeometryType.LINESTRING, packed(9, 2, 2, command(2, 10_000_000), 2, 2, 2, 2))
    );
    assertEquals(
      Paths.of(GeometryType.POINT, PointPath.of(1, 1)),
      decode(GeometryType.POINT, packed(command(1, 10_000_000), 2, 2))
    );
    assertEquals(
      Paths.of(GeometryType.POLYGON, PointPath.of(0, 0)),
      decode(GeometryType.POLYGON, packed(command(1, (1 << 29) - 1), 0, 0))
    );
  }

  @Test
  void testClosePathRepeatCountClosesOnce() throws DecodeException {
    assertEquals(
      Paths.of(GeometryType.POLYGON, PointPath.of(1, 1, 1, 1, 1, 1)),
      decode(GeometryType.POLYGON, packed(command(1, 1), 2, 2, command(7, (1 << 29) - 1), command(7, 1)))
    );
    assertEquals(
      Paths.of(GeometryType.POLYGON, PointPath.of(0, 0, 2, 0, 2, 2, 0, 0), PointPath.of(5, 5, 5, 5)),
      decode(GeometryType.POLYGON, commands()
        .moveTo(0, 0).lineTo(2, 0, 2, 2).raw(command(7, 3))
        .moveTo(5, 5).closePath().toPacked())
    );
  }

  @Test
  void testLongStreamBeyondReservationCap() throws DecodeException {
    int n = 1_000;
    int[] xys = new int[n * 2];
    for (int i = 0; i < n; i++) {
      xys[i * 2] = i;
      xys[i * 2 + 1] = i;
    }
    Paths paths = new GeometryDecoder(GeometryType.LINESTRING, 1f, CoordinateRange.INT16, 10, false)
      .decode(commands().moveTo(0, 0).lineTo(Arrays.copyOfRange(xys, 2, xys.length)).toPacked());
    assertEquals(1, paths.size());
    assertEquals(n, paths.get(0).size());
    assertEquals(new TilePoint(n - 1, n - 1), paths.get(0).get(n - 1));
  }

  @ParameterizedTest
  @CsvSource({
    "3, 0.5, 2",
    "-3, 0.5, -2",
    "5, 0.5, 3",
    "-5, 0.5, -3",
    "4096, 0.0625, 256",
    "1, 0.4, 0",
    "100, 2, 200",
  })
  void testScaleRoundsHalfAwayFromZero(int x, float scale, int expected) throws DecodeException {
    Paths paths = decode(GeometryType.POINT, scale, commands().moveTo(x, x).toPacked());
    assertEquals(PointPath.of(expected, expected), paths.get(0));
  }

  @Test
  void testCoordinateOutOfRange() throws DecodeException {
    var commands = commands().moveTo(40_000, 0).toPacked();
    assertEquals(DecodeException.Kind.COORDINATE_OUT_OF_RANGE, failure(GeometryType.POINT, commands));
    assertEquals(Paths.of(GeometryType.POINT, PointPath.of(20_000, 0)),
      decode(GeometryType.POINT, 0.5f, commands));
    assertEquals(Paths.of(GeometryType.POINT, PointPath.of(40_000, 0)),
      new GeometryDecoder(GeometryType.POINT, 1f, CoordinateRange.INT32).decode(commands));
  }

  @Test
  void testRangeBoundariesAreInclusive() throws DecodeException {
    assertEquals(Paths.of(GeometryType.POINT, PointPath.of(32_767, -32_768)),
      decode(GeometryType.POINT, commands().moveTo(32_767, -32_768).toPacked()));
    assertEquals(DecodeException.Kind.COORDINATE_OUT_OF_RANGE,
      failure(GeometryType.POINT, commands().moveTo(0, -32_769).toPacked()));
  }

  @Test
  void testCustomRange() {
    var decoder = new GeometryDecoder(GeometryType.POINT, 1f, CoordinateRange.of(0, 10));
    assertThrows(DecodeException.class, () -> decoder.decode(commands().moveTo(-1, 5).toPacked()));
    assertThrows(DecodeException.class, () -> decoder.decode(commands().moveTo(5, 11).toPacked()));
  }

  @Test
  void testNanScaleIsOutOfRange() {
    var decoder = new GeometryDecoder(GeometryType.POINT, Float.NaN, CoordinateRange.INT32);
    var e = assertThrows(DecodeException.class, () -> decoder.decode(commands().moveTo(1, 1).toPacked()));
    assertEquals(DecodeException.Kind.COORDINATE_OUT_OF_RANGE, e.kind());
  }

  @ParameterizedTest
  @EnumSource(GeometryType.class)
  void testDeterministic(GeometryType type) throws DecodeException {
    var commands = commands().moveTo(1, 2).lineTo(3, 4, 5, 6).closePath().moveTo(7, 8).toPacked();
    assertEquals(decode(type, 0.5f, commands), decode(type, 0.5f, commands));
  }

  @Test
  void testUnknownTypeStillInterpretsCommands() throws DecodeException {
    assertEquals(
      Paths.of(GeometryType.UNKNOWN, PointPath.of(2, 2, 2, 7)),
      decode(GeometryType.UNKNOWN, packed(9, 4, 4, 10, 0, 10))
    );
  }

  @Test
  void testLineToInPointFeature() throws DecodeException {
    var commands = packed(9, 2, 2, 10, 2, 2);
    assertEquals(Paths.of(GeometryType.POINT, PointPath.of(1, 1, 2, 2)), decode(GeometryType.POINT, commands));

    var strict = new GeometryDecoder(GeometryType.POINT, 1f, CoordinateRange.INT16, 100, true);
    assertEquals(DecodeException.Kind.UNKNOWN_COMMAND,
      assertThrows(DecodeException.class, () -> strict.decode(commands)).kind());
  }

  @Test
  void testMalformedVarint() {
    var commands = PackedUint32.of(ByteString.copyFrom(new byte[]{(byte) 0x89}));
    assertEquals(DecodeException.Kind.PRIMITIVE_READ_ERROR, failure(GeometryType.POINT, commands));
  }
}
