package com.onthegomap.tiledecoder.geo;

import com.carrotsearch.hppc.IntArrayList;
import com.google.protobuf.CodedInputStream;
import com.onthegomap.tiledecoder.DecodeException;
import com.onthegomap.tiledecoder.proto.PackedUint32;
import java.util.ArrayList;

/**
 * Interprets the packed geometry command stream of a vector tile feature into {@link Paths}.
 * <p>
 * The stream is a sequence of command integers ({@code id} in the low 3 bits, repeat {@code count} in the rest) each
 * followed by {@code count} pairs of zigzag-encoded deltas for MoveTo and LineTo, or nothing for ClosePath. A ClosePath
 * closes the current ring at most once whatever its count. Deltas accumulate into one cursor position across the whole
 * feature. Every point is multiplied by {@code scale} and rounded to the nearest integer (half away from zero) before
 * being range-checked against the target {@link CoordinateRange}.
 * <p>
 * The declared {@code count} of a command is only used as a hint to pre-size buffers, and that hint is capped at
 * {@link #MAX_RESERVED_POINTS} so a hostile tile cannot force a large allocation.
 *
 * @see <a href="https://github.com/mapbox/vector-tile-spec/tree/master/2.1#43-geometry-encoding">Geometry Encoding</a>
 */
public final class GeometryDecoder {

  /** Upper bound on points reserved from a command count: 1 MiB at 16 bytes per point. */
  public static final int MAX_RESERVED_POINTS = (1 << 20) / 16;

  private final GeometryType type;
  private final float scale;
  private final CoordinateRange range;
  private final int maxReservedPoints;
  private final boolean strictPointCommands;

  /**
   * @param type                geometry type of the feature
   * @param scale               factor applied to every decoded coordinate
   * @param range               range that scaled coordinates must fit in
   * @param maxReservedPoints   cap on points pre-allocated from a command count, at most
   *                            {@link #MAX_RESERVED_POINTS}
   * @param strictPointCommands when {@code true}, a LineTo or ClosePath in a point feature is an error
   */
  public GeometryDecoder(GeometryType type, float scale, CoordinateRange range, int maxReservedPoints,
    boolean strictPointCommands) {
    this.type = type;
    this.scale = scale;
    this.range = range;
    this.maxReservedPoints = Math.max(0, Math.min(maxReservedPoints, MAX_RESERVED_POINTS));
    this.strictPointCommands = strictPointCommands;
  }

  public GeometryDecoder(GeometryType type, float scale, CoordinateRange range) {
    this(type, scale, range, MAX_RESERVED_POINTS, false);
  }

  /** Returns the number of points to reserve for a command that declares {@code count} repetitions. */
  static int reservation(long count, int cap) {
    return (int) Math.max(0, Math.min(count, cap));
  }

  /** Rounds to the nearest integer with ties away from zero. */
  static double round(float value) {
    return Math.copySign(Math.floor(Math.abs((double) value) + 0.5), value);
  }

  /**
   * Decodes {@code commands} into paths.
   * <p>
   * The result always contains at least one path: the initial path is only replaced once a MoveTo arrives while it
   * already has points, so an empty command stream yields a single empty path.
   *
   * @throws DecodeException if the stream contains an unknown command, runs out of parameters, produces a coordinate
   *                         outside the range, or holds a malformed varint
   */
  public Paths decode(PackedUint32 commands) throws DecodeException {
    boolean pointType = type == GeometryType.POINT;
    int extraCoords = type.extraCoordinates();
    ArrayList<PointPath> paths = new ArrayList<>();
    IntArrayList current = new IntArrayList();
    boolean first = true;
    int command = Command.MOVE_TO.value;
    long length = 0;
    int reserve = 0;
    long x = 0;
    long y = 0;

    var cursor = commands.cursor();
    while (cursor.hasNext()) {
      if (length == 0) {
        int commandInteger = cursor.next();
        command = Command.id(commandInteger);
        length = Command.count(commandInteger);
        reserve = reservation(length, maxReservedPoints);
        if (command != Command.MOVE_TO.value && command != Command.LINE_TO.value &&
          command != Command.CLOSE_PATH.value) {
          throw new DecodeException(DecodeException.Kind.UNKNOWN_COMMAND,
            "unknown command " + command + " in " + type + " geometry");
        }
        if (length == 0) {
          continue;
        }
      }

      length--;

      if (command == Command.MOVE_TO.value || command == Command.LINE_TO.value) {
        if (pointType) {
          if (strictPointCommands && command == Command.LINE_TO.value) {
            throw new DecodeException(DecodeException.Kind.UNKNOWN_COMMAND, "LineTo command in point geometry");
          }
          if (first && command == Command.MOVE_TO.value) {
            paths.ensureCapacity(reserve);
            first = false;
          }
        } else if (first && command == Command.LINE_TO.value) {
          current.ensureCapacity((reserve + extraCoords) * 2);
          first = false;
        }

        if (command == Command.MOVE_TO.value && !current.isEmpty()) {
          paths.add(new PointPath(current.toArray()));
          current = new IntArrayList();
          if (!pointType) {
            first = true;
          }
        }

        x += CodedInputStream.decodeZigZag32(nextParameter(cursor, command));
        y += CodedInputStream.decodeZigZag32(nextParameter(cursor, command));
        double px = round(x * scale);
        double py = round(y * scale);
        if (!range.contains(px) || !range.contains(py)) {
          throw new DecodeException(DecodeException.Kind.COORDINATE_OUT_OF_RANGE,
            "point (%d, %d) scaled by %s is outside [%d, %d]".formatted(x, y, scale, range.min(), range.max()));
        }
        current.add((int) px, (int) py);
      } else {
        if (strictPointCommands && pointType) {
          throw new DecodeException(DecodeException.Kind.UNKNOWN_COMMAND, "ClosePath command in point geometry");
        }
        if (!current.isEmpty()) {
          current.add(current.get(0), current.get(1));
        }
        // a ClosePath consumes no parameters, so its count is ignored
        length = 0;
      }
    }

    paths.add(current.isEmpty() ? PointPath.EMPTY : new PointPath(current.toArray()));
    return new Paths(type, paths);
  }

  private static int nextParameter(PackedUint32.Cursor cursor, int command) throws DecodeException {
    if (!cursor.hasNext()) {
      throw new DecodeException(DecodeException.Kind.TRUNCATED_COMMAND,
        (command == Command.MOVE_TO.value ? "MoveTo" : "LineTo") + " command is missing parameters");
    }
    return cursor.next();
  }
}
