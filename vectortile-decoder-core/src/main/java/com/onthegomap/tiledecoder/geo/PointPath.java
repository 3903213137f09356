package com.onthegomap.tiledecoder.geo;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;
import javax.annotation.concurrent.Immutable;

/**
 * An exactly-sized sequence of decoded points: one ring, line, or point of a feature geometry.
 * <p>
 * Coordinates are stored as interleaved {@code x, y} pairs in a single {@code int[]}.
 */
@Immutable
public final class PointPath {

  static final PointPath EMPTY = new PointPath(new int[0]);

  private final int[] coords;

  PointPath(int[] coords) {
    assert coords.length % 2 == 0 : "odd coordinate count " + coords.length;
    this.coords = coords;
  }

  /** Returns a path through {@code xys}, given as alternating x and y values. */
  public static PointPath of(int... xys) {
    if (xys.length % 2 != 0) {
      throw new IllegalArgumentException("expected x/y pairs, got " + xys.length + " values");
    }
    return xys.length == 0 ? EMPTY : new PointPath(xys.clone());
  }

  public int size() {
    return coords.length / 2;
  }

  public boolean isEmpty() {
    return coords.length == 0;
  }

  public int x(int index) {
    return coords[index * 2];
  }

  public int y(int index) {
    return coords[index * 2 + 1];
  }

  public TilePoint get(int index) {
    return new TilePoint(x(index), y(index));
  }

  /** Returns {@code true} if this path has at least 2 points and ends where it started. */
  public boolean isClosed() {
    int n = size();
    return n > 1 && x(0) == x(n - 1) && y(0) == y(n - 1);
  }

  /** Returns a read-only list view over the points of this path. */
  public List<TilePoint> toList() {
    return new AbstractList<>() {
      @Override
      public TilePoint get(int index) {
        return PointPath.this.get(index);
      }

      @Override
      public int size() {
        return PointPath.this.size();
      }
    };
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PointPath other && Arrays.equals(coords, other.coords));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(coords);
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder("[");
    for (int i = 0; i < size(); i++) {
      if (i > 0) {
        result.append(", ");
      }
      result.append('(').append(x(i)).append(", ").append(y(i)).append(')');
    }
    return result.append(']').toString();
  }
}
