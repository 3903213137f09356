package com.onthegomap.tiledecoder.geo;

import java.util.List;
import java.util.stream.Stream;
import javax.annotation.concurrent.Immutable;

/**
 * The decoded geometry of one feature: its paths in command-stream order plus the type they were decoded for.
 * <p>
 * For {@link GeometryType#POINT} each path normally holds one point, for {@link GeometryType#LINESTRING} each path is a
 * line, and for {@link GeometryType#POLYGON} each path is a ring closed by repeating its first point.
 */
@Immutable
public record Paths(GeometryType type, List<PointPath> paths) {

  public Paths {
    paths = List.copyOf(paths);
  }

  public static Paths of(GeometryType type, PointPath... paths) {
    return new Paths(type, List.of(paths));
  }

  public int size() {
    return paths.size();
  }

  public PointPath get(int index) {
    return paths.get(index);
  }

  /** Returns the total number of points across all paths. */
  public int pointCount() {
    int count = 0;
    for (PointPath path : paths) {
      count += path.size();
    }
    return count;
  }

  /** Returns {@code true} if no path contains a point. */
  public boolean isEmpty() {
    return pointCount() == 0;
  }

  public Stream<TilePoint> points() {
    return paths.stream().flatMap(path -> path.toList().stream());
  }
}
