package com.onthegomap.tiledecoder.geo;

/**
 * The geometry type declared by a vector tile feature.
 */
public enum GeometryType {
  UNKNOWN(0, 0, 0),
  POINT(1, 1, 0),
  LINESTRING(2, 2, 1),
  POLYGON(3, 4, 2);

  private final int number;
  private final int minPoints;
  private final int extraCoordinates;

  GeometryType(int number, int minPoints, int extraCoordinates) {
    this.number = number;
    this.minPoints = minPoints;
    this.extraCoordinates = extraCoordinates;
  }

  /** Returns the type for the protobuf {@code GeomType} enum value, or {@link #UNKNOWN} for unrecognised values. */
  public static GeometryType valueOf(int number) {
    return switch (number) {
      case 1 -> POINT;
      case 2 -> LINESTRING;
      case 3 -> POLYGON;
      default -> UNKNOWN;
    };
  }

  public int number() {
    return number;
  }

  /** Returns the minimum number of points in one path for a geometry of this type to be usable. */
  public int minPoints() {
    return minPoints;
  }

  /** Returns how many points beyond the first LineTo count to reserve for the current path. */
  int extraCoordinates() {
    return extraCoordinates;
  }
}
