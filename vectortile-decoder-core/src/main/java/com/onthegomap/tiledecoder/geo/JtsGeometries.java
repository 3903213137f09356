package com.onthegomap.tiledecoder.geo;

import static com.onthegomap.tiledecoder.geo.GeoUtils.JTS_FACTORY;

import com.onthegomap.tiledecoder.DecodeException;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.impl.PackedCoordinateSequence;

/**
 * Converts decoded {@link Paths} into JTS geometries.
 * <p>
 * Polygon rings are grouped the way the vector tile specification orders them: the winding of the first ring marks
 * exterior rings, and each ring with the opposite winding is a hole in the most recent exterior ring.
 */
public final class JtsGeometries {

  private JtsGeometries() {}

  /**
   * Returns a JTS geometry for {@code paths} with every coordinate multiplied by {@code scale}.
   * <p>
   * Lines with fewer than 2 points and rings with fewer than 4 points are dropped. Unknown geometry types and paths
   * with nothing usable produce {@link GeoUtils#EMPTY_GEOMETRY}.
   *
   * @throws DecodeException if JTS rejects the assembled geometry
   */
  public static Geometry toGeometry(Paths paths, double scale) throws DecodeException {
    try {
      Geometry geometry = switch (paths.type()) {
        case POINT -> points(paths, scale);
        case LINESTRING -> lines(paths, scale);
        case POLYGON -> polygons(paths, scale);
        case UNKNOWN -> null;
      };
      return geometry == null ? GeoUtils.EMPTY_GEOMETRY : geometry;
    } catch (IllegalArgumentException e) {
      throw new DecodeException(DecodeException.Kind.INVALID_GEOMETRY, "Unable to build geometry: " + e.getMessage(),
        e);
    }
  }

  /**
   * Returns a JTS geometry for {@code paths} decoded at tile scale, resized so {@code extent} spans {@code tileSize}
   * units.
   *
   * @param extent the layer extent, an unsigned 32-bit value
   * @throws DecodeException of kind {@link DecodeException.Kind#INVALID_GEOMETRY} if {@code extent} is 0 or JTS rejects
   *                         the assembled geometry
   */
  public static Geometry toGeometry(Paths paths, double tileSize, int extent) throws DecodeException {
    long unsignedExtent = Integer.toUnsignedLong(extent);
    if (unsignedExtent == 0) {
      throw new DecodeException(DecodeException.Kind.INVALID_GEOMETRY, "can not scale geometry from extent 0");
    }
    return toGeometry(paths, tileSize / unsignedExtent);
  }

  private static CoordinateSequence sequence(PointPath path, double scale, boolean close) {
    int n = path.size();
    boolean addClosing = close && n > 0 && !path.isClosed();
    var result = new PackedCoordinateSequence.Double(addClosing ? n + 1 : n, 2, 0);
    for (int i = 0; i < n; i++) {
      result.setOrdinate(i, 0, path.x(i) * scale);
      result.setOrdinate(i, 1, path.y(i) * scale);
    }
    if (addClosing) {
      result.setOrdinate(n, 0, path.x(0) * scale);
      result.setOrdinate(n, 1, path.y(0) * scale);
    }
    return result;
  }

  private static Geometry points(Paths paths, double scale) {
    int count = paths.pointCount();
    var cs = new PackedCoordinateSequence.Double(count, 2, 0);
    int idx = 0;
    for (PointPath path : paths.paths()) {
      for (int i = 0; i < path.size(); i++) {
        cs.setOrdinate(idx, 0, path.x(i) * scale);
        cs.setOrdinate(idx, 1, path.y(i) * scale);
        idx++;
      }
    }
    if (count == 1) {
      return JTS_FACTORY.createPoint(cs);
    } else if (count > 1) {
      return JTS_FACTORY.createMultiPoint(cs);
    }
    return null;
  }

  private static Geometry lines(Paths paths, double scale) {
    List<LineString> lineStrings = new ArrayList<>(paths.size());
    for (PointPath path : paths.paths()) {
      if (path.size() >= GeometryType.LINESTRING.minPoints()) {
        lineStrings.add(JTS_FACTORY.createLineString(sequence(path, scale, false)));
      }
    }
    if (lineStrings.size() == 1) {
      return lineStrings.get(0);
    } else if (lineStrings.size() > 1) {
      return JTS_FACTORY.createMultiLineString(lineStrings.toArray(LineString[]::new));
    }
    return null;
  }

  private static Geometry polygons(Paths paths, double scale) {
    List<List<LinearRing>> polygonRings = new ArrayList<>();
    List<LinearRing> ringsForCurrentPolygon = null;
    boolean outerCCW = false;
    for (PointPath path : paths.paths()) {
      CoordinateSequence coords = sequence(path, scale, true);
      if (coords.size() < GeometryType.POLYGON.minPoints()) {
        continue;
      }
      boolean ccw = Orientation.isCCW(coords);
      if (ringsForCurrentPolygon == null) {
        outerCCW = ccw;
      }
      if (ringsForCurrentPolygon == null || ccw == outerCCW) {
        ringsForCurrentPolygon = new ArrayList<>();
        polygonRings.add(ringsForCurrentPolygon);
      }
      ringsForCurrentPolygon.add(JTS_FACTORY.createLinearRing(coords));
    }
    List<Polygon> polygons = new ArrayList<>(polygonRings.size());
    for (List<LinearRing> rings : polygonRings) {
      LinearRing shell = rings.get(0);
      LinearRing[] holes = rings.subList(1, rings.size()).toArray(LinearRing[]::new);
      polygons.add(JTS_FACTORY.createPolygon(shell, holes));
    }
    if (polygons.size() == 1) {
      return polygons.get(0);
    } else if (polygons.size() > 1) {
      return JTS_FACTORY.createMultiPolygon(GeometryFactory.toPolygonArray(polygons));
    }
    return null;
  }
}
