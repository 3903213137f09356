package com.onthegomap.tiledecoder;

import com.onthegomap.tiledecoder.geo.GeometryType;
import com.onthegomap.tiledecoder.geo.JtsGeometries;
import com.onthegomap.tiledecoder.geo.Paths;
import java.util.Map;
import java.util.Optional;
import org.locationtech.jts.geom.Geometry;

/**
 * A fully materialized feature produced by {@link VectorTileDecoder#decode(byte[])}.
 *
 * @param layer  name of the layer the feature came from
 * @param extent extent of that layer
 * @param id     the feature id, if present
 * @param type   declared geometry type
 * @param attrs  properties as plain java objects, without null values
 * @param paths  geometry in unscaled tile coordinates
 */
public record DecodedFeature(
  String layer,
  int extent,
  Optional<FeatureId> id,
  GeometryType type,
  Map<String, Object> attrs,
  Paths paths
) {

  /**
   * Returns the geometry as JTS where the layer extent spans {@code tileSize} units.
   *
   * @throws DecodeException if the extent is 0 or JTS rejects the geometry
   */
  public Geometry geometry(double tileSize) throws DecodeException {
    return JtsGeometries.toGeometry(paths, tileSize, extent);
  }
}
