package com.onthegomap.tiledecoder;

import com.onthegomap.tiledecoder.config.DecoderConfig;
import com.onthegomap.tiledecoder.geo.CoordinateRange;
import com.onthegomap.tiledecoder.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Eagerly decodes every feature of every layer in a tile, for callers that want the whole tile at once rather than
 * lazy access through {@link Tile}.
 */
public final class VectorTileDecoder {

  private VectorTileDecoder() {}

  /** Shorthand for {@link #decode(byte[], DecoderConfig)} with {@link DecoderConfig#defaults()}. */
  public static List<DecodedFeature> decode(byte[] encoded) throws DecodeException {
    return decode(encoded, DecoderConfig.defaults());
  }

  /**
   * Parses a binary-encoded vector tile into a list of features, in layer order and then feature order.
   * <p>
   * Gzip-compressed input is inflated first. Geometries are decoded without scaling. Attributes with a null value are
   * left out, and when a key repeats within one feature the first value wins.
   *
   * @param encoded encoded vector tile protobuf
   * @param config  decoder settings
   * @return every feature in the tile
   * @throws DecodeException if any layer or feature is malformed
   */
  public static List<DecodedFeature> decode(byte[] encoded, DecoderConfig config) throws DecodeException {
    Tile tile = Tile.parseMaybeGzipped(encoded, config);
    List<DecodedFeature> result = new ArrayList<>();
    for (String layerName : tile.layerNames()) {
      Layer layer = tile.getLayer(layerName);
      for (int i = 0; i < layer.featureCount(); i++) {
        Feature feature = layer.getFeature(i);
        Map<String, Value> properties = feature.getProperties();
        Map<String, Object> attrs = new LinkedHashMap<>();
        for (var entry : properties.entrySet()) {
          Object value = entry.getValue().asObject();
          if (value != null) {
            attrs.put(entry.getKey(), value);
          }
        }
        result.add(new DecodedFeature(
          layer.getName(),
          layer.getExtent(),
          feature.getId(),
          feature.getType(),
          Collections.unmodifiableMap(attrs),
          feature.getGeometries(1f, CoordinateRange.INT32)
        ));
      }
    }
    return result;
  }
}
