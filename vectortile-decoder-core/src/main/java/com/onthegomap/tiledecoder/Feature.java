package com.onthegomap.tiledecoder;

import com.carrotsearch.hppc.IntArrayList;
import com.google.protobuf.ByteString;
import com.onthegomap.tiledecoder.config.DecoderConfig;
import com.onthegomap.tiledecoder.geo.CoordinateRange;
import com.onthegomap.tiledecoder.geo.GeometryDecoder;
import com.onthegomap.tiledecoder.geo.GeometryType;
import com.onthegomap.tiledecoder.geo.JtsGeometries;
import com.onthegomap.tiledecoder.geo.Paths;
import com.onthegomap.tiledecoder.proto.PackedUint32;
import com.onthegomap.tiledecoder.proto.ProtoReader;
import com.onthegomap.tiledecoder.proto.VectorTileFields.FeatureMessage;
import com.onthegomap.tiledecoder.value.Value;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.concurrent.Immutable;
import org.locationtech.jts.geom.Geometry;

/**
 * One feature of a {@link Layer}.
 * <p>
 * The tag and geometry streams are kept encoded; properties are resolved against the owning layer's dictionaries and
 * geometries are interpreted each time they are requested.
 */
@Immutable
public final class Feature {

  static final String DUPLICATE_KEYS_WARNING = "duplicate keys with different tag ids";

  private final Layer layer;
  private final Optional<FeatureId> id;
  private final GeometryType type;
  private final PackedUint32 tags;
  private final PackedUint32 geometry;

  private Feature(Layer layer, Optional<FeatureId> id, GeometryType type, PackedUint32 tags, PackedUint32 geometry) {
    this.layer = layer;
    this.id = id;
    this.type = type;
    this.tags = tags;
    this.geometry = geometry;
  }

  /**
   * Decodes the feature message in {@code view}, bound to {@code layer} for dictionary lookups.
   * <p>
   * A feature without tags or geometry is valid. When {@code tags} or {@code geometry} appear more than once, the last
   * occurrence wins.
   */
  static Feature parse(ByteString view, Layer layer) throws DecodeException {
    Optional<FeatureId> id = Optional.empty();
    GeometryType type = GeometryType.UNKNOWN;
    PackedUint32 tags = PackedUint32.EMPTY;
    PackedUint32 geometry = PackedUint32.EMPTY;
    ProtoReader reader = ProtoReader.of(view);
    while (reader.next()) {
      switch (reader.field()) {
        case FeatureMessage.ID -> id = Optional.of(FeatureId.of(reader.readUInt64()));
        case FeatureMessage.TAGS -> tags = reader.readPackedUInt32();
        case FeatureMessage.TYPE -> type = GeometryType.valueOf(reader.readEnum());
        case FeatureMessage.GEOMETRY -> geometry = reader.readPackedUInt32();
        default -> reader.skip();
      }
    }
    return new Feature(layer, id, type, tags, geometry);
  }

  public GeometryType getType() {
    return type;
  }

  public Optional<FeatureId> getId() {
    return id;
  }

  public int getExtent() {
    return layer.getExtent();
  }

  public int getVersion() {
    return layer.getVersion();
  }

  public Layer getLayer() {
    return layer;
  }

  /** Returns the raw tag stream of alternating key and value dictionary indexes. */
  public PackedUint32 getTags() {
    return tags;
  }

  /** Returns the raw geometry command stream. */
  public PackedUint32 getGeometryCommands() {
    return geometry;
  }

  /** Shorthand for {@link #getValue(String, DecodeWarnings)} that logs warnings. */
  public Value getValue(String key) throws DecodeException {
    return getValue(key, DecodeWarnings.LOG);
  }

  /**
   * Returns the value of the first tag in stream order whose key is {@code key}, decoding only that one value.
   * <p>
   * When the layer's key dictionary holds {@code key} at more than one index, every one of those indexes matches and a
   * note is sent to {@code warnings} when a match is found.
   *
   * @return the value, or {@link Value#NULL} if the layer has no such key or this feature has no tag for it
   * @throws DecodeException of kind {@link DecodeException.Kind#MALFORMED_TAG_STREAM} if the tag stream has an odd
   *                         length or {@link DecodeException.Kind#OUT_OF_RANGE_REFERENCE} if a tag refers past the end
   *                         of a dictionary
   */
  public Value getValue(String key, DecodeWarnings warnings) throws DecodeException {
    IntArrayList matching = layer.keyIndexes(key);
    if (matching == null) {
      return Value.NULL;
    }
    int keyCount = layer.keys().size();
    int valueCount = layer.valueCount();
    var cursor = tags.cursor();
    while (cursor.hasNext()) {
      int keyIndex = cursor.next();
      checkIndex(keyIndex, keyCount, "key");
      if (!cursor.hasNext()) {
        throw unevenTags();
      }
      int valueIndex = cursor.next();
      checkIndex(valueIndex, valueCount, "value");
      if (matching.contains(keyIndex)) {
        if (matching.size() > 1) {
          warnings.warn(DUPLICATE_KEYS_WARNING + ": " + key);
        }
        return layer.value(valueIndex);
      }
    }
    return Value.NULL;
  }

  /**
   * Decodes every tag into a map from key to value in tag-stream order.
   * <p>
   * If the same key name occurs more than once, the first occurrence is kept, so each entry agrees with
   * {@link #getValue(String)}.
   *
   * @throws DecodeException if the tag stream has an odd length or refers past the end of a dictionary
   */
  public Map<String, Value> getProperties() throws DecodeException {
    Map<String, Value> properties = new LinkedHashMap<>();
    int keyCount = layer.keys().size();
    int valueCount = layer.valueCount();
    var cursor = tags.cursor();
    while (cursor.hasNext()) {
      int keyIndex = cursor.next();
      if (!cursor.hasNext()) {
        throw unevenTags();
      }
      int valueIndex = cursor.next();
      checkIndex(keyIndex, keyCount, "key");
      checkIndex(valueIndex, valueCount, "value");
      String key = layer.key(keyIndex);
      if (!properties.containsKey(key)) {
        properties.put(key, layer.value(valueIndex));
      }
    }
    return properties;
  }

  /** Decodes geometry paths scaled by {@code scale} into the tile's configured coordinate range. */
  public Paths getGeometries(float scale) throws DecodeException {
    return getGeometries(scale, layer.config().coordinateRange());
  }

  /**
   * Decodes geometry paths with every coordinate multiplied by {@code scale} and rounded.
   *
   * @throws DecodeException if the command stream is malformed or a coordinate does not fit in {@code range}
   */
  public Paths getGeometries(float scale, CoordinateRange range) throws DecodeException {
    DecoderConfig config = layer.config();
    return new GeometryDecoder(type, scale, range, config.maxReservedPoints(), config.strictPointCommands())
      .decode(geometry);
  }

  /**
   * Decodes the geometry into a JTS {@link Geometry} where the layer extent spans {@code tileSize} units.
   *
   * @throws DecodeException if the command stream is malformed, the layer extent is 0, or JTS rejects the result
   */
  public Geometry getGeometry(double tileSize) throws DecodeException {
    DecoderConfig config = layer.config();
    Paths paths = new GeometryDecoder(type, 1f, CoordinateRange.INT32, config.maxReservedPoints(),
      config.strictPointCommands()).decode(geometry);
    return JtsGeometries.toGeometry(paths, tileSize, layer.getExtent());
  }

  private static void checkIndex(int index, int size, String dictionary) throws DecodeException {
    if (Integer.compareUnsigned(index, size) >= 0) {
      throw new DecodeException(DecodeException.Kind.OUT_OF_RANGE_REFERENCE,
        "feature referenced out of range " + dictionary + " " + Integer.toUnsignedString(index) + " of " + size);
    }
  }

  private static DecodeException unevenTags() {
    return new DecodeException(DecodeException.Kind.MALFORMED_TAG_STREAM, "uneven number of feature tag ids");
  }

  @Override
  public String toString() {
    return "Feature{layer='" + layer.getName() + "', id=" + id.map(FeatureId::toString).orElse("none") + ", type=" +
      type + "}";
  }
}
