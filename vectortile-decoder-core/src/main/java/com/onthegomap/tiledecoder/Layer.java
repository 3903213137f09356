package com.onthegomap.tiledecoder;

import com.carrotsearch.hppc.IntArrayList;
import com.google.protobuf.ByteString;
import com.onthegomap.tiledecoder.config.DecoderConfig;
import com.onthegomap.tiledecoder.proto.ProtoReader;
import com.onthegomap.tiledecoder.proto.VectorTileFields.LayerMessage;
import com.onthegomap.tiledecoder.value.Value;
import com.onthegomap.tiledecoder.value.ValueDecoder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.concurrent.Immutable;

/**
 * A decoded vector tile layer: its name, version, extent, key and value dictionaries, and undecoded features.
 * <p>
 * Values and features are kept as views into the tile bytes and only decoded when a {@link Feature} asks for them.
 * Scalar fields that appear more than once take the last occurrence.
 */
@Immutable
public final class Layer {

  public static final int DEFAULT_VERSION = 1;
  public static final int DEFAULT_EXTENT = 4096;

  private final String name;
  private final int version;
  private final int extent;
  private final List<String> keys;
  private final Map<String, IntArrayList> keyIndexes;
  private final List<ByteString> values;
  private final List<ByteString> features;
  private final DecoderConfig config;

  private Layer(String name, int version, int extent, List<String> keys, Map<String, IntArrayList> keyIndexes,
    List<ByteString> values, List<ByteString> features, DecoderConfig config) {
    this.name = name;
    this.version = version;
    this.extent = extent;
    this.keys = Collections.unmodifiableList(keys);
    this.keyIndexes = keyIndexes;
    this.values = Collections.unmodifiableList(values);
    this.features = Collections.unmodifiableList(features);
    this.config = config;
  }

  public static Layer parse(ByteString view) throws DecodeException {
    return parse(view, DecoderConfig.defaults());
  }

  /**
   * Decodes the layer message in {@code view}.
   *
   * @throws DecodeException of kind {@link DecodeException.Kind#MISSING_REQUIRED_FIELD} listing every absent field if
   *                         any of {@code version}, {@code extent}, or {@code name} is missing, or
   *                         {@link DecodeException.Kind#PRIMITIVE_READ_ERROR} if the bytes are malformed
   */
  public static Layer parse(ByteString view, DecoderConfig config) throws DecodeException {
    String name = null;
    int version = DEFAULT_VERSION;
    int extent = DEFAULT_EXTENT;
    boolean hasVersion = false;
    boolean hasExtent = false;
    List<String> keys = new ArrayList<>();
    Map<String, IntArrayList> keyIndexes = new HashMap<>();
    List<ByteString> values = new ArrayList<>();
    List<ByteString> features = new ArrayList<>();

    ProtoReader reader = ProtoReader.of(view);
    while (reader.next()) {
      switch (reader.field()) {
        case LayerMessage.NAME -> name = reader.readString();
        case LayerMessage.FEATURES -> features.add(reader.readView());
        case LayerMessage.KEYS -> {
          String key = reader.readString();
          keyIndexes.computeIfAbsent(key, k -> new IntArrayList(1)).add(keys.size());
          keys.add(key);
        }
        case LayerMessage.VALUES -> values.add(reader.readView());
        case LayerMessage.EXTENT -> {
          extent = reader.readUInt32();
          hasExtent = true;
        }
        case LayerMessage.VERSION -> {
          version = reader.readUInt32();
          hasVersion = true;
        }
        default -> reader.skip();
      }
    }

    if (!hasVersion || !hasExtent || name == null) {
      List<String> missing = new ArrayList<>(3);
      if (!hasVersion) {
        missing.add("version");
      }
      if (!hasExtent) {
        missing.add("extent");
      }
      if (name == null) {
        missing.add("name");
      }
      throw DecodeException.missingRequiredFields(missing);
    }
    return new Layer(name, version, extent, keys, keyIndexes, values, features, config);
  }

  public String getName() {
    return name;
  }

  /** Returns the layer version, an unsigned 32-bit value. */
  public int getVersion() {
    return version;
  }

  /** Returns the size of the tile coordinate space, an unsigned 32-bit value. */
  public int getExtent() {
    return extent;
  }

  public int featureCount() {
    return features.size();
  }

  /** Returns the key dictionary in wire order, including any duplicate names. */
  public List<String> keys() {
    return keys;
  }

  public int valueCount() {
    return values.size();
  }

  DecoderConfig config() {
    return config;
  }

  /** Returns every dictionary index holding {@code key}, or {@code null} if none does. */
  IntArrayList keyIndexes(String key) {
    return keyIndexes.get(key);
  }

  String key(int index) {
    return keys.get(index);
  }

  /** Decodes entry {@code index} of the value dictionary. */
  public Value value(int index) throws DecodeException {
    if (index < 0 || index >= values.size()) {
      throw new DecodeException(DecodeException.Kind.OUT_OF_RANGE_REFERENCE,
        "value index " + Integer.toUnsignedString(index) + " out of range for " + values.size() + " values");
    }
    return ValueDecoder.decode(values.get(index));
  }

  /**
   * Decodes the feature at {@code index}.
   *
   * @throws DecodeException of kind {@link DecodeException.Kind#NOT_FOUND} if {@code index} is out of range, or any
   *                         other kind if the feature is malformed
   */
  public Feature getFeature(int index) throws DecodeException {
    if (index < 0 || index >= features.size()) {
      throw new DecodeException(DecodeException.Kind.NOT_FOUND,
        "No feature " + index + " in layer '" + name + "' with " + features.size() + " features");
    }
    return Feature.parse(features.get(index), this);
  }

  @Override
  public String toString() {
    return "Layer{name='" + name + "', version=" + version + ", extent=" + extent + ", features=" + features.size() +
      "}";
  }
}
