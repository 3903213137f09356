package com.onthegomap.tiledecoder;

import com.google.protobuf.ByteString;
import com.google.protobuf.UnsafeByteOperations;
import com.onthegomap.tiledecoder.config.DecoderConfig;
import com.onthegomap.tiledecoder.proto.ProtoReader;
import com.onthegomap.tiledecoder.proto.VectorTileFields.LayerMessage;
import com.onthegomap.tiledecoder.proto.VectorTileFields.TileMessage;
import com.onthegomap.tiledecoder.util.Gzip;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.concurrent.Immutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One encoded Mapbox Vector Tile split into named, still-undecoded layers.
 * <p>
 * Parsing only scans the top-level message and reads each layer's name; the rest of every layer stays as a view into
 * the original bytes until {@link #getLayer(String)} is called. The byte array passed to {@link #parse(byte[])} is
 * wrapped, not copied, so callers must not modify it while this tile or anything decoded from it is in use.
 * <p>
 * When more than one layer has the same name, the last one wins but the name keeps the position where it was first
 * seen.
 *
 * @see <a href="https://github.com/mapbox/vector-tile-spec/tree/master/2.1">Mapbox Vector Tile Specification</a>
 */
@Immutable
public final class Tile {

  private static final Logger LOGGER = LoggerFactory.getLogger(Tile.class);

  private final Map<String, ByteString> layers;
  private final DecoderConfig config;

  private Tile(Map<String, ByteString> layers, DecoderConfig config) {
    this.layers = Collections.unmodifiableMap(layers);
    this.config = config;
  }

  /** Shorthand for {@link #parse(byte[], DecoderConfig)} with {@link DecoderConfig#defaults()}. */
  public static Tile parse(byte[] bytes) throws DecodeException {
    return parse(bytes, DecoderConfig.defaults());
  }

  /**
   * Splits an uncompressed vector tile into layers.
   *
   * @param bytes  the encoded tile, wrapped without copying
   * @param config settings used for every layer and feature decoded from this tile
   * @return the tile
   * @throws DecodeException if the top-level message is malformed or a layer has no name
   */
  public static Tile parse(byte[] bytes, DecoderConfig config) throws DecodeException {
    return parse(UnsafeByteOperations.unsafeWrap(bytes), config);
  }

  /** Splits an uncompressed vector tile held in {@code data} into layers. */
  public static Tile parse(ByteString data, DecoderConfig config) throws DecodeException {
    Map<String, ByteString> layers = new LinkedHashMap<>();
    ProtoReader reader = ProtoReader.of(data);
    while (reader.next()) {
      if (reader.field() == TileMessage.LAYERS) {
        ByteString layerView = reader.readView();
        layers.put(readLayerName(layerView), layerView);
      } else {
        reader.skip();
      }
    }
    LOGGER.trace("Parsed tile with {} layers from {} bytes", layers.size(), data.size());
    return new Tile(layers, config);
  }

  /**
   * Like {@link #parse(byte[], DecoderConfig)} but first inflates {@code bytes} if they start with a gzip header.
   *
   * @throws DecodeException if the gzip stream is corrupt, inflates past {@link DecoderConfig#maxInflatedBytes()}, or
   *                         the inflated tile is malformed
   */
  public static Tile parseMaybeGzipped(byte[] bytes, DecoderConfig config) throws DecodeException {
    if (Gzip.isZipped(bytes)) {
      try {
        bytes = Gzip.gunzip(bytes, config.maxInflatedBytes());
      } catch (IOException e) {
        throw new DecodeException(DecodeException.Kind.PRIMITIVE_READ_ERROR, "Unable to gunzip tile", e);
      }
    }
    return parse(bytes, config);
  }

  public static Tile parseMaybeGzipped(byte[] bytes) throws DecodeException {
    return parseMaybeGzipped(bytes, DecoderConfig.defaults());
  }

  /** Reads only the name field of a layer, the last occurrence winning. */
  private static String readLayerName(ByteString layerView) throws DecodeException {
    String name = null;
    ProtoReader reader = ProtoReader.of(layerView);
    while (reader.next()) {
      if (reader.field() == LayerMessage.NAME) {
        name = reader.readString();
      } else {
        reader.skip();
      }
    }
    if (name == null) {
      throw DecodeException.missingRequiredFields(List.of("name"));
    }
    return name;
  }

  /** Returns layer names in the order they first appear in the tile. */
  public List<String> layerNames() {
    return List.copyOf(layers.keySet());
  }

  public int layerCount() {
    return layers.size();
  }

  public boolean hasLayer(String name) {
    return layers.containsKey(name);
  }

  /** Returns a read-only map from layer name to the undecoded bytes of that layer. */
  public Map<String, ByteString> getLayers() {
    return layers;
  }

  public DecoderConfig config() {
    return config;
  }

  /**
   * Decodes the layer called {@code name}.
   * <p>
   * Each call parses the layer again, so callers that read a layer repeatedly should keep the result.
   *
   * @throws DecodeException of kind {@link DecodeException.Kind#NOT_FOUND} if there is no such layer, or any other kind
   *                         if the layer is malformed
   */
  public Layer getLayer(String name) throws DecodeException {
    ByteString view = layers.get(name);
    if (view == null) {
      throw new DecodeException(DecodeException.Kind.NOT_FOUND, "No layer named '" + name + "'");
    }
    return Layer.parse(view, config);
  }

  /** Returns the layer called {@code name}, or empty if there is no such layer. */
  public Optional<Layer> findLayer(String name) throws DecodeException {
    return hasLayer(name) ? Optional.of(getLayer(name)) : Optional.empty();
  }

  @Override
  public String toString() {
    return "Tile{layers=" + layers.keySet() + "}";
  }
}
