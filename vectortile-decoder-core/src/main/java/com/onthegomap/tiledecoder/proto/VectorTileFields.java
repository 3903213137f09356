package com.onthegomap.tiledecoder.proto;

/**
 * Field numbers from the Mapbox Vector Tile protobuf schema.
 *
 * @see <a href="https://github.com/mapbox/vector-tile-spec/blob/master/2.1/vector_tile.proto">vector_tile.proto</a>
 */
public final class VectorTileFields {

  private VectorTileFields() {}

  /** Fields of the top-level {@code Tile} message. */
  public static final class TileMessage {
    private TileMessage() {}

    public static final int LAYERS = 3;
  }

  /** Fields of {@code Tile.Layer}. */
  public static final class LayerMessage {
    private LayerMessage() {}

    public static final int NAME = 1;
    public static final int FEATURES = 2;
    public static final int KEYS = 3;
    public static final int VALUES = 4;
    public static final int EXTENT = 5;
    public static final int VERSION = 15;
  }

  /** Fields of {@code Tile.Feature}. */
  public static final class FeatureMessage {
    private FeatureMessage() {}

    public static final int ID = 1;
    public static final int TAGS = 2;
    public static final int TYPE = 3;
    public static final int GEOMETRY = 4;
  }

  /** Fields of the {@code Tile.Value} oneof-like message. */
  public static final class ValueMessage {
    private ValueMessage() {}

    public static final int STRING = 1;
    public static final int FLOAT = 2;
    public static final int DOUBLE = 3;
    public static final int INT = 4;
    public static final int UINT = 5;
    public static final int SINT = 6;
    public static final int BOOL = 7;
  }
}
