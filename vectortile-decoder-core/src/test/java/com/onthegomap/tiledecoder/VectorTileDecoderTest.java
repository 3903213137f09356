package com.onthegomap.tiledecoder;

import static com.onthegomap.tiledecoder.TestTiles.commands;
import static com.onthegomap.tiledecoder.TestTiles.feature;
import static com.onthegomap.tiledecoder.TestTiles.layer;
import static com.onthegomap.tiledecoder.TestTiles.msg;
import static com.onthegomap.tiledecoder.TestTiles.stringValue;
import static com.onthegomap.tiledecoder.TestTiles.tile;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tiledecoder.geo.GeometryType;
import com.onthegomap.tiledecoder.geo.Paths;
import com.onthegomap.tiledecoder.geo.PointPath;
import com.onthegomap.tiledecoder.util.Gzip;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Polygon;

class VectorTileDecoderTest {

  private static byte[] sampleTile() {
    return tile(
      layer("poi")
        .string(3, "name")
        .string(3, "rank")
        .string(3, "empty")
        .message(4, stringValue("cafe"))
        .message(4, msg().sint64(6, -3))
        .message(4, msg())
        .message(2, feature(7, GeometryType.POINT, new int[]{0, 0, 1, 1, 2, 2}, new int[]{9, 20, 20})),
      layer("landuse")
        .message(2, feature(GeometryType.POLYGON, new int[0],
          commands().moveTo(0, 0).lineTo(4096, 0, 4096, 4096, 0, 4096).closePath().toArray()))
    );
  }

  @Test
  void testDecodeAllFeatures() throws DecodeException {
    List<DecodedFeature> features = VectorTileDecoder.decode(sampleTile());
    assertEquals(2, features.size());

    DecodedFeature poi = features.get(0);
    assertEquals("poi", poi.layer());
    assertEquals(4096, poi.extent());
    assertEquals(Optional.of(FeatureId.of(7)), poi.id());
    assertEquals(GeometryType.POINT, poi.type());
    assertEquals(Map.of("name", "cafe", "rank", -3L), poi.attrs());
    assertEquals(Paths.of(GeometryType.POINT, PointPath.of(10, 10)), poi.paths());

    DecodedFeature landuse = features.get(1);
    assertEquals("landuse", landuse.layer());
    assertEquals(Optional.empty(), landuse.id());
    assertEquals(Map.of(), landuse.attrs());
    assertEquals(4096, landuse.paths().get(0).x(1));
  }

  @Test
  void testGeometry() throws DecodeException {
    DecodedFeature landuse = VectorTileDecoder.decode(sampleTile()).get(1);
    var geometry = landuse.geometry(256);
    assertInstanceOf(Polygon.class, geometry);
    assertEquals(256 * 256, geometry.getArea(), 1e-6);
  }

  @Test
  void testGeometryFromZeroExtent() throws DecodeException {
    byte[] bytes = tile(msg().uint32(15, 2).uint32(5, 0).string(1, "flat")
      .message(2, feature(GeometryType.POINT, new int[0], new int[]{9, 0, 0})));
    DecodedFeature feature = VectorTileDecoder.decode(bytes).get(0);
    assertEquals(0, feature.extent());
    var e = assertThrows(DecodeException.class, () -> feature.geometry(256));
    assertEquals(DecodeException.Kind.INVALID_GEOMETRY, e.kind());

    DecodedFeature direct = new DecodedFeature("l", 0, Optional.empty(), GeometryType.POINT, Map.of(),
      Paths.of(GeometryType.POINT, PointPath.of(0, 0)));
    assertEquals(DecodeException.Kind.INVALID_GEOMETRY,
      assertThrows(DecodeException.class, () -> direct.geometry(256)).kind());
  }

  @Test
  void testGzipped() throws DecodeException {
    assertEquals(VectorTileDecoder.decode(sampleTile()), VectorTileDecoder.decode(Gzip.gzip(sampleTile())));
  }

  @Test
  void testAttrsAreReadOnly() throws DecodeException {
    var attrs = VectorTileDecoder.decode(sampleTile()).get(0).attrs();
    assertThrows(UnsupportedOperationException.class, () -> attrs.put("x", 1));
  }

  @Test
  void testEmptyTile() throws DecodeException {
    assertEquals(List.of(), VectorTileDecoder.decode(new byte[0]));
  }

  @Test
  void testMalformedFeatureFailsDecode() {
    byte[] bytes = tile(layer("a").message(2, feature(GeometryType.POINT, new int[]{0}, new int[]{9, 0, 0})));
    var e = assertThrows(DecodeException.class, () -> VectorTileDecoder.decode(bytes));
    assertEquals(DecodeException.Kind.MALFORMED_TAG_STREAM, e.kind());
  }
}
