package com.onthegomap.tiledecoder.geo;

/** A decoded, scaled point in tile coordinates. */
public record TilePoint(int x, int y) {}
