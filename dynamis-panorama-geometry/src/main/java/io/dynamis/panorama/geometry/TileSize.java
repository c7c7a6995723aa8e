package io.dynamis.panorama.geometry;

/** Size of one tile in pixels. */
public record TileSize(double colSize, double rowSize) {}
