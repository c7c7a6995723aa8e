package io.dynamis.panorama.api;

/** Viewer-space position in pixels, origin at the top-left corner of the viewport. */
public record ScreenPoint(double x, double y) {}
