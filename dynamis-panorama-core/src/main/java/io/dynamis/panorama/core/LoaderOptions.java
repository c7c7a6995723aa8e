package io.dynamis.panorama.core;

import io.dynamis.panorama.api.TilingConstants;

/**
 * Runtime options of a TiledPanoramaLoader.
 *
 * Defaults come from TilingConstants. Immutable; create with builder().
 */
public final class LoaderOptions {

    private final int fetchConcurrency;
    private final int maxCanvasWidth;

    private LoaderOptions(Builder builder) {
        this.fetchConcurrency = builder.fetchConcurrency;
        this.maxCanvasWidth = builder.maxCanvasWidth;
    }

    /** Maximum number of tile fetches in flight. */
    public int fetchConcurrency() { return fetchConcurrency; }

    /** Largest canvas side the texture sink can allocate, in pixels. */
    public int maxCanvasWidth() { return maxCanvasWidth; }

    /** Options with every value at its default. */
    public static LoaderOptions defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return "LoaderOptions{fetchConcurrency=" + fetchConcurrency +
            ", maxCanvasWidth=" + maxCanvasWidth + "}";
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private int fetchConcurrency = TilingConstants.DEFAULT_FETCH_CONCURRENCY;
        private int maxCanvasWidth = TilingConstants.DEFAULT_MAX_CANVAS_WIDTH;

        private Builder() {}

        public Builder fetchConcurrency(int concurrency) { this.fetchConcurrency = concurrency; return this; }
        public Builder maxCanvasWidth(int width) { this.maxCanvasWidth = width; return this; }

        /**
         * @throws IllegalArgumentException if fetchConcurrency < 1 or maxCanvasWidth < 2
         */
        public LoaderOptions build() {
            if (fetchConcurrency < 1) {
                throw new IllegalArgumentException("fetchConcurrency must be >= 1; got " + fetchConcurrency);
            }
            if (maxCanvasWidth < 2) {
                throw new IllegalArgumentException("maxCanvasWidth must be >= 2; got " + maxCanvasWidth);
            }
            return new LoaderOptions(this);
        }
    }
}
