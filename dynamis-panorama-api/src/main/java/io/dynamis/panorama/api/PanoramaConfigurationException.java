package io.dynamis.panorama.api;

/**
 * Thrown when panorama parameters are invalid.
 *
 * Fatal to the panorama load that raised it. Raised before any tile work
 * begins, so no partial state exists when a caller observes it.
 */
public final class PanoramaConfigurationException extends IllegalArgumentException {

    public PanoramaConfigurationException(String message) {
        super(message);
    }
}
