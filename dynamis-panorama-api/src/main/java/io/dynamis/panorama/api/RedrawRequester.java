package io.dynamis.panorama.api;

/** Asks the viewer to render a new frame. Called after every tile that reaches the sink. */
@FunctionalInterface
public interface RedrawRequester {

    void requestRedraw();
}
