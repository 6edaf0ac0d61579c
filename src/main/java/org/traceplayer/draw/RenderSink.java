package org.traceplayer.draw;

/**
 * Consumer of chromatogram geometry: a canvas, an image writer, a test double.
 */
public interface RenderSink {

  void render(ChromatogramGeometry geometry);
}
