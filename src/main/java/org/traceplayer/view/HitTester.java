package org.traceplayer.view;

import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.ViewState;

/**
 * Finds the base whose peak is drawn nearest to an x coordinate.
 * The same lookup serves click selection and hover preview.
 */
public class HitTester {

  public static final double MAX_DISTANCE_PX = 50;

  private final ChromatogramRecord record;
  private final ViewportMapper mapper;

  public HitTester(ChromatogramRecord record, ViewportMapper mapper) {
    this.record = record;
    this.mapper = mapper;
  }

  /**
   * Index of the visible base nearest to {@code pixelX}, or {@link ViewState#NO_BASE}
   * when none is visible or the nearest lies {@link #MAX_DISTANCE_PX} or more away.
   */
  public int nearestBase(double pixelX) {
    if (mapper.isEmpty()) return ViewState.NO_BASE;

    int closest = ViewState.NO_BASE;
    double closestDistance = Double.POSITIVE_INFINITY;
    for (int i = 0; i < record.getSequenceLength(); i++) {
      int peak = record.getPeakLocation(i);
      if (!mapper.contains(peak)) continue;

      double distance = Math.abs(pixelX - mapper.toPixelX(peak));
      if (distance < closestDistance) {
        closestDistance = distance;
        closest = i;
      }
    }
    return closestDistance < MAX_DISTANCE_PX ? closest : ViewState.NO_BASE;
  }

  /** Click: the nearest base becomes the selection, or the selection is cleared. */
  public ViewState select(ViewState state, double pixelX) {
    return state.withSelectedIndex(nearestBase(pixelX));
  }

  /** Pointer move: the nearest base becomes the hover preview. */
  public ViewState hover(ViewState state, double pixelX) {
    return state.withHoveredIndex(nearestBase(pixelX));
  }
}
