package org.traceplayer.view;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.RecordFixtures;
import org.traceplayer.model.ViewState;

public class HitTesterTest {

  @Test
  public void nearbyPixelHitsTheBase() {
    // zoom 1 over 1200 samples maps sample index straight to pixel
    ChromatogramRecord record = RecordFixtures.singleBase(1200, 100);
    ViewportMapper mapper = new ViewportMapper(1, 0, 1200, 1200);
    assertEquals(100, mapper.toPixelX(100), 0);

    HitTester hitTester = new HitTester(record, mapper);
    assertEquals(0, hitTester.nearestBase(105));
    assertEquals(0, hitTester.nearestBase(51));
    assertEquals(ViewState.NO_BASE, hitTester.nearestBase(150));
    assertEquals(ViewState.NO_BASE, hitTester.nearestBase(500));
  }

  @Test
  public void closestOfSeveralBasesWins() {
    ChromatogramRecord record = RecordFixtures.evenlySpaced("ACGTACGTAC", 120);
    HitTester hitTester = new HitTester(record, new ViewportMapper(1, 0, 1200, 1200));
    assertEquals(1, hitTester.nearestBase(185));
    assertEquals(9, hitTester.nearestBase(1150));
    assertEquals(ViewState.NO_BASE, hitTester.nearestBase(1199));
    assertEquals(ViewState.NO_BASE, hitTester.nearestBase(120));
  }

  @Test
  public void tieKeepsLowerIndex() {
    ChromatogramRecord record = RecordFixtures.evenlySpaced("ACGTACGTACGTACG", 80);
    HitTester hitTester = new HitTester(record, new ViewportMapper(1, 0, 1200, 1200));
    assertEquals(0, hitTester.nearestBase(80));
  }

  @Test
  public void basesOutsideWindowAreIgnored() {
    ChromatogramRecord record = RecordFixtures.evenlySpaced("ACGTACGTAC", 120);
    // 480 visible samples at the end: [720, 1200]
    ViewportMapper mapper = new ViewportMapper(2.5, 1, 1200, 1200);
    HitTester hitTester = new HitTester(record, mapper);
    assertEquals(6, hitTester.nearestBase(mapper.toPixelX(780)));
    // base 5 maps to -150 px but its peak lies outside the window
    assertEquals(ViewState.NO_BASE, hitTester.nearestBase(-150));
  }

  @Test
  public void emptyViewportHitsNothing() {
    ChromatogramRecord record = RecordFixtures.singleBase(0, 0);
    HitTester hitTester = new HitTester(record, new ViewportMapper(1, 0, 0, 1200));
    assertEquals(ViewState.NO_BASE, hitTester.nearestBase(0));
  }

  @Test
  public void selectAndHoverWriteIntoState() {
    ChromatogramRecord record = RecordFixtures.singleBase(1200, 100);
    HitTester hitTester = new HitTester(record, new ViewportMapper(1, 0, 1200, 1200));

    ViewState selected = hitTester.select(ViewState.initial(), 100);
    assertEquals(0, selected.selectedIndex());
    assertEquals(ViewState.NO_BASE, hitTester.select(selected, 900).selectedIndex());
    assertEquals(0, hitTester.hover(ViewState.initial(), 90).hoveredIndex());
  }
}
