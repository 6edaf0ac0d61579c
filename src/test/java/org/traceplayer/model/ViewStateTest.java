package org.traceplayer.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.EnumSet;
import java.util.Set;

import org.junit.Test;

public class ViewStateTest {

  @Test
  public void initialStateHasDefaults() {
    ViewState state = ViewState.initial();
    assertEquals(2.5, state.zoomLevel(), 0);
    assertEquals(0, state.scrollFraction(), 0);
    assertEquals(ViewState.NO_BASE, state.selectedIndex());
    assertEquals(ViewState.NO_BASE, state.hoveredIndex());
    assertTrue(state.editedIndices().isEmpty());
    assertNull(state.highlightRange());
    assertEquals(20, state.qualityThreshold());
    assertEquals(EnumSet.allOf(Channel.class), state.visibleChannels());
  }

  @Test
  public void zoomIsClamped() {
    ViewState state = ViewState.initial();
    assertEquals(20, state.zoomBy(100).zoomLevel(), 0);
    assertEquals(0.5, state.zoomBy(-100).zoomLevel(), 0);
    assertEquals(3.0, state.zoomBy(0.5).zoomLevel(), 1e-12);
  }

  @Test
  public void scrollIsClamped() {
    ViewState state = ViewState.initial();
    assertEquals(1, state.scrollBy(5).scrollFraction(), 0);
    assertEquals(0, state.scrollBy(-0.1).scrollFraction(), 0);
    assertEquals(0, state.withScrollFraction(Double.NaN).scrollFraction(), 0);
  }

  @Test
  public void transitionsLeaveOriginalUntouched() {
    ViewState state = ViewState.initial();
    ViewState changed = state.withSelectedIndex(4).withHoveredIndex(2).withEdited(4).withQualityThreshold(30);

    assertEquals(4, changed.selectedIndex());
    assertEquals(2, changed.hoveredIndex());
    assertTrue(changed.isEdited(4));
    assertEquals(30, changed.qualityThreshold());
    assertFalse(state.hasSelection());
    assertFalse(state.isEdited(4));
  }

  @Test
  public void negativeIndicesMeanNoBase() {
    ViewState state = ViewState.initial().withSelectedIndex(-7).withHoveredIndex(-2);
    assertEquals(ViewState.NO_BASE, state.selectedIndex());
    assertEquals(ViewState.NO_BASE, state.hoveredIndex());
  }

  @Test
  public void thresholdIsClampedToQualityRange() {
    assertEquals(60, ViewState.initial().withQualityThreshold(99).qualityThreshold());
    assertEquals(0, ViewState.initial().withQualityThreshold(-1).qualityThreshold());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void editedSetIsReadOnly() {
    ViewState.initial().withEdited(1).editedIndices().add(2);
  }

  @Test
  public void channelsToggle() {
    ViewState state = ViewState.initial().withChannelVisible(Channel.G, false);
    assertFalse(state.isChannelVisible(Channel.G));
    assertTrue(state.isChannelVisible(Channel.A));

    ViewState none = state.withChannelVisible(Channel.A, false).withChannelVisible(Channel.T, false)
        .withChannelVisible(Channel.C, false);
    assertTrue(none.visibleChannels().isEmpty());
    Set<Channel> back = none.withChannelVisible(Channel.C, true).visibleChannels();
    assertEquals(EnumSet.of(Channel.C), back);
  }

  @Test
  public void highlightRangeValidation() {
    HighlightRange range = HighlightRange.of(2, 4, 10);
    assertEquals(3, range.length());
    assertTrue(range.contains(1));
    assertTrue(range.contains(3));
    assertFalse(range.contains(4));
    assertTrue(ViewState.initial().withHighlightRange(range).hasHighlight());
  }

  @Test(expected = IllegalArgumentException.class)
  public void highlightBeyondSequenceIsRejected() {
    HighlightRange.of(5, 11, 10);
  }

  @Test(expected = IllegalArgumentException.class)
  public void reversedHighlightIsRejected() {
    HighlightRange.of(5, 4, 10);
  }
}
