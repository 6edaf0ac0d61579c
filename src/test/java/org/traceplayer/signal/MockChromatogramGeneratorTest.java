package org.traceplayer.signal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Random;

import org.junit.Test;
import org.traceplayer.model.Channel;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.FileFormat;

public class MockChromatogramGeneratorTest {

  @Test
  public void generatesEightHundredBasesOfMockData() {
    ChromatogramRecord record = new MockChromatogramGenerator(new Random(11)).generate("clone7.ab1");

    assertEquals(800, record.getSequenceLength());
    assertEquals(FileFormat.MOCK, record.getFileFormat());
    assertEquals("clone7.ab1", record.getFileName());
    for (Channel channel : Channel.values()) {
      assertEquals(3200, record.getTraces().get(channel).length);
    }
  }

  @Test
  public void peaksSitAtWindowCentres() {
    ChromatogramRecord record = new MockChromatogramGenerator(new Random(11)).generate(null);
    for (int b = 0; b < record.getSequenceLength(); b++) {
      assertEquals(4 * b + 2, record.getPeakLocation(b));
    }
    assertEquals("unknown.ab1", record.getFileName());
  }

  @Test
  public void callsAndQualityStayInRange() {
    ChromatogramRecord record = new MockChromatogramGenerator(new Random(5)).generate("x.ab1");
    for (int b = 0; b < record.getSequenceLength(); b++) {
      assertTrue("ATGC".indexOf(record.getBaseCall(b)) >= 0);
      int q = record.getQuality(b);
      assertTrue("quality " + q, q >= 10 && q <= 60);
    }
  }

  @Test
  public void calledChannelDominatesAtPeak() {
    ChromatogramRecord record = new MockChromatogramGenerator(new Random(9)).generate("x.ab1");
    int dominant = 0;
    for (int b = 10; b < 790; b++) {
      Channel called = Channel.fromSymbol(record.getBaseCall(b));
      int peak = record.getPeakLocation(b);
      double calledValue = record.getTraces().get(called)[peak];
      boolean highest = true;
      for (Channel other : Channel.values()) {
        if (other != called && record.getTraces().get(other)[peak] >= calledValue) highest = false;
      }
      if (highest) dominant++;
    }
    // Neighbouring peaks of the same base can blur, but most peaks must stand out
    assertTrue("dominant peaks: " + dominant, dominant > 700);
  }

  @Test
  public void sameSeedGivesSameRecord() {
    ChromatogramRecord first = new MockChromatogramGenerator(new Random(21)).generate("x.ab1");
    ChromatogramRecord second = new MockChromatogramGenerator(new Random(21)).generate("x.ab1");
    assertEquals(first, second);
  }
}
