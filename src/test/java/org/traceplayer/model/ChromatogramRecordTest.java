package org.traceplayer.model;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import java.util.EnumMap;
import java.util.Map;

import org.junit.Test;

public class ChromatogramRecordTest {

  @Test
  public void sequenceIsJoinedBaseCalls() {
    ChromatogramRecord record = RecordFixtures.evenlySpaced("ACGTN", 10);
    assertEquals("ACGTN", record.getSequence());
    assertEquals(5, record.getSequenceLength());
    assertEquals(50, record.getMaxTraceLength());
  }

  @Test
  public void withBaseCallReplacesOnlyTheCall() {
    ChromatogramRecord record = RecordFixtures.evenlySpaced("ACGTN", 10);
    ChromatogramRecord edited = record.withBaseCall(4, 'g');

    assertEquals("ACGTG", edited.getSequence());
    assertEquals(new String(edited.getBaseCalls()), edited.getSequence());
    assertArrayEquals(record.getQuality(), edited.getQuality());
    assertArrayEquals(record.getPeakLocations(), edited.getPeakLocations());
    assertEquals("ACGTN", record.getSequence());
    assertNotEquals(record, edited);
  }

  @Test(expected = IllegalArgumentException.class)
  public void withBaseCallRejectsInvalidSymbol() {
    RecordFixtures.evenlySpaced("ACGT", 10).withBaseCall(0, 'X');
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void withBaseCallRejectsIndexOutOfRange() {
    RecordFixtures.evenlySpaced("ACGT", 10).withBaseCall(4, 'A');
  }

  @Test(expected = IllegalArgumentException.class)
  public void perBaseArraysMustAgreeInLength() {
    new ChromatogramRecord("x", FileFormat.AB1, traces(10), new char[] { 'A', 'C' }, new int[] { 1 }, new int[] { 0, 1 });
  }

  @Test(expected = IllegalArgumentException.class)
  public void baseCallsMustBeUppercaseNucleotides() {
    new ChromatogramRecord("x", FileFormat.AB1, traces(10), new char[] { 'a' }, new int[] { 1 }, new int[] { 0 });
  }

  @Test(expected = IllegalArgumentException.class)
  public void peaksMustLieWithinTraces() {
    new ChromatogramRecord("x", FileFormat.AB1, traces(10), new char[] { 'A' }, new int[] { 1 }, new int[] { 11 });
  }

  @Test
  public void peakAtTraceEndIsAllowed() {
    ChromatogramRecord record = new ChromatogramRecord("x", FileFormat.AB1, traces(10), new char[] { 'A' },
        new int[] { 1 }, new int[] { 10 });
    assertEquals(10, record.getPeakLocation(0));
  }

  @Test
  public void missingChannelsBecomeEmpty() {
    ChromatogramRecord record = new ChromatogramRecord("x", FileFormat.SCF, traces(10), new char[0], new int[0], new int[0]);
    assertEquals(0, record.getTrace(Channel.C).length);
    assertEquals(10, record.getTrace(Channel.A).length);
  }

  @Test
  public void inputArraysAreCopied() {
    char[] calls = { 'A' };
    Map<Channel, double[]> traces = traces(10);
    ChromatogramRecord record = new ChromatogramRecord("x", FileFormat.AB1, traces, calls, new int[] { 1 }, new int[] { 0 });
    calls[0] = 'C';
    traces.get(Channel.A)[0] = 99;
    assertEquals('A', record.getBaseCall(0));
    assertEquals(0, record.getTrace(Channel.A)[0], 0);
  }

  @Test
  public void summaryStatistics() {
    ChromatogramRecord record = new ChromatogramRecord("x", FileFormat.AB1, traces(10), "AANC".toCharArray(),
        new int[] { 10, 20, 30, 40 }, new int[] { 0, 1, 2, 3 });

    assertEquals(25, record.getAverageQuality(), 1e-9);
    assertEquals(3, record.countHighQuality(20));
    Map<Character, Integer> composition = record.getBaseComposition();
    assertEquals(Integer.valueOf(2), composition.get('A'));
    assertEquals(Integer.valueOf(0), composition.get('T'));
    assertEquals(Integer.valueOf(1), composition.get('N'));
    assertEquals("[A, T, G, C, N]", composition.keySet().toString());
  }

  private static Map<Channel, double[]> traces(int length) {
    Map<Channel, double[]> traces = new EnumMap<>(Channel.class);
    traces.put(Channel.A, new double[length]);
    return traces;
  }
}
