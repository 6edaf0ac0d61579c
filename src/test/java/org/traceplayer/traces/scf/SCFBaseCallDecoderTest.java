package org.traceplayer.traces.scf;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.List;
import java.util.Optional;

import org.junit.Test;

public class SCFBaseCallDecoderTest {

  private final SCFBaseCallDecoder decoder = new SCFBaseCallDecoder();

  @Test
  public void asciiByteWinsOverConfidence() {
    assertEquals('T', decoder.decode(record(0, 0, 200, 0, 't', 0, 0, 0)));
  }

  @Test
  public void confidenceTiesResolveInAcgtOrder() {
    assertEquals('A', decoder.decode(record(90, 90, 90, 90, 0, 0, 0, 0)));
    assertEquals('G', decoder.decode(record(0, 10, 90, 90, 0, 0, 0, 0)));
  }

  @Test
  public void spareBytesAreTheLastResort() {
    assertEquals('G', decoder.decode(record(0, 0, 0, 0, 0, 0, 'g', 'A')));
  }

  @Test
  public void nothingDecodedIsN() {
    assertEquals('N', decoder.decode(record(0, 0, 0, 0, 0, 0, 0, 0)));
    assertFalse(SCFBaseCallDecoder.MAX_CONFIDENCE.decode(record(0, 0, 0, 0, 0, 0, 0, 0)).isPresent());
  }

  @Test
  public void firstMatchWinsEvenWhenInvalid() {
    // 'Q' in byte 8 stops the chain although confidences name a base
    assertEquals('N', decoder.decode(record(0, 250, 0, 0, 'Q', 0, 0, 0)));
  }

  @Test
  public void customStrategyOrderIsRespected() {
    SCFBaseCallDecoder confidenceFirst = new SCFBaseCallDecoder(
        List.of(SCFBaseCallDecoder.MAX_CONFIDENCE, SCFBaseCallDecoder.ASCII_BASE_BYTE));
    assertEquals('C', confidenceFirst.decode(record(0, 250, 0, 0, 'T', 0, 0, 0)));

    SCFBaseCallDecoder fixed = new SCFBaseCallDecoder(List.<SCFBaseCallDecoder.Strategy>of(r -> Optional.of('n')));
    assertEquals('N', fixed.decode(record(0, 0, 0, 0, 'A', 0, 0, 0)));
  }

  @Test
  public void qualityScalesMaxConfidence() {
    assertEquals(60, SCFBaseCallDecoder.quality(record(255, 0, 0, 0, 0, 0, 0, 0)));
    assertEquals(30, SCFBaseCallDecoder.quality(record(0, 0, 0, 128, 0, 0, 0, 0)));
    assertEquals(20, SCFBaseCallDecoder.quality(record(0, 0, 0, 0, 'A', 0, 0, 0)));
  }

  @Test
  public void nativePeakIndexIsUnsignedBigEndian() {
    byte[] bytes = new byte[SCFBaseRecord.SIZE];
    bytes[0] = (byte) 0xFF;
    bytes[3] = 0x01;
    assertEquals(0xFF000001L, new SCFBaseRecord(bytes).nativePeakIndex());
  }

  private static SCFBaseRecord record(int a, int c, int g, int t, int letter, int spare1, int spare2, int spare3) {
    byte[] bytes = new byte[SCFBaseRecord.SIZE];
    bytes[4] = (byte) a;
    bytes[5] = (byte) c;
    bytes[6] = (byte) g;
    bytes[7] = (byte) t;
    bytes[8] = (byte) letter;
    bytes[9] = (byte) spare1;
    bytes[10] = (byte) spare2;
    bytes[11] = (byte) spare3;
    return new SCFBaseRecord(bytes);
  }
}
