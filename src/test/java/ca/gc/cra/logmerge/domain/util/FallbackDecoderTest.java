package ca.gc.cra.logmerge.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class FallbackDecoderTest {
  private static final Charset GBK = Charset.forName("GBK");

  private final FallbackDecoder decoder = FallbackDecoder.utf8Then(GBK);

  @Test
  void validUtf8WinsFirst() {
    byte[] data = "Zoë 北京".getBytes(StandardCharsets.UTF_8);

    assertEquals("Zoë 北京", decoder.decode(data, 0, data.length));
  }

  @Test
  void gbkBytesFallBackToSecondary() {
    byte[] data = "北京".getBytes(GBK);

    assertEquals("北京", decoder.decode(data, 0, data.length));
  }

  @Test
  void undecodableBytesAreReplacedLossily() {
    byte[] data = {'A', (byte) 0xFF, 'B'};
    FallbackDecoder strictAscii = new FallbackDecoder(StandardCharsets.UTF_8, StandardCharsets.US_ASCII);

    assertEquals("A\uFFFDB", strictAscii.decode(data, 0, data.length));
  }

  @Test
  void decodesOnlyRequestedSlice() {
    byte[] data = "xxW1AWyy".getBytes(StandardCharsets.US_ASCII);

    assertEquals("W1AW", decoder.decode(data, 2, 4));
    assertEquals("", decoder.decode(data, 2, 0));
    assertEquals("", decoder.decode(null, 0, 4));
  }

  @Test
  void duplicateCharsetsAreTriedOnce() {
    FallbackDecoder twice = new FallbackDecoder(StandardCharsets.UTF_8, StandardCharsets.UTF_8, GBK);

    assertEquals(List.of(StandardCharsets.UTF_8, GBK), twice.attempts());
  }
}
