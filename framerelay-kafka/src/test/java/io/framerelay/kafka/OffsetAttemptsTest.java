package io.framerelay.kafka;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class OffsetAttemptsTest {

  @Test
  void encodesOffsetsInOrder() {
    Map<Long, Integer> attempts = new TreeMap<>();
    attempts.put(42L, 2);
    attempts.put(7L, 1);

    assertEquals("a1:7=1,42=2", OffsetAttempts.encode(attempts));
    assertEquals("", OffsetAttempts.encode(Map.of()));
  }

  @Test
  void decodesWhatEncodeWrote() {
    assertEquals(Map.of(7L, 1, 42L, 2), OffsetAttempts.decode("a1:7=1,42=2"));
  }

  @Test
  void ignoresForeignOrMalformedMetadata() {
    assertTrue(OffsetAttempts.decode(null).isEmpty());
    assertTrue(OffsetAttempts.decode("").isEmpty());
    assertTrue(OffsetAttempts.decode("a1:").isEmpty());
    assertTrue(OffsetAttempts.decode("committed by another tool").isEmpty());
    assertEquals(Map.of(3L, 2), OffsetAttempts.decode("a1:x=1,=4,5,3=2"));
  }

  @Test
  void staysWithinMetadataLimit() {
    Map<Long, Integer> attempts = new TreeMap<>();
    for (long offset = 1_000_000_000L; offset < 1_000_000_500L; offset++) {
      attempts.put(offset, 1);
    }

    String metadata = OffsetAttempts.encode(attempts);

    assertTrue(metadata.length() <= OffsetAttempts.MAX_LENGTH);
    Map<Long, Integer> decoded = OffsetAttempts.decode(metadata);
    assertFalse(decoded.isEmpty());
    assertTrue(decoded.size() < attempts.size());
    assertEquals(1, decoded.get(1_000_000_000L));
  }
}
