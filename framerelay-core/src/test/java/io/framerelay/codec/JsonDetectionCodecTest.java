package io.framerelay.codec;

import io.framerelay.BoundingBox;
import io.framerelay.Detection;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonDetectionCodecTest {

  private final DetectionCodec codec = DetectionCodec.getDefault();

  @Test
  void encodesExpectedDocument() {
    Detection detection = new Detection("cam0", 12, 2,
        List.of(new BoundingBox("person", 0.5, 10, 20, 30, 40)),
        Instant.parse("2024-05-01T10:15:30Z"));

    String json = new String(codec.encode(detection), StandardCharsets.UTF_8);

    assertEquals("{\"sourceId\":\"cam0\",\"frameSequenceNumber\":12,\"attemptCount\":2,"
        + "\"processedAt\":\"2024-05-01T10:15:30Z\",\"boxes\":[{\"label\":\"person\","
        + "\"confidence\":0.5,\"x\":10,\"y\":20,\"width\":30,\"height\":40}]}", json);
  }

  @Test
  void escapesSpecialCharacters() {
    Detection detection = new Detection("cam\"0\\\n", 1, 1, List.of(), Instant.EPOCH);

    String json = new String(codec.encode(detection), StandardCharsets.UTF_8);

    assertTrue(json.contains("\"sourceId\":\"cam\\\"0\\\\\\n\""), json);
    assertEquals("cam\"0\\\n", codec.decode(codec.encode(detection)).sourceId());
  }

  @Test
  void decodesWithWhitespaceAndFieldOrder() {
    String json = "{ \"boxes\" : [ { \"height\": 4, \"width\": 3, \"y\": 2, \"x\": 1,"
        + " \"confidence\": 0.75, \"label\": \"car\" } ],\n"
        + "  \"processedAt\": \"2024-01-01T00:00:00.5Z\", \"attemptCount\": 1,"
        + "  \"frameSequenceNumber\": 99, \"sourceId\": \"lobby\", \"extra\": [true, null] }";

    Detection detection = codec.decode(json.getBytes(StandardCharsets.UTF_8));

    assertEquals("lobby", detection.sourceId());
    assertEquals(99, detection.frameSequenceNumber());
    assertEquals(new BoundingBox("car", 0.75, 1, 2, 3, 4), detection.boxes().get(0));
    assertEquals(Instant.parse("2024-01-01T00:00:00.5Z"), detection.processedAt());
  }

  @Test
  void emptyBoxListIsKept() {
    Detection detection = new Detection("cam0", 3, 1, List.of(), Instant.EPOCH);

    Detection decoded = codec.decode(codec.encode(detection));

    assertTrue(decoded.isEmpty());
    assertEquals(detection, decoded);
  }

  @Test
  void rejectsMalformedDocuments() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode(null));
    assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes("[]")));
    assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes("{\"sourceId\":\"cam0\"")));
    assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes("{\"sourceId\":\"cam0\"}")));
    assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes(
        "{\"sourceId\":\"cam0\",\"frameSequenceNumber\":1,\"attemptCount\":1,"
            + "\"processedAt\":\"yesterday\",\"boxes\":[]}")));
  }

  @Test
  void rejectsFractionalOrOutOfRangeIntegers() {
    IllegalArgumentException fractional = assertThrows(IllegalArgumentException.class,
        () -> codec.decode(bytes(document("1", "{\"label\":\"car\",\"confidence\":0.5,"
            + "\"x\":1.5,\"y\":2,\"width\":3,\"height\":4}"))));
    assertTrue(fractional.getMessage().contains("x"), fractional.getMessage());

    IllegalArgumentException tooWide = assertThrows(IllegalArgumentException.class,
        () -> codec.decode(bytes(document("1", "{\"label\":\"car\",\"confidence\":0.5,"
            + "\"x\":1,\"y\":2,\"width\":4294967296,\"height\":4}"))));
    assertTrue(tooWide.getMessage().contains("width"), tooWide.getMessage());

    assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes(document("2.0", ""))));
    assertThrows(IllegalArgumentException.class, () -> codec.decode(bytes(document("3000000000", ""))));
  }

  private static String document(String attemptCount, String box) {
    return "{\"sourceId\":\"cam0\",\"frameSequenceNumber\":1,\"attemptCount\":" + attemptCount
        + ",\"processedAt\":\"2024-01-01T00:00:00Z\",\"boxes\":[" + box + "]}";
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
