package io.framerelay.codec;

import io.framerelay.Frame;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class BinaryFrameCodecTest {

  private final FrameCodec codec = FrameCodec.getDefault();

  private static Frame frame(long seq, byte[] payload) {
    return new Frame("cam0", seq, Instant.parse("2024-05-01T10:15:30.123456789Z"), payload);
  }

  @Test
  void decodesWhatItEncodes() throws Exception {
    Frame original = frame(42, new byte[] {1, 2, 3, (byte) 0xFF});

    Frame decoded = codec.decode(codec.encode(original));

    assertEquals(original, decoded);
    assertEquals(42, decoded.sequenceNumber());
    assertEquals(123456789, decoded.capturedAt().getNano());
  }

  @Test
  void layoutStartsWithMagicAndVersion() {
    byte[] bytes = codec.encode(frame(7, new byte[0]));
    ByteBuffer buffer = ByteBuffer.wrap(bytes);

    assertEquals(BinaryFrameCodec.MAGIC, buffer.getInt());
    assertEquals(BinaryFrameCodec.VERSION, buffer.get());
    assertEquals(4, buffer.getShort());
    // magic + version + length + "cam0" + seq + seconds + nanos + payload length
    assertEquals(4 + 1 + 2 + 4 + 8 + 8 + 4 + 4, bytes.length);
  }

  @Test
  void emptyPayloadIsAllowed() throws Exception {
    Frame decoded = codec.decode(codec.encode(frame(1, new byte[0])));

    assertEquals(0, decoded.payloadSize());
  }

  @Test
  void multiByteSourceIdSurvives() throws Exception {
    Frame original = new Frame("caméra-北", 3, Instant.EPOCH, new byte[] {9});

    assertEquals("caméra-北", codec.decode(codec.encode(original)).sourceId());
  }

  @Test
  void rejectsNull() {
    assertThrows(FrameDecodeException.class, () -> codec.decode(null));
  }

  @Test
  void rejectsTruncatedPayload() {
    byte[] bytes = codec.encode(frame(1, new byte[] {1, 2, 3, 4}));

    FrameDecodeException e = assertThrows(FrameDecodeException.class,
        () -> codec.decode(Arrays.copyOf(bytes, bytes.length - 2)));
    assertEquals("truncated payload body", e.reason());
    assertThrows(FrameDecodeException.class, () -> codec.decode(new byte[5]));
  }

  @Test
  void rejectsTrailingBytes() {
    byte[] bytes = codec.encode(frame(1, new byte[] {1}));

    FrameDecodeException e = assertThrows(FrameDecodeException.class,
        () -> codec.decode(Arrays.copyOf(bytes, bytes.length + 3)));
    assertEquals("3 trailing bytes", e.reason());
  }

  @Test
  void rejectsBadMagic() {
    byte[] bytes = codec.encode(frame(1, new byte[] {1}));
    bytes[0] = 'X';

    FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> codec.decode(bytes));
    assertEquals("bad magic", e.reason());
  }

  @Test
  void rejectsUnknownVersion() {
    byte[] bytes = codec.encode(frame(1, new byte[] {1}));
    bytes[4] = 2;

    FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> codec.decode(bytes));
    assertEquals("unsupported version 2", e.reason());
  }

  @Test
  void rejectsNegativeSequence() {
    byte[] bytes = codec.encode(frame(1, new byte[] {1}));
    ByteBuffer.wrap(bytes).putLong(4 + 1 + 2 + 4, -5L);

    FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> codec.decode(bytes));
    assertEquals("negative sequence number -5", e.reason());
  }

  @Test
  void rejectsInvalidUtf8SourceId() {
    byte[] bytes = codec.encode(frame(1, new byte[] {1}));
    bytes[7] = (byte) 0xC3;
    bytes[8] = (byte) 0x28;

    FrameDecodeException e = assertThrows(FrameDecodeException.class, () -> codec.decode(bytes));
    assertEquals("sourceId is not valid UTF-8", e.reason());
  }

  @Test
  void rejectsGarbage() {
    byte[] garbage = "definitely not a frame, just some text".getBytes(StandardCharsets.US_ASCII);

    assertThrows(FrameDecodeException.class, () -> codec.decode(garbage));
  }
}
