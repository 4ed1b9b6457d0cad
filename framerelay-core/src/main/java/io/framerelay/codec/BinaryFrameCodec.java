package io.framerelay.codec;

import io.framerelay.Frame;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Versioned big-endian binary layout for frames.
 *
 * <pre>
 *   magic        4 bytes  "FRMR"
 *   version      1 byte   1
 *   sourceId     u16 length + UTF-8 bytes
 *   sequence     i64
 *   capturedAt   i64 epoch seconds + i32 nanos
 *   payload      i32 length + bytes
 * </pre>
 *
 * <p>Decoding is strict: trailing bytes, unknown versions and lengths that do not match
 * the buffer are rejected.
 */
public final class BinaryFrameCodec implements FrameCodec {
  static final BinaryFrameCodec INSTANCE = new BinaryFrameCodec();

  static final int MAGIC = 0x46524D52; // "FRMR"
  static final byte VERSION = 1;

  private static final int FIXED_HEADER = 4 + 1 + 2;
  private static final int FIXED_BODY = 8 + 8 + 4 + 4;
  private static final int MAX_SOURCE_ID_BYTES = 0xFFFF;

  public BinaryFrameCodec() {
  }

  @Override
  public byte[] encode(Frame frame) {
    byte[] sourceId = frame.sourceId().getBytes(StandardCharsets.UTF_8);
    if (sourceId.length > MAX_SOURCE_ID_BYTES) {
      throw new IllegalArgumentException("sourceId exceeds " + MAX_SOURCE_ID_BYTES + " UTF-8 bytes");
    }
    byte[] payload = frame.payload();
    ByteBuffer buffer = ByteBuffer.allocate(FIXED_HEADER + sourceId.length + FIXED_BODY + payload.length);
    buffer.putInt(MAGIC);
    buffer.put(VERSION);
    buffer.putShort((short) sourceId.length);
    buffer.put(sourceId);
    buffer.putLong(frame.sequenceNumber());
    buffer.putLong(frame.capturedAt().getEpochSecond());
    buffer.putInt(frame.capturedAt().getNano());
    buffer.putInt(payload.length);
    buffer.put(payload);
    return buffer.array();
  }

  @Override
  public Frame decode(byte[] bytes) throws FrameDecodeException {
    if (bytes == null) {
      throw new FrameDecodeException("null payload");
    }
    if (bytes.length < FIXED_HEADER + FIXED_BODY) {
      throw new FrameDecodeException("truncated payload (" + bytes.length + " bytes)");
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    try {
      if (buffer.getInt() != MAGIC) {
        throw new FrameDecodeException("bad magic");
      }
      byte version = buffer.get();
      if (version != VERSION) {
        throw new FrameDecodeException("unsupported version " + version);
      }
      int sourceIdLength = Short.toUnsignedInt(buffer.getShort());
      if (sourceIdLength == 0) {
        throw new FrameDecodeException("empty sourceId");
      }
      if (sourceIdLength > buffer.remaining() - FIXED_BODY) {
        throw new FrameDecodeException("truncated sourceId");
      }
      byte[] sourceIdBytes = new byte[sourceIdLength];
      buffer.get(sourceIdBytes);
      String sourceId = decodeUtf8(sourceIdBytes);

      long sequence = buffer.getLong();
      if (sequence < 0) {
        throw new FrameDecodeException("negative sequence number " + sequence);
      }
      long seconds = buffer.getLong();
      int nanos = buffer.getInt();
      if (nanos < 0 || nanos > 999_999_999) {
        throw new FrameDecodeException("nanos out of range " + nanos);
      }
      Instant capturedAt = Instant.ofEpochSecond(seconds, nanos);

      int payloadLength = buffer.getInt();
      if (payloadLength < 0) {
        throw new FrameDecodeException("negative payload length " + payloadLength);
      }
      if (payloadLength > buffer.remaining()) {
        throw new FrameDecodeException("truncated payload body");
      }
      if (payloadLength < buffer.remaining()) {
        throw new FrameDecodeException((buffer.remaining() - payloadLength) + " trailing bytes");
      }
      byte[] payload = new byte[payloadLength];
      buffer.get(payload);
      return new Frame(sourceId, sequence, capturedAt, payload);
    } catch (BufferUnderflowException e) {
      throw new FrameDecodeException("truncated payload");
    } catch (DateTimeException e) {
      throw new FrameDecodeException("capturedAt out of range");
    }
  }

  private static String decodeUtf8(byte[] bytes) throws FrameDecodeException {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new FrameDecodeException("sourceId is not valid UTF-8");
    }
  }
}
