package io.framerelay.codec;

import io.framerelay.Frame;

/**
 * Converts {@link Frame}s to and from the byte payload carried by the broker.
 *
 * <p>Implementations are pure and thread-safe. For every valid frame
 * {@code decode(encode(f)).equals(f)} holds.
 *
 * @see BinaryFrameCodec
 */
public interface FrameCodec {

  /**
   * Returns the default binary codec.
   *
   * @return the shared {@link BinaryFrameCodec}
   */
  static FrameCodec getDefault() {
    return BinaryFrameCodec.INSTANCE;
  }

  byte[] encode(Frame frame);

  /**
   * Decodes a broker payload.
   *
   * @param payload bytes received from the channel
   * @return the decoded frame
   * @throws FrameDecodeException if the payload is truncated, malformed or of an unknown
   *     version; the consumer treats this as permanent
   */
  Frame decode(byte[] payload) throws FrameDecodeException;
}
