package io.framerelay.codec;

import io.framerelay.Detection;

/**
 * Converts {@link Detection}s to and from the payload published on the detections channel.
 *
 * <p>The default implementation ({@link JsonDetectionCodec}) writes a small JSON document
 * without external dependencies. Users who already have Jackson or Gson on the classpath
 * can implement this interface to delegate to their preferred library.
 */
public interface DetectionCodec {

  static DetectionCodec getDefault() {
    return JsonDetectionCodec.INSTANCE;
  }

  byte[] encode(Detection detection);

  /**
   * Parses a detection payload.
   *
   * @param payload bytes read from the detections channel
   * @return the detection
   * @throws IllegalArgumentException if the payload is not a valid detection document
   */
  Detection decode(byte[] payload);
}
