package io.framerelay;

import java.util.Optional;

/**
 * Capture collaborator: a real-time video source that the producer pulls frames from.
 *
 * <p>Implementations wrap a camera, a stream URL or a file. They are called from a single
 * capture thread and may block for up to one frame interval. They cannot be paused, which
 * is why the producer never lets publishing stall capture.
 */
public interface FrameSource extends AutoCloseable {

  /**
   * Returns the next captured frame.
   *
   * @return the next frame, or {@link Optional#empty()} at end of stream
   * @throws CaptureException if the device failed; the producer retries with backoff
   */
  Optional<RawFrame> nextFrame() throws CaptureException;

  @Override
  default void close() {
  }
}
