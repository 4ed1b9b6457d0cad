package io.framerelay;

import java.util.List;

/**
 * Detection collaborator: runs an inference model on one frame.
 *
 * <p>Invoked concurrently from several consumer worker slots; implementations must be
 * thread-safe or confine their own state.
 */
@FunctionalInterface
public interface Detector {

  /**
   * Detects objects in a frame.
   *
   * @param frame the decoded frame
   * @return detected regions, possibly empty
   * @throws DetectionException if inference failed; {@link DetectionException#isTransient()}
   *     decides between requeue and dead-letter
   */
  List<BoundingBox> detect(Frame frame) throws DetectionException;
}
