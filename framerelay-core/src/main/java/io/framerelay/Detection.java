package io.framerelay;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of running the detector on one frame delivery.
 *
 * <p>The source id and sequence number only correlate back to the frame; the detection
 * does not own it. An empty {@code boxes} list is a valid result meaning nothing was
 * found. A failed detection never produces a record.
 *
 * @param sourceId            source of the originating frame
 * @param frameSequenceNumber sequence number of the originating frame
 * @param attemptCount        delivery attempt that produced this result
 * @param boxes               detected regions in detector order
 * @param processedAt         when detection completed
 */
public record Detection(String sourceId, long frameSequenceNumber, int attemptCount,
    List<BoundingBox> boxes, Instant processedAt) {

  public Detection {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(processedAt, "processedAt");
    if (attemptCount < 1) {
      throw new IllegalArgumentException("attemptCount must be >= 1, got: " + attemptCount);
    }
    boxes = List.copyOf(Objects.requireNonNull(boxes, "boxes"));
  }

  /**
   * Key a {@link io.framerelay.sink.ResultSink} deduplicates on.
   *
   * @return {@code sourceId:frameSequenceNumber:attemptCount}
   */
  public String dedupeKey() {
    return sourceId + ':' + frameSequenceNumber + ':' + attemptCount;
  }

  public boolean isEmpty() {
    return boxes.isEmpty();
  }
}
