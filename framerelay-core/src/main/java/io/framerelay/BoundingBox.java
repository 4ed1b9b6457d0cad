package io.framerelay;

import java.util.Objects;

/**
 * One detected region within a frame, in pixel coordinates.
 *
 * @param label      class label reported by the detector
 * @param confidence detector confidence in {@code [0, 1]}
 * @param x          left edge
 * @param y          top edge
 * @param width      region width, non-negative
 * @param height     region height, non-negative
 */
public record BoundingBox(String label, double confidence, int x, int y, int width, int height) {

  public BoundingBox {
    Objects.requireNonNull(label, "label");
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be within [0, 1], got: " + confidence);
    }
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("width and height must be >= 0");
    }
  }
}
