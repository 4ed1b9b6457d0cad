/**
 * Wire formats: the versioned binary frame layout carried on the frames channel and the
 * JSON detection document carried on the detections channel.
 *
 * @see io.framerelay.codec.FrameCodec
 * @see io.framerelay.codec.DetectionCodec
 */
package io.framerelay.codec;
