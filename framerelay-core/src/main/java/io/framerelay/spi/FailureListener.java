package io.framerelay.spi;

import io.framerelay.PipelineFailure;

/**
 * Receives failures that pipelines recover from locally or turn into dead letters.
 *
 * <p>Pipelines report instead of throwing; a failure never unwinds a pipeline thread.
 * Implementations are called from pipeline threads and must not block.
 */
@FunctionalInterface
public interface FailureListener {

    FailureListener NOOP = failure -> { };

    void onFailure(PipelineFailure failure);
}
