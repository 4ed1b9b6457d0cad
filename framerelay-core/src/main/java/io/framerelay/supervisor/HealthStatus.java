package io.framerelay.supervisor;

import io.framerelay.PipelineFailure;
import io.framerelay.producer.ProducerState;

/**
 * Point-in-time view of a {@link Supervisor}.
 *
 * @param live               every configured pipeline is running and connected
 * @param producerState      producer lifecycle state, or {@code null} without a producer
 * @param producerConnected  producer holds an open connection
 * @param consumerConnected  consumer holds an open subscription
 * @param framesPublished    frames confirmed by the broker
 * @param framesDropped      frames evicted by drop-oldest or abandoned at shutdown
 * @param framesFailed       frames dropped after exhausting publish attempts
 * @param deliveriesAcked    deliveries acknowledged after a successful emit
 * @param deliveriesDead     deliveries dead-lettered
 * @param failuresReported   failures reported since start
 * @param lastFailure        most recent failure, or {@code null}
 */
public record HealthStatus(
    boolean live,
    ProducerState producerState,
    boolean producerConnected,
    boolean consumerConnected,
    long framesPublished,
    long framesDropped,
    long framesFailed,
    long deliveriesAcked,
    long deliveriesDead,
    long failuresReported,
    PipelineFailure lastFailure) {
}
