/**
 * Spring Boot auto-configuration for the frame relay.
 *
 * <p>{@link io.framerelay.spring.boot.FrameRelayAutoConfiguration} wires a channel client
 * and, when enabled, a {@link io.framerelay.supervisor.Supervisor} from
 * {@code framerelay.*} application properties.
 *
 * @see io.framerelay.spring.boot.FrameRelayAutoConfiguration
 * @see io.framerelay.spring.boot.FrameRelayProperties
 * @see io.framerelay.spring.boot.FrameRelayMicrometerAutoConfiguration
 */
package io.framerelay.spring.boot;
