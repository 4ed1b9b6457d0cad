/**
 * Process-local broker implementation of the channel SPI, with outage and latency
 * simulation.
 */
package io.framerelay.channel.memory;
