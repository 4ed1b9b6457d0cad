/**
 * Lifecycle ownership and health reporting for producer and consumer pipelines.
 */
package io.framerelay.supervisor;
