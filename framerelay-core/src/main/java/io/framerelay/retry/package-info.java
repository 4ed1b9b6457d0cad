/**
 * Backoff policies shared by reconnects, publish retries and capture restarts.
 */
package io.framerelay.retry;
