package io.framerelay.kafka;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Codec for the offset-commit metadata that records which attempt each handed-out,
 * uncommitted record of a partition was delivered with.
 *
 * <p>Format: {@code a1:<offset>=<attempt>,<offset>=<attempt>}. Offsets that do not fit
 * below {@link #MAX_LENGTH} characters are left out; they are redelivered with the attempt
 * from their record header.
 */
final class OffsetAttempts {
  private static final Logger logger = Logger.getLogger(OffsetAttempts.class.getName());

  static final String PREFIX = "a1:";

  // brokers reject metadata above offset.metadata.max.bytes, 4096 by default
  static final int MAX_LENGTH = 3072;

  private OffsetAttempts() {}

  /**
   * @param attempts offset to attempt, in ascending offset order
   * @return commit metadata, empty when there is nothing to record
   */
  static String encode(Map<Long, Integer> attempts) {
    if (attempts.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(PREFIX);
    int written = 0;
    for (Map.Entry<Long, Integer> entry : attempts.entrySet()) {
      String item = entry.getKey() + "=" + entry.getValue();
      if (sb.length() + item.length() + 1 > MAX_LENGTH) {
        logger.fine("Attempt metadata full; " + (attempts.size() - written) + " offset(s) not recorded");
        break;
      }
      if (written > 0) {
        sb.append(',');
      }
      sb.append(item);
      written++;
    }
    return sb.toString();
  }

  /**
   * @param metadata commit metadata, may be {@code null}
   * @return offset to attempt; empty if the metadata was not written by {@link #encode}
   */
  static Map<Long, Integer> decode(String metadata) {
    if (metadata == null || !metadata.startsWith(PREFIX) || metadata.length() == PREFIX.length()) {
      return Collections.emptyMap();
    }
    Map<Long, Integer> attempts = new HashMap<>();
    for (String item : metadata.substring(PREFIX.length()).split(",")) {
      int eq = item.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      try {
        attempts.put(Long.parseLong(item.substring(0, eq)), Integer.parseInt(item.substring(eq + 1)));
      } catch (NumberFormatException e) {
        logger.fine("Skipping malformed attempt entry '" + item + "'");
      }
    }
    return attempts;
  }
}
