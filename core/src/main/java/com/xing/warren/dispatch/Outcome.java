package com.xing.warren.dispatch;

/** Result of handling one delivery; decides the acknowledgment sent to the broker. */
public enum Outcome {
  /** Processed. Acked. */
  ACCEPTED,
  /** Processing failed and may succeed on redelivery. Nacked. */
  RETRYABLE,
  /** Must not be retried as it is. Published to quarantine, then rejected. */
  QUARANTINABLE,
  /** Structurally unusable delivery. Rejected without requeue. */
  MALFORMED,
  /** Unclassified processing failure. Nacked like {@link #RETRYABLE}. */
  UNEXPECTED
}
