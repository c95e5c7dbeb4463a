package com.xing.warren;

/**
 * Caller supplied processing of one message. Runs on the consumer's event loop and must complete
 * before the next delivery is handed over.
 *
 * <p>Returning normally acknowledges the delivery. Throw {@link RetryableException} to have it
 * nacked, {@link QuarantinableException} or {@link BadMessageException} to have it quarantined.
 * Any other exception is treated like a retryable failure.
 */
@FunctionalInterface
public interface MessageProcessor {

  /**
   * @param payload the message body decoded as UTF-8
   * @param txId the {@code tx_id} header, {@code null} if transaction id checking is disabled
   */
  void process(String payload, String txId) throws Exception;
}
