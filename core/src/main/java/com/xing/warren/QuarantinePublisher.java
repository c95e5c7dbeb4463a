package com.xing.warren;

import java.util.Map;

/** Sink for messages that cannot be processed and should not be retried as they are. */
@FunctionalInterface
public interface QuarantinePublisher {

  void publish(byte[] body, Map<String, Object> headers) throws PublishException;
}
