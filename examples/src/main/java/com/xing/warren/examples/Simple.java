package com.xing.warren.examples;

import com.xing.warren.BadMessageException;
import com.xing.warren.ConsumerConfiguration;
import com.xing.warren.MessageConsumer;
import com.xing.warren.RetryableException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes the queue configured through {@code WARREN_*} environment variables until the JVM is
 * asked to exit. Messages containing "retry" are nacked, messages containing "bad" quarantined.
 */
public class Simple {

    private static final Logger log = LoggerFactory.getLogger(Simple.class);

    public static void main(String[] args) throws InterruptedException {
        ConsumerConfiguration configuration = ConsumerConfiguration.fromEnvironment();
        if (configuration.getQuarantineQueue() == null) {
            log.error("Set WARREN_QUARANTINE_QUEUE to run this example.");
            System.exit(1);
        }

        final MessageConsumer consumer = MessageConsumer.builder()
            .configuration(configuration)
            .processor(new Simple(), "handle")
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            consumer.stop();
            try {
                consumer.awaitTermination(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "warren-shutdown"));

        consumer.run();
    }

    public void handle(String payload, String txId) {
        log.info("Handling message tx_id={} payload={}", txId, payload);
        if (payload.contains("retry")) {
            throw new RetryableException("Asked to retry " + txId);
        }
        if (payload.contains("bad")) {
            throw new BadMessageException("Cannot handle " + txId);
        }
    }
}
