package com.xing.warren.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.xing.warren.BadMessageException;
import com.xing.warren.MalformedMessageException;
import com.xing.warren.MessageProcessor;
import com.xing.warren.PublishException;
import com.xing.warren.QuarantinableException;
import com.xing.warren.QuarantinePublisher;
import com.xing.warren.RetryableException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MessageDispatcherTest {

  private static final long TAG = 42;

  @Mock Channel channel;
  @Mock MessageProcessor processor;
  @Mock QuarantinePublisher quarantinePublisher;

  private MessageDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher = dispatcher(true, true);
  }

  private MessageDispatcher dispatcher(boolean checkTxId, boolean nackRequeue) {
    return new MessageDispatcher(
        processor, quarantinePublisher, ExceptionClassifier.DEFAULT, "orders", checkTxId, nackRequeue);
  }

  @Test
  void successfulProcessingAcksOnce() throws Exception {
    Outcome outcome = dispatcher.dispatch(channel, delivery("valid", withTxId("abc123")));

    assertEquals(Outcome.ACCEPTED, outcome);
    verify(processor).process("valid", "abc123");
    verify(channel).basicAck(TAG, false);
    verifyNoMoreInteractions(channel);
    verifyNoInteractions(quarantinePublisher);
  }

  @Test
  void retryableFailureNacksWithoutQuarantine() throws Exception {
    doThrow(new RetryableException("database unavailable"))
        .when(processor)
        .process("valid", "abc123");

    Outcome outcome = dispatcher.dispatch(channel, delivery("valid", withTxId("abc123")));

    assertEquals(Outcome.RETRYABLE, outcome);
    verify(channel).basicNack(TAG, false, true);
    verifyNoMoreInteractions(channel);
    verifyNoInteractions(quarantinePublisher);
  }

  @Test
  void nackRequeueFlagIsConfigurable() throws Exception {
    dispatcher = dispatcher(true, false);
    doThrow(new RetryableException("database unavailable"))
        .when(processor)
        .process("valid", "abc123");

    dispatcher.dispatch(channel, delivery("valid", withTxId("abc123")));

    verify(channel).basicNack(TAG, false, false);
  }

  @Test
  void quarantinableFailurePublishesThenRejects() throws Exception {
    doThrow(new QuarantinableException("unknown customer"))
        .when(processor)
        .process("valid", "abc123");

    Outcome outcome = dispatcher.dispatch(channel, delivery("valid", withTxId("abc123")));

    assertEquals(Outcome.QUARANTINABLE, outcome);
    InOrder order = inOrder(quarantinePublisher, channel);
    order
        .verify(quarantinePublisher)
        .publish(
            "valid".getBytes(StandardCharsets.UTF_8), Collections.singletonMap("tx_id", "abc123"));
    order.verify(channel).basicReject(TAG, false);
    verifyNoMoreInteractions(channel);
  }

  @Test
  void badMessageIsQuarantined() throws Exception {
    doThrow(new BadMessageException("cannot parse")).when(processor).process("valid", "abc123");

    assertEquals(
        Outcome.QUARANTINABLE, dispatcher.dispatch(channel, delivery("valid", withTxId("abc123"))));
    verify(channel).basicReject(TAG, false);
  }

  @Test
  void failedQuarantinePublishRequeues() throws Exception {
    doThrow(new QuarantinableException("unknown customer"))
        .when(processor)
        .process("valid", "abc123");
    doThrow(new PublishException("no broker reachable"))
        .when(quarantinePublisher)
        .publish(any(), any());

    dispatcher.dispatch(channel, delivery("valid", withTxId("abc123")));

    verify(channel).basicReject(TAG, true);
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
    verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    verifyNoMoreInteractions(channel);
  }

  @Test
  void crashingQuarantinePublisherRequeues() throws Exception {
    doThrow(new QuarantinableException("unknown customer"))
        .when(processor)
        .process("valid", "abc123");
    doThrow(new IllegalStateException("publisher closed"))
        .when(quarantinePublisher)
        .publish(any(), any());

    dispatcher.dispatch(channel, delivery("valid", withTxId("abc123")));

    verify(channel).basicReject(TAG, true);
  }

  @Test
  void quarantinePublisherErrorRequeues() throws Exception {
    doThrow(new QuarantinableException("unknown customer"))
        .when(processor)
        .process("valid", "abc123");
    doThrow(new NoClassDefFoundError("com/example/Codec"))
        .when(quarantinePublisher)
        .publish(any(), any());

    dispatcher.dispatch(channel, delivery("valid", withTxId("abc123")));

    verify(channel).basicReject(TAG, true);
    verifyNoMoreInteractions(channel);
  }

  @Test
  void missingHeadersRejectWithoutProcessing() throws Exception {
    Outcome outcome =
        dispatcher.dispatch(channel, delivery("valid", new AMQP.BasicProperties.Builder().build()));

    assertEquals(Outcome.MALFORMED, outcome);
    verifyNoInteractions(processor);
    verify(channel).basicReject(TAG, false);
    verifyNoMoreInteractions(channel);
  }

  @Test
  void missingTxIdRejectsWithoutProcessing() throws Exception {
    Map<String, Object> headers = new HashMap<>();
    headers.put("other", "value");
    AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder().headers(headers).build();

    assertEquals(Outcome.MALFORMED, dispatcher.dispatch(channel, delivery("valid", properties)));
    verifyNoInteractions(processor);
    verify(channel).basicReject(TAG, false);
  }

  @Test
  void uncheckedTxIdPassesNullToProcessor() throws Exception {
    dispatcher = dispatcher(false, true);

    Outcome outcome =
        dispatcher.dispatch(channel, delivery("valid", new AMQP.BasicProperties.Builder().build()));

    assertEquals(Outcome.ACCEPTED, outcome);
    verify(processor).process("valid", null);
    verify(channel).basicAck(TAG, false);
  }

  @Test
  void malformedSignalFromProcessorRejects() throws Exception {
    doThrow(new MalformedMessageException("missing field")).when(processor).process("valid", "abc123");

    assertEquals(
        Outcome.MALFORMED, dispatcher.dispatch(channel, delivery("valid", withTxId("abc123"))));
    verify(channel).basicReject(TAG, false);
    verifyNoInteractions(quarantinePublisher);
  }

  @Test
  void unexpectedFailureNacks() throws Exception {
    doThrow(new IOException("disk full")).when(processor).process("valid", "abc123");

    assertEquals(
        Outcome.UNEXPECTED, dispatcher.dispatch(channel, delivery("valid", withTxId("abc123"))));
    verify(channel).basicNack(TAG, false, true);
    verifyNoInteractions(quarantinePublisher);
  }

  @Test
  void errorFromProcessorNacksOnce() throws Exception {
    doThrow(new AssertionError("invariant broken")).when(processor).process("valid", "abc123");

    assertEquals(
        Outcome.UNEXPECTED, dispatcher.dispatch(channel, delivery("valid", withTxId("abc123"))));
    verify(channel).basicNack(TAG, false, true);
    verifyNoMoreInteractions(channel);
    verifyNoInteractions(quarantinePublisher);
  }

  @Test
  void invalidUtf8BodyIsUnexpected() throws Exception {
    byte[] body = {(byte) 0xC3, (byte) 0x28};
    Delivery delivery = new Delivery(new Envelope(TAG, false, "events", "orders"), withTxId("t1"), body);

    assertEquals(Outcome.UNEXPECTED, dispatcher.dispatch(channel, delivery));
    verifyNoInteractions(processor);
    verify(channel).basicNack(TAG, false, true);
  }

  @Test
  void customRulesTakePrecedence() throws Exception {
    dispatcher =
        new MessageDispatcher(
            processor,
            quarantinePublisher,
            ExceptionClassifier.builder().retry(IllegalArgumentException.class).build(),
            "orders",
            true,
            true);
    doThrow(new IllegalArgumentException("transient")).when(processor).process("valid", "abc123");

    assertEquals(
        Outcome.RETRYABLE, dispatcher.dispatch(channel, delivery("valid", withTxId("abc123"))));
  }

  @Test
  void closedChannelOnAckDoesNotPropagate() throws Exception {
    doThrow(new AlreadyClosedException(new ShutdownSignalException(false, false, null, channel)))
        .when(channel)
        .basicAck(TAG, false);

    assertEquals(
        Outcome.ACCEPTED, dispatcher.dispatch(channel, delivery("valid", withTxId("abc123"))));
  }

  @Test
  void interruptedProcessorRestoresInterruptFlag() throws Exception {
    doThrow(new InterruptedException()).when(processor).process("valid", "abc123");

    try {
      assertEquals(
          Outcome.UNEXPECTED, dispatcher.dispatch(channel, delivery("valid", withTxId("abc123"))));
    } finally {
      assertTrue(Thread.interrupted());
    }
  }

  @Test
  void txIdReaderRejectsNullValues() {
    Map<String, Object> headers = new HashMap<>();
    headers.put("tx_id", null);
    AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder().headers(headers).build();

    assertThrows(MalformedMessageException.class, () -> MessageDispatcher.txId(properties));
  }

  private static AMQP.BasicProperties withTxId(String txId) {
    return new AMQP.BasicProperties.Builder()
        .appId("svc")
        .headers(Collections.singletonMap("tx_id", txId))
        .build();
  }

  private static Delivery delivery(String payload, AMQP.BasicProperties properties) {
    return new Delivery(
        new Envelope(TAG, false, "events", "orders"),
        properties,
        payload.getBytes(StandardCharsets.UTF_8));
  }
}
