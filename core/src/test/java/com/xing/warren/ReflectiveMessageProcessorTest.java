package com.xing.warren;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReflectiveMessageProcessorTest {

  public static class OrderHandler {

    final List<String> seen = new ArrayList<>();

    public void handle(String payload, String txId) {
      seen.add(payload + "/" + txId);
    }

    public void handle(String payload) {
      throw new AssertionError("single argument overload must not be chosen");
    }

    public void wrongArity(String payload) {
      seen.add(payload);
    }

    public void failing(String payload, String txId) {
      throw new RetryableException("downstream unavailable");
    }
  }

  @Test
  void invokesTwoArgumentOverload() throws Exception {
    OrderHandler handler = new OrderHandler();

    new ReflectiveMessageProcessor(handler, "handle").process("order-1", "tx-1");

    assertEquals(List.of("order-1/tx-1"), handler.seen);
  }

  @Test
  void unknownMethodFailsAtConstruction() {
    IllegalArgumentException error =
        assertThrows(
            IllegalArgumentException.class,
            () -> new ReflectiveMessageProcessor(new OrderHandler(), "missing"));
    assertEquals(
        "Process callback missing is not callable on " + OrderHandler.class.getName(),
        error.getMessage());
  }

  @Test
  void signatureMismatchIsReportedAsSignatureError() {
    MessageProcessor processor = new ReflectiveMessageProcessor(new OrderHandler(), "wrongArity");

    assertThrows(ProcessorSignatureException.class, () -> processor.process("order-1", "tx-1"));
  }

  @Test
  void exceptionsFromTargetPropagateUnwrapped() {
    MessageProcessor processor = new ReflectiveMessageProcessor(new OrderHandler(), "failing");

    assertThrows(RetryableException.class, () -> processor.process("order-1", "tx-1"));
  }
}
