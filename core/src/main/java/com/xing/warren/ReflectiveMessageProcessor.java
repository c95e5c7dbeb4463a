package com.xing.warren;

import static java.util.Objects.requireNonNull;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Adapts a public method of an arbitrary object, looked up by name, as a {@link MessageProcessor}.
 * A method taking {@code (String, String)} is preferred among overloads. If the chosen method cannot
 * be called with a payload and a transaction id, every invocation fails with a {@link
 * ProcessorSignatureException}, which quarantines the message.
 */
public class ReflectiveMessageProcessor implements MessageProcessor {

  private final Object target;
  private final Method method;

  public ReflectiveMessageProcessor(Object target, String methodName) {
    this.target = requireNonNull(target, "target");
    requireNonNull(methodName, "methodName");
    this.method =
        Arrays.stream(target.getClass().getMethods())
            .filter(m -> m.getName().equals(methodName))
            .min(Comparator.comparing((Method m) -> !takesPayloadAndTxId(m)))
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Process callback "
                            + methodName
                            + " is not callable on "
                            + target.getClass().getName()));
    method.trySetAccessible();
  }

  private static boolean takesPayloadAndTxId(Method m) {
    return Arrays.equals(m.getParameterTypes(), new Class<?>[] {String.class, String.class});
  }

  @Override
  public void process(String payload, String txId) throws Exception {
    try {
      method.invoke(target, payload, txId);
    } catch (IllegalArgumentException | IllegalAccessException e) {
      throw new ProcessorSignatureException("Incorrect call to process method " + method, e);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw e;
    }
  }

  @Override
  public String toString() {
    return "ReflectiveMessageProcessor{" + method + '}';
  }
}
