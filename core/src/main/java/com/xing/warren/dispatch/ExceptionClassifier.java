package com.xing.warren.dispatch;

import static java.util.Objects.requireNonNull;

import com.xing.warren.MalformedMessageException;
import com.xing.warren.ProcessorSignatureException;
import com.xing.warren.QuarantinableException;
import com.xing.warren.RetryableException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps exceptions thrown by a processor to an {@link Outcome}. Rules registered through the
 * builder are checked first, in registration order, followed by the built-in ones. Exceptions
 * matching no rule are {@link Outcome#UNEXPECTED}.
 */
public class ExceptionClassifier {

  public static final ExceptionClassifier DEFAULT = builder().build();

  private static final class Rule {

    private final Class<? extends Throwable> type;
    private final Outcome outcome;

    Rule(Class<? extends Throwable> type, Outcome outcome) {
      this.type = requireNonNull(type);
      this.outcome = requireNonNull(outcome);
    }
  }

  private final List<Rule> rules;

  private ExceptionClassifier(List<Rule> rules) {
    this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
  }

  public Outcome classify(Throwable error) {
    for (Rule rule : rules) {
      if (rule.type.isInstance(error)) {
        return rule.outcome;
      }
    }
    return Outcome.UNEXPECTED;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {

    private final List<Rule> rules = new ArrayList<>();

    @SafeVarargs
    public final Builder quarantine(Class<? extends Throwable>... types) {
      return add(Outcome.QUARANTINABLE, types);
    }

    @SafeVarargs
    public final Builder retry(Class<? extends Throwable>... types) {
      return add(Outcome.RETRYABLE, types);
    }

    @SafeVarargs
    public final Builder reject(Class<? extends Throwable>... types) {
      return add(Outcome.MALFORMED, types);
    }

    private Builder add(Outcome outcome, Class<? extends Throwable>[] types) {
      for (Class<? extends Throwable> type : types) {
        rules.add(new Rule(type, outcome));
      }
      return this;
    }

    public ExceptionClassifier build() {
      List<Rule> all = new ArrayList<>(rules);
      all.add(new Rule(ProcessorSignatureException.class, Outcome.QUARANTINABLE));
      all.add(new Rule(QuarantinableException.class, Outcome.QUARANTINABLE));
      all.add(new Rule(MalformedMessageException.class, Outcome.MALFORMED));
      all.add(new Rule(RetryableException.class, Outcome.RETRYABLE));
      return new ExceptionClassifier(all);
    }
  }
}
