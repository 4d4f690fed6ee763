package com.serviceruntime.infra.kafka.triage;

import java.io.InterruptedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.errors.ApiException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.RecordDeserializationException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.protocol.Errors;
import org.springframework.util.ClassUtils;

/**
 * Maps any {@link Throwable} onto a {@link Severity}.
 *
 * <h2>Classification order</h2>
 *
 * <ol>
 *   <li>Rules registered through {@link #withRule(Class, Function)}, latest first
 *   <li>{@link TriagedException}s without a fixed severity are classified by their cause
 *   <li>{@link Triage} implementations report their own severity
 *   <li>Wrapper exceptions, Spring Kafka's included, delegate to their cause
 *   <li>JVM errors are fatal
 *   <li>Kafka errors, by protocol error code first and by type otherwise
 *   <li>HTTP client errors (when Spring Web is on the classpath)
 *   <li>Network conditions are transient
 *   <li>Anything else, malformed input included, is permanent
 * </ol>
 *
 * <p>Instances are immutable and safe to share.
 */
public final class SeverityClassifier {
  private static final int MAX_CAUSE_DEPTH = 32;
  private static final boolean SPRING_WEB_PRESENT =
      ClassUtils.isPresent(
          "org.springframework.web.client.RestClientException",
          SeverityClassifier.class.getClassLoader());
  private static final SeverityClassifier DEFAULTS = new SeverityClassifier(List.of());

  private final List<Rule<?>> rules;

  private SeverityClassifier(List<Rule<?>> rules) {
    this.rules = rules;
  }

  public static SeverityClassifier defaults() {
    return DEFAULTS;
  }

  /** Returns a classifier that consults {@code rule} for {@code type} before any existing rule. */
  public <T extends Throwable> SeverityClassifier withRule(
      Class<T> type, Function<? super T, Severity> rule) {
    List<Rule<?>> extended = new ArrayList<>(rules.size() + 1);
    extended.add(new Rule<>(type, rule));
    extended.addAll(rules);
    return new SeverityClassifier(List.copyOf(extended));
  }

  public Severity classify(Throwable error) {
    return classify(error, 0);
  }

  private Severity classify(Throwable error, int depth) {
    if (error == null || depth > MAX_CAUSE_DEPTH) {
      return Severity.PERMANENT;
    }

    for (Rule<?> rule : rules) {
      Severity custom = rule.apply(error);
      if (custom != null) {
        return custom;
      }
    }

    if (error instanceof TriagedException triaged && triaged.defersToCause()) {
      return classify(triaged.getCause(), depth + 1);
    }

    if (error instanceof Triage triage) {
      return Objects.requireNonNullElse(triage.severity(), Severity.PERMANENT);
    }

    if (isWrapper(error) && error.getCause() != null) {
      return classify(error.getCause(), depth + 1);
    }

    if (error instanceof VirtualMachineError || error instanceof LinkageError) {
      return Severity.FATAL;
    }

    if (error instanceof KafkaException kafkaException) {
      return classifyKafka(kafkaException, depth);
    }

    if (SPRING_WEB_PRESENT) {
      Severity http = HttpSeverityRules.classify(error);
      if (http != null) {
        return http;
      }
    }

    if (isTransientNetworkCondition(error)) {
      return Severity.TRANSIENT;
    }

    // Malformed input (JSON, numbers, dates, URIs) lands here too.
    return Severity.PERMANENT;
  }

  private Severity classifyKafka(KafkaException error, int depth) {
    if (error instanceof ApiException apiException) {
      Errors code = Errors.forException(apiException);
      if (code != Errors.UNKNOWN_SERVER_ERROR && code != Errors.NONE) {
        return code.exception() instanceof RetriableException
            ? Severity.TRANSIENT
            : Severity.PERMANENT;
      }
    }

    if (error instanceof RetriableException) {
      return Severity.TRANSIENT;
    }
    if (error instanceof WakeupException || error instanceof InterruptException) {
      return Severity.TRANSIENT;
    }
    if (error instanceof RecordDeserializationException) {
      return Severity.PERMANENT;
    }
    if (error instanceof SerializationException || error instanceof ConfigException) {
      return Severity.FATAL;
    }
    if (error.getCause() != null && error.getCause() != error) {
      return classify(error.getCause(), depth + 1);
    }
    return Severity.PERMANENT;
  }

  private static boolean isWrapper(Throwable error) {
    return error instanceof CompletionException
        || error instanceof ExecutionException
        || error instanceof UndeclaredThrowableException
        || error instanceof InvocationTargetException
        || error instanceof org.springframework.kafka.KafkaException;
  }

  private static boolean isTransientNetworkCondition(Throwable error) {
    return error instanceof ConnectException
        || error instanceof NoRouteToHostException
        || error instanceof PortUnreachableException
        || error instanceof SocketException
        || error instanceof InterruptedIOException
        || error instanceof ClosedChannelException
        || error instanceof TimeoutException
        || error instanceof InterruptedException;
  }

  private record Rule<T extends Throwable>(Class<T> type, Function<? super T, Severity> rule) {
    Rule {
      Objects.requireNonNull(type, "type must not be null");
      Objects.requireNonNull(rule, "rule must not be null");
    }

    Severity apply(Throwable error) {
      if (!type.isInstance(error)) {
        return null;
      }
      return rule.apply(type.cast(error));
    }
  }
}
