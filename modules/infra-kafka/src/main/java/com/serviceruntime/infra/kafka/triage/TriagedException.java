package com.serviceruntime.infra.kafka.triage;

import java.util.Objects;

/**
 * Base class for application errors that declare their severity.
 *
 * <p>A subclass either pins a fixed severity or defers to exactly one cause. No constructor accepts
 * both. A {@link SeverityClassifier} classifies a deferring exception by its cause with its own
 * rules; {@link #severity()} alone falls back to {@link SeverityClassifier#defaults()}.
 */
public abstract class TriagedException extends RuntimeException implements Triage {
  private final Severity fixedSeverity;

  protected TriagedException(String message, Severity severity) {
    super(message);
    this.fixedSeverity = Objects.requireNonNull(severity, "severity must not be null");
  }

  protected TriagedException(String message, Throwable cause) {
    super(message, Objects.requireNonNull(cause, "cause must not be null"));
    this.fixedSeverity = null;
  }

  /** True when this exception has no severity of its own and reports its cause's. */
  public final boolean defersToCause() {
    return fixedSeverity == null;
  }

  @Override
  public final Severity severity() {
    if (fixedSeverity != null) {
      return fixedSeverity;
    }
    return SeverityClassifier.defaults().classify(getCause());
  }
}
