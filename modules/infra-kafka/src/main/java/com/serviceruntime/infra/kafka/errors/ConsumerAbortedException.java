package com.serviceruntime.infra.kafka.errors;

import com.serviceruntime.infra.kafka.triage.Severity;
import com.serviceruntime.infra.kafka.triage.Triage;

/**
 * Unwinds the consume loop after process termination was requested. A halting terminator never
 * lets this surface.
 */
public class ConsumerAbortedException extends RuntimeException implements Triage {
  public ConsumerAbortedException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public Severity severity() {
    return Severity.FATAL;
  }
}
