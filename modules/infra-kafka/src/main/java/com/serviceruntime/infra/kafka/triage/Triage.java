package com.serviceruntime.infra.kafka.triage;

/**
 * An error that knows its own {@link Severity}.
 *
 * <p>Implementations must be pure: no I/O and no exceptions from {@link #severity()}.
 */
@FunctionalInterface
public interface Triage {
  Severity severity();
}
