package com.serviceruntime.infra.kafka.triage;

/** How an error affects the unit of work that raised it. */
public enum Severity {
  /** Recoverable; the operation should be retried. */
  TRANSIENT,
  /** Unrecoverable for this unit of work; stop retrying and surface the error. */
  PERMANENT,
  /** Retrying is unsafe or meaningless; the process must terminate. */
  FATAL
}
