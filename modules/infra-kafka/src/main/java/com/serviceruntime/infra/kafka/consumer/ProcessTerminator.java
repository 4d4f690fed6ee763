package com.serviceruntime.infra.kafka.consumer;

/**
 * Ends the process after an unrecoverable consumer failure. Production implementations do not
 * return; the restart is left to the supervising process manager.
 */
@FunctionalInterface
public interface ProcessTerminator {
  void terminate(String reason, Throwable cause);
}
