package com.serviceruntime.infra.kafka.consumer;

/**
 * Application callback for one decoded event. A thrown exception is classified by severity: a
 * transient failure re-invokes the handler with the same event, so events should be immutable.
 */
@FunctionalInterface
public interface RecordHandler<G> {
  void handle(G event) throws Exception;
}
