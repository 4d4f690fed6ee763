package com.serviceruntime.infra.kafka.consumer;

import com.serviceruntime.infra.kafka.errors.BackoffSequence;
import com.serviceruntime.infra.kafka.errors.ConsumerAbortedException;
import com.serviceruntime.infra.kafka.errors.KafkaClientException;
import com.serviceruntime.infra.kafka.errors.KafkaReceiveException;
import com.serviceruntime.infra.kafka.errors.RetryPolicy;
import com.serviceruntime.infra.kafka.observability.KafkaTelemetry;
import com.serviceruntime.infra.kafka.triage.Severity;
import com.serviceruntime.infra.kafka.triage.SeverityClassifier;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervised consume loop for one {@link MessageGroup}.
 *
 * <p>A single driving thread polls Kafka, decodes records and hands every event to its own task on
 * an unbounded worker pool. Stream-level failures (receive errors, decode errors, stream ends) walk
 * a shared backoff sequence that any successfully decoded record resets; each handler task walks
 * its own. Exhausting the stream backoff, a fatal error anywhere, or a task failing outside the
 * handler terminates the process through the {@link ProcessTerminator}.
 *
 * <p>Offsets are committed from the driving thread, and only up to the first record whose task is
 * still running, so delivery is at-least-once.
 */
public class KafkaRecordConsumer<G> {
  private static final Logger log = LoggerFactory.getLogger(KafkaRecordConsumer.class);

  public record Settings(Duration pollTimeout, RetryPolicy streamRetryPolicy) {
    public Settings {
      Objects.requireNonNull(streamRetryPolicy, "streamRetryPolicy must not be null");
      pollTimeout =
          pollTimeout == null || pollTimeout.isNegative() ? Duration.ofMillis(100) : pollTimeout;
    }
  }

  private final String groupId;
  private final MessageGroup<G> messageGroup;
  private final List<String> topics;
  private final Supplier<Consumer<byte[], byte[]>> clientFactory;
  private final Settings settings;
  private final SeverityClassifier classifier;
  private final ProcessTerminator terminator;
  private final KafkaTelemetry telemetry;
  private final Sleeper sleeper;
  private final AtomicBoolean aborted = new AtomicBoolean(false);
  private final AtomicReference<ConsumerAbortedException> abortedBy = new AtomicReference<>();
  private final CountDownLatch terminationStarted = new CountDownLatch(1);
  private volatile Thread terminationThread;
  private Connection pendingConnection;

  private KafkaRecordConsumer(
      String groupId,
      MessageGroup<G> messageGroup,
      Supplier<Consumer<byte[], byte[]>> clientFactory,
      Settings settings,
      SeverityClassifier classifier,
      ProcessTerminator terminator,
      KafkaTelemetry telemetry,
      Sleeper sleeper) {
    this.groupId = groupId;
    this.messageGroup = messageGroup;
    this.topics = List.copyOf(messageGroup.topics());
    this.clientFactory = clientFactory;
    this.settings = settings;
    this.classifier = classifier;
    this.terminator = terminator;
    this.telemetry = telemetry;
    this.sleeper = sleeper;
  }

  /**
   * Creates the first Kafka client and subscribes it to the group's topics.
   *
   * @throws KafkaClientException if the client cannot be created or subscribed
   */
  public static <G> KafkaRecordConsumer<G> build(
      String groupId,
      MessageGroup<G> messageGroup,
      Supplier<Consumer<byte[], byte[]>> clientFactory,
      Settings settings,
      SeverityClassifier classifier,
      ProcessTerminator terminator,
      KafkaTelemetry telemetry,
      Sleeper sleeper) {
    Objects.requireNonNull(messageGroup, "messageGroup must not be null");
    if (messageGroup.topics() == null || messageGroup.topics().isEmpty()) {
      throw new IllegalArgumentException(
          "Message group " + messageGroup.groupName() + " declares no topics");
    }
    KafkaRecordConsumer<G> consumer =
        new KafkaRecordConsumer<>(
            Objects.requireNonNull(groupId, "groupId must not be null"),
            messageGroup,
            Objects.requireNonNull(clientFactory, "clientFactory must not be null"),
            Objects.requireNonNull(settings, "settings must not be null"),
            Objects.requireNonNull(classifier, "classifier must not be null"),
            Objects.requireNonNull(terminator, "terminator must not be null"),
            Objects.requireNonNull(telemetry, "telemetry must not be null"),
            Objects.requireNonNull(sleeper, "sleeper must not be null"));
    consumer.pendingConnection = consumer.connect();
    log.info("Kafka consumer subscribed group={} topics={}", groupId, consumer.topics);
    return consumer;
  }

  public String groupId() {
    return groupId;
  }

  public List<String> topics() {
    return topics;
  }

  /**
   * Runs the loop on the calling thread. Never returns normally: the only exit is process
   * termination, surfaced as {@link ConsumerAbortedException} when the terminator returns.
   */
  public void consume(RetryPolicy handlerRetryPolicy, RecordHandler<? super G> handler) {
    Objects.requireNonNull(handlerRetryPolicy, "handlerRetryPolicy must not be null");
    Objects.requireNonNull(handler, "handler must not be null");

    ExecutorService workers = Executors.newCachedThreadPool(handlerThreadFactory());
    CompletionService<HandledRecord> completions = new ExecutorCompletionService<>(workers);
    BackoffSequence streamBackoff = settings.streamRetryPolicy().newSequence();
    try {
      while (true) {
        ensureNotAborted();
        Connection connection = pendingConnection != null ? pendingConnection : reconnect();
        pendingConnection = null;
        if (connection != null) {
          try {
            receive(connection, completions, streamBackoff, handlerRetryPolicy, handler);
            drainCompleted(completions, connection.tracker);
          } finally {
            connection.close();
          }
        }

        Optional<Duration> delay = streamBackoff.next();
        if (delay.isEmpty()) {
          throw abort("Kafka stream reconnect attempts exhausted group=" + groupId, null);
        }
        telemetry.onStreamReconnect(streamBackoff.attempt() - 1, delay.get());
        log.warn(
            "Kafka stream ended, reconnecting group={} attempt={} backoffMs={}",
            groupId,
            streamBackoff.attempt() - 1,
            delay.get().toMillis());
        sleepOrAbort(delay.get());
      }
    } finally {
      awaitTermination();
      workers.shutdownNow();
    }
  }

  private void receive(
      Connection connection,
      CompletionService<HandledRecord> completions,
      BackoffSequence streamBackoff,
      RetryPolicy handlerRetryPolicy,
      RecordHandler<? super G> handler) {
    while (true) {
      ensureNotAborted();
      drainCompleted(completions, connection.tracker);
      if (!connection.commitCompleted()) {
        return;
      }

      ConsumerRecords<byte[], byte[]> records;
      try {
        records = connection.client.poll(settings.pollTimeout());
      } catch (WakeupException | InterruptException ex) {
        log.info(
            "Kafka stream ended group={} cause={}", groupId, ex.getClass().getSimpleName());
        return;
      } catch (IllegalStateException ex) {
        log.warn("Kafka stream unusable group={} error={}", groupId, ex.getMessage());
        return;
      } catch (KafkaException ex) {
        onReceiveFailure(streamBackoff, null, KafkaReceiveException.transport(ex));
        continue;
      }

      for (ConsumerRecord<byte[], byte[]> record : records) {
        ensureNotAborted();
        TopicPartition partition = new TopicPartition(record.topic(), record.partition());
        connection.tracker.track(partition, record.offset());
        G event;
        try {
          event = messageGroup.decode(record.topic(), record.key(), record.value());
        } catch (RuntimeException ex) {
          connection.tracker.complete(partition, record.offset());
          telemetry.onRecordDropped(record.topic(), "decode", ex);
          onReceiveFailure(streamBackoff, record.topic(), ex);
          continue;
        }
        streamBackoff.reset();
        completions.submit(
            new HandlerTask(
                partition, record.offset(), event, handler, handlerRetryPolicy.newSequence()));
      }
    }
  }

  private void onReceiveFailure(BackoffSequence streamBackoff, String topic, Throwable error) {
    telemetry.onReceiveFailure(topic, error);
    Severity severity = classifier.classify(error);
    if (severity == Severity.FATAL) {
      throw abort("Fatal error receiving from Kafka group=" + groupId + " topic=" + topic, error);
    }
    Optional<Duration> delay = streamBackoff.next();
    if (delay.isEmpty()) {
      throw abort("Too many consecutive Kafka receive errors group=" + groupId, error);
    }
    log.warn(
        "Kafka receive failed group={} topic={} severity={} attempt={} backoffMs={}",
        groupId,
        topic,
        severity,
        streamBackoff.attempt() - 1,
        delay.get().toMillis(),
        error);
    sleepOrAbort(delay.get());
  }

  private void drainCompleted(
      CompletionService<HandledRecord> completions, OffsetTracker tracker) {
    Future<HandledRecord> done;
    while ((done = completions.poll()) != null) {
      try {
        HandledRecord handled = done.get();
        tracker.complete(handled.partition(), handled.offset());
      } catch (ExecutionException ex) {
        if (ex.getCause() instanceof ConsumerAbortedException abortion) {
          throw abortion;
        }
        throw abort("Handler task failed unexpectedly group=" + groupId, ex.getCause());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw abort("Interrupted collecting handler results group=" + groupId, ex);
      }
    }
  }

  private void sleepOrAbort(Duration delay) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw abort("Interrupted during stream backoff group=" + groupId, ex);
    }
  }

  private Connection reconnect() {
    try {
      return connect();
    } catch (KafkaClientException ex) {
      telemetry.onReceiveFailure(null, ex);
      log.warn("Kafka reconnect failed group={}", groupId, ex);
      return null;
    }
  }

  private Connection connect() {
    Consumer<byte[], byte[]> client;
    try {
      client = clientFactory.get();
    } catch (KafkaException ex) {
      throw new KafkaClientException("Unable to create Kafka consumer group=" + groupId, ex);
    }
    Connection connection = new Connection(client);
    try {
      client.subscribe(topics, connection);
    } catch (KafkaException | IllegalArgumentException | IllegalStateException ex) {
      connection.close();
      throw new KafkaClientException(
          "Unable to subscribe Kafka consumer group=" + groupId + " topics=" + topics, ex);
    }
    return connection;
  }

  /** Requests termination once, then returns the exception that unwinds the caller. */
  private ConsumerAbortedException abort(String reason, Throwable cause) {
    ConsumerAbortedException abortion = new ConsumerAbortedException(reason, cause);
    if (aborted.compareAndSet(false, true)) {
      abortedBy.set(abortion);
      log.error("Aborting Kafka consumer group={} reason={}", groupId, reason, cause);
      Thread termination =
          new Thread(() -> runTerminator(reason, cause), "kafka-terminator-" + groupId);
      termination.setDaemon(false);
      terminationThread = termination;
      termination.start();
      terminationStarted.countDown();
    }
    return abortion;
  }

  private void runTerminator(String reason, Throwable cause) {
    try {
      terminator.terminate(reason, cause);
    } catch (RuntimeException ex) {
      log.error("Process terminator failed group={} reason={}", groupId, reason, ex);
    }
  }

  /** Blocks until a requested termination has finished, without interrupting the terminator. */
  private void awaitTermination() {
    if (!aborted.get()) {
      return;
    }
    boolean interrupted = false;
    while (true) {
      try {
        terminationStarted.await();
        terminationThread.join();
        break;
      } catch (InterruptedException ex) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void ensureNotAborted() {
    if (aborted.get()) {
      ConsumerAbortedException first = abortedBy.get();
      throw first != null ? first : new ConsumerAbortedException("Consumer aborted", null);
    }
  }

  private ThreadFactory handlerThreadFactory() {
    AtomicInteger sequence = new AtomicInteger();
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable runnable) {
        Thread thread =
            new Thread(runnable, "kafka-handler-" + groupId + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }

  private record HandledRecord(TopicPartition partition, long offset) {}

  private final class HandlerTask implements Callable<HandledRecord> {
    private final TopicPartition partition;
    private final long offset;
    private final G event;
    private final RecordHandler<? super G> handler;
    private final BackoffSequence backoff;

    private HandlerTask(
        TopicPartition partition,
        long offset,
        G event,
        RecordHandler<? super G> handler,
        BackoffSequence backoff) {
      this.partition = partition;
      this.offset = offset;
      this.event = event;
      this.handler = handler;
      this.backoff = backoff;
    }

    @Override
    public HandledRecord call() throws InterruptedException {
      HandledRecord handled = new HandledRecord(partition, offset);
      String topic = partition.topic();
      long started = System.nanoTime();
      int attempt = 1;
      while (true) {
        ensureNotAborted();
        try {
          handler.handle(event);
          telemetry.onConsumeSuccess(
              topic, partition.partition(), offset, attempt, System.nanoTime() - started);
          log.debug(
              "Record handled topic={} partition={} offset={} attempts={}",
              topic,
              partition.partition(),
              offset,
              attempt);
          return handled;
        } catch (Exception ex) {
          Severity severity = classifier.classify(ex);
          telemetry.onConsumeFailure(topic, severity, ex);
          switch (severity) {
            case TRANSIENT -> {
              Optional<Duration> delay = backoff.next();
              if (delay.isEmpty()) {
                log.warn(
                    "Giving up on record topic={} partition={} offset={} attempts={}",
                    topic,
                    partition.partition(),
                    offset,
                    attempt,
                    ex);
                telemetry.onRecordDropped(topic, "retries_exhausted", ex);
                return handled;
              }
              telemetry.onHandlerRetry(topic, attempt, delay.get());
              log.warn(
                  "Retrying record topic={} partition={} offset={} attempt={} backoffMs={}"
                      + " error={}",
                  topic,
                  partition.partition(),
                  offset,
                  attempt,
                  delay.get().toMillis(),
                  ex.toString());
              sleeper.sleep(delay.get());
              attempt++;
            }
            case PERMANENT -> {
              log.warn(
                  "Dropping record topic={} partition={} offset={} attempts={}",
                  topic,
                  partition.partition(),
                  offset,
                  attempt,
                  ex);
              telemetry.onRecordDropped(topic, "permanent", ex);
              return handled;
            }
            default -> throw abort(
                "Fatal error handling record topic="
                    + topic
                    + " partition="
                    + partition.partition()
                    + " offset="
                    + offset,
                ex);
          }
        }
      }
    }
  }

  private final class Connection implements ConsumerRebalanceListener {
    private final Consumer<byte[], byte[]> client;
    private final OffsetTracker tracker = new OffsetTracker();

    private Connection(Consumer<byte[], byte[]> client) {
      this.client = client;
    }

    /** Commits finished offsets. Returns false when the stream was woken up meanwhile. */
    private boolean commitCompleted() {
      Map<TopicPartition, OffsetAndMetadata> offsets = tracker.takeCommittable();
      if (offsets.isEmpty()) {
        return true;
      }
      try {
        client.commitSync(offsets);
        log.debug("Offsets committed group={} offsets={}", groupId, offsets);
      } catch (WakeupException | InterruptException ex) {
        return false;
      } catch (KafkaException ex) {
        log.warn("Offset commit failed group={} offsets={}", groupId, offsets, ex);
      }
      return true;
    }

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      Map<TopicPartition, OffsetAndMetadata> offsets = tracker.takeCommittable(partitions);
      if (!offsets.isEmpty()) {
        try {
          client.commitSync(offsets);
        } catch (KafkaException ex) {
          log.warn("Offset commit on revoke failed group={} offsets={}", groupId, offsets, ex);
        }
      }
      tracker.forget(partitions);
      log.info("Partitions revoked group={} partitions={}", groupId, partitions);
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      log.info("Partitions assigned group={} partitions={}", groupId, partitions);
    }

    private void close() {
      try {
        commitCompleted();
        client.close();
      } catch (KafkaException | IllegalStateException ex) {
        log.warn("Closing Kafka consumer failed group={}", groupId, ex);
      }
    }
  }
}
