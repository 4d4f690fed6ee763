package com.serviceruntime.infra.kafka.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.security.auth.SecurityProtocol;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.kafka")
public class InfraKafkaProperties {
  static final String SCRAM_MECHANISM = "SCRAM-SHA-512";
  private static final String SCRAM_LOGIN_MODULE =
      "org.apache.kafka.common.security.scram.ScramLoginModule";

  private String serviceName;
  private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
  private Security security = new Security();
  private Producer producer = new Producer();
  private Consumer consumer = new Consumer();
  private Supervision supervision = new Supervision();
  private HandlerRetry handlerRetry = new HandlerRetry();

  public String getServiceName() {
    return serviceName;
  }

  public void setServiceName(String serviceName) {
    this.serviceName = serviceName;
  }

  public List<String> getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(List<String> bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public Security getSecurity() {
    return security;
  }

  public void setSecurity(Security security) {
    this.security = security;
  }

  public Producer getProducer() {
    return producer;
  }

  public void setProducer(Producer producer) {
    this.producer = producer;
  }

  public Consumer getConsumer() {
    return consumer;
  }

  public void setConsumer(Consumer consumer) {
    this.consumer = consumer;
  }

  public Supervision getSupervision() {
    return supervision;
  }

  public void setSupervision(Supervision supervision) {
    this.supervision = supervision;
  }

  public HandlerRetry getHandlerRetry() {
    return handlerRetry;
  }

  public void setHandlerRetry(HandlerRetry handlerRetry) {
    this.handlerRetry = handlerRetry;
  }

  public String bootstrapServersAsCsv() {
    return String.join(",", bootstrapServers);
  }

  public String effectiveProducerClientId() {
    if (hasText(producer.getClientId())) {
      return producer.getClientId();
    }
    return hasText(serviceName) ? serviceName : "service-runtime-producer";
  }

  /**
   * Connection settings shared by producer, consumer and admin clients: bootstrap servers plus the
   * security protocol and, with credentials, SCRAM authentication.
   */
  public Map<String, Object> commonClientConfig() {
    Map<String, Object> config = new HashMap<>();
    config.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, bootstrapServersAsCsv());

    boolean hasUsername = hasText(security.getUsername());
    boolean hasPassword = hasText(security.getPassword());
    if (hasUsername != hasPassword) {
      throw new IllegalArgumentException(
          "infra.kafka.security.username and infra.kafka.security.password must be set together");
    }

    SecurityProtocol protocol;
    if (hasUsername) {
      protocol = security.isSsl() ? SecurityProtocol.SASL_SSL : SecurityProtocol.SASL_PLAINTEXT;
      config.put(SaslConfigs.SASL_MECHANISM, SCRAM_MECHANISM);
      config.put(
          SaslConfigs.SASL_JAAS_CONFIG,
          SCRAM_LOGIN_MODULE
              + " required username=\""
              + escapeJaas(security.getUsername())
              + "\" password=\""
              + escapeJaas(security.getPassword())
              + "\";");
    } else {
      protocol = security.isSsl() ? SecurityProtocol.SSL : SecurityProtocol.PLAINTEXT;
    }
    config.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, protocol.name);
    return config;
  }

  private static String escapeJaas(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  public static class Security {
    private String username;
    private String password;
    private boolean ssl = true;

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public boolean isSsl() {
      return ssl;
    }

    public void setSsl(boolean ssl) {
      this.ssl = ssl;
    }
  }

  public static class Producer {
    private String clientId;
    private String acks = "all";
    private boolean idempotenceEnabled = true;
    private String compressionType = "lz4";
    private int lingerMs = 5;
    private int deliveryTimeoutMs = 120000;
    private int requestTimeoutMs = 30000;
    private Duration partitionRefreshInterval = Duration.ofMinutes(5);
    private int topicPartitions = 1;
    private int topicReplicationFactor = 1;
    private Duration topicCreationTimeout = Duration.ofSeconds(30);

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public boolean isIdempotenceEnabled() {
      return idempotenceEnabled;
    }

    public void setIdempotenceEnabled(boolean idempotenceEnabled) {
      this.idempotenceEnabled = idempotenceEnabled;
    }

    public String getCompressionType() {
      return compressionType;
    }

    public void setCompressionType(String compressionType) {
      this.compressionType = compressionType;
    }

    public int getLingerMs() {
      return lingerMs;
    }

    public void setLingerMs(int lingerMs) {
      this.lingerMs = lingerMs;
    }

    public int getDeliveryTimeoutMs() {
      return deliveryTimeoutMs;
    }

    public void setDeliveryTimeoutMs(int deliveryTimeoutMs) {
      this.deliveryTimeoutMs = deliveryTimeoutMs;
    }

    public int getRequestTimeoutMs() {
      return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
    }

    public Duration getPartitionRefreshInterval() {
      return partitionRefreshInterval;
    }

    public void setPartitionRefreshInterval(Duration partitionRefreshInterval) {
      this.partitionRefreshInterval = partitionRefreshInterval;
    }

    public int getTopicPartitions() {
      return topicPartitions;
    }

    public void setTopicPartitions(int topicPartitions) {
      this.topicPartitions = topicPartitions;
    }

    public int getTopicReplicationFactor() {
      return topicReplicationFactor;
    }

    public void setTopicReplicationFactor(int topicReplicationFactor) {
      this.topicReplicationFactor = topicReplicationFactor;
    }

    public Duration getTopicCreationTimeout() {
      return topicCreationTimeout;
    }

    public void setTopicCreationTimeout(Duration topicCreationTimeout) {
      this.topicCreationTimeout = topicCreationTimeout;
    }
  }

  public static class Consumer {
    private String groupId;
    private String autoOffsetReset = "earliest";
    private int maxPollRecords = 500;
    private int maxPollIntervalMs = 300000;
    private int sessionTimeoutMs = 10000;
    private int heartbeatIntervalMs = 3000;
    private Duration pollTimeout = Duration.ofMillis(100);

    public String getGroupId() {
      return groupId;
    }

    public void setGroupId(String groupId) {
      this.groupId = groupId;
    }

    public String getAutoOffsetReset() {
      return autoOffsetReset;
    }

    public void setAutoOffsetReset(String autoOffsetReset) {
      this.autoOffsetReset = autoOffsetReset;
    }

    public int getMaxPollRecords() {
      return maxPollRecords;
    }

    public void setMaxPollRecords(int maxPollRecords) {
      this.maxPollRecords = maxPollRecords;
    }

    public int getMaxPollIntervalMs() {
      return maxPollIntervalMs;
    }

    public void setMaxPollIntervalMs(int maxPollIntervalMs) {
      this.maxPollIntervalMs = maxPollIntervalMs;
    }

    public int getSessionTimeoutMs() {
      return sessionTimeoutMs;
    }

    public void setSessionTimeoutMs(int sessionTimeoutMs) {
      this.sessionTimeoutMs = sessionTimeoutMs;
    }

    public int getHeartbeatIntervalMs() {
      return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(int heartbeatIntervalMs) {
      this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public Duration getPollTimeout() {
      return pollTimeout;
    }

    public void setPollTimeout(Duration pollTimeout) {
      this.pollTimeout = pollTimeout;
    }
  }

  /** Stream-level backoff and the process abort that follows its exhaustion. */
  public static class Supervision {
    private long initialBackoffMs = 500L;
    private long maxBackoffMs = 30000L;
    private double multiplier = 2.0d;
    private boolean jitterEnabled = true;
    private int maxAttempts = 10;
    private Duration abortGracePeriod = Duration.ofSeconds(1);
    private int abortExitStatus = 1;

    public long getInitialBackoffMs() {
      return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
      this.initialBackoffMs = initialBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public boolean isJitterEnabled() {
      return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
      this.jitterEnabled = jitterEnabled;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getAbortGracePeriod() {
      return abortGracePeriod;
    }

    public void setAbortGracePeriod(Duration abortGracePeriod) {
      this.abortGracePeriod = abortGracePeriod;
    }

    public int getAbortExitStatus() {
      return abortExitStatus;
    }

    public void setAbortExitStatus(int abortExitStatus) {
      this.abortExitStatus = abortExitStatus;
    }
  }

  public static class HandlerRetry {
    private String mode = "exponential";
    private int maxAttempts = 5;
    private long fixedBackoffMs = 1000L;
    private long initialBackoffMs = 100L;
    private long maxBackoffMs = 10000L;
    private double multiplier = 2.0d;
    private boolean jitterEnabled = true;

    public String getMode() {
      return mode;
    }

    public void setMode(String mode) {
      this.mode = mode;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getFixedBackoffMs() {
      return fixedBackoffMs;
    }

    public void setFixedBackoffMs(long fixedBackoffMs) {
      this.fixedBackoffMs = fixedBackoffMs;
    }

    public long getInitialBackoffMs() {
      return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
      this.initialBackoffMs = initialBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public boolean isJitterEnabled() {
      return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
      this.jitterEnabled = jitterEnabled;
    }
  }
}
