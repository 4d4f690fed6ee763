package com.serviceruntime.infra.kafka.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.serviceruntime.infra.kafka.consumer.HaltingProcessTerminator;
import com.serviceruntime.infra.kafka.consumer.ProcessTerminator;
import com.serviceruntime.infra.kafka.consumer.RecordConsumers;
import com.serviceruntime.infra.kafka.errors.RetryPolicy;
import com.serviceruntime.infra.kafka.observability.KafkaTelemetry;
import com.serviceruntime.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.serviceruntime.infra.kafka.observability.NoOpKafkaTelemetry;
import com.serviceruntime.infra.kafka.producer.RecordProducers;
import com.serviceruntime.infra.kafka.serde.RecordObjectMapperFactory;
import com.serviceruntime.infra.kafka.topics.KafkaTopicAdministrator;
import com.serviceruntime.infra.kafka.topics.TopicAdministrator;
import com.serviceruntime.infra.kafka.triage.SeverityClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@AutoConfiguration
@EnableConfigurationProperties(InfraKafkaProperties.class)
public class InfraKafkaAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "kafkaRecordObjectMapper")
  public ObjectMapper kafkaRecordObjectMapper() {
    return RecordObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry micrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerKafkaTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry noOpKafkaTelemetry() {
    return new NoOpKafkaTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public SeverityClassifier severityClassifier() {
    return SeverityClassifier.defaults();
  }

  @Bean
  @ConditionalOnMissingBean(name = "handlerRetryPolicy")
  public RetryPolicy handlerRetryPolicy(InfraKafkaProperties properties) {
    return RetryPolicyFactory.handlerRetry(properties.getHandlerRetry());
  }

  @Bean
  @ConditionalOnMissingBean
  public ProcessTerminator processTerminator(InfraKafkaProperties properties) {
    InfraKafkaProperties.Supervision supervision = properties.getSupervision();
    return new HaltingProcessTerminator(
        supervision.getAbortGracePeriod(), supervision.getAbortExitStatus());
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaProducerFactory")
  public ProducerFactory<byte[], byte[]> infraKafkaProducerFactory(
      InfraKafkaProperties properties) {
    InfraKafkaProperties.Producer producer = properties.getProducer();

    Map<String, Object> config = properties.commonClientConfig();
    config.put(ProducerConfig.CLIENT_ID_CONFIG, properties.effectiveProducerClientId());
    config.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
    config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isIdempotenceEnabled());
    config.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompressionType());
    config.put(ProducerConfig.LINGER_MS_CONFIG, producer.getLingerMs());
    config.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, producer.getDeliveryTimeoutMs());
    config.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, producer.getRequestTimeoutMs());
    config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
    config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
    return new DefaultKafkaProducerFactory<>(config);
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaTemplate")
  public KafkaTemplate<byte[], byte[]> infraKafkaTemplate(
      @Qualifier("infraKafkaProducerFactory")
          ProducerFactory<byte[], byte[]> infraKafkaProducerFactory) {
    return new KafkaTemplate<>(infraKafkaProducerFactory);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(name = "infraKafkaAdmin")
  public Admin infraKafkaAdmin(InfraKafkaProperties properties) {
    return Admin.create(properties.commonClientConfig());
  }

  @Bean
  @ConditionalOnMissingBean
  public TopicAdministrator topicAdministrator(
      @Qualifier("infraKafkaAdmin") Admin infraKafkaAdmin, InfraKafkaProperties properties) {
    return new KafkaTopicAdministrator(
        infraKafkaAdmin, properties.getProducer().getTopicCreationTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public RecordProducers recordProducers(
      @Qualifier("infraKafkaTemplate") KafkaTemplate<byte[], byte[]> infraKafkaTemplate,
      TopicAdministrator topicAdministrator,
      KafkaTelemetry kafkaTelemetry,
      InfraKafkaProperties properties) {
    InfraKafkaProperties.Producer producer = properties.getProducer();
    RecordProducers.Settings settings =
        new RecordProducers.Settings(
            producer.getPartitionRefreshInterval(),
            Math.max(1, producer.getTopicPartitions()),
            (short) Math.max(1, producer.getTopicReplicationFactor()));
    return new RecordProducers(
        properties.getServiceName(),
        infraKafkaTemplate,
        topicAdministrator,
        kafkaTelemetry,
        settings);
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaConsumerFactory")
  public ConsumerFactory<byte[], byte[]> infraKafkaConsumerFactory(
      InfraKafkaProperties properties) {
    InfraKafkaProperties.Consumer consumer = properties.getConsumer();

    Map<String, Object> config = properties.commonClientConfig();
    config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumer.getAutoOffsetReset());
    config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, consumer.getMaxPollRecords());
    config.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, consumer.getMaxPollIntervalMs());
    config.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, consumer.getSessionTimeoutMs());
    config.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, consumer.getHeartbeatIntervalMs());
    config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
    config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
    return new DefaultKafkaConsumerFactory<>(config);
  }

  @Bean
  @ConditionalOnMissingBean
  public RecordConsumers recordConsumers(
      @Qualifier("infraKafkaConsumerFactory")
          ConsumerFactory<byte[], byte[]> infraKafkaConsumerFactory,
      @Qualifier("handlerRetryPolicy") RetryPolicy handlerRetryPolicy,
      SeverityClassifier severityClassifier,
      ProcessTerminator processTerminator,
      KafkaTelemetry kafkaTelemetry,
      InfraKafkaProperties properties) {
    return new RecordConsumers(
        properties.getServiceName(),
        properties.getConsumer().getGroupId(),
        infraKafkaConsumerFactory,
        properties.getConsumer().getPollTimeout(),
        RetryPolicyFactory.supervision(properties.getSupervision()),
        handlerRetryPolicy,
        severityClassifier,
        processTerminator,
        kafkaTelemetry);
  }
}
