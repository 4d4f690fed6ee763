package com.serviceruntime.infra.kafka.consumer;

import com.serviceruntime.infra.kafka.errors.KafkaReceiveException;
import com.serviceruntime.infra.kafka.serde.MessageType;
import com.serviceruntime.infra.kafka.serde.RecordCodec;
import com.serviceruntime.infra.kafka.serde.RecordCodecException;
import com.serviceruntime.infra.kafka.topics.TopicNameValidator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/** {@link MessageGroup} backed by a static topic to decoder table. */
public final class TopicRoutedMessageGroup<G> implements MessageGroup<G> {
  private final String groupName;
  private final Map<String, Route<? extends G>> routes;

  private TopicRoutedMessageGroup(String groupName, Map<String, Route<? extends G>> routes) {
    this.groupName = groupName;
    this.routes = Map.copyOf(routes);
  }

  public static <G> Builder<G> builder(String groupName) {
    return new Builder<>(groupName);
  }

  @Override
  public List<String> topics() {
    return List.copyOf(routes.keySet());
  }

  @Override
  public G decode(String topic, byte[] key, byte[] payload) {
    Route<? extends G> route = topic == null ? null : routes.get(topic);
    if (route == null) {
      throw KafkaReceiveException.badTopic(topic);
    }
    return route.decode(topic, key, payload);
  }

  @Override
  public String groupName() {
    return groupName;
  }

  @FunctionalInterface
  private interface Route<G> {
    G decode(String topic, byte[] key, byte[] payload);
  }

  public static final class Builder<G> {
    private final String groupName;
    private final Map<String, Route<? extends G>> routes = new LinkedHashMap<>();

    private Builder(String groupName) {
      if (groupName == null || groupName.isBlank()) {
        throw new IllegalArgumentException("groupName must not be blank");
      }
      this.groupName = groupName;
    }

    /** Records on {@code topic} must carry both key and payload. */
    public <K, V> Builder<G> route(
        String topic, MessageType<K, V> messageType, BiFunction<K, V, ? extends G> mapper) {
      Objects.requireNonNull(messageType, "messageType must not be null");
      Objects.requireNonNull(mapper, "mapper must not be null");
      return add(
          topic,
          (recordTopic, key, payload) -> {
            if (key == null) {
              throw KafkaReceiveException.missingKey(recordTopic);
            }
            if (payload == null) {
              throw KafkaReceiveException.missingPayload(recordTopic);
            }
            K decodedKey = decodePart(recordTopic, messageType.keyCodec(), key);
            V decodedPayload = decodePart(recordTopic, messageType.payloadCodec(), payload);
            return mapper.apply(decodedKey, decodedPayload);
          });
    }

    /** Records on {@code topic} must carry a payload; the key is ignored. */
    public <V> Builder<G> routePayload(
        String topic, RecordCodec<V> payloadCodec, Function<V, ? extends G> mapper) {
      Objects.requireNonNull(payloadCodec, "payloadCodec must not be null");
      Objects.requireNonNull(mapper, "mapper must not be null");
      return add(
          topic,
          (recordTopic, key, payload) -> {
            if (payload == null) {
              throw KafkaReceiveException.missingPayload(recordTopic);
            }
            return mapper.apply(decodePart(recordTopic, payloadCodec, payload));
          });
    }

    public TopicRoutedMessageGroup<G> build() {
      if (routes.isEmpty()) {
        throw new IllegalStateException("Message group " + groupName + " declares no topics");
      }
      return new TopicRoutedMessageGroup<>(groupName, routes);
    }

    private Builder<G> add(String topic, Route<? extends G> route) {
      TopicNameValidator.assertValid(topic);
      if (routes.putIfAbsent(topic, route) != null) {
        throw new IllegalArgumentException("Topic already routed: " + topic);
      }
      return this;
    }

    private static <T> T decodePart(String topic, RecordCodec<T> codec, byte[] bytes) {
      try {
        return codec.decode(bytes);
      } catch (RecordCodecException ex) {
        throw KafkaReceiveException.decode(topic, ex);
      }
    }
  }
}
