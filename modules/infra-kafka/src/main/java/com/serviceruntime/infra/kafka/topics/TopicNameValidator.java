package com.serviceruntime.infra.kafka.topics;

import java.util.regex.Pattern;

public final class TopicNameValidator {
  private static final int MAX_LENGTH = 249;
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+$");

  private TopicNameValidator() {}

  public static void assertValid(String topicName) {
    if (!isValid(topicName)) {
      throw new IllegalArgumentException("Invalid topic name: " + topicName);
    }
  }

  public static boolean isValid(String topicName) {
    return topicName != null
        && !topicName.isEmpty()
        && topicName.length() <= MAX_LENGTH
        && !".".equals(topicName)
        && !"..".equals(topicName)
        && TOPIC_PATTERN.matcher(topicName).matches();
  }
}
