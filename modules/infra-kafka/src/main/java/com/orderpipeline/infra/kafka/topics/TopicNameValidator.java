package com.orderpipeline.infra.kafka.topics;

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
    if (topicName == null || topicName.isEmpty() || topicName.length() > MAX_LENGTH) {
      return false;
    }
    if (".".equals(topicName) || "..".equals(topicName)) {
      return false;
    }
    return TOPIC_PATTERN.matcher(topicName).matches();
  }
}
