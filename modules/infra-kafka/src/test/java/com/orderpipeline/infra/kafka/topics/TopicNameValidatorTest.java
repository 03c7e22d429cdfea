package com.orderpipeline.infra.kafka.topics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TopicNameValidatorTest {
  @Test
  void shouldValidateAllKnownTopics() {
    for (String topic : TopicNames.all()) {
      assertDoesNotThrow(() -> TopicNameValidator.assertValid(topic));
      assertTrue(TopicNameValidator.isValid(topic));
    }
  }

  @Test
  void shouldRejectInvalidTopicNames() {
    assertFalse(TopicNameValidator.isValid(""));
    assertFalse(TopicNameValidator.isValid(null));
    assertFalse(TopicNameValidator.isValid("."));
    assertFalse(TopicNameValidator.isValid(".."));
    assertFalse(TopicNameValidator.isValid("orders retry"));
    assertFalse(TopicNameValidator.isValid("orders/dlq"));
    assertFalse(TopicNameValidator.isValid("o".repeat(250)));
    assertTrue(TopicNameValidator.isValid("o".repeat(249)));
    assertThrows(IllegalArgumentException.class, () -> TopicNameValidator.assertValid("a:b"));
  }

  @Test
  void shouldMapChannelsToTopics() {
    assertEquals("orders", Channel.PRIMARY.topic());
    assertEquals("orders-retry", Channel.RETRY.topic());
    assertEquals("orders-dlq", Channel.DEAD_LETTER.topic());
  }
}
