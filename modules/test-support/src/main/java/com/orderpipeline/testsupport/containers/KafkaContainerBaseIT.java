package com.orderpipeline.testsupport.containers;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.kafka.KafkaContainer;
import org.testcontainers.utility.DockerImageName;

@Testcontainers
public abstract class KafkaContainerBaseIT {
  @Container
  protected static final KafkaContainer kafka =
      new KafkaContainer(DockerImageName.parse("apache/kafka:3.8.1"));

  @DynamicPropertySource
  static void kafkaProperties(DynamicPropertyRegistry registry) {
    registry.add("infra.kafka.bootstrap-servers", kafka::getBootstrapServers);
    registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
  }

  protected static String bootstrapServers() {
    return kafka.getBootstrapServers();
  }
}
