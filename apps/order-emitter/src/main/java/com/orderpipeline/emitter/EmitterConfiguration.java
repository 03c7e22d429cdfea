package com.orderpipeline.emitter;

import java.time.Clock;
import java.util.Random;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EmitterConfiguration {
  @Bean
  public OrderGenerator orderGenerator(EmitterProperties properties) {
    Random random = properties.getSeed() == null ? new Random() : new Random(properties.getSeed());
    return new OrderGenerator(random);
  }

  @Bean
  public Clock emitterClock() {
    return Clock.systemUTC();
  }
}
