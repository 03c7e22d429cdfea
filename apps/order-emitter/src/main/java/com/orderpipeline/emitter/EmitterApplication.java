package com.orderpipeline.emitter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EmitterApplication {
  public static void main(String[] args) {
    SpringApplication.run(EmitterApplication.class, args);
  }
}
