package com.orderpipeline.emitter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "emitter")
public class EmitterProperties {
  private boolean enabled = true;
  private long intervalMs = 2_000L;
  private long startSequence = 1001L;
  private Long seed;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public long getIntervalMs() {
    return intervalMs;
  }

  public void setIntervalMs(long intervalMs) {
    this.intervalMs = intervalMs;
  }

  public long getStartSequence() {
    return startSequence;
  }

  public void setStartSequence(long startSequence) {
    this.startSequence = startSequence;
  }

  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }
}
