package com.orderpipeline.worker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "worker")
public class WorkerProperties {
  private Processing processing = new Processing();
  private Report report = new Report();
  private Shutdown shutdown = new Shutdown();

  public Processing getProcessing() {
    return processing;
  }

  public void setProcessing(Processing processing) {
    this.processing = processing;
  }

  public Report getReport() {
    return report;
  }

  public void setReport(Report report) {
    this.report = report;
  }

  public Shutdown getShutdown() {
    return shutdown;
  }

  public void setShutdown(Shutdown shutdown) {
    this.shutdown = shutdown;
  }

  public static class Processing {
    private double failureProbability = 0.2d;

    public double getFailureProbability() {
      return failureProbability;
    }

    public void setFailureProbability(double failureProbability) {
      this.failureProbability = failureProbability;
    }
  }

  public static class Report {
    private boolean enabled = true;
    private long intervalMs = 30_000L;

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
  }

  public static class Shutdown {
    private long retryDrainTimeoutMs = 10_000L;

    public long getRetryDrainTimeoutMs() {
      return retryDrainTimeoutMs;
    }

    public void setRetryDrainTimeoutMs(long retryDrainTimeoutMs) {
      this.retryDrainTimeoutMs = retryDrainTimeoutMs;
    }
  }
}
