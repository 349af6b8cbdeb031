package com.agenthums.backend.auth.telemetry;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;

public class CredentialMetrics {

  private final MeterRegistry meterRegistry;

  public CredentialMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordSessionRefresh(String result, long durationNanos) {
    meterRegistry.counter("auth.session.refresh", "result", result).increment();
    meterRegistry
        .timer("auth.session.refresh.latency", "result", result)
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }

  public void recordSessionReconcile(String result) {
    meterRegistry.counter("auth.session.reconcile", "result", result).increment();
  }

  public void recordAuthOperation(String operation, String result) {
    meterRegistry.counter("auth.operation", "operation", operation, "result", result).increment();
  }

  public void recordProfileReconcile(String outcome) {
    meterRegistry.counter("profile.reconcile", "outcome", outcome).increment();
  }

  public void recordIntegrationRefresh(String serviceKind, String result, long durationNanos) {
    meterRegistry
        .counter("integration.token.refresh", "service", serviceKind, "result", result)
        .increment();
    meterRegistry
        .timer("integration.token.refresh.latency", "service", serviceKind, "result", result)
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }
}
