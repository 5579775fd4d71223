package com.agentgateway.backend.chat.session;

import com.agentgateway.backend.common.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class GatewayMetrics {

  private final MeterRegistry meterRegistry;
  private final Counter sessionsOpened;
  private final Counter sessionsRejected;
  private final Counter turnsCompleted;

  public GatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.sessionsOpened = meterRegistry.counter("gateway_sessions", "outcome", "opened");
    this.sessionsRejected = meterRegistry.counter("gateway_sessions", "outcome", "rejected");
    this.turnsCompleted = meterRegistry.counter("gateway_turns", "outcome", "success");
  }

  public void sessionOpened() {
    sessionsOpened.increment();
  }

  public void sessionRejected() {
    sessionsRejected.increment();
  }

  public void turnCompleted() {
    turnsCompleted.increment();
  }

  public void turnFailed(ErrorKind kind) {
    meterRegistry.counter("gateway_turns", "outcome", kind.name().toLowerCase(Locale.ROOT)).increment();
  }
}
