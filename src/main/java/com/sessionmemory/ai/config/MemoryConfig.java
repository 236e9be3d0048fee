package com.sessionmemory.ai.config;

import com.sessionmemory.ai.memory.LengthRetentionPolicy;
import com.sessionmemory.ai.memory.MemorySettings;
import com.sessionmemory.ai.memory.RetentionPolicy;
import com.sessionmemory.ai.memory.SessionIdValidator;
import com.sessionmemory.ai.memory.SessionMemoryManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MemoryConfig {

  private static final Logger log = LoggerFactory.getLogger(MemoryConfig.class);

  @Bean
  public MemorySettings memorySettings(
      @Value("${app.memory.long-term-capacity:5}") int longTermCapacity,
      @Value("${app.memory.retention-threshold-chars:20}") int retentionThresholdChars,
      @Value("${app.memory.short-term-max-turns:0}") int shortTermMaxTurns,
      @Value("${app.memory.retain-assistant-responses:false}") boolean retainAssistantResponses,
      @Value("${app.memory.lock-timeout:PT2S}") Duration lockTimeout) {
    return new MemorySettings(
        longTermCapacity, retentionThresholdChars, shortTermMaxTurns, retainAssistantResponses, lockTimeout);
  }

  @Bean
  public SessionIdValidator sessionIdValidator(
      @Value("${app.memory.session-id-max-length:128}") int maxLength) {
    return SessionIdValidator.maxLength(maxLength);
  }

  /**
   * A {@link RetentionPolicy} bean declared anywhere in the context replaces the
   * length baseline built from {@code app.memory.retention-threshold-chars}.
   */
  @Bean
  public SessionMemoryManager sessionMemoryManager(
      MemorySettings settings,
      ObjectProvider<RetentionPolicy> retentionPolicies,
      SessionIdValidator sessionIdValidator,
      MeterRegistry meterRegistry) {
    RetentionPolicy retentionPolicy = retentionPolicies.getIfAvailable(
        () -> new LengthRetentionPolicy(settings.retentionThresholdChars()));
    SessionMemoryManager manager =
        new SessionMemoryManager(settings, retentionPolicy, sessionIdValidator, Clock.systemUTC());
    Gauge.builder("memory.sessions.active", manager, SessionMemoryManager::sessionCount)
        .description("Live sessions held in memory")
        .register(meterRegistry);
    log.info("Session memory configured {} policy={}", settings, retentionPolicy);
    return manager;
  }
}
