package com.flamingo.ai.devicerag.config;

import com.flamingo.ai.devicerag.service.generation.GovernorClock;
import com.flamingo.ai.devicerag.service.generation.RateGovernor;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the shared rate governor and the clocks used by services. */
@Configuration
@Slf4j
public class GenerationConfig {

  @Bean
  public GovernorClock governorClock() {
    return GovernorClock.SYSTEM;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** The single process-wide governor; every external call site receives this instance. */
  @Bean
  public RateGovernor rateGovernor(
      RagConfig ragConfig, GovernorClock governorClock, MeterRegistry meterRegistry) {
    RagConfig.Generation generation = ragConfig.getGeneration();
    DistributionSummary inFlight =
        DistributionSummary.builder("governor.in_flight_at_start")
            .description("Calls in flight when a governed call starts")
            .register(meterRegistry);
    RateGovernor governor =
        new RateGovernor(
            generation.getMaxConcurrent(),
            generation.getMinDelayBetweenCalls(),
            governorClock,
            (startNanos, count) -> inFlight.record(count));
    meterRegistry.gauge("governor.in_flight", governor, RateGovernor::inFlight);
    log.info(
        "Rate governor: max {} concurrent calls, {} between starts",
        generation.getMaxConcurrent(),
        generation.getMinDelayBetweenCalls());
    return governor;
  }
}
