package com.skillswap.matching.service;

import com.skillswap.matching.model.SeedOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class SkillSwapMetrics {

  private final MeterRegistry meterRegistry;
  private final DistributionSummary cohortSizeSummary;
  private final ConcurrentMap<String, Counter> interestCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> meetingTransitionCounters =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> seedOutcomeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> seedFailureCounters = new ConcurrentHashMap<>();

  public SkillSwapMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.cohortSizeSummary =
        DistributionSummary.builder("sw.seed.cohort.size")
            .description("Number of synthetic users generated for an owner")
            .register(meterRegistry);
  }

  public void recordInterest(String status) {
    interestCounters.computeIfAbsent(status, this::registerInterestCounter).increment();
  }

  public void recordMeetingTransition(String transition) {
    meetingTransitionCounters
        .computeIfAbsent(transition, this::registerMeetingTransitionCounter)
        .increment();
  }

  public void recordSeedOutcome(SeedOutcome outcome) {
    seedOutcomeCounters
        .computeIfAbsent(outcome.name().toLowerCase(Locale.ROOT), this::registerSeedOutcomeCounter)
        .increment();
  }

  public void recordCohortSize(int size) {
    if (size < 0) {
      return;
    }
    cohortSizeSummary.record(size);
  }

  public void recordSeedFailure(String trigger) {
    seedFailureCounters.computeIfAbsent(trigger, this::registerSeedFailureCounter).increment();
  }

  private Counter registerInterestCounter(String status) {
    return Counter.builder("sw.interest.total")
        .tags(Tags.of("status", status))
        .register(meterRegistry);
  }

  private Counter registerMeetingTransitionCounter(String transition) {
    return Counter.builder("sw.meeting.transition.total")
        .tags(Tags.of("transition", transition))
        .register(meterRegistry);
  }

  private Counter registerSeedOutcomeCounter(String outcome) {
    return Counter.builder("sw.seed.total")
        .tags(Tags.of("outcome", outcome))
        .register(meterRegistry);
  }

  private Counter registerSeedFailureCounter(String trigger) {
    return Counter.builder("sw.seed.failure.total")
        .tags(Tags.of("trigger", trigger))
        .register(meterRegistry);
  }
}
