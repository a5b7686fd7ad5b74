package com.di.splitnova.util;

import com.di.splitnova.sampling.AdvisoryType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for sampling jobs and previews.
 */
@Slf4j
@Component
public class SamplingMetrics {

    private final Counter jobSuccessCounter;
    private final Counter jobErrorCounter;
    private final Timer jobTimer;
    private final DistributionSummary sampledRecords;
    private final DistributionSummary populationSize;
    private final Map<AdvisoryType, Counter> advisoryCounters = new EnumMap<>(AdvisoryType.class);

    public SamplingMetrics(MeterRegistry meterRegistry) {
        this.jobSuccessCounter = Counter.builder("sampling.jobs.total")
                .description("Total number of sampling jobs")
                .tag("status", "success")
                .register(meterRegistry);

        this.jobErrorCounter = Counter.builder("sampling.jobs.total")
                .description("Total number of failed sampling jobs")
                .tag("status", "error")
                .register(meterRegistry);

        this.jobTimer = Timer.builder("sampling.job.duration")
                .description("Wall-clock time of a sampling job")
                .register(meterRegistry);

        this.sampledRecords = DistributionSummary.builder("sampling.records.sampled")
                .description("Records emitted into target sets per job")
                .baseUnit("records")
                .register(meterRegistry);

        this.populationSize = DistributionSummary.builder("sampling.population.size")
                .description("Population size per job")
                .baseUnit("records")
                .register(meterRegistry);

        for (AdvisoryType type : AdvisoryType.values()) {
            advisoryCounters.put(type, Counter.builder("sampling.advisories.total")
                    .description("Advisories raised while refining thresholds")
                    .tag("type", type.name())
                    .register(meterRegistry));
        }
    }

    public void recordJobSuccess(long durationMs, long population, long sampled) {
        jobSuccessCounter.increment();
        jobTimer.record(durationMs, TimeUnit.MILLISECONDS);
        populationSize.record(population);
        sampledRecords.record(sampled);
        log.debug("Recorded sampling job: durationMs={}, population={}, sampled={}", durationMs, population, sampled);
    }

    public void recordJobFailure(long durationMs) {
        jobErrorCounter.increment();
        jobTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordAdvisory(AdvisoryType type, long count) {
        if (count > 0) {
            advisoryCounters.get(type).increment(count);
        }
    }
}
