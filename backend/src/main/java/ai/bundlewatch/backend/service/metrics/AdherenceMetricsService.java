package ai.bundlewatch.backend.service.metrics;

import ai.bundlewatch.backend.model.entity.ElementStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for evaluation cycles and deviation emission.
 */
@Slf4j
@Service
public class AdherenceMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter cyclesCounter;
    private final Counter episodesEvaluatedCounter;
    private final Counter evaluationFailuresCounter;
    private final Counter deviationsEmittedCounter;
    private final Counter deviationsSuppressedCounter;
    private final Counter deviationFailuresCounter;
    private final Counter ledgerWriteFailuresCounter;
    private final Timer cycleTimer;

    @Autowired
    public AdherenceMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.cyclesCounter = Counter.builder("adherence_cycles_total")
                .description("Evaluation cycles run")
                .register(meterRegistry);
        this.episodesEvaluatedCounter = Counter.builder("adherence_episodes_evaluated_total")
                .description("Episodes evaluated successfully")
                .register(meterRegistry);
        this.evaluationFailuresCounter = Counter.builder("adherence_episode_failures_total")
                .description("Episodes whose evaluation threw")
                .register(meterRegistry);
        this.deviationsEmittedCounter = Counter.builder("adherence_deviations_emitted_total")
                .description("Deviation alerts saved to the alert sink")
                .register(meterRegistry);
        this.deviationsSuppressedCounter = Counter.builder("adherence_deviations_suppressed_total")
                .description("Deviations suppressed as already alerted")
                .register(meterRegistry);
        this.deviationFailuresCounter = Counter.builder("adherence_deviation_failures_total")
                .description("Deviations whose alert could not be saved, retried next cycle")
                .register(meterRegistry);
        this.ledgerWriteFailuresCounter = Counter.builder("adherence_ledger_write_failures_total")
                .description("Failed writes to a durable dedup tier")
                .register(meterRegistry);
        this.cycleTimer = Timer.builder("adherence_cycle_duration_seconds")
                .description("Wall time of one evaluation cycle")
                .register(meterRegistry);
        log.info("AdherenceMetricsService initialized");
    }

    public void recordCycle(Duration duration) {
        cyclesCounter.increment();
        cycleTimer.record(duration);
    }

    public void recordEpisodeEvaluated() {
        episodesEvaluatedCounter.increment();
    }

    public void recordEpisodeFailure() {
        evaluationFailuresCounter.increment();
    }

    public void recordTransition(String bundleId, ElementStatus status) {
        Counter.builder("adherence_element_transitions_total")
                .description("Element status transitions")
                .tag("bundle", bundleId)
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordDeviationEmitted() {
        deviationsEmittedCounter.increment();
    }

    public void recordDeviationSuppressed() {
        deviationsSuppressedCounter.increment();
    }

    public void recordDeviationFailure() {
        deviationFailuresCounter.increment();
    }

    public void recordLedgerWriteFailure() {
        ledgerWriteFailuresCounter.increment();
    }
}
