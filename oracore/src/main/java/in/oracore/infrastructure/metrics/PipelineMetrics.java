package in.oracore.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus metrics for the detection and labeling pipelines.
 *
 * Key Metrics:
 * - oracore_bars_ingested_total{timeframe} - Provider bars stored
 * - oracore_bars_aggregated_total{timeframe} - Aggregate bars written
 * - oracore_signals_emitted_total{detector} - New signals
 * - oracore_detector_failures_total{detector, reason} - Detector errors and timeouts
 * - oracore_outcomes_computed_total{horizon} - Outcome rows written
 * - oracore_outcomes_pending_total / oracore_outcomes_skipped_total - Deferred and gap-skipped horizons
 * - oracore_baselines_written_total - Negative samples written
 * - oracore_provider_retries_total - Provider retries after transient failures
 * - oracore_stream_failures_total - Streams that failed a cycle
 * - oracore_cycle_duration_seconds - Detection cycle latency
 * - oracore_last_cycle_signals - Signals emitted by the most recent cycle
 *
 * Tests pass their own {@link CollectorRegistry} so collectors do not clash.
 */
public final class PipelineMetrics {

    private final CollectorRegistry registry;

    private final Counter barsIngested;
    private final Counter barsAggregated;
    private final Counter signalsEmitted;
    private final Counter detectorFailures;
    private final Counter outcomesComputed;
    private final Counter outcomesPending;
    private final Counter outcomesSkipped;
    private final Counter baselinesWritten;
    private final Counter providerRetries;
    private final Counter streamFailures;
    private final Histogram cycleDuration;
    private final Gauge lastCycleSignals;

    public PipelineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PipelineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.barsIngested = Counter.build()
            .name("oracore_bars_ingested_total")
            .help("Provider bars stored")
            .labelNames("timeframe")
            .register(registry);

        this.barsAggregated = Counter.build()
            .name("oracore_bars_aggregated_total")
            .help("Aggregate bars written")
            .labelNames("timeframe")
            .register(registry);

        this.signalsEmitted = Counter.build()
            .name("oracore_signals_emitted_total")
            .help("Signals newly recorded")
            .labelNames("detector")
            .register(registry);

        this.detectorFailures = Counter.build()
            .name("oracore_detector_failures_total")
            .help("Detector evaluations that threw or timed out")
            .labelNames("detector", "reason")
            .register(registry);

        this.outcomesComputed = Counter.build()
            .name("oracore_outcomes_computed_total")
            .help("Outcome rows written")
            .labelNames("horizon")
            .register(registry);

        this.outcomesPending = Counter.build()
            .name("oracore_outcomes_pending_total")
            .help("Horizon labels deferred because the window is incomplete")
            .register(registry);

        this.outcomesSkipped = Counter.build()
            .name("oracore_outcomes_skipped_total")
            .help("Horizon labels skipped because of a permanent data gap")
            .register(registry);

        this.baselinesWritten = Counter.build()
            .name("oracore_baselines_written_total")
            .help("Baseline samples written")
            .register(registry);

        this.providerRetries = Counter.build()
            .name("oracore_provider_retries_total")
            .help("Provider calls retried after a transient failure")
            .register(registry);

        this.streamFailures = Counter.build()
            .name("oracore_stream_failures_total")
            .help("Streams marked failed for a cycle")
            .register(registry);

        this.cycleDuration = Histogram.build()
            .name("oracore_cycle_duration_seconds")
            .help("Detection cycle duration in seconds")
            .buckets(0.1, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0, 60.0, 120.0)
            .register(registry);

        this.lastCycleSignals = Gauge.build()
            .name("oracore_last_cycle_signals")
            .help("Signals emitted by the most recent detection cycle")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    public void recordBarsIngested(String timeframe, int count) {
        barsIngested.labels(timeframe).inc(count);
    }

    public void recordBarsAggregated(String timeframe, int count) {
        barsAggregated.labels(timeframe).inc(count);
    }

    public void recordSignalEmitted(String detectorKey) {
        signalsEmitted.labels(detectorKey).inc();
    }

    public void recordDetectorFailure(String detectorKey, String reason) {
        detectorFailures.labels(detectorKey, reason).inc();
    }

    public void recordOutcomeComputed(String horizon) {
        outcomesComputed.labels(horizon).inc();
    }

    public void recordOutcomePending() {
        outcomesPending.inc();
    }

    public void recordOutcomeSkipped() {
        outcomesSkipped.inc();
    }

    public void recordBaselinesWritten(int count) {
        baselinesWritten.inc(count);
    }

    public void recordProviderRetry() {
        providerRetries.inc();
    }

    public void recordStreamFailure() {
        streamFailures.inc();
    }

    public void recordCycle(Duration duration, int signals) {
        cycleDuration.observe(duration.toMillis() / 1000.0);
        lastCycleSignals.set(signals);
    }
}
