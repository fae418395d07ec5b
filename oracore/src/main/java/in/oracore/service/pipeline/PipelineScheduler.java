package in.oracore.service.pipeline;

import in.oracore.domain.data.Timeframe;
import in.oracore.service.baseline.BaselineSampler;
import in.oracore.service.outcome.OutcomeLabeler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Service-mode scheduling. Detection cycles and labeling sweeps run on separate threads at
 * their own intervals; baseline sampling follows each labeling sweep.
 */
public final class PipelineScheduler {
    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final DetectionPipeline pipeline;
    private final OutcomeLabeler labeler;
    private final BaselineSampler sampler;
    private final List<String> watchlist;
    private final List<Timeframe> timeframes;
    private final Duration cycleInterval;
    private final Duration labelInterval;
    private final Duration labelLookback;
    private final Duration baselineWindow;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final AtomicReference<CycleSummary> lastCycle = new AtomicReference<>();

    /**
     * @param sampler null disables baseline sampling
     */
    public PipelineScheduler(DetectionPipeline pipeline, OutcomeLabeler labeler, BaselineSampler sampler,
                             List<String> watchlist, List<Timeframe> timeframes,
                             Duration cycleInterval, Duration labelInterval,
                             Duration labelLookback, Duration baselineWindow, Clock clock) {
        this.pipeline = pipeline;
        this.labeler = labeler;
        this.sampler = sampler;
        this.watchlist = List.copyOf(watchlist);
        this.timeframes = List.copyOf(timeframes);
        this.cycleInterval = cycleInterval;
        this.labelInterval = labelInterval;
        this.labelLookback = labelLookback;
        this.baselineWindow = baselineWindow;
        this.clock = clock;
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "pipeline-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        log.info("Starting pipeline scheduler (cycle every {}s, labeling every {}s)",
            cycleInterval.toSeconds(), labelInterval.toSeconds());

        scheduler.scheduleWithFixedDelay(this::runCycle, 0, cycleInterval.toMillis(), TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::runLabeling, labelInterval.toMillis(), labelInterval.toMillis(),
            TimeUnit.MILLISECONDS);
    }

    public Optional<CycleSummary> lastCycle() {
        return Optional.ofNullable(lastCycle.get());
    }

    void runCycle() {
        try {
            lastCycle.set(pipeline.runCycle());
        } catch (RuntimeException e) {
            log.error("Detection cycle failed: {}", e.getMessage(), e);
        }
    }

    void runLabeling() {
        try {
            labeler.sweep(clock.instant().minus(labelLookback));
        } catch (RuntimeException e) {
            log.error("Labeling sweep failed: {}", e.getMessage(), e);
        }
        if (sampler == null) {
            return;
        }

        Instant to = clock.instant();
        Instant from = to.minus(baselineWindow);
        for (String symbol : watchlist) {
            for (Timeframe timeframe : timeframes) {
                try {
                    sampler.sample(symbol, timeframe, from, to);
                } catch (RuntimeException e) {
                    log.error("Baseline sampling failed for {} {}: {}", symbol, timeframe, e.getMessage(), e);
                }
            }
        }
    }

    public void stop() {
        log.info("Stopping pipeline scheduler...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            log.info("✓ Pipeline scheduler stopped");
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
