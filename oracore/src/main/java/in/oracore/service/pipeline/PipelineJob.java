package in.oracore.service.pipeline;

import in.oracore.domain.data.Timeframe;
import in.oracore.service.baseline.BaselineSampler;
import in.oracore.service.outcome.LabelSweepResult;
import in.oracore.service.outcome.OutcomeLabeler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One-shot run: detection cycle, then a labeling sweep, then baseline sampling.
 *
 * Labeling and sampling read only stored data, so they run after detection has written the
 * cycle's bars and signals. Any failed stream turns the run into a partial failure.
 */
public final class PipelineJob {
    private static final Logger log = LoggerFactory.getLogger(PipelineJob.class);

    private final DetectionPipeline pipeline;
    private final OutcomeLabeler labeler;
    private final BaselineSampler sampler;
    private final List<String> watchlist;
    private final List<Timeframe> timeframes;
    private final Duration labelLookback;
    private final Duration baselineWindow;
    private final Clock clock;

    /**
     * @param sampler null disables baseline sampling
     */
    public PipelineJob(DetectionPipeline pipeline, OutcomeLabeler labeler, BaselineSampler sampler,
                       List<String> watchlist, List<Timeframe> timeframes,
                       Duration labelLookback, Duration baselineWindow, Clock clock) {
        this.pipeline = pipeline;
        this.labeler = labeler;
        this.sampler = sampler;
        this.watchlist = List.copyOf(watchlist);
        this.timeframes = List.copyOf(timeframes);
        this.labelLookback = labelLookback;
        this.baselineWindow = baselineWindow;
        this.clock = clock;
    }

    public JobReport run() {
        CycleSummary cycle = pipeline.runCycle();

        LabelSweepResult labels = labeler.sweep(clock.instant().minus(labelLookback));

        int written = 0;
        int errors = 0;
        if (sampler != null) {
            Instant to = clock.instant();
            Instant from = to.minus(baselineWindow);
            for (String symbol : watchlist) {
                for (Timeframe timeframe : timeframes) {
                    try {
                        written += sampler.sample(symbol, timeframe, from, to).size();
                    } catch (RuntimeException e) {
                        errors++;
                        log.error("Baseline sampling failed for {} {}: {}", symbol, timeframe, e.getMessage(), e);
                    }
                }
            }
        }

        RunStatus status = cycle.status() == RunStatus.SUCCESS && errors == 0
            ? RunStatus.SUCCESS
            : RunStatus.PARTIAL_FAILURE;

        log.info("Job finished: status={} signals={} outcomes={} pending={} skipped={} baselines={}",
            status, cycle.signals().size(), labels.computed(), labels.pending().size(),
            labels.skipped().size(), written);
        return new JobReport(cycle, labels, written, errors, status);
    }
}
