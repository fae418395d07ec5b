package in.oracore.service.outcome;

import in.oracore.domain.common.DataGapException;
import in.oracore.domain.common.LabelPendingException;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.StreamKey;
import in.oracore.domain.outcome.HitPriority;
import in.oracore.domain.outcome.Horizon;
import in.oracore.domain.outcome.Outcome;
import in.oracore.domain.outcome.OutcomeThresholds;
import in.oracore.domain.signal.Signal;
import in.oracore.infrastructure.metrics.PipelineMetrics;
import in.oracore.repository.OutcomeRepository;
import in.oracore.service.candle.CandleStore;
import in.oracore.service.signal.SignalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome Labeler - writes forward performance labels for recorded signals.
 *
 * Only bars in {@code (firedAt, firedAt + bars * width]} are read for a label. A horizon whose
 * window is incomplete is deferred; one whose missing bars can no longer arrive is skipped.
 * Rows are insert-only per (signal, horizon, label version).
 */
public final class OutcomeLabeler {
    private static final Logger log = LoggerFactory.getLogger(OutcomeLabeler.class);

    private final SignalStore signalStore;
    private final CandleStore candleStore;
    private final OutcomeRepository outcomeRepo;
    private final PipelineMetrics metrics;
    private final List<Horizon> horizons;
    private final OutcomeThresholds thresholds;
    private final HitPriority priority;
    private final int labelVersion;
    private final Clock clock;

    public OutcomeLabeler(SignalStore signalStore, CandleStore candleStore, OutcomeRepository outcomeRepo,
                          PipelineMetrics metrics, List<Horizon> horizons, OutcomeThresholds thresholds,
                          HitPriority priority, int labelVersion, Clock clock) {
        this.signalStore = signalStore;
        this.candleStore = candleStore;
        this.outcomeRepo = outcomeRepo;
        this.metrics = metrics;
        this.horizons = List.copyOf(horizons);
        this.thresholds = thresholds;
        this.priority = priority;
        this.labelVersion = labelVersion;
        this.clock = clock;
    }

    /**
     * Label every unlabeled (signal, horizon) pair for signals fired at or after {@code since}.
     * Stops between signals when the thread is interrupted.
     */
    public LabelSweepResult sweep(Instant since) {
        List<Signal> signals = signalStore.findSince(since);
        List<String> pending = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int computed = 0;
        int scanned = 0;
        boolean cancelled = false;

        for (Signal signal : signals) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Label sweep interrupted after {} of {} signals", scanned, signals.size());
                cancelled = true;
                break;
            }
            scanned++;

            for (Horizon horizon : horizons) {
                String label = signal.id() + "/" + horizon;
                if (horizon.timeframe().isFinerThan(signal.timeframe())) {
                    skipped.add(label + ": horizon finer than signal timeframe " + signal.timeframe());
                    continue;
                }
                if (outcomeRepo.exists(signal.id(), horizon, labelVersion)) {
                    continue;
                }

                try {
                    Outcome outcome = label(signal, horizon);
                    if (outcomeRepo.insertIfAbsent(outcome)) {
                        computed++;
                        metrics.recordOutcomeComputed(horizon.code());
                    }
                } catch (LabelPendingException e) {
                    pending.add(label);
                    metrics.recordOutcomePending();
                    log.debug("{}", e.getMessage());
                } catch (DataGapException e) {
                    skipped.add(label + ": " + e.getMessage());
                    metrics.recordOutcomeSkipped();
                    log.warn("Skipping outcome {}: {}", label, e.getMessage());
                }
            }
        }

        LabelSweepResult result = new LabelSweepResult(scanned, computed, pending, skipped, cancelled);
        log.info("Label sweep v{}: scanned={} computed={} pending={} skipped={}{}", labelVersion,
            scanned, computed, pending.size(), skipped.size(), cancelled ? " (cancelled)" : "");
        return result;
    }

    /**
     * Compute the outcome of one signal over one horizon.
     *
     * @throws LabelPendingException when the window is not complete yet
     * @throws DataGapException      when expected bars are missing and later bars already exist
     */
    public Outcome label(Signal signal, Horizon horizon) {
        Instant firedAt = signal.firedAt();
        Instant targetEnd = horizon.targetEnd(firedAt);
        List<Instant> expected = horizon.expectedBarTimes(firedAt);

        List<Candle> window = candleStore.getRange(signal.symbol(), horizon.timeframe(), firedAt, targetEnd);
        Map<Instant, Candle> byTs = new HashMap<>();
        for (Candle bar : window) {
            byTs.put(bar.timestamp(), bar);
        }

        List<Instant> missing = new ArrayList<>();
        for (Instant ts : expected) {
            if (!byTs.containsKey(ts)) {
                missing.add(ts);
            }
        }

        Instant lastExpectedClose = expected.get(expected.size() - 1).plus(horizon.timeframe().width());
        boolean closed = !lastExpectedClose.isAfter(clock.instant());

        if (missing.isEmpty() && closed) {
            return OutcomeCalculator.compute(signal, horizon, window, thresholds, priority, labelVersion, clock.instant());
        }

        if (!missing.isEmpty() && candleStore.hasBarAfter(signal.symbol(), horizon.timeframe(), targetEnd)) {
            throw new DataGapException(new StreamKey(signal.symbol(), horizon.timeframe()), missing,
                "signal " + signal.id() + " horizon " + horizon);
        }
        throw new LabelPendingException(signal.id(), horizon, expected.size() - missing.size(), expected.size());
    }
}
