package in.oracore.service.baseline;

import in.oracore.domain.baseline.Baseline;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Timeframe;
import in.oracore.infrastructure.metrics.PipelineMetrics;
import in.oracore.repository.BaselineRepository;
import in.oracore.service.candle.CandleStore;
import in.oracore.service.indicator.IndicatorSettings;
import in.oracore.service.indicator.IndicatorSnapshot;
import in.oracore.service.indicator.IndicatorState;
import in.oracore.service.signal.SignalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * Baseline Sampler - draws negative samples from bars where no detector fired.
 *
 * Replays the stream through a private indicator state so sampling never disturbs the live
 * detection state. Selection is driven by a {@link Random} seeded from (seed, symbol,
 * timeframe), so re-running over the same stored bars picks the same timestamps. Bars that
 * detection has not reached yet are left for a later call, since they may still fire.
 */
public final class BaselineSampler {
    private static final Logger log = LoggerFactory.getLogger(BaselineSampler.class);

    private final CandleStore candleStore;
    private final SignalStore signalStore;
    private final BaselineRepository baselineRepo;
    private final PipelineMetrics metrics;
    private final IndicatorSettings indicatorSettings;
    private final double samplingRate;
    private final int minSpacingBars;
    private final long seed;
    private final int labelVersion;
    private final DetectionProgress progress;
    private final Clock clock;

    public BaselineSampler(CandleStore candleStore, SignalStore signalStore, BaselineRepository baselineRepo,
                           PipelineMetrics metrics, IndicatorSettings indicatorSettings,
                           double samplingRate, int minSpacingBars, long seed, int labelVersion,
                           DetectionProgress progress, Clock clock) {
        if (samplingRate < 0 || samplingRate > 1) {
            throw new IllegalArgumentException("samplingRate must be in [0, 1]: " + samplingRate);
        }
        if (minSpacingBars < 0) {
            throw new IllegalArgumentException("minSpacingBars must be >= 0: " + minSpacingBars);
        }
        this.candleStore = candleStore;
        this.signalStore = signalStore;
        this.baselineRepo = baselineRepo;
        this.metrics = metrics;
        this.indicatorSettings = indicatorSettings;
        this.samplingRate = samplingRate;
        this.minSpacingBars = minSpacingBars;
        this.seed = seed;
        this.labelVersion = labelVersion;
        this.progress = progress;
        this.clock = clock;
    }

    /**
     * Sample baselines for bars with {@code from <= ts < to}, cut short at the stream's
     * detection frontier.
     *
     * @return baselines written by this call
     */
    public List<Baseline> sample(String symbol, Timeframe timeframe, Instant from, Instant requestedTo) {
        // Read the frontier before the fired set so every bar below it has its signals visible
        Instant frontier = progress.detectionFrontier(symbol, timeframe);
        Instant to = frontier.isBefore(requestedTo) ? frontier : requestedTo;
        if (!from.isBefore(to)) {
            log.debug("Baselines {} {} deferred: detection frontier {} not past {}", symbol, timeframe, frontier, from);
            return List.of();
        }

        List<Candle> warmup = candleStore.getRecentBefore(symbol, timeframe, from, indicatorSettings.warmupBars());
        List<Candle> bars = candleStore.getBetween(symbol, timeframe, from, to);
        if (bars.isEmpty()) {
            return List.of();
        }

        Set<Instant> fired = new HashSet<>(signalStore.firedTimestamps(symbol, timeframe, from, to));
        Duration spacing = timeframe.width().multipliedBy(minSpacingBars);
        TreeSet<Instant> taken = new TreeSet<>();
        baselineRepo.find(symbol, timeframe, labelVersion, from.minus(spacing), to.plus(spacing))
            .forEach(b -> taken.add(b.timestamp()));

        IndicatorState state = new IndicatorState(indicatorSettings);
        for (Candle bar : warmup) {
            state.update(bar);
        }

        Random random = new Random(streamSeed(symbol, timeframe));
        List<Baseline> written = new ArrayList<>();
        int excluded = 0;

        for (Candle bar : bars) {
            state.update(bar);
            // One draw per bar keeps the sequence stable regardless of which bars qualify
            double draw = random.nextDouble();

            IndicatorSnapshot snapshot = state.current();
            if (!isWarm(snapshot)) {
                continue;
            }
            if (fired.contains(bar.timestamp())) {
                excluded++;
                continue;
            }
            if (draw >= samplingRate || tooClose(taken, bar.timestamp(), spacing)) {
                continue;
            }

            Baseline baseline = new Baseline(null, symbol, timeframe, bar.timestamp(), labelVersion,
                snapshot.toFeatureSnapshot(), clock.instant());
            if (baselineRepo.insertIfAbsent(baseline)) {
                written.add(baseline);
            }
            taken.add(bar.timestamp());
        }

        metrics.recordBaselinesWritten(written.size());
        log.info("Baselines {} {} [{}, {}): {} written, {} signal bars excluded",
            symbol, timeframe, from, to, written.size(), excluded);
        return written;
    }

    long streamSeed(String symbol, Timeframe timeframe) {
        return seed * 31 * 31 + symbol.hashCode() * 31L + timeframe.ordinal();
    }

    private static boolean isWarm(IndicatorSnapshot snapshot) {
        return snapshot != null
            && snapshot.rsi14() != null
            && snapshot.atr14() != null
            && snapshot.relVolume() != null;
    }

    private static boolean tooClose(TreeSet<Instant> taken, Instant ts, Duration spacing) {
        if (spacing.isZero()) {
            return taken.contains(ts);
        }
        Instant before = taken.floor(ts);
        if (before != null && Duration.between(before, ts).compareTo(spacing) < 0) {
            return true;
        }
        Instant after = taken.ceiling(ts);
        return after != null && Duration.between(ts, after).compareTo(spacing) < 0;
    }
}
