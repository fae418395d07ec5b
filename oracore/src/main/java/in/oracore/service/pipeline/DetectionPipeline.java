package in.oracore.service.pipeline;

import in.oracore.domain.common.ProviderException;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.StreamKey;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.signal.Signal;
import in.oracore.infrastructure.metrics.PipelineMetrics;
import in.oracore.service.baseline.DetectionProgress;
import in.oracore.service.candle.BarIngestor;
import in.oracore.service.candle.CandleAggregator;
import in.oracore.service.candle.CandleStore;
import in.oracore.service.detector.DetectionContext;
import in.oracore.service.detector.DetectionResult;
import in.oracore.service.detector.DetectorFailure;
import in.oracore.service.detector.DetectorRunner;
import in.oracore.service.indicator.IndicatorEngine;
import in.oracore.service.indicator.IndicatorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detection Pipeline - one cycle of ingest, aggregate, indicators and detectors per symbol.
 *
 * A symbol's base stream and every aggregate stream derived from it are handled by one task on
 * the symbol's shard, so each stream has a single writer and sees its bars in order. A failing
 * symbol is reported in the cycle summary without affecting the others.
 *
 * Each stream keeps a watermark of the last bar whose detectors completed. A cycle evaluates
 * every stored bar past it, so a symbol that failed mid-batch is caught up on its next cycle.
 */
public final class DetectionPipeline implements DetectionProgress {
    private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);

    private static final Instant NOTHING_EVALUATED = Instant.EPOCH;

    private final BarIngestor ingestor;
    private final CandleStore candleStore;
    private final CandleAggregator aggregator;
    private final IndicatorEngine indicatorEngine;
    private final DetectorRunner detectorRunner;
    private final StreamExecutor executor;
    private final PipelineMetrics metrics;
    private final List<String> watchlist;
    private final Timeframe baseTimeframe;
    private final List<Timeframe> aggregateTimeframes;
    private final Clock clock;
    private final Map<StreamKey, Instant> watermarks = new ConcurrentHashMap<>();

    public DetectionPipeline(BarIngestor ingestor, CandleStore candleStore, CandleAggregator aggregator,
                             IndicatorEngine indicatorEngine, DetectorRunner detectorRunner,
                             StreamExecutor executor, PipelineMetrics metrics, List<String> watchlist,
                             Timeframe baseTimeframe, List<Timeframe> aggregateTimeframes, Clock clock) {
        this.ingestor = ingestor;
        this.candleStore = candleStore;
        this.aggregator = aggregator;
        this.indicatorEngine = indicatorEngine;
        this.detectorRunner = detectorRunner;
        this.executor = executor;
        this.metrics = metrics;
        this.watchlist = List.copyOf(watchlist);
        this.baseTimeframe = baseTimeframe;
        this.aggregateTimeframes = List.copyOf(aggregateTimeframes);
        this.clock = clock;
    }

    public CycleSummary runCycle() {
        Instant started = clock.instant();
        long startNanos = System.nanoTime();

        List<CompletableFuture<StreamResult>> futures = new ArrayList<>(watchlist.size());
        for (String symbol : watchlist) {
            futures.add(executor.submit(symbol, () -> processSymbol(symbol)));
        }

        List<StreamResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            String symbol = watchlist.get(i);
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Stream {} failed unexpectedly: {}", symbol, cause.getMessage(), cause);
                metrics.recordStreamFailure();
                results.add(StreamResult.failed(symbol, cause.toString()));
            }
        }

        CycleSummary summary = new CycleSummary(results, Duration.ofNanos(System.nanoTime() - startNanos));
        metrics.recordCycle(summary.duration(), summary.signals().size());
        logSummary(started, summary);
        return summary;
    }

    StreamResult processSymbol(String symbol) {
        StreamKey base = new StreamKey(symbol, baseTimeframe);
        evaluatedThrough(base);
        List<Candle> newBars;
        try {
            newBars = ingestor.ingest(symbol, baseTimeframe);
        } catch (ProviderException e) {
            metrics.recordStreamFailure();
            return StreamResult.failed(symbol, "provider: " + e.getMessage());
        }

        List<Signal> signals = new ArrayList<>();
        List<DetectorFailure> failures = new ArrayList<>();
        int duplicates = feed(base, signals, failures);

        int aggregated = 0;
        for (Timeframe target : aggregateTimeframes) {
            StreamKey stream = new StreamKey(symbol, target);
            evaluatedThrough(stream);
            List<Candle> closed = aggregator.aggregate(symbol, baseTimeframe, target);
            if (!closed.isEmpty()) {
                metrics.recordBarsAggregated(target.code(), closed.size());
            }
            aggregated += closed.size();
            duplicates += feed(stream, signals, failures);
        }

        return new StreamResult(symbol, newBars.size(), aggregated, signals, duplicates, failures, null);
    }

    /**
     * Bars of this stream with {@code ts < frontier} have been fully evaluated.
     */
    @Override
    public Instant detectionFrontier(String symbol, Timeframe timeframe) {
        Instant through = evaluatedThrough(new StreamKey(symbol, timeframe));
        return NOTHING_EVALUATED.equals(through) ? NOTHING_EVALUATED : through.plus(timeframe.width());
    }

    /**
     * Timestamp of the last bar whose evaluation completed. A stream seen for the first time
     * starts at its stored head, so history loaded before this process is not re-evaluated.
     */
    private Instant evaluatedThrough(StreamKey stream) {
        return watermarks.computeIfAbsent(stream, k -> {
            Candle head = candleStore.getLatest(k.symbol(), k.timeframe());
            return head != null ? head.timestamp() : NOTHING_EVALUATED;
        });
    }

    /**
     * Push every stored bar past the stream's watermark through indicators and detectors.
     * Returns the duplicate firing count.
     *
     * The watermark moves only once a bar's detectors have returned, so a batch cut short by a
     * failure resumes from the first unfinished bar on the next cycle.
     */
    private int feed(StreamKey stream, List<Signal> signals, List<DetectorFailure> failures) {
        Instant through = evaluatedThrough(stream);
        Candle head = candleStore.getLatest(stream.symbol(), stream.timeframe());
        if (head == null || !head.timestamp().isAfter(through)) {
            return 0;
        }
        List<Candle> pending = candleStore.getRange(stream.symbol(), stream.timeframe(), through, head.timestamp());
        if (pending.isEmpty()) {
            return 0;
        }

        int duplicates = 0;
        try {
            ensureTracked(stream, pending.get(0).timestamp());
            for (Candle bar : pending) {
                if (indicatorEngine.update(bar)) {
                    DetectionContext context = new DetectionContext(stream, bar, indicatorEngine.current(stream),
                        indicatorEngine.previous(stream), higherTimeframes(stream, bar));
                    DetectionResult result = detectorRunner.evaluate(context);
                    signals.addAll(result.emitted());
                    failures.addAll(result.failures());
                    duplicates += result.duplicates();
                }
                watermarks.put(stream, bar.timestamp());
            }
        } catch (RuntimeException e) {
            // State already holds the unfinished bar; rebuild from the watermark next cycle
            indicatorEngine.forget(stream);
            log.warn("Stream {} stopped at {}, will resume after it", stream, watermarks.get(stream));
            throw e;
        }
        return duplicates;
    }

    private void ensureTracked(StreamKey stream, Instant before) {
        if (indicatorEngine.isTracked(stream)) {
            return;
        }
        List<Candle> history = candleStore.getRecentBefore(stream.symbol(), stream.timeframe(), before,
            indicatorEngine.settings().warmupBars());
        indicatorEngine.warmup(stream, history);
    }

    /**
     * Latest snapshot of each coarser aggregate stream whose bar closed no later than {@code bar}.
     */
    private Map<Timeframe, IndicatorSnapshot> higherTimeframes(StreamKey stream, Candle bar) {
        Map<Timeframe, IndicatorSnapshot> higher = new EnumMap<>(Timeframe.class);
        for (Timeframe timeframe : aggregateTimeframes) {
            if (!stream.timeframe().isFinerThan(timeframe)) {
                continue;
            }
            StreamKey key = new StreamKey(stream.symbol(), timeframe);
            Instant through = evaluatedThrough(key);
            if (NOTHING_EVALUATED.equals(through)) {
                continue;
            }
            ensureTracked(key, through.plus(timeframe.width()));
            IndicatorSnapshot snapshot = indicatorEngine.current(key);
            if (snapshot != null && !snapshot.timestamp().plus(timeframe.width()).isAfter(bar.closeTime())) {
                higher.put(timeframe, snapshot);
            }
        }
        return higher;
    }

    private void logSummary(Instant started, CycleSummary summary) {
        log.info("Cycle {} finished in {} ms: symbols={} bars={} aggregated={} signals={} detectorFailures={} failedStreams={}",
            started, summary.duration().toMillis(), summary.streams().size(), summary.barsIngested(),
            summary.barsAggregated(), summary.signals().size(), summary.detectorFailures().size(),
            summary.failedStreams().size());
        for (StreamResult failed : summary.failedStreams()) {
            log.warn("Stream {} skipped this cycle: {}", failed.symbol(), failed.error());
        }
        for (DetectorFailure failure : summary.detectorFailures()) {
            log.warn("Detector {} skipped {} at {}: {}", failure.detectorKey(), failure.stream(),
                failure.barTimestamp(), failure.reason());
        }
    }
}
