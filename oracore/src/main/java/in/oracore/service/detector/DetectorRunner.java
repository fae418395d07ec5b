package in.oracore.service.detector;

import in.oracore.domain.common.DetectorException;
import in.oracore.domain.common.ProviderException;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Quote;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.signal.FeatureSnapshot;
import in.oracore.domain.signal.Signal;
import in.oracore.domain.signal.SignalCandidate;
import in.oracore.infrastructure.metrics.PipelineMetrics;
import in.oracore.service.candle.SessionClock;
import in.oracore.service.indicator.IndicatorSnapshot;
import in.oracore.service.signal.SignalStore;
import in.oracore.service.signal.StoredSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Detector Runner - evaluates every registered detector on a closed bar and records what fires.
 *
 * Each call runs on a dedicated pool under a timeout. A detector that throws or overruns is
 * recorded as a {@link DetectorFailure} for that bar and the remaining detectors still run.
 */
public final class DetectorRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DetectorRunner.class);

    public static final String SOURCE_SYSTEM = "oracore";

    private final DetectorRegistry registry;
    private final SignalStore signalStore;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Duration timeout;
    private final Function<String, Optional<Quote>> quoteLookup;
    private final ExecutorService executor;

    public DetectorRunner(DetectorRegistry registry, SignalStore signalStore, PipelineMetrics metrics,
                          Clock clock, Duration timeout, Function<String, Optional<Quote>> quoteLookup) {
        this.registry = registry;
        this.signalStore = signalStore;
        this.metrics = metrics;
        this.clock = clock;
        this.timeout = timeout;
        this.quoteLookup = quoteLookup;
        this.executor = Executors.newCachedThreadPool(daemonThreads("detector-"));
    }

    public DetectionResult evaluate(DetectionContext context) {
        List<Detector> detectors = registry.detectors();
        if (detectors.isEmpty()) {
            return DetectionResult.EMPTY;
        }

        List<Signal> emitted = new ArrayList<>();
        List<DetectorFailure> failures = new ArrayList<>();
        int duplicates = 0;

        for (Detector detector : detectors) {
            DetectorDefinition definition = detector.definition();
            Optional<SignalCandidate> candidate;
            try {
                candidate = runWithTimeout(detector, context);
            } catch (DetectorException e) {
                log.warn("{} on {} at {}", e.getMessage(), context.stream(), context.bar().timestamp(), e.getCause());
                failures.add(new DetectorFailure(e.getDetectorKey(), context.stream(),
                    context.bar().timestamp(), e.getMessage()));
                continue;
            }

            if (candidate.isEmpty()) {
                continue;
            }

            StoredSignal stored = signalStore.store(toSignal(definition, context, candidate.get()));
            if (stored.created()) {
                emitted.add(stored.signal());
                metrics.recordSignalEmitted(definition.key());
            } else {
                duplicates++;
            }
        }

        return new DetectionResult(emitted, duplicates, failures);
    }

    private Optional<SignalCandidate> runWithTimeout(Detector detector, DetectionContext context) {
        String key = detector.definition().key();
        Future<Optional<SignalCandidate>> future = executor.submit(() -> detector.evaluate(context));
        try {
            Optional<SignalCandidate> result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : Optional.empty();

        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordDetectorFailure(key, "timeout");
            throw new DetectorException(key, "timed out after " + timeout.toMillis() + " ms", e);

        } catch (ExecutionException e) {
            metrics.recordDetectorFailure(key, "error");
            throw new DetectorException(key, "failed: " + e.getCause(), e.getCause());

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            metrics.recordDetectorFailure(key, "interrupted");
            throw new DetectorException(key, "interrupted", e);
        }
    }

    private Signal toSignal(DetectorDefinition definition, DetectionContext context, SignalCandidate candidate) {
        Candle bar = context.bar();
        IndicatorSnapshot snapshot = context.current();
        Instant now = clock.instant();
        Quote quote = quoteFor(bar, now);

        FeatureSnapshot features = snapshot.toFeatureSnapshot().with(candidate.extraFeatures());
        if (quote != null && quote.spreadBps() != null) {
            features = features.with(Map.of("spread_bps", quote.spreadBps()));
        }

        return new Signal(
            null,
            bar.symbol(),
            bar.timeframe(),
            bar.timestamp(),
            definition.id(),
            definition.version(),
            candidate.side(),
            bar.close().setScale(6, RoundingMode.HALF_UP),
            quote != null ? quote.bid() : null,
            quote != null ? quote.ask() : null,
            quote != null ? quote.spread() : null,
            snapshot.relVolume(),
            SessionClock.sessionFlag(bar.timestamp()),
            candidate.score(),
            features,
            Math.max(0L, Duration.between(bar.closeTime(), now).toMillis()),
            SOURCE_SYSTEM,
            null
        );
    }

    /**
     * A live quote only describes a bar that just closed; replayed history gets none.
     */
    private Quote quoteFor(Candle bar, Instant now) {
        Duration age = Duration.between(bar.closeTime(), now);
        if (age.compareTo(bar.timeframe().width().multipliedBy(2)) > 0) {
            return null;
        }
        try {
            return quoteLookup.apply(bar.symbol()).orElse(null);
        } catch (ProviderException e) {
            log.warn("Quote unavailable for {}: {}", bar.symbol(), e.getMessage());
            return null;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
