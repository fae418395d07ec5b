package in.oracore.service.candle;

import in.oracore.domain.common.ProviderException;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.IngestionLogEntry;
import in.oracore.domain.data.Timeframe;
import in.oracore.infrastructure.metrics.PipelineMetrics;
import in.oracore.infrastructure.provider.BackoffPolicy;
import in.oracore.infrastructure.provider.BarProvider;
import in.oracore.repository.IngestionLogRepository;
import in.oracore.repository.SymbolRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bar Ingestor - pulls new closed bars from the provider into the candle store.
 *
 * Resumes after the newest stored bar, or starts {@code backfillWindow} back for a new stream.
 * Transient provider failures are retried with exponential backoff; when retries run out the
 * {@link ProviderException} propagates so the caller can mark the stream failed for the cycle.
 */
public final class BarIngestor {
    private static final Logger log = LoggerFactory.getLogger(BarIngestor.class);

    private final BarProvider provider;
    private final CandleStore candleStore;
    private final SymbolRepository symbolRepo;
    private final IngestionLogRepository ingestionLog;
    private final PipelineMetrics metrics;
    private final BackoffPolicy backoffTemplate;
    private final Duration backfillWindow;
    private final Clock clock;

    public BarIngestor(BarProvider provider, CandleStore candleStore, SymbolRepository symbolRepo,
                       IngestionLogRepository ingestionLog, PipelineMetrics metrics,
                       BackoffPolicy backoffTemplate, Duration backfillWindow, Clock clock) {
        this.provider = provider;
        this.candleStore = candleStore;
        this.symbolRepo = symbolRepo;
        this.ingestionLog = ingestionLog;
        this.metrics = metrics;
        this.backoffTemplate = backoffTemplate;
        this.backfillWindow = backfillWindow;
        this.clock = clock;
    }

    /**
     * Fetch and store every closed bar newer than the stream's head.
     *
     * @return the bars stored by this call, ascending
     * @throws ProviderException when the provider keeps failing after all retries
     */
    public List<Candle> ingest(String symbol, Timeframe timeframe) {
        Instant now = clock.instant();
        Candle head = candleStore.getLatest(symbol, timeframe);
        Instant from = head != null
            ? head.timestamp().plus(timeframe.width())
            : timeframe.floor(now.minus(backfillWindow));

        if (!from.isBefore(now)) {
            return List.of();
        }

        List<Candle> fetched;
        try {
            fetched = fetchWithRetry(symbol, timeframe, from, now);
        } catch (ProviderException e) {
            ingestionLog.append(new IngestionLogEntry(null, provider.name(), symbol, timeframe, 0, null,
                e.getMessage(), now));
            throw e;
        }

        List<Candle> accepted = new ArrayList<>(fetched.size());
        for (Candle bar : fetched) {
            if (!bar.symbol().equals(symbol) || bar.timeframe() != timeframe) {
                log.warn("Provider returned {} for request {}:{}; dropped", bar.streamKey(), symbol, timeframe);
                continue;
            }
            // Only closed bars after the head are accepted
            if (bar.closeTime().isAfter(now) || (head != null && !bar.timestamp().isAfter(head.timestamp()))) {
                continue;
            }
            accepted.add(bar);
        }
        accepted.sort(Comparator.comparing(Candle::timestamp));
        logGaps(symbol, timeframe, head, accepted);

        Long lagMs = null;
        if (!accepted.isEmpty()) {
            candleStore.putBars(accepted);
            Candle newest = accepted.get(accepted.size() - 1);
            symbolRepo.touch(symbol, newest.timestamp());
            lagMs = Duration.between(newest.closeTime(), now).toMillis();
            metrics.recordBarsIngested(timeframe.code(), accepted.size());
        }
        ingestionLog.append(new IngestionLogEntry(null, provider.name(), symbol, timeframe,
            accepted.size(), lagMs, null, now));

        log.debug("Ingested {} {} bars for {} from {}", accepted.size(), timeframe, symbol, from);
        return accepted;
    }

    private List<Candle> fetchWithRetry(String symbol, Timeframe timeframe, Instant from, Instant to) {
        BackoffPolicy policy = backoffTemplate.fresh();
        while (true) {
            try {
                List<Candle> bars = provider.fetchBars(symbol, timeframe, from, to);
                policy.recordSuccess();
                return bars != null ? bars : List.of();
            } catch (ProviderException e) {
                Duration delay = policy.getNextDelay();
                policy.recordFailure();
                if (!e.isRetryable() || !policy.shouldRetry()) {
                    log.error("Provider {} gave up on {}:{} after {} attempt(s): {}",
                        provider.name(), symbol, timeframe, policy.getAttemptCount(), e.getMessage());
                    throw e;
                }
                metrics.recordProviderRetry();
                log.warn("Provider {} failed for {}:{} (attempt {}/{}), retrying in {} ms: {}",
                    provider.name(), symbol, timeframe, policy.getAttemptCount(), policy.getMaxAttempts(),
                    delay.toMillis(), e.getMessage());
                sleep(delay);
            }
        }
    }

    private static void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while backing off", e);
        }
    }

    private static void logGaps(String symbol, Timeframe timeframe, Candle head, List<Candle> bars) {
        Instant expected = head != null ? head.closeTime() : null;
        for (Candle bar : bars) {
            if (expected != null && bar.timestamp().isAfter(expected)) {
                log.debug("Gap in {}:{} between {} and {}", symbol, timeframe, expected, bar.timestamp());
            }
            expected = bar.closeTime();
        }
    }
}
