package in.oracore.service.candle;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.StreamKey;
import in.oracore.domain.data.Timeframe;
import in.oracore.repository.CandleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Candle Store - repository-backed bar storage with an in-memory head per stream.
 *
 * Writes go straight to the repository as idempotent upserts and failures propagate
 * to the caller. The newest bar of every stream is cached so the ingestor and the
 * aggregator can find their resume point without a query per cycle.
 */
public final class CandleStore {
    private static final Logger log = LoggerFactory.getLogger(CandleStore.class);

    private final CandleRepository candleRepo;

    // stream -> newest known bar (Optional.empty() when the stream has none yet)
    private final Map<StreamKey, Optional<Candle>> latest = new ConcurrentHashMap<>();

    public CandleStore(CandleRepository candleRepo) {
        this.candleRepo = candleRepo;
    }

    /**
     * Insert or overwrite a bar at its (symbol, timeframe, ts) key.
     */
    public void putBar(Candle candle) {
        candleRepo.upsert(candle);
        advanceLatest(candle);
    }

    /**
     * Batch variant of {@link #putBar}, written in one repository call.
     */
    public void putBars(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return;
        }
        candleRepo.upsertBatch(candles);
        candles.stream()
            .max(Comparator.comparing(Candle::timestamp))
            .ifPresent(this::advanceLatest);
        log.debug("Stored {} bars for {}", candles.size(), candles.get(0).streamKey());
    }

    /**
     * Bars with {@code fromExclusive < ts <= toInclusive}, ascending.
     */
    public List<Candle> getRange(String symbol, Timeframe timeframe, Instant fromExclusive, Instant toInclusive) {
        return candleRepo.findAfter(symbol, timeframe, fromExclusive, toInclusive);
    }

    /**
     * Bars with {@code from <= ts < to}, ascending.
     */
    public List<Candle> getBetween(String symbol, Timeframe timeframe, Instant from, Instant to) {
        return candleRepo.findRange(symbol, timeframe, from, to);
    }

    /**
     * Up to {@code limit} bars strictly before {@code before}, ascending.
     */
    public List<Candle> getRecentBefore(String symbol, Timeframe timeframe, Instant before, int limit) {
        return candleRepo.findRecentBefore(symbol, timeframe, before, limit);
    }

    public Candle getLatest(String symbol, Timeframe timeframe) {
        StreamKey key = new StreamKey(symbol, timeframe);
        return latest.computeIfAbsent(key, k -> Optional.ofNullable(candleRepo.findLatest(symbol, timeframe)))
            .orElse(null);
    }

    public Candle getEarliest(String symbol, Timeframe timeframe) {
        return candleRepo.findEarliest(symbol, timeframe);
    }

    /**
     * Whether the stream holds any bar with {@code ts > after}.
     */
    public boolean hasBarAfter(String symbol, Timeframe timeframe, Instant after) {
        Candle head = getLatest(symbol, timeframe);
        return head != null && head.timestamp().isAfter(after);
    }

    private void advanceLatest(Candle candle) {
        latest.merge(candle.streamKey(), Optional.of(candle), (current, incoming) -> {
            if (current.isEmpty()) {
                return incoming;
            }
            return current.get().timestamp().isAfter(candle.timestamp()) ? current : incoming;
        });
    }
}
