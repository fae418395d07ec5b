package in.oracore.repository;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Timeframe;

import java.time.Instant;
import java.util.List;

/**
 * Repository for OHLCV bars keyed by (symbol, timeframe, ts).
 */
public interface CandleRepository {

    /**
     * Insert or overwrite the bar at its key. Re-applying the same bar is a no-op.
     */
    void upsert(Candle candle);

    /**
     * Batch upsert in one transaction.
     */
    void upsertBatch(List<Candle> candles);

    /**
     * Bars with {@code from <= ts < to}, ascending.
     */
    List<Candle> findRange(String symbol, Timeframe timeframe, Instant from, Instant to);

    /**
     * Bars with {@code after < ts <= until}, ascending.
     */
    List<Candle> findAfter(String symbol, Timeframe timeframe, Instant after, Instant until);

    /**
     * Up to {@code limit} most recent bars strictly before {@code before}, ascending.
     */
    List<Candle> findRecentBefore(String symbol, Timeframe timeframe, Instant before, int limit);

    Candle findLatest(String symbol, Timeframe timeframe);

    Candle findEarliest(String symbol, Timeframe timeframe);

    /**
     * Whether any bar of the stream has {@code ts > after}.
     */
    boolean existsAfter(String symbol, Timeframe timeframe, Instant after);
}
