package in.oracore.service.candle;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Candle Aggregator - builds coarser bars from a finer stream.
 *
 * Buckets are epoch-aligned in UTC. A bucket {@code [start, end)} is written only once it
 * is closed, i.e. the newest stored source bar ends at or after {@code end}. Partial
 * buckets are never written and empty buckets are never fabricated.
 */
public final class CandleAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    private final CandleStore candleStore;

    public CandleAggregator(CandleStore candleStore) {
        this.candleStore = candleStore;
    }

    /**
     * Write every newly closed {@code targetTf} bucket for the symbol.
     *
     * Resumes after the newest stored target bar, so calling it again with no new source
     * bars writes nothing.
     *
     * @return newly closed aggregate bars, ascending
     * @throws IllegalArgumentException when target width is not a multiple of source width
     */
    public List<Candle> aggregate(String symbol, Timeframe sourceTf, Timeframe targetTf) {
        if (targetTf == sourceTf || !targetTf.isMultipleOf(sourceTf)) {
            throw new IllegalArgumentException(
                "Cannot aggregate " + sourceTf + " into " + targetTf + ": width is not a multiple");
        }

        Candle latestSource = candleStore.getLatest(symbol, sourceTf);
        if (latestSource == null) {
            return List.of();
        }

        // Every bucket ending at or before this instant is closed
        Instant closedUntil = targetTf.floor(latestSource.closeTime());

        Candle latestTarget = candleStore.getLatest(symbol, targetTf);
        Instant from;
        if (latestTarget != null) {
            from = latestTarget.timestamp().plus(targetTf.width());
        } else {
            Candle earliest = candleStore.getEarliest(symbol, sourceTf);
            from = targetTf.floor(earliest.timestamp());
        }

        if (!from.isBefore(closedUntil)) {
            return List.of();
        }

        List<Candle> sourceBars = candleStore.getBetween(symbol, sourceTf, from, closedUntil);
        List<Candle> aggregated = aggregateClosed(symbol, targetTf, sourceBars);

        if (!aggregated.isEmpty()) {
            candleStore.putBars(aggregated);
            log.debug("Aggregated {} {} bars for {} from {} source bars",
                aggregated.size(), targetTf, symbol, sourceBars.size());
        }
        return aggregated;
    }

    /**
     * Group ascending source bars into target buckets. Every bucket is assumed closed.
     */
    static List<Candle> aggregateClosed(String symbol, Timeframe targetTf, List<Candle> sourceBars) {
        Map<Instant, List<Candle>> buckets = new TreeMap<>();
        for (Candle bar : sourceBars) {
            buckets.computeIfAbsent(targetTf.floor(bar.timestamp()), k -> new ArrayList<>()).add(bar);
        }

        List<Candle> result = new ArrayList<>(buckets.size());
        for (Map.Entry<Instant, List<Candle>> bucket : buckets.entrySet()) {
            result.add(combine(symbol, targetTf, bucket.getKey(), bucket.getValue()));
        }
        return result;
    }

    private static Candle combine(String symbol, Timeframe targetTf, Instant bucketStart, List<Candle> bars) {
        BigDecimal open = bars.get(0).open();
        BigDecimal close = bars.get(bars.size() - 1).close();
        BigDecimal high = bars.get(0).high();
        BigDecimal low = bars.get(0).low();
        long volume = 0;
        BigDecimal weightedPrice = BigDecimal.ZERO;
        Long tradeCount = null;
        boolean adjusted = true;

        for (Candle bar : bars) {
            if (bar.high().compareTo(high) > 0) high = bar.high();
            if (bar.low().compareTo(low) < 0) low = bar.low();
            volume += bar.volume();

            BigDecimal price = bar.vwap() != null ? bar.vwap() : bar.close();
            weightedPrice = weightedPrice.add(price.multiply(BigDecimal.valueOf(bar.volume())));

            if (bar.tradeCount() != null) {
                tradeCount = (tradeCount == null ? 0L : tradeCount) + bar.tradeCount();
            }
            adjusted &= bar.adjusted();
        }

        BigDecimal vwap = volume > 0
            ? weightedPrice.divide(BigDecimal.valueOf(volume), 6, RoundingMode.HALF_UP)
            : null;

        return new Candle(symbol, targetTf, bucketStart, open, high, low, close, volume,
            vwap, tradeCount, Candle.SOURCE_AGGREGATED, adjusted);
    }
}
