package in.oracore.domain.data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * OHLCV bar keyed by (symbol, timeframe, timestamp).
 *
 * The timestamp is the bar open time. {@code vwap} and {@code tradeCount} are optional
 * because not every provider reports them.
 */
public record Candle(
        String symbol,
        Timeframe timeframe,
        Instant timestamp,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        long volume,
        BigDecimal vwap,
        Long tradeCount,
        String source,
        boolean adjusted) {

    public static final String SOURCE_PROVIDER = "provider";
    public static final String SOURCE_AGGREGATED = "aggregated";

    public Candle {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timeframe, "timeframe");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(open, "open");
        Objects.requireNonNull(high, "high");
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(close, "close");
        if (volume < 0) {
            throw new IllegalArgumentException("Negative volume for " + symbol + " at " + timestamp);
        }
        if (source == null) {
            source = SOURCE_PROVIDER;
        }
    }

    public static Candle of(String symbol, Timeframe timeframe, Instant timestamp,
                            BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                            long volume) {
        return new Candle(symbol, timeframe, timestamp, open, high, low, close, volume,
            null, null, SOURCE_PROVIDER, true);
    }

    public StreamKey streamKey() {
        return new StreamKey(symbol, timeframe);
    }

    /**
     * Exclusive end of the bar: {@code timestamp + width(timeframe)}.
     */
    public Instant closeTime() {
        return timestamp.plus(timeframe.width());
    }
}
