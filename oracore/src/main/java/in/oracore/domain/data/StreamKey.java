package in.oracore.domain.data;

import java.util.Objects;

/**
 * Identity of an ordered bar stream: one ticker at one timeframe.
 */
public record StreamKey(String symbol, Timeframe timeframe) {
    public StreamKey {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timeframe, "timeframe");
    }

    @Override
    public String toString() {
        return symbol + ":" + timeframe.code();
    }
}
