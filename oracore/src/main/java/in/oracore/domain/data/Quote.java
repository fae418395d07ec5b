package in.oracore.domain.data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Best bid/ask snapshot for a ticker.
 */
public record Quote(String symbol, BigDecimal bid, BigDecimal ask, Instant timestamp) {

    public BigDecimal spread() {
        if (bid == null || ask == null) {
            return null;
        }
        return ask.subtract(bid).setScale(6, RoundingMode.HALF_UP);
    }

    /**
     * Spread over the mid price in basis points, or null when the quote is one-sided or the mid is zero.
     */
    public Double spreadBps() {
        if (bid == null || ask == null) {
            return null;
        }
        double mid = (bid.doubleValue() + ask.doubleValue()) / 2.0;
        if (mid == 0.0) {
            return null;
        }
        return (ask.doubleValue() - bid.doubleValue()) / mid * 10_000.0;
    }
}
