package in.oracore.domain.outcome;

import java.math.BigDecimal;
import java.util.List;

/**
 * Take-profit levels and stop distance as positive fractions of the entry price.
 */
public record OutcomeThresholds(BigDecimal tp1, BigDecimal tp2, BigDecimal tp3, BigDecimal stop) {

    public static OutcomeThresholds defaults() {
        return new OutcomeThresholds(
            new BigDecimal("0.01"), new BigDecimal("0.02"), new BigDecimal("0.03"), new BigDecimal("0.01"));
    }

    public List<BigDecimal> targets() {
        return List.of(tp1, tp2, tp3);
    }
}
