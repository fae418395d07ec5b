package in.oracore.service.outcome;

import in.oracore.domain.data.Candle;
import in.oracore.domain.outcome.HitPriority;
import in.oracore.domain.outcome.Horizon;
import in.oracore.domain.outcome.Outcome;
import in.oracore.domain.outcome.OutcomeThresholds;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.Signal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Pure outcome math over a complete horizon window.
 *
 * Returns are price moves relative to entry at scale 6, HALF_UP, whatever the side: run-up
 * uses the highest high and drawdown the lowest low. Targets and stop are side-aware (a
 * SHORT target sits below entry) and are scanned in bar order; evaluation stops at the stop
 * or once every target is hit.
 */
public final class OutcomeCalculator {
    private static final int SCALE = 6;

    private OutcomeCalculator() {}

    /**
     * @param window every bar of the horizon, ascending, all with {@code firedAt < ts <= targetEnd}
     * @throws IllegalArgumentException if the window is empty or holds a bar outside the horizon
     */
    public static Outcome compute(Signal signal, Horizon horizon, List<Candle> window,
                                  OutcomeThresholds thresholds, HitPriority priority,
                                  int labelVersion, Instant computedAt) {
        if (window.isEmpty()) {
            throw new IllegalArgumentException("Empty horizon window for signal " + signal.id());
        }
        Instant firedAt = signal.firedAt();
        Instant targetEnd = horizon.targetEnd(firedAt);
        for (Candle bar : window) {
            if (!bar.timestamp().isAfter(firedAt) || bar.timestamp().isAfter(targetEnd)) {
                throw new IllegalArgumentException("Bar " + bar.timestamp() + " is outside horizon ("
                    + firedAt + ", " + targetEnd + "] of signal " + signal.id());
            }
        }

        boolean isLong = signal.side() == Side.LONG;
        BigDecimal entry = signal.entryPrice();

        BigDecimal lastClose = window.get(window.size() - 1).close();
        BigDecimal maxHigh = window.get(0).high();
        BigDecimal minLow = window.get(0).low();
        for (Candle bar : window) {
            if (bar.high().compareTo(maxHigh) > 0) maxHigh = bar.high();
            if (bar.low().compareTo(minLow) < 0) minLow = bar.low();
        }

        BigDecimal retClose = relativeMove(entry, lastClose);
        BigDecimal maxRunUp = relativeMove(entry, maxHigh);
        BigDecimal maxDrawdown = relativeMove(entry, minLow);

        List<BigDecimal> targets = thresholds.targets();
        BigDecimal[] targetLevels = new BigDecimal[targets.size()];
        for (int i = 0; i < targets.size(); i++) {
            targetLevels[i] = level(entry, targets.get(i), isLong);
        }
        BigDecimal stopLevel = level(entry, thresholds.stop(), !isLong);

        Duration[] targetTimes = new Duration[targetLevels.length];
        Duration stopTime = null;

        for (Candle bar : window) {
            Duration elapsed = Duration.between(firedAt, bar.closeTime());
            boolean stopCrossed = isLong
                ? bar.low().compareTo(stopLevel) <= 0
                : bar.high().compareTo(stopLevel) >= 0;

            boolean anyTarget = false;
            boolean[] crossed = new boolean[targetLevels.length];
            for (int i = 0; i < targetLevels.length; i++) {
                if (targetTimes[i] == null) {
                    crossed[i] = isLong
                        ? bar.high().compareTo(targetLevels[i]) >= 0
                        : bar.low().compareTo(targetLevels[i]) <= 0;
                    anyTarget |= crossed[i];
                }
            }

            if (stopCrossed && anyTarget && priority == HitPriority.STOP_FIRST) {
                stopTime = elapsed;
                break;
            }
            for (int i = 0; i < crossed.length; i++) {
                if (crossed[i]) targetTimes[i] = elapsed;
            }
            if (stopCrossed) {
                stopTime = elapsed;
                break;
            }
            if (allHit(targetTimes)) {
                break;
            }
        }

        return new Outcome(
            signal.id(),
            horizon,
            labelVersion,
            retClose,
            maxRunUp,
            maxDrawdown,
            targetTimes[0] != null,
            targetTimes[1] != null,
            targetTimes[2] != null,
            stopTime != null,
            targetTimes[0],
            targetTimes[1],
            targetTimes[2],
            stopTime,
            computedAt
        );
    }

    private static BigDecimal relativeMove(BigDecimal entry, BigDecimal price) {
        return price.subtract(entry).divide(entry, SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal level(BigDecimal entry, BigDecimal fraction, boolean above) {
        BigDecimal factor = above ? BigDecimal.ONE.add(fraction) : BigDecimal.ONE.subtract(fraction);
        return entry.multiply(factor);
    }

    private static boolean allHit(Duration[] times) {
        for (Duration t : times) {
            if (t == null) return false;
        }
        return true;
    }
}
