package in.oracore.service.indicator;

/**
 * Wilder's smoothing: seeded with the simple mean of the first {@code period} inputs,
 * then {@code avg = (avg * (period - 1) + x) / period}.
 */
final class WilderAverage {
    private final int period;
    private int seen;
    private double seedSum;
    private Double value;

    WilderAverage(int period) {
        this.period = period;
    }

    void add(double x) {
        if (value != null) {
            value = (value * (period - 1) + x) / period;
            return;
        }
        seedSum += x;
        if (++seen == period) {
            value = seedSum / period;
        }
    }

    Double value() {
        return value;
    }
}
