package in.oracore.service.indicator;

/**
 * Exponential moving average with {@code alpha = 2 / (period + 1)}, seeded with the
 * simple mean of its first {@code period} inputs.
 */
final class Ema {
    private final int period;
    private final double alpha;
    private int seen;
    private double seedSum;
    private Double value;

    Ema(int period) {
        this.period = period;
        this.alpha = 2.0 / (period + 1);
    }

    void add(double x) {
        if (value != null) {
            value = alpha * x + (1 - alpha) * value;
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
