package in.oracore.service.indicator;

import java.util.ArrayDeque;

/**
 * Fixed-length window over the last {@code size} values with O(1) mean and variance.
 */
final class RollingWindow {
    private final int size;
    private final ArrayDeque<Double> values;
    private double sum;
    private double sumSquares;

    RollingWindow(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Window size must be positive: " + size);
        }
        this.size = size;
        this.values = new ArrayDeque<>(size + 1);
    }

    void add(double value) {
        values.addLast(value);
        sum += value;
        sumSquares += value * value;
        if (values.size() > size) {
            double evicted = values.removeFirst();
            sum -= evicted;
            sumSquares -= evicted * evicted;
        }
    }

    boolean isFull() {
        return values.size() == size;
    }

    /**
     * Mean of the window, or null until it is full.
     */
    Double mean() {
        return isFull() ? sum / size : null;
    }

    /**
     * Population standard deviation, or null until the window is full.
     */
    Double stdDev() {
        if (!isFull()) {
            return null;
        }
        double mean = sum / size;
        // running sums can drift slightly below zero on flat input
        return Math.sqrt(Math.max(0.0, sumSquares / size - mean * mean));
    }
}
