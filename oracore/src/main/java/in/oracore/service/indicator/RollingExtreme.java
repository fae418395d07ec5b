package in.oracore.service.indicator;

import java.util.ArrayDeque;

/**
 * Max (or min) over the last {@code size} values using a monotonic deque.
 * Each value is pushed and popped at most once, so updates are O(1) amortized.
 */
final class RollingExtreme {
    private record Entry(long index, double value) {
    }

    private final int size;
    private final boolean max;
    private final ArrayDeque<Entry> deque = new ArrayDeque<>();
    private long count;

    private RollingExtreme(int size, boolean max) {
        if (size <= 0) {
            throw new IllegalArgumentException("Window size must be positive: " + size);
        }
        this.size = size;
        this.max = max;
    }

    static RollingExtreme max(int size) {
        return new RollingExtreme(size, true);
    }

    static RollingExtreme min(int size) {
        return new RollingExtreme(size, false);
    }

    void add(double value) {
        long index = count++;
        while (!deque.isEmpty() && dominates(value, deque.peekLast().value())) {
            deque.removeLast();
        }
        deque.addLast(new Entry(index, value));
        while (deque.peekFirst().index() <= index - size) {
            deque.removeFirst();
        }
    }

    boolean isFull() {
        return count >= size;
    }

    /**
     * Extreme of the window, or null until {@code size} values have been seen.
     */
    Double value() {
        return isFull() ? deque.peekFirst().value() : null;
    }

    private boolean dominates(double incoming, double existing) {
        return max ? incoming >= existing : incoming <= existing;
    }
}
