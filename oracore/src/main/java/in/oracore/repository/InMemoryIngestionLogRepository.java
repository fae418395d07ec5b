package in.oracore.repository;

import in.oracore.domain.data.IngestionLogEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent entries only.
 */
public final class InMemoryIngestionLogRepository implements IngestionLogRepository {
    private static final int MAX_ENTRIES = 10_000;

    private final Deque<IngestionLogEntry> entries = new ArrayDeque<>();
    private long nextId = 1;

    @Override
    public synchronized void append(IngestionLogEntry entry) {
        entries.addFirst(new IngestionLogEntry(nextId++, entry.source(), entry.symbol(), entry.timeframe(),
            entry.barsWritten(), entry.lagMs(), entry.error(), entry.createdAt()));
        while (entries.size() > MAX_ENTRIES) {
            entries.removeLast();
        }
    }

    @Override
    public synchronized List<IngestionLogEntry> findRecent(int limit) {
        List<IngestionLogEntry> result = new ArrayList<>(Math.min(limit, entries.size()));
        for (IngestionLogEntry entry : entries) {
            if (result.size() >= limit) break;
            result.add(entry);
        }
        return result;
    }
}
