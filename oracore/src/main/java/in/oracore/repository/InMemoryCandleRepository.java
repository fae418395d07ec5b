package in.oracore.repository;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.StreamKey;
import in.oracore.domain.data.Timeframe;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Heap-backed CandleRepository for replay runs and tests.
 */
public final class InMemoryCandleRepository implements CandleRepository {

    private final Map<StreamKey, ConcurrentSkipListMap<Instant, Candle>> streams = new ConcurrentHashMap<>();

    @Override
    public void upsert(Candle candle) {
        stream(candle.symbol(), candle.timeframe()).put(candle.timestamp(), candle);
    }

    @Override
    public void upsertBatch(List<Candle> candles) {
        for (Candle candle : candles) {
            upsert(candle);
        }
    }

    @Override
    public List<Candle> findRange(String symbol, Timeframe timeframe, Instant from, Instant to) {
        return new ArrayList<>(stream(symbol, timeframe).subMap(from, true, to, false).values());
    }

    @Override
    public List<Candle> findAfter(String symbol, Timeframe timeframe, Instant after, Instant until) {
        return new ArrayList<>(stream(symbol, timeframe).subMap(after, false, until, true).values());
    }

    @Override
    public List<Candle> findRecentBefore(String symbol, Timeframe timeframe, Instant before, int limit) {
        NavigableMap<Instant, Candle> head = stream(symbol, timeframe).headMap(before, false).descendingMap();
        List<Candle> result = new ArrayList<>(Math.min(limit, head.size()));
        for (Candle candle : head.values()) {
            if (result.size() >= limit) break;
            result.add(0, candle);
        }
        return result;
    }

    @Override
    public Candle findLatest(String symbol, Timeframe timeframe) {
        Map.Entry<Instant, Candle> last = stream(symbol, timeframe).lastEntry();
        return last == null ? null : last.getValue();
    }

    @Override
    public Candle findEarliest(String symbol, Timeframe timeframe) {
        Map.Entry<Instant, Candle> first = stream(symbol, timeframe).firstEntry();
        return first == null ? null : first.getValue();
    }

    @Override
    public boolean existsAfter(String symbol, Timeframe timeframe, Instant after) {
        return stream(symbol, timeframe).higherKey(after) != null;
    }

    public int size(String symbol, Timeframe timeframe) {
        return stream(symbol, timeframe).size();
    }

    private ConcurrentSkipListMap<Instant, Candle> stream(String symbol, Timeframe timeframe) {
        return streams.computeIfAbsent(new StreamKey(symbol, timeframe), k -> new ConcurrentSkipListMap<>());
    }
}
