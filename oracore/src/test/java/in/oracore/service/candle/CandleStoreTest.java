package in.oracore.service.candle;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Timeframe;
import in.oracore.repository.InMemoryCandleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static in.oracore.support.TestCandles.*;
import static org.junit.jupiter.api.Assertions.*;

class CandleStoreTest {

    private InMemoryCandleRepository repo;
    private CandleStore store;

    @BeforeEach
    void setUp() {
        repo = new InMemoryCandleRepository();
        store = new CandleStore(repo);
    }

    @Test
    void ingestingTheSameBarsTwiceLeavesOneRowPerKey() {
        List<Candle> bars = rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 10, 100, 0.1, 1000);

        store.putBars(bars);
        store.putBars(bars);

        assertEquals(10, repo.size("AAPL", Timeframe.MINUTE_1));
        assertEquals(bars.get(9), store.getLatest("AAPL", Timeframe.MINUTE_1));
    }

    @Test
    void upsertOverwritesAtTheSameKey() {
        Instant ts = SESSION_OPEN;
        store.putBar(flat("AAPL", Timeframe.MINUTE_1, ts, 100, 1000));
        store.putBar(flat("AAPL", Timeframe.MINUTE_1, ts, 101, 1200));

        List<Candle> stored = store.getBetween("AAPL", Timeframe.MINUTE_1, ts, ts.plusSeconds(60));
        assertEquals(1, stored.size());
        assertEquals(0, dec(101).compareTo(stored.get(0).close()));
        assertEquals(1200, stored.get(0).volume());
    }

    @Test
    void rangeIsExclusiveStartInclusiveEnd() {
        store.putBars(rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 5, 100, 0.1, 1000));

        List<Candle> range = store.getRange("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, minutes(SESSION_OPEN, 3));

        assertEquals(List.of(minutes(SESSION_OPEN, 1), minutes(SESSION_OPEN, 2), minutes(SESSION_OPEN, 3)),
            range.stream().map(Candle::timestamp).toList());
    }

    @Test
    void olderBarDoesNotMoveTheHeadBack() {
        store.putBar(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 5), 100, 1000));
        store.putBar(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 2), 100, 1000));

        assertEquals(minutes(SESSION_OPEN, 5), store.getLatest("AAPL", Timeframe.MINUTE_1).timestamp());
        assertTrue(store.hasBarAfter("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 4)));
        assertFalse(store.hasBarAfter("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 5)));
    }

    @Test
    void recentBeforeReturnsTheNewestBarsAscending() {
        store.putBars(rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 10, 100, 0.1, 1000));

        List<Candle> recent = store.getRecentBefore("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 8), 3);

        assertEquals(List.of(minutes(SESSION_OPEN, 5), minutes(SESSION_OPEN, 6), minutes(SESSION_OPEN, 7)),
            recent.stream().map(Candle::timestamp).toList());
    }

    @Test
    void emptyStreamHasNoHead() {
        assertNull(store.getLatest("MSFT", Timeframe.MINUTE_1));
        assertFalse(store.hasBarAfter("MSFT", Timeframe.MINUTE_1, SESSION_OPEN));
    }
}
