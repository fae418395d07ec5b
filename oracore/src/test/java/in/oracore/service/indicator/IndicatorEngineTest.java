package in.oracore.service.indicator;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.StreamKey;
import in.oracore.domain.data.Timeframe;
import org.junit.jupiter.api.Test;

import java.util.List;

import static in.oracore.support.TestCandles.*;
import static org.junit.jupiter.api.Assertions.*;

class IndicatorEngineTest {

    @Test
    void warmupThenIncrementalMatchesAFullReplay() {
        List<Candle> bars = wave("AAPL", Timeframe.MINUTE_5, SESSION_OPEN, 60, 100, 1000);
        StreamKey stream = new StreamKey("AAPL", Timeframe.MINUTE_5);

        IndicatorEngine incremental = new IndicatorEngine(IndicatorSettings.defaults());
        incremental.warmup(stream, bars.subList(0, 40));
        bars.subList(40, 60).forEach(incremental::update);

        IndicatorEngine replay = new IndicatorEngine(IndicatorSettings.defaults());
        bars.forEach(replay::update);

        assertEquals(replay.current(stream), incremental.current(stream));
        assertEquals(replay.previous(stream), incremental.previous(stream));
    }

    @Test
    void streamsAreIndependent() {
        IndicatorEngine engine = new IndicatorEngine(IndicatorSettings.defaults());
        engine.update(flat("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 100, 10));
        engine.update(flat("AAPL", Timeframe.MINUTE_5, SESSION_OPEN, 200, 10));

        assertEquals(2, engine.trackedStreams());
        assertEquals(100.0, engine.current(new StreamKey("AAPL", Timeframe.MINUTE_1)).close());
        assertEquals(200.0, engine.current(new StreamKey("AAPL", Timeframe.MINUTE_5)).close());
        assertFalse(engine.isTracked(new StreamKey("MSFT", Timeframe.MINUTE_1)));
    }

    @Test
    void aForgottenStreamStartsOverFromItsNextWarmup() {
        IndicatorEngine engine = new IndicatorEngine(IndicatorSettings.defaults());
        StreamKey stream = new StreamKey("AAPL", Timeframe.MINUTE_1);
        engine.update(flat("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 100, 10));
        engine.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 1), 101, 10));

        engine.forget(stream);

        assertFalse(engine.isTracked(stream));
        assertNull(engine.current(stream));
        // the bar it had taken before being dropped is accepted again after warmup
        engine.warmup(stream, List.of(flat("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 100, 10)));
        assertTrue(engine.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 1), 101, 10)));
        assertEquals(10.0, engine.current(stream).obv());
    }
}
