package in.oracore.service.indicator;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Timeframe;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static in.oracore.support.TestCandles.*;
import static org.junit.jupiter.api.Assertions.*;

class IndicatorStateTest {

    @Test
    void valuesStayNullUntilTheirWindowsFill() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        List<Candle> bars = rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 20, 100, 0.1, 1000);

        state.update(bars.get(0));
        IndicatorSnapshot first = state.current();
        assertNull(first.rsi14());
        assertNull(first.sma20());
        assertNull(first.atr14());
        assertNull(first.relVolume());
        assertNull(first.featureVector());

        for (int i = 1; i < 20; i++) {
            state.update(bars.get(i));
        }
        IndicatorSnapshot twentieth = state.current();
        assertNotNull(twentieth.sma20());
        assertNotNull(twentieth.rsi14());
        assertNull(twentieth.sma50());
        assertNull(twentieth.ema200());
    }

    @Test
    void sma20IsTheMeanOfTheLastTwentyCloses() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        List<Candle> bars = rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 25, 100, 1.0, 1000);
        bars.forEach(state::update);

        double expected = bars.subList(5, 25).stream().mapToDouble(c -> c.close().doubleValue()).average().orElseThrow();
        assertEquals(expected, state.current().sma20(), 1e-9);
    }

    @Test
    void rsiIsHundredWhenPricesOnlyRise() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 16, 100, 0.5, 1000).forEach(state::update);

        assertEquals(100.0, state.current().rsi14(), 1e-9);
    }

    @Test
    void rsiEdgeCases() {
        assertEquals(50.0, IndicatorState.rsi(0.0, 0.0));
        assertEquals(100.0, IndicatorState.rsi(1.0, 0.0));
        assertEquals(50.0, IndicatorState.rsi(1.0, 1.0), 1e-9);
        assertNull(IndicatorState.rsi(null, 1.0));
    }

    @Test
    void priorHighExcludesTheCurrentBar() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults().withLookbacks(Set.of(3)));
        state.update(bar("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 10, 10, 9, 10, 100));
        state.update(bar("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 1), 10, 11, 9, 10, 100));
        state.update(bar("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 2), 10, 12, 9, 10, 100));
        assertNull(state.current().priorHigh(3), "only two prior bars before the third");

        state.update(bar("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 3), 10, 20, 9, 19, 400));

        assertEquals(12.0, state.current().priorHigh(3));
        assertEquals(100.0, state.current().priorMeanVolume(3));
    }

    @Test
    void relativeVolumeComparesAgainstPrecedingBarsOnly() {
        IndicatorState state = new IndicatorState(new IndicatorSettings(3, Set.of()));
        state.update(flat("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 10, 100));
        state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 1), 10, 100));
        state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 2), 10, 100));
        assertNull(state.current().relVolume());

        state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 3), 10, 400));

        assertEquals(4.0, state.current().relVolume(), 1e-9);
    }

    @Test
    void staleBarIsIgnored() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 1), 10, 100));
        IndicatorSnapshot before = state.current();

        assertFalse(state.update(flat("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 50, 100)));
        assertFalse(state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 1), 50, 100)));
        assertSame(before, state.current());
    }

    @Test
    void sessionVwapResetsOnANewSessionDay() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        state.update(flat("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 100, 1000));
        state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 1), 110, 1000));
        assertEquals(105.0, state.current().sessionVwap(), 1e-9);

        state.update(flat("AAPL", Timeframe.MINUTE_1, SESSION_OPEN.plusSeconds(24 * 3600), 120, 1000));
        assertEquals(120.0, state.current().sessionVwap(), 1e-9);
    }

    @Test
    void obvAddsVolumeOnUpClosesAndSubtractsOnDownCloses() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        state.update(flat("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 10, 100));
        assertEquals(0.0, state.current().obv());

        state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 1), 11, 200));
        assertEquals(200.0, state.current().obv());
        state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 2), 10.5, 50));
        assertEquals(150.0, state.current().obv());
        state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 3), 10.5, 70));
        assertEquals(150.0, state.current().obv(), "unchanged close leaves OBV alone");
    }

    @Test
    void smaDistanceAndSlopeArePercentages() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 21, 100, 1.0, 1000).forEach(state::update);

        IndicatorSnapshot now = state.current();
        // closes 101..120 now, 100..119 one bar earlier
        assertEquals(110.5, now.sma20(), 1e-9);
        assertEquals(100.0 * (120.0 / 110.5 - 1.0), now.pctFromSma20(), 1e-9);
        assertEquals(100.0 * (110.5 / 109.5 - 1.0), now.trendSma20Pct(), 1e-9);
        assertNull(now.pctFromSma50());
        assertNull(now.trendSma50Pct());
        assertEquals(100.0 * now.atr14() / 120.0, now.atrPct(), 1e-9);
    }

    @Test
    void volumeSpikeUsesTheTenPrecedingBars() {
        IndicatorState state = new IndicatorState(new IndicatorSettings(3, Set.of()));
        for (int i = 0; i < 10; i++) {
            state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, i), 10, 100));
        }
        assertNull(state.current().volSpike10());

        state.update(flat("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, 10), 10, 250));

        assertEquals(2.5, state.current().volSpike10(), 1e-9);
        assertEquals(2.5, state.current().relVolume(), 1e-9);
    }

    @Test
    void bollingerWidthHistoryKeepsTheLastSixtyBars() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        wave("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 100, 100, 1000).forEach(state::update);

        IndicatorSnapshot now = state.current();
        List<Double> widths = now.bbWidthHistory();
        assertEquals(60, widths.size());
        assertEquals(now.bbWidth(), widths.get(59));
        assertEquals(widths.stream().mapToDouble(Double::doubleValue).min().orElseThrow(), now.bbWidthPercentile(0, 10));
        assertEquals(widths.stream().mapToDouble(Double::doubleValue).max().orElseThrow(), now.bbWidthPercentile(100, 10));
        assertNull(now.bbWidthPercentile(50, 61));
    }

    @Test
    void contextFeaturesAreRecordedButStayOutOfTheModelVector() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        wave("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, IndicatorSettings.WARMUP_BARS, 100, 1000).forEach(state::update);

        IndicatorSnapshot now = state.current();
        assertEquals(now.obv(), now.toFeatureSnapshot().get("obv"));
        assertEquals(now.pctFromSma200(), now.featureMap().get("pct_from_sma_200"));
        assertEquals(IndicatorSnapshot.FEATURE_NAMES.size() + IndicatorSnapshot.CONTEXT_FEATURE_NAMES.size(),
            now.featureMap().size());
        assertEquals(16, now.featureVector().length);
    }

    @Test
    void fullHistoryWarmsEveryFeature() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        wave("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, IndicatorSettings.WARMUP_BARS, 100, 1000).forEach(state::update);

        double[] vector = state.current().featureVector();
        assertNotNull(vector);
        assertEquals(IndicatorSnapshot.FEATURE_NAMES.size(), vector.length);
    }
}
