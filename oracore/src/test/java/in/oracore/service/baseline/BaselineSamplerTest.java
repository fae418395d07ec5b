package in.oracore.service.baseline;

import in.oracore.domain.baseline.Baseline;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.signal.Side;
import in.oracore.infrastructure.metrics.PipelineMetrics;
import in.oracore.repository.InMemoryBaselineRepository;
import in.oracore.repository.InMemoryCandleRepository;
import in.oracore.repository.InMemorySignalRepository;
import in.oracore.service.candle.CandleStore;
import in.oracore.service.indicator.IndicatorSettings;
import in.oracore.service.indicator.IndicatorSnapshot;
import in.oracore.service.indicator.IndicatorState;
import in.oracore.service.signal.SignalStore;
import in.oracore.support.MutableClock;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static in.oracore.support.TestCandles.*;
import static in.oracore.support.TestSignals.unsaved;
import static org.junit.jupiter.api.Assertions.*;

class BaselineSamplerTest {

    private static final int BARS = 90;
    private static final Instant FROM = SESSION_OPEN;
    private static final Instant TO = minutes(SESSION_OPEN, BARS);

    private List<Candle> bars;
    private CandleStore candles;
    private SignalStore signals;
    private InMemoryBaselineRepository baselines;
    private CollectorRegistry collectors;
    private PipelineMetrics metrics;
    private MutableClock clock;
    private Instant frontier;

    @BeforeEach
    void setUp() {
        bars = wave("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, BARS, 100, 1000);
        candles = new CandleStore(new InMemoryCandleRepository());
        candles.putBars(bars);
        signals = new SignalStore(new InMemorySignalRepository());
        baselines = new InMemoryBaselineRepository();
        collectors = new CollectorRegistry();
        metrics = new PipelineMetrics(collectors);
        clock = new MutableClock(TO.plusSeconds(600));
        frontier = Instant.MAX;
    }

    @Test
    void samplesEveryWarmBarAtFullRate() {
        List<Baseline> written = sampler(1.0, 0, 42).sample("AAPL", Timeframe.MINUTE_1, FROM, TO);

        assertEquals(warmTimestamps(), timestamps(written));
        assertEquals((double) written.size(), collectors.getSampleValue("oracore_baselines_written_total"));
        assertNotNull(written.get(0).features().get("rsi_14"));
    }

    @Test
    void neverSamplesABarWhereADetectorFired() {
        List<Instant> warm = warmTimestamps();
        List<Instant> fired = List.of(warm.get(0), warm.get(10), warm.get(20));
        for (Instant ts : fired) {
            signals.record(unsaved("AAPL", Timeframe.MINUTE_1, ts, Side.LONG, 100));
        }

        List<Instant> written = timestamps(sampler(1.0, 0, 42).sample("AAPL", Timeframe.MINUTE_1, FROM, TO));

        assertEquals(warm.size() - fired.size(), written.size());
        for (Instant ts : fired) {
            assertFalse(written.contains(ts), "sampled a fired bar at " + ts);
        }
    }

    @Test
    void keepsTheMinimumSpacing() {
        List<Instant> written = timestamps(sampler(1.0, 5, 42).sample("AAPL", Timeframe.MINUTE_1, FROM, TO));

        assertFalse(written.isEmpty());
        for (int i = 1; i < written.size(); i++) {
            assertTrue(Duration.between(written.get(i - 1), written.get(i)).toMinutes() >= 5);
        }
        int warm = warmTimestamps().size();
        assertEquals((warm + 4) / 5, written.size());
    }

    @Test
    void sameSeedPicksTheSameBars() {
        List<Instant> first = timestamps(sampler(0.3, 0, 7).sample("AAPL", Timeframe.MINUTE_1, FROM, TO));

        baselines = new InMemoryBaselineRepository();
        List<Instant> second = timestamps(sampler(0.3, 0, 7).sample("AAPL", Timeframe.MINUTE_1, FROM, TO));

        assertFalse(first.isEmpty());
        assertEquals(first, second);
    }

    @Test
    void rerunningWritesNothingNew() {
        BaselineSampler sampler = sampler(0.5, 2, 42);
        int firstRun = sampler.sample("AAPL", Timeframe.MINUTE_1, FROM, TO).size();

        assertTrue(firstRun > 0);
        assertTrue(sampler.sample("AAPL", Timeframe.MINUTE_1, FROM, TO).isEmpty());
    }

    @Test
    void zeroRateSamplesNothing() {
        assertTrue(sampler(0.0, 0, 42).sample("AAPL", Timeframe.MINUTE_1, FROM, TO).isEmpty());
    }

    @Test
    void barsBeforeTheRangeOnlyWarmTheIndicators() {
        Instant from = minutes(SESSION_OPEN, 60);

        List<Instant> written = timestamps(sampler(1.0, 0, 42).sample("AAPL", Timeframe.MINUTE_1, from, TO));

        assertEquals(30, written.size());
        assertEquals(from, written.get(0));
    }

    @Test
    void leavesBarsDetectionHasNotReachedForALaterCall() {
        frontier = minutes(SESSION_OPEN, 75);
        BaselineSampler sampler = sampler(1.0, 0, 42);

        List<Instant> first = timestamps(sampler.sample("AAPL", Timeframe.MINUTE_1, FROM, TO));

        assertFalse(first.isEmpty());
        assertTrue(first.stream().allMatch(ts -> ts.isBefore(frontier)), "sampled past the frontier: " + first);

        frontier = Instant.MAX;
        List<Instant> second = timestamps(sampler.sample("AAPL", Timeframe.MINUTE_1, FROM, TO));

        assertEquals(15, second.size());
        assertEquals(minutes(SESSION_OPEN, 75), second.get(0));
        assertEquals(warmTimestamps().size(), first.size() + second.size());
    }

    @Test
    void samplesNothingBeforeDetectionHasStarted() {
        frontier = Instant.EPOCH;

        assertTrue(sampler(1.0, 0, 42).sample("AAPL", Timeframe.MINUTE_1, FROM, TO).isEmpty());
        assertTrue(baselines.find("AAPL", Timeframe.MINUTE_1, 1, FROM, TO).isEmpty());
    }

    @Test
    void rejectsRatesOutsideTheUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> sampler(1.5, 0, 42));
        assertThrows(IllegalArgumentException.class, () -> sampler(0.5, -1, 42));
    }

    private BaselineSampler sampler(double rate, int spacing, long seed) {
        return new BaselineSampler(candles, signals, baselines, metrics, IndicatorSettings.defaults(),
            rate, spacing, seed, 1, (symbol, timeframe) -> frontier, clock);
    }

    private List<Instant> warmTimestamps() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        List<Instant> warm = new ArrayList<>();
        for (Candle bar : bars) {
            state.update(bar);
            IndicatorSnapshot s = state.current();
            if (s.rsi14() != null && s.atr14() != null && s.relVolume() != null) {
                warm.add(bar.timestamp());
            }
        }
        return warm;
    }

    private static List<Instant> timestamps(List<Baseline> written) {
        return written.stream().map(Baseline::timestamp).toList();
    }
}
