package in.oracore.service.detector;

import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.detector.DetectorKind;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.SignalCandidate;
import in.oracore.service.indicator.IndicatorSettings;
import in.oracore.service.indicator.IndicatorState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static in.oracore.support.TestCandles.*;
import static org.junit.jupiter.api.Assertions.*;

class BreakoutDetectorTest {

    private BreakoutDetector detector;
    private IndicatorState state;
    private int index;

    @BeforeEach
    void setUp() {
        detector = new BreakoutDetector(new DetectorDefinition("breakout_v1", "1", DetectorKind.RULE, null,
            Map.of("lookback", 3, "volume_multiplier", 1.5)));
        state = new IndicatorState(IndicatorSettings.defaults().withLookbacks(detector.requiredLookbacks()));
        index = 0;
    }

    @Test
    void firesOnTheFirstBarOfABreakout() {
        assertTrue(feed(10, 10, 100).isEmpty());
        assertTrue(feed(10, 10, 100).isEmpty());
        assertTrue(feed(10, 10, 100).isEmpty());

        Optional<SignalCandidate> fired = feed(11, 11, 300);

        assertTrue(fired.isPresent());
        assertEquals(Side.LONG, fired.get().side());
        assertEquals(10.0, fired.get().extraFeatures().get("breakout_prior_high"));
        assertEquals(100.0, fired.get().extraFeatures().get("breakout_avg_volume"));
        // (11/10 - 1) + (300 / 150 - 1)
        assertEquals(1.1, fired.get().score(), 1e-9);
    }

    @Test
    void doesNotRepeatWhileTheBreakoutContinues() {
        feed(10, 10, 100);
        feed(10, 10, 100);
        feed(10, 10, 100);
        assertTrue(feed(11, 11, 300).isPresent());

        // Still above the prior high on heavy volume: same run, no new signal
        assertTrue(feed(12, 12, 400).isEmpty());
    }

    @Test
    void firesAgainAfterTheRunEnds() {
        feed(10, 10, 100);
        feed(10, 10, 100);
        feed(10, 10, 100);
        assertTrue(feed(11, 11, 300).isPresent());
        assertTrue(feed(10.5, 11, 100).isEmpty());

        assertTrue(feed(12, 12, 600).isPresent());
    }

    @Test
    void needsVolumeConfirmation() {
        feed(10, 10, 100);
        feed(10, 10, 100);
        feed(10, 10, 100);

        assertTrue(feed(11, 11, 120).isEmpty());
    }

    @Test
    void isSilentUntilTheLookbackIsWarm() {
        feed(10, 10, 100);
        feed(10, 10, 100);

        assertTrue(feed(20, 20, 1000).isEmpty());
    }

    @Test
    void rejectsBadParameters() {
        assertThrows(ConfigValidationException.class, () -> new BreakoutDetector(new DetectorDefinition(
            "b", "1", DetectorKind.RULE, null, Map.of("volume_multiplier", "lots"))));
        assertThrows(ConfigValidationException.class, () -> new BreakoutDetector(new DetectorDefinition(
            "b", "1", DetectorKind.RULE, null, Map.of("lookback", 0))));
        assertThrows(ConfigValidationException.class, () -> new BreakoutDetector(new DetectorDefinition(
            "b", "1", DetectorKind.MODEL, null, Map.of())));
    }

    private Optional<SignalCandidate> feed(double close, double high, long volume) {
        Candle bar = bar("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, index++), close, high, close - 0.5, close, volume);
        state.update(bar);
        return detector.evaluate(new DetectionContext(bar.streamKey(), bar, state.current(), state.previous()));
    }
}
