package in.oracore.service.detector;

import in.oracore.config.DetectorConfig;
import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.detector.DetectorKind;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.SignalCandidate;
import in.oracore.service.indicator.IndicatorSettings;
import in.oracore.service.indicator.IndicatorSnapshot;
import in.oracore.service.indicator.IndicatorState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static in.oracore.support.TestCandles.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelDetectorTest {

    @Mock
    private ScoringModel model;

    @Test
    void firesWhenTheModelIsConfident() {
        when(model.score(any())).thenReturn(new ModelScore(0.9, 0.015));
        when(model.modelVersion()).thenReturn(3);
        ModelDetector detector = detector(Map.of("model", "momentum", "confidence_min", 0.8, "side", "short"));

        Optional<SignalCandidate> fired = detector.evaluate(warmContext());

        assertTrue(fired.isPresent());
        assertEquals(Side.SHORT, fired.get().side());
        assertEquals(0.9, fired.get().score());
        assertEquals(3.0, fired.get().extraFeatures().get("model_version"));
        assertEquals(0.015, fired.get().extraFeatures().get("model_target_return"));

        ArgumentCaptor<double[]> features = ArgumentCaptor.forClass(double[].class);
        verify(model).score(features.capture());
        assertEquals(IndicatorSnapshot.FEATURE_NAMES.size(), features.getValue().length);
    }

    @Test
    void staysSilentBelowTheConfidenceFloor() {
        when(model.score(any())).thenReturn(new ModelScore(0.6, null));
        ModelDetector detector = detector(Map.of("model", "momentum"));

        assertTrue(detector.evaluate(warmContext()).isEmpty());
    }

    @Test
    void doesNotScoreUntilEveryFeatureIsWarm() {
        ModelDetector detector = detector(Map.of("model", "momentum"));
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        Candle bar = flat("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 100, 1000);
        state.update(bar);

        assertTrue(detector.evaluate(new DetectionContext(bar.streamKey(), bar, state.current(), null)).isEmpty());
        verifyNoInteractions(model);
    }

    @Test
    void rejectsAnOutOfRangeConfidenceFloor() {
        assertThrows(ConfigValidationException.class, () -> detector(Map.of("confidence_min", 1.5)));
    }

    @Test
    void factoryRejectsUnknownModels() {
        DetectorFactory factory = new DetectorFactory(Map.of("momentum", model));
        DetectorDefinition def = new DetectorDefinition("m", "1", DetectorKind.MODEL, null, Map.of("model", "other"));

        assertThrows(ConfigValidationException.class,
            () -> factory.create(new DetectorConfig(ModelDetector.TYPE, def)));
    }

    private ModelDetector detector(Map<String, Object> params) {
        return new ModelDetector(new DetectorDefinition("model_v1", "1", DetectorKind.MODEL, null, params), model);
    }

    private DetectionContext warmContext() {
        IndicatorState state = new IndicatorState(IndicatorSettings.defaults());
        List<Candle> bars = wave("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, IndicatorSettings.WARMUP_BARS, 100, 1000);
        bars.forEach(state::update);
        Candle last = bars.get(bars.size() - 1);
        return new DetectionContext(last.streamKey(), last, state.current(), state.previous());
    }
}
