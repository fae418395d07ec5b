package in.oracore.support;

import in.oracore.domain.data.Timeframe;
import in.oracore.domain.signal.FeatureSnapshot;
import in.oracore.domain.signal.SessionFlag;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.Signal;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public final class TestSignals {

    public static Signal signal(Long id, String symbol, Timeframe tf, Instant firedAt, Side side, double entry) {
        return new Signal(id, symbol, tf, firedAt, "breakout_v1", "1", side,
            BigDecimal.valueOf(entry).setScale(6), null, null, null, 1.0, SessionFlag.REGULAR, 0.5,
            FeatureSnapshot.of(Map.of("rsi_14", 55.0)), 0L, "oracore", null);
    }

    public static Signal unsaved(String symbol, Timeframe tf, Instant firedAt, Side side, double entry) {
        return signal(null, symbol, tf, firedAt, side, entry);
    }

    private TestSignals() {}
}
