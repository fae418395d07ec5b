package in.oracore.domain.signal;

import in.oracore.domain.data.Timeframe;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Detector firing on a closed bar.
 *
 * Immutable once written. {@code id} and {@code createdAt} are null until the row is stored.
 * {@code firedAt} is the open timestamp of the firing bar and {@code entryPrice} its close.
 */
public record Signal(
        Long id,
        String symbol,
        Timeframe timeframe,
        Instant firedAt,
        String detectorId,
        String detectorVersion,
        Side side,
        BigDecimal entryPrice,
        BigDecimal bid,
        BigDecimal ask,
        BigDecimal spread,
        Double relVolume,
        SessionFlag session,
        Double score,
        FeatureSnapshot features,
        Long dataFreshnessMs,
        String sourceSystem,
        Instant createdAt) {

    public Signal {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timeframe, "timeframe");
        Objects.requireNonNull(firedAt, "firedAt");
        Objects.requireNonNull(detectorId, "detectorId");
        Objects.requireNonNull(detectorVersion, "detectorVersion");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(entryPrice, "entryPrice");
        if (features == null) {
            features = FeatureSnapshot.of(null);
        }
    }

    public SignalKey key() {
        return new SignalKey(symbol, timeframe, firedAt, detectorId, detectorVersion);
    }

    /**
     * Copy carrying the identity assigned by the store.
     */
    public Signal stored(long assignedId, Instant assignedCreatedAt) {
        return new Signal(assignedId, symbol, timeframe, firedAt, detectorId, detectorVersion, side,
            entryPrice, bid, ask, spread, relVolume, session, score, features, dataFreshnessMs,
            sourceSystem, assignedCreatedAt);
    }
}
