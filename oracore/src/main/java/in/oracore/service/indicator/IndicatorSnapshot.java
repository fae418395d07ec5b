package in.oracore.service.indicator;

import in.oracore.domain.signal.FeatureSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Indicator values of one stream as of one closed bar. Any indicator still warming up is null.
 *
 * {@code priorHighs} and {@code priorMeanVolumes} are keyed by lookback and describe the
 * bars before this one, never including it. Fields named {@code pct} are percentages
 * (2.0 means 2%); {@code bbWidth} and {@code vwapDistance} are plain fractions.
 *
 * @param bbWidthHistory Bollinger width of up to the last 60 bars, oldest first, ending with this one
 */
public record IndicatorSnapshot(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume,
        Double rsi14,
        Double macd,
        Double macdSignal,
        Double macdHistogram,
        Double sma20,
        Double sma50,
        Double sma200,
        Double ema20,
        Double ema50,
        Double ema200,
        Double atr14,
        Double bbWidth,
        Double bbPercent,
        Double stochRsi,
        Double relVolume,
        Double sessionVwap,
        Double vwapDistance,
        Double obv,
        Double atrPct,
        Double pctFromSma20,
        Double pctFromSma50,
        Double pctFromSma200,
        Double trendSma20Pct,
        Double trendSma50Pct,
        Double trendSma200Pct,
        Double volSpike10,
        List<Double> bbWidthHistory,
        Map<Integer, Double> priorHighs,
        Map<Integer, Double> priorMeanVolumes) {

    /** Fixed order of the model feature vector. */
    public static final List<String> FEATURE_NAMES = List.of(
        "rsi_14", "macd", "macd_signal", "macd_hist",
        "sma_20", "sma_50", "sma_200", "ema_20", "ema_50", "ema_200",
        "atr_14", "bb_width", "bb_percent", "stoch_rsi", "rel_volume", "vwap_distance");

    /** Extra named values recorded with every signal and baseline, outside the model vector. */
    public static final List<String> CONTEXT_FEATURE_NAMES = List.of(
        "obv", "atr_pct", "pct_from_sma_20", "pct_from_sma_50", "pct_from_sma_200",
        "trend_sma_20_pct", "trend_sma_50_pct", "trend_sma_200_pct", "vol_spike_10");

    public IndicatorSnapshot {
        bbWidthHistory = List.copyOf(bbWidthHistory);
        priorHighs = Map.copyOf(priorHighs);
        priorMeanVolumes = Map.copyOf(priorMeanVolumes);
    }

    public Double priorHigh(int lookback) {
        return priorHighs.get(lookback);
    }

    public Double priorMeanVolume(int lookback) {
        return priorMeanVolumes.get(lookback);
    }

    /**
     * Linear-interpolated percentile of {@link #bbWidthHistory()}, or null with fewer than
     * {@code minValues} widths.
     *
     * @param percentile in [0, 100]
     */
    public Double bbWidthPercentile(double percentile, int minValues) {
        if (bbWidthHistory.isEmpty() || bbWidthHistory.size() < minValues) {
            return null;
        }
        List<Double> sorted = new ArrayList<>(bbWidthHistory);
        Collections.sort(sorted);
        double rank = (sorted.size() - 1) * (percentile / 100.0);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted.get(lower);
        }
        return sorted.get(lower) * (upper - rank) + sorted.get(upper) * (rank - lower);
    }

    /**
     * Named feature values: {@link #FEATURE_NAMES} then {@link #CONTEXT_FEATURE_NAMES}; nulls preserved.
     */
    public Map<String, Double> featureMap() {
        Double[] values = {
            rsi14, macd, macdSignal, macdHistogram,
            sma20, sma50, sma200, ema20, ema50, ema200,
            atr14, bbWidth, bbPercent, stochRsi, relVolume, vwapDistance};
        Double[] context = {
            obv, atrPct, pctFromSma20, pctFromSma50, pctFromSma200,
            trendSma20Pct, trendSma50Pct, trendSma200Pct, volSpike10};
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(FEATURE_NAMES.get(i), values[i]);
        }
        for (int i = 0; i < context.length; i++) {
            map.put(CONTEXT_FEATURE_NAMES.get(i), context[i]);
        }
        return map;
    }

    public FeatureSnapshot toFeatureSnapshot() {
        return FeatureSnapshot.of(featureMap());
    }

    /**
     * Dense feature vector for scoring models, or null if any feature is still warming up.
     */
    public double[] featureVector() {
        Map<String, Double> map = featureMap();
        double[] vector = new double[FEATURE_NAMES.size()];
        int i = 0;
        for (String name : FEATURE_NAMES) {
            Double value = map.get(name);
            if (value == null) {
                return null;
            }
            vector[i++] = value;
        }
        return vector;
    }
}
