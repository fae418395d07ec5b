package in.oracore.service.detector;

import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.detector.DetectorKind;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.SignalCandidate;
import in.oracore.service.indicator.IndicatorSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Momentum-gated breakout.
 *
 * Fires on every bar that closes above the high of the preceding {@code lookback} bars on at
 * least {@code volume_ratio} relative volume, provided all momentum gates pass:
 * <ul>
 *   <li>RSI(14) within [{@code rsi_min}, {@code rsi_max}]</li>
 *   <li>MACD histogram positive and above the previous bar's</li>
 *   <li>distance from session VWAP within [{@code vwap_min_pct}, {@code vwap_max_pct}] percent</li>
 *   <li>close {@code sma20_min_pct} to {@code sma20_max_pct} percent above SMA20, and not below SMA50</li>
 *   <li>Bollinger width between its {@code bb_low_percentile} and {@code bb_high_percentile}
 *       over the last 60 bars, with at least {@code bb_min_history} widths known</li>
 * </ul>
 * Any input still warming up means the bar is not evaluated.
 *
 * The score adds up to 100: breakout size (40), excess volume (25), momentum (20),
 * higher-timeframe alignment (10) and low volatility (5). Alignment needs the 15m close above
 * its SMA20 and SMA50, the 1h close above its SMA20 and the 4h close at or above its SMA20.
 */
public final class Breakout20Detector implements Detector {
    public static final String TYPE = "breakout20";

    private final DetectorDefinition definition;
    private final int lookback;
    private final double volumeRatio;
    private final double rsiMin;
    private final double rsiMax;
    private final double vwapMinPct;
    private final double vwapMaxPct;
    private final double sma20MinPct;
    private final double sma20MaxPct;
    private final double sma50MinPct;
    private final double bbLowPercentile;
    private final double bbHighPercentile;
    private final int bbMinHistory;

    public Breakout20Detector(DetectorDefinition definition) {
        if (definition.kind() != DetectorKind.RULE) {
            throw new ConfigValidationException("Breakout20 detector " + definition.key() + " must be a rule detector");
        }
        this.definition = definition;
        this.lookback = definition.intParam("lookback", 10);
        this.volumeRatio = definition.doubleParam("volume_ratio", 1.5);
        this.rsiMin = definition.doubleParam("rsi_min", 55);
        this.rsiMax = definition.doubleParam("rsi_max", 85);
        this.vwapMinPct = definition.doubleParam("vwap_min_pct", -1.0);
        this.vwapMaxPct = definition.doubleParam("vwap_max_pct", 5.0);
        this.sma20MinPct = definition.doubleParam("sma20_min_pct", 2.0);
        this.sma20MaxPct = definition.doubleParam("sma20_max_pct", 12.0);
        this.sma50MinPct = definition.doubleParam("sma50_min_pct", 0.0);
        this.bbLowPercentile = definition.doubleParam("bb_low_percentile", 3);
        this.bbHighPercentile = definition.doubleParam("bb_high_percentile", 75);
        this.bbMinHistory = definition.intParam("bb_min_history", 10);

        String key = definition.key();
        if (lookback < 1) {
            throw new ConfigValidationException("Breakout20 detector " + key + ": lookback must be >= 1");
        }
        if (volumeRatio <= 0) {
            throw new ConfigValidationException("Breakout20 detector " + key + ": volume_ratio must be > 0");
        }
        if (rsiMin > rsiMax || vwapMinPct > vwapMaxPct || sma20MinPct > sma20MaxPct) {
            throw new ConfigValidationException("Breakout20 detector " + key + ": a band has min above max");
        }
        if (bbLowPercentile < 0 || bbHighPercentile > 100 || bbLowPercentile > bbHighPercentile) {
            throw new ConfigValidationException(
                "Breakout20 detector " + key + ": Bollinger percentiles must satisfy 0 <= low <= high <= 100");
        }
        if (bbMinHistory < 1) {
            throw new ConfigValidationException("Breakout20 detector " + key + ": bb_min_history must be >= 1");
        }
    }

    @Override
    public DetectorDefinition definition() {
        return definition;
    }

    @Override
    public Set<Integer> requiredLookbacks() {
        return Set.of(lookback);
    }

    @Override
    public Optional<SignalCandidate> evaluate(DetectionContext context) {
        IndicatorSnapshot now = context.current();
        IndicatorSnapshot prev = context.previous();
        Double priorHigh = now.priorHigh(lookback);
        if (prev == null || priorHigh == null || priorHigh <= 0 || now.relVolume() == null) {
            return Optional.empty();
        }
        if (now.close() <= priorHigh || now.relVolume() < volumeRatio) {
            return Optional.empty();
        }
        if (!momentumHolds(now, prev)) {
            return Optional.empty();
        }

        int multiTf = multiTimeframeConfirmation(context) ? 1 : 0;
        double breakout = now.close() / priorHigh - 1.0;

        Map<String, Double> extra = new LinkedHashMap<>();
        extra.put("breakout_prior_high", priorHigh);
        extra.put("macd_hist_prev", prev.macdHistogram());
        extra.put("vwap_distance_pct", 100.0 * now.vwapDistance());
        extra.put("multitf_confirmation", (double) multiTf);
        return Optional.of(new SignalCandidate(Side.LONG, score(breakout, now, multiTf), extra));
    }

    private boolean momentumHolds(IndicatorSnapshot now, IndicatorSnapshot prev) {
        Double rsi = now.rsi14();
        Double hist = now.macdHistogram();
        Double histPrev = prev.macdHistogram();
        Double vwapDistance = now.vwapDistance();
        Double fromSma20 = now.pctFromSma20();
        Double fromSma50 = now.pctFromSma50();
        Double bbWidth = now.bbWidth();
        Double bbLow = now.bbWidthPercentile(bbLowPercentile, bbMinHistory);
        Double bbHigh = now.bbWidthPercentile(bbHighPercentile, bbMinHistory);
        if (rsi == null || hist == null || histPrev == null || vwapDistance == null
            || fromSma20 == null || fromSma50 == null || bbWidth == null || bbLow == null || bbHigh == null) {
            return false;
        }

        double vwapPct = 100.0 * vwapDistance;
        return rsi >= rsiMin && rsi <= rsiMax
            && hist > 0 && hist > histPrev
            && vwapPct >= vwapMinPct && vwapPct <= vwapMaxPct
            && fromSma20 >= sma20MinPct && fromSma20 <= sma20MaxPct
            && fromSma50 >= sma50MinPct
            && bbWidth >= bbLow && bbWidth <= bbHigh;
    }

    static boolean multiTimeframeConfirmation(DetectionContext context) {
        IndicatorSnapshot m15 = context.higher(Timeframe.MINUTE_15);
        IndicatorSnapshot h1 = context.higher(Timeframe.HOUR_1);
        IndicatorSnapshot h4 = context.higher(Timeframe.HOUR_4);
        if (m15 == null || m15.sma20() == null || m15.sma50() == null
            || h1 == null || h1.sma20() == null
            || h4 == null || h4.sma20() == null) {
            return false;
        }
        return m15.close() > m15.sma20() && m15.close() > m15.sma50()
            && h1.close() > h1.sma20()
            && h4.close() >= h4.sma20();
    }

    static double score(double breakout, IndicatorSnapshot now, int multiTf) {
        double breakoutScore = Math.min(breakout / 0.02, 1.0) * 40;
        double volumeScore = Math.min(Math.max(now.relVolume() - 1.0, 0.0), 1.0) * 25;

        double bits = Math.min(Math.max((now.rsi14() - 50.0) / 35.0, 0.0), 1.0);
        bits += now.macdHistogram() > 0 ? 1 : 0;
        int count = 2;
        if (now.bbPercent() != null) {
            bits += now.bbPercent() >= 0.3 && now.bbPercent() <= 0.8 ? 1 : 0;
            count++;
        }
        double momentumScore = bits / count * 20;

        double mtfScore = multiTf * 10.0;
        double riskScore = now.atrPct() != null ? (1.0 - Math.min(now.atrPct() / 5.0, 1.0)) * 5 : 0.0;
        return breakoutScore + volumeScore + momentumScore + mtfScore + riskScore;
    }
}
