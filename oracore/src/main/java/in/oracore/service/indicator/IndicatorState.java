package in.oracore.service.indicator;

import in.oracore.domain.data.Candle;
import in.oracore.service.candle.SessionClock;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Incremental indicator state of a single stream.
 *
 * Not thread-safe: the stream executor guarantees a single writer per stream.
 */
public final class IndicatorState {
    private static final int RSI_PERIOD = 14;
    private static final int ATR_PERIOD = 14;
    private static final int STOCH_PERIOD = 14;
    private static final int BOLLINGER_PERIOD = 20;
    private static final double BOLLINGER_WIDTH = 2.0;
    private static final int BB_WIDTH_HISTORY = 60;
    private static final int VOL_SPIKE_PERIOD = 10;

    private final WilderAverage avgGain = new WilderAverage(RSI_PERIOD);
    private final WilderAverage avgLoss = new WilderAverage(RSI_PERIOD);
    private final RollingExtreme rsiMax = RollingExtreme.max(STOCH_PERIOD);
    private final RollingExtreme rsiMin = RollingExtreme.min(STOCH_PERIOD);

    private final Ema emaFast = new Ema(12);
    private final Ema emaSlow = new Ema(26);
    private final Ema macdSignal = new Ema(9);

    private final RollingWindow sma20 = new RollingWindow(BOLLINGER_PERIOD);
    private final RollingWindow sma50 = new RollingWindow(50);
    private final RollingWindow sma200 = new RollingWindow(200);
    private final Ema ema20 = new Ema(20);
    private final Ema ema50 = new Ema(50);
    private final Ema ema200 = new Ema(200);

    private final WilderAverage atr = new WilderAverage(ATR_PERIOD);
    private final RollingWindow relVolumeWindow;
    private final RollingWindow volSpikeWindow = new RollingWindow(VOL_SPIKE_PERIOD);
    private final ArrayDeque<Double> bbWidths = new ArrayDeque<>(BB_WIDTH_HISTORY + 1);

    private final Map<Integer, RollingExtreme> channelHighs = new HashMap<>();
    private final Map<Integer, RollingWindow> channelVolumes = new HashMap<>();

    private LocalDate vwapSession;
    private double vwapPriceVolume;
    private double vwapVolume;

    private double obv;
    private Double prevClose;
    private Double prevSma20;
    private Double prevSma50;
    private Double prevSma200;
    private Instant lastTimestamp;
    private IndicatorSnapshot current;
    private IndicatorSnapshot previous;

    public IndicatorState(IndicatorSettings settings) {
        this.relVolumeWindow = new RollingWindow(settings.relVolumeWindow());
        for (int lookback : settings.channelLookbacks()) {
            channelHighs.put(lookback, RollingExtreme.max(lookback));
            channelVolumes.put(lookback, new RollingWindow(lookback));
        }
    }

    /**
     * Apply a closed bar.
     *
     * @return false when the bar is not strictly newer than the last one applied; state is unchanged
     */
    public boolean update(Candle bar) {
        if (lastTimestamp != null && !bar.timestamp().isAfter(lastTimestamp)) {
            return false;
        }

        double open = bar.open().doubleValue();
        double high = bar.high().doubleValue();
        double low = bar.low().doubleValue();
        double close = bar.close().doubleValue();
        double volume = bar.volume();

        // RSI (Wilder) and stochastic RSI
        Double rsi = null;
        if (prevClose != null) {
            double change = close - prevClose;
            avgGain.add(Math.max(change, 0.0));
            avgLoss.add(Math.max(-change, 0.0));
            rsi = rsi(avgGain.value(), avgLoss.value());
        }
        Double stochRsi = null;
        if (rsi != null) {
            rsiMax.add(rsi);
            rsiMin.add(rsi);
            Double hi = rsiMax.value();
            Double lo = rsiMin.value();
            if (hi != null && lo != null) {
                stochRsi = hi.equals(lo) ? 0.0 : (rsi - lo) / (hi - lo);
            }
        }

        // MACD
        emaFast.add(close);
        emaSlow.add(close);
        Double macd = null;
        Double signal = null;
        Double histogram = null;
        if (emaFast.value() != null && emaSlow.value() != null) {
            macd = emaFast.value() - emaSlow.value();
            macdSignal.add(macd);
            signal = macdSignal.value();
            histogram = signal != null ? macd - signal : null;
        }

        // Moving averages
        sma20.add(close);
        sma50.add(close);
        sma200.add(close);
        ema20.add(close);
        ema50.add(close);
        ema200.add(close);

        // ATR (Wilder) of true range
        if (prevClose != null) {
            double trueRange = Math.max(high - low, Math.max(Math.abs(high - prevClose), Math.abs(low - prevClose)));
            atr.add(trueRange);
        }

        // Bollinger(20, 2) on the SMA20 window
        Double bbWidth = null;
        Double bbPercent = null;
        Double middle = sma20.mean();
        Double sigma = sma20.stdDev();
        if (middle != null && sigma != null) {
            double upper = middle + BOLLINGER_WIDTH * sigma;
            double lower = middle - BOLLINGER_WIDTH * sigma;
            if (middle != 0.0) {
                bbWidth = (upper - lower) / middle;
            }
            if (upper > lower) {
                bbPercent = (close - lower) / (upper - lower);
            }
        }

        if (bbWidth != null) {
            bbWidths.addLast(bbWidth);
            if (bbWidths.size() > BB_WIDTH_HISTORY) {
                bbWidths.removeFirst();
            }
        }

        // Relative volume against the preceding bars only
        Double priorVolume = relVolumeWindow.mean();
        Double relVolume = priorVolume != null && priorVolume > 0 ? volume / priorVolume : null;
        relVolumeWindow.add(volume);
        Double priorSpikeVolume = volSpikeWindow.mean();
        Double volSpike10 = priorSpikeVolume != null && priorSpikeVolume > 0 ? volume / priorSpikeVolume : null;
        volSpikeWindow.add(volume);

        // On-balance volume, zero on the first bar
        if (prevClose != null) {
            if (close > prevClose) {
                obv += volume;
            } else if (close < prevClose) {
                obv -= volume;
            }
        }

        Double atrValue = atr.value();
        Double atrPct = atrValue != null && close != 0.0 ? 100.0 * atrValue / close : null;
        Double mean20 = sma20.mean();
        Double mean50 = sma50.mean();
        Double mean200 = sma200.mean();

        // Channel features, read before this bar enters the windows
        Map<Integer, Double> priorHighs = new HashMap<>();
        Map<Integer, Double> priorMeanVolumes = new HashMap<>();
        for (Map.Entry<Integer, RollingExtreme> e : channelHighs.entrySet()) {
            Double h = e.getValue().value();
            if (h != null) priorHighs.put(e.getKey(), h);
            e.getValue().add(high);
        }
        for (Map.Entry<Integer, RollingWindow> e : channelVolumes.entrySet()) {
            Double v = e.getValue().mean();
            if (v != null) priorMeanVolumes.put(e.getKey(), v);
            e.getValue().add(volume);
        }

        // Session VWAP
        LocalDate session = SessionClock.sessionDate(bar.timestamp());
        if (!session.equals(vwapSession)) {
            vwapSession = session;
            vwapPriceVolume = 0.0;
            vwapVolume = 0.0;
        }
        double price = bar.vwap() != null ? bar.vwap().doubleValue() : (high + low + close) / 3.0;
        vwapPriceVolume += price * volume;
        vwapVolume += volume;
        Double sessionVwap = vwapVolume > 0 ? vwapPriceVolume / vwapVolume : null;
        Double vwapDistance = sessionVwap != null && sessionVwap != 0.0 ? (close - sessionVwap) / sessionVwap : null;

        previous = current;
        current = new IndicatorSnapshot(
            bar.timestamp(), open, high, low, close, volume,
            rsi, macd, signal, histogram,
            mean20, mean50, mean200,
            ema20.value(), ema50.value(), ema200.value(),
            atrValue, bbWidth, bbPercent, stochRsi,
            relVolume, sessionVwap, vwapDistance,
            obv, atrPct,
            pctFrom(close, mean20), pctFrom(close, mean50), pctFrom(close, mean200),
            pctFrom(mean20, prevSma20), pctFrom(mean50, prevSma50), pctFrom(mean200, prevSma200),
            volSpike10, List.copyOf(bbWidths),
            priorHighs, priorMeanVolumes);
        prevClose = close;
        prevSma20 = mean20;
        prevSma50 = mean50;
        prevSma200 = mean200;
        lastTimestamp = bar.timestamp();
        return true;
    }

    public IndicatorSnapshot current() {
        return current;
    }

    public IndicatorSnapshot previous() {
        return previous;
    }

    public Instant lastTimestamp() {
        return lastTimestamp;
    }

    /**
     * {@code 100 * (value / base - 1)}, null when either side is missing or the base is zero.
     */
    static Double pctFrom(Double value, Double base) {
        if (value == null || base == null || base == 0.0) {
            return null;
        }
        return 100.0 * (value / base - 1.0);
    }

    static Double rsi(Double gain, Double loss) {
        if (gain == null || loss == null) {
            return null;
        }
        if (loss == 0.0) {
            return gain == 0.0 ? 50.0 : 100.0;
        }
        return 100.0 - 100.0 / (1.0 + gain / loss);
    }
}
