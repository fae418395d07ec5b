package in.oracore.service.detector;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.StreamKey;
import in.oracore.domain.data.Timeframe;
import in.oracore.service.indicator.IndicatorSnapshot;

import java.util.Map;

/**
 * Everything a detector may look at for one closed bar.
 *
 * @param previous snapshot of the bar before, null on the first bar of a stream
 * @param higherTimeframes latest snapshot of each coarser stream of the same symbol whose bar
 *                         had closed by the time this bar closed; absent when none is available
 */
public record DetectionContext(
        StreamKey stream,
        Candle bar,
        IndicatorSnapshot current,
        IndicatorSnapshot previous,
        Map<Timeframe, IndicatorSnapshot> higherTimeframes) {

    public DetectionContext {
        higherTimeframes = higherTimeframes == null ? Map.of() : Map.copyOf(higherTimeframes);
    }

    public DetectionContext(StreamKey stream, Candle bar, IndicatorSnapshot current, IndicatorSnapshot previous) {
        this(stream, bar, current, previous, Map.of());
    }

    public IndicatorSnapshot higher(Timeframe timeframe) {
        return higherTimeframes.get(timeframe);
    }
}
