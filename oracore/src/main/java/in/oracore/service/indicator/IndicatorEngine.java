package in.oracore.service.indicator;

import in.oracore.domain.data.Candle;
import in.oracore.domain.data.StreamKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Indicator Engine - one {@link IndicatorState} per stream.
 *
 * Bars must arrive in order per stream; stale or duplicate bars are ignored so a replayed
 * batch cannot corrupt the rolling windows.
 */
public final class IndicatorEngine {
    private static final Logger log = LoggerFactory.getLogger(IndicatorEngine.class);

    private final IndicatorSettings settings;
    private final Map<StreamKey, IndicatorState> states = new ConcurrentHashMap<>();

    public IndicatorEngine(IndicatorSettings settings) {
        this.settings = settings;
    }

    public IndicatorSettings settings() {
        return settings;
    }

    /**
     * Apply a closed bar to its stream.
     *
     * @return true when the bar advanced the stream, false when it was stale and ignored
     */
    public boolean update(Candle bar) {
        IndicatorState state = states.computeIfAbsent(bar.streamKey(), k -> new IndicatorState(settings));
        boolean applied = state.update(bar);
        if (!applied) {
            log.debug("Ignored stale bar {} at {} (last {})", bar.streamKey(), bar.timestamp(), state.lastTimestamp());
        }
        return applied;
    }

    /**
     * Replace the stream's state with one rebuilt from stored history.
     */
    public void warmup(StreamKey stream, List<Candle> history) {
        IndicatorState state = new IndicatorState(settings);
        for (Candle bar : history) {
            state.update(bar);
        }
        states.put(stream, state);
        log.debug("Warmed up {} with {} bars", stream, history.size());
    }

    /**
     * Drop the stream's state; the next bar for it starts from a fresh warmup.
     */
    public void forget(StreamKey stream) {
        if (states.remove(stream) != null) {
            log.debug("Dropped indicator state for {}", stream);
        }
    }

    public boolean isTracked(StreamKey stream) {
        return states.containsKey(stream);
    }

    public IndicatorSnapshot current(StreamKey stream) {
        IndicatorState state = states.get(stream);
        return state != null ? state.current() : null;
    }

    public IndicatorSnapshot previous(StreamKey stream) {
        IndicatorState state = states.get(stream);
        return state != null ? state.previous() : null;
    }

    public int trackedStreams() {
        return states.size();
    }
}
