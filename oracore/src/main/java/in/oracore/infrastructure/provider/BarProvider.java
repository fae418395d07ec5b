package in.oracore.infrastructure.provider;

import in.oracore.domain.common.ProviderException;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Quote;
import in.oracore.domain.data.Timeframe;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Source of historical and recent OHLCV bars.
 */
public interface BarProvider {

    /**
     * Bars with {@code from <= ts < to}, ascending. May return fewer bars than the range
     * covers (halts, illiquid periods); missing bars are never an error here.
     *
     * @throws ProviderException on a transient failure worth retrying
     */
    List<Candle> fetchBars(String ticker, Timeframe timeframe, Instant from, Instant to);

    /**
     * Latest best bid/ask, when the provider offers one.
     *
     * @throws ProviderException on a transient failure
     */
    default Optional<Quote> fetchQuote(String ticker) {
        return Optional.empty();
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
