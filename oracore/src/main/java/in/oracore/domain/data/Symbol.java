package in.oracore.domain.data;

import java.time.Instant;

/**
 * Tradable instrument. Unique by (ticker, exchange).
 */
public record Symbol(
        Long id,
        String ticker,
        String exchange,
        String assetType,
        String currency,
        Instant firstSeen,
        Instant lastSeen) {

    public static final String DEFAULT_EXCHANGE = "";
    public static final String DEFAULT_ASSET_TYPE = "equity";
    public static final String DEFAULT_CURRENCY = "USD";
}
