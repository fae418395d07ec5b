package in.oracore.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.oracore.domain.common.ProviderException;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.Quote;
import in.oracore.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Massive (Polygon-compatible) REST client for aggregates and NBBO quotes.
 *
 * Aggregates: {@code GET /v2/aggs/ticker/{ticker}/range/{multiplier}/{timespan}/{fromMs}/{toMs}},
 * followed through {@code next_url} pages. Quotes: {@code GET /v2/last/nbbo/{ticker}}.
 * Throttling (429), server errors (5xx) and I/O failures raise {@link ProviderException}.
 */
public final class MassiveBarProvider implements BarProvider {
    private static final Logger log = LoggerFactory.getLogger(MassiveBarProvider.class);

    public static final String DEFAULT_BASE_URL = "https://api.massive.com";

    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final int PAGE_LIMIT = 50_000;
    private static final int MAX_PAGES = 100;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public MassiveBarProvider(String baseUrl, String apiKey) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), baseUrl, apiKey);
    }

    MassiveBarProvider(HttpClient httpClient, String baseUrl, String apiKey) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return "massive";
    }

    @Override
    public List<Candle> fetchBars(String ticker, Timeframe timeframe, Instant from, Instant to) {
        // Aggregate ranges are inclusive on both ends; the last millisecond before 'to' keeps the range half-open
        long toMs = to.toEpochMilli() - 1;
        String url = baseUrl + "/v2/aggs/ticker/" + encode(ticker) + "/range/"
            + multiplier(timeframe) + "/" + timespan(timeframe) + "/"
            + from.toEpochMilli() + "/" + toMs
            + "?adjusted=true&sort=asc&limit=" + PAGE_LIMIT;

        List<Candle> bars = new ArrayList<>();
        int pages = 0;
        while (url != null && pages++ < MAX_PAGES) {
            JsonNode body = get(url, ticker);
            bars.addAll(parseAggregates(body, ticker, timeframe));
            JsonNode next = body.get("next_url");
            url = next != null && !next.isNull() && !next.asText().isEmpty() ? next.asText() : null;
        }

        bars.removeIf(c -> c.timestamp().isBefore(from) || !c.timestamp().isBefore(to));
        log.debug("Fetched {} {} bars for {} [{}, {})", bars.size(), timeframe, ticker, from, to);
        return bars;
    }

    @Override
    public Optional<Quote> fetchQuote(String ticker) {
        JsonNode body = get(baseUrl + "/v2/last/nbbo/" + encode(ticker), ticker);
        return parseQuote(body, ticker);
    }

    List<Candle> parseAggregates(JsonNode body, String ticker, Timeframe timeframe) {
        JsonNode results = body.get("results");
        if (results == null || !results.isArray()) {
            return List.of();
        }

        List<Candle> bars = new ArrayList<>(results.size());
        for (JsonNode agg : results) {
            BigDecimal vwap = agg.hasNonNull("vw") ? agg.get("vw").decimalValue() : null;
            Long trades = agg.hasNonNull("n") ? agg.get("n").asLong() : null;
            bars.add(new Candle(
                ticker,
                timeframe,
                Instant.ofEpochMilli(agg.get("t").asLong()),
                agg.get("o").decimalValue(),
                agg.get("h").decimalValue(),
                agg.get("l").decimalValue(),
                agg.get("c").decimalValue(),
                agg.get("v").asLong(),
                vwap,
                trades,
                Candle.SOURCE_PROVIDER,
                true
            ));
        }
        return bars;
    }

    Optional<Quote> parseQuote(JsonNode body, String ticker) {
        JsonNode results = body.get("results");
        if (results == null || !results.hasNonNull("p") || !results.hasNonNull("P")) {
            return Optional.empty();
        }
        // NBBO timestamps are nanoseconds since epoch
        Instant ts = results.hasNonNull("t")
            ? Instant.ofEpochSecond(0, results.get("t").asLong())
            : null;
        return Optional.of(new Quote(ticker, results.get("p").decimalValue(), results.get("P").decimalValue(), ts));
    }

    private JsonNode get(String url, String ticker) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(withApiKey(url)))
            .timeout(TIMEOUT)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException("Massive request failed for " + ticker + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Massive request interrupted for " + ticker, e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new ProviderException("Massive HTTP " + status + " for " + ticker, status, null);
        }
        if (status != 200) {
            log.error("Massive HTTP {} for {}: {}", status, ticker, abbreviate(response.body()));
            throw new ProviderException("Massive HTTP " + status + " for " + ticker, status, null);
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new ProviderException("Unparseable Massive response for " + ticker, e);
        }
    }

    private String withApiKey(String url) {
        return url + (url.contains("?") ? "&" : "?") + "apiKey=" + encode(apiKey);
    }

    static int multiplier(Timeframe timeframe) {
        return switch (timeframe) {
            case MINUTE_1, HOUR_1, DAY_1 -> 1;
            case MINUTE_5 -> 5;
            case MINUTE_15 -> 15;
            case HOUR_4 -> 4;
            case HOUR_5 -> 5;
        };
    }

    static String timespan(Timeframe timeframe) {
        return switch (timeframe) {
            case MINUTE_1, MINUTE_5, MINUTE_15 -> "minute";
            case HOUR_1, HOUR_4, HOUR_5 -> "hour";
            case DAY_1 -> "day";
        };
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        return body == null ? "" : body.substring(0, Math.min(200, body.length()));
    }
}
