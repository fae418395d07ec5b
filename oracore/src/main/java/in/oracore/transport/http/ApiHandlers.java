package in.oracore.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.oracore.domain.data.Timeframe;
import in.oracore.domain.outcome.Outcome;
import in.oracore.domain.signal.Signal;
import in.oracore.service.pipeline.CycleSummary;
import in.oracore.service.signal.SignalQueryService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-only HTTP API over signals and outcomes.
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SignalQueryService queryService;
    private final Supplier<Optional<CycleSummary>> lastCycle;
    private final Clock clock;

    public ApiHandlers(SignalQueryService queryService, Supplier<Optional<CycleSummary>> lastCycle, Clock clock) {
        this.queryService = queryService;
        this.lastCycle = lastCycle;
        this.clock = clock;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", clock.instant().toString());

        lastCycle.get().ifPresent(cycle -> {
            ObjectNode node = health.putObject("lastCycle");
            node.put("durationMs", cycle.duration().toMillis());
            node.put("symbols", cycle.streams().size());
            node.put("barsIngested", cycle.barsIngested());
            node.put("signals", cycle.signals().size());
            node.put("detectorFailures", cycle.detectorFailures().size());
            node.put("failedStreams", cycle.failedStreams().size());
            node.put("status", cycle.status().name());
        });

        sendJson(exchange, health.toString());
    }

    /**
     * GET /api/signals?symbol=&timeframe=&since=&limit=
     * Returns signals newest first.
     */
    public void signals(HttpServerExchange exchange) {
        Map<String, Deque<String>> params = exchange.getQueryParameters();
        String symbol = first(params, "symbol");

        Timeframe timeframe = null;
        String tfParam = first(params, "timeframe");
        if (tfParam != null) {
            try {
                timeframe = Timeframe.fromCode(tfParam);
            } catch (IllegalArgumentException e) {
                badRequest(exchange, "Unknown timeframe: " + tfParam);
                return;
            }
        }

        Instant since = null;
        String sinceParam = first(params, "since");
        if (sinceParam != null) {
            try {
                since = Instant.parse(sinceParam);
            } catch (DateTimeParseException e) {
                badRequest(exchange, "since must be an ISO-8601 instant");
                return;
            }
        }

        int limit = SignalQueryService.DEFAULT_LIMIT;
        String limitParam = first(params, "limit");
        if (limitParam != null) {
            try {
                limit = Integer.parseInt(limitParam);
            } catch (NumberFormatException e) {
                badRequest(exchange, "limit must be an integer");
                return;
            }
        }

        try {
            List<Signal> signals = queryService.querySignals(symbol, timeframe, since, limit);
            ArrayNode array = MAPPER.createArrayNode();
            for (Signal signal : signals) {
                array.add(toJson(signal));
            }
            sendJson(exchange, array.toString());
        } catch (Exception e) {
            log.error("Error fetching signals: {}", e.getMessage(), e);
            serverError(exchange, "Failed to fetch signals");
        }
    }

    /**
     * GET /api/signals/{id}/outcomes
     */
    public void outcomes(HttpServerExchange exchange) {
        String idParam = first(exchange.getQueryParameters(), "id");
        long signalId;
        try {
            signalId = Long.parseLong(idParam);
        } catch (NumberFormatException e) {
            badRequest(exchange, "Signal id must be numeric");
            return;
        }

        try {
            Optional<Signal> signal = queryService.findSignal(signalId);
            if (signal.isEmpty()) {
                notFound(exchange, "Signal not found: " + signalId);
                return;
            }

            ObjectNode body = MAPPER.createObjectNode();
            body.set("signal", toJson(signal.get()));
            ArrayNode outcomes = body.putArray("outcomes");
            for (Outcome outcome : queryService.queryOutcomes(signalId)) {
                outcomes.add(toJson(outcome));
            }
            sendJson(exchange, body.toString());
        } catch (Exception e) {
            log.error("Error fetching outcomes for signal {}: {}", signalId, e.getMessage(), e);
            serverError(exchange, "Failed to fetch outcomes");
        }
    }

    // ============================================================

    static ObjectNode toJson(Signal s) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", s.id());
        node.put("symbol", s.symbol());
        node.put("timeframe", s.timeframe().code());
        node.put("firedAt", s.firedAt().toString());
        node.put("detectorId", s.detectorId());
        node.put("detectorVersion", s.detectorVersion());
        node.put("side", s.side().name());
        node.put("entryPrice", s.entryPrice());
        putDecimal(node, "bid", s.bid());
        putDecimal(node, "ask", s.ask());
        putDecimal(node, "spread", s.spread());
        if (s.relVolume() != null) {
            node.put("relVolume", s.relVolume());
        }
        if (s.session() != null) {
            node.put("session", s.session().name());
        }
        if (s.score() != null) {
            node.put("score", s.score());
        }
        if (s.dataFreshnessMs() != null) {
            node.put("dataFreshnessMs", s.dataFreshnessMs());
        }
        node.put("sourceSystem", s.sourceSystem());
        if (s.createdAt() != null) {
            node.put("createdAt", s.createdAt().toString());
        }

        ObjectNode features = node.putObject("features");
        features.put("schemaVersion", s.features().schemaVersion());
        ObjectNode values = features.putObject("values");
        s.features().values().forEach((name, value) -> {
            if (value == null || value.isNaN() || value.isInfinite()) {
                values.putNull(name);
            } else {
                values.put(name, value);
            }
        });
        return node;
    }

    static ObjectNode toJson(Outcome o) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("horizon", o.horizon().code());
        node.put("labelVersion", o.labelVersion());
        node.put("retClose", o.retClose());
        node.put("maxRunUp", o.maxRunUp());
        node.put("maxDrawdown", o.maxDrawdown());
        node.put("hitTp1", o.hitTp1());
        node.put("hitTp2", o.hitTp2());
        node.put("hitTp3", o.hitTp3());
        node.put("hitStop", o.hitStop());
        putDuration(node, "tToTp1Ms", o.tToTp1());
        putDuration(node, "tToTp2Ms", o.tToTp2());
        putDuration(node, "tToTp3Ms", o.tToTp3());
        putDuration(node, "tToStopMs", o.tToStop());
        node.put("computedAt", o.computedAt().toString());
        return node;
    }

    private static void putDecimal(ObjectNode node, String field, BigDecimal value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putDuration(ObjectNode node, String field, Duration value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value.toMillis());
        }
    }

    private static String first(Map<String, Deque<String>> params, String name) {
        Deque<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.getFirst().isBlank()) {
            return null;
        }
        return values.getFirst().trim();
    }

    private void sendJson(HttpServerExchange exchange, String body) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body, StandardCharsets.UTF_8);
    }

    private void badRequest(HttpServerExchange exchange, String message) {
        sendError(exchange, 400, message);
    }

    private void notFound(HttpServerExchange exchange, String message) {
        sendError(exchange, 404, message);
    }

    private void serverError(HttpServerExchange exchange, String message) {
        sendError(exchange, 500, message);
    }

    private void sendError(HttpServerExchange exchange, int status, String message) {
        exchange.setStatusCode(status);
        ObjectNode error = MAPPER.createObjectNode();
        error.put("error", message);
        sendJson(exchange, error.toString());
    }
}
