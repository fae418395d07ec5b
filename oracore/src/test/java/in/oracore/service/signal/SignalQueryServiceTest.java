package in.oracore.service.signal;

import in.oracore.domain.data.Timeframe;
import in.oracore.domain.outcome.Horizon;
import in.oracore.domain.outcome.Outcome;
import in.oracore.domain.signal.Side;
import in.oracore.domain.signal.Signal;
import in.oracore.repository.InMemoryOutcomeRepository;
import in.oracore.repository.InMemorySignalRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static in.oracore.support.TestCandles.*;
import static in.oracore.support.TestSignals.unsaved;
import static org.junit.jupiter.api.Assertions.*;

class SignalQueryServiceTest {

    private SignalStore store;
    private InMemoryOutcomeRepository outcomes;
    private SignalQueryService service;

    @BeforeEach
    void setUp() {
        store = new SignalStore(new InMemorySignalRepository());
        outcomes = new InMemoryOutcomeRepository();
        service = new SignalQueryService(store, outcomes);
    }

    @Test
    void normalisesTheSymbolFilter() {
        store.record(unsaved("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, Side.LONG, 100));

        assertEquals(1, service.querySignals(" aapl ", null, null).size());
        assertEquals(1, service.querySignals("", null, null).size());
    }

    @Test
    void clampsTheLimit() {
        for (int i = 0; i < 3; i++) {
            store.record(unsaved("AAPL", Timeframe.MINUTE_1, minutes(SESSION_OPEN, i), Side.LONG, 100));
        }

        assertEquals(1, service.querySignals(null, null, null, 0).size());
        assertEquals(1, service.querySignals(null, null, null, -5).size());
        assertEquals(3, service.querySignals(null, null, null, 1_000_000).size());
    }

    @Test
    void ordersOutcomesByHorizonThenVersion() {
        Signal signal = store.record(unsaved("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, Side.LONG, 100));
        outcomes.insertIfAbsent(outcome(signal.id(), "1h:4", 1));
        outcomes.insertIfAbsent(outcome(signal.id(), "15m:4", 2));
        outcomes.insertIfAbsent(outcome(signal.id(), "15m:4", 1));
        outcomes.insertIfAbsent(outcome(signal.id(), "5m:6", 1));

        List<String> order = service.queryOutcomes(signal.id()).stream()
            .map(o -> o.horizon().code() + "/v" + o.labelVersion())
            .toList();

        assertEquals(List.of("5m:6/v1", "15m:4/v1", "15m:4/v2", "1h:4/v1"), order);
        assertTrue(service.queryOutcomes(999L).isEmpty());
    }

    static Outcome outcome(long signalId, String horizon, int labelVersion) {
        return new Outcome(signalId, Horizon.parse(horizon), labelVersion, new BigDecimal("0.004000"),
            new BigDecimal("0.012000"), new BigDecimal("-0.003000"), true, false, false, false,
            Duration.ofMinutes(7), null, null, null, SESSION_OPEN.plusSeconds(7200));
    }
}
