package in.oracore.service.candle;

import in.oracore.domain.common.ProviderException;
import in.oracore.domain.data.Candle;
import in.oracore.domain.data.IngestionLogEntry;
import in.oracore.domain.data.Timeframe;
import in.oracore.infrastructure.metrics.PipelineMetrics;
import in.oracore.infrastructure.provider.BackoffPolicy;
import in.oracore.infrastructure.provider.BarProvider;
import in.oracore.repository.InMemoryCandleRepository;
import in.oracore.repository.InMemoryIngestionLogRepository;
import in.oracore.repository.InMemorySymbolRepository;
import in.oracore.support.MutableClock;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static in.oracore.support.TestCandles.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BarIngestorTest {

    @Mock
    private BarProvider provider;

    private MutableClock clock;
    private CandleStore store;
    private InMemorySymbolRepository symbols;
    private InMemoryIngestionLogRepository ingestionLog;
    private CollectorRegistry registry;
    private BarIngestor ingestor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(minutes(SESSION_OPEN, 4).plusSeconds(30));
        store = new CandleStore(new InMemoryCandleRepository());
        symbols = new InMemorySymbolRepository();
        ingestionLog = new InMemoryIngestionLogRepository();
        registry = new CollectorRegistry();
        BackoffPolicy backoff = BackoffPolicy.builder()
            .initialDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(5))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
        ingestor = new BarIngestor(provider, store, symbols, ingestionLog, new PipelineMetrics(registry),
            backoff, Duration.ofMinutes(10), clock);
    }

    @Test
    void storesClosedBarsAndDropsTheFormingOne() {
        // 14:34 closes at 14:35, after now (14:34:30)
        List<Candle> bars = rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 5, 100, 0.1, 1000);
        when(provider.fetchBars(eq("AAPL"), eq(Timeframe.MINUTE_1), any(), any())).thenReturn(bars);

        List<Candle> stored = ingestor.ingest("AAPL", Timeframe.MINUTE_1);

        assertEquals(4, stored.size());
        assertEquals(minutes(SESSION_OPEN, 3), store.getLatest("AAPL", Timeframe.MINUTE_1).timestamp());
        assertEquals(minutes(SESSION_OPEN, 3), symbols.findByTicker("AAPL").orElseThrow().lastSeen());
        assertEquals(4.0, registry.getSampleValue("oracore_bars_ingested_total",
            new String[]{"timeframe"}, new String[]{"1m"}));
    }

    @Test
    void backfillsFromTheConfiguredWindowOnAnEmptyStream() {
        when(provider.fetchBars(any(), any(), any(), any())).thenReturn(List.of());

        ingestor.ingest("AAPL", Timeframe.MINUTE_1);

        Instant expectedFrom = Timeframe.MINUTE_1.floor(clock.instant().minus(Duration.ofMinutes(10)));
        verify(provider).fetchBars("AAPL", Timeframe.MINUTE_1, expectedFrom, clock.instant());
    }

    @Test
    void resumesAfterTheStoredHead() {
        store.putBars(rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 2, 100, 0.1, 1000));
        when(provider.fetchBars(any(), any(), any(), any())).thenReturn(List.of());

        ingestor.ingest("AAPL", Timeframe.MINUTE_1);

        verify(provider).fetchBars(eq("AAPL"), eq(Timeframe.MINUTE_1), eq(minutes(SESSION_OPEN, 2)), any());
    }

    @Test
    void reIngestingAnOverlapDoesNotDuplicate() {
        List<Candle> bars = rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 4, 100, 0.1, 1000);
        when(provider.fetchBars(any(), any(), any(), any())).thenReturn(bars);

        assertEquals(4, ingestor.ingest("AAPL", Timeframe.MINUTE_1).size());
        // A provider that ignores 'from' returns the same bars again; none are newer than the head
        assertTrue(ingestor.ingest("AAPL", Timeframe.MINUTE_1).isEmpty());
        assertEquals(4, store.getBetween("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, clock.instant()).size());
    }

    @Test
    void retriesTransientFailures() {
        List<Candle> bars = rising("AAPL", Timeframe.MINUTE_1, SESSION_OPEN, 2, 100, 0.1, 1000);
        when(provider.fetchBars(any(), any(), any(), any()))
            .thenThrow(new ProviderException("HTTP 503", 503, null))
            .thenThrow(new ProviderException("HTTP 429", 429, null))
            .thenReturn(bars);

        assertEquals(2, ingestor.ingest("AAPL", Timeframe.MINUTE_1).size());
        verify(provider, times(3)).fetchBars(any(), any(), any(), any());
        assertEquals(2.0, registry.getSampleValue("oracore_provider_retries_total"));
    }

    @Test
    void givesUpAfterMaxAttemptsAndLogsTheFailure() {
        when(provider.fetchBars(any(), any(), any(), any())).thenThrow(new ProviderException("HTTP 502", 502, null));

        assertThrows(ProviderException.class, () -> ingestor.ingest("AAPL", Timeframe.MINUTE_1));

        verify(provider, times(3)).fetchBars(any(), any(), any(), any());
        IngestionLogEntry entry = ingestionLog.findRecent(1).get(0);
        assertTrue(entry.failed());
        assertEquals(0, entry.barsWritten());
        assertNull(store.getLatest("AAPL", Timeframe.MINUTE_1));
    }

    @Test
    void clientErrorsAreNotRetried() {
        when(provider.fetchBars(any(), any(), any(), any())).thenThrow(new ProviderException("HTTP 401", 401, null));

        assertThrows(ProviderException.class, () -> ingestor.ingest("AAPL", Timeframe.MINUTE_1));
        verify(provider, times(1)).fetchBars(any(), any(), any(), any());
    }

    @Test
    void dropsBarsForAnotherStream() {
        when(provider.fetchBars(any(), any(), any(), any())).thenReturn(List.of(
            flat("MSFT", Timeframe.MINUTE_1, SESSION_OPEN, 400, 10),
            flat("AAPL", Timeframe.MINUTE_5, SESSION_OPEN, 100, 10)));

        assertTrue(ingestor.ingest("AAPL", Timeframe.MINUTE_1).isEmpty());
    }
}
