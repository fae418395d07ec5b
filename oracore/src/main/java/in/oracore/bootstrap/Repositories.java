package in.oracore.bootstrap;

import in.oracore.repository.BaselineRepository;
import in.oracore.repository.CandleRepository;
import in.oracore.repository.DetectorRepository;
import in.oracore.repository.InMemoryBaselineRepository;
import in.oracore.repository.InMemoryCandleRepository;
import in.oracore.repository.InMemoryDetectorRepository;
import in.oracore.repository.InMemoryIngestionLogRepository;
import in.oracore.repository.InMemoryOutcomeRepository;
import in.oracore.repository.InMemorySignalRepository;
import in.oracore.repository.InMemorySymbolRepository;
import in.oracore.repository.IngestionLogRepository;
import in.oracore.repository.OutcomeRepository;
import in.oracore.repository.PostgresBaselineRepository;
import in.oracore.repository.PostgresCandleRepository;
import in.oracore.repository.PostgresDetectorRepository;
import in.oracore.repository.PostgresIngestionLogRepository;
import in.oracore.repository.PostgresOutcomeRepository;
import in.oracore.repository.PostgresSignalRepository;
import in.oracore.repository.PostgresSymbolRepository;
import in.oracore.repository.SignalRepository;
import in.oracore.repository.SymbolRepository;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * The repository layer, backed either by PostgreSQL or by memory.
 */
public record Repositories(
        CandleRepository candles,
        SymbolRepository symbols,
        DetectorRepository detectors,
        SignalRepository signals,
        OutcomeRepository outcomes,
        BaselineRepository baselines,
        IngestionLogRepository ingestionLog) {

    public static Repositories postgres(DataSource dataSource) {
        return new Repositories(
            new PostgresCandleRepository(dataSource),
            new PostgresSymbolRepository(dataSource),
            new PostgresDetectorRepository(dataSource),
            new PostgresSignalRepository(dataSource),
            new PostgresOutcomeRepository(dataSource),
            new PostgresBaselineRepository(dataSource),
            new PostgresIngestionLogRepository(dataSource));
    }

    public static Repositories inMemory(Clock clock) {
        return new Repositories(
            new InMemoryCandleRepository(),
            new InMemorySymbolRepository(),
            new InMemoryDetectorRepository(clock),
            new InMemorySignalRepository(clock),
            new InMemoryOutcomeRepository(),
            new InMemoryBaselineRepository(),
            new InMemoryIngestionLogRepository());
    }
}
