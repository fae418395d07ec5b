package in.oracore.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.oracore.config.PipelineConfig;
import in.oracore.config.PipelineConfigLoader;
import in.oracore.domain.common.ConfigValidationException;
import in.oracore.infrastructure.metrics.PipelineMetrics;
import in.oracore.infrastructure.metrics.PrometheusMetricsHandler;
import in.oracore.infrastructure.provider.BackoffPolicy;
import in.oracore.infrastructure.provider.BarProvider;
import in.oracore.infrastructure.provider.MassiveBarProvider;
import in.oracore.migration.SchemaMigration;
import in.oracore.service.baseline.BaselineSampler;
import in.oracore.service.candle.BarIngestor;
import in.oracore.service.candle.CandleAggregator;
import in.oracore.service.candle.CandleStore;
import in.oracore.service.detector.Detector;
import in.oracore.service.detector.DetectorFactory;
import in.oracore.service.detector.DetectorRegistry;
import in.oracore.service.detector.DetectorRunner;
import in.oracore.service.detector.ScoringModel;
import in.oracore.service.detector.ScoringModels;
import in.oracore.service.indicator.IndicatorEngine;
import in.oracore.service.indicator.IndicatorSettings;
import in.oracore.service.outcome.OutcomeLabeler;
import in.oracore.service.pipeline.DetectionPipeline;
import in.oracore.service.pipeline.JobReport;
import in.oracore.service.pipeline.PipelineJob;
import in.oracore.service.pipeline.PipelineScheduler;
import in.oracore.service.pipeline.RunStatus;
import in.oracore.service.pipeline.StreamExecutor;
import in.oracore.service.signal.SignalQueryService;
import in.oracore.service.signal.SignalStore;
import in.oracore.transport.http.ApiHandlers;
import in.oracore.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.Map;

/**
 * Entry point.
 *
 * RUN_MODE=ONCE runs one detection cycle, a labeling sweep and baseline sampling, then exits
 * with the {@link RunStatus} code. RUN_MODE=SERVICE (default) schedules those continuously
 * and serves the read API and /metrics over Undertow.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== OraCore Signals Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        String runMode = Env.get("RUN_MODE", "SERVICE").trim().toUpperCase();
        int port = Env.getInt("PORT", 9090);
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        PipelineConfig config;
        try {
            config = new PipelineConfigLoader().load();
        } catch (ConfigValidationException e) {
            fatal(e);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Repository layer
        // ═══════════════════════════════════════════════════════════════
        String store = Env.get("STORE", "postgres").trim().toLowerCase();
        Repositories repos;
        if ("memory".equals(store)) {
            log.info("STORE=memory: nothing is persisted beyond this process");
            repos = Repositories.inMemory(clock);
        } else {
            DataSource dataSource = createDataSource();
            try {
                new SchemaMigration(dataSource).migrate();
            } catch (IllegalStateException e) {
                log.error("❌ SCHEMA MIGRATION FAILED", e);
                System.exit(RunStatus.FATAL.exitCode());
                return;
            }
            repos = Repositories.postgres(dataSource);
        }

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PipelineMetrics metrics = new PipelineMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Market data provider
        // ═══════════════════════════════════════════════════════════════
        String apiKey = Env.get("MASSIVE_API_KEY", null);
        if (apiKey == null) {
            fatal(new ConfigValidationException("MASSIVE_API_KEY is not set"));
            return;
        }
        BarProvider provider = new MassiveBarProvider(
            Env.get("MASSIVE_BASE_URL", MassiveBarProvider.DEFAULT_BASE_URL), apiKey);

        // ═══════════════════════════════════════════════════════════════
        // Services (validation gate runs inside wire)
        // ═══════════════════════════════════════════════════════════════
        Components components;
        try {
            components = wire(config, repos, provider, metrics, clock, ScoringModels.discover());
        } catch (ConfigValidationException e) {
            fatal(e);
            return;
        }

        if ("ONCE".equals(runMode)) {
            JobReport report;
            try (components) {
                report = components.job().run();
            }
            log.info("Run finished with status {}", report.status());
            System.exit(report.status().exitCode());
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Service mode: scheduler + HTTP API
        // ═══════════════════════════════════════════════════════════════
        PipelineScheduler scheduler = components.scheduler();
        ApiHandlers api = new ApiHandlers(components.queryService(), scheduler::lastCycle, clock);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/signals", api::signals)
            .get("/api/signals/{id}/outcomes", api::outcomes)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "OraCore Signals\n\n" +
                    "API: GET /api/health, /api/signals, /api/signals/{id}/outcomes\n" +
                    "Metrics: GET /metrics\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", port);

        scheduler.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            scheduler.stop();
            components.close();
            server.stop();
            log.info("✓ Shutdown complete");
        }, "shutdown-hook"));
    }

    /**
     * Build every service from the configuration. Registers detectors, so the stored detector
     * definitions must agree with the configured ones.
     *
     * @param models scoring models available to model detectors, by name
     * @throws ConfigValidationException when the configuration is invalid
     */
    static Components wire(PipelineConfig config, Repositories repos, BarProvider provider,
                           PipelineMetrics metrics, Clock clock, Map<String, ScoringModel> models) {
        DetectorFactory factory = new DetectorFactory(models);
        StartupConfigValidator.validate(config, factory);

        DetectorRegistry registry = new DetectorRegistry(repos.detectors());
        for (Detector detector : factory.createAll(config.detectors())) {
            registry.register(detector);
        }

        CandleStore candleStore = new CandleStore(repos.candles());
        SignalStore signalStore = new SignalStore(repos.signals());
        IndicatorSettings settings = new IndicatorSettings(config.relVolumeWindow(), registry.requiredLookbacks());

        BarIngestor ingestor = new BarIngestor(provider, candleStore, repos.symbols(), repos.ingestionLog(),
            metrics, BackoffPolicy.forProvider(), config.backfillWindow(), clock);
        DetectorRunner runner = new DetectorRunner(registry, signalStore, metrics, clock,
            config.detectorTimeout(), provider::fetchQuote);
        StreamExecutor executor = new StreamExecutor(config.workerShards());

        DetectionPipeline pipeline = new DetectionPipeline(ingestor, candleStore, new CandleAggregator(candleStore),
            new IndicatorEngine(settings), runner, executor, metrics, config.watchlist(),
            config.baseTimeframe(), config.aggregateTimeframes(), clock);

        OutcomeLabeler labeler = new OutcomeLabeler(signalStore, candleStore, repos.outcomes(), metrics,
            config.labeling().horizons(), config.labeling().thresholds(), config.labeling().hitPriority(),
            config.labeling().labelVersion(), clock);

        BaselineSampler sampler = null;
        if (config.baseline().enabled()) {
            sampler = new BaselineSampler(candleStore, signalStore, repos.baselines(), metrics, settings,
                config.baseline().samplingRate(), config.baseline().minSpacingBars(), config.baseline().seed(),
                config.labeling().labelVersion(), pipeline, clock);
        }

        PipelineJob job = new PipelineJob(pipeline, labeler, sampler, config.watchlist(), config.allTimeframes(),
            config.labeling().lookback(), config.baseline().window(), clock);
        PipelineScheduler scheduler = new PipelineScheduler(pipeline, labeler, sampler, config.watchlist(),
            config.allTimeframes(), config.cycleInterval(), config.labeling().interval(),
            config.labeling().lookback(), config.baseline().window(), clock);

        log.info("✓ Pipeline wired: {} detectors, {} symbols, store-backed services ready", registry.size(),
            config.watchlist().size());
        return new Components(job, scheduler, new SignalQueryService(signalStore, repos.outcomes()), runner, executor);
    }

    /**
     * Wired services plus the thread pools that must be closed on exit.
     */
    record Components(PipelineJob job, PipelineScheduler scheduler, SignalQueryService queryService,
                      DetectorRunner runner, StreamExecutor executor) implements AutoCloseable {
        @Override
        public void close() {
            executor.close();
            runner.close();
        }
    }

    private static void fatal(ConfigValidationException e) {
        log.error("❌ STARTUP VALIDATION FAILED: {}", e.getMessage(), e);
        System.err.println("\n" + e.getMessage() + "\n");
        System.exit(RunStatus.FATAL.exitCode());
    }

    private static DataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/oracore");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("oracore-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }
}
