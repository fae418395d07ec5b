package in.oracore.service.pipeline;

import in.oracore.domain.data.Timeframe;
import in.oracore.service.baseline.BaselineSampler;
import in.oracore.service.outcome.LabelSweepResult;
import in.oracore.service.outcome.OutcomeLabeler;
import in.oracore.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static in.oracore.support.TestCandles.SESSION_OPEN;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineJobTest {

    private static final LabelSweepResult NO_LABELS = new LabelSweepResult(0, 0, List.of(), List.of(), false);

    @Mock
    private DetectionPipeline pipeline;
    @Mock
    private OutcomeLabeler labeler;
    @Mock
    private BaselineSampler sampler;

    private final MutableClock clock = new MutableClock(SESSION_OPEN.plus(Duration.ofHours(2)));

    @Test
    void cleanRunSucceeds() {
        when(pipeline.runCycle()).thenReturn(cycle(ok("AAPL")));
        when(labeler.sweep(any())).thenReturn(NO_LABELS);
        when(sampler.sample(any(), any(), any(), any())).thenReturn(List.of());

        JobReport report = job(sampler).run();

        assertEquals(RunStatus.SUCCESS, report.status());
        assertEquals(0, report.status().exitCode());
        verify(labeler).sweep(clock.instant().minus(Duration.ofDays(10)));
        verify(sampler).sample("AAPL", Timeframe.MINUTE_1, clock.instant().minus(Duration.ofDays(5)), clock.instant());
        verify(sampler).sample(eq("AAPL"), eq(Timeframe.MINUTE_5), any(Instant.class), any(Instant.class));
    }

    @Test
    void aFailedStreamMakesThePartialExitCode() {
        when(pipeline.runCycle()).thenReturn(cycle(ok("AAPL"), StreamResult.failed("MSFT", "provider: HTTP 503")));
        when(labeler.sweep(any())).thenReturn(NO_LABELS);

        JobReport report = job(null).run();

        assertEquals(RunStatus.PARTIAL_FAILURE, report.status());
        assertEquals(2, report.status().exitCode());
        verify(labeler).sweep(any());
    }

    @Test
    void samplingErrorsAreCountedAndDoNotAbortTheRun() {
        when(pipeline.runCycle()).thenReturn(cycle(ok("AAPL")));
        when(labeler.sweep(any())).thenReturn(NO_LABELS);
        when(sampler.sample(eq("AAPL"), eq(Timeframe.MINUTE_1), any(), any()))
            .thenThrow(new IllegalStateException("store unavailable"));
        when(sampler.sample(eq("AAPL"), eq(Timeframe.MINUTE_5), any(), any())).thenReturn(List.of());

        JobReport report = job(sampler).run();

        assertEquals(1, report.baselineErrors());
        assertEquals(RunStatus.PARTIAL_FAILURE, report.status());
        verify(sampler, times(2)).sample(any(), any(), any(), any());
    }

    @Test
    void disabledSamplingSkipsTheSampler() {
        when(pipeline.runCycle()).thenReturn(cycle(ok("AAPL")));
        when(labeler.sweep(any())).thenReturn(NO_LABELS);

        JobReport report = job(null).run();

        assertEquals(0, report.baselinesWritten());
        assertEquals(RunStatus.SUCCESS, report.status());
    }

    private PipelineJob job(BaselineSampler baselineSampler) {
        return new PipelineJob(pipeline, labeler, baselineSampler, List.of("AAPL"),
            List.of(Timeframe.MINUTE_1, Timeframe.MINUTE_5), Duration.ofDays(10), Duration.ofDays(5), clock);
    }

    private static StreamResult ok(String symbol) {
        return new StreamResult(symbol, 5, 1, List.of(), 0, List.of(), null);
    }

    private static CycleSummary cycle(StreamResult... streams) {
        return new CycleSummary(List.of(streams), Duration.ofMillis(40));
    }
}
