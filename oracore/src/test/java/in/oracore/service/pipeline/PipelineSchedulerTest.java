package in.oracore.service.pipeline;

import in.oracore.domain.data.Timeframe;
import in.oracore.service.baseline.BaselineSampler;
import in.oracore.service.outcome.OutcomeLabeler;
import in.oracore.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static in.oracore.support.TestCandles.SESSION_OPEN;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineSchedulerTest {

    @Mock
    private DetectionPipeline pipeline;
    @Mock
    private OutcomeLabeler labeler;
    @Mock
    private BaselineSampler sampler;

    @Test
    void remembersTheLastCycle() {
        CycleSummary summary = new CycleSummary(List.of(), Duration.ofMillis(5));
        when(pipeline.runCycle()).thenReturn(summary);
        PipelineScheduler scheduler = scheduler(Duration.ofMinutes(1));

        assertTrue(scheduler.lastCycle().isEmpty());
        scheduler.runCycle();

        assertSame(summary, scheduler.lastCycle().orElseThrow());
    }

    @Test
    void aFailedCycleKeepsThePreviousSummaryAndTheSchedule() {
        CycleSummary summary = new CycleSummary(List.of(), Duration.ofMillis(5));
        when(pipeline.runCycle()).thenReturn(summary).thenThrow(new IllegalStateException("boom"));
        PipelineScheduler scheduler = scheduler(Duration.ofMinutes(1));

        scheduler.runCycle();
        assertDoesNotThrow(scheduler::runCycle);

        assertSame(summary, scheduler.lastCycle().orElseThrow());
    }

    @Test
    void labelingFailureStillRunsSampling() {
        when(labeler.sweep(any())).thenThrow(new IllegalStateException("db down"));
        when(sampler.sample(any(), any(), any(), any())).thenReturn(List.of());

        scheduler(Duration.ofMinutes(1)).runLabeling();

        verify(sampler).sample(eq("AAPL"), eq(Timeframe.MINUTE_1), any(), any());
    }

    @Test
    void startRunsTheFirstCycleImmediately() {
        when(pipeline.runCycle()).thenReturn(new CycleSummary(List.of(), Duration.ZERO));
        PipelineScheduler scheduler = scheduler(Duration.ofHours(1));

        scheduler.start();
        try {
            verify(pipeline, timeout(2_000)).runCycle();
        } finally {
            scheduler.stop();
        }
        verifyNoInteractions(labeler);
    }

    private PipelineScheduler scheduler(Duration interval) {
        return new PipelineScheduler(pipeline, labeler, sampler, List.of("AAPL"), List.of(Timeframe.MINUTE_1),
            interval, interval, Duration.ofDays(1), Duration.ofDays(1), new MutableClock(SESSION_OPEN));
    }
}
