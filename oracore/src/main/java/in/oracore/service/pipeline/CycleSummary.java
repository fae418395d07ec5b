package in.oracore.service.pipeline;

import in.oracore.domain.signal.Signal;
import in.oracore.service.detector.DetectorFailure;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of one detection cycle across all symbols.
 */
public record CycleSummary(List<StreamResult> streams, Duration duration) {

    public CycleSummary {
        streams = List.copyOf(streams);
    }

    public int barsIngested() {
        return streams.stream().mapToInt(StreamResult::barsIngested).sum();
    }

    public int barsAggregated() {
        return streams.stream().mapToInt(StreamResult::barsAggregated).sum();
    }

    public List<Signal> signals() {
        List<Signal> all = new ArrayList<>();
        streams.forEach(s -> all.addAll(s.signals()));
        return all;
    }

    public List<DetectorFailure> detectorFailures() {
        List<DetectorFailure> all = new ArrayList<>();
        streams.forEach(s -> all.addAll(s.detectorFailures()));
        return all;
    }

    public List<StreamResult> failedStreams() {
        return streams.stream().filter(StreamResult::isFailed).toList();
    }

    public RunStatus status() {
        return failedStreams().isEmpty() ? RunStatus.SUCCESS : RunStatus.PARTIAL_FAILURE;
    }
}
