package in.oracore.domain.common;

import in.oracore.domain.data.StreamKey;

import java.time.Instant;
import java.util.List;

/**
 * Expected bars are missing and will not arrive: the stream already holds later bars.
 * Gaps are reported and skipped, never filled with synthesized bars.
 */
public class DataGapException extends RuntimeException {
    private final StreamKey stream;
    private final List<Instant> missing;

    public DataGapException(StreamKey stream, List<Instant> missing, String context) {
        super("Data gap on " + stream + " (" + context + "): missing " + missing.size()
            + " bar(s), first " + (missing.isEmpty() ? "-" : missing.get(0)));
        this.stream = stream;
        this.missing = List.copyOf(missing);
    }

    public StreamKey getStream() {
        return stream;
    }

    public List<Instant> getMissing() {
        return missing;
    }
}
