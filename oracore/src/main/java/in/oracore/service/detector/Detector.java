package in.oracore.service.detector;

import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.domain.signal.SignalCandidate;

import java.util.Optional;
import java.util.Set;

/**
 * A versioned signal detector.
 *
 * {@link #evaluate} must be a pure function of the context: the same bar and indicator
 * state always give the same answer, which is what makes re-running a cycle safe.
 */
public interface Detector {

    DetectorDefinition definition();

    /**
     * @return a candidate when the detector fires on the context's bar, empty otherwise
     *         (including when the inputs it needs are still warming up)
     */
    Optional<SignalCandidate> evaluate(DetectionContext context);

    /**
     * Channel lookbacks this detector reads from the indicator snapshot.
     */
    default Set<Integer> requiredLookbacks() {
        return Set.of();
    }
}
