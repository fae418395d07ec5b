package in.oracore.service.detector;

import in.oracore.domain.common.ConfigValidationException;
import in.oracore.domain.detector.DetectorDefinition;
import in.oracore.repository.DetectorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detectors active in this process, registered explicitly at startup.
 *
 * Registration persists the definition. An (id, version) already stored with different
 * parameters is rejected: parameters never change under an existing version.
 */
public final class DetectorRegistry {
    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final DetectorRepository detectorRepo;
    private final Map<String, Detector> detectors = new LinkedHashMap<>();

    public DetectorRegistry(DetectorRepository detectorRepo) {
        this.detectorRepo = detectorRepo;
    }

    /**
     * @throws ConfigValidationException on a duplicate key or a parameter conflict with the stored definition
     */
    public synchronized void register(Detector detector) {
        DetectorDefinition definition = detector.definition();
        if (detectors.containsKey(definition.key())) {
            throw new ConfigValidationException("Detector registered twice: " + definition.key());
        }

        DetectorDefinition stored = detectorRepo.register(definition);
        if (!stored.sameDefinitionAs(definition)) {
            throw new ConfigValidationException("Detector " + definition.key()
                + " is already registered with params " + stored.params()
                + "; bump the version to use " + definition.params());
        }

        detectors.put(definition.key(), detector);
        log.info("Detector {} ({}) registered with params {}", definition.key(), definition.kind(), definition.params());
    }

    public synchronized List<Detector> detectors() {
        return List.copyOf(new ArrayList<>(detectors.values()));
    }

    /**
     * Union of channel lookbacks the registered detectors read.
     */
    public synchronized Set<Integer> requiredLookbacks() {
        Set<Integer> lookbacks = new TreeSet<>();
        for (Detector detector : detectors.values()) {
            lookbacks.addAll(detector.requiredLookbacks());
        }
        return lookbacks;
    }

    public synchronized int size() {
        return detectors.size();
    }
}
