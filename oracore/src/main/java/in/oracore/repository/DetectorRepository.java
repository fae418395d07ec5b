package in.oracore.repository;

import in.oracore.domain.detector.DetectorDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Repository for versioned detector definitions.
 */
public interface DetectorRepository {

    /**
     * Insert the definition if its (id, version) is new.
     *
     * @return the stored definition, which is the existing row when the key was already present
     */
    DetectorDefinition register(DetectorDefinition definition);

    Optional<DetectorDefinition> find(String id, String version);

    List<DetectorDefinition> findAll();
}
