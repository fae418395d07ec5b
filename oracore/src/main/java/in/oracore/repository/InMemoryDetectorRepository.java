package in.oracore.repository;

import in.oracore.domain.detector.DetectorDefinition;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryDetectorRepository implements DetectorRepository {

    private final Map<String, DetectorDefinition> definitions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDetectorRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryDetectorRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public DetectorDefinition register(DetectorDefinition definition) {
        return definitions.computeIfAbsent(definition.key(), k -> new DetectorDefinition(
            definition.id(), definition.version(), definition.kind(), definition.description(),
            definition.params(), clock.instant()));
    }

    @Override
    public Optional<DetectorDefinition> find(String id, String version) {
        return Optional.ofNullable(definitions.get(id + "@" + version));
    }

    @Override
    public List<DetectorDefinition> findAll() {
        return new ArrayList<>(definitions.values());
    }
}
