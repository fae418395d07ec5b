package in.oracore.service.signal;

import in.oracore.domain.data.Timeframe;
import in.oracore.domain.signal.Signal;
import in.oracore.repository.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Signal Store - write-once storage of signals.
 *
 * Recording a signal whose natural key exists is a successful no-op returning the stored
 * row. There is no update path.
 */
public final class SignalStore {
    private static final Logger log = LoggerFactory.getLogger(SignalStore.class);

    private final SignalRepository signalRepo;

    public SignalStore(SignalRepository signalRepo) {
        this.signalRepo = signalRepo;
    }

    /**
     * @return the stored signal, new or pre-existing
     */
    public Signal record(Signal signal) {
        return store(signal).signal();
    }

    /**
     * Like {@link #record} but also tells whether this call created the row.
     */
    public StoredSignal store(Signal signal) {
        Optional<Signal> inserted = signalRepo.insertIfAbsent(signal);
        if (inserted.isPresent()) {
            Signal s = inserted.get();
            log.info("Signal {} recorded: {} {} {} {}@{} entry={}", s.id(), s.symbol(), s.timeframe(),
                s.firedAt(), s.detectorId(), s.detectorVersion(), s.entryPrice());
            return new StoredSignal(s, true);
        }

        Signal existing = signalRepo.findByKey(signal.key())
            .orElseThrow(() -> new IllegalStateException("Signal key conflict without stored row: " + signal.key()));
        log.debug("Signal {} already recorded for {}", existing.id(), signal.key());
        return new StoredSignal(existing, false);
    }

    public Optional<Signal> findById(long id) {
        return signalRepo.findById(id);
    }

    public List<Signal> query(String symbol, Timeframe timeframe, Instant since, int limit) {
        return signalRepo.find(symbol, timeframe, since, limit);
    }

    /**
     * Signals fired at or after {@code since}, oldest first.
     */
    public List<Signal> findSince(Instant since) {
        return signalRepo.findFiredSince(since);
    }

    public List<Instant> firedTimestamps(String symbol, Timeframe timeframe, Instant from, Instant to) {
        return signalRepo.findFiredTimestamps(symbol, timeframe, from, to);
    }
}
