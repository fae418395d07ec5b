package in.oracore.repository;

import in.oracore.domain.data.IngestionLogEntry;

import java.util.List;

/**
 * Audit trail of provider fetches.
 */
public interface IngestionLogRepository {

    void append(IngestionLogEntry entry);

    /**
     * Most recent entries first.
     */
    List<IngestionLogEntry> findRecent(int limit);
}
