package com.iudex.cograg.rag.memory;

import java.util.List;
import java.util.Optional;

/**
 * Append-only, tenant-scoped persistence for consultation records.
 */
public interface ConsultationStore {

    void save(ConsultationRecord record);

    /**
     * The tenant's most recent records, newest first.
     */
    List<ConsultationRecord> recent(String tenantId, int limit);

    Optional<ConsultationRecord> findById(String id);

    /**
     * Appends a correction to an existing record.
     *
     * @return {@code false} when no record has that id
     */
    boolean appendCorrection(String id, Correction correction);
}
