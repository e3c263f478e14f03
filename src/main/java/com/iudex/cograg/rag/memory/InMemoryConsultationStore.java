package com.iudex.cograg.rag.memory;

import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local store. Records are replaced atomically by id when a correction is appended;
 * each tenant keeps at most {@code maxRecordsPerTenant} records, oldest dropped first.
 */
@Component
@ConditionalOnProperty(name="iudex.memory.backend", havingValue="in-memory", matchIfMissing=true)
public class InMemoryConsultationStore implements ConsultationStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConsultationStore.class);
    private final Map<String, ConsultationRecord> records = new ConcurrentHashMap<>();
    private final Map<String, Deque<String>> idsByTenant = new ConcurrentHashMap<>();
    @Value(value="${iudex.memory.max-records-per-tenant:2000}")
    private int maxRecordsPerTenant = 2000;

    @Override
    public void save(ConsultationRecord record) {
        this.records.put(record.id(), record);
        Deque<String> ids = this.idsByTenant.computeIfAbsent(record.tenantId(), tenant -> new ConcurrentLinkedDeque<>());
        ids.addFirst(record.id());
        while (ids.size() > this.maxRecordsPerTenant) {
            String evicted = ids.pollLast();
            if (evicted == null) {
                break;
            }
            this.records.remove(evicted);
            log.debug("Memory: evicted consultation {} for tenant {}", evicted, record.tenantId());
        }
    }

    @Override
    public List<ConsultationRecord> recent(String tenantId, int limit) {
        List<ConsultationRecord> result = new ArrayList<>();
        Deque<String> ids = this.idsByTenant.get(tenantId);
        if (ids == null) {
            return result;
        }
        Iterator<String> iterator = ids.iterator();
        while (iterator.hasNext() && result.size() < limit) {
            ConsultationRecord record = this.records.get(iterator.next());
            if (record != null) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public Optional<ConsultationRecord> findById(String id) {
        return Optional.ofNullable(this.records.get(id));
    }

    @Override
    public boolean appendCorrection(String id, Correction correction) {
        return this.records.computeIfPresent(id, (key, record) -> record.withCorrection(correction)) != null;
    }

    public int size() {
        return this.records.size();
    }
}
