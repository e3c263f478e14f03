package com.iudex.cograg.rag.memory;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

/**
 * MongoDB-backed store. Corrections are appended with an atomic {@code $push}, so concurrent
 * reviewers never overwrite each other.
 */
@Component
@ConditionalOnProperty(name="iudex.memory.backend", havingValue="mongo")
public class MongoConsultationStore implements ConsultationStore {
    private static final Logger log = LoggerFactory.getLogger(MongoConsultationStore.class);
    static final String COLLECTION = "cograg_consultations";
    private final MongoTemplate mongoTemplate;

    public MongoConsultationStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void save(ConsultationRecord record) {
        this.mongoTemplate.insert(ConsultationDocument.from(record), COLLECTION);
    }

    @Override
    public List<ConsultationRecord> recent(String tenantId, int limit) {
        Query query = new Query(Criteria.where("tenantId").is(tenantId));
        query.with(Sort.by(Sort.Direction.DESC, "createdAt")).limit(limit);
        return this.mongoTemplate.find(query, ConsultationDocument.class, COLLECTION).stream()
                .map(ConsultationDocument::toRecord)
                .toList();
    }

    @Override
    public Optional<ConsultationRecord> findById(String id) {
        ConsultationDocument document = this.mongoTemplate.findById(id, ConsultationDocument.class, COLLECTION);
        return Optional.ofNullable(document).map(ConsultationDocument::toRecord);
    }

    @Override
    public boolean appendCorrection(String id, Correction correction) {
        Query query = new Query(Criteria.where("_id").is(id));
        long matched = this.mongoTemplate.updateFirst(query, new Update().push("corrections", correction),
                ConsultationDocument.class, COLLECTION).getMatchedCount();
        if (matched == 0L) {
            log.warn("Memory: correction for unknown consultation {}", id);
        }
        return matched > 0L;
    }
}
