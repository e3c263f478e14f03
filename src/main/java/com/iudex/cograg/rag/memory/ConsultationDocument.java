package com.iudex.cograg.rag.memory;

import com.iudex.cograg.rag.cograg.planner.TreeSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection="cograg_consultations")
public record ConsultationDocument(
    @Id String id,
    @Indexed String tenantId,
    String query,
    List<String> keywords,
    TreeSnapshot tree,
    Map<String, String> nodeAnswers,
    String finalAnswer,
    List<String> citations,
    @Indexed Instant createdAt,
    List<Correction> corrections
) {

    static ConsultationDocument from(ConsultationRecord record) {
        return new ConsultationDocument(record.id(), record.tenantId(), record.query(), new ArrayList<>(record.keywords()),
                record.tree(), record.nodeAnswers(), record.finalAnswer(), record.citations(), record.createdAt(), record.corrections());
    }

    ConsultationRecord toRecord() {
        return new ConsultationRecord(this.id, this.tenantId, this.query,
                new LinkedHashSet<>(this.keywords == null ? List.of() : this.keywords), this.tree,
                this.nodeAnswers == null ? Map.of() : this.nodeAnswers, this.finalAnswer,
                this.citations == null ? List.of() : this.citations, this.createdAt,
                this.corrections == null ? List.of() : this.corrections);
    }
}
