package com.iudex.cograg.config;

import com.iudex.cograg.capability.EmbeddingService;
import com.iudex.cograg.capability.GraphStore;
import com.iudex.cograg.capability.LexicalIndex;
import com.iudex.cograg.capability.VectorIndex;
import com.iudex.cograg.rag.fusion.GraphRetrievalAdapter;
import com.iudex.cograg.rag.fusion.LexicalRetrievalAdapter;
import com.iudex.cograg.rag.fusion.RetrievalAdapter;
import com.iudex.cograg.rag.fusion.RetrievalAdapters;
import com.iudex.cograg.rag.fusion.VectorRetrievalAdapter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires an adapter for every backend capability the deployment provides. Missing capabilities
 * are simply left out of the fan-out.
 */
@Configuration
public class RetrievalAdapterConfig {
    private static final Logger log = LoggerFactory.getLogger(RetrievalAdapterConfig.class);

    @Bean
    public RetrievalAdapters retrievalAdapters(ObjectProvider<LexicalIndex> lexicalIndex,
                                               ObjectProvider<VectorIndex> vectorIndex,
                                               ObjectProvider<EmbeddingService> embeddingService,
                                               ObjectProvider<GraphStore> graphStore,
                                               @Value("${iudex.graph.enabled:true}") boolean graphEnabled,
                                               @Value("${iudex.graph.max-hops:2}") int maxHops,
                                               @Value("${iudex.graph.limit:10}") int limit) {
        List<RetrievalAdapter> adapters = new ArrayList<>();
        lexicalIndex.ifAvailable(index -> adapters.add(new LexicalRetrievalAdapter(index)));
        VectorIndex vectors = vectorIndex.getIfAvailable();
        EmbeddingService embeddings = embeddingService.getIfAvailable();
        if (vectors != null && embeddings != null) {
            adapters.add(new VectorRetrievalAdapter(vectors, embeddings));
        }
        graphStore.ifAvailable(store -> adapters.add(new GraphRetrievalAdapter(store, maxHops, limit)));
        if (adapters.isEmpty()) {
            log.warn("No retrieval backend configured; every search will return an empty result");
        }
        log.info("Retrieval adapters: {} (graphEnabled={})", adapters.stream().map(RetrievalAdapter::name).toList(), graphEnabled);
        return new RetrievalAdapters(adapters, graphEnabled);
    }
}
