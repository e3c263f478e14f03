package com.iudex.cograg.capability.springai;

import com.iudex.cograg.capability.EmbeddingService;
import com.iudex.cograg.exception.EmbeddingException;
import com.iudex.cograg.util.LogSanitizer;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

@Service
public class EmbeddingModelService implements EmbeddingService {
    private final EmbeddingModel embeddingModel;

    public EmbeddingModelService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }
        float[] vector;
        try {
            vector = this.embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding model failed: " + LogSanitizer.sanitize(e.getMessage()), e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding model returned an empty vector");
        }
        return vector;
    }
}
