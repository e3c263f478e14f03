package com.iudex.cograg.rag.fusion;

import com.iudex.cograg.config.FusionProperties;
import com.iudex.cograg.model.BackendType;
import com.iudex.cograg.rag.classifier.Classification;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-backend RRF weights for one fusion call.
 */
public record FusionWeights(Map<BackendType, Double> weights) {

    public FusionWeights {
        EnumMap<BackendType, Double> copy = new EnumMap<>(BackendType.class);
        copy.putAll(weights);
        weights = Map.copyOf(copy);
    }

    /**
     * Classifier weights for lexical/vector, configured graph weight, then any overrides.
     */
    public static FusionWeights from(Classification classification, FusionProperties properties) {
        EnumMap<BackendType, Double> weights = new EnumMap<>(BackendType.class);
        weights.put(BackendType.LEXICAL, classification.sparseWeight());
        weights.put(BackendType.VECTOR, classification.denseWeight());
        weights.put(BackendType.GRAPH, properties.getGraphWeight());
        for (BackendType backend : BackendType.values()) {
            Double override = properties.weightOverride(backend);
            if (override != null && override >= 0.0) {
                weights.put(backend, override);
            }
        }
        return new FusionWeights(weights);
    }

    public static FusionWeights of(double lexical, double vector, double graph) {
        return new FusionWeights(Map.of(BackendType.LEXICAL, lexical, BackendType.VECTOR, vector, BackendType.GRAPH, graph));
    }

    public double weightFor(BackendType backend) {
        return this.weights.getOrDefault(backend, 0.0);
    }
}
