package com.iudex.cograg.config;

import com.iudex.cograg.model.BackendType;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Multi-backend fusion settings bound from {@code iudex.fusion.*}.
 */
@ConfigurationProperties(prefix = "iudex.fusion")
public class FusionProperties {

    /**
     * Reciprocal-rank-fusion constant {@code k}. Larger values flatten the rank curve.
     */
    private int rrfK = 60;

    /**
     * Weight of the graph backend when no override is configured.
     * Lexical and vector weights come from the query classifier.
     */
    private double graphWeight = 0.3;

    /**
     * Per-backend weight overrides keyed by backend name ({@code lexical}, {@code vector}, {@code graph}).
     * An override replaces the classifier-derived weight for every query.
     */
    private Map<String, Double> weightOverrides = new HashMap<>();

    /**
     * Per-backend call timeouts in milliseconds, keyed by backend name.
     */
    private Map<String, Long> providerTimeoutsMs = new HashMap<>();

    /**
     * Timeout for backends without an explicit entry in {@link #providerTimeoutsMs}.
     */
    private long defaultTimeoutMs = 4000L;

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public double getGraphWeight() {
        return graphWeight;
    }

    public void setGraphWeight(double graphWeight) {
        this.graphWeight = graphWeight;
    }

    public Map<String, Double> getWeightOverrides() {
        return weightOverrides;
    }

    public void setWeightOverrides(Map<String, Double> weightOverrides) {
        this.weightOverrides = weightOverrides == null ? new HashMap<>() : weightOverrides;
    }

    public Map<String, Long> getProviderTimeoutsMs() {
        return providerTimeoutsMs;
    }

    public void setProviderTimeoutsMs(Map<String, Long> providerTimeoutsMs) {
        this.providerTimeoutsMs = providerTimeoutsMs == null ? new HashMap<>() : providerTimeoutsMs;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public Double weightOverride(BackendType backend) {
        return this.weightOverrides.get(backend.key());
    }

    public long timeoutFor(BackendType backend) {
        Long timeout = this.providerTimeoutsMs.get(backend.key());
        return timeout != null && timeout > 0 ? timeout : this.defaultTimeoutMs;
    }
}
