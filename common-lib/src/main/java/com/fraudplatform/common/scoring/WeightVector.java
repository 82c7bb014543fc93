package com.fraudplatform.common.scoring;

import com.fraudplatform.common.exception.WeightConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-agent importance used by the weighted sum.
 *
 * <p>Weights are non-negative. After every construction or {@link #update} they are
 * normalised to sum to 1.0, unless the merged raw sum is 0, in which case they are kept
 * exactly as supplied (no division by zero, no NaN).
 *
 * <p>Owned by the coordinator and mutated only between runs. Aggregation reads an
 * immutable {@link #snapshot()}, so an update never changes an in-flight aggregation.
 */
public class WeightVector {

    private static final Logger log = LoggerFactory.getLogger(WeightVector.class);

    /** Weights of the original five-agent deployment. */
    public static final Map<String, Double> DEFAULT_WEIGHTS = defaultWeights();

    private Map<String, Double> weights;

    public WeightVector(Map<String, Double> initialWeights) {
        Map<String, Double> merged = new LinkedHashMap<>();
        mergeInto(merged, initialWeights);
        this.weights = normalize(merged);
    }

    public static WeightVector defaults() {
        return new WeightVector(DEFAULT_WEIGHTS);
    }

    /**
     * Merges {@code overrides} into the current weights and renormalises.
     *
     * @throws WeightConfigurationException if any override is negative or not finite;
     *         the vector is left unchanged
     */
    public synchronized Map<String, Double> update(Map<String, Double> overrides) {
        Map<String, Double> merged = new LinkedHashMap<>(weights);
        mergeInto(merged, overrides);
        this.weights = normalize(merged);
        log.info("Agent weights updated. weights={}", weights);
        return weights;
    }

    /** Normalised weight of {@code agentName}; 0.0 for agents without a configured weight. */
    public synchronized double weightOf(String agentName) {
        return weights.getOrDefault(agentName, 0.0);
    }

    public synchronized Map<String, Double> snapshot() {
        return weights;
    }

    private static void mergeInto(Map<String, Double> target, Map<String, Double> overrides) {
        if (overrides == null) {
            return;
        }
        // validate everything before touching target so a bad entry leaves no partial merge
        overrides.forEach(WeightVector::validate);
        target.putAll(overrides);
    }

    private static void validate(String agentName, Double weight) {
        if (weight == null || !Double.isFinite(weight)) {
            throw new WeightConfigurationException(agentName, "weight must be a finite number, got " + weight);
        }
        if (weight < 0.0) {
            throw new WeightConfigurationException(agentName, "weight must be non-negative, got " + weight);
        }
    }

    private static Map<String, Double> normalize(Map<String, Double> raw) {
        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> result = new LinkedHashMap<>();
        if (total > 0.0) {
            raw.forEach((agent, weight) -> result.put(agent, weight / total));
        } else {
            log.warn("Agent weights sum to 0 - keeping them unnormalised. weights={}", raw);
            result.putAll(raw);
        }
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put("coverage_agent",     0.25);
        defaults.put("patient_flip_agent", 0.20);
        defaults.put("high_dollar_agent",  0.20);
        defaults.put("rejection_agent",    0.20);
        defaults.put("network_agent",      0.15);
        return Collections.unmodifiableMap(defaults);
    }
}
