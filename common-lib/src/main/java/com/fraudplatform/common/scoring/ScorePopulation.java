package com.fraudplatform.common.scoring;

import com.fraudplatform.common.model.Finding;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Mean and population standard deviation of every finding score in a run, pooled across
 * all agents and all pharmacies. Computed once per run and shared by every outlier score.
 */
public record ScorePopulation(int count, double mean, double standardDeviation) {

    public static final ScorePopulation EMPTY = new ScorePopulation(0, 0.0, 0.0);

    /** Below this spread the pooled mean carries rounding noise only. */
    static final double ZERO_SPREAD = 1e-12;

    static final double MIN_OUTLIER = Math.nextUp(0.0);
    static final double MAX_OUTLIER = Math.nextDown(1.0);

    public static ScorePopulation of(Map<String, List<Finding>> findingsByAgent) {
        return ofFindings(findingsByAgent.values().stream().flatMap(Collection::stream).toList());
    }

    public static ScorePopulation ofFindings(Collection<Finding> findings) {
        if (findings.isEmpty()) {
            return EMPTY;
        }
        double sum = 0.0;
        for (Finding f : findings) {
            sum += f.score();
        }
        double mean = sum / findings.size();
        double squared = 0.0;
        for (Finding f : findings) {
            double d = f.score() - mean;
            squared += d * d;
        }
        return new ScorePopulation(findings.size(), mean, Math.sqrt(squared / findings.size()));
    }

    /**
     * Population-relative standing of a pharmacy's mean score, mapped to (0, 1) by a
     * sigmoid over the z-score. Returns exactly 0.5 when the population has no spread
     * (every score identical). Extreme z-scores stay strictly inside the open interval.
     */
    public double outlierScore(double entityMean) {
        if (count == 0 || standardDeviation < ZERO_SPREAD) {
            return 0.5;
        }
        double z = (entityMean - mean) / standardDeviation;
        double sigmoid = z >= 0
            ? 1.0 / (1.0 + Math.exp(-z))
            : Math.exp(z) / (1.0 + Math.exp(z));
        return Math.min(MAX_OUTLIER, Math.max(MIN_OUTLIER, sigmoid));
    }
}
