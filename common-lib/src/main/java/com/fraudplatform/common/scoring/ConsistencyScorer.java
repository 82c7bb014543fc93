package com.fraudplatform.common.scoring;

import java.util.Collection;

/**
 * Classifies how well the agents that scored one pharmacy agree.
 *
 * <pre>
 *   fewer than 2 agents          → 0.5  (not enough signal)
 *   some ≥ 0.8 and some &lt; 0.4    → 0.3  (conflicting)
 *   some ≥ 0.8                   → 0.9  (converging high risk)
 *   some &lt; 0.4                   → 0.1  (converging low risk)
 *   otherwise                    → 0.5  (moderate / ambiguous)
 * </pre>
 *
 * The result is always one of {0.1, 0.3, 0.5, 0.9}.
 */
public final class ConsistencyScorer {

    public static final double HIGH_SIGNAL = 0.8;
    public static final double LOW_SIGNAL  = 0.4;

    static final double INSUFFICIENT = 0.5;
    static final double CONFLICTING  = 0.3;
    static final double CONVERGING_HIGH = 0.9;
    static final double CONVERGING_LOW  = 0.1;
    static final double AMBIGUOUS    = 0.5;

    private ConsistencyScorer() {}

    public static double score(Collection<Double> agentScores) {
        if (agentScores == null || agentScores.size() < 2) {
            return INSUFFICIENT;
        }
        boolean anyHigh = agentScores.stream().anyMatch(ConsistencyScorer::isHighSignal);
        boolean anyLow  = agentScores.stream().anyMatch(ConsistencyScorer::isLowSignal);

        if (anyHigh && anyLow) return CONFLICTING;
        if (anyHigh)           return CONVERGING_HIGH;
        if (anyLow)            return CONVERGING_LOW;
        return AMBIGUOUS;
    }

    public static boolean isHighSignal(double score) {
        return score >= HIGH_SIGNAL;
    }

    public static boolean isLowSignal(double score) {
        return score < LOW_SIGNAL;
    }
}
