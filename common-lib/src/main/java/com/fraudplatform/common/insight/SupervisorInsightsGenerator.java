package com.fraudplatform.common.insight;

import com.fraudplatform.common.model.AggregatedScore;
import com.fraudplatform.common.model.Finding;
import com.fraudplatform.common.model.RiskLevel;
import com.fraudplatform.common.scoring.ConsistencyScorer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives {@link RunInsights} from a ranked run.
 *
 * <p>Recommendation thresholds:
 * <pre>
 *   HIGH pharmacies        &gt; 10 → manual review
 *   MEDIUM pharmacies      &gt; 20 → adjust thresholds
 *   conflicting signals    &gt; 5  → review agent weights
 *   high-consistency count &gt; 10 → raise confidence threshold
 * </pre>
 *
 * <p>Stateless; every registered agent gets a performance entry, including agents that
 * failed or reported nothing.
 */
public class SupervisorInsightsGenerator {

    static final int MANY_HIGH_RISK   = 10;
    static final int MANY_MEDIUM_RISK = 20;
    static final int MANY_CONFLICTS   = 5;
    static final int MANY_AGREEMENTS  = 10;
    static final int AGREEMENT_QUORUM = 3;

    private final String doubleFlagFirst;
    private final String doubleFlagSecond;

    /**
     * @param doubleFlagFirst  first agent of the pair whose joint high score is counted
     * @param doubleFlagSecond second agent of that pair
     */
    public SupervisorInsightsGenerator(String doubleFlagFirst, String doubleFlagSecond) {
        this.doubleFlagFirst  = doubleFlagFirst;
        this.doubleFlagSecond = doubleFlagSecond;
    }

    public RunInsights generate(List<AggregatedScore> rankedScores,
                                Map<String, List<Finding>> findingsByAgent,
                                Set<String> failedAgents) {
        Map<RiskLevel, Integer> levels = new EnumMap<>(RiskLevel.class);
        for (AggregatedScore score : rankedScores) {
            levels.merge(score.riskLevel(), 1, Integer::sum);
        }

        CrossAgentPatterns patterns = crossAgentPatterns(rankedScores);
        int high   = levels.getOrDefault(RiskLevel.HIGH, 0);
        int medium = levels.getOrDefault(RiskLevel.MEDIUM, 0);

        return new RunInsights(
            rankedScores.size(),
            high,
            medium,
            levels.getOrDefault(RiskLevel.LOW, 0),
            levels.getOrDefault(RiskLevel.VERY_LOW, 0),
            agentPerformance(findingsByAgent, failedAgents),
            patterns,
            recommendations(high, medium, patterns));
    }

    private Map<String, AgentPerformance> agentPerformance(Map<String, List<Finding>> findingsByAgent,
                                                           Set<String> failedAgents) {
        Map<String, AgentPerformance> performance = new TreeMap<>();
        findingsByAgent.forEach((agent, findings) -> {
            boolean failed = failedAgents.contains(agent);
            if (findings == null || findings.isEmpty()) {
                performance.put(agent, AgentPerformance.none(failed));
                return;
            }
            double avg = findings.stream().mapToDouble(Finding::score).average().orElse(0.0);
            int highRisk = (int) findings.stream().filter(f -> ConsistencyScorer.isHighSignal(f.score())).count();
            performance.put(agent, new AgentPerformance(round3(avg), highRisk, findings.size(), failed));
        });
        for (String agent : failedAgents) {
            performance.putIfAbsent(agent, AgentPerformance.none(true));
        }
        return Collections.unmodifiableMap(performance);
    }

    private CrossAgentPatterns crossAgentPatterns(List<AggregatedScore> scores) {
        int conflicting = 0;
        int consistent = 0;
        int doubleFlags = 0;
        for (AggregatedScore score : scores) {
            Map<String, Double> agentScores = score.unitScores();
            if (agentScores.isEmpty()) {
                continue;
            }
            Collection<Double> values = agentScores.values();
            long highCount = values.stream().filter(ConsistencyScorer::isHighSignal).count();
            long lowCount  = values.stream().filter(ConsistencyScorer::isLowSignal).count();

            if (highCount > 0 && lowCount > 0) conflicting++;
            if (highCount >= AGREEMENT_QUORUM || lowCount >= AGREEMENT_QUORUM) consistent++;
            if (isHigh(agentScores.get(doubleFlagFirst)) && isHigh(agentScores.get(doubleFlagSecond))) {
                doubleFlags++;
            }
        }
        return new CrossAgentPatterns(conflicting, consistent, doubleFlags);
    }

    private static List<String> recommendations(int high, int medium, CrossAgentPatterns patterns) {
        List<String> recommendations = new ArrayList<>();
        if (high > MANY_HIGH_RISK) {
            recommendations.add("High number of high-risk pharmacies detected - consider manual review");
        }
        if (medium > MANY_MEDIUM_RISK) {
            recommendations.add("Many medium-risk pharmacies - consider adjusting thresholds");
        }
        if (patterns.conflictingSignals() > MANY_CONFLICTS) {
            recommendations.add("Multiple conflicting signals detected - review agent weights");
        }
        if (patterns.highConsistency() > MANY_AGREEMENTS) {
            recommendations.add("High agent agreement detected - consider increasing confidence threshold");
        }
        return List.copyOf(recommendations);
    }

    private static boolean isHigh(Double score) {
        return score != null && ConsistencyScorer.isHighSignal(score);
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
