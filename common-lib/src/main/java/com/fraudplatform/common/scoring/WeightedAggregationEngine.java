package com.fraudplatform.common.scoring;

import com.fraudplatform.common.explain.FraudExplanationGenerator;
import com.fraudplatform.common.model.AggregatedScore;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.ClaimRecord;
import com.fraudplatform.common.model.Finding;
import com.fraudplatform.common.model.RiskLevel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link AggregationEngine}: normalised weighted sum plus two correctives.
 *
 * <h3>Algorithm (per pharmacy reported by at least one agent)</h3>
 * <ol>
 *   <li>{@code weighted = Σ score(agent) × weight(agent)} over the agents that reported.
 *       Silent agents contribute nothing and the sum is <b>not</b> renormalised over the
 *       reporting subset: an agent's silence counts as "no evidence of that risk".</li>
 *   <li>{@code consistency}: see {@link ConsistencyScorer}.</li>
 *   <li>{@code outlier}: sigmoid z-score of the pharmacy's mean against the pooled score
 *       population of the run, see {@link ScorePopulation}.</li>
 *   <li>{@code final = 0.7 × weighted + 0.2 × consistency + 0.1 × outlier}</li>
 *   <li>{@link RiskLevel#fromScore(double)} on the final score.</li>
 * </ol>
 * The result is sorted and ranked by {@link ScoreRanker}.
 *
 * <p>Stateless and thread-safe. Does not modify the findings or the dataset.
 */
public class WeightedAggregationEngine implements AggregationEngine {

    static final double EVIDENCE_SHARE    = 0.7;
    static final double CONSISTENCY_SHARE = 0.2;
    static final double OUTLIER_SHARE     = 0.1;

    @Override
    public List<AggregatedScore> aggregate(Map<String, List<Finding>> findingsByAgent,
                                           ClaimDataset dataset,
                                           Map<String, Double> weights) {
        if (findingsByAgent == null || findingsByAgent.isEmpty()) {
            return List.of();
        }
        ClaimDataset claims = dataset != null ? dataset : ClaimDataset.empty();
        Map<String, Double> agentWeights = weights != null ? weights : Map.of();
        FindingIndex index = FindingIndex.build(findingsByAgent);
        ScorePopulation population = ScorePopulation.of(findingsByAgent);

        List<AggregatedScore> scores = new ArrayList<>(index.entityCount());
        for (String entityId : index.entities()) {
            Map<String, Finding> reported = index.findingsFor(entityId);
            if (reported.isEmpty()) {
                continue;
            }
            scores.add(scoreEntity(entityId, reported, claims.claimsFor(entityId), population, agentWeights));
        }
        return ScoreRanker.rank(scores);
    }

    private AggregatedScore scoreEntity(String entityId,
                                        Map<String, Finding> reported,
                                        List<ClaimRecord> transactions,
                                        ScorePopulation population,
                                        Map<String, Double> weights) {
        Map<String, Double> agentScores = new LinkedHashMap<>();
        Map<String, String> agentReasons = new LinkedHashMap<>();
        double weighted = 0.0;
        for (Map.Entry<String, Finding> e : reported.entrySet()) {
            double score = e.getValue().score();
            agentScores.put(e.getKey(), score);
            agentReasons.put(e.getKey(), e.getValue().reason());
            weighted += score * weights.getOrDefault(e.getKey(), 0.0);
        }

        double consistency = ConsistencyScorer.score(agentScores.values());
        double entityMean = agentScores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double outlier = population.outlierScore(entityMean);
        double finalScore = finalScore(weighted, consistency, outlier);

        ClaimRecord first = transactions.isEmpty() ? null : transactions.get(0);
        return new AggregatedScore(
            entityId,
            first != null ? first.nameOrUnknown()  : ClaimRecord.UNKNOWN,
            first != null ? first.cityOrUnknown()  : ClaimRecord.UNKNOWN,
            first != null ? first.stateOrUnknown() : ClaimRecord.UNKNOWN,
            weighted,
            consistency,
            outlier,
            finalScore,
            RiskLevel.fromScore(finalScore),
            agentScores.keySet(),
            agentScores,
            agentReasons,
            FraudExplanationGenerator.explain(agentScores, agentReasons, transactions),
            transactions.size(),
            0);
    }

    static double finalScore(double weighted, double consistency, double outlier) {
        return weighted * EVIDENCE_SHARE + consistency * CONSISTENCY_SHARE + outlier * OUTLIER_SHARE;
    }
}
