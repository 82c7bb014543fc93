package com.fraudplatform.orchestrator.pipeline;

import com.fraudplatform.common.insight.RunInsights;
import com.fraudplatform.common.model.AggregatedScore;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.Finding;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable state of one fraud run, handed from stage to stage.
 *
 * <p>Each stage receives the previous state and returns a new one through the
 * {@code with…} factories; no stage ever mutates a state it was given. A stage that
 * failed is listed in {@code degradedStages} and its output is the empty value.
 */
public record FraudRunState(
    String runId,
    Instant startedAt,
    ClaimDataset dataset,
    Map<String, List<Finding>> findingsByAgent,
    Set<String> failedAgents,
    List<AggregatedScore> aggregatedScores,
    List<AggregatedScore> rankedScores,
    RunInsights insights,
    List<PipelineStage> degradedStages
) {
    public FraudRunState {
        dataset = dataset == null ? ClaimDataset.empty() : dataset;
        findingsByAgent = findingsByAgent == null ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(findingsByAgent));
        failedAgents = failedAgents == null ? Set.of()
            : Collections.unmodifiableSortedSet(new TreeSet<>(failedAgents));
        aggregatedScores = aggregatedScores == null ? List.of() : List.copyOf(aggregatedScores);
        rankedScores = rankedScores == null ? List.of() : List.copyOf(rankedScores);
        insights = insights == null ? RunInsights.EMPTY : insights;
        degradedStages = degradedStages == null ? List.of() : List.copyOf(degradedStages);
    }

    public static FraudRunState start(String runId, Instant startedAt) {
        return new FraudRunState(runId, startedAt, ClaimDataset.empty(), Map.of(), Set.of(),
            List.of(), List.of(), RunInsights.EMPTY, List.of());
    }

    public FraudRunState withDataset(ClaimDataset newDataset) {
        return new FraudRunState(runId, startedAt, newDataset, findingsByAgent, failedAgents,
            aggregatedScores, rankedScores, insights, degradedStages);
    }

    public FraudRunState withAgentFindings(Map<String, List<Finding>> newFindings, Set<String> newFailedAgents) {
        return new FraudRunState(runId, startedAt, dataset, newFindings, newFailedAgents,
            aggregatedScores, rankedScores, insights, degradedStages);
    }

    public FraudRunState withAggregatedScores(List<AggregatedScore> scores) {
        return new FraudRunState(runId, startedAt, dataset, findingsByAgent, failedAgents,
            scores, rankedScores, insights, degradedStages);
    }

    public FraudRunState withRanking(List<AggregatedScore> ranked, RunInsights newInsights) {
        return new FraudRunState(runId, startedAt, dataset, findingsByAgent, failedAgents,
            aggregatedScores, ranked, newInsights, degradedStages);
    }

    public FraudRunState withDegraded(PipelineStage stage) {
        List<PipelineStage> stages = new ArrayList<>(degradedStages);
        stages.add(stage);
        return new FraudRunState(runId, startedAt, dataset, findingsByAgent, failedAgents,
            aggregatedScores, rankedScores, insights, stages);
    }
}
