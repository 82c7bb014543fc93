package com.fraudplatform.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fraudplatform.common.insight.RunInsights;
import com.fraudplatform.common.model.AggregatedScore;
import com.fraudplatform.common.model.Finding;
import com.fraudplatform.orchestrator.pipeline.FraudRunState;
import com.fraudplatform.orchestrator.pipeline.PipelineStage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Externally visible outcome of one run.
 */
public record FraudRunResult(
    @JsonProperty("run_id") String runId,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("total_claims") int totalClaims,
    @JsonProperty("ranked_scores") List<AggregatedScore> rankedScores,
    @JsonProperty("findings_by_agent") Map<String, List<Finding>> findingsByAgent,
    @JsonProperty("insights") RunInsights insights,
    @JsonProperty("degraded_stages") List<PipelineStage> degradedStages,
    @JsonProperty("failed_agents") Set<String> failedAgents,
    @JsonProperty("latency_ms") long latencyMs
) {
    public static FraudRunResult from(FraudRunState state, long latencyMs) {
        return new FraudRunResult(
            state.runId(),
            state.startedAt(),
            state.dataset().size(),
            state.rankedScores(),
            state.findingsByAgent(),
            state.insights(),
            state.degradedStages(),
            state.failedAgents(),
            latencyMs);
    }
}
