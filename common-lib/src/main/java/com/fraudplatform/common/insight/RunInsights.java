package com.fraudplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Supervisor view of one run: risk distribution, per-agent performance, cross-agent
 * patterns and operator recommendations. Pure data.
 */
public record RunInsights(
    @JsonProperty("total_pharmacies_analyzed") int totalPharmaciesAnalyzed,
    @JsonProperty("high_risk_pharmacies") int highRiskPharmacies,
    @JsonProperty("medium_risk_pharmacies") int mediumRiskPharmacies,
    @JsonProperty("low_risk_pharmacies") int lowRiskPharmacies,
    @JsonProperty("very_low_risk_pharmacies") int veryLowRiskPharmacies,
    @JsonProperty("agent_performance") Map<String, AgentPerformance> agentPerformance,
    @JsonProperty("cross_agent_patterns") CrossAgentPatterns crossAgentPatterns,
    @JsonProperty("recommendations") List<String> recommendations
) {
    public static final RunInsights EMPTY =
        new RunInsights(0, 0, 0, 0, 0, Map.of(), CrossAgentPatterns.NONE, List.of());
}
