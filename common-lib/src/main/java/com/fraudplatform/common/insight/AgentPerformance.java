package com.fraudplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One agent's contribution to a run. A failed or silent agent reports zero findings.
 */
public record AgentPerformance(
    @JsonProperty("avg_score") double avgScore,
    @JsonProperty("high_risk_findings") int highRiskFindings,
    @JsonProperty("total_findings") int totalFindings,
    @JsonProperty("failed") boolean failed
) {
    public static AgentPerformance none(boolean failed) {
        return new AgentPerformance(0.0, 0, 0, failed);
    }
}
