package com.fraudplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run-level counts of how agents agreed or disagreed across pharmacies.
 *
 * <ul>
 *   <li>{@code conflictingSignals}: some agent ≥ 0.8 and some agent &lt; 0.4</li>
 *   <li>{@code highConsistency}   : at least 3 agents ≥ 0.8, or at least 3 agents &lt; 0.4</li>
 *   <li>{@code doubleFlags}       : both agents of the configured pair ≥ 0.8</li>
 * </ul>
 */
public record CrossAgentPatterns(
    @JsonProperty("conflicting_signals_count") int conflictingSignals,
    @JsonProperty("high_consistency_count") int highConsistency,
    @JsonProperty("double_flag_count") int doubleFlags
) {
    public static final CrossAgentPatterns NONE = new CrossAgentPatterns(0, 0, 0);
}
