package com.fraudplatform.analysis.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fraudplatform.common.model.Finding;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Output of one dispatch: findings keyed by agent name (sorted) and the agents that
 * failed. A failed agent is present in {@code findingsByAgent} with an empty list.
 */
public record AgentDispatchResult(
    @JsonProperty("findings_by_agent") Map<String, List<Finding>> findingsByAgent,
    @JsonProperty("failed_agents") Set<String> failedAgents
) {
    public static final AgentDispatchResult EMPTY = new AgentDispatchResult(Map.of(), Set.of());

    public AgentDispatchResult {
        Map<String, List<Finding>> sorted = new TreeMap<>();
        if (findingsByAgent != null) {
            findingsByAgent.forEach((agent, findings) ->
                sorted.put(agent, findings == null ? List.of() : List.copyOf(findings)));
        }
        findingsByAgent = Collections.unmodifiableMap(sorted);
        failedAgents = failedAgents == null ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(failedAgents));
    }

    public int totalFindings() {
        return findingsByAgent.values().stream().mapToInt(List::size).sum();
    }
}
