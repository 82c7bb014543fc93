package com.fraudplatform.common.scoring;

import com.fraudplatform.common.model.Finding;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Entity-keyed view over the per-agent finding lists: {@code pharmacy → (agent → finding)}.
 *
 * <p>Built once per run in a single pass, so aggregation is linear in the number of
 * findings. The key set is the aggregation domain: a pharmacy that no agent reported is
 * absent. When an agent reported the same pharmacy more than once, its highest-scoring
 * finding is kept (the first one on ties).
 */
public final class FindingIndex {

    private final Map<String, Map<String, Finding>> byEntity;

    private FindingIndex(Map<String, Map<String, Finding>> byEntity) {
        this.byEntity = byEntity;
    }

    public static FindingIndex build(Map<String, List<Finding>> findingsByAgent) {
        Map<String, Map<String, Finding>> index = new TreeMap<>();
        findingsByAgent.forEach((agentName, findings) -> {
            if (findings == null) {
                return;
            }
            for (Finding finding : findings) {
                index.computeIfAbsent(finding.entityId(), k -> new TreeMap<>())
                     .merge(agentName, finding, (kept, next) -> next.score() > kept.score() ? next : kept);
            }
        });
        index.replaceAll((entity, perAgent) -> Collections.unmodifiableMap(perAgent));
        return new FindingIndex(Collections.unmodifiableMap(index));
    }

    /** Pharmacies reported by at least one agent, in sorted order. */
    public Iterable<String> entities() {
        return byEntity.keySet();
    }

    /** Findings for one pharmacy keyed by agent name; empty when no agent reported it. */
    public Map<String, Finding> findingsFor(String entityId) {
        return byEntity.getOrDefault(entityId, Map.of());
    }

    public int entityCount() {
        return byEntity.size();
    }
}
