package com.fraudplatform.analysis.agent;

import com.fraudplatform.analysis.ClaimFixtures;
import com.fraudplatform.common.exception.AgentException;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.ClaimRecord;
import com.fraudplatform.common.model.Finding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NetworkAnomalyAgentTest {

    private final NetworkAnomalyAgent agent = new NetworkAnomalyAgent();

    private static ClaimDataset independentOutOfNetwork() {
        return ClaimDataset.of(ClaimFixtures.times(10, "P1", b -> b.network("N").networkType("Independent")));
    }

    @Nested
    @DisplayName("network score")
    class NetworkScore {

        @Test
        @DisplayName("out-of-network independent pharmacy → 0.4 + 0.2 + 0.1")
        void outOfNetworkIndependent() {
            List<Finding> findings = agent.analyze(independentOutOfNetwork());

            assertEquals(1, findings.size());
            assertEquals(0.7, findings.get(0).score());
            assertEquals("network_anomaly", findings.get(0).detail().get("analysis_type"));
        }

        @Test
        @DisplayName("unknown group type with more than 5 claims adds 0.3")
        void unknownGroupType() {
            List<ClaimRecord> claims = new ArrayList<>();
            claims.addAll(ClaimFixtures.times(6, "P1", b -> b.networkType(null)));
            claims.addAll(ClaimFixtures.times(1, "P2", b -> b));

            Map<String, Double> scores = new HashMap<>();
            agent.analyze(ClaimDataset.of(claims)).forEach(f -> scores.put(f.entityId(), f.score()));

            assertEquals(0.3, scores.get("P1"));
            assertEquals(0.0, scores.get("P2"));
        }

        @Test
        @DisplayName("an empty first group type is kept even when a later claim names one")
        void emptyFirstGroupTypeWins() {
            List<ClaimRecord> claims = new ArrayList<>();
            claims.add(ClaimFixtures.claim("P1").networkType("").build());
            claims.addAll(ClaimFixtures.times(5, "P1", b -> b.networkType("Chain")));

            Finding finding = agent.analyze(ClaimDataset.of(claims)).get(0);

            assertEquals("", finding.detail().get("primary_network_type"));
            assertEquals(0.3, finding.score());
        }

        @Test
        @DisplayName("missing network attributes → AgentException")
        void missingAttributes() {
            ClaimDataset dataset = ClaimDataset.of(ClaimFixtures.times(3, "P1", b -> b.network(null).networkType(null)));

            AgentException ex = assertThrows(AgentException.class, () -> agent.analyze(dataset));
            assertEquals(NetworkAnomalyAgent.NAME, ex.getAgentName());
        }

        @Test
        @DisplayName("empty dataset → no findings")
        void emptyDataset() {
            assertTrue(agent.analyze(ClaimDataset.empty()).isEmpty());
        }
    }

    @Nested
    @DisplayName("enhancement with peer findings")
    class Enhancement {

        @Test
        @DisplayName("score = 0.3 × network + 0.7 × peer average")
        void blendsPeerAverage() {
            List<Finding> peers = List.of(
                Finding.of("P1", 1.0, "r", "coverage_agent", Map.of()),
                Finding.of("P1", 0.8, "r", "rejection_agent", Map.of()));

            Finding f = agent.analyze(independentOutOfNetwork(), peers).get(0);

            assertEquals(0.3 * 0.7 + 0.7 * 0.9, f.score(), 1e-9);
            assertEquals(2, f.detail().get("agent_count"));
            assertEquals(2, f.detail().get("high_risk_agents"));
            assertEquals("network_anomaly_enhanced", f.detail().get("analysis_type"));
        }

        @Test
        @DisplayName("pharmacy without peer findings keeps its network score")
        void noPeersForPharmacy() {
            List<Finding> peers = List.of(Finding.of("OTHER", 0.9, "r", "coverage_agent", Map.of()));

            Finding f = agent.analyze(independentOutOfNetwork(), peers).get(0);

            assertEquals(0.7, f.score());
            assertTrue(f.reason().endsWith("(No agent findings)"));
        }
    }
}
