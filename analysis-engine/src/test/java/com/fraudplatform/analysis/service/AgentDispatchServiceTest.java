package com.fraudplatform.analysis.service;

import com.fraudplatform.analysis.ClaimFixtures;
import com.fraudplatform.analysis.agent.CombinationDependentAgent;
import com.fraudplatform.analysis.agent.FraudAgent;
import com.fraudplatform.common.exception.AgentException;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.Finding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AgentDispatchServiceTest {

    private final Scheduler scheduler = Schedulers.newBoundedElastic(2, 100, "test-agents");

    private final ClaimDataset dataset = ClaimDataset.of(List.of(
        ClaimFixtures.claim("P1").build(),
        ClaimFixtures.claim("P2").build()));

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private static FraudAgent fixed(String name, double score) {
        return new FraudAgent() {
            @Override public List<Finding> analyze(ClaimDataset ds) {
                return List.of(Finding.of("P1", score, name + " says so", name, Map.of()));
            }
            @Override public String agentName() { return name; }
        };
    }

    private static FraudAgent throwing(String name) {
        return new FraudAgent() {
            @Override public List<Finding> analyze(ClaimDataset ds) {
                throw new AgentException(name, "boom");
            }
            @Override public String agentName() { return name; }
        };
    }

    private static FraudAgent returningNull(String name) {
        return new FraudAgent() {
            @Override public List<Finding> analyze(ClaimDataset ds) { return null; }
            @Override public String agentName() { return name; }
        };
    }

    /** Records the peer findings it was given and reports their count as a score. */
    private static final class RecordingCombinedAgent implements CombinationDependentAgent {
        final AtomicReference<List<Finding>> seen = new AtomicReference<>();

        @Override
        public List<Finding> analyze(ClaimDataset ds, List<Finding> peerFindings) {
            seen.set(peerFindings);
            return List.of(Finding.of("P1", Math.min(1.0, peerFindings.size() / 10.0), "peers", agentName(), Map.of()));
        }

        @Override public String agentName() { return "network_agent"; }
    }

    @Nested
    @DisplayName("failure isolation")
    class Isolation {

        @Test
        @DisplayName("a throwing agent is recorded as failed with an empty list")
        void throwingAgent() {
            AgentDispatchService service = new AgentDispatchService(
                List.of(fixed("a", 0.9), throwing("broken"), fixed("b", 0.2)), scheduler);

            AgentDispatchResult result = service.dispatchAll(dataset).block();

            assertNotNull(result);
            assertEquals(Set.of("broken"), result.failedAgents());
            assertEquals(List.of(), result.findingsByAgent().get("broken"));
            assertEquals(1, result.findingsByAgent().get("a").size());
            assertEquals(1, result.findingsByAgent().get("b").size());
            assertEquals(2, result.totalFindings());
        }

        @Test
        @DisplayName("a null result is treated as empty, not as a failure")
        void nullResult() {
            AgentDispatchService service = new AgentDispatchService(
                List.of(returningNull("silent"), fixed("a", 0.5)), scheduler);

            AgentDispatchResult result = service.dispatchAll(dataset).block();

            assertNotNull(result);
            assertTrue(result.failedAgents().isEmpty());
            assertEquals(List.of(), result.findingsByAgent().get("silent"));
        }

        @Test
        @DisplayName("all agents failing still completes")
        void allFail() {
            AgentDispatchService service = new AgentDispatchService(
                List.of(throwing("x"), throwing("y")), scheduler);

            AgentDispatchResult result = service.dispatchAll(dataset).block();

            assertNotNull(result);
            assertEquals(Set.of("x", "y"), result.failedAgents());
            assertEquals(0, result.totalFindings());
        }
    }

    @Nested
    @DisplayName("two-phase protocol")
    class TwoPhase {

        @Test
        @DisplayName("combination-dependent agent receives every phase-1 finding")
        void receivesPhaseOneFindings() {
            RecordingCombinedAgent network = new RecordingCombinedAgent();
            AgentDispatchService service = new AgentDispatchService(
                List.of(network, fixed("a", 0.9), fixed("b", 0.4), throwing("broken")), scheduler);

            AgentDispatchResult result = service.dispatchAll(dataset).block();

            assertNotNull(result);
            assertEquals(2, network.seen.get().size());
            assertEquals(0.2, result.findingsByAgent().get("network_agent").get(0).score(), 1e-12);
            assertEquals(List.of("a", "b", "broken", "network_agent"),
                List.copyOf(result.findingsByAgent().keySet()));
        }

        @Test
        @DisplayName("a failing combination-dependent agent is isolated too")
        void failingDependentAgent() {
            CombinationDependentAgent failing = new CombinationDependentAgent() {
                @Override public List<Finding> analyze(ClaimDataset ds, List<Finding> peers) {
                    throw AgentException.missingAttributes(agentName(), List.of("is_network_pharmacy"));
                }
                @Override public String agentName() { return "network_agent"; }
            };
            AgentDispatchService service = new AgentDispatchService(List.of(fixed("a", 0.9), failing), scheduler);

            AgentDispatchResult result = service.dispatchAll(dataset).block();

            assertNotNull(result);
            assertEquals(Set.of("network_agent"), result.failedAgents());
            assertEquals(1, result.findingsByAgent().get("a").size());
        }
    }

    @Test
    @DisplayName("two agents with the same name are rejected at construction")
    void duplicateAgentNamesRejected() {
        List<FraudAgent> agents = List.of(fixed("coverage_agent", 0.9), fixed("coverage_agent", 0.1));
        IllegalStateException ex = assertThrows(IllegalStateException.class,
            () -> new AgentDispatchService(agents, scheduler));
        assertTrue(ex.getMessage().contains("coverage_agent"));
    }
}
