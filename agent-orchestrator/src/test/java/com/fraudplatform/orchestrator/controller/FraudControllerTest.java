package com.fraudplatform.orchestrator.controller;

import com.fraudplatform.analysis.agent.FraudAgent;
import com.fraudplatform.analysis.service.AgentDispatchService;
import com.fraudplatform.common.insight.SupervisorInsightsGenerator;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.Finding;
import com.fraudplatform.common.scoring.WeightVector;
import com.fraudplatform.common.scoring.WeightedAggregationEngine;
import com.fraudplatform.orchestrator.Claims;
import com.fraudplatform.orchestrator.config.OrchestratorConfig;
import com.fraudplatform.orchestrator.export.ScoreCsvExporter;
import com.fraudplatform.orchestrator.logger.PipelineFlowLogger;
import com.fraudplatform.orchestrator.pipeline.FraudPipelineEngine;
import com.fraudplatform.orchestrator.service.FraudDetectionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FraudControllerTest {

    private final Scheduler scheduler = Schedulers.newBoundedElastic(2, 100, "test-agents");

    private WeightVector weightVector;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        FraudAgent coverage = new FraudAgent() {
            @Override
            public List<Finding> analyze(ClaimDataset ds) {
                return List.of(Finding.of("P1", 0.9, "cash-heavy", agentName(), Map.of()));
            }
            @Override public String agentName() { return "coverage_agent"; }
        };
        ClaimDataset dataset = Claims.dataset(Claims.claim("P1", "Cash", 250.0));
        weightVector = WeightVector.defaults();
        PipelineFlowLogger flowLogger = new PipelineFlowLogger();
        FraudPipelineEngine engine = new FraudPipelineEngine(
            () -> Mono.just(dataset),
            new AgentDispatchService(List.of(coverage), scheduler),
            new WeightedAggregationEngine(),
            weightVector,
            new SupervisorInsightsGenerator("coverage_agent", "patient_flip_agent"),
            flowLogger);
        FraudController controller = new FraudController(
            new FraudDetectionService(engine, flowLogger),
            weightVector,
            new ScoreCsvExporter(new OrchestratorConfig().csvMapper()));

        client = WebTestClient.bindToController(controller)
            .controllerAdvice(new ErrorHandler())
            .build();
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    @DisplayName("latest run is 404 before anything has run")
    void latestBeforeFirstRun() {
        client.get().uri("/api/v1/fraud/runs/latest").exchange().expectStatus().isNotFound();
        client.get().uri("/api/v1/fraud/runs/latest/export").exchange().expectStatus().isNotFound();
    }

    @Test
    @DisplayName("POST /runs returns the ranked result and GET /runs/latest serves it afterwards")
    void runThenLatest() {
        client.post().uri("/api/v1/fraud/runs").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.run_id").isNotEmpty()
            .jsonPath("$.total_claims").isEqualTo(1)
            .jsonPath("$.ranked_scores[0].entity_id").isEqualTo("P1")
            .jsonPath("$.ranked_scores[0].rank").isEqualTo(1)
            .jsonPath("$.degraded_stages").isEmpty();

        client.get().uri("/api/v1/fraud/runs/latest").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.ranked_scores[0].entity_id").isEqualTo("P1");
    }

    @Test
    @DisplayName("export serves the latest ranking as CSV")
    void exportCsv() {
        client.post().uri("/api/v1/fraud/runs").exchange().expectStatus().isOk();

        String body = client.get().uri("/api/v1/fraud/runs/latest/export").exchange()
            .expectStatus().isOk()
            .expectHeader().contentTypeCompatibleWith(MediaType.parseMediaType("text/csv"))
            .expectBody(String.class)
            .returnResult()
            .getResponseBody();

        assertNotNull(body);
        assertTrue(body.startsWith("rank,entity_id,"), body);
        assertTrue(body.contains("1,P1,"), body);
    }

    @Test
    @DisplayName("PUT /weights merges, renormalises and returns the new vector")
    void updateWeights() {
        client.put().uri("/api/v1/fraud/weights")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("coverage_agent", 0.5))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.coverage_agent").isNumber();

        // raw {0.5, 0.2, 0.2, 0.2, 0.15} → 0.5 / 1.25
        assertEquals(0.4, weightVector.weightOf("coverage_agent"), 1e-9);
    }

    @Test
    @DisplayName("a negative weight is rejected with 400 and the vector is left unchanged")
    void negativeWeightRejected() {
        Map<String, Double> before = weightVector.snapshot();

        client.put().uri("/api/v1/fraud/weights")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("network_agent", -0.1))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.code").isEqualTo("INVALID_WEIGHT")
            .jsonPath("$.agent").isEqualTo("network_agent");

        assertEquals(before, weightVector.snapshot());
    }

    @Test
    @DisplayName("GET /weights lists every configured agent")
    void currentWeights() {
        client.get().uri("/api/v1/fraud/weights").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.coverage_agent").isNumber()
            .jsonPath("$.network_agent").isNumber()
            .jsonPath("$.patient_flip_agent").isNumber();
    }
}
