package com.fraudplatform.orchestrator.pipeline;

import com.fraudplatform.analysis.service.AgentDispatchService;
import com.fraudplatform.common.insight.RunInsights;
import com.fraudplatform.common.insight.SupervisorInsightsGenerator;
import com.fraudplatform.common.model.AggregatedScore;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.scoring.AggregationEngine;
import com.fraudplatform.common.scoring.ScoreRanker;
import com.fraudplatform.common.scoring.WeightVector;
import com.fraudplatform.orchestrator.data.ClaimDataSource;
import com.fraudplatform.orchestrator.logger.PipelineFlowLogger;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Drives one fraud run through {@code LOAD → EXECUTE_AGENTS → AGGREGATE → FINALIZE}.
 *
 * <h3>Failure boundary per stage</h3>
 * Any error raised by a stage is logged with the run id, the stage is appended to
 * {@code degradedStages} and the stage's output is replaced by its empty value:
 * <ul>
 *   <li>LOAD: empty dataset</li>
 *   <li>EXECUTE_AGENTS: empty findings map</li>
 *   <li>AGGREGATE: empty score list</li>
 *   <li>FINALIZE: empty ranking and empty insights</li>
 * </ul>
 * Later stages still run. No retry, no rollback.
 *
 * <p>Aggregation reads a snapshot of the {@link WeightVector}, so a concurrent weight
 * update applies to the next run only.
 */
@Component
public class FraudPipelineEngine {

    private final ClaimDataSource dataSource;
    private final AgentDispatchService dispatchService;
    private final AggregationEngine aggregationEngine;
    private final WeightVector weightVector;
    private final SupervisorInsightsGenerator insightsGenerator;
    private final PipelineFlowLogger flowLogger;

    public FraudPipelineEngine(ClaimDataSource dataSource,
                               AgentDispatchService dispatchService,
                               AggregationEngine aggregationEngine,
                               WeightVector weightVector,
                               SupervisorInsightsGenerator insightsGenerator,
                               PipelineFlowLogger flowLogger) {
        this.dataSource        = dataSource;
        this.dispatchService   = dispatchService;
        this.aggregationEngine = aggregationEngine;
        this.weightVector      = weightVector;
        this.insightsGenerator = insightsGenerator;
        this.flowLogger        = flowLogger;
    }

    public Mono<FraudRunState> execute(FraudRunState initial) {
        return Mono.just(initial)
            .flatMap(this::load)
            .flatMap(this::executeAgents)
            .flatMap(this::aggregate)
            .flatMap(this::finalizeRun);
    }

    private Mono<FraudRunState> load(FraudRunState state) {
        return runStage(PipelineStage.LOAD, state,
            () -> dataSource.load().map(state::withDataset),
            s -> s.withDataset(ClaimDataset.empty()));
    }

    private Mono<FraudRunState> executeAgents(FraudRunState state) {
        return runStage(PipelineStage.EXECUTE_AGENTS, state,
            () -> dispatchService.dispatchAll(state.dataset())
                .map(result -> state.withAgentFindings(result.findingsByAgent(), result.failedAgents())),
            s -> s.withAgentFindings(Map.of(), Set.of()));
    }

    private Mono<FraudRunState> aggregate(FraudRunState state) {
        return runStage(PipelineStage.AGGREGATE, state,
            () -> Mono.fromCallable(() -> state.withAggregatedScores(
                aggregationEngine.aggregate(state.findingsByAgent(), state.dataset(), weightVector.snapshot()))),
            s -> s.withAggregatedScores(List.of()));
    }

    private Mono<FraudRunState> finalizeRun(FraudRunState state) {
        return runStage(PipelineStage.FINALIZE, state,
            () -> Mono.fromCallable(() -> {
                List<AggregatedScore> ranked = ScoreRanker.rank(state.aggregatedScores());
                RunInsights insights = insightsGenerator.generate(ranked, state.findingsByAgent(), state.failedAgents());
                return state.withRanking(ranked, insights);
            }),
            s -> s.withRanking(List.of(), RunInsights.EMPTY));
    }

    private Mono<FraudRunState> runStage(PipelineStage stage,
                                         FraudRunState state,
                                         Supplier<Mono<FraudRunState>> work,
                                         UnaryOperator<FraudRunState> fallback) {
        return Mono.defer(work)
            .switchIfEmpty(Mono.error(() -> new IllegalStateException("Stage " + stage + " produced no state")))
            .doOnEach(flowLogger.stage(stage.completedEvent()))
            .onErrorResume(e -> {
                flowLogger.stageFailed(stage, state.runId(), e);
                return Mono.just(fallback.apply(state).withDegraded(stage));
            });
    }
}
