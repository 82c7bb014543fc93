package com.fraudplatform.orchestrator.service;

import com.fraudplatform.common.trace.TraceContextUtil;
import com.fraudplatform.orchestrator.logger.PipelineFlowLogger;
import com.fraudplatform.orchestrator.pipeline.FraudPipelineEngine;
import com.fraudplatform.orchestrator.pipeline.FraudRunState;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for fraud runs. Assigns the run id, executes the pipeline and keeps the
 * most recent completed result for the read endpoints.
 */
@Service
public class FraudDetectionService {

    private final FraudPipelineEngine pipelineEngine;
    private final PipelineFlowLogger flowLogger;
    private final AtomicReference<FraudRunResult> latestRun = new AtomicReference<>();

    public FraudDetectionService(FraudPipelineEngine pipelineEngine, PipelineFlowLogger flowLogger) {
        this.pipelineEngine = pipelineEngine;
        this.flowLogger = flowLogger;
    }

    public Mono<FraudRunResult> runDetection() {
        String runId = UUID.randomUUID().toString();
        Mono<FraudRunResult> run = Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            flowLogger.logWithRunId(PipelineFlowLogger.RUN_STARTED, runId);
            return pipelineEngine.execute(FraudRunState.start(runId, Instant.now()))
                .map(state -> {
                    long latencyMs = System.currentTimeMillis() - startTime;
                    flowLogger.logRunSummary(state, latencyMs);
                    return FraudRunResult.from(state, latencyMs);
                })
                .doOnNext(latestRun::set);
        });
        return TraceContextUtil.withRunId(run, runId);
    }

    public Optional<FraudRunResult> latestRun() {
        return Optional.ofNullable(latestRun.get());
    }
}
