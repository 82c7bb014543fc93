package com.fraudplatform.orchestrator.logger;

import com.fraudplatform.common.trace.TraceContextUtil;
import com.fraudplatform.orchestrator.pipeline.FraudRunState;
import com.fraudplatform.orchestrator.pipeline.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Lifecycle logging for the fraud run pipeline. Side effects only; never changes what
 * flows through the pipeline.
 *
 * <p>Events (in order): {@link #RUN_STARTED}, then each stage's
 * {@link PipelineStage#completedEvent()}, then {@link #RUN_COMPLETED}. A stage that fails
 * logs {@link #STAGE_DEGRADED} instead of its completion event.
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(PipelineStage.AGGREGATE.completedEvent()))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String RUN_STARTED    = "RUN_STARTED";
    public static final String STAGE_DEGRADED = "STAGE_DEGRADED";
    public static final String RUN_COMPLETED  = "RUN_COMPLETED";

    /**
     * {@code doOnEach} consumer that logs {@code event} on {@code onNext}. The run id is
     * read from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String event) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = TraceContextUtil.getRunId(signal.getContextView());
            TraceContextUtil.withMdc(runId, () ->
                log.info("[FraudFlow] stage={} runId={}", event, runId)
            );
        };
    }

    public void logWithRunId(String event, String runId) {
        TraceContextUtil.withMdc(runId, () ->
            log.info("[FraudFlow] stage={} runId={}", event, runId)
        );
    }

    public void stageFailed(PipelineStage stage, String runId, Throwable error) {
        TraceContextUtil.withMdc(runId, () ->
            log.error("[FraudFlow] stage={} failedStage={} runId={} reason={}",
                STAGE_DEGRADED, stage, runId, error.getMessage(), error)
        );
    }

    public void logRunSummary(FraudRunState state, long latencyMs) {
        TraceContextUtil.withMdc(state.runId(), () ->
            log.info("[FraudFlow] stage={} claims={} agents={} failedAgents={} scored={} high={} "
                     + "degradedStages={} latencyMs={} runId={}",
                     RUN_COMPLETED,
                     state.dataset().size(),
                     state.findingsByAgent().size(),
                     state.failedAgents(),
                     state.rankedScores().size(),
                     state.insights().highRiskPharmacies(),
                     state.degradedStages(),
                     latencyMs,
                     state.runId())
        );
    }
}
