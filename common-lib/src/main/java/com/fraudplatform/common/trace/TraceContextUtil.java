package com.fraudplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Run id in the Reactor Context, copied into MDC only for the span of one log call.
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";
    public static final String UNKNOWN_RUN = "unknown";

    private TraceContextUtil() {}

    /** Apply last when assembling a run: {@code contextWrite} reaches upstream operators only. */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, orUnknown(runId)));
    }

    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, UNKNOWN_RUN);
    }

    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, orUnknown(runId));
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    private static String orUnknown(String runId) {
        return runId == null || runId.isBlank() ? UNKNOWN_RUN : runId;
    }
}
