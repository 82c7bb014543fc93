package com.fraudplatform.analysis.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Bounded worker pool for agent execution. Agents are CPU-bound over an in-memory
 * dataset, so the pool is sized explicitly instead of sharing {@code boundedElastic}.
 */
@Configuration
public class AgentPoolConfig {

    private static final int QUEUED_TASK_CAP = 1_000;

    @Bean(name = "fraudAgentScheduler", destroyMethod = "dispose")
    public Scheduler fraudAgentScheduler(@Value("${fraud.agents.pool-size:5}") int poolSize) {
        return Schedulers.newBoundedElastic(Math.max(1, poolSize), QUEUED_TASK_CAP, "fraud-agents");
    }
}
