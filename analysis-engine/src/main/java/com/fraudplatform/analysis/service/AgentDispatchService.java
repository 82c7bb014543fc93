package com.fraudplatform.analysis.service;

import com.fraudplatform.analysis.agent.CombinationDependentAgent;
import com.fraudplatform.analysis.agent.FraudAgent;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Runs every registered {@link FraudAgent} over a dataset.
 *
 * <p>Phase 1 fans the independent agents out on the bounded agent scheduler. Phase 2
 * runs each {@link CombinationDependentAgent} one after another with the combined
 * phase-1 findings. An agent that throws is logged, recorded as failed and contributes
 * an empty list; a {@code null} result is treated as empty. Neither affects the other
 * agents.
 */
@Service
public class AgentDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatchService.class);

    private final List<FraudAgent> independentAgents;
    private final List<CombinationDependentAgent> dependentAgents;
    private final Scheduler agentScheduler;

    public AgentDispatchService(List<FraudAgent> agents,
                                @Qualifier("fraudAgentScheduler") Scheduler agentScheduler) {
        List<FraudAgent> independent = new ArrayList<>();
        List<CombinationDependentAgent> dependent = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (FraudAgent agent : agents) {
            if (!names.add(agent.agentName())) {
                throw new IllegalStateException("Duplicate agent name: " + agent.agentName());
            }
            if (agent instanceof CombinationDependentAgent combined) {
                dependent.add(combined);
            } else {
                independent.add(agent);
            }
        }
        this.independentAgents = List.copyOf(independent);
        this.dependentAgents = List.copyOf(dependent);
        this.agentScheduler = agentScheduler;
    }

    public Mono<AgentDispatchResult> dispatchAll(ClaimDataset dataset) {
        log.info("Dispatching {} agents in parallel (+{} combination-dependent) over {} claims",
            independentAgents.size(), dependentAgents.size(), dataset.size());

        return Flux.fromIterable(independentAgents)
            .flatMap(agent -> runIsolated(agent, () -> agent.analyze(dataset)))
            .collectList()
            .flatMap(phaseOne -> {
                List<Finding> peerFindings = phaseOne.stream()
                    .flatMap(outcome -> outcome.findings().stream())
                    .toList();
                return Flux.fromIterable(dependentAgents)
                    .concatMap(agent -> runIsolated(agent, () -> agent.analyze(dataset, peerFindings)))
                    .collectList()
                    .map(phaseTwo -> merge(phaseOne, phaseTwo));
            })
            .doOnSuccess(result -> log.info("Dispatch complete. agents={} findings={} failed={}",
                result.findingsByAgent().size(), result.totalFindings(), result.failedAgents()));
    }

    private Mono<AgentOutcome> runIsolated(FraudAgent agent, Callable<List<Finding>> work) {
        String name = agent.agentName();
        return Mono.fromCallable(() -> {
                long start = System.currentTimeMillis();
                List<Finding> findings = work.call();
                if (findings == null) {
                    log.warn("Agent={} returned no result, treating as empty", name);
                    return AgentOutcome.succeeded(name, List.of());
                }
                List<Finding> clean = findings.stream().filter(Objects::nonNull).toList();
                log.info("Agent={} complete. findings={} latencyMs={}",
                    name, clean.size(), System.currentTimeMillis() - start);
                return AgentOutcome.succeeded(name, clean);
            })
            .subscribeOn(agentScheduler)
            .onErrorResume(e -> {
                log.error("Agent={} failed: {}", name, e.getMessage(), e);
                return Mono.just(AgentOutcome.failed(name));
            });
    }

    private static AgentDispatchResult merge(List<AgentOutcome> phaseOne, List<AgentOutcome> phaseTwo) {
        Map<String, List<Finding>> findingsByAgent = new HashMap<>();
        Set<String> failed = new HashSet<>();
        for (List<AgentOutcome> phase : List.of(phaseOne, phaseTwo)) {
            for (AgentOutcome outcome : phase) {
                findingsByAgent.put(outcome.agentName(), outcome.findings());
                if (outcome.failed()) failed.add(outcome.agentName());
            }
        }
        return new AgentDispatchResult(findingsByAgent, failed);
    }

    private record AgentOutcome(String agentName, List<Finding> findings, boolean failed) {
        static AgentOutcome succeeded(String agentName, List<Finding> findings) {
            return new AgentOutcome(agentName, findings, false);
        }

        static AgentOutcome failed(String agentName) {
            return new AgentOutcome(agentName, List.of(), true);
        }
    }
}
