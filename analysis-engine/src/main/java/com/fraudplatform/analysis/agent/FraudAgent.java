package com.fraudplatform.analysis.agent;

import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.Finding;

import java.util.List;

/**
 * A scoring agent. Reads the shared dataset, never mutates it, and returns at most one
 * {@link Finding} per pharmacy it has an opinion on. Throwing is allowed: the dispatcher
 * isolates the failure and records the agent as failed.
 */
public interface FraudAgent {
    List<Finding> analyze(ClaimDataset dataset);
    String agentName();
}
