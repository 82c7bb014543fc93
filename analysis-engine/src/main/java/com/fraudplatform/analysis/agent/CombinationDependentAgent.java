package com.fraudplatform.analysis.agent;

import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.Finding;

import java.util.List;

/**
 * An agent whose score depends on what the other agents found. Runs in the second
 * dispatch phase, after every independent agent has completed, and receives their
 * combined findings.
 */
public interface CombinationDependentAgent extends FraudAgent {

    List<Finding> analyze(ClaimDataset dataset, List<Finding> peerFindings);

    @Override
    default List<Finding> analyze(ClaimDataset dataset) {
        return analyze(dataset, List.of());
    }
}
