package com.fraudplatform.common.scoring;

import com.fraudplatform.common.model.AggregatedScore;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.Finding;

import java.util.List;
import java.util.Map;

/**
 * Strategy contract for merging per-agent findings into one composite score per pharmacy.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Deterministic</b>: equal inputs give {@code equals} outputs</li>
 *   <li><b>Non-null</b>: an empty input yields an empty list</li>
 * </ul>
 *
 * Register as a {@code @Bean} in the orchestrator configuration to swap strategies.
 */
public interface AggregationEngine {

    /**
     * @param findingsByAgent per-agent findings of this run (lists may be empty)
     * @param dataset         the claims the findings were derived from
     * @param weights         normalised weight snapshot keyed by agent name
     * @return one score per reported pharmacy, sorted by final score and ranked from 1
     */
    List<AggregatedScore> aggregate(Map<String, List<Finding>> findingsByAgent,
                                    ClaimDataset dataset,
                                    Map<String, Double> weights);
}
