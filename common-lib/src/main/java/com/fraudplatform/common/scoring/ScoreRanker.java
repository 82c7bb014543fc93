package com.fraudplatform.common.scoring;

import com.fraudplatform.common.model.AggregatedScore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders scores by descending final score (ties by entity id) and numbers them 1..n.
 * Idempotent: ranking an already ranked list returns an equal list.
 */
public final class ScoreRanker {

    static final Comparator<AggregatedScore> RISK_ORDER =
        Comparator.comparingDouble(AggregatedScore::finalScore).reversed()
                  .thenComparing(AggregatedScore::entityId);

    private ScoreRanker() {}

    public static List<AggregatedScore> rank(List<AggregatedScore> scores) {
        List<AggregatedScore> sorted = new ArrayList<>(scores);
        sorted.sort(RISK_ORDER);
        List<AggregatedScore> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return List.copyOf(ranked);
    }
}
