package com.fraudplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Composite fraud score for one pharmacy in one run.
 *
 * <p>Field names are a downstream contract (exports and dashboards bind to them) and
 * must not be renamed. Collections are copied into sorted, unmodifiable containers so
 * two aggregations over the same input compare {@code equals}.
 *
 * <p>{@code rank} is 0 until the result set has been ranked.
 */
public record AggregatedScore(
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("pharmacy_name") String pharmacyName,
    @JsonProperty("pharmacy_city") String pharmacyCity,
    @JsonProperty("pharmacy_state") String pharmacyState,
    @JsonProperty("weighted_score") double weightedScore,
    @JsonProperty("consistency_score") double consistencyScore,
    @JsonProperty("outlier_score") double outlierScore,
    @JsonProperty("final_score") double finalScore,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("contributing_units") Set<String> contributingUnits,
    @JsonProperty("unit_scores") Map<String, Double> unitScores,
    @JsonProperty("unit_reasons") Map<String, String> unitReasons,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("transaction_count") int transactionCount,
    @JsonProperty("rank") int rank
) {
    public AggregatedScore {
        contributingUnits = contributingUnits == null ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(contributingUnits));
        unitScores = unitScores == null ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(unitScores));
        unitReasons = unitReasons == null ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(unitReasons));
    }

    public AggregatedScore withRank(int newRank) {
        return new AggregatedScore(entityId, pharmacyName, pharmacyCity, pharmacyState,
            weightedScore, consistencyScore, outlierScore, finalScore, riskLevel,
            contributingUnits, unitScores, unitReasons, explanation, transactionCount, newRank);
    }
}
