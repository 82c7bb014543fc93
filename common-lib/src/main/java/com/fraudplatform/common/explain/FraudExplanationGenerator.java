package com.fraudplatform.common.explain;

import com.fraudplatform.common.model.ClaimRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the audit text attached to every {@code AggregatedScore}.
 *
 * <p>Output shape (clauses omitted when empty, joined with {@value #SEPARATOR}):
 * <pre>
 *   HIGH RISK from 2 agents: &lt;reason&gt;, &lt;reason&gt; | MEDIUM RISK from 1 agents: &lt;reason&gt;
 *     | Transaction Analysis: 62.5% cash/not covered claims, 12.5% high-dollar claims
 * </pre>
 *
 * Pure function of its inputs; agents are listed in name order.
 */
public final class FraudExplanationGenerator {

    public static final String SEPARATOR = " | ";
    public static final String NO_INDICATORS =
        "Multiple agent analysis completed - no significant fraud indicators detected";

    private static final double HIGH_RISK   = 0.8;
    private static final double MEDIUM_RISK = 0.6;

    private FraudExplanationGenerator() {}

    public static String explain(Map<String, Double> agentScores,
                                 Map<String, String> agentReasons,
                                 List<ClaimRecord> transactions) {
        Map<String, Double> scores = new TreeMap<>(agentScores);
        List<String> highReasons = new ArrayList<>();
        List<String> mediumReasons = new ArrayList<>();

        scores.forEach((agent, score) -> {
            if (score >= HIGH_RISK) {
                highReasons.add(reasonOrDefault(agentReasons, agent, "High risk"));
            } else if (score >= MEDIUM_RISK) {
                mediumReasons.add(reasonOrDefault(agentReasons, agent, "Medium risk"));
            }
        });

        List<String> parts = new ArrayList<>();
        if (!highReasons.isEmpty()) {
            parts.add("HIGH RISK from " + highReasons.size() + " agents: " + String.join(", ", highReasons));
        }
        if (!mediumReasons.isEmpty()) {
            parts.add("MEDIUM RISK from " + mediumReasons.size() + " agents: " + String.join(", ", mediumReasons));
        }
        String transactionClause = transactionClause(transactions);
        if (transactionClause != null) {
            parts.add(transactionClause);
        }

        return parts.isEmpty() ? NO_INDICATORS : String.join(SEPARATOR, parts);
    }

    private static String transactionClause(List<ClaimRecord> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return null;
        }
        int total = transactions.size();
        long cash = transactions.stream().filter(ClaimRecord::isCashOrNotCovered).count();
        long highDollar = transactions.stream().filter(ClaimRecord::isHighCost).count();

        List<String> insights = new ArrayList<>();
        if (cash > 0) {
            insights.add(percent(cash, total) + " cash/not covered claims");
        }
        if (highDollar > 0) {
            insights.add(percent(highDollar, total) + " high-dollar claims");
        }
        return insights.isEmpty() ? null : "Transaction Analysis: " + String.join(", ", insights);
    }

    private static String percent(long part, int total) {
        return String.format(Locale.ROOT, "%.1f%%", part * 100.0 / total);
    }

    private static String reasonOrDefault(Map<String, String> reasons, String agent, String fallback) {
        String reason = reasons == null ? null : reasons.get(agent);
        return reason == null || reason.isBlank() ? fallback : reason;
    }
}
