package com.fraudplatform.analysis.agent;

import com.fraudplatform.analysis.indicator.ClaimIndicators;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.ClaimRecord;
import com.fraudplatform.common.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects concentrations of high-dollar claims that may indicate rebate abuse.
 *
 * <p>A claim is high-dollar when copay &gt; 200, OOP &gt; 500, copay fee &gt; 200 or original
 * cost &gt; 1000. Per pharmacy with at least one such claim, four factors of up to 0.25 each:
 * <pre>
 *   count        ≥ 10 → .25   ≥ 5 → .15     ≥ 2 → .10
 *   total cost   ≥ 10k → .25  ≥ 5k → .15    ≥ 2k → .10
 *   avg cost     ≥ 1000 → .25 ≥ 500 → .15   ≥ 300 → .10
 *   cash share % ≥ 80 → .25   ≥ 60 → .15    ≥ 40 → .10
 * </pre>
 * Costs are original cost of the high-dollar claims.
 */
@Component
public class HighDollarClaimAgent implements FraudAgent {

    public static final String NAME = "high_dollar_agent";

    private static final Logger log = LoggerFactory.getLogger(HighDollarClaimAgent.class);

    private static final double COPAY_LIMIT    = 200.0;
    private static final double OOP_LIMIT      = 500.0;
    private static final double COPAY_FEE_LIMIT = 200.0;
    private static final double ORIGINAL_LIMIT = 1000.0;

    @Override
    public String agentName() { return NAME; }

    @Override
    public List<Finding> analyze(ClaimDataset dataset) {
        log.info("[{}] Analyzing high-dollar claims for {} claims", NAME, dataset.size());

        List<Finding> findings = new ArrayList<>();
        dataset.byPharmacy().forEach((pharmacy, claims) -> {
            List<ClaimRecord> highDollar = claims.stream().filter(HighDollarClaimAgent::isHighDollar).toList();
            if (highDollar.isEmpty()) {
                return;
            }
            int count = highDollar.size();
            double totalCost = highDollar.stream().mapToDouble(ClaimRecord::original).sum();
            double avgCost = totalCost / count;
            long cashCount = highDollar.stream().filter(ClaimRecord::isCashOrNotCovered).count();
            double cashPercent = cashCount * 100.0 / count;

            double score = fraudScore(count, totalCost, avgCost, cashPercent);

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("total_high_dollar_claims", count);
            detail.put("total_cost", ClaimIndicators.round2(totalCost));
            detail.put("avg_claim_cost", ClaimIndicators.round2(avgCost));
            detail.put("cash_not_covered_count", cashCount);
            detail.put("cash_percentage", ClaimIndicators.round2(cashPercent));
            detail.put("analysis_type", "high_dollar_claims");
            findings.add(Finding.of(pharmacy, score, reason(score), NAME, detail));
        });

        log.info("[{}] {} pharmacies with high-dollar claims", NAME, findings.size());
        return findings;
    }

    static boolean isHighDollar(ClaimRecord claim) {
        return claim.copay() > COPAY_LIMIT
            || claim.oop() > OOP_LIMIT
            || claim.copayFee() > COPAY_FEE_LIMIT
            || claim.original() > ORIGINAL_LIMIT;
    }

    static double fraudScore(int count, double totalCost, double avgCost, double cashPercent) {
        double score = 0.0;

        if (count >= 10)      score += 0.25;
        else if (count >= 5)  score += 0.15;
        else if (count >= 2)  score += 0.10;

        if (totalCost >= 10_000)     score += 0.25;
        else if (totalCost >= 5_000) score += 0.15;
        else if (totalCost >= 2_000) score += 0.10;

        if (avgCost >= 1000)     score += 0.25;
        else if (avgCost >= 500) score += 0.15;
        else if (avgCost >= 300) score += 0.10;

        if (cashPercent >= 80)      score += 0.25;
        else if (cashPercent >= 60) score += 0.15;
        else if (cashPercent >= 40) score += 0.10;

        return ClaimIndicators.round3(ClaimIndicators.clamp01(score));
    }

    private static String reason(double score) {
        String text;
        if (score >= 0.9)      text = "Multiple high-risk factors - high volume, high cost, high cash percentage";
        else if (score >= 0.8) text = "High-dollar claims with suspicious patterns";
        else if (score >= 0.6) text = "Elevated high-dollar claim activity";
        else if (score >= 0.4) text = "Moderate high-dollar claim patterns";
        else if (score >= 0.2) text = "Some high-dollar claims detected";
        else                   text = "Minimal high-dollar claim activity";
        return ClaimIndicators.severity(score) + ": " + text;
    }
}
