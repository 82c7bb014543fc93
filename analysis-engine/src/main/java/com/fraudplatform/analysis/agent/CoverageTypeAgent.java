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
import java.util.Set;

/**
 * Flags pharmacies whose claims are mostly uninsured: coverage type Cash / Not Covered,
 * or an other-coverage code of 0, 1 or 3.
 *
 * <pre>
 *   flagged %  &gt; 90 → 1.0   &gt; 75 → 0.8   &gt; 50 → 0.6   &gt; 25 → 0.3   &gt; 0 → 0.1   else 0.0
 * </pre>
 * Every pharmacy receives a finding, including "Normal" ones at 0.0.
 */
@Component
public class CoverageTypeAgent implements FraudAgent {

    public static final String NAME = "coverage_agent";

    private static final Logger log = LoggerFactory.getLogger(CoverageTypeAgent.class);

    private static final Set<Integer> SUSPICIOUS_OCC = Set.of(0, 1, 3);

    @Override
    public String agentName() { return NAME; }

    @Override
    public List<Finding> analyze(ClaimDataset dataset) {
        log.info("[{}] Analyzing coverage patterns for {} claims", NAME, dataset.size());

        List<Finding> findings = new ArrayList<>();
        dataset.byPharmacy().forEach((pharmacy, claims) -> {
            long flagged = claims.stream().filter(CoverageTypeAgent::isFlagged).count();
            double flaggedPercent = flagged * 100.0 / claims.size();

            double score;
            String reason;
            if (flaggedPercent > 90) {
                score = 1.0; reason = "HIGH_RISK: >90% flagged claims";
            } else if (flaggedPercent > 75) {
                score = 0.8; reason = "MEDIUM_HIGH: >75% flagged claims";
            } else if (flaggedPercent > 50) {
                score = 0.6; reason = "MEDIUM: >50% flagged claims";
            } else if (flaggedPercent > 25) {
                score = 0.3; reason = "LOW_MEDIUM: >25% flagged claims";
            } else if (flaggedPercent > 0) {
                score = 0.1; reason = "LOW: Some flagged claims";
            } else {
                score = 0.0; reason = "Normal";
            }

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("total_claims", claims.size());
            detail.put("flagged_claims", flagged);
            detail.put("flagged_percent", ClaimIndicators.round2(flaggedPercent));
            detail.put("analysis_type", "coverage_pattern");
            findings.add(Finding.of(pharmacy, score, reason, NAME, detail));
        });

        long high = findings.stream().filter(f -> f.score() >= 0.8).count();
        log.info("[{}] Analyzed {} pharmacies, high risk={}", NAME, findings.size(), high);
        return findings;
    }

    static boolean isFlagged(ClaimRecord claim) {
        return claim.isCashOrNotCovered() || (claim.occ() != null && SUSPICIOUS_OCC.contains(claim.occ()));
    }
}
