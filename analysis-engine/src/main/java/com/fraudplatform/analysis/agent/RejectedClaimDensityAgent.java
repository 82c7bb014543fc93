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
 * Detects pharmacies with a high density of rejected claims (possible gaming of the
 * adjudication flow). Pharmacies without any rejection are omitted.
 *
 * <pre>
 *   rejection %     ≥ 50 → .4  ≥ 30 → .3  ≥ 20 → .2  ≥ 10 → .1
 *   rejected count  ≥ 20 → .3  ≥ 10 → .2  ≥ 5  → .1
 *   total claims    ≥ 50 → .3  ≥ 20 → .2  ≥ 10 → .1
 * </pre>
 */
@Component
public class RejectedClaimDensityAgent implements FraudAgent {

    public static final String NAME = "rejection_agent";

    private static final Logger log = LoggerFactory.getLogger(RejectedClaimDensityAgent.class);

    @Override
    public String agentName() { return NAME; }

    @Override
    public List<Finding> analyze(ClaimDataset dataset) {
        log.info("[{}] Analyzing rejection density for {} claims", NAME, dataset.size());

        List<Finding> findings = new ArrayList<>();
        dataset.byPharmacy().forEach((pharmacy, claims) -> {
            int rejected = (int) claims.stream().filter(ClaimIndicators::hasRejection).count();
            if (rejected == 0) {
                return;
            }
            int total = claims.size();
            double rejectionPercent = rejected * 100.0 / total;
            double score = fraudScore(total, rejected, rejectionPercent);

            int primary = ClaimIndicators.countCodes(claims,
                ClaimRecord::cobPrimaryRejectCode1, ClaimRecord::cobPrimaryRejectCode2);
            int pa = ClaimIndicators.countCodes(claims,
                ClaimRecord::paRejectionCode1, ClaimRecord::paRejectionCode2);
            int status = (int) claims.stream().filter(ClaimIndicators::hasRejectedPaStatus).count();

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("total_claims", total);
            detail.put("rejected_claims", rejected);
            detail.put("rejection_percentage", ClaimIndicators.round2(rejectionPercent));
            detail.put("primary_rejections", primary);
            detail.put("pa_rejections", pa);
            detail.put("status_rejections", status);
            detail.put("total_rejection_types", primary + pa + status);
            detail.put("analysis_type", "rejection_density");
            findings.add(Finding.of(pharmacy, score, reason(score), NAME, detail));
        });

        log.info("[{}] {} pharmacies with rejections", NAME, findings.size());
        return findings;
    }

    static double fraudScore(int total, int rejected, double rejectionPercent) {
        double score = 0.0;

        if (rejectionPercent >= 50)      score += 0.4;
        else if (rejectionPercent >= 30) score += 0.3;
        else if (rejectionPercent >= 20) score += 0.2;
        else if (rejectionPercent >= 10) score += 0.1;

        if (rejected >= 20)      score += 0.3;
        else if (rejected >= 10) score += 0.2;
        else if (rejected >= 5)  score += 0.1;

        if (total >= 50)      score += 0.3;
        else if (total >= 20) score += 0.2;
        else if (total >= 10) score += 0.1;

        return ClaimIndicators.round3(ClaimIndicators.clamp01(score));
    }

    private static String reason(double score) {
        String text;
        if (score >= 0.9)      text = "Extremely high rejection rate with large volume";
        else if (score >= 0.8) text = "High rejection density indicating potential gaming";
        else if (score >= 0.6) text = "Elevated rejection patterns";
        else if (score >= 0.4) text = "Moderate rejection density";
        else if (score >= 0.2) text = "Some rejection patterns detected";
        else                   text = "Minimal rejection activity";
        return ClaimIndicators.severity(score) + ": " + text;
    }
}
