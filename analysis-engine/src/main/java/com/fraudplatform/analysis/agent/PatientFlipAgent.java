package com.fraudplatform.analysis.agent;

import com.fraudplatform.analysis.indicator.ClaimIndicators;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.ClaimRecord;
import com.fraudplatform.common.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Detects insurance-to-cash flips: the same patient fills the same product at the same
 * pharmacy first through insurance and later as cash, typically after a rejection.
 *
 * <h3>Per (patient, product, pharmacy) group</h3>
 * <ol>
 *   <li>Only coverage types Well Covered / Covered - HD (insured) and Cash / Not Covered
 *       (cash) take part; groups need at least two such claims.</li>
 *   <li>The earliest cash claim must be strictly later than the earliest insured claim.</li>
 *   <li>With rejection evidence on an insured claim the pattern is scored by the share of
 *       cash claims in the group:
 *       <pre>  &gt; 0.8 → 1.0   &gt; 0.6 → 0.8   &gt; 0.4 → 0.6   &gt; 0.2 → 0.4   else 0.2</pre>
 *       without it the pattern is still flagged as SUSPICIOUS at 0.3.</li>
 * </ol>
 * A pharmacy's finding is its strongest pattern; {@code flip_patterns} counts all of them.
 */
@Component
public class PatientFlipAgent implements FraudAgent {

    public static final String NAME = "patient_flip_agent";

    private static final Logger log = LoggerFactory.getLogger(PatientFlipAgent.class);

    static final Set<String> INSURED_TYPES = Set.of("Well Covered", "Covered - HD");
    static final Set<String> CASH_TYPES    = Set.of("Cash", "Not Covered");

    /** A copay this high on an insured claim is treated as a sign of rejection. */
    private static final double REJECTION_COPAY = 100.0;

    private static final double SUSPICIOUS_SCORE = 0.3;

    @Override
    public String agentName() { return NAME; }

    @Override
    public List<Finding> analyze(ClaimDataset dataset) {
        log.info("[{}] Analyzing flip patterns for {} claims", NAME, dataset.size());

        List<Finding> findings = new ArrayList<>();
        int patternCount = 0;
        for (Map.Entry<String, List<ClaimRecord>> pharmacy : dataset.byPharmacy().entrySet()) {
            List<FlipPattern> patterns = new ArrayList<>();
            groupByPatientProduct(pharmacy.getValue()).forEach((key, group) ->
                detect(group).ifPresent(patterns::add));
            if (patterns.isEmpty()) {
                continue;
            }
            patternCount += patterns.size();
            FlipPattern strongest = patterns.get(0);
            for (FlipPattern p : patterns) {
                if (p.score() > strongest.score()) strongest = p;
            }
            findings.add(toFinding(pharmacy.getKey(), strongest, patterns.size()));
        }

        log.info("[{}] {} flip patterns across {} pharmacies", NAME, patternCount, findings.size());
        return findings;
    }

    private static Map<String, List<ClaimRecord>> groupByPatientProduct(List<ClaimRecord> claims) {
        Map<String, List<ClaimRecord>> groups = new TreeMap<>();
        for (ClaimRecord claim : claims) {
            String type = claim.coverage();
            if (!INSURED_TYPES.contains(type) && !CASH_TYPES.contains(type)) continue;
            if (ClaimRecord.isBlank(claim.patientId()) || ClaimRecord.isBlank(claim.productNdc())) continue;
            groups.computeIfAbsent(claim.patientId() + "|" + claim.productNdc(), k -> new ArrayList<>()).add(claim);
        }
        return groups;
    }

    static Optional<FlipPattern> detect(List<ClaimRecord> group) {
        if (group.size() < 2) {
            return Optional.empty();
        }
        List<ClaimRecord> insured = group.stream().filter(c -> INSURED_TYPES.contains(c.coverage())).toList();
        List<ClaimRecord> cash    = group.stream().filter(c -> CASH_TYPES.contains(c.coverage())).toList();
        if (insured.isEmpty() || cash.isEmpty()) {
            return Optional.empty();
        }

        Optional<LocalDate> firstInsured = earliest(insured);
        Optional<LocalDate> firstCash    = earliest(cash);
        if (firstInsured.isEmpty() || firstCash.isEmpty() || !firstCash.get().isAfter(firstInsured.get())) {
            return Optional.empty();
        }

        ClaimRecord sample = group.get(0);
        int flips = cash.size();
        if (!insured.stream().anyMatch(PatientFlipAgent::hasRejectionEvidence)) {
            return Optional.of(new FlipPattern(sample.patientId(), sample.productNdc(), flips, group.size(),
                SUSPICIOUS_SCORE, "SUSPICIOUS: Insurance-to-cash pattern without rejection indicators"));
        }

        double ratio = (double) flips / group.size();
        double score;
        String reason;
        if (ratio > 0.8) {
            score = 1.0; reason = "HIGH_RISK: >80% claims are cash flips";
        } else if (ratio > 0.6) {
            score = 0.8; reason = "MEDIUM_HIGH: >60% claims are cash flips";
        } else if (ratio > 0.4) {
            score = 0.6; reason = "MEDIUM: >40% claims are cash flips";
        } else if (ratio > 0.2) {
            score = 0.4; reason = "LOW_MEDIUM: >20% claims are cash flips";
        } else {
            score = 0.2; reason = "LOW: Some cash flips detected";
        }
        return Optional.of(new FlipPattern(sample.patientId(), sample.productNdc(), flips, group.size(), score, reason));
    }

    static boolean hasRejectionEvidence(ClaimRecord claim) {
        return ClaimIndicators.hasPaRejection(claim)
            || ClaimIndicators.hasCobRejection(claim)
            || ClaimIndicators.present(claim.latestPaStatusCode())
            || ClaimIndicators.mentionsRejectOrDenial(claim.latestPaStatusDesc())
            || claim.copay() > REJECTION_COPAY;
    }

    private static Optional<LocalDate> earliest(List<ClaimRecord> claims) {
        return claims.stream().map(ClaimRecord::dateSubmitted).filter(Objects::nonNull).min(LocalDate::compareTo);
    }

    private Finding toFinding(String pharmacy, FlipPattern pattern, int patternCount) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("patient_id", pattern.patientId());
        detail.put("product_ndc", pattern.productNdc());
        detail.put("number_of_flips", pattern.flips());
        detail.put("total_claims", pattern.totalClaims());
        detail.put("flip_patterns", patternCount);
        detail.put("analysis_type", "flip_pattern");
        return Finding.of(pharmacy, pattern.score(), pattern.reason(), NAME, detail);
    }

    record FlipPattern(String patientId, String productNdc, int flips, int totalClaims,
                       double score, String reason) {}
}
