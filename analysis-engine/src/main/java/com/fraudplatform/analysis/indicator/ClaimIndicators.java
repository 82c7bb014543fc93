package com.fraudplatform.analysis.indicator;

import com.fraudplatform.common.model.ClaimRecord;

import java.util.Collection;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Pure claim-level predicates and helpers shared by the scoring agents.
 */
public final class ClaimIndicators {

    private ClaimIndicators() {}

    // ── Rejections ──────────────────────────────────────────────────────────

    /** Either COB primary reject code is present. */
    public static boolean hasCobRejection(ClaimRecord claim) {
        return present(claim.cobPrimaryRejectCode1()) || present(claim.cobPrimaryRejectCode2());
    }

    /** Either PA rejection code is present. */
    public static boolean hasPaRejection(ClaimRecord claim) {
        return present(claim.paRejectionCode1()) || present(claim.paRejectionCode2());
    }

    /** Latest PA status description mentions reject, denied or failed (case-insensitive). */
    /** PA status text reading reject, denied or failed. */
    public static boolean hasRejectedPaStatus(ClaimRecord claim) {
        String desc = claim.latestPaStatusDesc();
        if (desc == null) return false;
        return mentionsRejectOrDenial(desc) || desc.toLowerCase(Locale.ROOT).contains("failed");
    }

    public static boolean mentionsRejectOrDenial(String text) {
        if (text == null) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.contains("reject") || lower.contains("denied");
    }

    public static boolean hasRejection(ClaimRecord claim) {
        return hasCobRejection(claim) || hasPaRejection(claim) || hasRejectedPaStatus(claim);
    }

    /** Number of non-blank values among the given reject-code columns across all claims. */
    public static int countCodes(Collection<ClaimRecord> claims,
                                 Function<ClaimRecord, String> first,
                                 Function<ClaimRecord, String> second) {
        int count = 0;
        for (ClaimRecord claim : claims) {
            if (present(first.apply(claim)))  count++;
            if (present(second.apply(claim))) count++;
        }
        return count;
    }

    // ── Ratios and scores ───────────────────────────────────────────────────

    /**
     * @return share of claims matching {@code predicate}, as a percentage 0–100;
     *         0 for an empty collection
     */
    public static double percentOf(Collection<ClaimRecord> claims, Predicate<ClaimRecord> predicate) {
        if (claims == null || claims.isEmpty()) return 0.0;
        long matching = claims.stream().filter(predicate).count();
        return matching * 100.0 / claims.size();
    }

    public static double clamp01(double score) {
        return Math.max(0.0, Math.min(score, 1.0));
    }

    public static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * Severity prefix used in agent reasons.
     * <pre>
     *   ≥ 0.9 CRITICAL · ≥ 0.8 HIGH_RISK · ≥ 0.6 MEDIUM_HIGH · ≥ 0.4 MEDIUM · ≥ 0.2 LOW_MEDIUM · else LOW
     * </pre>
     */
    public static String severity(double score) {
        if (score >= 0.9) return "CRITICAL";
        if (score >= 0.8) return "HIGH_RISK";
        if (score >= 0.6) return "MEDIUM_HIGH";
        if (score >= 0.4) return "MEDIUM";
        if (score >= 0.2) return "LOW_MEDIUM";
        return "LOW";
    }

    public static boolean present(String value) {
        return !ClaimRecord.isBlank(value);
    }
}
