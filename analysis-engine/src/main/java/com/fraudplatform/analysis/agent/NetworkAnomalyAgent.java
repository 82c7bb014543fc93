package com.fraudplatform.analysis.agent;

import com.fraudplatform.analysis.indicator.ClaimIndicators;
import com.fraudplatform.common.exception.AgentException;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.ClaimRecord;
import com.fraudplatform.common.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores non-network activity and, when peer findings are supplied, blends it with what
 * the other agents concluded about the same pharmacy.
 *
 * <h3>Network score (≤ 0.4 + ≤ 0.3 + ≤ 0.3)</h3>
 * <pre>
 *   non-network %             ≥ 80 → .4  ≥ 60 → .3  ≥ 40 → .2  ≥ 20 → .1
 *   group type Unknown/None/blank and &gt; 5 claims            → .3
 *   group type Independent/Small Chain and non-network &gt; 50% → .2
 *   ≥ 50 claims and non-network &gt; 30% → .3
 *   ≥ 20 claims and non-network &gt; 50% → .2
 *   ≥ 10 claims and non-network &gt; 70% → .1
 * </pre>
 *
 * <h3>Enhancement</h3>
 * {@code score = 0.3 × network + 0.7 × mean(peer scores for the pharmacy)}. Pharmacies
 * without peer findings keep their network score.
 */
@Component
public class NetworkAnomalyAgent implements CombinationDependentAgent {

    public static final String NAME = "network_agent";

    private static final Logger log = LoggerFactory.getLogger(NetworkAnomalyAgent.class);

    static final double NETWORK_SHARE = 0.3;
    static final double PEER_SHARE    = 0.7;

    private static final Set<String> UNKNOWN_TYPES = Set.of("Unknown", "None", "");
    private static final Set<String> SMALL_TYPES   = Set.of("Independent", "Small Chain");

    @Override
    public String agentName() { return NAME; }

    @Override
    public List<Finding> analyze(ClaimDataset dataset, List<Finding> peerFindings) {
        log.info("[{}] Analyzing network patterns for {} claims, peerFindings={}",
            NAME, dataset.size(), peerFindings.size());
        if (dataset.isEmpty()) {
            return List.of();
        }
        requireNetworkAttributes(dataset);

        Map<String, List<Finding>> peersByPharmacy = new HashMap<>();
        for (Finding peer : peerFindings) {
            peersByPharmacy.computeIfAbsent(peer.entityId(), k -> new ArrayList<>()).add(peer);
        }
        boolean enhance = !peerFindings.isEmpty();

        List<Finding> findings = new ArrayList<>();
        dataset.byPharmacy().forEach((pharmacy, claims) -> {
            NetworkProfile profile = NetworkProfile.of(claims);
            double networkScore = networkScore(profile);
            Map<String, Object> detail = profile.toDetail();
            detail.put("network_fraud_score", networkScore);

            if (!enhance) {
                detail.put("analysis_type", "network_anomaly");
                findings.add(Finding.of(pharmacy, networkScore, networkReason(networkScore), NAME, detail));
                return;
            }

            List<Finding> peers = peersByPharmacy.getOrDefault(pharmacy, List.of());
            detail.put("analysis_type", "network_anomaly_enhanced");
            if (peers.isEmpty()) {
                detail.put("agent_fraud_score", 0.0);
                detail.put("agent_count", 0);
                detail.put("high_risk_agents", 0);
                findings.add(Finding.of(pharmacy, networkScore,
                    networkReason(networkScore) + " (No agent findings)", NAME, detail));
                return;
            }

            double peerAverage = peers.stream().mapToDouble(Finding::score).average().orElse(0.0);
            int highRisk = (int) peers.stream().filter(f -> f.score() >= 0.8).count();
            double enhanced = enhancedScore(networkScore, peerAverage);
            detail.put("agent_fraud_score", ClaimIndicators.round3(peerAverage));
            detail.put("agent_count", peers.size());
            detail.put("high_risk_agents", highRisk);
            findings.add(Finding.of(pharmacy, enhanced,
                enhancedReason(enhanced, profile, peers.size(), highRisk), NAME, detail));
        });

        log.info("[{}] Scored {} pharmacies (enhanced={})", NAME, findings.size(), enhance);
        return findings;
    }

    /** Throws when no claim carries a network flag or no claim carries a group type. */
    private void requireNetworkAttributes(ClaimDataset dataset) {
        List<String> missing = new ArrayList<>();
        if (dataset.records().stream().allMatch(c -> ClaimRecord.isBlank(c.isNetworkPharmacy()))) {
            missing.add("is_network_pharmacy");
        }
        if (dataset.records().stream().allMatch(c -> ClaimRecord.isBlank(c.networkPharmacyGroupType()))) {
            missing.add("network_pharmacy_group_type");
        }
        if (!missing.isEmpty()) {
            throw AgentException.missingAttributes(NAME, missing);
        }
    }

    static double networkScore(NetworkProfile p) {
        double nonNetwork = p.nonNetworkPercent();
        double score = 0.0;

        if (nonNetwork >= 80)      score += 0.4;
        else if (nonNetwork >= 60) score += 0.3;
        else if (nonNetwork >= 40) score += 0.2;
        else if (nonNetwork >= 20) score += 0.1;

        if (UNKNOWN_TYPES.contains(p.primaryType()) && p.total() > 5)   score += 0.3;
        else if (SMALL_TYPES.contains(p.primaryType()) && nonNetwork > 50) score += 0.2;

        if (p.total() >= 50 && nonNetwork > 30)      score += 0.3;
        else if (p.total() >= 20 && nonNetwork > 50) score += 0.2;
        else if (p.total() >= 10 && nonNetwork > 70) score += 0.1;

        return ClaimIndicators.round3(ClaimIndicators.clamp01(score));
    }

    static double enhancedScore(double networkScore, double peerAverage) {
        return ClaimIndicators.round3(ClaimIndicators.clamp01(networkScore * NETWORK_SHARE + peerAverage * PEER_SHARE));
    }

    private static String networkReason(double score) {
        String text;
        if (score >= 0.9)      text = "High non-network activity with suspicious patterns";
        else if (score >= 0.8) text = "Elevated non-network claim patterns";
        else if (score >= 0.6) text = "Unusual network/non-network distribution";
        else if (score >= 0.4) text = "Some network anomalies detected";
        else if (score >= 0.2) text = "Minor network pattern variations";
        else                   text = "Normal network patterns";
        return ClaimIndicators.severity(score) + ": " + text;
    }

    private static String enhancedReason(double score, NetworkProfile profile, int agentCount, int highRisk) {
        String text;
        if (score >= 0.9) {
            text = String.format(Locale.ROOT, "Non-network pharmacy (%.1f%% non-network) with %d high-risk agent findings",
                profile.nonNetworkPercent(), highRisk);
        } else if (score >= 0.8) {
            text = "Non-network pharmacy with " + agentCount + " agent findings (" + highRisk + " high-risk)";
        } else if (score >= 0.6) {
            text = "Network anomaly with " + agentCount + " agent findings";
        } else if (score >= 0.4) {
            text = "Some network and agent concerns";
        } else if (score >= 0.2) {
            text = "Minor network and agent issues";
        } else {
            text = "Minimal network and agent concerns";
        }
        return ClaimIndicators.severity(score) + ": " + text;
    }

    /** Network composition of one pharmacy's claims. */
    record NetworkProfile(int total, int networkClaims, int nonNetworkClaims, String primaryType) {

        static NetworkProfile of(List<ClaimRecord> claims) {
            int network = 0;
            int nonNetwork = 0;
            String primaryType = null;
            for (ClaimRecord claim : claims) {
                String flag = claim.isNetworkPharmacy() == null ? "" : claim.isNetworkPharmacy().strip();
                if ("Y".equals(flag)) network++;
                else if ("N".equals(flag)) nonNetwork++;
                // first recorded type wins, an empty one included
                if (primaryType == null && claim.networkPharmacyGroupType() != null) {
                    primaryType = claim.networkPharmacyGroupType().strip();
                }
            }
            return new NetworkProfile(claims.size(), network, nonNetwork,
                primaryType == null ? ClaimRecord.UNKNOWN : primaryType);
        }

        double nonNetworkPercent() {
            return total == 0 ? 0.0 : nonNetworkClaims * 100.0 / total;
        }

        double networkPercent() {
            return total == 0 ? 0.0 : networkClaims * 100.0 / total;
        }

        Map<String, Object> toDetail() {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("total_claims", total);
            detail.put("network_claims", networkClaims);
            detail.put("non_network_claims", nonNetworkClaims);
            detail.put("network_percentage", ClaimIndicators.round2(networkPercent()));
            detail.put("is_primarily_network", networkClaims > nonNetworkClaims);
            detail.put("primary_network_type", primaryType);
            return detail;
        }
    }
}
