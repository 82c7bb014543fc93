package com.fraudplatform.common.model;

/**
 * Risk band derived from a pharmacy's final score. Each band includes its lower bound.
 */
public enum RiskLevel {
    HIGH("HIGH RISK"),
    MEDIUM("MEDIUM RISK"),
    LOW("LOW RISK"),
    VERY_LOW("VERY LOW RISK");

    public static final double HIGH_THRESHOLD   = 0.8;
    public static final double MEDIUM_THRESHOLD = 0.6;
    public static final double LOW_THRESHOLD    = 0.4;

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static RiskLevel fromScore(double finalScore) {
        if (finalScore >= HIGH_THRESHOLD)   return HIGH;
        if (finalScore >= MEDIUM_THRESHOLD) return MEDIUM;
        if (finalScore >= LOW_THRESHOLD)    return LOW;
        return VERY_LOW;
    }
}
