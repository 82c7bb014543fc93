package com.fraudplatform.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scoring configuration bound from {@code fraud.scoring.*}.
 */
@ConfigurationProperties(prefix = "fraud.scoring")
public class FraudScoringProperties {

    /**
     * Per-agent weight overrides, merged over the built-in defaults and normalised.
     * Config key: {@code fraud.scoring.weights.<agent_name>}
     */
    private Map<String, Double> weights = new LinkedHashMap<>();

    /** Agent pair whose joint high score is counted as a double flag in run insights. */
    private DoubleFlag doubleFlag = new DoubleFlag();

    public Map<String, Double> getWeights() { return weights; }
    public void setWeights(Map<String, Double> weights) { this.weights = weights; }

    public DoubleFlag getDoubleFlag() { return doubleFlag; }
    public void setDoubleFlag(DoubleFlag doubleFlag) { this.doubleFlag = doubleFlag; }

    public static class DoubleFlag {
        private String first = "coverage_agent";
        private String second = "patient_flip_agent";

        public String getFirst() { return first; }
        public void setFirst(String first) { this.first = first; }

        public String getSecond() { return second; }
        public void setSecond(String second) { this.second = second; }
    }
}
