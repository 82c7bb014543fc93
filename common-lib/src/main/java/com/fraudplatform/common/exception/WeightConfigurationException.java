package com.fraudplatform.common.exception;

/**
 * Rejected agent weight configuration (negative or non-finite weight).
 * The weight vector is left exactly as it was before the rejected update.
 */
public class WeightConfigurationException extends RuntimeException {
    private final String agentName;

    public WeightConfigurationException(String agentName, String message) {
        super("Invalid weight for agent=" + agentName + ": " + message);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
