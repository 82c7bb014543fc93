package com.fraudplatform.common.exception;

import java.util.Collection;

/**
 * Raised by a scoring agent that cannot produce findings for the current dataset.
 * The dispatch service isolates it to the failing agent; it never aborts a run.
 */
public class AgentException extends RuntimeException {
    private final String agentName;

    public AgentException(String agentName, String message) {
        this(agentName, message, null);
    }

    public AgentException(String agentName, String message, Throwable cause) {
        super("[" + agentName + "] " + message, cause);
        this.agentName = agentName;
    }

    /** The dataset carries none of the claim attributes the agent scores on. */
    public static AgentException missingAttributes(String agentName, Collection<String> columns) {
        return new AgentException(agentName, "Claim data lacks required attributes " + columns);
    }

    public String getAgentName() {
        return agentName;
    }
}
