package com.fraudplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One agent's scored opinion about one pharmacy.
 *
 * <p>Immutable once built. The compact constructor rejects a blank entity id and any
 * score outside [0.0, 1.0], so an agent emitting malformed output fails inside its own
 * execution boundary instead of reaching aggregation.
 */
public record Finding(
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("score") double score,
    @JsonProperty("reason") String reason,
    @JsonProperty("source_unit") String sourceUnit,
    @JsonProperty("detail") Map<String, Object> detail
) {
    public Finding {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Finding requires an entity id (sourceUnit=" + sourceUnit + ")");
        }
        if (!Double.isFinite(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException(
                "Finding score must be within [0,1]: entity=" + entityId + " score=" + score);
        }
        reason = reason == null ? "" : reason;
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public static Finding of(String entityId, double score, String reason,
                             String sourceUnit, Map<String, Object> detail) {
        return new Finding(entityId, score, reason, sourceUnit, detail);
    }
}
