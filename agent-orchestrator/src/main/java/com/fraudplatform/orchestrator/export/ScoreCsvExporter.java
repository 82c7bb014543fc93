package com.fraudplatform.orchestrator.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fraudplatform.common.exception.ScoreExportException;
import com.fraudplatform.common.model.AggregatedScore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flattens ranked scores into CSV, one column per {@link AggregatedScore} field.
 * Multi-valued fields are joined with {@code ;} ({@code agent=value} for maps).
 */
@Component
public class ScoreCsvExporter {

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public ScoreCsvExporter(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
        this.schema = csvMapper.schemaFor(ScoreRow.class).withHeader();
    }

    public String toCsv(List<AggregatedScore> scores) {
        List<ScoreRow> rows = scores.stream().map(ScoreRow::of).toList();
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new ScoreExportException("Failed to export " + scores.size() + " scores as CSV", e);
        }
    }

    @JsonPropertyOrder({"rank", "entity_id", "pharmacy_name", "pharmacy_city", "pharmacy_state",
        "final_score", "risk_level", "weighted_score", "consistency_score", "outlier_score",
        "transaction_count", "contributing_units", "unit_scores", "unit_reasons", "explanation"})
    record ScoreRow(
        @JsonProperty("rank") int rank,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("pharmacy_name") String pharmacyName,
        @JsonProperty("pharmacy_city") String pharmacyCity,
        @JsonProperty("pharmacy_state") String pharmacyState,
        @JsonProperty("final_score") double finalScore,
        @JsonProperty("risk_level") String riskLevel,
        @JsonProperty("weighted_score") double weightedScore,
        @JsonProperty("consistency_score") double consistencyScore,
        @JsonProperty("outlier_score") double outlierScore,
        @JsonProperty("transaction_count") int transactionCount,
        @JsonProperty("contributing_units") String contributingUnits,
        @JsonProperty("unit_scores") String unitScores,
        @JsonProperty("unit_reasons") String unitReasons,
        @JsonProperty("explanation") String explanation
    ) {
        static ScoreRow of(AggregatedScore s) {
            return new ScoreRow(s.rank(), s.entityId(), s.pharmacyName(), s.pharmacyCity(), s.pharmacyState(),
                s.finalScore(), s.riskLevel().label(), s.weightedScore(), s.consistencyScore(), s.outlierScore(),
                s.transactionCount(), String.join(";", s.contributingUnits()),
                join(s.unitScores()), join(s.unitReasons()), s.explanation());
        }

        private static String join(Map<String, ?> values) {
            return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(";"));
        }
    }
}
