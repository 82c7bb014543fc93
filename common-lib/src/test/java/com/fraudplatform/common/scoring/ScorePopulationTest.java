package com.fraudplatform.common.scoring;

import com.fraudplatform.common.model.AggregatedScore;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.Finding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScorePopulationTest {

    private static Finding finding(String entity, double score, String agent) {
        return Finding.of(entity, score, "r", agent, Map.of());
    }

    @Test
    @DisplayName("mean and population std are pooled across agents")
    void pooledStatistics() {
        ScorePopulation population = ScorePopulation.of(Map.of(
            "a", List.of(finding("P1", 0.2, "a"), finding("P2", 0.4, "a")),
            "b", List.of(finding("P1", 0.6, "b"), finding("P3", 0.8, "b"))));

        assertEquals(4, population.count());
        assertEquals(0.5, population.mean(), 1e-12);
        // deviations ±0.3, ±0.1 → variance (0.09+0.01+0.01+0.09)/4 = 0.05
        assertEquals(Math.sqrt(0.05), population.standardDeviation(), 1e-12);
    }

    @Test
    @DisplayName("identical scores everywhere → outlier exactly 0.5")
    void zeroSpread() {
        ScorePopulation population = ScorePopulation.of(Map.of(
            "a", List.of(finding("P1", 0.1, "a"), finding("P2", 0.1, "a"), finding("P3", 0.1, "a")),
            "b", List.of(finding("P1", 0.1, "b"))));

        assertEquals(0.5, population.outlierScore(0.1));
    }

    @Test
    @DisplayName("empty population → 0.5")
    void emptyPopulation() {
        assertEquals(0.5, ScorePopulation.of(Map.of()).outlierScore(0.9));
        assertEquals(0.5, ScorePopulation.EMPTY.outlierScore(0.0));
    }

    @Test
    @DisplayName("outlier is a sigmoid of the z-score and stays in (0, 1)")
    void sigmoidOfZ() {
        ScorePopulation population = new ScorePopulation(10, 0.5, 0.2);
        assertEquals(0.5, population.outlierScore(0.5), 1e-12);
        assertEquals(1.0 / (1.0 + Math.exp(-1.0)), population.outlierScore(0.7), 1e-12);
        assertTrue(population.outlierScore(1.0) < 1.0);
        assertTrue(population.outlierScore(0.0) > 0.0);
        assertTrue(population.outlierScore(0.9) > population.outlierScore(0.6));
    }

    @Test
    @DisplayName("one hot pharmacy among thousands of zeros stays strictly below 1")
    void extremeZStaysOpen() {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            findings.add(finding("P" + i, 0.0, "coverage_agent"));
        }
        findings.add(finding("HOT", 1.0, "coverage_agent"));
        ScorePopulation population = ScorePopulation.of(Map.of("coverage_agent", findings));

        double hot = population.outlierScore(1.0);
        assertTrue(hot < 1.0, "outlier was " + hot);
        assertTrue(hot > 0.99);
        double cold = population.outlierScore(0.0);
        assertTrue(cold > 0.0 && cold < 0.5, "outlier was " + cold);
    }

    @Test
    @DisplayName("z far below -745 still yields a positive outlier score")
    void extremeNegativeZ() {
        ScorePopulation population = new ScorePopulation(10, 1.0, 1e-3);
        double score = population.outlierScore(0.0);
        assertTrue(score > 0.0, "outlier was " + score);
        assertTrue(population.outlierScore(2.0) < 1.0);
    }

    @Test
    @DisplayName("aggregated outlier for a lone high scorer is inside (0, 1)")
    void aggregatedOutlierStaysOpen() {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            findings.add(finding("P" + i, 0.0, "coverage_agent"));
        }
        findings.add(finding("HOT", 1.0, "coverage_agent"));

        AggregatedScore hot = new WeightedAggregationEngine()
            .aggregate(Map.of("coverage_agent", findings), ClaimDataset.empty(), WeightVector.defaults().snapshot())
            .stream().filter(s -> s.entityId().equals("HOT")).findFirst().orElseThrow();

        assertTrue(hot.outlierScore() > 0.0 && hot.outlierScore() < 1.0, "outlier was " + hot.outlierScore());
    }
}
