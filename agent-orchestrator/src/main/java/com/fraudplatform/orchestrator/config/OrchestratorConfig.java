package com.fraudplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fraudplatform.common.insight.SupervisorInsightsGenerator;
import com.fraudplatform.common.scoring.AggregationEngine;
import com.fraudplatform.common.scoring.WeightVector;
import com.fraudplatform.common.scoring.WeightedAggregationEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(FraudScoringProperties.class)
public class OrchestratorConfig {

    @Bean
    public AggregationEngine aggregationEngine() {
        return new WeightedAggregationEngine();
    }

    @Bean
    public WeightVector weightVector(FraudScoringProperties properties) {
        Map<String, Double> weights = new LinkedHashMap<>(WeightVector.DEFAULT_WEIGHTS);
        weights.putAll(properties.getWeights());
        return new WeightVector(weights);
    }

    @Bean
    public SupervisorInsightsGenerator supervisorInsightsGenerator(FraudScoringProperties properties) {
        return new SupervisorInsightsGenerator(
            properties.getDoubleFlag().getFirst(), properties.getDoubleFlag().getSecond());
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /** Claim import and score export. Blank cells bind as {@code null}. */
    @Bean
    public CsvMapper csvMapper() {
        CsvMapper mapper = new CsvMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(CsvParser.Feature.EMPTY_STRING_AS_NULL);
        return mapper;
    }
}
