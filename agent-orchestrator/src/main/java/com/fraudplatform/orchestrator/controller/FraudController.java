package com.fraudplatform.orchestrator.controller;

import com.fraudplatform.common.scoring.WeightVector;
import com.fraudplatform.orchestrator.export.ScoreCsvExporter;
import com.fraudplatform.orchestrator.service.FraudDetectionService;
import com.fraudplatform.orchestrator.service.FraudRunResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/fraud")
public class FraudController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final FraudDetectionService detectionService;
    private final WeightVector weightVector;
    private final ScoreCsvExporter csvExporter;

    public FraudController(FraudDetectionService detectionService,
                           WeightVector weightVector,
                           ScoreCsvExporter csvExporter) {
        this.detectionService = detectionService;
        this.weightVector = weightVector;
        this.csvExporter = csvExporter;
    }

    @PostMapping("/runs")
    public Mono<ResponseEntity<FraudRunResult>> run() {
        return detectionService.runDetection().map(ResponseEntity::ok);
    }

    @GetMapping("/runs/latest")
    public Mono<ResponseEntity<FraudRunResult>> latest() {
        return Mono.justOrEmpty(detectionService.latestRun())
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/runs/latest/export")
    public Mono<ResponseEntity<String>> exportLatest() {
        return Mono.justOrEmpty(detectionService.latestRun())
            .map(result -> ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                    "attachment; filename=\"fraud-scores-" + result.runId() + ".csv\"")
                .body(csvExporter.toCsv(result.rankedScores())))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/weights")
    public ResponseEntity<Map<String, Double>> weights() {
        return ResponseEntity.ok(weightVector.snapshot());
    }

    @PutMapping("/weights")
    public ResponseEntity<Map<String, Double>> updateWeights(@RequestBody Map<String, Double> overrides) {
        return ResponseEntity.ok(weightVector.update(overrides));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
