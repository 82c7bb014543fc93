package com.fraudplatform.analysis.controller;

import com.fraudplatform.analysis.service.AgentDispatchResult;
import com.fraudplatform.analysis.service.AgentDispatchService;
import com.fraudplatform.common.model.ClaimDataset;
import com.fraudplatform.common.model.ClaimRecord;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analyze")
public class AnalysisController {

    private final AgentDispatchService dispatchService;

    public AnalysisController(AgentDispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    @PostMapping
    public Mono<ResponseEntity<AgentDispatchResult>> analyze(@RequestBody List<ClaimRecord> claims) {
        return dispatchService.dispatchAll(ClaimDataset.of(claims))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
