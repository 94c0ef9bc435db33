package com.example.renderflow_backend.controller;

import com.example.renderflow_backend.dto.engine.CostEstimateRequest;
import com.example.renderflow_backend.dto.engine.EngineCallbackRequest;
import com.example.renderflow_backend.dto.engine.EngineSelectionRequest;
import com.example.renderflow_backend.dto.engine.EngineView;
import com.example.renderflow_backend.service.BatchOrchestrator;
import com.example.renderflow_backend.service.EngineAdvisor;
import com.example.renderflow_backend.service.decision.CostEstimate;
import com.example.renderflow_backend.service.decision.DecisionResult;
import com.example.renderflow_backend.util.Capability;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/engines")
public class EngineController {
    private final EngineAdvisor advisor;
    private final BatchOrchestrator orchestrator;

    public EngineController(EngineAdvisor advisor, BatchOrchestrator orchestrator) {
        this.advisor = advisor;
        this.orchestrator = orchestrator;
    }

    @GetMapping
    public List<EngineView> list(@RequestParam(required = false) Capability capability) {
        return advisor.list(capability);
    }

    @PostMapping("/select")
    public DecisionResult select(@Valid @RequestBody EngineSelectionRequest request) {
        return advisor.select(request);
    }

    @PostMapping("/estimate")
    public CostEstimate estimate(@Valid @RequestBody CostEstimateRequest request) {
        return advisor.estimate(request);
    }

    @PostMapping("/callback")
    public ResponseEntity<Map<String, Object>> callback(@Valid @RequestBody EngineCallbackRequest request) {
        if (!orchestrator.resolveTask(request)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND");
        }
        return ResponseEntity.ok(Map.of("taskHandle", request.taskHandle(), "accepted", true));
    }
}
