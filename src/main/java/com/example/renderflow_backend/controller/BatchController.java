package com.example.renderflow_backend.controller;

import com.example.renderflow_backend.dto.batch.BatchSpecRequest;
import com.example.renderflow_backend.dto.batch.BatchStatusResponse;
import com.example.renderflow_backend.dto.batch.BatchSubmitResponse;
import com.example.renderflow_backend.service.BatchOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/v1/batches")
public class BatchController {
    private final BatchOrchestrator orchestrator;

    public BatchController(BatchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    @Operation(summary = "Queue a batch of video variations")
    @ApiResponse(responseCode = "202", description = "Batch persisted and queued for the worker")
    @ApiResponse(responseCode = "400", description = "Invalid batch spec")
    @ApiResponse(responseCode = "422", description = "No engine can serve the batch")
    public BatchSubmitResponse submit(@Valid @RequestBody BatchSpecRequest request) {
        return orchestrator.submit(request);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Batch status with per-item states, errors and validated artifact urls")
    @ApiResponse(responseCode = "200", description = "Current batch status")
    @ApiResponse(responseCode = "404", description = "Unknown batch id")
    public BatchStatusResponse get(@PathVariable UUID id) {
        return orchestrator.getStatus(id);
    }
}
