package com.example.renderflow_backend.controller;

import com.example.renderflow_backend.service.EngineAdvisor;
import com.example.renderflow_backend.service.decision.EnvironmentSnapshot;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/environment")
public class EnvironmentController {
    private final EngineAdvisor advisor;

    public EnvironmentController(EngineAdvisor advisor) { this.advisor = advisor; }

    @GetMapping
    public EnvironmentSnapshot current() {
        return advisor.environment();
    }
}
