package com.example.renderflow_backend.service.Interfaces;

import com.example.renderflow_backend.service.decision.EnvironmentSnapshot;

public interface EnvironmentProbe {
    /** Last cached snapshot; never blocks. */
    EnvironmentSnapshot current();
}
