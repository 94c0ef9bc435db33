package com.example.renderflow_backend.service.decision;

import java.time.Instant;
import java.util.List;

/**
 * Last known state of the self-hosted render backend.
 */
public record EnvironmentSnapshot(
        boolean available,
        boolean ffmpegReady,
        int queueDepth,
        long latencyMs,
        Hardware hardware,
        Instant probedAt
) {
    public record Hardware(int cores, long ramMb, List<String> gpuFlags) {
        public Hardware {
            gpuFlags = gpuFlags == null ? List.of() : List.copyOf(gpuFlags);
        }

        public static Hardware none() {
            return new Hardware(0, 0, List.of());
        }
    }

    public EnvironmentSnapshot {
        hardware = hardware == null ? Hardware.none() : hardware;
        queueDepth = Math.max(0, queueDepth);
    }

    /** Snapshot used until the first successful probe. */
    public static EnvironmentSnapshot unavailable() {
        return new EnvironmentSnapshot(false, false, 0, 0, Hardware.none(), null);
    }

    public boolean hasGpu() {
        return !hardware.gpuFlags().isEmpty();
    }

    public boolean canRunLocally() {
        return available && ffmpegReady;
    }
}
