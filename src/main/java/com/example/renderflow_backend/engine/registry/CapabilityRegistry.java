package com.example.renderflow_backend.engine.registry;

import com.example.renderflow_backend.util.Capability;

import java.util.*;

/**
 * Read-only lookup over the engine catalog. Catalog order is preserved.
 */
public class CapabilityRegistry {
    private final List<EngineDefinition> engines;
    private final Map<String, EngineDefinition> byId;

    public CapabilityRegistry(List<? extends EngineDefinition> engines) {
        this.engines = List.copyOf(engines);
        Map<String, EngineDefinition> index = new LinkedHashMap<>();
        for (EngineDefinition engine : this.engines) {
            if (index.putIfAbsent(engine.id(), engine) != null) {
                throw new IllegalArgumentException("Duplicate engine id: " + engine.id());
            }
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    public static CapabilityRegistry withDefaults() {
        return new CapabilityRegistry(EngineCatalog.defaults());
    }

    /** Engines flagged available, in catalog order. */
    public List<EngineDefinition> getAll() {
        return engines.stream().filter(EngineDefinition::available).toList();
    }

    public Optional<EngineDefinition> getById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    public List<EngineDefinition> getByCapability(Capability capability) {
        return getAll().stream().filter(e -> e.supports(capability)).toList();
    }

    /**
     * Local ffmpeg editing variant: the hardware-accelerated one when {@code gpu} is set and one exists,
     * otherwise the CPU one.
     */
    public Optional<LocalEngine> localVariant(boolean gpu) {
        List<LocalEngine> editors = getAll().stream()
                .filter(e -> e instanceof LocalEngine && e.supports(Capability.VIDEO_EDIT))
                .map(LocalEngine.class::cast)
                .toList();
        if (gpu) {
            Optional<LocalEngine> accelerated = editors.stream().filter(LocalEngine::hardwareAccelerated).findFirst();
            if (accelerated.isPresent()) {
                return accelerated;
            }
        }
        return editors.stream().filter(e -> !e.hardwareAccelerated()).findFirst();
    }

    public List<EngineDefinition> freeTier() {
        return getAll().stream().filter(EngineDefinition::isFree).toList();
    }
}
