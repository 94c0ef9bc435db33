package com.example.renderflow_backend.engine.registry;

import com.example.renderflow_backend.util.Capability;
import com.example.renderflow_backend.util.OperationType;
import com.example.renderflow_backend.util.QualityTier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityRegistryTest {

    private final CapabilityRegistry registry = CapabilityRegistry.withDefaults();

    @Test
    void defaultsExposeLocalEdgeAndProviderEngines() {
        assertThat(registry.getById(EngineCatalog.FFMPEG_NATIVE)).get().isInstanceOf(LocalEngine.class);
        assertThat(registry.getById(EngineCatalog.EDGE_FFMPEG)).get().isInstanceOf(RemoteEngine.class);
        assertThat(registry.getById("sora")).get()
                .satisfies(e -> assertThat(e.requiredCredential()).contains("OPENAI_API_KEY"));
        assertThat(registry.getById("missing")).isEmpty();
        assertThat(registry.getById(null)).isEmpty();
    }

    @Test
    void capabilityFilterOnlyReturnsSupportingEngines() {
        List<EngineDefinition> avatars = registry.getByCapability(Capability.AVATAR);

        assertThat(avatars).extracting(EngineDefinition::id).containsExactlyInAnyOrder("heygen", "omnihuman");
    }

    @Test
    void localVariantPrefersGpuOnlyWhenAsked() {
        assertThat(registry.localVariant(true)).get().extracting(LocalEngine::id).isEqualTo(EngineCatalog.FFMPEG_GPU);
        assertThat(registry.localVariant(false)).get().extracting(LocalEngine::id).isEqualTo(EngineCatalog.FFMPEG_NATIVE);
    }

    @Test
    void unavailableEnginesAreHidden() {
        LocalEngine off = new LocalEngine("off", "Off", OperationType.VIDEO_RENDER, QualityTier.FAST,
                Set.of(Capability.VIDEO_EDIT), 60, 10, 100, false, false);
        CapabilityRegistry custom = new CapabilityRegistry(List.of(off));

        assertThat(custom.getAll()).isEmpty();
        assertThat(custom.localVariant(false)).isEmpty();
    }

    @Test
    void duplicateIdsAreRejected() {
        LocalEngine a = new LocalEngine("dup", "A", OperationType.VIDEO_RENDER, QualityTier.FAST,
                Set.of(Capability.VIDEO_EDIT), 60, 10, 100, false, true);

        assertThatThrownBy(() -> new CapabilityRegistry(List.of(a, a)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
