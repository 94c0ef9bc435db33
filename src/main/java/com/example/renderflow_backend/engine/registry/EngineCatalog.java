package com.example.renderflow_backend.engine.registry;

import com.example.renderflow_backend.util.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static com.example.renderflow_backend.util.Capability.*;

/**
 * Built-in engine catalog.
 */
public final class EngineCatalog {
    public static final String FFMPEG_NATIVE = "ffmpeg-native";
    public static final String FFMPEG_GPU = "ffmpeg-gpu";
    public static final String EDGE_FFMPEG = "edge-ffmpeg";

    private static final Set<Capability> EDIT = Set.of(VIDEO_EDIT, AUDIO_MIX, SUBTITLES, VIDEO_TO_VIDEO);
    private static final Set<Capability> GENERATE = Set.of(TEXT_TO_VIDEO, IMAGE_TO_VIDEO);
    private static final Set<Capability> TALKING_HEAD = Set.of(AVATAR, LIP_SYNC);
    private static final Set<ExecutionMode> AGENT = Set.of(ExecutionMode.AGENT);

    private EngineCatalog() {
    }

    public static List<EngineDefinition> defaults() {
        return List.of(
                // self-hosted ffmpeg
                new LocalEngine(FFMPEG_NATIVE, "FFmpeg (CPU)", OperationType.VIDEO_RENDER, QualityTier.BALANCED,
                        EDIT, 3600, 50, 2_000, false, true),
                new LocalEngine(FFMPEG_GPU, "FFmpeg (GPU)", OperationType.VIDEO_RENDER, QualityTier.BALANCED,
                        EDIT, 3600, 55, 800, true, true),
                new LocalEngine("ffmpeg_creative", "FFmpeg Creative Templates", OperationType.VIDEO_GENERATION,
                        QualityTier.FAST, Set.of(IMAGE_TO_VIDEO, VIDEO_TO_VIDEO), 60, 90, 5_000, false, true),
                new RemoteEngine(EDGE_FFMPEG, "Edge FFmpeg", OperationType.VIDEO_RENDER, new BigDecimal("0.01"),
                        QualityTier.FAST, CostTier.BUDGET, EDIT, Set.of(ExecutionMode.EDGE), 60, 40, 3_000,
                        Provider.EDGE, null, true),
                new RemoteEngine("nanobanana", "Nano Banana", OperationType.VIDEO_GENERATION, BigDecimal.ZERO,
                        QualityTier.FAST, CostTier.FREE, GENERATE, Set.of(ExecutionMode.EDGE, ExecutionMode.AGENT),
                        10, 80, 15_000, Provider.EDGE, null, true),

                // budget providers
                remote("kling_standard", "Kling 2.1 Standard", "0.05", QualityTier.BALANCED, CostTier.BUDGET, 10, 70,
                        60_000, Provider.KLING, "KLING_ACCESS_KEY"),
                remote("minimax", "MiniMax Video-01", "0.04", QualityTier.BALANCED, CostTier.BUDGET, 6, 65,
                        45_000, Provider.MINIMAX, "MINIMAX_API_KEY"),
                remote("wan_2_5", "Wan 2.5", "0.03", QualityTier.FAST, CostTier.BUDGET, 8, 60,
                        40_000, Provider.FAL, "FAL_API_KEY"),
                remote("hailuo", "Hailuo 02", "0.06", QualityTier.BALANCED, CostTier.BUDGET, 6, 55,
                        50_000, Provider.MINIMAX, "MINIMAX_API_KEY"),

                // premium providers
                remote("veo_3", "Veo 3", "0.15", QualityTier.CINEMATIC, CostTier.PREMIUM, 8, 95,
                        90_000, Provider.GOOGLE, "GOOGLE_API_KEY"),
                new RemoteEngine("runway_gen3", "Runway Gen-3 Alpha", OperationType.VIDEO_GENERATION,
                        new BigDecimal("0.12"), QualityTier.CINEMATIC, CostTier.PREMIUM,
                        Set.of(TEXT_TO_VIDEO, IMAGE_TO_VIDEO, VIDEO_TO_VIDEO), AGENT, 10, 90, 75_000,
                        Provider.RUNWAY, "RUNWAY_API_KEY", true),
                remote("sora", "Sora", "0.20", QualityTier.CINEMATIC, CostTier.PREMIUM, 20, 98,
                        120_000, Provider.OPENAI, "OPENAI_API_KEY"),
                remote("pika", "Pika 2.0", "0.10", QualityTier.BALANCED, CostTier.PREMIUM, 4, 75,
                        40_000, Provider.PIKA, "PIKA_API_KEY"),
                remote("luma", "Luma Dream Machine", "0.08", QualityTier.BALANCED, CostTier.PREMIUM, 5, 72,
                        45_000, Provider.LUMA, "LUMA_API_KEY"),
                remote("kling_pro", "Kling 2.1 Pro", "0.10", QualityTier.CINEMATIC, CostTier.PREMIUM, 10, 85,
                        80_000, Provider.KLING, "KLING_ACCESS_KEY"),

                // avatars
                new RemoteEngine("heygen", "HeyGen Avatar", OperationType.AVATAR_GENERATION, new BigDecimal("0.25"),
                        QualityTier.BALANCED, CostTier.PREMIUM, TALKING_HEAD, AGENT, 120, 88, 120_000,
                        Provider.HEYGEN, "HEYGEN_API_KEY", true),
                new RemoteEngine("omnihuman", "OmniHuman", OperationType.AVATAR_GENERATION, new BigDecimal("0.18"),
                        QualityTier.CINEMATIC, CostTier.PREMIUM, TALKING_HEAD, AGENT, 60, 82, 100_000,
                        Provider.FAL, "FAL_API_KEY", true)
        );
    }

    private static RemoteEngine remote(String id, String name, String cost, QualityTier quality, CostTier tier,
                                       int maxDurationSec, int priority, long latencyMs, Provider provider,
                                       String credential) {
        return new RemoteEngine(id, name, OperationType.VIDEO_GENERATION, new BigDecimal(cost), quality, tier,
                GENERATE, AGENT, maxDurationSec, priority, latencyMs, provider, credential, true);
    }
}
