package com.colorcorrection.pipeline;

import com.colorcorrection.service.lifecycle.ReleasableResource;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * GPU detection with the result cached, since probing touches the driver.
 *
 * Mode {@code auto} looks for an NVIDIA driver and a non-empty
 * {@code CUDA_VISIBLE_DEVICES}; {@code on}/{@code off} force the answer.
 */
@Component
@Slf4j
public class CachedGpuProbe implements GpuProbe, ReleasableResource {

    private static final String CACHE_KEY = "gpu";
    private static final Path NVIDIA_DRIVER = Path.of("/proc/driver/nvidia/version");

    private final Cache<String, Boolean> gpuProbeCache;
    private final String mode;

    public CachedGpuProbe(
            @Qualifier("gpuProbeCache") Cache<String, Boolean> gpuProbeCache,
            @Value("${app.gpu.mode:auto}") String mode) {
        this.gpuProbeCache = gpuProbeCache;
        this.mode = mode == null ? "auto" : mode.trim().toLowerCase();
    }

    @Override
    public boolean isGpuAvailable() {
        return gpuProbeCache.get(CACHE_KEY, key -> probe());
    }

    private boolean probe() {
        boolean available = switch (mode) {
            case "on", "true" -> true;
            case "off", "false" -> false;
            default -> detect();
        };
        log.info("GPU probe (mode={}): {}", mode, available ? "available" : "not available");
        return available;
    }

    private boolean detect() {
        String visible = System.getenv("CUDA_VISIBLE_DEVICES");
        if (visible != null && (visible.isBlank() || visible.trim().equals("-1"))) {
            return false;
        }
        return Files.exists(NVIDIA_DRIVER);
    }

    @Override
    public String resourceName() {
        return "gpu-probe-cache";
    }

    @Override
    public void release() {
        gpuProbeCache.invalidateAll();
    }
}
