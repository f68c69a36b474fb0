package com.colorcorrection.controller;

import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.pipeline.GpuProbe;
import com.colorcorrection.service.batch.BatchState;
import com.colorcorrection.service.lifecycle.ShutdownCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class LifecycleController {

    private final CorrectionPipelineFactory pipelineFactory;
    private final GpuProbe gpuProbe;
    private final BatchState batchState;
    private final ShutdownCoordinator shutdownCoordinator;
    private final String version;

    public LifecycleController(
            CorrectionPipelineFactory pipelineFactory,
            GpuProbe gpuProbe,
            BatchState batchState,
            ShutdownCoordinator shutdownCoordinator,
            @Value("${app.version:2.0.0}") String version) {
        this.pipelineFactory = pipelineFactory;
        this.gpuProbe = gpuProbe;
        this.batchState = batchState;
        this.shutdownCoordinator = shutdownCoordinator;
        this.version = version;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("parallel_processing", true);
        features.put("gpu_support", gpuProbe.isGpuAvailable());
        features.put("thread_safe", true);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("message", "Backend is running");
        body.put("cc_available", pipelineFactory.isAvailable());
        body.put("version", version);
        body.put("batch_active", batchState.isActive());
        body.put("features", features);
        return ResponseEntity.ok(body);
    }

    /**
     * Returns immediately; the drain, cleanup and exit happen in the background.
     */
    @PostMapping("/shutdown")
    public ResponseEntity<Map<String, Object>> shutdown() {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("SHUTDOWN INITIATED VIA API");
        log.info("═══════════════════════════════════════════════════════════════");
        boolean started = shutdownCoordinator.requestShutdown();
        Map<String, Object> body = ApiResponses.success();
        body.put("message", started ? "Backend shutdown initiated" : "Shutdown already in progress");
        return ResponseEntity.ok(body);
    }
}
