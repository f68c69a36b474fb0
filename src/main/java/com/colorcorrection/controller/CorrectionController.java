package com.colorcorrection.controller;

import com.colorcorrection.model.BatchRequest;
import com.colorcorrection.model.BatchStatus;
import com.colorcorrection.model.BatchSubmission;
import com.colorcorrection.model.InferenceRequest;
import com.colorcorrection.model.InferenceSummary;
import com.colorcorrection.model.ModelExportRequest;
import com.colorcorrection.model.ModelExportResult;
import com.colorcorrection.model.SingleRunRequest;
import com.colorcorrection.model.SingleRunResult;
import com.colorcorrection.service.BatchOrchestrator;
import com.colorcorrection.service.export.ModelExportService;
import com.colorcorrection.service.processing.ModelInferenceService;
import com.colorcorrection.service.processing.SingleImageCorrectionService;
import com.colorcorrection.session.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Correction runs:
 * - POST /api/run-cc-parallel → start a batch (202), poll with GET /api/batch-progress
 * - POST /api/run-cc          → one image, trains the model
 * - POST /api/apply-cc        → apply the trained model to other images
 * - GET  /api/check-model     → whether a trained model is stored
 * - POST /api/save-model      → write the stored model to disk
 */
@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class CorrectionController {

    private final BatchOrchestrator batchOrchestrator;
    private final SingleImageCorrectionService singleImageService;
    private final ModelInferenceService inferenceService;
    private final ModelExportService modelExportService;
    private final SessionRegistry registry;

    @PostMapping("/run-cc-parallel")
    public ResponseEntity<Map<String, Object>> runParallel(@RequestBody BatchRequest request) {
        try {
            BatchSubmission submission = batchOrchestrator.submit(request);
            Map<String, Object> body = ApiResponses.success();
            body.put("message", "Batch processing started");
            body.put("batch_id", submission.batchId());
            body.put("total_images", submission.totalItems());
            body.put("max_workers", submission.workerCount());
            body.put("has_gpu", submission.hasGpu());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        } catch (Exception e) {
            return ApiResponses.fromException("Batch submission", e);
        }
    }

    @GetMapping("/batch-progress")
    public ResponseEntity<Map<String, Object>> batchProgress() {
        BatchStatus status = batchOrchestrator.getProgress();
        Map<String, Object> body = ApiResponses.success();
        body.put("batch_id", status.batchId());
        body.put("active", status.active());
        body.put("total", status.total());
        body.put("completed", status.completed());
        body.put("failed", status.failed());
        body.put("progress", status.progress());
        body.put("has_results", status.hasResults());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/run-cc")
    public ResponseEntity<Map<String, Object>> runSingle(@RequestBody SingleRunRequest request) {
        try {
            SingleRunResult result = singleImageService.run(request);
            Map<String, Object> body = ApiResponses.success();
            body.put("filename", result.filename());
            body.put("corrected_images", result.correctedImages());
            body.put("final_step", result.finalStage());
            body.put("metrics", result.metrics());
            body.put("model_stored", result.modelStored());
            if (result.savedModelPath() != null) {
                body.put("model_path", result.savedModelPath().toString());
            }
            if (result.warning() != null) {
                body.put("warning", result.warning());
            }
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return ApiResponses.fromException("Single image run", e);
        }
    }

    @PostMapping("/apply-cc")
    public ResponseEntity<Map<String, Object>> applyModel(@RequestBody InferenceRequest request) {
        try {
            InferenceSummary summary = inferenceService.apply(request);
            Map<String, Object> body = ApiResponses.success();
            body.put("message", "Applied model to " + summary.processed() + " image(s)");
            body.put("processed_count", summary.processed());
            body.put("failed_count", summary.failed());
            body.put("total", summary.total());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return ApiResponses.fromException("Apply CC", e);
        }
    }

    @GetMapping("/check-model")
    public ResponseEntity<Map<String, Object>> checkModel() {
        Map<String, Object> body = ApiResponses.success();
        body.put("model_available", registry.modelHandle().isPresent());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/save-model")
    public ResponseEntity<Map<String, Object>> saveModel(@RequestBody(required = false) ModelExportRequest request) {
        try {
            ModelExportResult result = modelExportService.saveModel(
                    request != null ? request : new ModelExportRequest(null, null));
            Map<String, Object> body = ApiResponses.success();
            body.put("message", "Model \"" + result.name() + "\" saved successfully");
            body.put("path", result.path().toString());
            body.put("name", result.name());
            body.put("directory", result.directory().toString());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return ApiResponses.fromException("Save model", e);
        }
    }
}
