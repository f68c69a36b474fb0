package com.colorcorrection.controller;

import com.colorcorrection.model.CorrectedImage;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.ExportRequest;
import com.colorcorrection.model.ExportResult;
import com.colorcorrection.model.ImageDescriptor;
import com.colorcorrection.model.ItemResult;
import com.colorcorrection.model.settings.StageSettings;
import com.colorcorrection.service.export.ResultExportService;
import com.colorcorrection.session.ImageRegistrationService;
import com.colorcorrection.session.SessionRegistry;
import com.colorcorrection.session.SettingsMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session data: uploads, stage settings, results and export.
 */
@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class SessionController {

    private final SessionRegistry registry;
    private final SettingsMapper settingsMapper;
    private final ImageRegistrationService imageRegistration;
    private final ResultExportService exportService;

    // ═══════════════════════════════════════════════════════════════
    // Images
    // ═══════════════════════════════════════════════════════════════

    @PostMapping(value = "/images", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> uploadImages(
            @RequestParam(value = "images", required = false) List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, "No images provided");
        }
        List<ImageDescriptor> uploaded = new ArrayList<>();
        for (MultipartFile file : files) {
            try (InputStream content = file.getInputStream()) {
                uploaded.add(imageRegistration.registerImage(file.getOriginalFilename(), content));
            } catch (IOException e) {
                log.error("Failed to register {}: {}", file.getOriginalFilename(), e.getMessage());
            }
        }
        Map<String, Object> body = ApiResponses.success();
        body.put("message", "Uploaded " + uploaded.size() + " image(s)");
        body.put("images", uploaded.stream().map(SessionController::describe).toList());
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/white-image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> uploadWhiteImage(
            @RequestParam(value = "white_image", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, "No white image provided");
        }
        try (InputStream content = file.getInputStream()) {
            ImageDescriptor image = imageRegistration.registerWhiteImage(file.getOriginalFilename(), content);
            Map<String, Object> body = ApiResponses.success();
            body.put("message", "White image uploaded: " + image.filename());
            body.put("white_image", describe(image));
            return ResponseEntity.ok(body);
        } catch (IOException e) {
            log.error("White image upload error: {}", e.getMessage());
            return ApiResponses.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to process image: " + e.getMessage());
        }
    }

    @GetMapping("/images")
    public ResponseEntity<Map<String, Object>> listImages() {
        Map<String, Object> body = ApiResponses.success();
        body.put("images", registry.images().stream().map(SessionController::describe).toList());
        body.put("white_image", registry.whiteImage().map(SessionController::describe).orElse(null));
        return ResponseEntity.ok(body);
    }

    // ═══════════════════════════════════════════════════════════════
    // Settings
    // ═══════════════════════════════════════════════════════════════

    @GetMapping("/settings/{step}")
    public ResponseEntity<Map<String, Object>> getSettings(@PathVariable String step) {
        Optional<CorrectionStage> stage = CorrectionStage.fromKey(step);
        if (stage.isEmpty()) {
            return invalidStep(step);
        }
        Map<String, Object> body = ApiResponses.success();
        body.put("settings", settingsMapper.toMap(registry.settings(stage.get())));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/settings/{step}")
    public ResponseEntity<Map<String, Object>> updateSettings(
            @PathVariable String step,
            @RequestBody(required = false) Map<String, Object> request) {
        Optional<CorrectionStage> stage = CorrectionStage.fromKey(step);
        if (stage.isEmpty()) {
            return invalidStep(step);
        }
        if (request == null || !(request.get("settings") instanceof Map<?, ?> raw)) {
            return ApiResponses.error(HttpStatus.BAD_REQUEST, "Missing settings in request body");
        }
        try {
            Map<String, Object> updates = new LinkedHashMap<>();
            raw.forEach((key, value) -> updates.put(String.valueOf(key), value));
            StageSettings merged = registry.updateSettings(stage.get(), updates);
            Map<String, Object> body = ApiResponses.success();
            body.put("message", stage.get().label() + " settings updated");
            body.put("settings", settingsMapper.toMap(merged));
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return ApiResponses.fromException("Settings update", e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Results
    // ═══════════════════════════════════════════════════════════════

    @GetMapping("/available-images")
    public ResponseEntity<Map<String, Object>> availableImages() {
        List<Map<String, Object>> available = new ArrayList<>();
        for (CorrectedImage image : registry.correctedImages()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", image.name());
            entry.put("preview", image.data().substring(0, Math.min(100, image.data().length())) + "...");
            available.add(entry);
        }
        Map<String, Object> body = ApiResponses.success();
        body.put("images", available);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/batch-images-list")
    public ResponseEntity<Map<String, Object>> batchImagesList() {
        List<Map<String, Object>> images = new ArrayList<>();
        for (ItemResult result : registry.processedImages()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("image_index", result.index());
            entry.put("filename", result.filename());
            entry.put("available_steps", result.correctedImages().stream()
                    .map(CorrectedImage::name)
                    .map(name -> name.substring(name.lastIndexOf('_') + 1))
                    .toList());
            images.add(entry);
        }
        Map<String, Object> body = ApiResponses.success();
        body.put("images", images);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/save-images")
    public ResponseEntity<Map<String, Object>> saveImages(@RequestBody(required = false) ExportRequest request) {
        try {
            ExportResult result = exportService.saveImages(request != null ? request : emptyExport());
            return ResponseEntity.ok(exportBody(result, "Saved " + result.saved().size() + " image(s)"));
        } catch (Exception e) {
            return ApiResponses.fromException("Save images", e);
        }
    }

    @PostMapping("/save-batch-images")
    public ResponseEntity<Map<String, Object>> saveBatchImages(@RequestBody(required = false) ExportRequest request) {
        try {
            ExportResult result = exportService.saveBatchImages(request != null ? request : emptyExport());
            return ResponseEntity.ok(exportBody(result,
                    "Saved " + result.saved().size() + " files from " + result.imageCount() + " images"));
        } catch (Exception e) {
            return ApiResponses.fromException("Save batch images", e);
        }
    }

    @PostMapping("/clear-session")
    public ResponseEntity<Map<String, Object>> clearSession() {
        registry.reset();
        Map<String, Object> body = ApiResponses.success();
        body.put("message", "Session cleared successfully");
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> exportBody(ExportResult result, String message) {
        Map<String, Object> body = ApiResponses.success();
        body.put("message", message);
        body.put("saved_count", result.saved().size());
        body.put("image_count", result.imageCount());
        body.put("directory", result.directory().toString());
        if (!result.failed().isEmpty()) {
            body.put("warning", result.failed().size() + " files failed to save");
            body.put("failed_files", result.failed());
        }
        return body;
    }

    private static ExportRequest emptyExport() {
        return new ExportRequest(null, null, null, null);
    }

    private static Map<String, Object> describe(ImageDescriptor image) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("filename", image.filename());
        entry.put("path", image.path().toString());
        entry.put("preview", image.preview());
        return entry;
    }

    private static ResponseEntity<Map<String, Object>> invalidStep(String step) {
        List<String> valid = Arrays.stream(CorrectionStage.values()).map(CorrectionStage::key).toList();
        return ApiResponses.error(HttpStatus.BAD_REQUEST, "Invalid step '" + step + "'. Must be one of: " + valid);
    }
}
