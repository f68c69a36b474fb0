package com.colorcorrection.session;

import com.colorcorrection.model.CorrectedImage;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.ImageDescriptor;
import com.colorcorrection.model.ItemResult;
import com.colorcorrection.model.settings.StageSettings;
import com.colorcorrection.pipeline.CorrectionModel;
import com.colorcorrection.service.lifecycle.ReleasableResource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session-wide data shared by request handlers and batch workers: the
 * registered images, stage settings, the trained model and the results.
 *
 * Every accessor takes the same lock and hands out copies, so callers never
 * see a list while another thread is appending to it.
 */
@Component
@Slf4j
public class SessionRegistry implements ReleasableResource {

    private final ReentrantLock lock = new ReentrantLock();
    private final SettingsMapper settingsMapper;

    private final List<ImageDescriptor> images = new ArrayList<>();
    private final Map<CorrectionStage, StageSettings> settings = new EnumMap<>(CorrectionStage.class);
    private final List<CorrectedImage> correctedImages = new ArrayList<>();
    private final List<ItemResult> processedImages = new ArrayList<>();
    private ImageDescriptor whiteImage;
    private CorrectionModel modelHandle;
    private boolean batchMode;

    public SessionRegistry(SettingsMapper settingsMapper) {
        this.settingsMapper = settingsMapper;
        for (CorrectionStage stage : CorrectionStage.values()) {
            settings.put(stage, SettingsMapper.defaultsFor(stage));
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Images
    // ═══════════════════════════════════════════════════════════════

    /**
     * @return index of the new image
     */
    public int addImage(ImageDescriptor image) {
        lock.lock();
        try {
            images.add(image);
            return images.size() - 1;
        } finally {
            lock.unlock();
        }
    }

    public List<ImageDescriptor> images() {
        lock.lock();
        try {
            return List.copyOf(images);
        } finally {
            lock.unlock();
        }
    }

    public int imageCount() {
        lock.lock();
        try {
            return images.size();
        } finally {
            lock.unlock();
        }
    }

    public Optional<ImageDescriptor> image(int index) {
        lock.lock();
        try {
            return index >= 0 && index < images.size() ? Optional.of(images.get(index)) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public void setWhiteImage(ImageDescriptor image) {
        lock.lock();
        try {
            whiteImage = image;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ImageDescriptor> whiteImage() {
        lock.lock();
        try {
            return Optional.ofNullable(whiteImage);
        } finally {
            lock.unlock();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Settings
    // ═══════════════════════════════════════════════════════════════

    /**
     * @return a copy; changing it does not affect the session
     */
    public StageSettings settings(CorrectionStage stage) {
        lock.lock();
        try {
            return settingsMapper.copy(settings.get(stage));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Merges the given keys into the stored settings of {@code stage}. Keys not
     * present in {@code updates} keep their value.
     *
     * @return the settings after the merge
     */
    public StageSettings updateSettings(CorrectionStage stage, Map<String, Object> updates) {
        lock.lock();
        try {
            StageSettings merged = settingsMapper.merge(settings.get(stage), updates);
            settings.put(stage, merged);
            log.info("Updated {} settings: {}", stage.label(), updates.keySet());
            return settingsMapper.copy(merged);
        } finally {
            lock.unlock();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Model and results
    // ═══════════════════════════════════════════════════════════════

    public Optional<CorrectionModel> modelHandle() {
        lock.lock();
        try {
            return Optional.ofNullable(modelHandle);
        } finally {
            lock.unlock();
        }
    }

    public void setModelHandle(CorrectionModel model) {
        lock.lock();
        try {
            modelHandle = model;
        } finally {
            lock.unlock();
        }
    }

    public void setCorrectedImages(List<CorrectedImage> images) {
        lock.lock();
        try {
            correctedImages.clear();
            correctedImages.addAll(images);
        } finally {
            lock.unlock();
        }
    }

    public List<CorrectedImage> correctedImages() {
        lock.lock();
        try {
            return List.copyOf(correctedImages);
        } finally {
            lock.unlock();
        }
    }

    public void addProcessedImage(ItemResult result) {
        lock.lock();
        try {
            processedImages.add(result);
        } finally {
            lock.unlock();
        }
    }

    public List<ItemResult> processedImages() {
        lock.lock();
        try {
            return List.copyOf(processedImages);
        } finally {
            lock.unlock();
        }
    }

    public void setBatchMode(boolean batchMode) {
        lock.lock();
        try {
            this.batchMode = batchMode;
        } finally {
            lock.unlock();
        }
    }

    public boolean isBatchMode() {
        lock.lock();
        try {
            return batchMode;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops images, results and the model. Stage settings are kept.
     */
    public void reset() {
        lock.lock();
        try {
            images.clear();
            whiteImage = null;
            modelHandle = null;
            correctedImages.clear();
            processedImages.clear();
            batchMode = false;
        } finally {
            lock.unlock();
        }
        log.info("Session cleared");
    }

    @Override
    public String resourceName() {
        return "session-registry";
    }

    @Override
    public void release() {
        reset();
    }
}
