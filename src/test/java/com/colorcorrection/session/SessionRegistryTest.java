package com.colorcorrection.session;

import com.colorcorrection.config.JacksonConfig;
import com.colorcorrection.model.CorrectedImage;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.ImageDescriptor;
import com.colorcorrection.model.ItemResult;
import com.colorcorrection.model.settings.ColorCorrectionSettings;
import com.colorcorrection.model.settings.GammaSettings;
import com.colorcorrection.pipeline.CorrectionModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class SessionRegistryTest {

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(new SettingsMapper(new JacksonConfig().objectMapper()));
    }

    @Test
    void addImageReturnsSequentialIndices() {
        assertThat(registry.addImage(image("a.jpg"))).isZero();
        assertThat(registry.addImage(image("b.jpg"))).isEqualTo(1);

        assertThat(registry.imageCount()).isEqualTo(2);
        assertThat(registry.image(1)).map(ImageDescriptor::filename).contains("b.jpg");
        assertThat(registry.image(2)).isEmpty();
        assertThat(registry.image(-1)).isEmpty();
    }

    @Test
    @DisplayName("A partial cc update keeps every other cc key")
    void partialSettingsUpdate() {
        registry.updateSettings(CorrectionStage.CC, Map.of("mtd", "nn", "nlayers", 50));

        ColorCorrectionSettings cc = (ColorCorrectionSettings) registry.settings(CorrectionStage.CC);
        assertThat(cc.getMtd()).isEqualTo("nn");
        assertThat(cc.getNlayers()).isEqualTo(50);
        assertThat(cc.getDegree()).isEqualTo(2);
        assertThat(cc.getHiddenLayers()).containsExactly(64, 32, 16);
    }

    @Test
    @DisplayName("Settings handed out are copies")
    void settingsAreCopies() {
        GammaSettings gc = (GammaSettings) registry.settings(CorrectionStage.GC);
        gc.setMaxDegree(9);

        assertThat(((GammaSettings) registry.settings(CorrectionStage.GC)).getMaxDegree()).isEqualTo(5);
    }

    @Test
    @DisplayName("Reset drops images, results and model but keeps settings")
    void resetKeepsSettings() {
        registry.addImage(image("a.jpg"));
        registry.setWhiteImage(image("white.jpg"));
        registry.setModelHandle(mock(CorrectionModel.class));
        registry.setCorrectedImages(List.of(new CorrectedImage("a_CC", "data:")));
        registry.addProcessedImage(new ItemResult(true, 0, "a.jpg", Path.of("a.jpg"), List.of(), "CC", null));
        registry.setBatchMode(true);
        registry.updateSettings(CorrectionStage.CC, Map.of("degree", 4));

        registry.release();

        assertThat(registry.imageCount()).isZero();
        assertThat(registry.whiteImage()).isEmpty();
        assertThat(registry.modelHandle()).isEmpty();
        assertThat(registry.correctedImages()).isEmpty();
        assertThat(registry.processedImages()).isEmpty();
        assertThat(registry.isBatchMode()).isFalse();
        assertThat(((ColorCorrectionSettings) registry.settings(CorrectionStage.CC)).getDegree()).isEqualTo(4);
    }

    @Test
    void snapshotsAreDetached() {
        registry.addImage(image("a.jpg"));
        List<ImageDescriptor> before = registry.images();

        registry.addImage(image("b.jpg"));

        assertThat(before).hasSize(1);
        assertThat(registry.images()).hasSize(2);
    }

    private static ImageDescriptor image(String name) {
        return new ImageDescriptor(name, Path.of("/uploads", name), null);
    }
}
