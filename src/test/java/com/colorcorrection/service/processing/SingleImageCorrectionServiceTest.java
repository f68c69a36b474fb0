package com.colorcorrection.service.processing;

import com.colorcorrection.config.JacksonConfig;
import com.colorcorrection.exception.BatchValidationException;
import com.colorcorrection.exception.ImageProcessingException;
import com.colorcorrection.exception.PipelineUnavailableException;
import com.colorcorrection.model.CorrectedImage;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.ImageDescriptor;
import com.colorcorrection.model.PipelineConfig;
import com.colorcorrection.model.SingleRunRequest;
import com.colorcorrection.model.SingleRunResult;
import com.colorcorrection.model.settings.ColorCorrectionSettings;
import com.colorcorrection.pipeline.CorrectionModel;
import com.colorcorrection.pipeline.CorrectionPipeline;
import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.pipeline.ImageCodec;
import com.colorcorrection.pipeline.ImageFrame;
import com.colorcorrection.pipeline.PipelineOutput;
import com.colorcorrection.service.export.ModelExportService;
import com.colorcorrection.session.ImageRegistrationService;
import com.colorcorrection.session.PipelineConfigFactory;
import com.colorcorrection.session.SessionRegistry;
import com.colorcorrection.session.SettingsMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SingleImageCorrectionServiceTest {

    private static final Path IMAGE_PATH = Path.of("/uploads/chart.jpg");
    private static final Path WHITE_PATH = Path.of("/uploads/white.jpg");

    @Mock
    private ImageCodec codec;

    @Mock
    private CorrectionPipelineFactory pipelineFactory;

    @Mock
    private CorrectionPipeline pipeline;

    @Mock
    private CorrectionModel model;

    @Mock
    private ModelExportService modelExportService;

    private SessionRegistry registry;
    private SingleImageCorrectionService service;

    @BeforeEach
    void setUp() throws IOException {
        SettingsMapper settingsMapper = new SettingsMapper(new JacksonConfig().objectMapper());
        registry = new SessionRegistry(settingsMapper);
        service = new SingleImageCorrectionService(
                registry, new ImageRegistrationService(registry, codec, "uploads"),
                new PipelineConfigFactory(registry, settingsMapper), pipelineFactory, codec, modelExportService);

        registry.addImage(new ImageDescriptor("chart.jpg", IMAGE_PATH, null));
        registry.setWhiteImage(new ImageDescriptor("white.jpg", WHITE_PATH, null));

        when(pipelineFactory.isAvailable()).thenReturn(true);
        when(pipelineFactory.create()).thenReturn(pipeline);
        when(pipeline.model()).thenReturn(model);
        when(model.hasTrainedModel()).thenReturn(true);
        when(codec.read(any())).thenAnswer(invocation -> frame());
        when(codec.encode(any())).thenReturn("data:image/jpeg;base64,AAAA");
        when(pipeline.run(any(), any(), anyString(), any())).thenAnswer(invocation -> {
            Map<String, ImageFrame> images = new LinkedHashMap<>();
            images.put("chart_FFC", frame());
            images.put("chart_CC", frame());
            return new PipelineOutput(Map.of("CC", Map.of("mean_delta_e", 1.8)), images, null);
        });
    }

    @Test
    @DisplayName("Should store the trained model when color correction ran")
    void shouldStoreModelWhenCcEnabled() {
        SingleRunResult result = service.run(request(true, true).build());

        assertThat(result.modelStored()).isTrue();
        assertThat(registry.modelHandle()).contains(model);
        assertThat(result.finalStage()).isEqualTo("CC");
        assertThat(result.metrics()).containsKey("CC");
        assertThat(registry.correctedImages()).extracting(CorrectedImage::name)
                .containsExactly("chart_chart_FFC", "chart_chart_CC");
    }

    @Test
    @DisplayName("Should not store a model when color correction is disabled")
    void shouldNotStoreModelWithoutCc() {
        SingleRunResult result = service.run(request(true, false).build());

        assertThat(result.modelStored()).isFalse();
        assertThat(registry.modelHandle()).isEmpty();
    }

    @Test
    @DisplayName("Should not store a model that was not trained")
    void shouldNotStoreUntrainedModel() {
        when(model.hasTrainedModel()).thenReturn(false);

        SingleRunResult result = service.run(request(false, true).build());

        assertThat(result.modelStored()).isFalse();
        assertThat(registry.modelHandle()).isEmpty();
    }

    @Test
    @DisplayName("Delta E follows the request and only applies to enabled stages")
    void shouldApplyDeltaEPreference() {
        service.run(request(false, true).build());

        ArgumentCaptor<PipelineConfig> captor = ArgumentCaptor.forClass(PipelineConfig.class);
        verify(pipeline).run(any(), isNull(), eq("chart"), captor.capture());
        PipelineConfig config = captor.getValue();
        assertThat(config.stageSettings().get(CorrectionStage.CC).isComputeDeltaE()).isTrue();
        assertThat(config.stageSettings().get(CorrectionStage.FFC).isComputeDeltaE()).isFalse();
    }

    @Test
    void shouldDisableDeltaEWhenRequested() {
        service.run(request(false, true).computeDeltaE(false).method("nn").build());

        ArgumentCaptor<PipelineConfig> captor = ArgumentCaptor.forClass(PipelineConfig.class);
        verify(pipeline).run(any(), any(), anyString(), captor.capture());
        PipelineConfig config = captor.getValue();
        assertThat(config.stageSettings().values()).noneMatch(s -> s.isComputeDeltaE());
        assertThat(config.settings(CorrectionStage.CC, ColorCorrectionSettings.class).getMtd()).isEqualTo("nn");
    }

    @Test
    @DisplayName("White reference is only loaded for flat-field correction")
    void shouldLoadWhiteImageOnlyForFfc() throws IOException {
        service.run(request(false, true).build());
        verify(codec, never()).read(WHITE_PATH);

        service.run(request(true, true).build());
        verify(codec).read(WHITE_PATH);
    }

    @Test
    @DisplayName("An unreadable white image leaves the run without a white reference")
    void shouldRunWithoutUnreadableWhiteImage() throws IOException {
        when(codec.read(WHITE_PATH)).thenThrow(new IOException("Failed to load image: " + WHITE_PATH));

        SingleRunResult result = service.run(request(true, true).build());

        verify(pipeline).run(any(), isNull(), eq("chart"), any());
        assertThat(result.finalStage()).isEqualTo("CC");
    }

    @Test
    void shouldAutoSaveModelWhenRequested() {
        Path saved = Path.of("/models/model_chart.pkl");
        when(modelExportService.autoSave(model, "chart")).thenReturn(Optional.of(saved));

        SingleRunResult result = service.run(request(false, true).saveCcModel(true).build());

        assertThat(result.savedModelPath()).isEqualTo(saved);
        verify(modelExportService).autoSave(model, "chart");
    }

    @Test
    void shouldNotAutoSaveByDefault() {
        SingleRunResult result = service.run(request(false, true).build());

        assertThat(result.savedModelPath()).isNull();
        verify(modelExportService, never()).autoSave(any(), anyString());
    }

    @Test
    void shouldWrapPipelineFailure() {
        when(pipeline.run(any(), any(), anyString(), any())).thenThrow(new IllegalArgumentException("bad chart"));

        assertThatThrownBy(() -> service.run(request(false, true).build()))
                .isInstanceOf(ImageProcessingException.class)
                .hasMessage("Pipeline error: bad chart");
    }

    @Test
    void shouldValidateRequest() {
        assertThatThrownBy(() -> service.run(SingleRunRequest.builder().build()))
                .isInstanceOf(BatchValidationException.class)
                .hasMessage("image_index is required");
        assertThatThrownBy(() -> service.run(SingleRunRequest.builder().imageIndex(3).build()))
                .isInstanceOf(BatchValidationException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> service.run(request(false, true).method("magic").build()))
                .isInstanceOf(BatchValidationException.class)
                .hasMessageStartingWith("Invalid method 'magic'");
    }

    @Test
    void shouldFailFastWhenPipelineUnavailable() {
        when(pipelineFactory.isAvailable()).thenReturn(false);

        assertThatThrownBy(() -> service.run(request(false, true).build()))
                .isInstanceOf(PipelineUnavailableException.class);
    }

    private static SingleRunRequest.SingleRunRequestBuilder request(boolean ffc, boolean cc) {
        return SingleRunRequest.builder().imageIndex(0).ffcEnabled(ffc).ccEnabled(cc);
    }

    private static ImageFrame frame() {
        return new ImageFrame(1, 1, new double[]{0.3, 0.3, 0.3});
    }
}
