package com.colorcorrection.service.processing;

import com.colorcorrection.config.AppMetrics;
import com.colorcorrection.config.JacksonConfig;
import com.colorcorrection.model.CorrectedImage;
import com.colorcorrection.model.CorrectionMethod;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.ItemResult;
import com.colorcorrection.model.PipelineConfig;
import com.colorcorrection.model.WorkItem;
import com.colorcorrection.model.settings.StageSettings;
import com.colorcorrection.pipeline.CorrectionModel;
import com.colorcorrection.pipeline.CorrectionPipeline;
import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.pipeline.ImageCodec;
import com.colorcorrection.pipeline.ImageFrame;
import com.colorcorrection.pipeline.PipelineOutput;
import com.colorcorrection.session.SettingsMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ItemExecutor.
 *
 * Tests verify:
 * - Every failure mode becomes a failed ItemResult with a readable message
 * - A timed-out item returns at its deadline with a distinct reason
 * - Batch items run with diagnostics off, on a copy of the config
 * - Image buffers are released on every path
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ItemExecutorTest {

    @Mock
    private ImageCodec codec;

    @Mock
    private CorrectionPipelineFactory pipelineFactory;

    @Mock
    private CorrectionPipeline pipeline;

    private ExecutorService attemptExecutor;
    private AppMetrics metrics;
    private ItemExecutor itemExecutor;

    @BeforeEach
    void setUp() throws IOException {
        attemptExecutor = Executors.newCachedThreadPool();
        metrics = new AppMetrics(new SimpleMeterRegistry());
        SettingsMapper settingsMapper = new SettingsMapper(new JacksonConfig().objectMapper());
        itemExecutor = new ItemExecutor(codec, pipelineFactory, settingsMapper, metrics, attemptExecutor);

        when(pipelineFactory.create()).thenReturn(pipeline);
        when(codec.encode(any())).thenReturn("data:image/jpeg;base64,AAAA");
    }

    @AfterEach
    void tearDown() {
        attemptExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Should encode every stage output and report the last stage as final")
    void shouldProcessItemSuccessfully() throws IOException {
        // Given
        ImageFrame source = frame();
        ImageFrame ffc = frame();
        ImageFrame cc = frame();
        when(codec.read(Path.of("/data/sample.jpg"))).thenReturn(source);
        Map<String, ImageFrame> images = new LinkedHashMap<>();
        images.put("FFC", ffc);
        images.put("CC", cc);
        when(pipeline.run(any(), any(), anyString(), any())).thenReturn(new PipelineOutput(Map.of(), images, null));

        // When
        ItemResult result = itemExecutor.execute(item(0), Duration.ofSeconds(5));

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.index()).isZero();
        assertThat(result.correctedImages()).extracting(CorrectedImage::name)
                .containsExactly("sample_FFC", "sample_CC");
        assertThat(result.finalStage()).isEqualTo("CC");
        assertThat(source.isReleased()).isTrue();
        assertThat(ffc.isReleased()).isTrue();
        assertThat(cc.isReleased()).isTrue();
        assertThat(metrics.getItemProcessingTimer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail with the load error and never start a pipeline")
    void shouldFailWhenImageCannotBeLoaded() throws IOException {
        // Given
        when(codec.read(any())).thenThrow(new IOException("Failed to load image: /data/sample.jpg"));

        // When
        ItemResult result = itemExecutor.execute(item(3), Duration.ofSeconds(5));

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.index()).isEqualTo(3);
        assertThat(result.error()).isEqualTo("Failed to load image: /data/sample.jpg");
        verify(pipelineFactory, never()).create();
    }

    @Test
    @DisplayName("Should wrap pipeline exceptions and still release the source frame")
    void shouldReportPipelineError() throws IOException {
        // Given
        ImageFrame source = frame();
        when(codec.read(any())).thenReturn(source);
        when(pipeline.run(any(), any(), anyString(), any())).thenThrow(new IllegalStateException("singular matrix"));

        // When
        ItemResult result = itemExecutor.execute(item(1), Duration.ofSeconds(5));

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Pipeline error: singular matrix");
        assertThat(source.isReleased()).isTrue();
    }

    @Test
    @DisplayName("Should give up at the deadline with a timeout reason")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void shouldTimeOutSlowItem() throws IOException {
        // Given: a pipeline that ignores interrupts
        CountDownLatch release = new CountDownLatch(1);
        when(codec.read(any())).thenReturn(frame());
        when(pipeline.run(any(), any(), anyString(), any())).thenAnswer(invocation -> {
            while (release.getCount() > 0) {
                try {
                    release.await();
                } catch (InterruptedException ignored) {
                    // keep running, like native compute would
                }
            }
            return new PipelineOutput(Map.of(), Map.of(), null);
        });

        // When
        long start = System.nanoTime();
        ItemResult result = itemExecutor.execute(item(2), Duration.ofMillis(200));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        release.countDown();

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Processing timeout after 200ms");
        assertThat(elapsedMillis).isLessThan(2000);
        assertThat(metrics.getItemTimeoutsCounter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Timeout reason should use whole seconds when possible")
    void timeoutReasonFormatting() {
        assertThat(ItemExecutor.timeoutReason(Duration.ofSeconds(300))).isEqualTo("Processing timeout after 300s");
        assertThat(ItemExecutor.timeoutReason(Duration.ofMillis(1500))).isEqualTo("Processing timeout after 1500ms");
    }

    @Test
    @DisplayName("Should run with diagnostics off on a copy of the item config")
    void shouldSuppressDiagnosticsOnCopy() throws IOException {
        // Given
        when(codec.read(any())).thenReturn(frame());
        when(pipeline.run(any(), any(), anyString(), any())).thenReturn(new PipelineOutput(Map.of(), Map.of(), null));
        WorkItem item = item(0);
        item.config().stageSettings().values().forEach(settings -> settings.setShow(true));

        // When
        itemExecutor.execute(item, Duration.ofSeconds(5));

        // Then
        ArgumentCaptor<PipelineConfig> captor = ArgumentCaptor.forClass(PipelineConfig.class);
        verify(pipeline).run(any(), any(), eq("sample"), captor.capture());
        PipelineConfig used = captor.getValue();
        assertThat(used.stageSettings().values()).allSatisfy(settings -> {
            assertThat(settings.isShow()).isFalse();
            assertThat(settings.isComputeDeltaE()).isFalse();
        });
        assertThat(used.enabledStages()).isEqualTo(item.config().enabledStages());
        assertThat(item.config().stageSettings().values()).allSatisfy(settings -> {
            assertThat(settings.isShow()).isTrue();
            assertThat(settings.isComputeDeltaE()).isTrue();
        });
    }

    @Test
    @DisplayName("Should skip an output that fails to encode")
    void shouldSkipOutputThatFailsToEncode() throws IOException {
        // Given
        ImageFrame gc = frame();
        ImageFrame wb = frame();
        when(codec.read(any())).thenReturn(frame());
        Map<String, ImageFrame> images = new LinkedHashMap<>();
        images.put("sample_GC", gc);
        images.put("sample_WB", wb);
        when(pipeline.run(any(), any(), anyString(), any())).thenReturn(new PipelineOutput(Map.of(), images, "low contrast"));
        when(codec.encode(gc)).thenThrow(new IOException("encoder failure"));

        // When
        ItemResult result = itemExecutor.execute(item(0), Duration.ofSeconds(5));

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.correctedImages()).extracting(CorrectedImage::name).containsExactly("sample_sample_WB");
        assertThat(result.finalStage()).isEqualTo("WB");
    }

    @Test
    @DisplayName("Should hold the model lock only around the prediction")
    void shouldHoldModelLockOnlyForPrediction() throws IOException {
        // Given
        ReentrantLock modelLock = new ReentrantLock();
        CorrectionModel model = mock(CorrectionModel.class);
        when(codec.read(any())).thenAnswer(invocation -> {
            assertThat(modelLock.isLocked()).isFalse();
            return frame();
        });
        when(model.predictImage(any())).thenAnswer(invocation -> {
            assertThat(modelLock.isHeldByCurrentThread()).isTrue();
            Map<String, ImageFrame> out = new LinkedHashMap<>();
            out.put("CC", frame());
            out.put("FFC", frame());
            return out;
        });
        when(codec.encode(any())).thenAnswer(invocation -> {
            assertThat(modelLock.isLocked()).isFalse();
            return "data:image/jpeg;base64,AAAA";
        });

        // When
        ItemResult result = itemExecutor.executeInference(item(4), model, modelLock, Duration.ofSeconds(5));

        // Then: stage outputs in pipeline order
        assertThat(result.success()).isTrue();
        assertThat(result.correctedImages()).extracting(CorrectedImage::name)
                .containsExactly("sample_FFC", "sample_CC");
        assertThat(modelLock.isLocked()).isFalse();
    }

    @Test
    @DisplayName("Should fail inference when the model returns nothing")
    void shouldFailInferenceWithoutImages() throws IOException {
        CorrectionModel model = mock(CorrectionModel.class);
        when(codec.read(any())).thenReturn(frame());
        when(model.predictImage(any())).thenReturn(Map.of());

        ItemResult result = itemExecutor.executeInference(item(0), model, new ReentrantLock(), Duration.ofSeconds(5));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("No corrected images produced by model");
    }

    private static WorkItem item(int index) {
        Map<CorrectionStage, StageSettings> settings = new EnumMap<>(CorrectionStage.class);
        for (CorrectionStage stage : CorrectionStage.values()) {
            settings.put(stage, SettingsMapper.defaultsFor(stage));
        }
        PipelineConfig config = new PipelineConfig(
                EnumSet.of(CorrectionStage.FFC, CorrectionStage.CC), CorrectionMethod.PLS, settings);
        return new WorkItem(index, Path.of("/data/sample.jpg"), "sample.jpg", config, null);
    }

    private static ImageFrame frame() {
        return new ImageFrame(1, 1, new double[]{0.1, 0.2, 0.3});
    }
}
