package com.colorcorrection.controller;

import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.pipeline.GpuProbe;
import com.colorcorrection.service.batch.BatchState;
import com.colorcorrection.service.lifecycle.ShutdownCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LifecycleControllerTest {

    @Mock
    private CorrectionPipelineFactory pipelineFactory;

    @Mock
    private GpuProbe gpuProbe;

    @Mock
    private BatchState batchState;

    @Mock
    private ShutdownCoordinator shutdownCoordinator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(
                new LifecycleController(pipelineFactory, gpuProbe, batchState, shutdownCoordinator, "2.0.0")).build();
    }

    @Test
    void healthReportsAvailabilityAndBatchState() throws Exception {
        when(pipelineFactory.isAvailable()).thenReturn(false);
        when(gpuProbe.isGpuAvailable()).thenReturn(true);
        when(batchState.isActive()).thenReturn(true);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.cc_available").value(false))
                .andExpect(jsonPath("$.version").value("2.0.0"))
                .andExpect(jsonPath("$.batch_active").value(true))
                .andExpect(jsonPath("$.features.gpu_support").value(true));
    }

    @Test
    void shutdownReturnsImmediately() throws Exception {
        when(shutdownCoordinator.requestShutdown()).thenReturn(true, false);

        mockMvc.perform(post("/api/shutdown"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Backend shutdown initiated"));
        mockMvc.perform(post("/api/shutdown"))
                .andExpect(jsonPath("$.message").value("Shutdown already in progress"));
    }
}
