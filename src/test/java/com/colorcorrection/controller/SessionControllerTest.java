package com.colorcorrection.controller;

import com.colorcorrection.config.JacksonConfig;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.ImageDescriptor;
import com.colorcorrection.model.settings.ColorCorrectionSettings;
import com.colorcorrection.service.export.ResultExportService;
import com.colorcorrection.session.ImageRegistrationService;
import com.colorcorrection.session.SessionRegistry;
import com.colorcorrection.session.SettingsMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SessionControllerTest {

    @Mock
    private ImageRegistrationService imageRegistration;

    @Mock
    private ResultExportService exportService;

    private SessionRegistry registry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SettingsMapper settingsMapper = new SettingsMapper(new JacksonConfig().objectMapper());
        registry = new SessionRegistry(settingsMapper);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new SessionController(registry, settingsMapper, imageRegistration, exportService)).build();
    }

    @Test
    void updatesOnlyTheGivenSettingKeys() throws Exception {
        mockMvc.perform(post("/api/settings/cc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"settings\":{\"mtd\":\"nn\",\"n_samples\":25}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.settings.mtd").value("nn"))
                .andExpect(jsonPath("$.settings.n_samples").value(25))
                .andExpect(jsonPath("$.settings.degree").value(2));

        ColorCorrectionSettings cc = (ColorCorrectionSettings) registry.settings(CorrectionStage.CC);
        assertThat(cc.getMtd()).isEqualTo("nn");
        assertThat(cc.getSampleCount()).isEqualTo(25);
    }

    @Test
    void rejectsBadSettingsRequests() throws Exception {
        mockMvc.perform(get("/api/settings/xyz"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid step 'xyz'. Must be one of: [ffc, gc, wb, cc]"));
        mockMvc.perform(post("/api/settings/gc").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing settings in request body"));
        mockMvc.perform(post("/api/settings/ffc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"settings\":{\"bins\":\"many\"}}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void uploadsImages() throws Exception {
        ImageDescriptor stored = new ImageDescriptor("20260101_120000_a.jpg", Path.of("/uploads/20260101_120000_a.jpg"), "data:x");
        when(imageRegistration.registerImage(eq("a.jpg"), any())).thenReturn(stored);
        when(imageRegistration.registerImage(eq("bad.jpg"), any())).thenThrow(new IOException("Failed to load image"));

        mockMvc.perform(multipart("/api/images")
                        .file(new MockMultipartFile("images", "a.jpg", "image/jpeg", new byte[]{1}))
                        .file(new MockMultipartFile("images", "bad.jpg", "image/jpeg", new byte[]{2})))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Uploaded 1 image(s)"))
                .andExpect(jsonPath("$.images[0].filename").value("20260101_120000_a.jpg"));
    }

    @Test
    void clearSessionKeepsSettings() throws Exception {
        registry.addImage(new ImageDescriptor("a.jpg", Path.of("a.jpg"), null));
        registry.updateSettings(CorrectionStage.GC, Map.of("max_degree", 7));

        mockMvc.perform(post("/api/clear-session"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        assertThat(registry.imageCount()).isZero();
        mockMvc.perform(get("/api/settings/gc"))
                .andExpect(jsonPath("$.settings.max_degree").value(7));
    }
}
