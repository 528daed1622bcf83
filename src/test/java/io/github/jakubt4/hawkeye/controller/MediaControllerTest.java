package io.github.jakubt4.hawkeye.controller;

import io.github.jakubt4.hawkeye.dto.Detection;
import io.github.jakubt4.hawkeye.service.media.MediaRelayService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MediaController.class)
class MediaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MediaRelayService mediaRelayService;

    @Test
    void frameIsRelayed() throws Exception {
        when(mediaRelayService.publishFrame("AAEC", "jpeg", 640, 480)).thenReturn(true);

        mockMvc.perform(post("/api/media/frames")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"frame": "AAEC", "format": "jpeg", "width": 640, "height": 480}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.channel").value("video"));
    }

    @Test
    void frameWithoutDimensionsIsRejected() throws Exception {
        mockMvc.perform(post("/api/media/frames")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frame\": \"AAEC\", \"format\": \"jpeg\"}"))
                .andExpect(status().isBadRequest());

        verify(mediaRelayService, never()).publishFrame(anyString(), anyString(), anyInt(), anyInt());
    }

    @Test
    void detectionsAreRelayed() throws Exception {
        final var person = new Detection("person", 0.9, List.of(1.0, 2.0, 3.0, 4.0));
        when(mediaRelayService.publishDetections(List.of(person))).thenReturn(false);

        mockMvc.perform(post("/api/media/detections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"detections": [{"label": "person", "confidence": 0.9, "bbox": [1, 2, 3, 4]}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(false))
                .andExpect(jsonPath("$.channel").value("detections"));
    }
}
