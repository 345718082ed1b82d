package dev.pagegraph.controller;

import dev.pagegraph.config.SecurityConfig;
import dev.pagegraph.config.WebProperties;
import dev.pagegraph.dto.request.IngestRequest;
import dev.pagegraph.service.IngestResult;
import dev.pagegraph.service.IngestionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web-layer slice for the event receiver. Only routing, status codes, body binding and
 * CORS are under test; the gateway is mocked.
 */
@WebMvcTest(IngestController.class)
@Import(SecurityConfig.class)
@EnableConfigurationProperties(WebProperties.class)
class IngestControllerTest {

    private static final String FINGERPRINT = "c".repeat(64);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private IngestionService ingestionService;

    @Test
    @DisplayName("GET / reports the service as up")
    void health() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("url-ingestion"));
    }

    @Nested
    @DisplayName("POST /ingest")
    class Ingest {

        @Test
        @DisplayName("answers 202 Queued with the fingerprint and visit id")
        void queued() throws Exception {
            UUID visitId = UUID.randomUUID();
            when(ingestionService.ingest(any())).thenReturn(IngestResult.queued(FINGERPRINT, visitId));

            mockMvc.perform(post("/ingest")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"url\":\"https://example.com/a\",\"source\":\"full-load\"}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.accepted").value(true))
                    .andExpect(jsonPath("$.status").value("Queued"))
                    .andExpect(jsonPath("$.fingerprint").value(FINGERPRINT))
                    .andExpect(jsonPath("$.visitId").value(visitId.toString()))
                    .andExpect(jsonPath("$.reason").doesNotExist());
        }

        @Test
        @DisplayName("answers 202 Throttled when the queue is full")
        void throttled() throws Exception {
            when(ingestionService.ingest(any())).thenReturn(IngestResult.throttled(FINGERPRINT, UUID.randomUUID()));

            mockMvc.perform(post("/ingest")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"url\":\"https://example.com/a\"}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.status").value("Throttled"))
                    .andExpect(jsonPath("$.reason").exists());
        }

        @Test
        @DisplayName("answers 400 Rejected for an invalid event")
        void rejected() throws Exception {
            when(ingestionService.ingest(any())).thenReturn(IngestResult.rejected("url has no host"));

            mockMvc.perform(post("/ingest")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"url\":\"https:///\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.accepted").value(false))
                    .andExpect(jsonPath("$.status").value("Rejected"))
                    .andExpect(jsonPath("$.reason").value("url has no host"));
        }

        @Test
        @DisplayName("accepts the capture extension's field names")
        void legacyFieldNames() throws Exception {
            when(ingestionService.ingest(any())).thenReturn(IngestResult.queued(FINGERPRINT, UUID.randomUUID()));

            mockMvc.perform(post("/ingest")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"url":"https://example.com/a","tab_id":42,
                                     "timestamp":"2026-03-02T08:59:00Z","source":"extension","title":"ignored"}"""))
                    .andExpect(status().isAccepted());

            ArgumentCaptor<IngestRequest> request = ArgumentCaptor.forClass(IngestRequest.class);
            verify(ingestionService).ingest(request.capture());
            assertThat(request.getValue().tabRef()).isEqualTo("42");
            assertThat(request.getValue().observedAt()).isEqualTo(Instant.parse("2026-03-02T08:59:00Z"));
            assertThat(request.getValue().source()).isEqualTo("extension");
        }

        @Test
        @DisplayName("answers 400 for a body that is not JSON")
        void malformedBody() throws Exception {
            mockMvc.perform(post("/ingest")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("url=https://example.com"))
                    .andExpect(status().isBadRequest());

            verify(ingestionService, never()).ingest(any());
        }

        @Test
        @DisplayName("allows cross-origin posts from the capture client")
        void corsPreflight() throws Exception {
            mockMvc.perform(options("/ingest")
                            .header("Origin", "https://some-page.example")
                            .header("Access-Control-Request-Method", "POST"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("Access-Control-Allow-Origin", "https://some-page.example"));
        }
    }
}
